package com.musicfox.plugin.core.manager;

import com.musicfox.plugin.api.context.PluginContext;
import com.musicfox.plugin.api.plugin.Plugin;
import com.musicfox.plugin.api.plugin.PluginInfo;
import com.musicfox.plugin.api.plugin.PluginMetrics;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用插件：记录回调次数，可注入失败与延迟
 */
class FakePlugin implements Plugin {

    private final PluginInfo info;
    private final List<String> dependencies;

    final AtomicInteger initializeCalls = new AtomicInteger();
    final AtomicInteger startCalls = new AtomicInteger();
    final AtomicInteger stopCalls = new AtomicInteger();
    final AtomicInteger cleanupCalls = new AtomicInteger();

    // 剩余需要失败的启动次数，-1 表示一直失败
    final AtomicInteger startFailures = new AtomicInteger();
    volatile boolean stopFails;
    volatile long startDelayMillis;
    volatile long stopDelayMillis;
    volatile long healthDelayMillis;

    volatile PluginContext context;

    FakePlugin(String id, String... dependencies) {
        this(PluginInfo.builder().id(id).name(id).version("1.0.0").author("musicfox").build(), dependencies);
    }

    FakePlugin(PluginInfo info, String... dependencies) {
        this.info = info;
        this.dependencies = List.of(dependencies);
    }

    @Override
    public PluginInfo getInfo() {
        return info;
    }

    @Override
    public List<String> getCapabilities() {
        return List.of("lyrics");
    }

    @Override
    public List<String> getDependencies() {
        return dependencies;
    }

    @Override
    public void initialize(PluginContext context) {
        initializeCalls.incrementAndGet();
        this.context = context;
    }

    @Override
    public void start() throws Exception {
        startCalls.incrementAndGet();
        if (startDelayMillis > 0) {
            Thread.sleep(startDelayMillis);
        }
        int remaining = startFailures.get();
        if (remaining > 0) {
            startFailures.decrementAndGet();
        }
        if (remaining != 0) {
            throw new IllegalStateException("audio device busy");
        }
    }

    @Override
    public void stop() throws Exception {
        stopCalls.incrementAndGet();
        if (stopDelayMillis > 0) {
            Thread.sleep(stopDelayMillis);
        }
        if (stopFails) {
            throw new IllegalStateException("stream still open");
        }
    }

    @Override
    public void cleanup() {
        cleanupCalls.incrementAndGet();
    }

    @Override
    public void healthCheck() throws Exception {
        if (healthDelayMillis > 0) {
            Thread.sleep(healthDelayMillis);
        }
    }

    @Override
    public PluginMetrics getMetrics() {
        return PluginMetrics.builder().pluginId(info.getId()).requestCount(10).errorCount(1).build();
    }
}
