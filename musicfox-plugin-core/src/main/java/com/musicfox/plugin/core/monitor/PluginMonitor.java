package com.musicfox.plugin.core.monitor;

import com.musicfox.plugin.api.plugin.PluginMetrics;
import com.musicfox.plugin.api.plugin.PluginState;
import com.musicfox.plugin.core.manager.ManagedPlugin;
import com.musicfox.plugin.core.manager.PluginCallExecutor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 插件指标监控
 * <p>
 * 按配置周期收集各插件上报的指标并汇总。插件未提供或收集失败时记为零值快照，不视为错误。
 */
@Slf4j
public class PluginMonitor {

    private final Map<String, ManagedPlugin> plugins = new ConcurrentHashMap<>();
    private final Map<String, PluginMetrics> latest = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler;
    private final PluginCallExecutor callExecutor;
    private final Duration interval;
    private final Duration callTimeout;

    private volatile AggregateMetrics aggregate = AggregateMetrics.empty();
    private ScheduledFuture<?> task;

    public PluginMonitor(@NonNull ScheduledExecutorService scheduler,
                         @NonNull PluginCallExecutor callExecutor,
                         @NonNull Duration interval,
                         @NonNull Duration callTimeout) {
        this.scheduler = scheduler;
        this.callExecutor = callExecutor;
        this.interval = interval;
        this.callTimeout = callTimeout;
    }

    public void addPlugin(@NonNull ManagedPlugin plugin) {
        plugins.put(plugin.getId(), plugin);
        latest.put(plugin.getId(), PluginMetrics.empty(plugin.getId()));
    }

    public void removePlugin(String pluginId) {
        plugins.remove(pluginId);
        latest.remove(pluginId);
    }

    public boolean isMonitoring(String pluginId) {
        return plugins.containsKey(pluginId);
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long periodMs = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::collectSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Plugin monitor started, interval={}ms", periodMs);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Plugin monitor stopped");
        }
    }

    private void collectSafely() {
        try {
            collectNow();
        } catch (Exception e) {
            log.error("Metrics collection failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 立即收集一轮并刷新汇总
     */
    public AggregateMetrics collectNow() {
        int running = 0;
        long memory = 0;
        double cpu = 0.0;
        long requests = 0;
        long errors = 0;

        for (ManagedPlugin plugin : plugins.values()) {
            PluginMetrics metrics = collect(plugin);
            if (plugins.containsKey(plugin.getId())) {
                latest.put(plugin.getId(), metrics);
            }
            if (plugin.getState() == PluginState.RUNNING) {
                running++;
            }
            memory += metrics.getMemoryUsage();
            cpu += metrics.getCpuUsage();
            requests += metrics.getRequestCount();
            errors += metrics.getErrorCount();
        }

        AggregateMetrics snapshot = new AggregateMetrics(plugins.size(), running, memory, cpu, requests, errors,
                Instant.now());
        this.aggregate = snapshot;
        log.debug("Metrics collected: {}", snapshot);
        return snapshot;
    }

    private PluginMetrics collect(ManagedPlugin plugin) {
        PluginMetrics reported = null;
        if (plugin.getState() == PluginState.RUNNING) {
            try {
                reported = callExecutor.call(plugin.getId(), "metrics", callTimeout, () -> plugin.getPlugin().getMetrics());
            } catch (Exception e) {
                log.debug("[{}] Metrics unavailable: {}", plugin.getId(), e.getMessage());
            }
        }
        PluginMetrics base = reported != null ? reported : PluginMetrics.empty(plugin.getId());
        return base.toBuilder()
                .pluginId(plugin.getId())
                .uptime(plugin.getRuntime())
                .timestamp(Instant.now())
                .build();
    }

    /**
     * 插件最近一次指标，未监控的插件返回零值快照
     */
    public PluginMetrics getMetrics(String pluginId) {
        PluginMetrics metrics = latest.get(pluginId);
        return metrics != null ? metrics : PluginMetrics.empty(pluginId);
    }

    public Map<String, PluginMetrics> getAllMetrics() {
        return Collections.unmodifiableMap(new HashMap<>(latest));
    }

    public AggregateMetrics getAggregate() {
        return aggregate;
    }
}
