package com.musicfox.plugin.core.monitor;

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
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 健康检查器
 * <p>
 * 周期性调用运行中插件的 {@code healthCheck()}；非运行态插件只记录状态，不调用插件。
 */
@Slf4j
public class HealthChecker {

    private final Map<String, ManagedPlugin> plugins = new ConcurrentHashMap<>();
    private final Map<String, HealthStatus> statuses = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler;
    private final PluginCallExecutor callExecutor;
    private final Duration interval;
    private final Duration callTimeout;

    private ScheduledFuture<?> task;

    public HealthChecker(@NonNull ScheduledExecutorService scheduler,
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
        statuses.put(plugin.getId(), HealthStatus.unknown(plugin.getId(), plugin.getState()));
    }

    public void removePlugin(String pluginId) {
        plugins.remove(pluginId);
        statuses.remove(pluginId);
    }

    public boolean isMonitoring(String pluginId) {
        return plugins.containsKey(pluginId);
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long periodMs = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::checkAllSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Health checker started, interval={}ms", periodMs);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Health checker stopped");
        }
    }

    private void checkAllSafely() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Health check round failed: {}", e.getMessage(), e);
        }
    }

    public Map<String, HealthStatus> checkAll() {
        for (ManagedPlugin plugin : plugins.values()) {
            check(plugin);
        }
        return getStatus();
    }

    public Optional<HealthStatus> checkNow(String pluginId) {
        ManagedPlugin plugin = plugins.get(pluginId);
        return plugin == null ? Optional.empty() : Optional.of(check(plugin));
    }

    private HealthStatus check(ManagedPlugin plugin) {
        PluginState state = plugin.getState();
        HealthStatus status;
        if (state != PluginState.RUNNING) {
            status = new HealthStatus(plugin.getId(), state != PluginState.ERROR && state != PluginState.CORRUPTED,
                    state, "plugin is " + state, Instant.now());
        } else {
            try {
                callExecutor.run(plugin.getId(), "health check", callTimeout, () -> plugin.getPlugin().healthCheck());
                status = new HealthStatus(plugin.getId(), true, state, "OK", Instant.now());
            } catch (Exception e) {
                log.warn("[{}] Health check failed: {}", plugin.getId(), e.getMessage());
                status = new HealthStatus(plugin.getId(), false, state, e.getMessage(), Instant.now());
            }
        }
        // 检查期间插件可能已被移除
        if (plugins.containsKey(plugin.getId())) {
            statuses.put(plugin.getId(), status);
        }
        return status;
    }

    public Map<String, HealthStatus> getStatus() {
        return Collections.unmodifiableMap(new HashMap<>(statuses));
    }
}
