package com.musicfox.plugin.core.monitor;

import com.musicfox.plugin.api.plugin.PluginState;

import java.time.Instant;

/**
 * 单个插件的健康检查结果
 */
public record HealthStatus(String pluginId, boolean healthy, PluginState state, String message, Instant timestamp) {

    public static HealthStatus unknown(String pluginId, PluginState state) {
        return new HealthStatus(pluginId, false, state, "not checked yet", Instant.now());
    }
}
