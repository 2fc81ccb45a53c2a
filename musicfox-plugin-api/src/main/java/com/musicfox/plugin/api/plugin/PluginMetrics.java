package com.musicfox.plugin.api.plugin;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 插件上报的运行指标快照
 */
@Value
@Builder(toBuilder = true)
public class PluginMetrics {

    String pluginId;

    @Builder.Default
    Duration uptime = Duration.ZERO;

    /**
     * 内存占用（字节）
     */
    long memoryUsage;

    double cpuUsage;

    long requestCount;

    long errorCount;

    double successRate;

    @Singular
    Map<String, Object> customMetrics;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * 插件未提供指标时使用的零值快照
     */
    public static PluginMetrics empty(String pluginId) {
        return PluginMetrics.builder().pluginId(pluginId).build();
    }
}
