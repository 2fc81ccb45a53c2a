package com.musicfox.plugin.core.monitor;

import java.time.Instant;

/**
 * 进程级汇总指标
 */
public record AggregateMetrics(
        int pluginCount,
        int runningCount,
        long totalMemoryUsage,
        double totalCpuUsage,
        long totalRequests,
        long totalErrors,
        Instant timestamp) {

    public static AggregateMetrics empty() {
        return new AggregateMetrics(0, 0, 0, 0.0, 0, 0, Instant.EPOCH);
    }
}
