package com.musicfox.plugin.core.resource;

import java.time.Instant;

/**
 * 资源使用快照
 *
 * @param memoryUsageMb   内存占用 (MB)
 * @param cpuUsagePercent CPU 占用 (%)
 * @param activeTasks     并发任务数
 * @param fileHandles     打开的文件句柄数
 * @param connections     网络连接数
 * @param lastUpdated     采样时间
 */
public record ResourceUsage(
        long memoryUsageMb,
        double cpuUsagePercent,
        int activeTasks,
        int fileHandles,
        int connections,
        Instant lastUpdated) {

    public static ResourceUsage empty() {
        return new ResourceUsage(0, 0.0, 0, 0, 0, Instant.EPOCH);
    }
}
