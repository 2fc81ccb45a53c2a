package com.musicfox.plugin.core.resource;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 插件资源限额（不可变，整体替换实现热更新）
 * <p>
 * 数值为 0 表示该维度不设限。
 */
@Value
@Builder(toBuilder = true)
public class ResourceLimits {

    @Builder.Default
    long maxMemoryMb = 256;

    @Builder.Default
    double maxCpuPercent = 50.0;

    @Builder.Default
    int maxConcurrentTasks = 100;

    @Builder.Default
    int maxFileHandles = 100;

    @Builder.Default
    int maxConnections = 50;

    @Builder.Default
    Duration executionTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration idleTimeout = Duration.ofMinutes(10);

    @Builder.Default
    EnforceMode enforceMode = EnforceMode.LIMIT;

    public static ResourceLimits defaults() {
        return ResourceLimits.builder().build();
    }

    public void validate() {
        if (maxMemoryMb < 0) {
            throw new InvalidArgumentException("maxMemoryMb", "must not be negative");
        }
        if (maxCpuPercent < 0) {
            throw new InvalidArgumentException("maxCpuPercent", "must not be negative");
        }
        if (maxConcurrentTasks < 0) {
            throw new InvalidArgumentException("maxConcurrentTasks", "must not be negative");
        }
        if (maxFileHandles < 0) {
            throw new InvalidArgumentException("maxFileHandles", "must not be negative");
        }
        if (maxConnections < 0) {
            throw new InvalidArgumentException("maxConnections", "must not be negative");
        }
        if (executionTimeout == null || executionTimeout.isNegative()) {
            throw new InvalidArgumentException("executionTimeout", "must not be negative");
        }
        if (idleTimeout == null || idleTimeout.isNegative()) {
            throw new InvalidArgumentException("idleTimeout", "must not be negative");
        }
        if (enforceMode == null) {
            throw new InvalidArgumentException("enforceMode", "must not be null");
        }
    }
}
