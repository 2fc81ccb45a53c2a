package com.musicfox.plugin.core.manager;

import java.time.Duration;
import java.time.Instant;

/**
 * 卸载进度
 *
 * @param progress 0.0 - 1.0，单次卸载内单调不减
 * @param error    该阶段的错误，无则为 null
 */
public record UnloadProgress(
        String pluginId,
        String pluginName,
        String stage,
        double progress,
        String message,
        Instant startTime,
        Duration elapsed,
        Throwable error) {
}
