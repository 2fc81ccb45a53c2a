package com.musicfox.plugin.core.manager;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * 卸载进度上报：保证进度单调不减，监听器异常不影响卸载
 */
@Slf4j
class ProgressReporter {

    static final ProgressReporter NOOP = new ProgressReporter(null, null, null);

    private final String pluginId;
    private final String pluginName;
    private final UnloadProgressListener listener;
    private final Instant startTime = Instant.now();
    private double last;

    ProgressReporter(String pluginId, String pluginName, UnloadProgressListener listener) {
        this.pluginId = pluginId;
        this.pluginName = pluginName;
        this.listener = listener;
    }

    void report(String stage, double progress, String message) {
        report(stage, progress, message, null);
    }

    synchronized void report(String stage, double progress, String message, Throwable error) {
        if (listener == null) {
            return;
        }
        last = Math.max(last, Math.min(1.0, progress));
        UnloadProgress event = new UnloadProgress(pluginId, pluginName, stage, last, message, startTime,
                Duration.between(startTime, Instant.now()), error);
        try {
            listener.onProgress(event);
        } catch (Exception e) {
            log.warn("[{}] Unload progress listener failed: {}", pluginId, e.getMessage());
        }
    }
}
