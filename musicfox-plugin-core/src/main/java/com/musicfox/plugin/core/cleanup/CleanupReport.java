package com.musicfox.plugin.core.cleanup;

import com.musicfox.plugin.api.exception.PluginOperationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 一轮清理的结果；各阶段互不影响，失败逐条记录
 */
public record CleanupReport(String pluginId, List<StageFailure> failures) {

    public CleanupReport {
        failures = List.copyOf(failures);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * 合并为一个异常，首个失败作为 cause
     */
    public PluginOperationException toException(String what) {
        String message = failures.stream()
                .map(f -> f.stage() + ": " + f.error().getMessage())
                .collect(Collectors.joining("; "));
        return new PluginOperationException(pluginId, what + " errors: " + message,
                failures.isEmpty() ? null : failures.get(0).error());
    }

    public record StageFailure(String stage, Throwable error) {
    }
}
