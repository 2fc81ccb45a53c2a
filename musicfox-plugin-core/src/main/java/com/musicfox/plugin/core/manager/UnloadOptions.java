package com.musicfox.plugin.core.manager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * 卸载选项
 */
@Value
@Builder(toBuilder = true)
public class UnloadOptions {

    Duration timeout;

    /**
     * 忽略状态与依赖检查，清理阶段的失败不再中止卸载
     */
    boolean forceUnload;

    @Builder.Default
    boolean gracefulShutdown = true;

    boolean skipCleanup;

    /**
     * 先按优先级降序卸载所有依赖本插件的插件
     */
    boolean cascadeUnload;

    int retryCount;

    Duration retryDelay;

    @Singular
    List<LifecycleHook> hooks;

    public static UnloadOptions defaults() {
        return UnloadOptions.builder().build();
    }

    public int effectiveRetryCount() {
        return RetryPolicy.attempts(retryCount);
    }

    public Duration effectiveRetryDelay() {
        return RetryPolicy.delay(retryDelay);
    }
}
