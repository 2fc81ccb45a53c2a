package com.musicfox.plugin.core.manager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * 停止选项
 */
@Value
@Builder(toBuilder = true)
public class StopOptions {

    Duration timeout;

    /**
     * 忽略仍在运行的依赖方
     */
    boolean forceStop;

    /**
     * Stop() 超时后仍继续停止流程
     */
    boolean force;

    @Builder.Default
    boolean gracefulShutdown = true;

    /**
     * 跳过资源清理（卸载流程内部停止时使用，由卸载统一清理）
     */
    boolean skipCleanup;

    int retryCount;

    Duration retryDelay;

    @Singular
    List<LifecycleHook> hooks;

    public static StopOptions defaults() {
        return StopOptions.builder().build();
    }

    public int effectiveRetryCount() {
        return RetryPolicy.attempts(retryCount);
    }

    public Duration effectiveRetryDelay() {
        return RetryPolicy.delay(retryDelay);
    }
}
