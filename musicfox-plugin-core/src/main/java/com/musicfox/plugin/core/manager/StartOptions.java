package com.musicfox.plugin.core.manager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * 启动选项
 */
@Value
@Builder(toBuilder = true)
public class StartOptions {

    /**
     * 单次调用超时，为空或非正数时使用编排器配置
     */
    Duration timeout;

    /**
     * 跳过状态与依赖检查
     */
    boolean forceStart;

    /**
     * 总尝试次数，非正数按 1 处理
     */
    int retryCount;

    /**
     * 重试间隔，非正数按 1 秒处理
     */
    Duration retryDelay;

    @Singular
    List<LifecycleHook> hooks;

    public static StartOptions defaults() {
        return StartOptions.builder().build();
    }

    public int effectiveRetryCount() {
        return RetryPolicy.attempts(retryCount);
    }

    public Duration effectiveRetryDelay() {
        return RetryPolicy.delay(retryDelay);
    }
}
