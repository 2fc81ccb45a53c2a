package com.musicfox.plugin.core.resilience;

/**
 * 熔断器接口
 */
public interface CircuitBreaker {

    /**
     * 是否允许请求通过
     */
    boolean tryAcquirePermission();

    /**
     * 记录成功
     */
    void onSuccess();

    /**
     * 记录失败
     */
    void onError(Throwable throwable);

    /**
     * 获取当前状态
     */
    State getState();

    int getFailureCount();

    /**
     * 回到 CLOSED 并清零计数
     */
    void reset();

    enum State {
        CLOSED, // 关闭（正常）
        OPEN, // 打开（熔断）
        HALF_OPEN // 半开（试探）
    }
}
