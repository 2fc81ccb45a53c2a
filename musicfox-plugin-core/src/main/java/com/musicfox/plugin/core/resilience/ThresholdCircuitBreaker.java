package com.musicfox.plugin.core.resilience;

import com.musicfox.plugin.api.exception.InvalidArgumentException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 失败计数熔断器
 * <p>
 * CLOSED 下连续失败数达到阈值后 OPEN；OPEN 持续 recoveryTimeout 后放行一次试探进入 HALF_OPEN；
 * 试探成功回到 CLOSED，失败重新 OPEN。成功会清零失败计数。
 */
@Slf4j
public class ThresholdCircuitBreaker implements CircuitBreaker {

    @Getter
    private final String name;
    @Getter
    private final int failureThreshold;
    @Getter
    private final Duration recoveryTimeout;
    private final LongSupplier clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong lastFailureTime = new AtomicLong(0);

    public ThresholdCircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, System::currentTimeMillis);
    }

    public ThresholdCircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, LongSupplier clock) {
        if (failureThreshold <= 0) {
            throw new InvalidArgumentException("failureThreshold", "must be positive");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new InvalidArgumentException("recoveryTimeout", "must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquirePermission() {
        State current = state.get();
        if (current != State.OPEN) {
            return true;
        }
        long now = clock.getAsLong();
        if (now - lastFailureTime.get() >= recoveryTimeout.toMillis()) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                log.info("[Breaker:{}] State changed: OPEN -> HALF_OPEN (Trial starts)", name);
            }
            return true;
        }
        return false;
    }

    @Override
    public synchronized void onSuccess() {
        failureCount.set(0);
        if (state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            log.info("[Breaker:{}] State changed: HALF_OPEN -> CLOSED (Recovered)", name);
        }
    }

    @Override
    public synchronized void onError(Throwable throwable) {
        lastFailureTime.set(clock.getAsLong());
        int failures = failureCount.incrementAndGet();

        if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
            log.warn("[Breaker:{}] Trial call failed: HALF_OPEN -> OPEN", name);
            return;
        }
        if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
            log.warn("[Breaker:{}] {} failures reached threshold {}. OPENING. Last error: {}",
                    name, failures, failureThreshold, throwable != null ? throwable.getMessage() : "n/a");
        }
    }

    @Override
    public State getState() {
        return state.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    public long getLastFailureTime() {
        return lastFailureTime.get();
    }

    @Override
    public synchronized void reset() {
        failureCount.set(0);
        state.set(State.CLOSED);
    }
}
