package com.musicfox.plugin.core.manager;

import java.time.Duration;

final class RetryPolicy {

    static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    private RetryPolicy() {
    }

    static int attempts(int retryCount) {
        return retryCount <= 0 ? 1 : retryCount;
    }

    static Duration delay(Duration retryDelay) {
        return retryDelay == null || retryDelay.isZero() || retryDelay.isNegative() ? DEFAULT_DELAY : retryDelay;
    }

    static Duration timeout(Duration requested, Duration fallback) {
        return requested == null || requested.isZero() || requested.isNegative() ? fallback : requested;
    }
}
