package com.acme.asuc.governor.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Sliding-window limits: at most {@code maxPerSecond} creations per component
 * and {@code maxPerSecond * windowSeconds} creations overall inside the trailing window.
 */
public record RateLimitPolicy(int maxPerSecond, Duration window) {

    public RateLimitPolicy {
        Objects.requireNonNull(window, "window");
        if (maxPerSecond < 1) {
            throw new IllegalArgumentException("maxPerSecond must be >= 1: " + maxPerSecond);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public long globalCapacity() {
        return (long) maxPerSecond * Math.max(1L, window.toSeconds());
    }

    public long perComponentCapacity() {
        return maxPerSecond;
    }
}
