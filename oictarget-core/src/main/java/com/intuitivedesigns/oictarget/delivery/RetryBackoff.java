/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code base * 2^retry}, capped.
 */
public record RetryBackoff(Duration base, Duration cap) {

    public RetryBackoff {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(cap, "cap");
        if (base.isNegative()) throw new IllegalArgumentException("base must be >= 0");
        if (cap.compareTo(base) < 0) throw new IllegalArgumentException("cap must be >= base");
    }

    /**
     * @param retry zero-based retry index (0 for the first retry)
     */
    public Duration delayFor(int retry) {
        if (retry < 0) throw new IllegalArgumentException("retry must be >= 0");
        long baseMs = base.toMillis();
        long capMs = cap.toMillis();
        if (baseMs == 0) return Duration.ZERO;
        // 2^retry overflows past 62 shifts; anything that large is capped anyway
        if (retry >= 62 || baseMs > (capMs >> Math.min(retry, 62))) {
            return cap;
        }
        return Duration.ofMillis(Math.min(baseMs << retry, capMs));
    }

    /**
     * A server-supplied {@code Retry-After} replaces the computed delay, still bounded by the cap.
     */
    public Duration delayFor(int retry, Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) return delayFor(retry);
        return retryAfter.compareTo(cap) > 0 ? cap : retryAfter;
    }
}
