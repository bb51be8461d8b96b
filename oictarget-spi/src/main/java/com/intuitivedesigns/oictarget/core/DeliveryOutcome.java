/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

import java.util.Objects;

/**
 * Result of submitting one batch.
 *
 * @param success    true when the endpoint confirmed the batch
 * @param processed  records confirmed by the endpoint (0 on failure)
 * @param errorKind  failure classification, null on success
 * @param retryable  whether the caller may try again later
 * @param httpStatus last HTTP status seen, or -1
 * @param message    last error detail, null on success
 * @param attempts   network attempts consumed
 */
public record DeliveryOutcome(
        boolean success,
        int processed,
        ErrorKind errorKind,
        boolean retryable,
        int httpStatus,
        String message,
        int attempts
) {

    public DeliveryOutcome {
        if (success && errorKind != null) throw new IllegalArgumentException("success outcome cannot carry an error kind");
        if (!success) Objects.requireNonNull(errorKind, "failure outcome requires an error kind");
        if (attempts < 0) throw new IllegalArgumentException("attempts must be >= 0");
    }

    public static DeliveryOutcome success(int processed, int httpStatus, int attempts) {
        return new DeliveryOutcome(true, processed, null, false, httpStatus, null, attempts);
    }

    public static DeliveryOutcome failure(ErrorKind kind, int httpStatus, String message) {
        return new DeliveryOutcome(false, 0, kind, kind.isTransient(), httpStatus, message, 1);
    }

    public DeliveryOutcome withAttempts(int total) {
        return new DeliveryOutcome(success, processed, errorKind, retryable, httpStatus, message, total);
    }

    /**
     * Marks a failure as final for this submission (retries exhausted).
     */
    public DeliveryOutcome exhausted() {
        return new DeliveryOutcome(success, processed, errorKind, false, httpStatus, message, attempts);
    }

    public String describe() {
        if (success) return "OK processed=" + processed + " attempts=" + attempts;
        return errorKind + (httpStatus > 0 ? " (HTTP " + httpStatus + ")" : "")
                + " attempts=" + attempts
                + (message == null ? "" : " msg='" + message + "'");
    }
}
