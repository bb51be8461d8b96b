/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.error;

import com.intuitivedesigns.oictarget.core.UndeliveredReport;

import java.time.Duration;

/**
 * Graceful drain did not finish within the grace period. The fate of in-flight batches is unknown.
 */
public class ShutdownTimeoutException extends TargetException {

    private final UndeliveredReport undelivered;

    public ShutdownTimeoutException(Duration grace, UndeliveredReport undelivered) {
        super("Shutdown drain exceeded grace period of " + grace.toSeconds() + "s; unconfirmed: " + undelivered);
        this.undelivered = undelivered;
    }

    public UndeliveredReport undelivered() {
        return undelivered;
    }
}
