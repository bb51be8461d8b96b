/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.pipeline;

import java.time.Duration;

/**
 * Totals for one completed run.
 */
public record RunSummary(
        int streams,
        long recordsReceived,
        long recordsInvalid,
        long recordsDelivered,
        long batchesDelivered,
        long statesEmitted,
        Duration elapsed
) {
    @Override
    public String toString() {
        return "streams=" + streams +
                " received=" + recordsReceived +
                " invalid=" + recordsInvalid +
                " delivered=" + recordsDelivered +
                " batches=" + batchesDelivered +
                " states=" + statesEmitted +
                " elapsed=" + elapsed.toMillis() + "ms";
    }
}
