/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.error;

import com.intuitivedesigns.oictarget.core.DeliveryOutcome;
import com.intuitivedesigns.oictarget.core.UndeliveredReport;

/**
 * A batch could not be delivered: permanent rejection or retries exhausted.
 */
public class DeliveryException extends TargetException {

    private final String stream;
    private final String batchId;
    private final DeliveryOutcome outcome;
    private final UndeliveredReport undelivered;

    public DeliveryException(String stream, String batchId, DeliveryOutcome outcome, UndeliveredReport undelivered) {
        super("Delivery failed for stream '" + stream + "' batch " + batchId + ": " + outcome.describe()
                + (undelivered == null || undelivered.isEmpty() ? "" : " | undelivered: " + undelivered));
        this.stream = stream;
        this.batchId = batchId;
        this.outcome = outcome;
        this.undelivered = undelivered == null ? UndeliveredReport.empty() : undelivered;
    }

    public String stream() {
        return stream;
    }

    public String batchId() {
        return batchId;
    }

    public DeliveryOutcome outcome() {
        return outcome;
    }

    public UndeliveredReport undelivered() {
        return undelivered;
    }

    public DeliveryException withUndelivered(UndeliveredReport report) {
        DeliveryException copy = new DeliveryException(stream, batchId, outcome, report);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
