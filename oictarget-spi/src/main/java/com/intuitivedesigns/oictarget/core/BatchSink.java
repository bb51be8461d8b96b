/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

/**
 * A pluggable destination for drained batches.
 *
 * Examples:
 * - OIC REST endpoint (OAuth2 bearer)
 * - Dry-run logger
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #deliver(BatchEnvelope)} reports failures through the returned {@link DeliveryOutcome};
 * it does not throw for HTTP or network failures.</li>
 * <li>Implementations must be thread-safe: batches of different streams are delivered concurrently.</li>
 * <li>Batches of one stream are never delivered concurrently with each other.</li>
 * </ul>
 */
public interface BatchSink extends AutoCloseable {

    /**
     * Submit the batch, retrying transient failures according to the sink's policy.
     *
     * @param batch the drained envelope
     * @return final outcome after all attempts
     */
    DeliveryOutcome deliver(BatchEnvelope batch);

    /**
     * Identifier for logging and metrics tagging.
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() {
        // no-op by default
    }
}
