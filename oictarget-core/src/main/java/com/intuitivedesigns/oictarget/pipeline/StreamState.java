/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.pipeline;

/**
 * Lifecycle of one stream. A stream with no SCHEMA yet has no context at all.
 */
public enum StreamState {
    SCHEMA_RECEIVED,
    ACTIVE,
    DRAINING,
    CLOSED
}
