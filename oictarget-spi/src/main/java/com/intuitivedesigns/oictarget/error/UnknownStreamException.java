/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.error;

/**
 * A RECORD arrived for a stream that never received a SCHEMA.
 */
public class UnknownStreamException extends TargetException {

    private final String stream;

    public UnknownStreamException(String stream) {
        super("Record for stream '" + stream + "' arrived before its SCHEMA message");
        this.stream = stream;
    }

    public String stream() {
        return stream;
    }
}
