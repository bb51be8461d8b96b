/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.singer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.oictarget.core.StateSink;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Writes each emitted state as one JSON line. Stdout carries nothing else.
 */
public final class StdoutStateWriter implements StateSink {

    private final PrintStream out;
    private final ObjectMapper mapper;

    public StdoutStateWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        this.mapper = new ObjectMapper();
    }

    @Override
    public void emit(JsonNode state) {
        final String line;
        try {
            line = mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize state", e);
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
