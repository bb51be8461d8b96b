/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives bookmarks once every batch they depend on is confirmed delivered.
 */
@FunctionalInterface
public interface StateSink {

    void emit(JsonNode state);
}
