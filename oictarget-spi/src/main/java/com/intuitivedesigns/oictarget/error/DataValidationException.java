/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.error;

/**
 * A single record failed a required-field or type-coercion check.
 */
public class DataValidationException extends TargetException {

    private final String field;

    public DataValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
