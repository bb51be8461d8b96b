/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.error;

/**
 * The identity provider rejected the client credentials or returned an unusable token payload.
 */
public class AuthenticationException extends TargetException {

    private final int httpStatus;

    public AuthenticationException(String message) {
        this(message, -1);
    }

    public AuthenticationException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /**
     * @return the token endpoint status, or -1 when the failure was not an HTTP response.
     */
    public int httpStatus() {
        return httpStatus;
    }
}
