/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.core;

/**
 * Classification of a failed delivery attempt.
 */
public enum ErrorKind {
    NETWORK(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    RATE_LIMITED(true),
    AUTHENTICATION(false),
    CLIENT_ERROR(false),
    INTERRUPTED(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * @return true when another attempt of the same request may succeed.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Maps a non-2xx HTTP status onto a kind.
     */
    public static ErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) return AUTHENTICATION;
        if (status == 429) return RATE_LIMITED;
        if (status >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
