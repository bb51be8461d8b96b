/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached OAuth2 access token. Never leaves the auth package except as {@link #headerValue()}.
 */
public record AccessToken(String token, String tokenType, Instant issuedAt, Duration expiresIn) {

    public AccessToken {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresIn, "expiresIn");
        if (tokenType == null || tokenType.isBlank() || "bearer".equalsIgnoreCase(tokenType)) {
            tokenType = "Bearer";
        }
    }

    public Instant expiresAt() {
        return issuedAt.plus(expiresIn);
    }

    /**
     * A token inside the refresh window is treated as expired.
     */
    public boolean isUsable(Instant now, Duration refreshThreshold) {
        return now.isBefore(expiresAt().minus(refreshThreshold));
    }

    public String headerValue() {
        return tokenType + " " + token;
    }

    @Override
    public String toString() {
        return "AccessToken{type=" + tokenType + ", issuedAt=" + issuedAt + ", expiresIn=" + expiresIn + "}";
    }
}
