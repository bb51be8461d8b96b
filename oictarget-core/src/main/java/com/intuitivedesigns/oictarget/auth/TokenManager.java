/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.auth;

import java.io.IOException;

/**
 * Supplies the {@code Authorization} header for OIC calls.
 *
 * <p>One instance is shared by every delivery worker; implementations must be thread-safe.
 */
public interface TokenManager {

    /**
     * @return header value such as {@code "Bearer eyJ..."}, refreshed first when the cached token is near expiry
     * @throws com.intuitivedesigns.oictarget.error.AuthenticationException if the identity provider rejects the request
     *         or answers with a malformed token payload
     * @throws IOException on network failure or timeout reaching the token endpoint
     */
    String acquire() throws IOException, InterruptedException;

    /**
     * Drops the cached token so the next {@link #acquire()} fetches a new one.
     */
    void invalidate();

    /**
     * Drops the cached token only if it still produces {@code staleHeader}.
     * A worker reporting a 401 for a token another worker already replaced does not force a second refresh.
     */
    void invalidate(String staleHeader);
}
