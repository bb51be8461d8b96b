/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.error.AuthenticationException;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OAuth2 client-credentials token manager for Oracle IDCS.
 *
 * <p>Reads go through a volatile snapshot; the refresh path is serialized by a lock and re-checks
 * the snapshot after acquiring it, so callers arriving during a refresh reuse its result.
 */
public final class OAuth2TokenManager implements TokenManager {

    private static final Logger log = LoggerFactory.getLogger(OAuth2TokenManager.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String METRIC_REFRESHES = "oic.token.refreshes";

    private final TargetSettings settings;
    private final HttpClient client;
    private final Clock clock;
    private final MetricsRuntime metrics;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile AccessToken current;

    public OAuth2TokenManager(TargetSettings settings, HttpClient client, Clock clock, MetricsRuntime metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String acquire() throws IOException, InterruptedException {
        AccessToken snapshot = current;
        if (snapshot != null && snapshot.isUsable(clock.instant(), settings.refreshThreshold)) {
            return snapshot.headerValue();
        }

        refreshLock.lockInterruptibly();
        try {
            snapshot = current;
            if (snapshot != null && snapshot.isUsable(clock.instant(), settings.refreshThreshold)) {
                return snapshot.headerValue();
            }
            AccessToken fresh = requestToken();
            current = fresh;
            return fresh.headerValue();
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void invalidate() {
        refreshLock.lock();
        try {
            current = null;
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void invalidate(String staleHeader) {
        refreshLock.lock();
        try {
            AccessToken snapshot = current;
            if (snapshot != null && snapshot.headerValue().equals(staleHeader)) {
                log.debug("Invalidating rejected access token");
                current = null;
            }
        } finally {
            refreshLock.unlock();
        }
    }

    private AccessToken requestToken() throws IOException, InterruptedException {
        final Instant issuedAt = clock.instant();

        StringBuilder form = new StringBuilder("grant_type=client_credentials")
                .append("&scope=").append(encode(settings.scope));

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(settings.tokenUrl)
                .timeout(settings.requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json");

        if (settings.clientAuth == TargetSettings.ClientAuth.BASIC) {
            String credentials = settings.clientId + ":" + settings.clientSecret;
            request.header("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        } else {
            form.append("&client_id=").append(encode(settings.clientId))
                    .append("&client_secret=").append(encode(settings.clientSecret));
        }

        HttpResponse<String> response = client.send(
                request.POST(HttpRequest.BodyPublishers.ofString(form.toString())).build(),
                HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AuthenticationException("Token endpoint returned HTTP " + status + describeError(response.body()), status);
        }

        AccessToken token = parseToken(response.body(), issuedAt);
        metrics.counter(METRIC_REFRESHES);
        log.info("Access token acquired (type={}, expiresIn={}s)", token.tokenType(), token.expiresIn().toSeconds());
        return token;
    }

    static AccessToken parseToken(String body, Instant issuedAt) {
        final JsonNode json;
        try {
            json = MAPPER.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new AuthenticationException("Token endpoint returned a non-JSON payload", e);
        }
        if (json == null || !json.isObject()) {
            throw new AuthenticationException("Token endpoint returned a non-object payload");
        }

        JsonNode accessToken = json.get("access_token");
        if (accessToken == null || !accessToken.isTextual() || accessToken.asText().isBlank()) {
            throw new AuthenticationException("Malformed token payload: missing access_token");
        }

        long expiresIn = parseExpiresIn(json.get("expires_in"));
        JsonNode tokenType = json.get("token_type");

        return new AccessToken(
                accessToken.asText(),
                (tokenType == null || tokenType.isNull()) ? null : tokenType.asText(),
                issuedAt,
                Duration.ofSeconds(expiresIn));
    }

    private static long parseExpiresIn(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new AuthenticationException("Malformed token payload: missing expires_in");
        }
        long seconds;
        if (node.isNumber()) {
            seconds = node.asLong();
        } else if (node.isTextual()) {
            try {
                seconds = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new AuthenticationException("Malformed token payload: expires_in is not a number", e);
            }
        } else {
            throw new AuthenticationException("Malformed token payload: expires_in is not a number");
        }
        if (seconds <= 0) {
            throw new AuthenticationException("Malformed token payload: expires_in must be positive");
        }
        return seconds;
    }

    /**
     * Formats an OAuth2 {@code error}/{@code error_description} pair when the body carries one.
     */
    public static String describeError(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode json = MAPPER.readTree(body);
            if (json == null || !json.isObject() || !json.hasNonNull("error")) return "";
            String error = json.get("error").asText();
            JsonNode desc = json.get("error_description");
            return (desc == null || desc.isNull()) ? ": " + error : ": " + error + " - " + desc.asText();
        } catch (IOException e) {
            return "";
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
