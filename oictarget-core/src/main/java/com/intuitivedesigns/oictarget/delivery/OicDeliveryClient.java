/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.oictarget.auth.OAuth2TokenManager;
import com.intuitivedesigns.oictarget.auth.TokenManager;
import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;
import com.intuitivedesigns.oictarget.core.BatchSink;
import com.intuitivedesigns.oictarget.core.DeliveryOutcome;
import com.intuitivedesigns.oictarget.core.ErrorKind;
import com.intuitivedesigns.oictarget.error.AuthenticationException;
import com.intuitivedesigns.oictarget.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Posts batches to OIC REST endpoints.
 *
 * <p>Retry policy, as a bounded loop:
 * <ul>
 *   <li>network errors, timeouts, 5xx and 429 retry up to {@code maxRetries} times with exponential backoff</li>
 *   <li>401/403 invalidates the token and retries once, outside the retry budget</li>
 *   <li>any other 4xx fails immediately</li>
 * </ul>
 * Every attempt for a batch carries the same {@code X-Batch-Id}.
 */
public final class OicDeliveryClient implements BatchSink {

    private static final Logger log = LoggerFactory.getLogger(OicDeliveryClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String METRIC_RETRIES = "oic.delivery.retries";
    static final String METRIC_LATENCY = "oic.delivery.latency";

    static final String HEADER_BATCH_ID = "X-Batch-Id";
    private static final String USER_AGENT = "target-oracle-oic-java/1.0";
    private static final int MAX_ERROR_BODY_CHARS = 512;

    private final TargetSettings settings;
    private final TokenManager tokens;
    private final HttpClient client;
    private final Sleeper sleeper;
    private final RetryBackoff backoff;
    private final MetricsRuntime metrics;

    public OicDeliveryClient(TargetSettings settings, TokenManager tokens, HttpClient client,
                             Sleeper sleeper, MetricsRuntime metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.client = Objects.requireNonNull(client, "client");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.backoff = new RetryBackoff(settings.retryDelay, settings.maxRetryDelay);
    }

    /**
     * Production wiring: one shared HTTP client and token manager.
     */
    public static OicDeliveryClient create(TargetSettings settings, MetricsRuntime metrics) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        TokenManager tokens = new OAuth2TokenManager(settings, http, Clock.systemUTC(), metrics);
        return new OicDeliveryClient(settings, tokens, http, Sleeper.SYSTEM, metrics);
    }

    @Override
    public String id() {
        return TargetSettings.SINK_OIC;
    }

    @Override
    public DeliveryOutcome deliver(BatchEnvelope batch) {
        Objects.requireNonNull(batch, "batch");

        final URI uri;
        try {
            uri = settings.endpointUri(batch.stream());
        } catch (IllegalArgumentException e) {
            return DeliveryOutcome.failure(ErrorKind.CLIENT_ERROR, 0, "invalid endpoint for stream '" + batch.stream() + "': " + e.getMessage());
        }
        final byte[] body = encode(batch);

        int attempts = 0;
        int retries = 0;
        boolean authRetried = false;

        while (true) {
            attempts++;
            Attempt attempt = send(uri, batch, body);
            DeliveryOutcome outcome = attempt.outcome.withAttempts(attempts);

            if (outcome.success()) {
                log.debug("Delivered batch {} for stream '{}' ({})", batch.batchId(), batch.stream(), outcome.describe());
                return outcome;
            }

            if (outcome.errorKind() == ErrorKind.AUTHENTICATION) {
                if (!authRetried && attempt.authHeader != null) {
                    authRetried = true;
                    log.warn("OIC rejected token for batch {} (HTTP {}). Refreshing and retrying once.", batch.batchId(), outcome.httpStatus());
                    tokens.invalidate(attempt.authHeader);
                    continue;
                }
                return outcome.exhausted();
            }

            if (!outcome.retryable() || retries >= settings.maxRetries) {
                return outcome.exhausted();
            }

            Duration delay = backoff.delayFor(retries, attempt.retryAfter);
            retries++;
            metrics.counter(METRIC_RETRIES);
            log.warn("Batch {} for stream '{}' failed: {}. Retry {}/{} in {} ms",
                    batch.batchId(), batch.stream(), outcome.describe(), retries, settings.maxRetries, delay.toMillis());

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return DeliveryOutcome.failure(ErrorKind.INTERRUPTED, 0, "interrupted during backoff").withAttempts(attempts);
            }
        }
    }

    private Attempt send(URI uri, BatchEnvelope batch, byte[] body) {
        final String authHeader;
        try {
            authHeader = tokens.acquire();
        } catch (AuthenticationException e) {
            return new Attempt(DeliveryOutcome.failure(ErrorKind.AUTHENTICATION, Math.max(0, e.httpStatus()), e.getMessage()), null, null);
        } catch (HttpTimeoutException e) {
            return new Attempt(DeliveryOutcome.failure(ErrorKind.TIMEOUT, 0, "token endpoint timeout"), null, null);
        } catch (IOException e) {
            return new Attempt(DeliveryOutcome.failure(ErrorKind.NETWORK, 0, "token endpoint: " + e.getMessage()), null, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(DeliveryOutcome.failure(ErrorKind.INTERRUPTED, 0, "interrupted"), null, null);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(settings.requestTimeout)
                .header("Authorization", authHeader)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .header(HEADER_BATCH_ID, batch.batchId())
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        final long start = System.nanoTime();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            metrics.timer(METRIC_LATENCY, (System.nanoTime() - start) / 1_000_000L);
            return new Attempt(classify(response, batch), authHeader, retryAfter(response));
        } catch (HttpTimeoutException e) {
            return new Attempt(DeliveryOutcome.failure(ErrorKind.TIMEOUT, 0, "request timed out after " + settings.requestTimeout), authHeader, null);
        } catch (IOException e) {
            return new Attempt(DeliveryOutcome.failure(ErrorKind.NETWORK, 0, e.getClass().getSimpleName() + ": " + e.getMessage()), authHeader, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(DeliveryOutcome.failure(ErrorKind.INTERRUPTED, 0, "interrupted"), authHeader, null);
        }
    }

    private static DeliveryOutcome classify(HttpResponse<String> response, BatchEnvelope batch) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return DeliveryOutcome.success(processedCount(response.body(), batch.size()), status, 1);
        }
        return DeliveryOutcome.failure(ErrorKind.fromStatus(status), status, errorMessage(status, response.body()));
    }

    /**
     * OIC may report how many records it accepted; otherwise the whole batch counts.
     */
    static int processedCount(String body, int fallback) {
        if (body == null || body.isBlank()) return fallback;
        try {
            JsonNode json = MAPPER.readTree(body);
            JsonNode processed = (json == null) ? null : json.get("processed");
            return (processed != null && processed.canConvertToInt()) ? processed.asInt() : fallback;
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON success body ignored: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private static String errorMessage(int status, String body) {
        String oauth = OAuth2TokenManager.describeError(body);
        if (!oauth.isEmpty()) return "HTTP " + status + oauth;
        if (body == null || body.isBlank()) return "HTTP " + status;
        String trimmed = body.strip();
        return "HTTP " + status + ": " + (trimmed.length() > MAX_ERROR_BODY_CHARS ? trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "..." : trimmed);
    }

    static Duration retryAfter(HttpResponse<?> response) {
        if (response.statusCode() != 429) return null;
        return response.headers().firstValue("Retry-After")
                .map(String::trim)
                .filter(v -> v.matches("\\d{1,9}"))
                .map(v -> Duration.ofSeconds(Long.parseLong(v)))
                .orElse(null);
    }

    static byte[] encode(BatchEnvelope batch) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("batch_id", batch.batchId());
        root.put("stream", batch.stream());
        root.put("sequence", batch.sequence());
        root.put("created_at", DateTimeFormatter.ISO_INSTANT.format(batch.createdAt()));
        root.put("record_count", batch.size());
        ArrayNode records = root.putArray("records");
        batch.records().forEach(records::add);
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize batch " + batch.batchId(), e);
        }
    }

    private static final class Attempt {
        final DeliveryOutcome outcome;
        final String authHeader;
        final Duration retryAfter;

        Attempt(DeliveryOutcome outcome, String authHeader, Duration retryAfter) {
            this.outcome = outcome;
            this.authHeader = authHeader;
            this.retryAfter = retryAfter;
        }
    }
}
