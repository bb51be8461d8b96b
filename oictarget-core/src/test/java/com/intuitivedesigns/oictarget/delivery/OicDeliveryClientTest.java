/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.oictarget.auth.TokenManager;
import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.core.BatchEnvelope;
import com.intuitivedesigns.oictarget.core.DeliveryOutcome;
import com.intuitivedesigns.oictarget.core.ErrorKind;
import com.intuitivedesigns.oictarget.error.AuthenticationException;
import com.intuitivedesigns.oictarget.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.oictarget.support.StubHttpServer;
import com.intuitivedesigns.oictarget.support.StubHttpServer.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OicDeliveryClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USERS_PATH = "/ic/api/integration/v1/users";

    private StubHttpServer oic;
    private MicrometerMetricsRuntime metrics;
    private HttpClient http;
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final Sleeper recordingSleeper = sleeps::add;

    /**
     * Hands out "Bearer t1", "Bearer t2", ... advancing on each effective invalidation.
     */
    private static class CountingTokens implements TokenManager {
        final AtomicInteger generation = new AtomicInteger(1);
        final AtomicInteger invalidations = new AtomicInteger();

        @Override
        public String acquire() {
            return "Bearer t" + generation.get();
        }

        @Override
        public void invalidate() {
            invalidations.incrementAndGet();
            generation.incrementAndGet();
        }

        @Override
        public void invalidate(String staleHeader) {
            if (staleHeader.equals(acquire())) invalidate();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        oic = StubHttpServer.start();
        metrics = new MicrometerMetricsRuntime();
        http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        oic.close();
        metrics.close();
    }

    private TargetSettings.Builder settings() {
        return TargetSettings.builder()
                .baseUrl(oic.baseUrl())
                .tokenUrl("https://idcs.example.com/oauth2/v1/token")
                .clientId("client")
                .clientSecret("secret")
                .retryDelay(Duration.ofMillis(100))
                .maxRetryDelay(Duration.ofSeconds(5))
                .requestTimeout(Duration.ofSeconds(5));
    }

    private OicDeliveryClient client(TargetSettings s, TokenManager tokens) {
        return new OicDeliveryClient(s, tokens, http, recordingSleeper, metrics);
    }

    private static BatchEnvelope batch(String stream, int records) throws Exception {
        List<JsonNode> list = new ArrayList<>();
        for (int i = 0; i < records; i++) list.add(MAPPER.readTree("{\"id\":\"u" + i + "\"}"));
        return BatchEnvelope.of(stream, 1, list, Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void testTransientFailureThenSuccessUsesTwoCalls() throws Exception {
        oic.enqueue(USERS_PATH, Response.of(503, "{\"error\":\"unavailable\"}"))
                .enqueue(USERS_PATH, Response.of(200, "{}"));
        BatchEnvelope b = batch("users", 3);

        DeliveryOutcome outcome = client(settings().build(), new CountingTokens()).deliver(b);

        assertTrue(outcome.success());
        assertEquals(2, outcome.attempts());
        assertEquals(3, outcome.processed());
        assertEquals(2, oic.count(USERS_PATH));
        assertEquals(List.of(Duration.ofMillis(100)), sleeps);
        assertEquals(1.0, metrics.count(OicDeliveryClient.METRIC_RETRIES));

        // Same batch id on every attempt
        List<StubHttpServer.Recorded> reqs = oic.requests(USERS_PATH);
        assertEquals(b.batchId(), reqs.get(0).header(OicDeliveryClient.HEADER_BATCH_ID));
        assertEquals(b.batchId(), reqs.get(1).header(OicDeliveryClient.HEADER_BATCH_ID));
    }

    @Test
    void testRetriesExhaustedReportsLastError() throws Exception {
        oic.respond(USERS_PATH, Response.of(503, "{\"error\":\"unavailable\"}"));

        DeliveryOutcome outcome = client(settings().maxRetries(1).build(), new CountingTokens()).deliver(batch("users", 1));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.SERVER_ERROR, outcome.errorKind());
        assertEquals(503, outcome.httpStatus());
        assertEquals(2, outcome.attempts());
        assertFalse(outcome.retryable());
        assertEquals(2, oic.count(USERS_PATH));
    }

    @Test
    void testUnauthorizedRefreshesTokenOnce() throws Exception {
        oic.enqueue(USERS_PATH, Response.of(401, ""))
                .enqueue(USERS_PATH, Response.of(200, "{\"processed\":1}"));
        CountingTokens tokens = new CountingTokens();

        DeliveryOutcome outcome = client(settings().maxRetries(0).build(), tokens).deliver(batch("users", 1));

        assertTrue(outcome.success());
        assertEquals(1, tokens.invalidations.get());
        List<StubHttpServer.Recorded> reqs = oic.requests(USERS_PATH);
        assertEquals("Bearer t1", reqs.get(0).header("Authorization"));
        assertEquals("Bearer t2", reqs.get(1).header("Authorization"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRepeatedUnauthorizedIsFatal() throws Exception {
        oic.respond(USERS_PATH, Response.of(403, "{\"error\":\"forbidden\"}"));
        CountingTokens tokens = new CountingTokens();

        DeliveryOutcome outcome = client(settings().maxRetries(5).build(), tokens).deliver(batch("users", 1));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.AUTHENTICATION, outcome.errorKind());
        assertEquals(2, oic.count(USERS_PATH));
        assertEquals(1, tokens.invalidations.get());
    }

    @Test
    void testClientErrorFailsImmediately() throws Exception {
        oic.respond(USERS_PATH, Response.of(400, "{\"error\":\"invalid_request\",\"error_description\":\"bad field\"}"));

        DeliveryOutcome outcome = client(settings().build(), new CountingTokens()).deliver(batch("users", 1));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.CLIENT_ERROR, outcome.errorKind());
        assertEquals(1, outcome.attempts());
        assertTrue(outcome.message().contains("invalid_request - bad field"));
        assertEquals(1, oic.count(USERS_PATH));
    }

    @Test
    void testRateLimitHonoursRetryAfter() throws Exception {
        oic.enqueue(USERS_PATH, Response.of(429, "").withHeader("Retry-After", "2"))
                .enqueue(USERS_PATH, Response.of(202, ""));

        DeliveryOutcome outcome = client(settings().build(), new CountingTokens()).deliver(batch("users", 2));

        assertTrue(outcome.success());
        assertEquals(202, outcome.httpStatus());
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testTokenEndpointRejectionIsNotRetried() throws Exception {
        TokenManager rejecting = new CountingTokens() {
            @Override
            public String acquire() {
                throw new AuthenticationException("Token endpoint returned HTTP 401: invalid_client", 401);
            }
        };

        DeliveryOutcome outcome = client(settings().build(), rejecting).deliver(batch("users", 1));

        assertEquals(ErrorKind.AUTHENTICATION, outcome.errorKind());
        assertEquals(401, outcome.httpStatus());
        assertEquals(0, oic.count(USERS_PATH));
    }

    @Test
    void testNetworkErrorIsRetried() throws Exception {
        StubHttpServer gone = StubHttpServer.start();
        String deadUrl = gone.baseUrl();
        gone.close();

        TargetSettings s = settings().baseUrl(deadUrl).maxRetries(2).build();
        DeliveryOutcome outcome = client(s, new CountingTokens()).deliver(batch("users", 1));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.NETWORK, outcome.errorKind());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void testSlowResponseTimesOutAndIsRetried() throws Exception {
        oic.respond(USERS_PATH, Response.of(200, "{}").withDelay(Duration.ofMillis(1500)));

        TargetSettings s = settings().requestTimeout(Duration.ofMillis(200)).maxRetries(2).build();
        DeliveryOutcome outcome = client(s, new CountingTokens()).deliver(batch("users", 1));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.TIMEOUT, outcome.errorKind());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        assertEquals(2.0, metrics.count(OicDeliveryClient.METRIC_RETRIES));
    }

    @Test
    void testStreamNameWithSpacesIsDelivered() throws Exception {
        oic.respond("/ic/api/integration/v1/sales orders", Response.of(200, "{}"));

        DeliveryOutcome outcome = client(settings().build(), new CountingTokens()).deliver(batch("sales orders", 2));

        assertTrue(outcome.success());
        assertEquals(1, oic.count("/ic/api/integration/v1/sales orders"));
    }

    @Test
    void testRequestCarriesEnvelopeAndHeaders() throws Exception {
        String path = "/ic/api/integration/v1/flows/rest/CUSTOM/1.0/users";
        oic.respond(path, Response.of(200, "{\"processed\":2}"));
        TargetSettings s = settings().streamPath("users", "/ic/api/integration/v1/flows/rest/CUSTOM/1.0/users").build();
        BatchEnvelope b = batch("users", 2);

        DeliveryOutcome outcome = client(s, new CountingTokens()).deliver(b);

        assertTrue(outcome.success());
        StubHttpServer.Recorded req = oic.requests(path).get(0);
        assertEquals("POST", req.method());
        assertEquals("Bearer t1", req.header("Authorization"));
        assertTrue(req.header("Content-Type").startsWith("application/json"));

        JsonNode body = MAPPER.readTree(req.body());
        assertEquals(b.batchId(), body.get("batch_id").asText());
        assertEquals("users", body.get("stream").asText());
        assertEquals(2, body.get("record_count").asInt());
        assertEquals("2025-01-01T00:00:00Z", body.get("created_at").asText());
        assertEquals("u1", body.get("records").get(1).get("id").asText());
    }

    @Test
    void testProcessedCountFallsBackToBatchSize() {
        assertEquals(5, OicDeliveryClient.processedCount("", 5));
        assertEquals(5, OicDeliveryClient.processedCount("<html/>", 5));
        assertEquals(4, OicDeliveryClient.processedCount("{\"processed\":4}", 5));
    }
}
