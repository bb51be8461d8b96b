/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.auth;

import com.intuitivedesigns.oictarget.config.TargetSettings;
import com.intuitivedesigns.oictarget.error.AuthenticationException;
import com.intuitivedesigns.oictarget.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.oictarget.support.MutableClock;
import com.intuitivedesigns.oictarget.support.StubHttpServer;
import com.intuitivedesigns.oictarget.support.StubHttpServer.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class OAuth2TokenManagerTest {

    private static final String TOKEN_PATH = "/oauth2/v1/token";

    private StubHttpServer idcs;
    private MutableClock clock;
    private MicrometerMetricsRuntime metrics;
    private HttpClient http;

    @BeforeEach
    void setUp() throws Exception {
        idcs = StubHttpServer.start();
        clock = MutableClock.atEpoch();
        metrics = new MicrometerMetricsRuntime();
        http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        idcs.close();
        metrics.close();
    }

    private TargetSettings.Builder settings() {
        return TargetSettings.builder()
                .baseUrl("https://oic.example.com")
                .tokenUrl(idcs.uri(TOKEN_PATH).toString())
                .clientId("client-1")
                .clientSecret("s3cret")
                .refreshThreshold(Duration.ofSeconds(60));
    }

    private static Response token(String value, long expiresIn) {
        return Response.of(200, "{\"access_token\":\"" + value + "\",\"token_type\":\"bearer\",\"expires_in\":" + expiresIn + "}");
    }

    @Test
    void testTwoAcquiresWithinWindowMakeOneRoundTrip() throws Exception {
        idcs.respond(TOKEN_PATH, token("t1", 3600));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        String first = tokens.acquire();
        clock.advance(Duration.ofMinutes(30));
        String second = tokens.acquire();

        assertEquals("Bearer t1", first);
        assertEquals(first, second);
        assertEquals(1, idcs.count(TOKEN_PATH));
        assertEquals(1.0, metrics.count(OAuth2TokenManager.METRIC_REFRESHES));
    }

    @Test
    void testTokenInsideRefreshThresholdIsNotReused() throws Exception {
        idcs.enqueue(TOKEN_PATH, token("t1", 3600)).enqueue(TOKEN_PATH, token("t2", 3600));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        assertEquals("Bearer t1", tokens.acquire());
        // 50s left, threshold is 60s
        clock.advance(Duration.ofSeconds(3550));
        assertEquals("Bearer t2", tokens.acquire());
        assertEquals(2, idcs.count(TOKEN_PATH));
    }

    @Test
    void testConcurrentCallersShareOneRefresh() throws Exception {
        idcs.respond(TOKEN_PATH, token("shared", 3600).withDelay(Duration.ofMillis(300)));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return tokens.acquire();
                }));
            }
            go.countDown();

            HashSet<String> headers = new HashSet<>();
            for (Future<String> f : results) headers.add(f.get());

            assertEquals(1, headers.size());
            assertEquals(1, idcs.count(TOKEN_PATH));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testBasicClientAuthAndScope() throws Exception {
        idcs.respond(TOKEN_PATH, token("t1", 3600));
        TargetSettings s = settings().scope("https://aud.example.com:443urn:opc:resource:consumer::all").build();

        new OAuth2TokenManager(s, http, clock, metrics).acquire();

        StubHttpServer.Recorded req = idcs.requests(TOKEN_PATH).get(0);
        String expected = "Basic " + Base64.getEncoder().encodeToString("client-1:s3cret".getBytes(StandardCharsets.UTF_8));
        assertEquals("POST", req.method());
        assertEquals(expected, req.header("Authorization"));
        assertTrue(req.body().startsWith("grant_type=client_credentials&scope="));
        assertTrue(req.body().contains("urn%3Aopc%3Aresource%3Aconsumer%3A%3Aall"));
        assertFalse(req.body().contains("client_secret"));
    }

    @Test
    void testFormClientAuthSendsCredentialsInBody() throws Exception {
        idcs.respond(TOKEN_PATH, token("t1", 3600));
        TargetSettings s = settings().clientAuth(TargetSettings.ClientAuth.FORM).build();

        new OAuth2TokenManager(s, http, clock, metrics).acquire();

        StubHttpServer.Recorded req = idcs.requests(TOKEN_PATH).get(0);
        assertNull(req.header("Authorization"));
        assertTrue(req.body().contains("client_id=client-1"));
        assertTrue(req.body().contains("client_secret=s3cret"));
    }

    @Test
    void testRejectedCredentialsRaiseAuthenticationError() {
        idcs.respond(TOKEN_PATH, Response.of(401, "{\"error\":\"invalid_client\",\"error_description\":\"Client authentication failed\"}"));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        AuthenticationException ex = assertThrows(AuthenticationException.class, tokens::acquire);
        assertEquals(401, ex.httpStatus());
        assertTrue(ex.getMessage().contains("invalid_client"));
        assertTrue(ex.getMessage().contains("Client authentication failed"));
        assertEquals(0.0, metrics.count(OAuth2TokenManager.METRIC_REFRESHES));
    }

    @Test
    void testMalformedPayloadRaisesAuthenticationError() {
        idcs.enqueue(TOKEN_PATH, Response.of(200, "{\"access_token\":\"t1\"}"))
                .enqueue(TOKEN_PATH, Response.of(200, "{\"expires_in\":3600}"))
                .enqueue(TOKEN_PATH, Response.of(200, "not json"));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        assertTrue(assertThrows(AuthenticationException.class, tokens::acquire).getMessage().contains("expires_in"));
        assertTrue(assertThrows(AuthenticationException.class, tokens::acquire).getMessage().contains("access_token"));
        assertThrows(AuthenticationException.class, tokens::acquire);
    }

    @Test
    void testInvalidateWithStaleHeaderKeepsNewerToken() throws Exception {
        idcs.enqueue(TOKEN_PATH, token("t1", 3600)).enqueue(TOKEN_PATH, token("t2", 3600));
        OAuth2TokenManager tokens = new OAuth2TokenManager(settings().build(), http, clock, metrics);

        String stale = tokens.acquire();
        tokens.invalidate(stale);
        String fresh = tokens.acquire();

        // A second worker reporting the old token must not force another refresh
        tokens.invalidate(stale);
        assertEquals(fresh, tokens.acquire());

        assertEquals("Bearer t2", fresh);
        assertEquals(2, idcs.count(TOKEN_PATH));
    }

    @Test
    void testParseTokenDefaultsTypeAndAcceptsStringExpiry() {
        AccessToken t = OAuth2TokenManager.parseToken("{\"access_token\":\"abc\",\"expires_in\":\"120\"}", clock.instant());

        assertEquals("Bearer abc", t.headerValue());
        assertEquals(Duration.ofSeconds(120), t.expiresIn());
        assertFalse(t.toString().contains("abc"));
    }
}
