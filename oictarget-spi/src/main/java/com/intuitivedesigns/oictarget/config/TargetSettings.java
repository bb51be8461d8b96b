/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.config;

import com.intuitivedesigns.oictarget.error.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated settings consumed by the pipeline core.
 * Built once at startup from a {@link TargetConfig}.
 */
public final class TargetSettings {

    // ---- Config keys ----
    public static final String KEY_BASE_URL = "oic.base.url";
    public static final String KEY_CLIENT_ID = "oic.oauth.client.id";
    public static final String KEY_CLIENT_SECRET = "oic.oauth.client.secret";
    public static final String KEY_TOKEN_URL = "oic.oauth.token.url";
    public static final String KEY_SCOPE = "oic.oauth.scope";
    public static final String KEY_AUDIENCE = "oic.oauth.client.aud";
    public static final String KEY_CLIENT_AUTH = "oic.oauth.client.auth";
    public static final String KEY_REFRESH_THRESHOLD_S = "oic.oauth.refresh.threshold.seconds";
    public static final String KEY_BATCH_SIZE = "oic.batch.size";
    public static final String KEY_BATCH_MAX_AGE_MS = "oic.batch.max.age.ms";
    public static final String KEY_FLUSH_INTERVAL_MS = "oic.flush.interval.ms";
    public static final String KEY_REQUEST_TIMEOUT_S = "oic.request.timeout.seconds";
    public static final String KEY_MAX_RETRIES = "oic.max.retries";
    public static final String KEY_RETRY_DELAY_MS = "oic.retry.delay.ms";
    public static final String KEY_RETRY_MAX_DELAY_MS = "oic.retry.max.delay.ms";
    public static final String KEY_CONCURRENT_STREAMS = "oic.concurrent.streams";
    public static final String KEY_SHUTDOWN_GRACE_S = "oic.shutdown.grace.seconds";
    public static final String KEY_VALIDATION_THRESHOLD = "oic.validation.error.threshold";
    public static final String KEY_VALIDATION_MIN_RECORDS = "oic.validation.error.min.records";
    public static final String KEY_PATH_TEMPLATE = "oic.endpoint.path.template";
    public static final String KEY_SINK_TYPE = "sink.type";

    private static final String STREAM_PATH_PREFIX = "oic.stream.";
    private static final String STREAM_PATH_SUFFIX = ".path";
    private static final String STREAM_PLACEHOLDER = "{stream}";

    // ---- Defaults ----
    public static final String DEFAULT_SCOPE = "urn:opc:resource:consumer::all";
    public static final String DEFAULT_PATH_TEMPLATE = "/ic/api/integration/v1/" + STREAM_PLACEHOLDER;
    public static final String SINK_OIC = "OIC";
    public static final String SINK_DRY_RUN = "DRY_RUN";

    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final int MAX_BATCH_SIZE = 1000;
    private static final long DEFAULT_BATCH_MAX_AGE_MS = 5_000L;
    private static final long DEFAULT_FLUSH_INTERVAL_MS = 1_000L;
    private static final long DEFAULT_REQUEST_TIMEOUT_S = 30L;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 500L;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 30_000L;
    private static final long DEFAULT_REFRESH_THRESHOLD_S = 60L;
    private static final int DEFAULT_CONCURRENT_STREAMS = 4;
    private static final long DEFAULT_SHUTDOWN_GRACE_S = 30L;

    public enum ClientAuth { BASIC, FORM }

    // ---- Public Immutable Fields ----
    public final URI baseUrl;
    public final String clientId;
    public final String clientSecret;
    public final URI tokenUrl;
    public final String scope;
    public final ClientAuth clientAuth;
    public final Duration refreshThreshold;

    public final int batchSize;
    public final Duration maxBatchAge;
    public final Duration flushInterval;

    public final Duration requestTimeout;
    public final int maxRetries;
    public final Duration retryDelay;
    public final Duration maxRetryDelay;

    public final int concurrentStreams;
    public final Duration shutdownGrace;

    public final double validationErrorThreshold;
    public final long validationMinRecords;

    public final String pathTemplate;
    public final Map<String, String> streamPaths;
    public final String sinkType;

    private TargetSettings(Builder b) {
        this.baseUrl = b.baseUrl;
        this.clientId = b.clientId;
        this.clientSecret = b.clientSecret;
        this.tokenUrl = b.tokenUrl;
        this.scope = b.scope;
        this.clientAuth = b.clientAuth;
        this.refreshThreshold = b.refreshThreshold;
        this.batchSize = b.batchSize;
        this.maxBatchAge = b.maxBatchAge;
        this.flushInterval = b.flushInterval;
        this.requestTimeout = b.requestTimeout;
        this.maxRetries = b.maxRetries;
        this.retryDelay = b.retryDelay;
        this.maxRetryDelay = b.maxRetryDelay;
        this.concurrentStreams = b.concurrentStreams;
        this.shutdownGrace = b.shutdownGrace;
        this.validationErrorThreshold = b.validationErrorThreshold;
        this.validationMinRecords = b.validationMinRecords;
        this.pathTemplate = b.pathTemplate;
        this.streamPaths = Collections.unmodifiableMap(new HashMap<>(b.streamPaths));
        this.sinkType = b.sinkType;
    }

    public static TargetSettings from(TargetConfig config) {
        Objects.requireNonNull(config, "config");

        final String sinkType = upper(config.getString(KEY_SINK_TYPE, SINK_OIC));
        final boolean needsAuth = !SINK_DRY_RUN.equals(sinkType);

        Builder b = builder()
                .sinkType(sinkType)
                .baseUrl(needsAuth ? require(config, KEY_BASE_URL) : config.getString(KEY_BASE_URL, "http://localhost"))
                .batchSize(config.getInt(KEY_BATCH_SIZE, DEFAULT_BATCH_SIZE))
                .maxBatchAge(Duration.ofMillis(config.getLong(KEY_BATCH_MAX_AGE_MS, DEFAULT_BATCH_MAX_AGE_MS)))
                .flushInterval(Duration.ofMillis(config.getLong(KEY_FLUSH_INTERVAL_MS, DEFAULT_FLUSH_INTERVAL_MS)))
                .requestTimeout(Duration.ofSeconds(config.getLong(KEY_REQUEST_TIMEOUT_S, DEFAULT_REQUEST_TIMEOUT_S)))
                .maxRetries(config.getInt(KEY_MAX_RETRIES, DEFAULT_MAX_RETRIES))
                .retryDelay(Duration.ofMillis(config.getLong(KEY_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS)))
                .maxRetryDelay(Duration.ofMillis(config.getLong(KEY_RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS)))
                .refreshThreshold(Duration.ofSeconds(config.getLong(KEY_REFRESH_THRESHOLD_S, DEFAULT_REFRESH_THRESHOLD_S)))
                .concurrentStreams(config.getInt(KEY_CONCURRENT_STREAMS, DEFAULT_CONCURRENT_STREAMS))
                .shutdownGrace(Duration.ofSeconds(config.getLong(KEY_SHUTDOWN_GRACE_S, DEFAULT_SHUTDOWN_GRACE_S)))
                .validationErrorThreshold(config.getDouble(KEY_VALIDATION_THRESHOLD, 0.0))
                .validationMinRecords(config.getLong(KEY_VALIDATION_MIN_RECORDS, 0L))
                .pathTemplate(config.getString(KEY_PATH_TEMPLATE, DEFAULT_PATH_TEMPLATE))
                .clientAuth(parseClientAuth(config.getString(KEY_CLIENT_AUTH, ClientAuth.BASIC.name())))
                .scope(buildScope(config.getString(KEY_SCOPE, null), config.getString(KEY_AUDIENCE, null)));

        if (needsAuth) {
            b.clientId(require(config, KEY_CLIENT_ID))
             .clientSecret(require(config, KEY_CLIENT_SECRET))
             .tokenUrl(require(config, KEY_TOKEN_URL));
        }

        for (String key : config.keys()) {
            if (key.startsWith(STREAM_PATH_PREFIX) && key.endsWith(STREAM_PATH_SUFFIX)
                    && key.length() > STREAM_PATH_PREFIX.length() + STREAM_PATH_SUFFIX.length()) {
                String stream = key.substring(STREAM_PATH_PREFIX.length(), key.length() - STREAM_PATH_SUFFIX.length());
                b.streamPath(stream, config.getString(key, null));
            }
        }

        return b.build();
    }

    /**
     * IDCS scope. An audience wins over an explicit scope and expands to the consumer + API resources.
     */
    static String buildScope(String scope, String audience) {
        final String aud = normalize(audience);
        if (aud != null) {
            return aud + ":443urn:opc:resource:consumer::all " + aud + ":443/ic/api/";
        }
        final String s = normalize(scope);
        return (s != null) ? s : DEFAULT_SCOPE;
    }

    /**
     * Path of the OIC endpoint receiving batches for {@code stream}.
     */
    public String endpointPath(String stream) {
        final String override = streamPaths.get(stream);
        final String path = (override != null) ? override : pathTemplate.replace(STREAM_PLACEHOLDER, encodeSegment(stream));
        return path.startsWith("/") ? path : "/" + path;
    }

    /**
     * @throws IllegalArgumentException when a configured override path is not a valid URI path
     */
    public URI endpointUri(String stream) {
        final String base = baseUrl.toString();
        final String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return URI.create(trimmed + endpointPath(stream));
    }

    // Stream names are free text; only the template slot is encoded, override paths are taken as configured
    static String encodeSegment(String stream) {
        return URLEncoder.encode(stream, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public boolean dryRun() {
        return SINK_DRY_RUN.equals(sinkType);
    }

    @Override
    public String toString() {
        return "TargetSettings{" +
                "baseUrl=" + baseUrl +
                ", tokenUrl=" + tokenUrl +
                ", clientId='" + clientId + '\'' +
                ", clientSecret=" + mask(clientSecret) +
                ", scope='" + scope + '\'' +
                ", clientAuth=" + clientAuth +
                ", batchSize=" + batchSize +
                ", maxBatchAge=" + maxBatchAge +
                ", flushInterval=" + flushInterval +
                ", requestTimeout=" + requestTimeout +
                ", maxRetries=" + maxRetries +
                ", retryDelay=" + retryDelay +
                ", maxRetryDelay=" + maxRetryDelay +
                ", concurrentStreams=" + concurrentStreams +
                ", shutdownGrace=" + shutdownGrace +
                ", validationErrorThreshold=" + validationErrorThreshold +
                ", pathTemplate='" + pathTemplate + '\'' +
                ", streamPaths=" + streamPaths +
                ", sinkType=" + sinkType +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Programmatic construction, mainly for embedding and tests. {@link #build()} applies the same checks as {@link #from(TargetConfig)}.
     */
    public static final class Builder {
        private URI baseUrl;
        private String clientId;
        private String clientSecret;
        private URI tokenUrl;
        private String scope = DEFAULT_SCOPE;
        private ClientAuth clientAuth = ClientAuth.BASIC;
        private Duration refreshThreshold = Duration.ofSeconds(DEFAULT_REFRESH_THRESHOLD_S);
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration maxBatchAge = Duration.ofMillis(DEFAULT_BATCH_MAX_AGE_MS);
        private Duration flushInterval = Duration.ofMillis(DEFAULT_FLUSH_INTERVAL_MS);
        private Duration requestTimeout = Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_S);
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = Duration.ofMillis(DEFAULT_RETRY_DELAY_MS);
        private Duration maxRetryDelay = Duration.ofMillis(DEFAULT_RETRY_MAX_DELAY_MS);
        private int concurrentStreams = DEFAULT_CONCURRENT_STREAMS;
        private Duration shutdownGrace = Duration.ofSeconds(DEFAULT_SHUTDOWN_GRACE_S);
        private double validationErrorThreshold = 0.0;
        private long validationMinRecords = 0L;
        private String pathTemplate = DEFAULT_PATH_TEMPLATE;
        private final Map<String, String> streamPaths = new HashMap<>();
        private String sinkType = SINK_OIC;

        private Builder() {}

        public Builder baseUrl(String v) { this.baseUrl = parseUrl(KEY_BASE_URL, v); return this; }
        public Builder clientId(String v) { this.clientId = v; return this; }
        public Builder clientSecret(String v) { this.clientSecret = v; return this; }
        public Builder tokenUrl(String v) { this.tokenUrl = parseUrl(KEY_TOKEN_URL, v); return this; }
        public Builder scope(String v) { this.scope = v; return this; }
        public Builder clientAuth(ClientAuth v) { this.clientAuth = v; return this; }
        public Builder refreshThreshold(Duration v) { this.refreshThreshold = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder maxBatchAge(Duration v) { this.maxBatchAge = v; return this; }
        public Builder flushInterval(Duration v) { this.flushInterval = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder retryDelay(Duration v) { this.retryDelay = v; return this; }
        public Builder maxRetryDelay(Duration v) { this.maxRetryDelay = v; return this; }
        public Builder concurrentStreams(int v) { this.concurrentStreams = v; return this; }
        public Builder shutdownGrace(Duration v) { this.shutdownGrace = v; return this; }
        public Builder validationErrorThreshold(double v) { this.validationErrorThreshold = v; return this; }
        public Builder validationMinRecords(long v) { this.validationMinRecords = v; return this; }
        public Builder pathTemplate(String v) { this.pathTemplate = v; return this; }
        public Builder sinkType(String v) { this.sinkType = upper(v); return this; }

        public Builder streamPath(String stream, String path) {
            if (normalize(stream) == null || normalize(path) == null) {
                throw new ConfigurationException("Blank stream path override for stream '" + stream + "'");
            }
            this.streamPaths.put(stream, path.trim());
            return this;
        }

        public TargetSettings build() {
            if (baseUrl == null) throw new ConfigurationException("Missing required configuration key: " + KEY_BASE_URL);
            if (!SINK_DRY_RUN.equals(sinkType)) {
                if (normalize(clientId) == null) throw new ConfigurationException("Missing required configuration key: " + KEY_CLIENT_ID);
                if (normalize(clientSecret) == null) throw new ConfigurationException("Missing required configuration key: " + KEY_CLIENT_SECRET);
                if (tokenUrl == null) throw new ConfigurationException("Missing required configuration key: " + KEY_TOKEN_URL);
            }
            checkRange(KEY_BATCH_SIZE, batchSize, 1, MAX_BATCH_SIZE);
            checkRange(KEY_MAX_RETRIES, maxRetries, 0, 100);
            checkRange(KEY_CONCURRENT_STREAMS, concurrentStreams, 1, 256);
            checkPositive(KEY_BATCH_MAX_AGE_MS, maxBatchAge);
            checkPositive(KEY_FLUSH_INTERVAL_MS, flushInterval);
            checkPositive(KEY_REQUEST_TIMEOUT_S, requestTimeout);
            checkPositive(KEY_SHUTDOWN_GRACE_S, shutdownGrace);
            checkNotNegative(KEY_RETRY_DELAY_MS, retryDelay);
            checkNotNegative(KEY_REFRESH_THRESHOLD_S, refreshThreshold);
            if (maxRetryDelay == null || maxRetryDelay.compareTo(retryDelay) < 0) {
                throw new ConfigurationException(KEY_RETRY_MAX_DELAY_MS + " must be >= " + KEY_RETRY_DELAY_MS);
            }
            if (Double.isNaN(validationErrorThreshold) || validationErrorThreshold < 0.0 || validationErrorThreshold > 1.0) {
                throw new ConfigurationException(KEY_VALIDATION_THRESHOLD + " must be within [0.0, 1.0] but was " + validationErrorThreshold);
            }
            if (validationMinRecords < 0) throw new ConfigurationException(KEY_VALIDATION_MIN_RECORDS + " must be >= 0");
            if (normalize(pathTemplate) == null) throw new ConfigurationException(KEY_PATH_TEMPLATE + " must not be blank");
            if (normalize(scope) == null) scope = DEFAULT_SCOPE;
            if (clientAuth == null) clientAuth = ClientAuth.BASIC;
            if (normalize(sinkType) == null) sinkType = SINK_OIC;
            return new TargetSettings(this);
        }
    }

    // --- Helpers ---

    private static String require(TargetConfig config, String key) {
        final String v = normalize(config.getString(key, null));
        if (v == null) throw new ConfigurationException("Missing required configuration key: " + key);
        return v;
    }

    private static URI parseUrl(String key, String raw) {
        final String v = normalize(raw);
        if (v == null) return null;
        try {
            URI uri = new URI(v);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException("Config key '" + key + "' must be an absolute http(s) URL but was '" + v + "'");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Config key '" + key + "' is not a valid URL: " + v, e);
        }
    }

    private static ClientAuth parseClientAuth(String raw) {
        final String v = upper(raw);
        if (v == null) return ClientAuth.BASIC;
        try {
            return ClientAuth.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(KEY_CLIENT_AUTH + " must be BASIC or FORM but was '" + raw + "'");
        }
    }

    private static void checkRange(String key, long v, long min, long max) {
        if (v < min || v > max) {
            throw new ConfigurationException("Config key '" + key + "' must be within [" + min + ", " + max + "] but was " + v);
        }
    }

    private static void checkPositive(String key, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new ConfigurationException("Config key '" + key + "' must be > 0");
        }
    }

    private static void checkNotNegative(String key, Duration d) {
        if (d == null || d.isNegative()) {
            throw new ConfigurationException("Config key '" + key + "' must be >= 0");
        }
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String upper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static String mask(String secret) {
        if (secret == null || secret.length() <= 4) return "****";
        return "****" + secret.substring(secret.length() - 4);
    }
}
