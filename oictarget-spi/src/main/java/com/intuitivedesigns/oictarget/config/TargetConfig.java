/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.oictarget.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration for the target.
 *
 * <p>Resolution order (later wins):</p>
 * <ol>
 * <li>File from {@code --config}, {@code -Doic.config.path} or ENV {@code OIC_CONFIG_PATH}.
 * {@code .json} files are Singer-style objects with snake_case keys, anything else is a properties file.</li>
 * <li>ENV variables prefixed with {@code TARGET_ORACLE_OIC_}.</li>
 * </ol>
 */
public final class TargetConfig {

    private static final Logger log = LoggerFactory.getLogger(TargetConfig.class);

    public static final String SYS_PROP_PATH = "oic.config.path";
    public static final String ENV_PATH = "OIC_CONFIG_PATH";
    public static final String ENV_PREFIX = "TARGET_ORACLE_OIC_";

    // Singer config names that do not follow the plain "oic." + dotted rule
    private static final Map<String, String> ALIASES = Map.of(
            "request_timeout", "oic.request.timeout.seconds",
            "max_batch_age_ms", "oic.batch.max.age.ms",
            "retry_delay_ms", "oic.retry.delay.ms",
            "flush_interval_ms", "oic.flush.interval.ms",
            "shutdown_grace_seconds", "oic.shutdown.grace.seconds",
            "validation_error_threshold", "oic.validation.error.threshold",
            "metrics_provider", "metrics.provider",
            "sink_type", "sink.type"
    );
    private static final String JSON_STREAM_PATHS = "stream_paths";
    private static final String JSON_DRY_RUN = "dry_run_mode";

    private final Properties props;

    private TargetConfig(Properties props) {
        this.props = props;
    }

    public static TargetConfig of(Map<String, String> values) {
        Properties p = new Properties();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) p.setProperty(k, v);
            });
        }
        return new TargetConfig(p);
    }

    public static TargetConfig load(String explicitPath) {
        return load(explicitPath, System.getenv());
    }

    public static TargetConfig load(String explicitPath, Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Properties p = new Properties();

        String path = explicitPath;
        if (path == null || path.isBlank()) path = System.getProperty(SYS_PROP_PATH);
        if (path == null || path.isBlank()) path = env.get(ENV_PATH);

        if (path != null && !path.isBlank()) {
            loadFile(Path.of(path.trim()), p);
            log.info("Loaded {} configuration keys from {}", p.size(), path);
        } else {
            log.warn("No configuration file given (--config, -D{} or {}); relying on environment only", SYS_PROP_PATH, ENV_PATH);
        }

        int fromEnv = 0;
        for (Map.Entry<String, String> e : env.entrySet()) {
            final String name = e.getKey();
            if (name == null || !name.startsWith(ENV_PREFIX) || e.getValue() == null) continue;
            final String singerKey = name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT);
            if (singerKey.isEmpty()) continue;
            p.setProperty(toKey(singerKey), e.getValue());
            fromEnv++;
        }
        if (fromEnv > 0) log.info("Applied {} configuration overrides from {}* environment", fromEnv, ENV_PREFIX);

        return new TargetConfig(p);
    }

    private static void loadFile(Path file, Properties into) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
                JsonNode root = new ObjectMapper().readTree(is);
                if (root == null || !root.isObject()) {
                    throw new ConfigurationException("Config file must contain a JSON object: " + file);
                }
                flattenSinger(root, into);
            } else {
                into.load(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + file, e);
        }
    }

    private static void flattenSinger(JsonNode root, Properties into) {
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            final String name = e.getKey();
            final JsonNode value = e.getValue();
            if (value == null || value.isNull()) continue;

            if (JSON_STREAM_PATHS.equals(name) && value.isObject()) {
                value.fields().forEachRemaining(s -> into.setProperty("oic.stream." + s.getKey() + ".path", s.getValue().asText()));
            } else if (JSON_DRY_RUN.equals(name)) {
                if (value.asBoolean(false)) into.setProperty("sink.type", "DRY_RUN");
            } else if (value.isValueNode()) {
                into.setProperty(toKey(name), value.asText());
            } else {
                throw new ConfigurationException("Unsupported nested value for config key '" + name + "'");
            }
        }
    }

    static String toKey(String singerKey) {
        if (singerKey.indexOf('.') >= 0) return singerKey;
        final String alias = ALIASES.get(singerKey);
        if (alias != null) return alias;
        return "oic." + singerKey.replace('_', '.');
    }

    // --- Accessors ---

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        final String val = trimmed(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Config key '" + key + "' must be an integer but was '" + val + "'");
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = trimmed(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Config key '" + key + "' must be a long but was '" + val + "'");
        }
    }

    public double getDouble(String key, double defaultValue) {
        final String val = trimmed(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Config key '" + key + "' must be a number but was '" + val + "'");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String val = trimmed(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    private String trimmed(String key) {
        final String v = props.getProperty(key);
        if (v == null) return null;
        final String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
