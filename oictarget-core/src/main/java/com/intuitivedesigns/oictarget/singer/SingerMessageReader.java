/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.singer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.oictarget.error.SingerProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses newline-delimited Singer messages.
 */
public final class SingerMessageReader {

    private static final Logger log = LoggerFactory.getLogger(SingerMessageReader.class);

    private final ObjectReader reader;

    public SingerMessageReader() {
        this(new ObjectMapper());
    }

    public SingerMessageReader(ObjectMapper mapper) {
        // One message per line: anything after the object is a protocol error
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @return the message, or empty for blank lines and message types the target ignores
     * @throws SingerProtocolException for malformed JSON, a missing discriminator or an unknown type
     */
    public Optional<SingerMessage> parse(String line, long lineNumber) {
        if (line == null || line.isBlank()) return Optional.empty();

        final JsonNode json;
        try {
            json = reader.readTree(line);
        } catch (JsonProcessingException e) {
            throw new SingerProtocolException(lineNumber, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new SingerProtocolException(lineNumber, "message must be a JSON object");
        }

        String type = text(json, "type", lineNumber).toUpperCase(Locale.ROOT);
        return switch (type) {
            case "SCHEMA" -> Optional.of(schema(json, lineNumber));
            case "RECORD" -> Optional.of(record(json, lineNumber));
            case "STATE" -> Optional.of(state(json, lineNumber));
            case "ACTIVATE_VERSION" -> {
                log.debug("Ignoring ACTIVATE_VERSION for stream '{}' (line {})", json.path("stream").asText(""), lineNumber);
                yield Optional.empty();
            }
            default -> throw new SingerProtocolException(lineNumber, "unknown message type '" + type + "'");
        };
    }

    private static SingerMessage.SchemaMessage schema(JsonNode json, long lineNumber) {
        String stream = text(json, "stream", lineNumber);
        JsonNode schema = json.get("schema");
        if (schema == null || !schema.isObject()) {
            throw new SingerProtocolException(lineNumber, "SCHEMA message for '" + stream + "' has no schema object");
        }
        List<String> keys = new ArrayList<>();
        JsonNode keyProperties = json.get("key_properties");
        if (keyProperties != null && keyProperties.isArray()) {
            keyProperties.forEach(k -> keys.add(k.asText()));
        }
        return new SingerMessage.SchemaMessage(stream, schema, keys);
    }

    private static SingerMessage.RecordMessage record(JsonNode json, long lineNumber) {
        String stream = text(json, "stream", lineNumber);
        JsonNode record = json.get("record");
        if (record == null || !record.isObject()) {
            throw new SingerProtocolException(lineNumber, "RECORD message for '" + stream + "' has no record object");
        }
        return new SingerMessage.RecordMessage(stream, (ObjectNode) record);
    }

    private static SingerMessage.StateMessage state(JsonNode json, long lineNumber) {
        JsonNode value = json.get("value");
        if (value == null || value.isNull()) {
            throw new SingerProtocolException(lineNumber, "STATE message has no value");
        }
        return new SingerMessage.StateMessage(value);
    }

    private static String text(JsonNode json, String field, long lineNumber) {
        JsonNode node = json.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new SingerProtocolException(lineNumber, "missing or blank '" + field + "'");
        }
        return node.asText();
    }
}
