/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.singer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * One parsed line of Singer input.
 */
public interface SingerMessage {

    record SchemaMessage(String stream, JsonNode schema, List<String> keyProperties) implements SingerMessage {
        public SchemaMessage {
            Objects.requireNonNull(stream, "stream");
            Objects.requireNonNull(schema, "schema");
            keyProperties = (keyProperties == null) ? List.of() : List.copyOf(keyProperties);
        }
    }

    record RecordMessage(String stream, ObjectNode record) implements SingerMessage {
        public RecordMessage {
            Objects.requireNonNull(stream, "stream");
            Objects.requireNonNull(record, "record");
        }
    }

    record StateMessage(JsonNode value) implements SingerMessage {
        public StateMessage {
            Objects.requireNonNull(value, "value");
        }
    }
}
