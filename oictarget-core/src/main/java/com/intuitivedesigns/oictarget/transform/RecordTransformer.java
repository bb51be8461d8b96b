/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.oictarget.error.DataValidationException;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link CompiledSchema} to raw records.
 *
 * <p>Stateless: the input record is never mutated and the same input always yields the same output.
 * Properties the schema does not declare are copied through in their original order.
 */
public final class RecordTransformer {

    public ObjectNode transform(ObjectNode record, CompiledSchema schema) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(schema, "schema");

        for (String field : schema.required()) {
            if (!record.has(field)) {
                throw new DataValidationException(field, "required property '" + field + "' is missing");
            }
        }

        ObjectNode out = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = record.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.set(e.getKey(), coerce(e.getKey(), e.getValue(), schema.rule(e.getKey())));
        }
        return out;
    }

    private static JsonNode coerce(String field, JsonNode value, CoercionRule rule) {
        if (value == null || value.isNull()) return value;
        if (value.isTextual() && value.asText().isEmpty()) return value;
        return rule.apply(field, value);
    }
}
