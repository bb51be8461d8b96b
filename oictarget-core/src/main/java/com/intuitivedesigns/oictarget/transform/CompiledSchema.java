/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.oictarget.error.DataValidationException;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Coercion rules resolved once from a stream's SCHEMA message.
 */
public final class CompiledSchema {

    private final JsonNode source;
    private final Map<String, CoercionRule> rules;
    private final Set<String> required;

    private CompiledSchema(JsonNode source, Map<String, CoercionRule> rules, Set<String> required) {
        this.source = source;
        this.rules = Collections.unmodifiableMap(rules);
        this.required = Collections.unmodifiableSet(required);
    }

    /**
     * @throws DataValidationException if the schema is not a JSON object
     */
    public static CompiledSchema compile(JsonNode schema) {
        Objects.requireNonNull(schema, "schema");
        if (!schema.isObject()) {
            throw new DataValidationException("schema", "schema must be a JSON object");
        }

        Map<String, CoercionRule> rules = new LinkedHashMap<>();
        JsonNode properties = schema.get("properties");
        if (properties != null && properties.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                rules.put(e.getKey(), ruleFor(e.getValue()));
            }
        }

        Set<String> required = new LinkedHashSet<>();
        JsonNode req = schema.get("required");
        if (req != null && req.isArray()) {
            for (JsonNode n : req) {
                if (n.isTextual()) required.add(n.asText());
            }
        }

        return new CompiledSchema(schema.deepCopy(), rules, required);
    }

    static CoercionRule ruleFor(JsonNode property) {
        if (property == null || !property.isObject()) return CoercionRule.PASSTHROUGH;

        JsonNode format = property.get("format");
        String fmt = (format != null && format.isTextual()) ? format.asText() : null;

        JsonNode type = property.get("type");
        if (type != null) {
            return CoercionRule.forType(firstNonNullType(type), fmt);
        }

        // {"anyOf": [{"type": "null"}, {"type": "string", "format": "date-time"}]}
        JsonNode anyOf = property.get("anyOf");
        if (anyOf != null && anyOf.isArray()) {
            for (JsonNode branch : anyOf) {
                CoercionRule rule = ruleFor(branch);
                JsonNode branchType = branch.get("type");
                boolean nullBranch = branchType != null && "null".equals(firstNonNullType(branchType));
                if (!nullBranch && branchType != null) return rule;
            }
        }
        return CoercionRule.PASSTHROUGH;
    }

    private static String firstNonNullType(JsonNode type) {
        if (type.isTextual()) return type.asText();
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && !"null".equals(t.asText())) return t.asText();
            }
            return "null";
        }
        return null;
    }

    public CoercionRule rule(String field) {
        return rules.getOrDefault(field, CoercionRule.PASSTHROUGH);
    }

    public Map<String, CoercionRule> rules() {
        return rules;
    }

    public Set<String> required() {
        return required;
    }

    /**
     * The schema document this was compiled from; used to detect schema changes.
     */
    public JsonNode source() {
        return source;
    }

    public boolean sameSource(JsonNode other) {
        return source.equals(other);
    }
}
