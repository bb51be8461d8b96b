/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.oictarget.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.intuitivedesigns.oictarget.error.DataValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Per-property coercion, selected from the declared JSON-schema type.
 *
 * <p>Rules never see JSON null or empty strings; {@link RecordTransformer} preserves those as received.
 */
public enum CoercionRule {

    STRING {
        @Override
        JsonNode apply(String field, JsonNode value) {
            return value;
        }
    },

    INTEGER {
        @Override
        JsonNode apply(String field, JsonNode value) {
            if (value.isIntegralNumber()) return value;
            BigDecimal decimal = toDecimal(field, value, "integer");
            try {
                BigInteger exact = decimal.toBigIntegerExact();
                return exact.bitLength() < 64
                        ? JsonNodeFactory.instance.numberNode(exact.longValue())
                        : JsonNodeFactory.instance.numberNode(exact);
            } catch (ArithmeticException e) {
                throw new DataValidationException(field, "expected integer but got '" + value.asText() + "'");
            }
        }
    },

    NUMBER {
        @Override
        JsonNode apply(String field, JsonNode value) {
            if (value.isNumber()) return value;
            double d = toDecimal(field, value, "number").doubleValue();
            if (Double.isInfinite(d)) {
                throw new DataValidationException(field, "number out of range: '" + value.asText() + "'");
            }
            return DoubleNode.valueOf(d);
        }
    },

    BOOLEAN {
        @Override
        JsonNode apply(String field, JsonNode value) {
            if (value.isBoolean()) return value;
            if (value.isTextual()) {
                String s = value.asText().trim().toLowerCase(Locale.ROOT);
                if (s.equals("true")) return BooleanNode.TRUE;
                if (s.equals("false")) return BooleanNode.FALSE;
            }
            throw new DataValidationException(field, "expected boolean but got '" + value.asText() + "'");
        }
    },

    DATE_TIME {
        @Override
        JsonNode apply(String field, JsonNode value) {
            if (!value.isTextual()) {
                throw new DataValidationException(field, "expected date-time string but got " + value.getNodeType());
            }
            Instant instant = parseInstant(value.asText().trim());
            if (instant == null) {
                throw new DataValidationException(field, "unparseable date-time '" + value.asText() + "'");
            }
            return TextNode.valueOf(DateTimeFormatter.ISO_INSTANT.format(instant));
        }
    },

    PASSTHROUGH {
        @Override
        JsonNode apply(String field, JsonNode value) {
            return value;
        }
    };

    abstract JsonNode apply(String field, JsonNode value);

    /**
     * Maps a JSON-schema {@code type} (and optional {@code format}) to a rule.
     */
    static CoercionRule forType(String type, String format) {
        if (type == null) return PASSTHROUGH;
        return switch (type) {
            case "string" -> "date-time".equals(format) ? DATE_TIME : STRING;
            case "integer" -> INTEGER;
            case "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            default -> PASSTHROUGH;
        };
    }

    private static BigDecimal toDecimal(String field, JsonNode value, String expected) {
        if (value.isNumber()) return value.decimalValue();
        if (!value.isTextual()) {
            throw new DataValidationException(field, "expected " + expected + " but got " + value.getNodeType());
        }
        try {
            // BigDecimal rejects hex, NaN/Infinity and suffixes like "10f"
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new DataValidationException(field, "expected " + expected + " but got '" + value.asText() + "'");
        }
    }

    private static Instant parseInstant(String s) {
        try {
            return OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
