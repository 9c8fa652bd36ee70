package com.example.pipelinesync.service.mapper;

import com.example.pipelinesync.exception.RecordValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Field readers shared by the Source mappers. Missing or null fields read as {@code null};
 * present but malformed fields raise {@link RecordValidationException}.
 */
final class SourceFields {

    private SourceFields() {
    }

    static long requireId(JsonNode raw) {
        JsonNode id = raw.get("id");
        if (id == null || !id.canConvertToLong()) {
            throw new RecordValidationException("Source record has no numeric id: " + abbreviate(raw));
        }
        return id.asLong();
    }

    static String text(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Reads a status that is either a plain string or an object with a {@code name}.
     */
    static String nameOrText(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isObject() ? text(node, "name") : node.asText();
    }

    static Long longValue(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToLong() && !(node.isTextual() && node.asText().matches("-?\\d+"))) {
            throw new RecordValidationException(String.format("Field %s is not an id: %s", field, node));
        }
        return node.asLong();
    }

    static Boolean bool(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        return node == null || node.isNull() ? null : node.asBoolean();
    }

    static BigDecimal decimal(JsonNode raw, String field) {
        JsonNode node = raw.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            throw new RecordValidationException(String.format("Field %s is not a number: %s", field, node), e);
        }
    }

    static Instant instant(JsonNode raw, String field) {
        String value = text(raw, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return Instant.parse(value.endsWith("Z") ? value : value + "Z");
            } catch (DateTimeParseException e) {
                throw new RecordValidationException(String.format("Field %s is not a timestamp: %s", field, value), e);
            }
        }
    }

    private static String abbreviate(JsonNode raw) {
        String text = raw.toString();
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
