package com.williamcallahan.film_rating_aggregator.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }

    public static boolean isEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    /**
     * Reads a textual field from a JSON node, treating JSON null, blanks and the
     * provider placeholder {@code "N/A"} as absent.
     */
    public static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String text = node.get(field).asText();
        if (!hasText(text) || "N/A".equalsIgnoreCase(text.trim())) {
            return null;
        }
        return text.trim();
    }

    /**
     * Reads an integer field that providers sometimes send as a string.
     */
    public static Integer intOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value.isIntegralNumber()) {
            return value.asInt();
        }
        String text = textOrNull(node, field);
        if (text == null) {
            return null;
        }
        String digits = text.replaceAll("[^0-9]", "");
        if (digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        return Integer.parseInt(digits);
    }
}
