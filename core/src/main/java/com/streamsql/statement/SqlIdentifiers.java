package com.streamsql.statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Helpers for comparing rendered column references such as {@code o.Id},
 * {@code KEY->ID} or {@code `Region`}.
 */
final class SqlIdentifiers {

    private SqlIdentifiers() {
        // Utility class
    }

    /**
     * Returns the column part of a reference, dropping any arrow or dot qualifier.
     */
    static String unqualified(String expression) {
        if (expression == null || expression.isBlank()) {
            return "";
        }
        String value = expression.trim();
        int arrow = value.lastIndexOf("->");
        if (arrow >= 0) {
            value = value.substring(arrow + 2);
        }
        int dot = value.lastIndexOf('.');
        if (dot >= 0) {
            value = value.substring(dot + 1);
        }
        return value.trim();
    }

    /**
     * Returns the qualifier of a reference ({@code KEY} for {@code KEY->ID},
     * {@code o} for {@code o.Id}), or an empty string.
     */
    static String qualifier(String expression) {
        if (expression == null || expression.isBlank()) {
            return "";
        }
        String value = expression.trim();
        int arrow = value.lastIndexOf("->");
        if (arrow >= 0) {
            return value.substring(0, arrow).trim();
        }
        int dot = value.lastIndexOf('.');
        if (dot >= 0) {
            return value.substring(0, dot).trim();
        }
        return "";
    }

    /**
     * Upper-cases an identifier after removing a trailing {@code ()} and
     * surrounding backticks or double quotes.
     */
    static String normalize(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "";
        }
        String value = identifier.trim();
        if (value.endsWith("()")) {
            value = value.substring(0, value.length() - 2);
        }
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '`' && last == '`') || (first == '"' && last == '"')) {
                value = value.substring(1, value.length() - 1);
            }
        }
        return value.toUpperCase(Locale.ROOT);
    }

    static String normalizedColumn(String expression) {
        return normalize(unqualified(expression));
    }

    /**
     * Splits a comma list into trimmed, non-empty entries.
     */
    static List<String> split(String columns) {
        List<String> result = new ArrayList<>();
        if (columns == null || columns.isBlank()) {
            return result;
        }
        for (String part : columns.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
