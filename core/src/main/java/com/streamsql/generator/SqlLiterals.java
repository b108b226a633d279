package com.streamsql.generator;

/**
 * Rendering of constant values as SQL literals.
 */
public final class SqlLiterals {

    private SqlLiterals() {
        // Utility class
    }

    /**
     * Renders a constant value.
     *
     * <p>Examples:
     * <pre>
     *   null     → NULL
     *   "abc"    → 'abc'
     *   "it's"   → 'it''s'
     *   true     → true
     *   42       → 42
     * </pre>
     *
     * @param value the value (may be null)
     * @return the literal text
     */
    public static String safeToString(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String || value instanceof Character) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (value instanceof Boolean) {
            return value.toString().toLowerCase();
        }
        return value.toString();
    }
}
