package com.streamsql.types;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.UnsupportedConstructException;

/**
 * Maps host value types to streaming-SQL type names.
 *
 * <p>Examples:
 * <pre>
 *   INT, SHORT → "INTEGER"
 *   LONG       → "BIGINT"
 *   DECIMAL    → "DECIMAL(18, 2)"
 *   UUID       → "VARCHAR"
 *   DATETIME   → "TIMESTAMP"
 * </pre>
 *
 * @see ValueType
 */
public final class TypeMapper {

    private TypeMapper() {
        // Utility class
    }

    /**
     * Converts a value type to its dialect type name.
     *
     * @param type the value type
     * @param config supplies the default decimal precision and scale
     * @return the dialect type name
     * @throws UnsupportedConstructException if the type has no scalar dialect form
     */
    public static String toKsqlType(ValueType type, CompilerConfig config) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        return switch (type) {
            case SHORT, INT -> "INTEGER";
            case LONG       -> "BIGINT";
            case FLOAT, DOUBLE -> "DOUBLE";
            case DECIMAL    -> new DecimalType(config.decimalPrecision(), config.decimalScale()).toSQL();
            case STRING, UUID -> "VARCHAR";
            case BOOLEAN    -> "BOOLEAN";
            case DATETIME   -> "TIMESTAMP";
            case BYTES      -> "BYTES";
            default -> throw new UnsupportedConstructException(
                "Type '" + type.name() + "' is not supported.", type.name());
        };
    }
}
