package com.streamsql.types;

/**
 * Static value type carried by every expression node.
 *
 * <p>Value types describe the host-side type of a member, constant or call result.
 * Each type belongs to a {@link Category} that function argument validation works on.
 *
 * <p>Examples:
 * <pre>
 *   INT, SHORT          → Category.INT
 *   LONG                → Category.BIGINT
 *   FLOAT, DOUBLE       → Category.DOUBLE
 *   UUID, BYTES, STRUCT → Category.STRUCT
 * </pre>
 */
public enum ValueType {
    BYTE(Category.UNKNOWN),
    SHORT(Category.INT),
    INT(Category.INT),
    LONG(Category.BIGINT),
    FLOAT(Category.DOUBLE),
    DOUBLE(Category.DOUBLE),
    DECIMAL(Category.DECIMAL),
    CHAR(Category.STRING),
    STRING(Category.STRING),
    BOOLEAN(Category.BOOLEAN),
    DATETIME(Category.DATETIME),
    UUID(Category.STRUCT),
    BYTES(Category.STRUCT),
    ENUM(Category.STRUCT),
    COLLECTION(Category.STRUCT),
    GROUPING(Category.STRUCT),
    STRUCT(Category.STRUCT),
    OBJECT(Category.STRUCT);

    /**
     * Argument type categories used by function allow-lists.
     */
    public enum Category {
        INT, BIGINT, DOUBLE, DECIMAL, STRING, BOOLEAN, DATETIME, STRUCT, UNKNOWN
    }

    private final Category category;

    ValueType(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isNumeric() {
        return category == Category.INT || category == Category.BIGINT
            || category == Category.DOUBLE || category == Category.DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATETIME;
    }
}
