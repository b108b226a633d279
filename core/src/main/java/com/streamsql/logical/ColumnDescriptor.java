package com.streamsql.logical;

import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * A column of a source or result type.
 *
 * @param name the declared member name
 * @param valueType the member's value type
 * @param key true if the column is part of the message key
 * @param precision declared decimal precision, or null
 * @param scale declared decimal scale, or null
 */
public record ColumnDescriptor(String name, ValueType valueType, boolean key, Integer precision, Integer scale) {

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static ColumnDescriptor of(String name, ValueType valueType) {
        return new ColumnDescriptor(name, valueType, false, null, null);
    }

    public static ColumnDescriptor key(String name, ValueType valueType) {
        return new ColumnDescriptor(name, valueType, true, null, null);
    }

    public static ColumnDescriptor decimal(String name, int precision, int scale) {
        return new ColumnDescriptor(name, ValueType.DECIMAL, false, precision, scale);
    }
}
