package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A constant value captured from the query DSL.
 *
 * <p>A constant of type {@link ValueType#COLLECTION} holds a {@link Collection}
 * and renders as an IN list when used as the receiver of {@code Contains}.
 */
public final class Constant implements Expression {

    private final Object value;
    private final ValueType valueType;

    public Constant(Object value, ValueType valueType) {
        this.value = value instanceof Collection ? List.copyOf((Collection<?>) value) : value;
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
    }

    public static Constant of(String value) {
        return new Constant(value, ValueType.STRING);
    }

    public static Constant of(int value) {
        return new Constant(value, ValueType.INT);
    }

    public static Constant of(long value) {
        return new Constant(value, ValueType.LONG);
    }

    public static Constant of(double value) {
        return new Constant(value, ValueType.DOUBLE);
    }

    public static Constant of(boolean value) {
        return new Constant(value, ValueType.BOOLEAN);
    }

    public static Constant nullValue(ValueType valueType) {
        return new Constant(null, valueType);
    }

    public static Constant collection(Collection<?> values) {
        return new Constant(Objects.requireNonNull(values, "values must not be null"), ValueType.COLLECTION);
    }

    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isCollection() {
        return value instanceof Collection;
    }

    @Override
    public Kind kind() {
        return Kind.CONSTANT;
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        Constant that = (Constant) obj;
        return Objects.equals(value, that.value) && valueType == that.valueType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, valueType);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
