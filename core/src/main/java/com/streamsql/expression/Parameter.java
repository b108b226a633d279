package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * A lambda parameter, such as {@code o} in {@code o -> o.Amount > 10}.
 *
 * <p>Parameters are identified by name. Alias maps used by the clause builders
 * are keyed by parameter name, so two parameters with the same name denote the
 * same source.
 */
public final class Parameter implements Expression {

    private final String name;
    private final ValueType valueType;

    public Parameter(String name, ValueType valueType) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
    }

    /**
     * Creates a record-typed parameter.
     *
     * @param name the parameter name
     * @return the parameter
     */
    public static Parameter of(String name) {
        return new Parameter(name, ValueType.STRUCT);
    }

    /**
     * Creates a grouping parameter ({@code g} in {@code g -> new { g.Key, Total = g.Sum(...) }}).
     *
     * @param name the parameter name
     * @return the parameter
     */
    public static Parameter grouping(String name) {
        return new Parameter(name, ValueType.GROUPING);
    }

    public String name() {
        return name;
    }

    public boolean isGrouping() {
        return valueType == ValueType.GROUPING;
    }

    @Override
    public Kind kind() {
        return Kind.PARAMETER;
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Parameter)) return false;
        return name.equals(((Parameter) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
