package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A lambda expression: ordered parameters plus a body.
 *
 * <p>Every clause of a query model (WHERE, SELECT, GROUP BY, HAVING, join
 * condition) is a lambda. Aggregate selectors such as {@code x -> x.Amount} in
 * {@code g.Sum(x -> x.Amount)} appear as lambda arguments of method calls.
 */
public final class Lambda implements Expression {

    private final List<Parameter> parameters;
    private final Expression body;

    public Lambda(List<Parameter> parameters, Expression body) {
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public static Lambda of(Parameter parameter, Expression body) {
        return new Lambda(List.of(parameter), body);
    }

    public static Lambda of(Parameter first, Parameter second, Expression body) {
        return new Lambda(List.of(first, second), body);
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Expression body() {
        return body;
    }

    @Override
    public Kind kind() {
        return Kind.LAMBDA;
    }

    /**
     * Returns the type of the body.
     */
    @Override
    public ValueType valueType() {
        return body.valueType();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Lambda)) return false;
        Lambda that = (Lambda) obj;
        return parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, body);
    }

    @Override
    public String toString() {
        String params = parameters.stream().map(Parameter::name).collect(Collectors.joining(", "));
        return "(" + params + ") => " + body;
    }
}
