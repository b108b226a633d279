package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * A ternary conditional {@code test ? ifTrue : ifFalse}, rendered as
 * {@code CASE WHEN test THEN ifTrue ELSE ifFalse END}.
 */
public final class Conditional implements Expression {

    private final Expression test;
    private final Expression ifTrue;
    private final Expression ifFalse;

    public Conditional(Expression test, Expression ifTrue, Expression ifFalse) {
        this.test = Objects.requireNonNull(test, "test must not be null");
        this.ifTrue = Objects.requireNonNull(ifTrue, "ifTrue must not be null");
        this.ifFalse = Objects.requireNonNull(ifFalse, "ifFalse must not be null");
    }

    public Expression test() {
        return test;
    }

    public Expression ifTrue() {
        return ifTrue;
    }

    public Expression ifFalse() {
        return ifFalse;
    }

    @Override
    public Kind kind() {
        return Kind.CONDITIONAL;
    }

    @Override
    public ValueType valueType() {
        return ifTrue.valueType();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Conditional)) return false;
        Conditional that = (Conditional) obj;
        return test.equals(that.test) && ifTrue.equals(that.ifTrue) && ifFalse.equals(that.ifFalse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, ifTrue, ifFalse);
    }

    @Override
    public String toString() {
        return "(" + test + " ? " + ifTrue + " : " + ifFalse + ")";
    }
}
