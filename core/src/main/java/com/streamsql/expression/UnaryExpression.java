package com.streamsql.expression;

import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * Expression representing a unary operation.
 *
 * <p>{@link Operator#CONVERT} is an implicit conversion inserted by the host
 * compiler (e.g. int to long widening). Renderers look through it.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NOT("NOT", "logical negation"),
        NEGATE("-", "arithmetic negation"),
        CONVERT("", "implicit conversion");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression operand;
    private final ValueType valueType;

    public UnaryExpression(Operator operator, Expression operand, ValueType valueType) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand, ValueType.BOOLEAN);
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand, operand.valueType());
    }

    public static UnaryExpression convert(Expression operand, ValueType target) {
        return new UnaryExpression(Operator.CONVERT, operand, target);
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public Kind kind() {
        return Kind.UNARY;
    }

    @Override
    public ValueType valueType() {
        return valueType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand) && valueType == that.valueType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand, valueType);
    }

    @Override
    public String toString() {
        return operator == Operator.CONVERT ? "Convert(" + operand + ")" : operator.symbol() + " " + operand;
    }
}
