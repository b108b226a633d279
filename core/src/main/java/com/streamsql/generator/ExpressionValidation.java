package com.streamsql.generator;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.Conditional;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.functions.FunctionCatalog;

/**
 * Structural checks shared by the translator and the clause builders.
 */
public final class ExpressionValidation {

    private ExpressionValidation() {
        // Utility class
    }

    /**
     * Rejects null, overly deep and overly large expression trees.
     *
     * @param expression the expression
     * @param config supplies the depth and node limits
     * @throws IllegalArgumentException if the expression is null
     * @throws ValidationException if a limit is exceeded
     */
    public static void validateExpression(Expression expression, CompilerConfig config) {
        if (expression == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        int maxDepth = config.maxExpressionDepth();
        // the root sits at depth 0
        if (ExpressionUtils.depth(expression) - 1 > maxDepth) {
            throw new ValidationException("Expression depth exceeds maximum allowed depth of " + maxDepth + ". "
                + "Consider simplifying the expression or breaking it into multiple operations.");
        }
        int maxNodes = config.maxExpressionNodes();
        int nodes = ExpressionUtils.nodeCount(expression);
        if (nodes > maxNodes) {
            throw new ValidationException("Expression complexity exceeds maximum allowed nodes of " + maxNodes + ". "
                + "Current expression has " + nodes + " nodes. "
                + "Consider simplifying the expression or breaking it into multiple operations.");
        }
    }

    /**
     * Requires both branches of a conditional to have the same value type.
     *
     * @param conditional the conditional
     */
    public static void validateConditionalTypes(Conditional conditional) {
        if (conditional.ifTrue().valueType() != conditional.ifFalse().valueType()) {
            throw new ValidationException("CASE expression type mismatch: "
                + conditional.ifTrue().valueType() + " and " + conditional.ifFalse().valueType());
        }
    }

    /**
     * Rejects aggregate calls nested inside other aggregate calls.
     *
     * @param expression the expression
     * @param catalog decides which calls are aggregates
     */
    public static void validateNoNestedAggregates(Expression expression, FunctionCatalog catalog) {
        if (catalog.hasNestedAggregates(expression)) {
            throw new ValidationException("Nested aggregate functions are not supported");
        }
    }
}
