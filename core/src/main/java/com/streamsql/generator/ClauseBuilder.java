package com.streamsql.generator;

import com.streamsql.exception.ValidationException;
import com.streamsql.expression.Expression;
import com.streamsql.functions.FunctionCatalog;

import java.util.Objects;

/**
 * Base class for clause builders.
 *
 * <p>A clause builder renders the content of one clause (without its keyword)
 * from an expression tree. The template method {@link #build(Expression)} runs
 * the shared input checks, delegates to {@link #buildInternal(Expression)} and
 * rejects empty output. Typed failures propagate unchanged; any other runtime
 * failure is wrapped with the clause kind and the offending expression.
 *
 * <p>Builders hold no per-call state in fields and may be reused.
 */
public abstract class ClauseBuilder {

    /**
     * Clause kinds, used in diagnostics.
     */
    public enum ClauseKind {
        SELECT("Select"),
        WHERE("Where"),
        GROUP_BY("GroupBy"),
        HAVING("Having");

        private final String displayName;

        ClauseKind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    protected final ExpressionTranslator translator;

    protected ClauseBuilder(ExpressionTranslator translator) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
    }

    /**
     * Returns the clause this builder renders.
     *
     * @return the clause kind
     */
    public abstract ClauseKind kind();

    /**
     * Renders the clause content.
     *
     * @param expression the clause expression (usually a lambda body)
     * @return the clause text without its keyword
     * @throws IllegalArgumentException if the expression is null
     * @throws ValidationException if the expression violates a clause rule
     */
    public final String build(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException(kind().displayName() + " builder requires a non-null expression");
        }
        ExpressionValidation.validateExpression(expression, translator.config());
        validateSpecific(expression);

        String result;
        try {
            result = buildInternal(expression);
        } catch (IllegalArgumentException | IllegalStateException
                 | UnsupportedOperationException | ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to build " + kind().displayName()
                + " clause from expression. Expression: " + expression + ". Error: " + e.getMessage(), e);
        }

        if (result == null || result.isBlank()) {
            throw new IllegalStateException(kind().displayName() + " builder produced empty result. "
                + "This indicates an issue with the expression processing logic.");
        }
        return result;
    }

    /**
     * Renders the clause content for a validated expression.
     *
     * @param expression the expression
     * @return the clause text
     */
    protected abstract String buildInternal(Expression expression);

    /**
     * Clause-specific validation, run before rendering.
     *
     * @param expression the expression
     */
    protected void validateSpecific(Expression expression) {
        // no clause-specific rules by default
    }

    protected FunctionCatalog catalog() {
        return translator.catalog();
    }

    /**
     * Returns true for calls to catalog aggregates.
     *
     * @param methodName the method name
     * @return true for aggregates
     */
    protected boolean isAggregate(String methodName) {
        return catalog().isAggregateFunction(methodName);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind() + "]";
    }
}
