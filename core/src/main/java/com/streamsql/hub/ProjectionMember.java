package com.streamsql.hub;

import com.streamsql.expression.Expression;
import com.streamsql.types.ValueType;

import java.util.Objects;

/**
 * One output member of a projection with its classification.
 *
 * @param alias the output member name
 * @param expression the bound expression
 * @param kind the classification
 * @param resolvedColumnName the upper-cased column this member maps to, or null
 * @param aggregateFunctionName the aggregate method name for {@link ProjectionMemberKind#AGGREGATE}, else null
 * @param sourceMemberPath the canonical source path read by the member, or null
 * @param resultType the member's value type
 * @param nullable true if the member may be null
 */
public record ProjectionMember(
        String alias,
        Expression expression,
        ProjectionMemberKind kind,
        String resolvedColumnName,
        String aggregateFunctionName,
        String sourceMemberPath,
        ValueType resultType,
        boolean nullable) {

    public ProjectionMember {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
