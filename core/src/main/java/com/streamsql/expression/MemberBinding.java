package com.streamsql.expression;

import java.util.Objects;

/**
 * One member assignment of an {@link ObjectInit}: {@code Total = g.Sum(x => x.Amount)}.
 *
 * @param member the output member name
 * @param expression the bound expression
 */
public record MemberBinding(String member, Expression expression) {

    public MemberBinding {
        Objects.requireNonNull(member, "member must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
