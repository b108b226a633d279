package com.streamsql.statement;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.Parameter;
import com.streamsql.expression.UnaryExpression;
import com.streamsql.generator.SqlLiterals;
import com.streamsql.logical.QueryModel;
import com.streamsql.logical.SourceDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders {@code FROM L [o] [JOIN R i WITHIN n SECONDS ON (...)]}.
 *
 * <p>The alias-to-source map always records the primary source under {@code o},
 * whether or not the alias is rendered, so later passes can reason about column
 * ownership.
 */
final class FromClauseBuilder {

    static final String PRIMARY_ALIAS = "o";
    static final String JOIN_ALIAS = "i";

    /**
     * Rendered FROM clause plus the alias-to-source-name map in source order.
     */
    record FromClause(String text, Map<String, String> aliasToSource) {
    }

    private final CompilerConfig config;

    FromClauseBuilder(CompilerConfig config) {
        this.config = config;
    }

    /**
     * Validates the source list of a model.
     *
     * @throws ValidationException if no source is declared
     * @throws UnsupportedOperationException if more than two sources are declared
     */
    static void validateSources(QueryModel model) {
        List<SourceDescriptor> sources = model.sources();
        if (sources.isEmpty()) {
            throw new ValidationException("Source types are required", "FROM", model.toString(),
                "Declare at least one source");
        }
        if (sources.size() > 2) {
            throw new UnsupportedOperationException("Only up to 2 tables are supported in JOIN");
        }
    }

    FromClause build(QueryModel model, Function<SourceDescriptor, String> resolver, boolean aliasPrimary) {
        validateSources(model);
        List<SourceDescriptor> sources = model.sources();

        Map<String, String> aliasToSource = new LinkedHashMap<>();
        StringBuilder sb = new StringBuilder();
        String left = resolver.apply(sources.get(0));
        aliasToSource.put(PRIMARY_ALIAS, left);
        String leftAlias = null;
        sb.append("FROM ").append(left);
        if (aliasPrimary) {
            leftAlias = PRIMARY_ALIAS;
            sb.append(' ').append(leftAlias);
        }

        if (sources.size() > 1) {
            String right = resolver.apply(sources.get(1));
            aliasToSource.put(JOIN_ALIAS, right);
            sb.append(" JOIN ").append(right).append(' ').append(JOIN_ALIAS);

            Lambda condition = model.joinCondition().orElseThrow(() -> new ValidationException(
                "Join condition required for two table join", "JOIN", left + ", " + right,
                "Supply an equality predicate between the two sources"));

            sb.append(" WITHIN ").append(withinSeconds(model)).append(" SECONDS");

            if (leftAlias == null) {
                throw new ValidationException("Primary source alias missing for join condition.");
            }
            sb.append(" ON ").append(new JoinConditionRenderer(condition, leftAlias, JOIN_ALIAS).render());
        }
        return new FromClause(sb.toString(), Collections.unmodifiableMap(aliasToSource));
    }

    private int withinSeconds(QueryModel model) {
        Integer explicit = model.withinSeconds().orElse(null);
        if (explicit != null && explicit > 0) {
            return explicit;
        }
        if (!model.forbidDefaultWithin()) {
            return config.defaultWithinSeconds();
        }
        throw new ValidationException(
            "Stream-Stream JOIN requires explicit Within(...) when default is disabled.",
            "JOIN", model.toString(), "Call within(seconds) on the model");
    }

    /**
     * Renders a join predicate, qualifying each member by the side its parameter belongs to.
     */
    private static final class JoinConditionRenderer {

        private final Lambda condition;
        private final String leftAlias;
        private final String rightAlias;

        JoinConditionRenderer(Lambda condition, String leftAlias, String rightAlias) {
            this.condition = condition;
            this.leftAlias = leftAlias;
            this.rightAlias = rightAlias;
        }

        String render() {
            return render(condition.body());
        }

        private String render(Expression expression) {
            switch (expression.kind()) {
                case BINARY: {
                    BinaryExpression binary = (BinaryExpression) expression;
                    if (binary.operator() == BinaryExpression.Operator.EQUAL) {
                        return "(" + render(binary.left()) + " = " + render(binary.right()) + ")";
                    }
                    if (binary.operator() == BinaryExpression.Operator.AND) {
                        return render(binary.left()) + " AND " + render(binary.right());
                    }
                    throw new ValidationException("JOIN condition supports only equality predicates joined by AND",
                        "JOIN", expression.toString(), null);
                }
                case MEMBER_ACCESS:
                    return qualified((MemberAccess) expression);
                case UNARY:
                    return render(((UnaryExpression) expression).operand());
                case CONSTANT:
                    return SqlLiterals.safeToString(((Constant) expression).value());
                default:
                    throw new ValidationException("Unsupported expression in JOIN condition: " + expression.kind(),
                        "JOIN", expression.toString(), null);
            }
        }

        private String qualified(MemberAccess member) {
            List<Parameter> parameters = condition.parameters();
            if (ExpressionUtils.memberRoot(member) instanceof Parameter parameter) {
                if (!parameters.isEmpty() && parameter.equals(parameters.get(0))) {
                    return leftAlias + "." + member.member();
                }
                if (parameters.size() > 1 && parameter.equals(parameters.get(1))) {
                    return rightAlias + "." + member.member();
                }
            }
            throw new ValidationException("Unqualified column access in JOIN condition is not allowed.",
                "JOIN", member.toString(), "Reference columns through the join lambda parameters");
        }
    }
}
