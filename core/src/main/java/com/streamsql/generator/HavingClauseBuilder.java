package com.streamsql.generator;

import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.UnaryExpression;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renders the predicate of a HAVING clause.
 *
 * <p>Aggregates render by a fixed name table ({@code Average} → {@code AVG},
 * {@code LatestByOffset} → {@code LATEST_BY_OFFSET}, others upper-cased) over the
 * column selected by their lambda. Members render by their declared name.
 */
public final class HavingClauseBuilder extends ClauseBuilder {

    private static final Map<String, String> AGGREGATE_NAMES = Map.of(
        "LatestByOffset", "LATEST_BY_OFFSET",
        "EarliestByOffset", "EARLIEST_BY_OFFSET",
        "CollectList", "COLLECT_LIST",
        "CollectSet", "COLLECT_SET",
        "Average", "AVG",
        "CountDistinct", "COUNT_DISTINCT");

    private final Set<String> groupedColumns;

    public HavingClauseBuilder(ExpressionTranslator translator) {
        this(translator, Collections.emptySet());
    }

    /**
     * Creates a builder that also checks member references against the grouped columns.
     *
     * @param translator the expression translator
     * @param groupedColumns member names used as GROUP BY keys; empty disables the check
     */
    public HavingClauseBuilder(ExpressionTranslator translator, Set<String> groupedColumns) {
        super(translator);
        TreeSet<String> columns = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        columns.addAll(groupedColumns);
        this.groupedColumns = Collections.unmodifiableSet(columns);
    }

    @Override
    public ClauseKind kind() {
        return ClauseKind.HAVING;
    }

    @Override
    protected void validateSpecific(Expression expression) {
        ExpressionValidation.validateNoNestedAggregates(expression, catalog());
        if (!groupedColumns.isEmpty() && referencesUngroupedColumn(expression, false)) {
            throw new ValidationException(
                "HAVING clause can only reference aggregate functions or columns in GROUP BY clause");
        }
    }

    private boolean referencesUngroupedColumn(Expression expression, boolean insideAggregate) {
        boolean inside = insideAggregate
            || (expression instanceof MethodCall call && isAggregate(call.methodName()));
        if (!inside && expression instanceof MemberAccess member
                && !ExpressionUtils.isGroupKeyMember(member)
                && !groupedColumns.contains(member.member())) {
            return true;
        }
        for (Expression child : ExpressionUtils.children(expression)) {
            if (referencesUngroupedColumn(child, inside)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected String buildInternal(Expression expression) {
        return render(expression);
    }

    private String render(Expression expression) {
        switch (expression.kind()) {
            case LAMBDA:
                return render(((Lambda) expression).body());
            case METHOD_CALL: {
                MethodCall call = (MethodCall) expression;
                if (isAggregate(call.methodName())) {
                    return aggregate(call);
                }
                return translator.translateCall(call, member -> member.member());
            }
            case MEMBER_ACCESS:
                return ((MemberAccess) expression).member();
            case CONSTANT:
                return SqlLiterals.safeToString(((Constant) expression).value());
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) expression;
                String left = render(binary.left());
                String right = render(binary.right());
                if (binary.operator() == BinaryExpression.Operator.COALESCE) {
                    return "COALESCE(" + left + ", " + right + ")";
                }
                return "(" + left + " " + binary.operator().symbol() + " " + right + ")";
            }
            case UNARY: {
                UnaryExpression unary = (UnaryExpression) expression;
                if (unary.operator() == UnaryExpression.Operator.NOT) {
                    return "NOT (" + render(unary.operand()) + ")";
                }
                if (unary.operator() == UnaryExpression.Operator.NEGATE) {
                    return "-" + render(unary.operand());
                }
                return render(unary.operand());
            }
            default:
                return translator.translate(expression, member -> member.member());
        }
    }

    // ==================== Aggregates ====================

    private String aggregate(MethodCall call) {
        String function = AGGREGATE_NAMES.getOrDefault(call.methodName(),
            call.methodName().toUpperCase(Locale.ROOT));
        if ("Count".equals(call.methodName())) {
            if (call.arguments().size() >= 2) {
                throw new ValidationException(
                    "Conditional Count is not supported in KSQL HAVING clause. Use WHERE clause instead.");
            }
            return "COUNT(*)";
        }

        List<Expression> args = call.arguments();
        if (args.size() == 1 && args.get(0) instanceof Lambda lambda) {
            return function + "(" + columnFromLambda(lambda) + ")";
        }
        if (call.isStatic() && args.size() >= 2 && ExpressionUtils.unwrapConvert(args.get(1)) instanceof Lambda lambda) {
            return function + "(" + columnFromLambda(lambda) + ")";
        }
        if (call.receiver() instanceof MemberAccess member) {
            return function + "(" + member.member() + ")";
        }
        return function + "(*)";
    }

    private static String columnFromLambda(Lambda lambda) {
        if (ExpressionUtils.unwrapConvert(lambda.body()) instanceof MemberAccess member) {
            return member.member();
        }
        throw new ValidationException("Cannot extract column name from lambda: " + lambda);
    }
}
