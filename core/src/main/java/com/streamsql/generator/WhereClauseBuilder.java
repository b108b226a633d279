package com.streamsql.generator;

import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MemberBinding;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.expression.UnaryExpression;
import com.streamsql.types.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the predicate of a WHERE clause (or of a JOIN filter).
 *
 * <p>Translation rules:
 * <pre>
 *   o.Name == null                 → o.Name IS NULL
 *   o.IsActive                     → (o.IsActive = true)
 *   !o.IsActive                    → (o.IsActive = false)
 *   o.Discount.HasValue            → o.Discount IS NOT NULL
 *   o.Name.Contains("x")           → INSTR(o.Name, 'x') > 0
 *   ids.Contains(o.Id)             → o.Id IN (1, 2)
 *   new {a, b} == new {c, d}       → (a = c AND b = d)
 * </pre>
 *
 * <p>Member references render as {@code alias.Member} when the root parameter is
 * mapped, else as the bare member name; case is preserved.
 */
public final class WhereClauseBuilder extends ClauseBuilder {

    private final Map<String, String> parameterAliases;

    public WhereClauseBuilder(ExpressionTranslator translator) {
        this(translator, Collections.emptyMap());
    }

    public WhereClauseBuilder(ExpressionTranslator translator, Map<String, String> parameterAliases) {
        super(translator);
        this.parameterAliases = Collections.unmodifiableMap(new LinkedHashMap<>(parameterAliases));
    }

    @Override
    public ClauseKind kind() {
        return ClauseKind.WHERE;
    }

    @Override
    protected void validateSpecific(Expression expression) {
        if (catalog().containsAggregate(expression)) {
            throw new ValidationException(
                "Aggregate functions are not allowed in WHERE clause. Use HAVING clause instead.");
        }
    }

    @Override
    protected String buildInternal(Expression expression) {
        return predicate(expression);
    }

    // ==================== Predicates ====================

    private String predicate(Expression expression) {
        switch (expression.kind()) {
            case LAMBDA:
                return predicate(((Lambda) expression).body());
            case BINARY:
                return binaryPredicate((BinaryExpression) expression);
            case UNARY: {
                UnaryExpression unary = (UnaryExpression) expression;
                if (unary.operator() == UnaryExpression.Operator.NOT) {
                    return negation(unary.operand());
                }
                return predicate(unary.operand());
            }
            case MEMBER_ACCESS:
                return memberPredicate((MemberAccess) expression);
            case METHOD_CALL:
                return methodPredicate((MethodCall) expression);
            default:
                return value(expression);
        }
    }

    private String binaryPredicate(BinaryExpression binary) {
        BinaryExpression.Operator op = binary.operator();
        boolean equality = op == BinaryExpression.Operator.EQUAL || op == BinaryExpression.Operator.NOT_EQUAL;

        if (equality && (isNullConstant(binary.left()) || isNullConstant(binary.right()))) {
            Expression operand = isNullConstant(binary.left()) ? binary.right() : binary.left();
            return value(operand) + " IS " + (op == BinaryExpression.Operator.NOT_EQUAL ? "NOT " : "") + "NULL";
        }
        if (op == BinaryExpression.Operator.EQUAL
                && binary.left() instanceof ObjectInit left
                && binary.right() instanceof ObjectInit right) {
            return compositeKeyEquality(left, right);
        }
        if (op.isLogical()) {
            return "(" + predicate(binary.left()) + " " + op.symbol() + " " + predicate(binary.right()) + ")";
        }
        return value(binary);
    }

    private String compositeKeyEquality(ObjectInit left, ObjectInit right) {
        List<MemberBinding> leftBindings = left.bindings();
        List<MemberBinding> rightBindings = right.bindings();
        if (leftBindings.size() != rightBindings.size()) {
            throw new ValidationException("Composite key expressions must have the same number of properties");
        }
        List<String> conditions = new ArrayList<>();
        for (int i = 0; i < leftBindings.size(); i++) {
            conditions.add(value(leftBindings.get(i).expression())
                + " = " + value(rightBindings.get(i).expression()));
        }
        return conditions.size() == 1 ? conditions.get(0) : "(" + String.join(" AND ", conditions) + ")";
    }

    private String negation(Expression operand) {
        Expression node = ExpressionUtils.unwrapConvert(operand);
        if (node instanceof MemberAccess member) {
            MemberAccess nullableValue = nullableBooleanValue(member);
            if (nullableValue != null) {
                return "(" + memberName(nullableValue) + " = false)";
            }
            if (member.valueType() == ValueType.BOOLEAN) {
                return "(" + memberName(member) + " = false)";
            }
        }
        if (node instanceof MethodCall call && isCollectionContains(call)) {
            return inList(call, true);
        }
        return "NOT (" + predicate(node) + ")";
    }

    private String memberPredicate(MemberAccess member) {
        MemberAccess nullableValue = nullableBooleanValue(member);
        if (nullableValue != null) {
            return "(" + memberName(nullableValue) + " = true)";
        }
        if ("HasValue".equals(member.member()) && member.target() instanceof MemberAccess inner) {
            return memberName(inner) + " IS NOT NULL";
        }
        String name = memberName(member);
        if (member.valueType() == ValueType.BOOLEAN) {
            return "(" + name + " = true)";
        }
        return name;
    }

    /**
     * Returns the nullable boolean member for {@code x.Flag.Value}, else null.
     */
    private static MemberAccess nullableBooleanValue(MemberAccess member) {
        if ("Value".equals(member.member())
                && member.target() instanceof MemberAccess inner
                && inner.valueType() == ValueType.BOOLEAN) {
            return inner;
        }
        return null;
    }

    private String methodPredicate(MethodCall call) {
        boolean instanceWithOneArg = call.receiver() != null && call.arguments().size() == 1;
        switch (call.methodName()) {
            case "Contains":
                if (isCollectionContains(call)) {
                    return inList(call, false);
                }
                if (instanceWithOneArg) {
                    return "INSTR(" + value(call.receiver()) + ", " + value(call.arguments().get(0)) + ") > 0";
                }
                break;
            case "StartsWith":
                if (instanceWithOneArg) {
                    return "STARTS_WITH(" + value(call.receiver()) + ", " + value(call.arguments().get(0)) + ")";
                }
                break;
            case "EndsWith":
                if (instanceWithOneArg) {
                    return "ENDS_WITH(" + value(call.receiver()) + ", " + value(call.arguments().get(0)) + ")";
                }
                break;
            default:
                break;
        }
        return translator.translateCall(call, this::memberName);
    }

    private static boolean isCollectionContains(MethodCall call) {
        if (!"Contains".equals(call.methodName())) {
            return false;
        }
        if (call.receiver() == null && call.arguments().size() == 2) {
            return call.arguments().get(0).valueType() == ValueType.COLLECTION;
        }
        return call.receiver() != null && call.arguments().size() == 1
            && call.receiver().valueType() == ValueType.COLLECTION;
    }

    private String inList(MethodCall call, boolean negated) {
        Expression values = call.receiver() == null ? call.arguments().get(0) : call.receiver();
        Expression target = call.receiver() == null ? call.arguments().get(1) : call.arguments().get(0);
        if (!(values instanceof Constant constant) || !constant.isCollection()) {
            return translator.translateCall(call, this::memberName);
        }
        List<?> items = (List<?>) constant.value();
        String joined = items.stream().map(SqlLiterals::safeToString).collect(Collectors.joining(", "));
        return value(target) + (negated ? " NOT IN (" : " IN (") + joined + ")";
    }

    // ==================== Values ====================

    private String value(Expression expression) {
        Expression node = ExpressionUtils.unwrapConvert(expression);
        switch (node.kind()) {
            case MEMBER_ACCESS:
                return memberName((MemberAccess) node);
            case CONSTANT:
                return SqlLiterals.safeToString(((Constant) node).value());
            case METHOD_CALL:
                return translator.translateCall((MethodCall) node, this::memberName);
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) node;
                if (binary.operator().isLogical()) {
                    return binaryPredicate(binary);
                }
                if (binary.operator() == BinaryExpression.Operator.COALESCE) {
                    return "COALESCE(" + value(binary.left()) + ", " + value(binary.right()) + ")";
                }
                return "(" + value(binary.left()) + " " + binary.operator().symbol()
                    + " " + value(binary.right()) + ")";
            }
            default:
                return translator.translate(node, this::memberName);
        }
    }

    private String memberName(MemberAccess member) {
        Expression root = ExpressionUtils.memberRoot(member);
        if (root instanceof Parameter parameter) {
            String alias = parameterAliases.get(parameter.name());
            if (alias != null) {
                return alias + "." + member.member();
            }
        }
        return member.member();
    }

    private static boolean isNullConstant(Expression expression) {
        return expression instanceof Constant constant && constant.isNull();
    }
}
