package com.streamsql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Utility methods for classifying and inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /** Member name that denotes the grouping key of a grouping parameter. */
    public static final String GROUP_KEY_MEMBER = "Key";

    /**
     * Returns the direct child nodes of an expression in evaluation order.
     *
     * @param expr the expression
     * @return the children (empty for leaves)
     */
    public static List<Expression> children(Expression expr) {
        switch (expr.kind()) {
            case METHOD_CALL: {
                MethodCall call = (MethodCall) expr;
                List<Expression> result = new ArrayList<>(call.arguments().size() + 1);
                if (call.receiver() != null) {
                    result.add(call.receiver());
                }
                result.addAll(call.arguments());
                return result;
            }
            case MEMBER_ACCESS:
                return List.of(((MemberAccess) expr).target());
            case LAMBDA:
                return List.of(((Lambda) expr).body());
            case UNARY:
                return List.of(((UnaryExpression) expr).operand());
            case BINARY: {
                BinaryExpression bin = (BinaryExpression) expr;
                return List.of(bin.left(), bin.right());
            }
            case CONDITIONAL: {
                Conditional cond = (Conditional) expr;
                return List.of(cond.test(), cond.ifTrue(), cond.ifFalse());
            }
            case OBJECT_INIT: {
                List<Expression> result = new ArrayList<>();
                for (MemberBinding binding : ((ObjectInit) expr).bindings()) {
                    result.add(binding.expression());
                }
                return result;
            }
            case CONSTANT:
            case PARAMETER:
                return Collections.emptyList();
            default:
                throw new IllegalStateException("Unknown expression kind: " + expr.kind());
        }
    }

    /**
     * Strips implicit conversions.
     *
     * @param expr the expression
     * @return the innermost non-conversion expression
     */
    public static Expression unwrapConvert(Expression expr) {
        Expression current = expr;
        while (current instanceof UnaryExpression unary
                && unary.operator() == UnaryExpression.Operator.CONVERT) {
            current = unary.operand();
        }
        return current;
    }

    /**
     * Returns the nesting depth of an expression; a leaf has depth 1.
     *
     * @param expr the expression
     * @return the depth
     */
    public static int depth(Expression expr) {
        int max = 0;
        for (Expression child : children(expr)) {
            max = Math.max(max, depth(child));
        }
        return max + 1;
    }

    /**
     * Returns the number of nodes in an expression tree.
     *
     * @param expr the expression
     * @return the node count
     */
    public static int nodeCount(Expression expr) {
        int count = 1;
        for (Expression child : children(expr)) {
            count += nodeCount(child);
        }
        return count;
    }

    /**
     * Returns true if any node of the tree is a method call whose name matches.
     *
     * @param expr the expression
     * @param isAggregate predicate over method names
     * @return true if an aggregate call is present
     */
    public static boolean containsCall(Expression expr, Predicate<String> isAggregate) {
        if (expr instanceof MethodCall call && isAggregate.test(call.methodName())) {
            return true;
        }
        for (Expression child : children(expr)) {
            if (containsCall(child, isAggregate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if an aggregate call appears inside the arguments of another
     * aggregate call.
     *
     * @param expr the expression
     * @param isAggregate predicate over method names
     * @return true if aggregates are nested
     */
    public static boolean hasNestedCalls(Expression expr, Predicate<String> isAggregate) {
        return hasNestedCalls(expr, isAggregate, 0);
    }

    private static boolean hasNestedCalls(Expression expr, Predicate<String> isAggregate, int depth) {
        int next = depth;
        if (expr instanceof MethodCall call && isAggregate.test(call.methodName())) {
            if (depth > 0) {
                return true;
            }
            next = depth + 1;
        }
        for (Expression child : children(expr)) {
            if (hasNestedCalls(child, isAggregate, next)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first parameter found in a depth-first walk that satisfies the
     * predicate.
     *
     * @param expr the expression
     * @param predicate the parameter filter
     * @return the parameter, or null
     */
    public static Parameter findParameter(Expression expr, Predicate<Parameter> predicate) {
        if (expr instanceof Parameter param && predicate.test(param)) {
            return param;
        }
        if (expr instanceof Lambda lambda) {
            for (Parameter param : lambda.parameters()) {
                if (predicate.test(param)) {
                    return param;
                }
            }
        }
        for (Expression child : children(expr)) {
            Parameter found = findParameter(child, predicate);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Returns true for {@code g.Key} where {@code g} is a parameter.
     *
     * @param expr the expression
     * @return true for the grouping key object itself
     */
    public static boolean isGroupKeyObject(Expression expr) {
        return expr instanceof MemberAccess member
            && GROUP_KEY_MEMBER.equals(member.member())
            && member.target() instanceof Parameter;
    }

    /**
     * Returns true for {@code g.Key} or {@code g.Key.X}.
     *
     * @param expr the expression
     * @return true for group key references
     */
    public static boolean isGroupKeyMember(Expression expr) {
        if (!(expr instanceof MemberAccess member)) {
            return false;
        }
        if (isGroupKeyObject(member)) {
            return true;
        }
        return isGroupKeyObject(member.target());
    }

    /**
     * Returns the member names from the root parameter down to the given member.
     *
     * @param member the member access
     * @return the path, outermost member last
     */
    public static List<String> memberPath(MemberAccess member) {
        List<String> path = new ArrayList<>();
        Expression current = member;
        while (current instanceof MemberAccess access) {
            path.add(0, access.member());
            current = access.target();
        }
        return path;
    }

    /**
     * Returns the expression at the root of a member chain.
     *
     * @param member the member access
     * @return the root expression
     */
    public static Expression memberRoot(MemberAccess member) {
        Expression current = member;
        while (current instanceof MemberAccess access) {
            current = access.target();
        }
        return current;
    }

    /**
     * Replaces characters that are not valid in an identifier with underscores.
     *
     * @param name the raw name
     * @return the sanitized name
     */
    public static String sanitizeName(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
