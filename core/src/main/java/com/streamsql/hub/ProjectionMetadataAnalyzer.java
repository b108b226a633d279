package com.streamsql.hub;

import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MemberBinding;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.expression.UnaryExpression;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.types.ValueType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies the members of a SELECT projection.
 *
 * <p>Each binding of an object-initializer projection becomes one member; any
 * other projection body becomes a single member named {@code value}.
 */
public final class ProjectionMetadataAnalyzer {

    private static final String KEY_PATH = "KEY";

    private static final Set<ValueType> NULLABLE_TYPES = EnumSet.of(
        ValueType.STRING, ValueType.BYTES, ValueType.COLLECTION,
        ValueType.STRUCT, ValueType.OBJECT, ValueType.GROUPING);

    private final Set<String> supportedAggregates = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    public ProjectionMetadataAnalyzer(FunctionCatalog catalog) {
        List<String> aggregates = catalog.functionsByCategory().getOrDefault("Aggregate", List.of());
        for (String name : aggregates) {
            supportedAggregates.add(name);
            supportedAggregates.add(normalizeFunctionName(name));
        }
    }

    /**
     * Classifies a projection.
     *
     * @param projection the projection lambda or body, may be null
     * @param hubInput whether the projection reads a derived rows stream
     * @return the metadata
     */
    public ProjectionMetadata analyze(Expression projection, boolean hubInput) {
        List<ProjectionMember> members = new ArrayList<>();
        if (projection != null) {
            Expression body = projection instanceof Lambda lambda ? lambda.body() : projection;
            if (body instanceof ObjectInit init) {
                for (MemberBinding binding : init.bindings()) {
                    members.add(buildMember(binding.member(), binding.expression()));
                }
            } else {
                members.add(buildMember("value", body));
            }
        }
        return new ProjectionMetadata(members, hubInput);
    }

    private ProjectionMember buildMember(String alias, Expression expression) {
        Expression expr = ExpressionUtils.unwrapConvert(expression);
        Classification c = classify(alias, expr);
        ValueType type = expr.valueType();
        return new ProjectionMember(alias, expression, c.kind, c.resolvedColumn, c.functionName,
            c.sourcePath, type, NULLABLE_TYPES.contains(type));
    }

    private Classification classify(String alias, Expression expr) {
        switch (expr.kind()) {
            case METHOD_CALL: {
                MethodCall call = (MethodCall) expr;
                if (isSupportedAggregate(call.methodName())) {
                    return new Classification(ProjectionMemberKind.AGGREGATE, sanitize(alias),
                        call.methodName(), aggregateSourcePath(call));
                }
                return computed(alias);
            }
            case MEMBER_ACCESS:
                return classifyMember(alias, (MemberAccess) expr);
            case PARAMETER:
                return new Classification(ProjectionMemberKind.VALUE, sanitize(alias), null, null);
            case UNARY:
                return classify(alias, ((UnaryExpression) expr).operand());
            case LAMBDA:
                return classify(alias, ((Lambda) expr).body());
            default:
                return computed(alias);
        }
    }

    private Classification classifyMember(String alias, MemberAccess member) {
        String path = propertyPath(member);
        if (path == null || path.isEmpty()) {
            return new Classification(ProjectionMemberKind.VALUE, sanitize(alias), null, null);
        }
        if (KEY_PATH.equals(path) || path.startsWith(KEY_PATH + ".")) {
            String trimmed = KEY_PATH.equals(path) ? "" : path.substring(KEY_PATH.length() + 1);
            if (trimmed.isEmpty()) {
                return new Classification(ProjectionMemberKind.KEY, sanitize(alias), null, null);
            }
            String leaf = trimmed.substring(trimmed.lastIndexOf('.') + 1);
            return new Classification(ProjectionMemberKind.KEY, leaf, null, trimmed);
        }
        return new Classification(ProjectionMemberKind.VALUE, path, null, path);
    }

    private String aggregateSourcePath(MethodCall call) {
        for (Expression argument : call.arguments()) {
            if (argument instanceof Lambda lambda
                    && ExpressionUtils.unwrapConvert(lambda.body()) instanceof MemberAccess member) {
                return propertyPath(member);
            }
        }
        return null;
    }

    /**
     * Returns the sanitized, upper-cased dotted path from the root parameter, or null
     * when the chain is not rooted at a parameter.
     */
    private static String propertyPath(MemberAccess member) {
        if (!(ExpressionUtils.memberRoot(member) instanceof Parameter)) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : ExpressionUtils.memberPath(member)) {
            parts.add(ExpressionUtils.sanitizeName(part));
        }
        return String.join(".", parts).toUpperCase(Locale.ROOT).replace("`", "");
    }

    private boolean isSupportedAggregate(String methodName) {
        return supportedAggregates.contains(methodName)
            || supportedAggregates.contains(normalizeFunctionName(methodName));
    }

    private static String normalizeFunctionName(String name) {
        return name.replace("_", "").toUpperCase(Locale.ROOT);
    }

    private static Classification computed(String alias) {
        return new Classification(ProjectionMemberKind.COMPUTED, sanitize(alias), null, null);
    }

    private static String sanitize(String value) {
        return ExpressionUtils.sanitizeName(value).toUpperCase(Locale.ROOT);
    }

    private static final class Classification {
        final ProjectionMemberKind kind;
        final String resolvedColumn;
        final String functionName;
        final String sourcePath;

        Classification(ProjectionMemberKind kind, String resolvedColumn, String functionName, String sourcePath) {
            this.kind = kind;
            this.resolvedColumn = resolvedColumn;
            this.functionName = functionName;
            this.sourcePath = sourcePath;
        }
    }
}
