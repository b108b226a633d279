package com.streamsql.generator;

import com.streamsql.exception.UnsupportedConstructException;
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
import com.streamsql.functions.FunctionMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the key list of a GROUP BY clause.
 *
 * <p>A single member renders as one key, an object initializer as a comma list.
 * Non-key members keep their declared name; key members render upper-cased and
 * qualified by the source alias when one is mapped. With {@code prefixAll}, every
 * member is rendered the key way.
 */
public final class GroupByClauseBuilder extends ClauseBuilder {

    private final Map<String, String> parameterAliases;
    private final boolean prefixAll;

    public GroupByClauseBuilder(ExpressionTranslator translator) {
        this(translator, Collections.emptyMap(), false);
    }

    public GroupByClauseBuilder(ExpressionTranslator translator, Map<String, String> parameterAliases) {
        this(translator, parameterAliases, false);
    }

    public GroupByClauseBuilder(ExpressionTranslator translator, Map<String, String> parameterAliases,
                                boolean prefixAll) {
        super(translator);
        this.parameterAliases = Collections.unmodifiableMap(new LinkedHashMap<>(parameterAliases));
        this.prefixAll = prefixAll;
    }

    @Override
    public ClauseKind kind() {
        return ClauseKind.GROUP_BY;
    }

    @Override
    protected void validateSpecific(Expression expression) {
        if (catalog().containsAggregate(expression)) {
            throw new ValidationException("Aggregate functions are not allowed in GROUP BY clause");
        }
        int maxKeys = translator.config().maxGroupByKeys();
        int keyCount = countKeys(expression);
        if (keyCount > maxKeys) {
            throw new ValidationException("GROUP BY supports maximum " + maxKeys + " keys for optimal performance. "
                + "Found " + keyCount + " keys. Consider using composite keys or data denormalization.");
        }
    }

    @Override
    protected String buildInternal(Expression expression) {
        List<String> keys = new ArrayList<>();
        collectKeys(expression, keys);
        if (keys.isEmpty()) {
            throw new IllegalStateException("Unable to extract GROUP BY keys from expression");
        }
        return String.join(", ", keys);
    }

    private static int countKeys(Expression expression) {
        Expression node = ExpressionUtils.unwrapConvert(expression);
        if (node instanceof Lambda lambda) {
            return countKeys(lambda.body());
        }
        if (node instanceof ObjectInit init) {
            int count = 0;
            for (MemberBinding binding : init.bindings()) {
                count += countKeys(binding.expression());
            }
            return count;
        }
        return 1;
    }

    private void collectKeys(Expression expression, List<String> keys) {
        Expression node = ExpressionUtils.unwrapConvert(expression);
        switch (node.kind()) {
            case LAMBDA:
                collectKeys(((Lambda) node).body(), keys);
                return;
            case OBJECT_INIT:
                for (MemberBinding binding : ((ObjectInit) node).bindings()) {
                    collectKeys(binding.expression(), keys);
                }
                return;
            case METHOD_CALL:
                keys.add(groupByFunction((MethodCall) node));
                return;
            case CONSTANT:
                throw new ValidationException("Constant expression is not supported in GROUP BY");
            default:
                keys.add(render(node));
        }
    }

    private String render(Expression expression) {
        Expression node = ExpressionUtils.unwrapConvert(expression);
        switch (node.kind()) {
            case MEMBER_ACCESS:
                return memberName((MemberAccess) node);
            case CONSTANT: {
                Object value = ((Constant) node).value();
                return value == null ? "NULL" : value.toString();
            }
            case METHOD_CALL:
                return groupByFunction((MethodCall) node);
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) node;
                String left = render(binary.left());
                String right = render(binary.right());
                if (binary.operator() == BinaryExpression.Operator.COALESCE) {
                    return "COALESCE(" + left + ", " + right + ")";
                }
                return left + " " + binary.operator().symbol() + " " + right;
            }
            default:
                throw new UnsupportedConstructException(
                    "Expression type '" + node.kind() + "' is not supported in GROUP BY", node.kind().name());
        }
    }

    private String groupByFunction(MethodCall call) {
        Optional<FunctionMapping> mapping = catalog().lookup(call.methodName());
        if (mapping.isEmpty() || !mapping.get().allowedInGroupBy()) {
            throw new UnsupportedConstructException(
                "Function '" + call.methodName() + "' is not allowed in GROUP BY clause", call.methodName());
        }
        return translator.translateCall(call, this::memberName);
    }

    private String memberName(MemberAccess member) {
        if (!prefixAll && !member.isKey()) {
            return member.member();
        }
        String prefix = "";
        if (ExpressionUtils.memberRoot(member) instanceof Parameter parameter) {
            String alias = parameterAliases.get(parameter.name());
            if (alias != null && !alias.isBlank()) {
                prefix = alias;
            }
        }
        String name = ExpressionUtils.sanitizeName(member.member()).toUpperCase(Locale.ROOT);
        return prefix.isEmpty() ? name : prefix + "." + name;
    }
}
