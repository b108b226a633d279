package com.streamsql.generator;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.TypeIncompatibilityException;
import com.streamsql.exception.UnsupportedConstructException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Conditional;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Expression;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.Parameter;
import com.streamsql.expression.UnaryExpression;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.functions.FunctionCategories;
import com.streamsql.functions.FunctionMapping;
import com.streamsql.types.TypeMapper;
import com.streamsql.types.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Translates expression trees to streaming-SQL text, driven by a {@link FunctionCatalog}.
 *
 * <p>Method calls are resolved by name against the catalog, validated for
 * argument count and argument type category, then rendered either through
 * dedicated handlers (ToString, Parse, Convert, Case, Count) or the mapping's
 * standard form. Other node kinds use fixed operator tables.
 *
 * <p>Member references are resolved through a {@link MemberResolver} supplied per
 * call, which lets each clause builder apply its own alias regime:
 * <pre>
 *   ExpressionTranslator translator = new ExpressionTranslator(FunctionCatalog.defaults());
 *   translator.translateCall(call);                          // UPPER(Name)
 *   translator.translateCall(call, m -> "o." + m.member());  // UPPER(o.Name)
 * </pre>
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    static final String TIMESTAMP_FORMAT = "'yyyy-MM-dd''T''HH:mm:ssXXX'";

    private final FunctionCatalog catalog;
    private final CompilerConfig config;

    public ExpressionTranslator(FunctionCatalog catalog, CompilerConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ExpressionTranslator(FunctionCatalog catalog) {
        this(catalog, CompilerConfig.defaults());
    }

    public FunctionCatalog catalog() {
        return catalog;
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Translates a method call, rendering members by their bare name.
     *
     * @param call the method call
     * @return the SQL text
     */
    public String translateCall(MethodCall call) {
        return translateCall(call, MemberResolver.BARE);
    }

    /**
     * Translates a method call.
     *
     * @param call the method call
     * @param resolver resolves member references
     * @return the SQL text
     * @throws UnsupportedConstructException if the method is unknown and has no CAST fallback
     * @throws TypeIncompatibilityException if an argument type is not accepted by the function
     * @throws IllegalArgumentException if the argument count is out of bounds
     */
    public String translateCall(MethodCall call, MemberResolver resolver) {
        ExpressionValidation.validateExpression(call, config);
        Objects.requireNonNull(resolver, "resolver must not be null");

        String methodName = call.methodName();
        FunctionMapping mapping = catalog.lookup(methodName).orElse(null);
        if (mapping == null) {
            return handleUnknownMethod(call, resolver);
        }

        int argCount = call.effectiveArgumentCount();
        if (!mapping.isValidArgCount(argCount)) {
            throw new IllegalArgumentException("Method '" + methodName + "' expects "
                + mapping.minArgs() + "-" + mapping.maxArgs() + " arguments, but got " + argCount);
        }

        validateTypeCompatibility(mapping.function(), call);

        if (mapping.specialHandling()) {
            return handleSpecialFunction(call, mapping, resolver);
        }
        return mapping.generateStandardCall(extractArguments(call, resolver).toArray(new String[0]));
    }

    /**
     * Translates any expression node.
     *
     * @param expression the expression
     * @param resolver resolves member references
     * @return the SQL text
     */
    public String translate(Expression expression, MemberResolver resolver) {
        switch (expression.kind()) {
            case METHOD_CALL:
                return translateCall((MethodCall) expression, resolver);
            case MEMBER_ACCESS: {
                MemberAccess member = (MemberAccess) expression;
                String resolved = resolver.resolve(member);
                return resolved != null ? resolved : member.member();
            }
            case CONSTANT:
                return SqlLiterals.safeToString(((Constant) expression).value());
            case PARAMETER:
                return ((Parameter) expression).name();
            case LAMBDA:
                return translate(((Lambda) expression).body(), resolver);
            case UNARY:
                return translateUnary((UnaryExpression) expression, resolver);
            case BINARY:
                return translateBinary((BinaryExpression) expression, resolver);
            case CONDITIONAL:
                return translateConditional((Conditional) expression, resolver);
            case OBJECT_INIT:
                throw new UnsupportedConstructException(
                    "Object initializer is not supported inside a function call.", "ObjectInit");
            default:
                throw new IllegalStateException("Unknown expression kind: " + expression.kind());
        }
    }

    private String translateUnary(UnaryExpression unary, MemberResolver resolver) {
        String operand = translate(unary.operand(), resolver);
        switch (unary.operator()) {
            case NOT:
                return "NOT (" + operand + ")";
            case NEGATE:
                return "-" + operand;
            default:
                return operand;
        }
    }

    private String translateBinary(BinaryExpression binary, MemberResolver resolver) {
        String left = translate(binary.left(), resolver);
        String right = translate(binary.right(), resolver);
        if (binary.operator() == BinaryExpression.Operator.COALESCE) {
            return "COALESCE(" + left + ", " + right + ")";
        }
        return "(" + left + " " + binary.operator().symbol() + " " + right + ")";
    }

    private String translateConditional(Conditional conditional, MemberResolver resolver) {
        ExpressionValidation.validateConditionalTypes(conditional);
        return "CASE WHEN " + translate(conditional.test(), resolver)
            + " THEN " + translate(conditional.ifTrue(), resolver)
            + " ELSE " + translate(conditional.ifFalse(), resolver) + " END";
    }

    // ==================== Special handling ====================

    private String handleSpecialFunction(MethodCall call, FunctionMapping mapping, MemberResolver resolver) {
        switch (call.methodName()) {
            case "ToString":
                return handleToString(call, resolver);
            case "Parse":
                return handleParse(call, resolver);
            case "Convert":
                return handleConvert(call, resolver);
            case "Case":
                return handleCase(call, resolver);
            case "Count":
                return handleCount(call, resolver);
            default:
                return mapping.generateStandardCall(extractArguments(call, resolver).toArray(new String[0]));
        }
    }

    private String handleToString(MethodCall call, MemberResolver resolver) {
        Expression target = call.receiver() != null
            ? call.receiver()
            : (call.arguments().isEmpty() ? null : call.arguments().get(0));
        if (target != null && target.valueType() == ValueType.DATETIME) {
            // epoch-millisecond sources such as WINDOWSTART need the TIMESTAMP cast
            return formatTimestamp(translate(target, resolver));
        }

        List<String> args = extractArguments(call, resolver);
        if (args.isEmpty() && call.receiver() != null) {
            return "CAST(" + translate(call.receiver(), resolver) + " AS VARCHAR)";
        }
        return "CAST(" + args.get(0) + " AS VARCHAR)";
    }

    static String formatTimestamp(String timestampSql) {
        return "FORMAT_TIMESTAMP(CAST(" + timestampSql + " AS TIMESTAMP), " + TIMESTAMP_FORMAT + ", 'UTC')";
    }

    private String handleParse(MethodCall call, MemberResolver resolver) {
        String ksqlType = TypeMapper.toKsqlType(call.valueType(), config);
        List<String> args = extractArguments(call, resolver);
        return "CAST(" + args.get(0) + " AS " + ksqlType + ")";
    }

    private String handleConvert(MethodCall call, MemberResolver resolver) {
        List<String> args = extractArguments(call, resolver);
        if ("Convert".equals(call.declaringType())) {
            String ksqlType;
            switch (call.methodName()) {
                case "ToInt32":
                    ksqlType = "INTEGER";
                    break;
                case "ToInt64":
                    ksqlType = "BIGINT";
                    break;
                case "ToDouble":
                    ksqlType = "DOUBLE";
                    break;
                case "ToDecimal":
                    ksqlType = "DECIMAL";
                    break;
                case "ToBoolean":
                    ksqlType = "BOOLEAN";
                    break;
                default:
                    ksqlType = "VARCHAR";
            }
            return "CAST(" + args.get(0) + " AS " + ksqlType + ")";
        }
        if (args.size() < 2) {
            throw new IllegalArgumentException("Convert requires a value and a target type");
        }
        return "CAST(" + args.get(0) + " AS " + args.get(1) + ")";
    }

    private String handleCase(MethodCall call, MemberResolver resolver) {
        List<String> args = extractArguments(call, resolver);
        StringBuilder result = new StringBuilder("CASE");
        for (int i = 0; i < args.size() - 1; i += 2) {
            result.append(" WHEN ").append(args.get(i)).append(" THEN ").append(args.get(i + 1));
        }
        // odd argument count carries a trailing ELSE
        if (args.size() % 2 == 1) {
            result.append(" ELSE ").append(args.get(args.size() - 1));
        }
        result.append(" END");
        return result.toString();
    }

    private String handleCount(MethodCall call, MemberResolver resolver) {
        List<Expression> rendered = call.renderedArguments();
        if (rendered.isEmpty()) {
            return "COUNT(*)";
        }
        if (rendered.size() == 1 && rendered.get(0) instanceof Lambda) {
            return "COUNT(*)";
        }
        return "COUNT(" + translate(rendered.get(0), resolver) + ")";
    }

    private String handleUnknownMethod(MethodCall call, MemberResolver resolver) {
        String methodName = call.methodName();
        // these names must come from the catalog; a catalog without them targets an older dialect
        if (methodName.equalsIgnoreCase("ToUpper") || methodName.equalsIgnoreCase("ToLower")
                || methodName.equalsIgnoreCase("Year")) {
            throw new UnsupportedConstructException(
                "Function '" + methodName + "' is not supported in the target KSQL version.", methodName);
        }

        List<String> args = extractArguments(call, resolver);
        if (methodName.startsWith("To") && args.size() <= 1) {
            String targetType = catalog.inferTypeFromMethodName(methodName);
            String source = !args.isEmpty()
                ? args.get(0)
                : (call.receiver() != null ? translate(call.receiver(), resolver) : "NULL");
            logger.debug("Rendering unknown method {} as CAST to {}", methodName, targetType);
            return "CAST(" + source + " AS " + targetType + ")";
        }
        throw new UnsupportedConstructException("Function '" + methodName + "' is not supported.", methodName);
    }

    // ==================== Arguments ====================

    private List<String> extractArguments(MethodCall call, MemberResolver resolver) {
        List<Expression> rendered = call.renderedArguments();
        List<String> args = new ArrayList<>(rendered.size());
        for (Expression arg : rendered) {
            args.add(translate(arg, resolver));
        }
        return args;
    }

    private void validateTypeCompatibility(String targetFunction, MethodCall call) {
        Set<ValueType.Category> allowed = FunctionCategories.allowedCategories(targetFunction);
        if (allowed == null) {
            return;
        }
        for (Expression arg : call.renderedArguments()) {
            // lambda selectors contribute their body type
            ValueType type = arg instanceof Lambda lambda ? lambda.body().valueType() : arg.valueType();
            if (!allowed.contains(type.category())) {
                throw new TypeIncompatibilityException(targetFunction, type.name());
            }
        }
    }
}
