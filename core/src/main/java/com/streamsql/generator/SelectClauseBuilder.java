package com.streamsql.generator;

import com.streamsql.exception.UnsupportedConstructException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Conditional;
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
import com.streamsql.functions.FunctionMapping;
import com.streamsql.hub.HubProjectionOverride;
import com.streamsql.types.DecimalType;
import com.streamsql.types.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the column list of a SELECT clause.
 *
 * <p>Object-initializer projections become {@code expr AS Alias} items with
 * unique aliases; the grouping key ({@code g.Key}) expands into one column per
 * GROUP BY key. Two optional configurations refine the output:
 * <ul>
 *   <li>decimal hints: members whose result column is DECIMAL are wrapped in
 *       {@code CAST(expr AS DECIMAL(p, s))} unless already a cast</li>
 *   <li>hub mode: per-alias {@link HubProjectionOverride} rules retarget members
 *       onto precomputed columns, and excluded members are dropped</li>
 * </ul>
 *
 * <p>Instances are immutable; per-call visitor state lives in {@link Projection}.
 */
public final class SelectClauseBuilder extends ClauseBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SelectClauseBuilder.class);

    private static final Pattern GROUP_KEY_ALIAS = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\)?$");

    private static final String DEFAULT_OVERRIDE_SOURCE_ALIAS = "o";

    private final Map<String, String> parameterAliases;
    private final Map<String, DecimalType> decimalHints;
    private final Map<String, HubProjectionOverride> overrides;
    private final Set<String> excludedMembers;
    private final String overrideSourceAlias;
    private final String groupByKeys;

    private SelectClauseBuilder(Builder builder) {
        super(builder.translator);
        this.parameterAliases = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameterAliases));
        this.decimalHints = Collections.unmodifiableMap(copyCaseInsensitive(builder.decimalHints));
        this.overrides = builder.overrides == null
            ? null
            : Collections.unmodifiableMap(copyCaseInsensitive(builder.overrides));
        TreeSet<String> excluded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        excluded.addAll(builder.excludedMembers);
        this.excludedMembers = Collections.unmodifiableSet(excluded);
        this.overrideSourceAlias = builder.overrideSourceAlias == null || builder.overrideSourceAlias.isBlank()
            ? DEFAULT_OVERRIDE_SOURCE_ALIAS
            : builder.overrideSourceAlias;
        this.groupByKeys = builder.groupByKeys;
    }

    /**
     * Creates a builder without aliases, hints or overrides.
     *
     * @param translator the expression translator
     * @return the new builder
     */
    public static SelectClauseBuilder plain(ExpressionTranslator translator) {
        return builder(translator).build();
    }

    public static Builder builder(ExpressionTranslator translator) {
        return new Builder(translator);
    }

    @Override
    public ClauseKind kind() {
        return ClauseKind.SELECT;
    }

    public boolean hasOverrides() {
        return overrides != null;
    }

    @Override
    protected void validateSpecific(Expression expression) {
        ExpressionValidation.validateNoNestedAggregates(expression, catalog());
    }

    @Override
    protected String buildInternal(Expression expression) {
        Projection projection = new Projection();
        projection.visit(expression);
        if (projection.columns.isEmpty()) {
            return "*";
        }
        return String.join(", ", projection.columns);
    }

    /**
     * Returns the aliases a GROUP BY key list produces in SELECT.
     *
     * @param keys the GROUP BY keys without the keyword
     * @return the aliases in key order
     */
    static List<String> groupKeyAliases(String keys) {
        List<String> aliases = new ArrayList<>();
        for (String key : splitKeys(keys)) {
            aliases.add(aliasForKey(key));
        }
        return aliases;
    }

    private static List<String> splitKeys(String keys) {
        List<String> parts = new ArrayList<>();
        if (keys == null || keys.isBlank()) {
            return parts;
        }
        for (String part : keys.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    private static String aliasForKey(String key) {
        Matcher m = GROUP_KEY_ALIAS.matcher(key);
        return m.find() ? m.group(1) : key;
    }

    private static <V> Map<String, V> copyCaseInsensitive(Map<String, V> source) {
        Map<String, V> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(source);
        return copy;
    }

    // ==================== Per-call state ====================

    /**
     * Visitor state for one SELECT rendering.
     */
    private final class Projection {

        private final List<String> columns = new ArrayList<>();
        private final Set<String> usedAliases = new HashSet<>();
        private String currentAlias;
        private boolean groupingContext;

        void visit(Expression expression) {
            switch (expression.kind()) {
                case LAMBDA:
                    visit(((Lambda) expression).body());
                    return;
                case OBJECT_INIT:
                    visitObjectInit((ObjectInit) expression);
                    return;
                case MEMBER_ACCESS:
                    visitMember((MemberAccess) expression);
                    return;
                case PARAMETER:
                    columns.add("*");
                    return;
                case METHOD_CALL:
                    columns.add(translator.translateCall((MethodCall) expression, this::columnName));
                    return;
                default:
                    columns.add(render(expression));
            }
        }

        private void visitMember(MemberAccess member) {
            if (ExpressionUtils.isGroupKeyObject(member)) {
                addGroupKeyColumns();
                return;
            }
            columns.add(columnName(member));
        }

        private void visitObjectInit(ObjectInit init) {
            groupingContext = groupingContext
                || ExpressionUtils.findParameter(init, Parameter::isGrouping) != null;
            validateGroupKeyOrder(init);

            for (MemberBinding binding : init.bindings()) {
                String memberName = binding.member();
                Expression argument = binding.expression();

                if (ExpressionUtils.isGroupKeyObject(argument)) {
                    addGroupKeyColumns();
                    continue;
                }

                enforceNoAggregateMixing(argument);

                currentAlias = memberName;
                String column;
                try {
                    column = renderProjectionArgument(argument);
                    column = applyNonAggregateOverride(column, argument);
                } finally {
                    currentAlias = null;
                }

                String alias = uniqueAlias(memberName);
                if (excludedMembers.contains(memberName) || excludedMembers.contains(alias)) {
                    usedAliases.remove(alias);
                    logger.debug("Excluding SELECT member {}", memberName);
                    continue;
                }
                columns.add(applyAliasTypeCast(column, alias));
            }
        }

        private void enforceNoAggregateMixing(Expression argument) {
            if (groupingContext) {
                return;
            }
            if (catalog().containsAggregate(argument) && containsNonAggregateColumn(argument)) {
                throw new ValidationException(
                    "SELECT clause cannot mix aggregate functions with non-aggregate columns without GROUP BY",
                    "SELECT", argument.toString(), "Add a GroupBy before the projection");
            }
        }

        private boolean containsNonAggregateColumn(Expression expression) {
            if (expression instanceof MethodCall call && isAggregate(call.methodName())) {
                return false;
            }
            if (expression instanceof MemberAccess) {
                return true;
            }
            for (Expression child : ExpressionUtils.children(expression)) {
                if (containsNonAggregateColumn(child)) {
                    return true;
                }
            }
            return false;
        }

        private void validateGroupKeyOrder(ObjectInit init) {
            if (init.isAnonymous()) {
                return;
            }
            List<String> keyAliases = groupKeyAliases(groupByKeys);
            if (keyAliases.isEmpty()) {
                return;
            }
            List<String> dtoKeys = new ArrayList<>();
            for (MemberBinding binding : init.bindings()) {
                if (ExpressionUtils.isGroupKeyMember(binding.expression())) {
                    dtoKeys.add(binding.member());
                }
            }
            boolean matches = dtoKeys.size() == keyAliases.size();
            for (int i = 0; matches && i < dtoKeys.size(); i++) {
                matches = dtoKeys.get(i).equalsIgnoreCase(keyAliases.get(i));
            }
            if (!matches) {
                throw new ValidationException(
                    "The order of GroupBy keys does not match the output DTO definition. "
                        + "Please ensure they are the same order.");
            }
        }

        private void addGroupKeyColumns() {
            for (String key : splitKeys(groupByKeys)) {
                String alias = aliasForKey(key);
                if (excludedMembers.contains(alias) || !usedAliases.add(alias)) {
                    continue;
                }
                columns.add(key + " AS " + alias);
            }
        }

        private String uniqueAlias(String base) {
            String alias = base;
            int suffix = 1;
            while (!usedAliases.add(alias)) {
                alias = base + "_" + suffix++;
            }
            return alias;
        }

        private String applyAliasTypeCast(String column, String alias) {
            DecimalType hint = decimalHints.get(alias);
            if (hint != null && !column.trim().toUpperCase(Locale.ROOT).startsWith("CAST(")) {
                return "CAST(" + column + " AS " + hint.toSQL() + ") AS " + alias;
            }
            return column + " AS " + alias;
        }

        // ==================== Rendering ====================

        private String renderProjectionArgument(Expression argument) {
            Expression unwrapped = ExpressionUtils.unwrapConvert(argument);
            if (unwrapped instanceof MemberAccess member
                    && "Length".equals(member.member())
                    && member.target().valueType() == ValueType.STRING) {
                return "LEN(" + renderProjectionArgument(member.target()) + ")";
            }
            return render(unwrapped);
        }

        private String render(Expression expression) {
            Expression node = ExpressionUtils.unwrapConvert(expression);
            switch (node.kind()) {
                case MEMBER_ACCESS:
                    return columnName((MemberAccess) node);
                case METHOD_CALL:
                    return translatePossiblyOverridden((MethodCall) node);
                case BINARY:
                    return renderBinary((BinaryExpression) node);
                case CONSTANT:
                    return SqlLiterals.safeToString(((Constant) node).value());
                case CONDITIONAL:
                    return renderConditional((Conditional) node);
                case UNARY:
                    return renderUnary((UnaryExpression) node);
                case LAMBDA:
                    return render(((Lambda) node).body());
                case PARAMETER:
                    return ((Parameter) node).name();
                case OBJECT_INIT:
                    throw new UnsupportedConstructException(
                        "Nested object initializers are not supported in SELECT.", "ObjectInit");
                default:
                    throw new IllegalStateException("Unknown expression kind: " + node.kind());
            }
        }

        private String renderUnary(UnaryExpression unary) {
            String operand = render(unary.operand());
            switch (unary.operator()) {
                case NOT:
                    return "NOT (" + operand + ")";
                case NEGATE:
                    return "-" + operand;
                default:
                    return operand;
            }
        }

        private String renderBinary(BinaryExpression binary) {
            String left = render(binary.left());
            String right = render(binary.right());
            if (binary.operator() == BinaryExpression.Operator.COALESCE) {
                return "COALESCE(" + left + ", " + right + ")";
            }
            return "(" + left + " " + binary.operator().symbol() + " " + right + ")";
        }

        private String renderConditional(Conditional conditional) {
            ExpressionValidation.validateConditionalTypes(conditional);
            return "CASE WHEN " + render(conditional.test())
                + " THEN " + render(conditional.ifTrue())
                + " ELSE " + render(conditional.ifFalse()) + " END";
        }

        // ==================== Hub overrides ====================

        private String translatePossiblyOverridden(MethodCall call) {
            Optional<HubProjectionOverride> rule = currentRule();
            Optional<FunctionMapping> mapping = catalog().lookup(call.methodName());
            if (rule.isPresent() && mapping.isPresent() && isAggregate(call.methodName())) {
                String target = rule.get().targetColumn();
                String qualified = target.indexOf('.') < 0 ? overrideSourceAlias + "." + target : target;
                String function = call.methodName().toUpperCase(Locale.ROOT);
                if ("AVERAGE".equals(function) || "AVG".equals(function)) {
                    String baseColumn = target.substring(target.lastIndexOf('.') + 1).toUpperCase(Locale.ROOT);
                    if (baseColumn.startsWith("SUM")) {
                        return "(SUM(" + qualified + ") / SUM(CNT))";
                    }
                    return "AVG(" + qualified + ")";
                }
                logger.debug("Retargeting {} for {} onto {}", call.methodName(), currentAlias, qualified);
                return mapping.get().generateStandardCall(qualified);
            }
            return translator.translateCall(call, this::columnName);
        }

        private Optional<HubProjectionOverride> currentRule() {
            if (overrides == null || currentAlias == null || currentAlias.isBlank()) {
                return Optional.empty();
            }
            HubProjectionOverride rule = overrides.get(currentAlias);
            if (rule == null || rule.targetColumn().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(rule);
        }

        private String applyNonAggregateOverride(String column, Expression argument) {
            if (overrides == null || currentAlias == null || currentAlias.isBlank()) {
                return column;
            }
            Expression node = ExpressionUtils.unwrapConvert(argument);
            if (node instanceof MethodCall call && catalog().has(call.methodName())
                    && isAggregate(call.methodName())) {
                return column;
            }
            if (ExpressionUtils.isGroupKeyMember(node)) {
                return column;
            }
            Optional<HubProjectionOverride> found = currentRule();
            if (found.isEmpty()) {
                logger.debug("No hub override for SELECT member {}", currentAlias);
                return column;
            }
            HubProjectionOverride rule = found.get();
            String target = rule.targetColumn();
            String function = rule.aggregateFunctionName();
            boolean hasFunction = function != null && !function.isBlank();

            if (catalog().containsAggregate(node)) {
                boolean sameAlias = target.equalsIgnoreCase(currentAlias);
                if (rule.aggregateOnly() || (sameAlias && hasFunction)) {
                    return column;
                }
            }
            if (rule.aggregateOnly()) {
                return column;
            }
            if (hasFunction) {
                Optional<FunctionMapping> mapping = catalog().lookup(function);
                if (mapping.isPresent()) {
                    return mapping.get().generateStandardCall(target);
                }
            }
            return "LATEST_BY_OFFSET(" + target + ")";
        }

        // ==================== Column names ====================

        private String columnName(MemberAccess member) {
            List<String> path = ExpressionUtils.memberPath(member);
            Expression root = ExpressionUtils.memberRoot(member);
            if (!(root instanceof Parameter parameter)) {
                throw new ValidationException(
                    "Unqualified column access is not allowed. Use source parameter properties.");
            }
            String mapped = parameterAliases.get(parameter.name());

            if (ExpressionUtils.GROUP_KEY_MEMBER.equals(path.get(0))) {
                List<String> rest = new ArrayList<>();
                for (String part : path.subList(1, path.size())) {
                    rest.add(ExpressionUtils.sanitizeName(part).toUpperCase(Locale.ROOT));
                }
                return prefix(mapped) + String.join(".", rest);
            }
            if (member.isKey()) {
                return prefix(mapped) + member.member().toUpperCase(Locale.ROOT);
            }

            List<String> upper = new ArrayList<>(path.size());
            for (String part : path) {
                upper.add(part.toUpperCase(Locale.ROOT));
            }
            String column = String.join(".", upper);
            String source = mapped;
            if (source == null || source.isBlank()) {
                source = currentRule().isPresent() ? overrideSourceAlias : firstMappedAlias();
            }
            return source == null || source.isBlank() ? column : source + "." + column;
        }

        private String firstMappedAlias() {
            for (String alias : parameterAliases.values()) {
                if (alias != null && !alias.isBlank()) {
                    return alias;
                }
            }
            return null;
        }

        private String prefix(String alias) {
            return alias == null || alias.isBlank() ? "" : alias + ".";
        }
    }

    // ==================== Builder ====================

    /**
     * Fluent configuration for {@link SelectClauseBuilder}.
     */
    public static final class Builder {

        private final ExpressionTranslator translator;
        private final Map<String, String> parameterAliases = new LinkedHashMap<>();
        private final Map<String, DecimalType> decimalHints = new LinkedHashMap<>();
        private Map<String, HubProjectionOverride> overrides;
        private final Set<String> excludedMembers = new HashSet<>();
        private String overrideSourceAlias;
        private String groupByKeys;

        private Builder(ExpressionTranslator translator) {
            this.translator = translator;
        }

        public Builder parameterAliases(Map<String, String> aliases) {
            parameterAliases.putAll(aliases);
            return this;
        }

        public Builder decimalHints(Map<String, DecimalType> hints) {
            decimalHints.putAll(hints);
            return this;
        }

        /**
         * Enables hub mode.
         *
         * @param rules per-alias override rules, may be empty
         * @param sourceAlias alias used to qualify retargeted columns; blank means {@code o}
         * @return this builder
         */
        public Builder overrides(Map<String, HubProjectionOverride> rules, String sourceAlias) {
            this.overrides = new LinkedHashMap<>(rules);
            this.overrideSourceAlias = sourceAlias;
            return this;
        }

        public Builder exclude(Set<String> members) {
            excludedMembers.addAll(members);
            return this;
        }

        /**
         * Sets the rendered GROUP BY keys, used to expand {@code g.Key}.
         *
         * @param keys the GROUP BY keys without the keyword, may be null
         * @return this builder
         */
        public Builder groupByKeys(String keys) {
            this.groupByKeys = keys;
            return this;
        }

        public SelectClauseBuilder build() {
            return new SelectClauseBuilder(this);
        }
    }
}
