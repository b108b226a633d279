package com.streamsql.hub;

import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.functions.FunctionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides, for projections that read a derived per-second rows stream, which
 * members are retargeted onto precomputed hub columns and which are dropped.
 *
 * <p>Hub columns follow a fixed naming scheme: {@code SUM<leaf>}, {@code MAX<leaf>},
 * {@code MIN<leaf>}, {@code LAST<leaf>}, {@code FIRST<leaf>} and {@code CNT}.
 * An average is served from {@code SUM<leaf>} and {@code CNT}.
 */
public final class HubSelectPolicy {

    private static final Logger logger = LoggerFactory.getLogger(HubSelectPolicy.class);

    /** Logical column restored from the windowed key; never computed in the statement. */
    public static final String WINDOW_START_RAW = "WindowStartRaw";

    private static final String COUNT_COLUMN = "CNT";

    /**
     * Override rules and exclusions derived for one projection.
     *
     * @param overrides rules keyed by output alias (case-insensitive)
     * @param excludes aliases dropped from the statement (case-insensitive)
     */
    public record Selection(Map<String, HubProjectionOverride> overrides, Set<String> excludes) {

        public Selection {
            Map<String, HubProjectionOverride> o = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            o.putAll(overrides);
            overrides = Collections.unmodifiableMap(o);
            Set<String> e = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            e.addAll(excludes);
            excludes = Collections.unmodifiableSet(e);
        }
    }

    private final FunctionCatalog catalog;

    public HubSelectPolicy(FunctionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Derives override rules and exclusions.
     *
     * @param metadata the projection metadata
     * @param availableColumns the hub columns known to exist, or null/empty when unknown
     * @return the selection
     */
    public Selection buildOverridesAndExcludes(ProjectionMetadata metadata, Set<String> availableColumns) {
        Map<String, HubProjectionOverride> overrides = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Set<String> excludes = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

        for (ProjectionMember member : metadata.members()) {
            String alias = member.alias();
            if (alias.isBlank()) {
                continue;
            }
            if (WINDOW_START_RAW.equalsIgnoreCase(alias)) {
                excludes.add(alias);
                continue;
            }

            if (member.kind() == ProjectionMemberKind.AGGREGATE) {
                String function = member.aggregateFunctionName();
                boolean average = "Average".equalsIgnoreCase(function) || "Avg".equalsIgnoreCase(function);
                String target = ExpressionUtils.sanitizeName(alias).toUpperCase(Locale.ROOT);
                if (average) {
                    String inferred = inferHubColumn(member.expression(), availableColumns);
                    if (inferred != null) {
                        target = inferred;
                    }
                }
                overrides.put(alias, HubProjectionOverride.forAggregate(target, function));
                logger.debug("Hub override alias={} target={} func={}", alias, target, function);
                continue;
            }

            if (member.kind() == ProjectionMemberKind.COMPUTED) {
                if (catalog.containsAggregate(member.expression())) {
                    String target = inferHubColumn(member.expression(), availableColumns);
                    if (target == null) {
                        target = member.resolvedColumnName() != null && !member.resolvedColumnName().isBlank()
                            ? member.resolvedColumnName()
                            : ExpressionUtils.sanitizeName(alias).toUpperCase(Locale.ROOT);
                    }
                    String function = member.aggregateFunctionName() == null
                        || member.aggregateFunctionName().isBlank() ? "AVG" : member.aggregateFunctionName();
                    overrides.put(alias, HubProjectionOverride.forAggregate(target, function));
                    logger.debug("Hub override (computed) alias={} target={} func={}", alias, target, function);
                } else {
                    excludes.add(alias);
                }
            }
        }
        return new Selection(overrides, excludes);
    }

    /**
     * Infers the hub column backing the first aggregate in an expression.
     *
     * @param expression the member expression
     * @param availableColumns the known hub columns, or null/empty
     * @return the column, or null when none applies
     */
    String inferHubColumn(Expression expression, Set<String> availableColumns) {
        MethodCall aggregate = firstAggregate(expression);
        if (aggregate == null) {
            return null;
        }
        String function = aggregate.methodName();
        String leaf = ExpressionUtils.sanitizeName(aggregateLeaf(aggregate)).toUpperCase(Locale.ROOT);

        List<String> candidates = new ArrayList<>();
        if (!leaf.isEmpty()) {
            switch (function.toLowerCase(Locale.ROOT)) {
                case "average":
                case "avg":
                case "sum":
                    candidates.add("SUM" + leaf);
                    break;
                case "max":
                    candidates.add("MAX" + leaf);
                    break;
                case "min":
                    candidates.add("MIN" + leaf);
                    break;
                case "latestbyoffset":
                    candidates.add("LAST" + leaf);
                    break;
                case "earliestbyoffset":
                    candidates.add("FIRST" + leaf);
                    break;
                default:
                    break;
            }
        }
        if ("Count".equalsIgnoreCase(function)) {
            candidates.add(COUNT_COLUMN);
        }

        if (availableColumns == null || availableColumns.isEmpty()) {
            return candidates.isEmpty() ? null : candidates.get(0);
        }
        Set<String> available = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        available.addAll(availableColumns);

        if (!candidates.isEmpty() && candidates.get(0).toUpperCase(Locale.ROOT).startsWith("SUM")) {
            String sumColumn = candidates.get(0);
            if (available.contains(sumColumn) && available.contains(COUNT_COLUMN)) {
                return sumColumn;
            }
        }
        for (String candidate : candidates) {
            if (available.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private MethodCall firstAggregate(Expression expression) {
        if (expression instanceof MethodCall call && catalog.isAggregateFunction(call.methodName())) {
            return call;
        }
        for (Expression child : ExpressionUtils.children(expression)) {
            MethodCall found = firstAggregate(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static String aggregateLeaf(MethodCall call) {
        for (Expression argument : call.arguments()) {
            if (argument instanceof Lambda lambda
                    && ExpressionUtils.unwrapConvert(lambda.body()) instanceof MemberAccess member) {
                return member.member();
            }
        }
        return "";
    }
}
