package com.streamsql.statement;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.expression.Lambda;
import com.streamsql.hub.HubRowsProjectionAdapter;
import com.streamsql.hub.HubSelectPolicy;
import com.streamsql.hub.ProjectionMetadata;
import com.streamsql.hub.ProjectionMetadataAnalyzer;
import com.streamsql.logical.Extras;
import com.streamsql.logical.HoppingWindow;
import com.streamsql.logical.QueryModel;
import com.streamsql.logical.RenderOptions;
import com.streamsql.logical.SourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds a WINDOW clause to statements produced by {@link CreateStatementAssembler}.
 *
 * <p>The decorator compiles the model first and then edits the text: the EMIT
 * mode and the FROM source can be overridden and the window clause is injected
 * right after the FROM source and its alias. Typical output:
 * <pre>
 *   CREATE TABLE IF NOT EXISTS BARS_5M WITH (...) AS
 *   SELECT ...
 *   FROM TICKS_1S_ROWS WINDOW TUMBLING (SIZE 5 MINUTES, GRACE PERIOD 30 SECONDS)
 *   GROUP BY SYMBOL
 *   EMIT FINAL;
 * </pre>
 */
public final class WindowedStatementDecorator {

    private static final Logger logger = LoggerFactory.getLogger(WindowedStatementDecorator.class);

    /** Source names used by hopping statements unless the request supplies a resolver. */
    public static final Function<SourceDescriptor, String> HOPPING_SOURCE_NAMES =
        source -> source.typeName().toUpperCase(Locale.ROOT);

    private static final String CLAUSE_KEYWORDS = "JOIN|WINDOW|GROUP|EMIT|WHERE|HAVING|PARTITION|ON|WITHIN";

    // FROM must open a line so EXTRACT(... FROM CAST(...)) inside SELECT never matches.
    private static final Pattern FROM_SOURCE = Pattern.compile(
        "^FROM\\s+([A-Za-z_]\\w*)(\\s+(?!(?:" + CLAUSE_KEYWORDS + ")\\b)[A-Za-z_]\\w*)?",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern FROM_INJECTION_POINT = Pattern.compile(
        "^FROM\\s+([A-Za-z_]\\w*)(\\s+(?!(?:" + CLAUSE_KEYWORDS + ")\\b)[A-Za-z_]\\w*)?"
            + "(?=\\s+(?:" + CLAUSE_KEYWORDS + ")\\b|;)",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern UNUSED_WINDOW_START =
        Pattern.compile("WINDOWSTART\\s+(?:AS\\s+[A-Za-z_]\\w*)\\s*,?", Pattern.CASE_INSENSITIVE);

    private static final Pattern WINDOW_END =
        Pattern.compile("WINDOWSTART\\s+(?:AS\\s+)?ENDTS", Pattern.CASE_INSENSITIVE);

    private static final Pattern WINDOW_START_PROJECTION =
        Pattern.compile("WINDOWSTART\\s+AS\\s+[A-Za-z_][\\w]*\\s*,?", Pattern.CASE_INSENSITIVE);

    private static final String EMIT_CHANGES = "EMIT CHANGES";

    private final CreateStatementAssembler assembler;
    private final ProjectionMetadataAnalyzer analyzer;
    private final HubSelectPolicy hubSelectPolicy;

    public WindowedStatementDecorator(CreateStatementAssembler assembler) {
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.analyzer = new ProjectionMetadataAnalyzer(assembler.catalog());
        this.hubSelectPolicy = new HubSelectPolicy(assembler.catalog());
    }

    // ==================== Tumbling ====================

    public String buildTumbling(CompilationScope scope, String name, QueryModel model, String timeframe) {
        return buildTumbling(scope, name, model, timeframe, null, null, RenderOptions.defaults());
    }

    /**
     * Builds a tumbling-window statement for one timeframe.
     *
     * @param scope the active compilation scope
     * @param name the target name
     * @param model the query model
     * @param timeframe a compact timeframe such as {@code 5m}, {@code 1h}, {@code 1wk}
     * @param emitOverride replaces {@code EMIT CHANGES} when not blank, e.g. {@code EMIT FINAL}
     * @param inputOverride replaces the FROM source when not blank
     * @param options rendering options passed to the assembler
     * @return the statement text
     */
    public String buildTumbling(CompilationScope scope, String name, QueryModel model, String timeframe,
                                String emitOverride, String inputOverride, RenderOptions options) {
        CompilationScope.require(scope);
        requireName(name);
        Objects.requireNonNull(model, "model must not be null");
        if (timeframe == null || timeframe.isBlank()) {
            throw new IllegalArgumentException("Timeframe is required");
        }

        prepareHubInput(model, isHubInput(model, inputOverride));
        applySinkDefaults(model);

        String sql = assembler.build(scope, CreateRequest.of(name, model).withOptions(options));
        sql = overrideEmitAndSource(sql, emitOverride, inputOverride);
        String window = formatTumbling(timeframe, model.graceSeconds().orElse(null));
        return injectWindow(sql, window);
    }

    /**
     * Builds one tumbling statement per window declared on the model.
     *
     * @param scope the active compilation scope
     * @param model the query model
     * @param nameFormatter maps a timeframe to the target name
     * @return statements keyed by timeframe, shortest window first
     */
    public Map<String, String> buildAll(CompilationScope scope, QueryModel model,
                                        Function<String, String> nameFormatter) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(nameFormatter, "nameFormatter must not be null");
        Map<String, String> result = new LinkedHashMap<>();
        for (String timeframe : model.windows()) {
            result.put(timeframe, buildTumbling(scope, nameFormatter.apply(timeframe), model, timeframe));
        }
        return result;
    }

    /**
     * Formats a tumbling window clause.
     *
     * <p>Units: {@code s}, {@code m}, {@code h}, {@code d}; {@code wk} becomes
     * seven days per week and {@code mo} months. An unknown unit means minutes and
     * an unparsable count means 1.
     *
     * @param timeframe the compact timeframe
     * @param graceSeconds grace period in seconds, or null
     * @return the WINDOW clause
     */
    public static String formatTumbling(String timeframe, Integer graceSeconds) {
        String size = tumblingSize(timeframe.trim());
        String grace = graceSeconds != null
            ? ", GRACE PERIOD " + graceSeconds + " SECONDS"
            : "";
        return "WINDOW TUMBLING (SIZE " + size + grace + ")";
    }

    private static String tumblingSize(String timeframe) {
        String lower = timeframe.toLowerCase(Locale.ROOT);
        if (lower.endsWith("wk")) {
            Integer weeks = parseCount(timeframe.substring(0, timeframe.length() - 2));
            if (weeks != null) {
                return (weeks * 7) + " DAYS";
            }
        }
        if (lower.endsWith("mo")) {
            Integer months = parseCount(timeframe.substring(0, timeframe.length() - 2));
            if (months != null) {
                return months + " MONTHS";
            }
        }
        Integer parsed = parseCount(timeframe.substring(0, timeframe.length() - 1));
        int value = parsed != null ? parsed : 1;
        switch (lower.charAt(lower.length() - 1)) {
            case 's':
                return value + " SECONDS";
            case 'h':
                return value + " HOURS";
            case 'd':
                return value + " DAYS";
            case 'm':
            default:
                return value + " MINUTES";
        }
    }

    private static Integer parseCount(String digits) {
        try {
            return Integer.parseInt(digits.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ==================== Hopping ====================

    public String buildHopping(CompilationScope scope, String name, QueryModel model) {
        return buildHopping(scope, CreateRequest.of(name, model).withSourceNameResolver(HOPPING_SOURCE_NAMES),
            null, null);
    }

    /**
     * Builds a hopping-window statement from the model's hopping specification.
     *
     * @param scope the active compilation scope
     * @param request the create request; use {@link #HOPPING_SOURCE_NAMES} for type-name sources
     * @param emitOverride replaces {@code EMIT CHANGES} when not blank
     * @param inputOverride replaces the FROM source when not blank
     * @return the statement text
     * @throws ValidationException if the model has no hopping window or no GROUP BY
     */
    public String buildHopping(CompilationScope scope, CreateRequest request,
                               String emitOverride, String inputOverride) {
        CompilationScope.require(scope);
        Objects.requireNonNull(request, "request must not be null");
        requireName(request.name());
        QueryModel model = request.model();
        HoppingWindow hopping = model.hopping().orElseThrow(() ->
            new ValidationException("Hopping window not specified on model"));
        if (!model.hasGroupBy()) {
            throw new ValidationException("Hopping window requires GroupBy().", "WINDOW", model.toString(),
                "Group the query before applying a hopping window");
        }
        applySinkDefaults(model);

        String sql = assembler.build(scope, request);
        sql = overrideEmitAndSource(sql, emitOverride, inputOverride);
        sql = injectWindow(sql, formatHopping(hopping));

        Lambda projection = CreateStatementAssembler.projectionOf(model);
        boolean selectsWindowStart = projection != null
            && ExpressionUtils.containsCall(projection, "WindowStart"::equals);
        if (!selectsWindowStart) {
            sql = UNUSED_WINDOW_START.matcher(sql).replaceAll("");
        }
        sql = WINDOW_END.matcher(sql).replaceAll("WINDOWEND AS EndTs");
        // window bounds travel in the windowed key
        return WINDOW_START_PROJECTION.matcher(sql).replaceAll("");
    }

    /**
     * Formats a hopping window clause, each duration in the largest whole unit up to days.
     *
     * @param hopping the hopping specification
     * @return the WINDOW clause
     */
    public static String formatHopping(HoppingWindow hopping) {
        StringBuilder sb = new StringBuilder("WINDOW HOPPING ( ");
        sb.append("SIZE ").append(largestUnit(hopping.size()));
        sb.append(" , ADVANCE BY ").append(largestUnit(hopping.advance()));
        if (hopping.hasGrace()) {
            sb.append(" , GRACE PERIOD ").append(largestUnit(hopping.grace()));
        }
        sb.append(" )");
        return sb.toString();
    }

    private static String largestUnit(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds >= 86_400 && seconds % 86_400 == 0) {
            return (seconds / 86_400) + " DAYS";
        }
        if (seconds >= 3_600 && seconds % 3_600 == 0) {
            return (seconds / 3_600) + " HOURS";
        }
        if (seconds >= 60 && seconds % 60 == 0) {
            return (seconds / 60) + " MINUTES";
        }
        return seconds + " SECONDS";
    }

    // ==================== Text edits ====================

    private static String overrideEmitAndSource(String sql, String emitOverride, String inputOverride) {
        String result = sql;
        if (emitOverride != null && !emitOverride.isBlank()) {
            result = result.replace(EMIT_CHANGES, emitOverride);
        }
        if (inputOverride != null && !inputOverride.isBlank()) {
            result = overrideFrom(result, inputOverride);
        }
        return result;
    }

    /**
     * Replaces the source of the FROM clause line, keeping its alias.
     */
    static String overrideFrom(String sql, String source) {
        Matcher matcher = FROM_SOURCE.matcher(sql);
        if (!matcher.find()) {
            return sql;
        }
        String alias = matcher.group(2) != null ? matcher.group(2) : "";
        return sql.substring(0, matcher.start()) + "FROM " + source + alias + sql.substring(matcher.end());
    }

    /**
     * Inserts the window clause after the FROM clause source and its alias.
     */
    static String injectWindow(String sql, String windowClause) {
        Matcher matcher = FROM_INJECTION_POINT.matcher(sql);
        if (!matcher.find()) {
            logger.debug("No FROM clause found for window injection");
            return sql;
        }
        String alias = matcher.group(2) != null ? matcher.group(2) : "";
        logger.debug("Injecting {} after FROM {}{}", windowClause, matcher.group(1), alias);
        return sql.substring(0, matcher.start())
            + "FROM " + matcher.group(1) + alias + " " + windowClause
            + sql.substring(matcher.end());
    }

    // ==================== Preparation ====================

    private boolean isHubInput(QueryModel model, String inputOverride) {
        CompilerConfig config = assembler.config();
        if (inputOverride != null && !inputOverride.isBlank()) {
            return config.isHubRowsSource(inputOverride);
        }
        return !model.sources().isEmpty() && config.isHubRowsSource(model.sources().get(0).sourceName());
    }

    /**
     * Adapts the projection to hub-row columns and memoizes the derived metadata
     * and select overrides, unless metadata is already present.
     */
    @SuppressWarnings("unchecked")
    private void prepareHubInput(QueryModel model, boolean hubInput) {
        if (!hubInput) {
            return;
        }
        Lambda projection = model.selectProjection().orElse(null);
        if (projection == null || CreateStatementAssembler.metadataOf(model) != null) {
            return;
        }
        Extras extras = model.extras();
        Expression adapted = HubRowsProjectionAdapter.adapt(projection);
        Lambda hubProjection = adapted instanceof Lambda lambda ? lambda : projection;
        ProjectionMetadata metadata = analyzer.analyze(hubProjection, true);
        Set<String> available = (Set<String>) extras.get(Extras.HUB_AVAILABLE_COLUMNS, Set.class).orElse(null);
        HubSelectPolicy.Selection selection = hubSelectPolicy.buildOverridesAndExcludes(metadata, available);

        extras.put(Extras.HUB_PROJECTION, hubProjection);
        extras.put(Extras.HUB_METADATA, metadata);
        extras.put(Extras.SELECT_OVERRIDES, selection.overrides());
        extras.put(Extras.SELECT_EXCLUDE, selection.excludes());
        logger.debug("Prepared hub input: {} members, {} overrides, {} exclusions",
            metadata.members().size(), selection.overrides().size(), selection.excludes().size());
    }

    private void applySinkDefaults(QueryModel model) {
        CompilerConfig config = assembler.config();
        model.extras()
            .putIfAbsent(Extras.SINK_PARTITIONS, config.defaultSinkPartitions())
            .putIfAbsent(Extras.SINK_REPLICAS, config.defaultSinkReplicas());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Statement name is required");
        }
    }
}
