package com.streamsql.functions;

import com.streamsql.config.CompilerConfig;
import com.streamsql.expression.Expression;
import com.streamsql.expression.ExpressionUtils;
import com.streamsql.types.DecimalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Catalog of source method names mapped to streaming-SQL functions.
 *
 * <p>The catalog is an immutable value. {@link #defaults()} returns the shared
 * built-in table; extensions derive a new catalog with {@link #toBuilder()}:
 * <pre>
 *   FunctionCatalog catalog = FunctionCatalog.defaults().toBuilder()
 *       .register("Greatest", FunctionMapping.of("GREATEST", 2, FunctionMapping.UNBOUNDED))
 *       .build();
 * </pre>
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: ToUpper, ToLower, Substring, Trim, Replace, Left, Right, etc.</li>
 *   <li>Math functions: Abs, Round, Floor, Ceiling, Sqrt, Power, etc.</li>
 *   <li>Date functions: Year, Month, Day, AddDays, WeekOfYear, etc.</li>
 *   <li>Aggregate functions: Sum, Count, Max, Min, Average, LatestByOffset, etc.</li>
 *   <li>Array and JSON functions</li>
 *   <li>Cast, conditional, URL, geo, crypto and window metadata functions</li>
 * </ul>
 *
 * <p>Lookups are case-sensitive on the source method name.
 */
public final class FunctionCatalog {

    private static final Logger logger = LoggerFactory.getLogger(FunctionCatalog.class);

    private static final FunctionCatalog DEFAULTS = createDefaults();

    private final Map<String, FunctionMapping> mappings;
    private final DecimalType decimalType;

    private FunctionCatalog(Map<String, FunctionMapping> mappings, DecimalType decimalType) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
        this.decimalType = decimalType;
    }

    /**
     * Returns the built-in catalog.
     *
     * @return the shared default catalog
     */
    public static FunctionCatalog defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this catalog's mappings.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.mappings.putAll(mappings);
        builder.decimalType = decimalType;
        return builder;
    }

    /**
     * Looks up the mapping for a method name.
     *
     * @param methodName the source method name
     * @return the mapping, if any
     */
    public Optional<FunctionMapping> lookup(String methodName) {
        if (methodName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(methodName));
    }

    public boolean has(String methodName) {
        return methodName != null && mappings.containsKey(methodName);
    }

    public Map<String, FunctionMapping> all() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }

    /**
     * Returns the built-in functions grouped by category, in declaration order.
     *
     * @return category name to method names
     */
    public Map<String, List<String>> functionsByCategory() {
        return FunctionCategories.BY_CATEGORY;
    }

    /**
     * Returns the built-in method names of one category.
     *
     * @param category the category name, e.g. {@code Date}
     * @return the method names, or an empty list for an unknown category
     */
    public List<String> functionsInCategory(String category) {
        return category == null ? List.of() : functionsByCategory().getOrDefault(category, List.of());
    }

    /**
     * Returns true if the method name is a built-in aggregate.
     *
     * @param methodName the source method name
     * @return true for aggregates
     */
    public boolean isAggregateFunction(String methodName) {
        return FunctionCategories.AGGREGATES.contains(methodName);
    }

    /**
     * Returns true if any call in the tree is an aggregate.
     *
     * @param expression the expression
     * @return true if an aggregate is present
     */
    public boolean containsAggregate(Expression expression) {
        return ExpressionUtils.containsCall(expression, this::isAggregateFunction);
    }

    /**
     * Returns true if an aggregate call appears inside another aggregate call.
     *
     * @param expression the expression
     * @return true for nested aggregates
     */
    public boolean hasNestedAggregates(Expression expression) {
        return ExpressionUtils.hasNestedCalls(expression, this::isAggregateFunction);
    }

    /**
     * Returns the names of all mappings that require dedicated rendering logic.
     *
     * @return method names, sorted
     */
    public Set<String> specialHandlingFunctions() {
        Set<String> result = new TreeSet<>();
        for (Map.Entry<String, FunctionMapping> entry : mappings.entrySet()) {
            if (entry.getValue().specialHandling()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * Infers the target SQL type produced by a method, based on its name.
     *
     * <p>Examples:
     * <pre>
     *   Sum      → DOUBLE
     *   Count    → BIGINT
     *   ToInt32  → INTEGER
     *   ToDecimal → DECIMAL(18, 2)
     *   Foo      → UNKNOWN
     * </pre>
     *
     * @param methodName the source method name
     * @return the inferred type name
     */
    public String inferTypeFromMethodName(String methodName) {
        switch (methodName.toUpperCase()) {
            case "SUM":
            case "AVG":
                return "DOUBLE";
            case "COUNT":
                return "BIGINT";
            case "MAX":
            case "MIN":
                return "ANY";
            case "TOPK":
                return "ARRAY";
            case "HISTOGRAM":
                return "MAP";
            case "TOINT":
            case "TOINT32":
                return "INTEGER";
            case "TOLONG":
            case "TOINT64":
                return "BIGINT";
            case "TODOUBLE":
                return "DOUBLE";
            case "TODECIMAL":
                return decimalType.toSQL();
            case "TOSTRING":
                return "VARCHAR";
            case "TOBOOL":
            case "TOBOOLEAN":
                return "BOOLEAN";
            default:
                return "UNKNOWN";
        }
    }

    /**
     * Returns a human-readable listing of the catalog grouped by category.
     *
     * @return the listing
     */
    public String debugInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("Function Catalog - Supported Functions:\n");
        sb.append("=".repeat(51)).append('\n');

        Set<String> known = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> category : functionsByCategory().entrySet()) {
            sb.append("\n[").append(category.getKey()).append("] (")
              .append(category.getValue().size()).append(" functions)\n");
            for (String name : category.getValue()) {
                known.add(name);
                appendEntry(sb, name);
            }
        }

        List<String> extras = mappings.keySet().stream()
            .filter(name -> !known.contains(name))
            .sorted()
            .toList();
        if (!extras.isEmpty()) {
            sb.append("\n[Other] (").append(extras.size()).append(" functions)\n");
            for (String name : extras) {
                appendEntry(sb, name);
            }
        }
        return sb.toString();
    }

    private void appendEntry(StringBuilder sb, String name) {
        FunctionMapping mapping = mappings.get(name);
        if (mapping == null) {
            sb.append("• ").append(name).append(" → (not registered)\n");
            return;
        }
        String max = mapping.maxArgs() == FunctionMapping.UNBOUNDED ? "*" : String.valueOf(mapping.maxArgs());
        sb.append("• ").append(name).append(" → ").append(mapping.function())
          .append(" (args: ").append(mapping.minArgs()).append('-').append(max).append(")\n");
    }

    /**
     * Builder for catalogs.
     */
    public static final class Builder {
        private final Map<String, FunctionMapping> mappings = new LinkedHashMap<>();
        private DecimalType decimalType = new DecimalType(
            CompilerConfig.DEFAULT_DECIMAL_PRECISION, CompilerConfig.DEFAULT_DECIMAL_SCALE);

        private Builder() {}

        /**
         * Registers or replaces a mapping.
         *
         * @param methodName the source method name
         * @param mapping the mapping
         * @return this builder
         */
        public Builder register(String methodName, FunctionMapping mapping) {
            Objects.requireNonNull(methodName, "methodName must not be null");
            Objects.requireNonNull(mapping, "mapping must not be null");
            if (methodName.isBlank()) {
                throw new IllegalArgumentException("methodName must not be blank");
            }
            mappings.put(methodName, mapping);
            return this;
        }

        public Builder decimalType(DecimalType type) {
            this.decimalType = Objects.requireNonNull(type, "type must not be null");
            return this;
        }

        public FunctionCatalog build() {
            return new FunctionCatalog(mappings, decimalType);
        }
    }

    private static FunctionCatalog createDefaults() {
        Builder b = new Builder();
        registerStringFunctions(b);
        registerMathFunctions(b);
        registerDateFunctions(b);
        registerAggregateFunctions(b);
        registerArrayFunctions(b);
        registerJsonFunctions(b);
        registerCastFunctions(b);
        registerConditionalFunctions(b);
        registerMiscFunctions(b);
        FunctionCatalog catalog = b.build();
        logger.debug("Built default function catalog with {} mappings", catalog.size());
        return catalog;
    }

    private static void registerStringFunctions(Builder b) {
        b.register("ToUpper", FunctionMapping.of("UPPER", 1).withGroupBy().withOrderBy());
        b.register("ToLower", FunctionMapping.of("LOWER", 1).withGroupBy().withOrderBy());
        b.register("Upper", FunctionMapping.of("UPPER", 1).withGroupBy().withOrderBy());
        b.register("Lower", FunctionMapping.of("LOWER", 1).withGroupBy().withOrderBy());
        b.register("Substring", FunctionMapping.of("SUBSTRING", 2, 3).withGroupBy());
        b.register("Length", FunctionMapping.of("LEN", 1));
        b.register("Trim", FunctionMapping.of("TRIM", 1));
        b.register("Replace", FunctionMapping.of("REPLACE", 3));
        b.register("Contains", FunctionMapping.templated("INSTR({0}, {1}) > 0", 2));
        b.register("StartsWith", FunctionMapping.of("STARTS_WITH", 2));
        b.register("EndsWith", FunctionMapping.of("ENDS_WITH", 2));
        b.register("Split", FunctionMapping.of("SPLIT", 2));
        b.register("Concat", FunctionMapping.of("CONCAT", 2, FunctionMapping.UNBOUNDED));
        b.register("IndexOf", FunctionMapping.of("INSTR", 2));
        b.register("PadLeft", FunctionMapping.of("LPAD", 2, 3));
        b.register("PadRight", FunctionMapping.of("RPAD", 2, 3));
        // LEFT/RIGHT clamp to the string bounds through SUBSTRING/LEN
        b.register("Left", FunctionMapping.templated("SUBSTRING({0}, 1, {1})", 2).withGroupBy());
        b.register("Right", FunctionMapping.templated(
            "SUBSTRING({0}, CASE WHEN LEN({0}) - {1} + 1 < 1 THEN 1 ELSE LEN({0}) - {1} + 1 END, {1})", 2)
            .withGroupBy());
    }

    private static void registerMathFunctions(Builder b) {
        b.register("Abs", FunctionMapping.of("ABS", 1).withOrderBy());
        b.register("Round", FunctionMapping.of("ROUND", 1, 2).withGroupBy());
        b.register("Floor", FunctionMapping.of("FLOOR", 1).withGroupBy());
        b.register("Ceiling", FunctionMapping.of("CEIL", 1).withGroupBy());
        b.register("Sqrt", FunctionMapping.of("SQRT", 1));
        b.register("Power", FunctionMapping.of("POWER", 2));
        b.register("Sign", FunctionMapping.of("SIGN", 1));
        b.register("Sin", FunctionMapping.of("SIN", 1));
        b.register("Cos", FunctionMapping.of("COS", 1));
        b.register("Tan", FunctionMapping.of("TAN", 1));
        b.register("Log", FunctionMapping.of("LOG", 1, 2));
        b.register("Log10", FunctionMapping.of("LOG10", 1));
        b.register("Exp", FunctionMapping.of("EXP", 1));
    }

    private static void registerDateFunctions(Builder b) {
        b.register("Year", extract("YEAR").withOrderBy());
        b.register("Month", extract("MONTH").withOrderBy());
        b.register("Day", extract("DAY").withOrderBy());
        b.register("Hour", extract("HOUR"));
        b.register("Minute", extract("MINUTE"));
        b.register("Second", extract("SECOND"));
        b.register("AddDays", FunctionMapping.templated("DATEADD('day', {1}, {0})", 2));
        b.register("AddHours", FunctionMapping.templated("DATEADD('hour', {1}, {0})", 2));
        b.register("AddMinutes", FunctionMapping.templated("DATEADD('minute', {1}, {0})", 2));
        b.register("AddSeconds", FunctionMapping.templated("DATEADD('second', {1}, {0})", 2));
        b.register("AddMilliseconds", FunctionMapping.templated("DATEADD('millisecond', {1}, {0})", 2));
        b.register("DayOfWeek", FunctionMapping.of("DAYOFWEEK", 1).withGroupBy());
        b.register("DayOfYear", FunctionMapping.of("DAYOFYEAR", 1).withGroupBy());
        // Epoch inputs such as WINDOWSTART need the TIMESTAMP cast first
        b.register("WeekOfYear", FunctionMapping.templated(
            "CAST(FORMAT_TIMESTAMP(CAST({0} AS TIMESTAMP), 'w', 'UTC') AS INT)", 1).withGroupBy());
    }

    private static FunctionMapping extract(String field) {
        return FunctionMapping.templated("EXTRACT(" + field + " FROM CAST({0} AS TIMESTAMP))", 1).withGroupBy();
    }

    private static void registerAggregateFunctions(Builder b) {
        b.register("Sum", FunctionMapping.of("SUM", 1));
        b.register("Count", FunctionMapping.of("COUNT", 0, 1).withSpecialHandling());
        b.register("Max", FunctionMapping.of("MAX", 1));
        b.register("Min", FunctionMapping.of("MIN", 1));
        b.register("Average", FunctionMapping.of("AVG", 1));
        b.register("LatestByOffset", FunctionMapping.of("LATEST_BY_OFFSET", 1));
        b.register("EarliestByOffset", FunctionMapping.of("EARLIEST_BY_OFFSET", 1));
        b.register("CollectList", FunctionMapping.of("COLLECT_LIST", 1));
        b.register("CollectSet", FunctionMapping.of("COLLECT_SET", 1));
        b.register("CountDistinct", FunctionMapping.of("COUNT_DISTINCT", 1));
        b.register("Histogram", FunctionMapping.of("HISTOGRAM", 1));
        b.register("TopK", FunctionMapping.of("TOPK", 2));
        b.register("TopKDistinct", FunctionMapping.of("TOPKDISTINCT", 2));
    }

    private static void registerArrayFunctions(Builder b) {
        b.register("ArrayLength", FunctionMapping.of("ARRAY_LENGTH", 1));
        b.register("ArrayContains", FunctionMapping.of("ARRAY_CONTAINS", 2));
        b.register("ArraySlice", FunctionMapping.of("ARRAY_SLICE", 3));
        b.register("ArrayJoin", FunctionMapping.of("ARRAY_JOIN", 2));
        b.register("ArrayDistinct", FunctionMapping.of("ARRAY_DISTINCT", 1));
        b.register("ArrayExcept", FunctionMapping.of("ARRAY_EXCEPT", 2));
        b.register("ArrayIntersect", FunctionMapping.of("ARRAY_INTERSECT", 2));
        b.register("ArrayUnion", FunctionMapping.of("ARRAY_UNION", 2));
        b.register("ArraySort", FunctionMapping.of("ARRAY_SORT", 1));
        b.register("ArrayMax", FunctionMapping.of("ARRAY_MAX", 1));
        b.register("ArrayMin", FunctionMapping.of("ARRAY_MIN", 1));
    }

    private static void registerJsonFunctions(Builder b) {
        b.register("JsonExtractString", FunctionMapping.of("JSON_EXTRACT_STRING", 2));
        b.register("JsonArrayLength", FunctionMapping.of("JSON_ARRAY_LENGTH", 1));
        b.register("JsonKeys", FunctionMapping.of("JSON_KEYS", 1));
        b.register("JsonArrayContains", FunctionMapping.of("JSON_ARRAY_CONTAINS", 2));
        b.register("JsonConcat", FunctionMapping.of("JSON_CONCAT", 2, FunctionMapping.UNBOUNDED));
        b.register("JsonRecords", FunctionMapping.of("JSON_RECORDS", 1));
    }

    private static void registerCastFunctions(Builder b) {
        b.register("ToString", FunctionMapping.of("CAST({0} AS VARCHAR)", 1)
            .withTemplate("CAST({0} AS VARCHAR)").withSpecialHandling().withGroupBy());
        b.register("Parse", FunctionMapping.of("PARSE_{TYPE}", 1).withSpecialHandling());
        b.register("Convert", FunctionMapping.of("CAST({0} AS {TYPE})", 1).withSpecialHandling());
        b.register("ToInt", FunctionMapping.templated("CAST({0} AS INTEGER)", 1));
        b.register("ToLong", FunctionMapping.templated("CAST({0} AS BIGINT)", 1));
        b.register("ToDouble", FunctionMapping.templated("CAST({0} AS DOUBLE)", 1));
        b.register("ToDecimal", FunctionMapping.templated("CAST({0} AS DECIMAL)", 1));
    }

    private static void registerConditionalFunctions(Builder b) {
        b.register("Case", FunctionMapping.of("CASE", 2, FunctionMapping.UNBOUNDED).withSpecialHandling());
        b.register("Coalesce", FunctionMapping.of("COALESCE", 1, FunctionMapping.UNBOUNDED));
        b.register("IfNull", FunctionMapping.of("IFNULL", 2));
        b.register("NullIf", FunctionMapping.of("NULLIF", 2));
    }

    private static void registerMiscFunctions(Builder b) {
        // URL
        b.register("UrlExtractHost", FunctionMapping.of("URL_EXTRACT_HOST", 1));
        b.register("UrlExtractPath", FunctionMapping.of("URL_EXTRACT_PATH", 1));
        b.register("UrlExtractQuery", FunctionMapping.of("URL_EXTRACT_QUERY", 1));
        b.register("UrlExtractProtocol", FunctionMapping.of("URL_EXTRACT_PROTOCOL", 1));

        // Geo
        b.register("GeoDistance", FunctionMapping.of("GEO_DISTANCE", 4));
        b.register("AsGeoJson", FunctionMapping.of("AS_GEOJSON", 2));

        // Crypto
        b.register("Md5", FunctionMapping.of("MD5", 1));
        b.register("Sha1", FunctionMapping.of("SHA1", 1));
        b.register("Sha256", FunctionMapping.of("SHA256", 1));

        // Window metadata
        b.register("WindowStart", FunctionMapping.templated("WINDOWSTART", 0));
        b.register("RowTime", FunctionMapping.of("ROWTIME", 0).withOrderBy());
        b.register("RowKey", FunctionMapping.of("ROWKEY", 0));
    }
}
