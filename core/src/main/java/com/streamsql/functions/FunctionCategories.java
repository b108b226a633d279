package com.streamsql.functions;

import com.streamsql.types.ValueType.Category;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Centralized function categorization shared by the catalog and the translator.
 *
 * <p>Holds two tables:
 * <ul>
 *   <li>The category grouping of built-in source method names</li>
 *   <li>The per-function argument category allow-list, keyed by target function name</li>
 * </ul>
 */
public final class FunctionCategories {

    private FunctionCategories() {
        // Utility class - prevent instantiation
    }

    /**
     * Built-in source method names grouped by category, in declaration order.
     */
    public static final Map<String, List<String>> BY_CATEGORY = createCategories();

    /**
     * Source method names treated as aggregates.
     */
    public static final Set<String> AGGREGATES = Set.copyOf(BY_CATEGORY.get("Aggregate"));

    private static final Set<Category> NUMERIC = Collections.unmodifiableSet(
        EnumSet.of(Category.INT, Category.BIGINT, Category.DOUBLE));

    private static final Set<Category> COMPARABLE = Collections.unmodifiableSet(
        EnumSet.of(Category.INT, Category.BIGINT, Category.DOUBLE, Category.DECIMAL,
            Category.STRING, Category.BOOLEAN, Category.DATETIME));

    private static final Set<Category> ANY_VALUE = Collections.unmodifiableSet(
        EnumSet.of(Category.INT, Category.BIGINT, Category.DOUBLE, Category.DECIMAL,
            Category.STRING, Category.BOOLEAN, Category.DATETIME, Category.STRUCT));

    private static final Set<Category> TEXT = Collections.unmodifiableSet(EnumSet.of(Category.STRING));

    /**
     * Argument categories accepted by target functions. Functions absent from
     * this table accept any argument.
     */
    public static final Map<String, Set<Category>> ALLOWED_ARGUMENT_CATEGORIES = Map.of(
        "SUM", NUMERIC,
        "AVG", NUMERIC,
        "MIN", COMPARABLE,
        "MAX", COMPARABLE,
        "TOPK", COMPARABLE,
        "COUNT", ANY_VALUE,
        "COLLECT_LIST", ANY_VALUE,
        "LOWER", TEXT,
        "UPPER", TEXT,
        "LEN", TEXT
    );

    /**
     * Returns the allowed argument categories for a target function.
     *
     * @param targetFunction the target function name (any case)
     * @return the allowed categories, or null when unrestricted
     */
    public static Set<Category> allowedCategories(String targetFunction) {
        return ALLOWED_ARGUMENT_CATEGORIES.get(targetFunction.toUpperCase());
    }

    private static Map<String, List<String>> createCategories() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("String", List.of("ToUpper", "ToLower", "Substring", "Length", "Trim", "Replace",
            "Contains", "StartsWith", "EndsWith", "Split", "Concat", "IndexOf", "PadLeft", "PadRight"));
        map.put("Math", List.of("Abs", "Round", "Floor", "Ceiling", "Sqrt", "Power", "Sign",
            "Sin", "Cos", "Tan", "Log", "Log10", "Exp"));
        map.put("Date", List.of("AddDays", "AddHours", "AddMinutes", "AddSeconds", "AddMilliseconds",
            "Year", "Month", "Day", "Hour", "Minute", "Second", "DayOfWeek", "DayOfYear", "WeekOfYear"));
        map.put("Aggregate", List.of("Sum", "Count", "Max", "Min", "Average", "LatestByOffset",
            "EarliestByOffset", "CollectList", "CollectSet", "CountDistinct", "Histogram", "TopK",
            "TopKDistinct"));
        map.put("Array", List.of("ArrayLength", "ArrayContains", "ArraySlice", "ArrayJoin",
            "ArrayDistinct", "ArrayExcept", "ArrayIntersect", "ArrayUnion", "ArraySort",
            "ArrayMax", "ArrayMin"));
        map.put("JSON", List.of("JsonExtractString", "JsonArrayLength", "JsonKeys",
            "JsonArrayContains", "JsonConcat", "JsonRecords"));
        map.put("Cast", List.of("ToString", "Parse", "Convert", "ToInt", "ToLong", "ToDouble", "ToDecimal"));
        map.put("Conditional", List.of("Case", "Coalesce", "IfNull", "NullIf"));
        map.put("URL", List.of("UrlExtractHost", "UrlExtractPath", "UrlExtractQuery", "UrlExtractProtocol"));
        map.put("GEO", List.of("GeoDistance", "AsGeoJson"));
        map.put("Crypto", List.of("Md5", "Sha1", "Sha256"));
        map.put("Window", List.of("WindowStart", "RowTime", "RowKey"));
        return Collections.unmodifiableMap(map);
    }
}
