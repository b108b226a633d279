package com.streamsql.logical;

import com.streamsql.config.CompilerConfig;
import com.streamsql.types.DecimalType;
import com.streamsql.types.ValueType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output record type of a query, used for per-member cast hints.
 *
 * @param name the result type name
 * @param columns the result columns
 */
public record ResultType(String name, List<ColumnDescriptor> columns) {

    public ResultType {
        Objects.requireNonNull(name, "name must not be null");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
    }

    public static ResultType of(String name, ColumnDescriptor... columns) {
        return new ResultType(name, List.of(columns));
    }

    /**
     * Returns the decimal cast target per DECIMAL column, falling back to the configured
     * precision and scale where the column declares none.
     *
     * @param config the compiler configuration
     * @return decimal types keyed by column name
     */
    public Map<String, DecimalType> decimalHints(CompilerConfig config) {
        Map<String, DecimalType> hints = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            if (column.valueType() != ValueType.DECIMAL) {
                continue;
            }
            int precision = column.precision() != null ? column.precision() : config.decimalPrecision();
            int scale = column.scale() != null ? column.scale() : config.decimalScale();
            hints.put(column.name(), new DecimalType(precision, scale));
        }
        return hints;
    }
}
