package com.streamsql.config;

/**
 * Compiler-wide defaults and limits.
 *
 * <p>All configuration is programmatic. {@link #defaults()} returns the values the
 * statement assemblers use when the caller supplies nothing; the {@code with...}
 * methods return adjusted copies.
 *
 * @param decimalPrecision default precision for DECIMAL casts
 * @param decimalScale default scale for DECIMAL casts
 * @param defaultWithinSeconds join time bound used when a model does not set one
 * @param hubRowsSuffix source-name suffix that marks a derived per-second rows stream
 * @param defaultSinkPartitions sink partitions applied by the windowed decorator
 * @param defaultSinkReplicas sink replicas applied by the windowed decorator
 * @param maxGroupByKeys maximum number of GROUP BY keys
 * @param maxExpressionDepth maximum expression nesting depth per clause
 * @param maxExpressionNodes maximum expression node count per clause
 */
public record CompilerConfig(
        int decimalPrecision,
        int decimalScale,
        int defaultWithinSeconds,
        String hubRowsSuffix,
        int defaultSinkPartitions,
        int defaultSinkReplicas,
        int maxGroupByKeys,
        int maxExpressionDepth,
        int maxExpressionNodes) {

    /** Default DECIMAL precision. */
    public static final int DEFAULT_DECIMAL_PRECISION = 18;

    /** Default DECIMAL scale. */
    public static final int DEFAULT_DECIMAL_SCALE = 2;

    /** Default stream-stream join time bound in seconds. */
    public static final int DEFAULT_WITHIN_SECONDS = 300;

    /** Suffix of derived per-second rows streams. */
    public static final String DEFAULT_HUB_ROWS_SUFFIX = "_1s_rows";

    public static final int DEFAULT_SINK_PARTITIONS = 1;
    public static final int DEFAULT_SINK_REPLICAS = 1;
    public static final int DEFAULT_MAX_GROUP_BY_KEYS = 10;
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 50;
    public static final int DEFAULT_MAX_EXPRESSION_NODES = 1000;

    private static final CompilerConfig DEFAULTS = new CompilerConfig(
        DEFAULT_DECIMAL_PRECISION,
        DEFAULT_DECIMAL_SCALE,
        DEFAULT_WITHIN_SECONDS,
        DEFAULT_HUB_ROWS_SUFFIX,
        DEFAULT_SINK_PARTITIONS,
        DEFAULT_SINK_REPLICAS,
        DEFAULT_MAX_GROUP_BY_KEYS,
        DEFAULT_MAX_EXPRESSION_DEPTH,
        DEFAULT_MAX_EXPRESSION_NODES);

    public CompilerConfig {
        if (decimalPrecision < 1 || decimalPrecision > 38) {
            throw new IllegalArgumentException(
                "decimalPrecision must be between 1 and 38, got: " + decimalPrecision);
        }
        if (decimalScale < 0 || decimalScale > decimalPrecision) {
            throw new IllegalArgumentException(
                "decimalScale must be between 0 and " + decimalPrecision + ", got: " + decimalScale);
        }
        if (defaultWithinSeconds <= 0) {
            throw new IllegalArgumentException("defaultWithinSeconds must be positive");
        }
        if (hubRowsSuffix == null || hubRowsSuffix.isBlank()) {
            throw new IllegalArgumentException("hubRowsSuffix must not be blank");
        }
        if (maxGroupByKeys <= 0 || maxExpressionDepth <= 0 || maxExpressionNodes <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return the shared default configuration
     */
    public static CompilerConfig defaults() {
        return DEFAULTS;
    }

    public CompilerConfig withDecimal(int precision, int scale) {
        return new CompilerConfig(precision, scale, defaultWithinSeconds, hubRowsSuffix,
            defaultSinkPartitions, defaultSinkReplicas, maxGroupByKeys,
            maxExpressionDepth, maxExpressionNodes);
    }

    public CompilerConfig withDefaultWithinSeconds(int seconds) {
        return new CompilerConfig(decimalPrecision, decimalScale, seconds, hubRowsSuffix,
            defaultSinkPartitions, defaultSinkReplicas, maxGroupByKeys,
            maxExpressionDepth, maxExpressionNodes);
    }

    public CompilerConfig withHubRowsSuffix(String suffix) {
        return new CompilerConfig(decimalPrecision, decimalScale, defaultWithinSeconds, suffix,
            defaultSinkPartitions, defaultSinkReplicas, maxGroupByKeys,
            maxExpressionDepth, maxExpressionNodes);
    }

    public CompilerConfig withSinkDefaults(int partitions, int replicas) {
        return new CompilerConfig(decimalPrecision, decimalScale, defaultWithinSeconds, hubRowsSuffix,
            partitions, replicas, maxGroupByKeys, maxExpressionDepth, maxExpressionNodes);
    }

    public CompilerConfig withLimits(int groupByKeys, int depth, int nodes) {
        return new CompilerConfig(decimalPrecision, decimalScale, defaultWithinSeconds, hubRowsSuffix,
            defaultSinkPartitions, defaultSinkReplicas, groupByKeys, depth, nodes);
    }

    /**
     * Returns true if the given source name denotes a derived per-second rows stream.
     *
     * @param sourceName the source name (may be null)
     * @return true if the name ends with the hub rows suffix, ignoring case
     */
    public boolean isHubRowsSource(String sourceName) {
        if (sourceName == null) {
            return false;
        }
        return sourceName.toLowerCase().endsWith(hubRowsSuffix.toLowerCase());
    }
}
