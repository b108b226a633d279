package com.streamsql.hub;

import java.util.Objects;

/**
 * Per-output-alias retargeting of a SELECT member onto a hub column.
 *
 * @param targetColumn the hub column the member reads from, e.g. {@code SUMPRICE} or {@code CNT}
 * @param aggregateFunctionName the source aggregate name (e.g. {@code Average}), or null
 * @param aggregateOnly when true the rule applies to aggregate calls only and non-aggregate
 *        members keep their own rendering
 */
public record HubProjectionOverride(String targetColumn, String aggregateFunctionName, boolean aggregateOnly) {

    public HubProjectionOverride {
        Objects.requireNonNull(targetColumn, "targetColumn must not be null");
    }

    public static HubProjectionOverride forAggregate(String targetColumn, String aggregateFunctionName) {
        return new HubProjectionOverride(targetColumn, aggregateFunctionName, false);
    }

    public static HubProjectionOverride forAggregateOnly(String targetColumn, String aggregateFunctionName) {
        return new HubProjectionOverride(targetColumn, aggregateFunctionName, true);
    }
}
