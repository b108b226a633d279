package com.streamsql.logical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Open string-keyed side channel carried by a {@link QueryModel}.
 *
 * <p>Holds orthogonal settings (sink sizing, emit override, schema names, hub
 * column rules) and memoized derived values. Writers may only add idempotent
 * derived values; settings supplied by the caller are never overwritten.
 *
 * <p>Not thread-safe. Compiling one model from several threads must be serialized
 * by the caller.
 */
public final class Extras {

    public static final String SINK_PARTITIONS = "sink/partitions";
    public static final String SINK_REPLICAS = "sink/replicas";
    public static final String SINK_RETENTION_MS = "sink/retentionMs";
    public static final String SINK_CLEANUP_POLICY = "sink/cleanupPolicy";
    public static final String SINK_CLEANUP_POLICY_DOTTED = "sink/cleanup.policy";
    public static final String EMIT = "emit";
    public static final String VALUE_SCHEMA_FULL_NAME = "valueSchemaFullName";
    public static final String SELECT_OVERRIDES = "select/overrides";
    public static final String SELECT_EXCLUDE = "select/exclude";
    public static final String HUB_AVAILABLE_COLUMNS = "hub/availableColumns";
    public static final String HUB_PROJECTION = "hub/projection";
    public static final String HUB_METADATA = "hub/metadata";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public Extras() {
    }

    public Extras(Map<String, ?> initial) {
        values.putAll(initial);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns the value if it has the requested type.
     *
     * @param key the key
     * @param type the expected type
     * @param <T> the value type
     * @return the typed value, or empty when absent or of another type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Optional<String> getString(String key) {
        return get(key, String.class).filter(s -> !s.isBlank());
    }

    /**
     * Returns a positive int setting.
     *
     * @param key the key
     * @return the value, or empty when absent, non-integral or not positive
     */
    public Optional<Integer> getPositiveInt(String key) {
        Object value = values.get(key);
        if (value instanceof Integer || value instanceof Short) {
            int v = ((Number) value).intValue();
            return v > 0 ? Optional.of(v) : Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Returns a positive long setting; accepts long, int, short and numeric strings.
     *
     * @param key the key
     * @return the value, or empty when absent, unparsable or not positive
     */
    public Optional<Long> getPositiveLong(String key) {
        Object value = values.get(key);
        long v;
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            v = ((Number) value).longValue();
        } else if (value instanceof String s) {
            try {
                v = Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return v > 0 ? Optional.of(v) : Optional.empty();
    }

    public Extras put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public Extras putIfAbsent(String key, Object value) {
        values.putIfAbsent(key, value);
        return this;
    }

    /**
     * Returns the memoized value for a key, computing and storing it on first use.
     *
     * @param key the key
     * @param type the expected type
     * @param supplier computes the value
     * @param <T> the value type
     * @return the stored or computed value
     */
    public <T> T memoize(String key, Class<T> type, Supplier<T> supplier) {
        Object existing = values.get(key);
        if (type.isInstance(existing)) {
            return type.cast(existing);
        }
        T computed = supplier.get();
        values.put(key, computed);
        return computed;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Extras" + values.keySet();
    }
}
