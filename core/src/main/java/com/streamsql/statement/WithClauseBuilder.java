package com.streamsql.statement;

import com.streamsql.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@code WITH (...)} property list of a CREATE statement.
 *
 * <p>Properties are emitted in a fixed order:
 * <pre>
 *   KAFKA_TOPIC, CLEANUP_POLICY, KEY_FORMAT, VALUE_FORMAT,
 *   KEY_AVRO_SCHEMA_FULL_NAME, VALUE_AVRO_SCHEMA_FULL_NAME,
 *   PARTITIONS, REPLICAS, RETENTION_MS
 * </pre>
 * Absent optional values are omitted.
 */
public final class WithClauseBuilder {

    private static final String FORMAT = "AVRO";

    private final String kafkaTopic;
    private boolean keyed;
    private String cleanupPolicy;
    private String keySchemaFullName;
    private String valueSchemaFullName;
    private Integer partitions;
    private Integer replicas;
    private Long retentionMs;
    private boolean retentionAllowed = true;

    private WithClauseBuilder(String kafkaTopic) {
        this.kafkaTopic = kafkaTopic;
    }

    /**
     * Starts a WITH clause for the given sink topic.
     *
     * @param kafkaTopic the sink topic name
     * @return a new builder
     */
    public static WithClauseBuilder forTopic(String kafkaTopic) {
        return new WithClauseBuilder(kafkaTopic);
    }

    /**
     * Declares whether any source carries key columns; adds {@code KEY_FORMAT}.
     */
    public WithClauseBuilder keyed(boolean hasKey) {
        this.keyed = hasKey;
        return this;
    }

    public WithClauseBuilder cleanupPolicy(String policy) {
        this.cleanupPolicy = policy;
        return this;
    }

    public WithClauseBuilder keySchemaFullName(String name) {
        this.keySchemaFullName = name;
        return this;
    }

    public WithClauseBuilder valueSchemaFullName(String name) {
        this.valueSchemaFullName = name;
        return this;
    }

    public WithClauseBuilder partitions(Integer value) {
        this.partitions = value;
        return this;
    }

    public WithClauseBuilder replicas(Integer value) {
        this.replicas = value;
        return this;
    }

    /**
     * Sets the retention, emitted only while {@code allowed} is true.
     *
     * @param value retention in milliseconds, may be null
     * @param allowed false for non-windowed tables
     * @return this builder
     */
    public WithClauseBuilder retentionMs(Long value, boolean allowed) {
        this.retentionMs = value;
        this.retentionAllowed = allowed;
        return this;
    }

    /**
     * Renders the clause.
     *
     * @return {@code WITH (KAFKA_TOPIC='...', ...)}
     * @throws ValidationException if the topic is blank
     */
    public String build() {
        if (kafkaTopic == null || kafkaTopic.isBlank()) {
            throw new ValidationException("kafkaTopic is required", "WITH", null,
                "Pass the target statement name as the sink topic");
        }
        List<String> parts = new ArrayList<>();
        parts.add("KAFKA_TOPIC='" + kafkaTopic + "'");
        if (hasText(cleanupPolicy)) {
            parts.add("CLEANUP_POLICY='" + cleanupPolicy + "'");
        }
        if (keyed) {
            parts.add("KEY_FORMAT='" + FORMAT + "'");
        }
        parts.add("VALUE_FORMAT='" + FORMAT + "'");
        if (keyed && hasText(keySchemaFullName)) {
            parts.add("KEY_AVRO_SCHEMA_FULL_NAME='" + keySchemaFullName + "'");
        }
        if (hasText(valueSchemaFullName)) {
            parts.add("VALUE_AVRO_SCHEMA_FULL_NAME='" + valueSchemaFullName + "'");
        }
        if (partitions != null && partitions > 0) {
            parts.add("PARTITIONS=" + partitions);
        }
        if (replicas != null && replicas > 0) {
            parts.add("REPLICAS=" + replicas);
        }
        if (retentionAllowed && retentionMs != null && retentionMs > 0) {
            parts.add("RETENTION_MS=" + retentionMs);
        }
        return "WITH (" + String.join(", ", parts) + ")";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
