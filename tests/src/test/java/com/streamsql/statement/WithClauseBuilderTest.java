package com.streamsql.statement;

import com.streamsql.exception.ValidationException;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link WithClauseBuilder}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("WITH Clause Builder Tests")
public class WithClauseBuilderTest extends TestBase {

    @Test
    @DisplayName("TC-WITH-001: Minimal clause")
    void testMinimal() {
        assertThat(WithClauseBuilder.forTopic("T").build())
            .isEqualTo("WITH (KAFKA_TOPIC='T', VALUE_FORMAT='AVRO')");
        assertThat(WithClauseBuilder.forTopic("T").keyed(true).build())
            .isEqualTo("WITH (KAFKA_TOPIC='T', KEY_FORMAT='AVRO', VALUE_FORMAT='AVRO')");
    }

    @Test
    @DisplayName("TC-WITH-002: Every property in fixed order")
    void testFullOrder() {
        String with = WithClauseBuilder.forTopic("T")
            .retentionMs(1000L, true)
            .replicas(2)
            .partitions(3)
            .valueSchemaFullName("v")
            .keySchemaFullName("k")
            .cleanupPolicy("compact")
            .keyed(true)
            .build();

        assertThat(with).isEqualTo("WITH (KAFKA_TOPIC='T', CLEANUP_POLICY='compact', KEY_FORMAT='AVRO', "
            + "VALUE_FORMAT='AVRO', KEY_AVRO_SCHEMA_FULL_NAME='k', VALUE_AVRO_SCHEMA_FULL_NAME='v', "
            + "PARTITIONS=3, REPLICAS=2, RETENTION_MS=1000)");
    }

    @Test
    @DisplayName("TC-WITH-003: Key schema requires a keyed sink")
    void testKeySchemaNeedsKey() {
        String with = WithClauseBuilder.forTopic("T").keySchemaFullName("k").build();

        assertThat(with).doesNotContain("KEY_AVRO_SCHEMA_FULL_NAME");
    }

    @Test
    @DisplayName("TC-WITH-004: Disallowed retention and non-positive counts are omitted")
    void testOmittedValues() {
        String with = WithClauseBuilder.forTopic("T")
            .partitions(0)
            .replicas(null)
            .retentionMs(1000L, false)
            .cleanupPolicy(" ")
            .build();

        assertThat(with).isEqualTo("WITH (KAFKA_TOPIC='T', VALUE_FORMAT='AVRO')");
    }

    @Test
    @DisplayName("TC-WITH-005: Topic is required")
    void testBlankTopic() {
        assertThatThrownBy(() -> WithClauseBuilder.forTopic(" ").build())
            .isInstanceOf(ValidationException.class)
            .hasMessage("kafkaTopic is required");
    }
}
