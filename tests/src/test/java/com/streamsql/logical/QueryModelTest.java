package com.streamsql.logical;

import com.streamsql.config.CompilerConfig;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.DecimalType;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.streamsql.test.QueryFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link QueryModel} and the descriptors it carries.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Query Model Tests")
public class QueryModelTest extends TestBase {

    private final FunctionCatalog catalog = FunctionCatalog.defaults();
    private final Parameter o = Parameter.of("o");

    // ==================== Model ====================

    @Nested
    @DisplayName("Model")
    class ModelTests {

        @Test
        @DisplayName("TC-QM-001: Windows are distinct and ordered by duration")
        void testWindowNormalization() {
            QueryModel model = QueryModel.builder()
                .source(ORDERS)
                .windows("1h", "5m", "1m", "5m", "1d")
                .build();

            assertThat(model.windows()).containsExactly("1m", "5m", "1h", "1d");
            assertThat(model.hasTumbling()).isTrue();
        }

        @Test
        @DisplayName("TC-QM-025: Window ordering spans seconds to months")
        void testWindowOrderingAcrossUnits() {
            QueryModel model = QueryModel.builder()
                .source(ORDERS)
                .windows("1mo", "30s", "1wk", "1m", "1000mo", "1d")
                .build();

            assertThat(model.windows()).containsExactly("30s", "1m", "1d", "1wk", "1mo", "1000mo");
        }

        @Test
        @DisplayName("TC-QM-026: Models built from one builder do not share extras")
        void testExtrasCopiedPerBuild() {
            QueryModel.Builder builder = QueryModel.builder().source(ORDERS).extra(Extras.EMIT, "EMIT FINAL");

            QueryModel first = builder.build();
            QueryModel second = builder.build();
            first.extras().put(Extras.SINK_PARTITIONS, 6);

            assertThat(first.extras()).isNotSameAs(second.extras());
            assertThat(second.extras().contains(Extras.SINK_PARTITIONS)).isFalse();
            assertThat(second.extras().getString(Extras.EMIT)).contains("EMIT FINAL");

            builder.extra(Extras.SINK_REPLICAS, 3);
            assertThat(first.extras().contains(Extras.SINK_REPLICAS)).isFalse();
        }

        @Test
        @DisplayName("TC-QM-002: Plain projections compile to streams")
        void testStreamType() {
            QueryModel model = QueryModel.builder()
                .source(ORDERS)
                .select(Lambda.of(o, ObjectInit.anonymous().bind("Id", ORDERS.member(o, "OrderId")).build()))
                .build();

            assertThat(model.isAggregateQuery(catalog)).isFalse();
            assertThat(model.determineType(catalog)).isEqualTo(SourceKind.STREAM);
        }

        @Test
        @DisplayName("TC-QM-003: Grouping, windows, hopping or aggregates make a table")
        void testTableType() {
            Parameter g = Parameter.grouping("g");
            Lambda aggregating = Lambda.of(g, ObjectInit.anonymous().bind("Count", count(g)).build());

            assertThat(QueryModel.builder().source(ORDERS).groupBy(Lambda.of(o, ORDERS.member(o, "CustomerId")))
                .build().determineType(catalog)).isEqualTo(SourceKind.TABLE);
            assertThat(QueryModel.builder().source(ORDERS).windows("5m")
                .build().determineType(catalog)).isEqualTo(SourceKind.TABLE);
            assertThat(QueryModel.builder().source(ORDERS)
                .hopping(HoppingWindow.of(Duration.ofMinutes(5), Duration.ofMinutes(1)))
                .build().determineType(catalog)).isEqualTo(SourceKind.TABLE);
            assertThat(QueryModel.builder().source(ORDERS).select(aggregating)
                .build().hasAggregates(catalog)).isTrue();
        }

        @Test
        @DisplayName("TC-QM-004: Primary alias defaults to whether the query joins")
        void testPrimaryAliasDefault() {
            assertThat(QueryModel.builder().source(ORDERS).build().primarySourceRequiresAlias()).isFalse();
            assertThat(QueryModel.builder().source(ORDERS).join(PAYMENTS, null).build()
                .primarySourceRequiresAlias()).isTrue();
            assertThat(QueryModel.builder().source(ORDERS).primarySourceRequiresAlias(true).build()
                .primarySourceRequiresAlias()).isTrue();
        }

        @Test
        @DisplayName("TC-QM-005: Optional clauses are empty unless set")
        void testOptionalClauses() {
            QueryModel model = QueryModel.builder().source(ORDERS).build();

            assertThat(model.whereCondition()).isEmpty();
            assertThat(model.joinCondition()).isEmpty();
            assertThat(model.withinSeconds()).isEmpty();
            assertThat(model.graceSeconds()).isEmpty();
            assertThat(model.hopping()).isEmpty();
            assertThat(model.sources()).containsExactly(ORDERS);
        }
    }

    // ==================== Descriptors ====================

    @Nested
    @DisplayName("Descriptors")
    class DescriptorTests {

        @Test
        @DisplayName("TC-QM-010: Source name is the upper-cased topic, else the type name")
        void testSourceName() {
            assertThat(ORDERS.sourceName()).isEqualTo("ORDERS");
            assertThat(EVENTS.sourceName()).isEqualTo("Event");
        }

        @Test
        @DisplayName("TC-QM-011: Key columns and identifiers follow declaration order")
        void testKeysAndIdentifiers() {
            assertThat(ORDERS.hasKey()).isTrue();
            assertThat(PAYMENTS.hasKey()).isFalse();
            assertThat(ORDERS.keyColumns()).extracting(ColumnDescriptor::name).containsExactly("OrderId");
            assertThat(CUSTOMERS.columnIdentifiers()).containsExactly("CUSTOMERID", "NAME", "REGION");
        }

        @Test
        @DisplayName("TC-QM-012: Members carry the column type and key flag")
        void testMember() {
            MemberAccess key = ORDERS.member(o, "OrderId");

            assertThat(key.isKey()).isTrue();
            assertThat(key.valueType()).isEqualTo(ValueType.INT);
            assertThatThrownBy(() -> ORDERS.member(o, "Missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column 'Missing' is not declared on OrderEvent");
        }

        @Test
        @DisplayName("TC-QM-013: Decimal hints fall back to the configured precision")
        void testDecimalHints() {
            ResultType result = ResultType.of("OrderView",
                ColumnDescriptor.decimal("Amount", 10, 4),
                ColumnDescriptor.of("Fee", ValueType.DECIMAL),
                ColumnDescriptor.of("Region", ValueType.STRING));

            Map<String, DecimalType> hints = result.decimalHints(CompilerConfig.defaults());

            assertThat(hints).containsOnlyKeys("Amount", "Fee");
            assertThat(hints.get("Amount")).isEqualTo(new DecimalType(10, 4));
            assertThat(hints.get("Fee")).isEqualTo(new DecimalType(18, 2));
        }

        @Test
        @DisplayName("TC-QM-014: Hopping windows require positive durations")
        void testHoppingValidation() {
            assertThatThrownBy(() -> HoppingWindow.of(Duration.ZERO, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("size must be positive");
            assertThat(new HoppingWindow(Duration.ofMinutes(5), Duration.ofMinutes(1), Duration.ofSeconds(30))
                .hasGrace()).isTrue();
        }
    }

    // ==================== Extras ====================

    @Nested
    @DisplayName("Extras")
    class ExtrasTests {

        @Test
        @DisplayName("TC-QM-020: Positive int settings accept int and short only")
        void testPositiveInt() {
            Extras extras = new Extras()
                .put("a", 3)
                .put("b", (short) 2)
                .put("c", 3L)
                .put("d", 0)
                .put("e", "4");

            assertThat(extras.getPositiveInt("a")).contains(3);
            assertThat(extras.getPositiveInt("b")).contains(2);
            assertThat(extras.getPositiveInt("c")).isEmpty();
            assertThat(extras.getPositiveInt("d")).isEmpty();
            assertThat(extras.getPositiveInt("e")).isEmpty();
        }

        @Test
        @DisplayName("TC-QM-021: Positive long settings also parse strings")
        void testPositiveLong() {
            Extras extras = new Extras(Map.of("a", 86400000L, "b", " 1000 ", "c", "soon", "d", -1));

            assertThat(extras.getPositiveLong("a")).contains(86400000L);
            assertThat(extras.getPositiveLong("b")).contains(1000L);
            assertThat(extras.getPositiveLong("c")).isEmpty();
            assertThat(extras.getPositiveLong("d")).isEmpty();
        }

        @Test
        @DisplayName("TC-QM-022: Memoized values are computed once")
        void testMemoize() {
            Extras extras = new Extras();
            int[] calls = {0};

            String first = extras.memoize("k", String.class, () -> "v" + (++calls[0]));
            String second = extras.memoize("k", String.class, () -> "v" + (++calls[0]));

            assertThat(first).isEqualTo("v1");
            assertThat(second).isEqualTo("v1");
            assertThat(calls[0]).isEqualTo(1);
        }

        @Test
        @DisplayName("TC-QM-023: Caller settings are not overwritten by putIfAbsent")
        void testPutIfAbsent() {
            Extras extras = new Extras().put(Extras.EMIT, "EMIT FINAL");

            extras.putIfAbsent(Extras.EMIT, "EMIT CHANGES");

            assertThat(extras.getString(Extras.EMIT)).contains("EMIT FINAL");
            assertThat(extras.get(Extras.EMIT, Integer.class)).isEmpty();
            assertThat(extras.asMap()).containsOnlyKeys(Extras.EMIT);
        }

        @Test
        @DisplayName("TC-QM-024: Blank strings read as absent")
        void testBlankString() {
            Extras extras = new Extras().put(Extras.VALUE_SCHEMA_FULL_NAME, "  ");

            assertThat(extras.contains(Extras.VALUE_SCHEMA_FULL_NAME)).isTrue();
            assertThat(extras.getString(Extras.VALUE_SCHEMA_FULL_NAME)).isEmpty();
        }
    }
}
