package com.streamsql.generator;

import com.streamsql.exception.UnsupportedConstructException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Expression;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.hub.HubProjectionOverride;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.DecimalType;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.streamsql.test.QueryFixtures.aggregate;
import static com.streamsql.test.QueryFixtures.count;
import static com.streamsql.test.QueryFixtures.groupKey;
import static com.streamsql.test.QueryFixtures.groupKeyPart;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SelectClauseBuilder}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SELECT Clause Builder Tests")
public class SelectClauseBuilderTest extends TestBase {

    private final Parameter o = Parameter.of("o");
    private final Parameter p = Parameter.of("p");
    private final Parameter g = Parameter.grouping("g");
    private final Parameter x = Parameter.of("x");

    private final MemberAccess orderId = MemberAccess.key(o, "OrderId", ValueType.INT);
    private final MemberAccess amount = new MemberAccess(o, "Amount", ValueType.DOUBLE);
    private final MemberAccess region = new MemberAccess(o, "Region", ValueType.STRING);

    private ExpressionTranslator translator;

    @Override
    protected void doSetUp() {
        translator = new ExpressionTranslator(FunctionCatalog.defaults());
    }

    // ==================== Plain projections ====================

    @Nested
    @DisplayName("Plain Projections")
    class PlainProjectionTests {

        @Test
        @DisplayName("TC-SEL-001: Columns are upper-cased and aliased by member name")
        void testBareColumns() {
            Expression projection = ObjectInit.anonymous()
                .bind("Id", orderId)
                .bind("Amount", amount)
                .build();

            String sql = SelectClauseBuilder.plain(translator).build(projection);

            logData("SELECT", sql);
            assertThat(sql).isEqualTo("ORDERID AS Id, AMOUNT AS Amount");
        }

        @Test
        @DisplayName("TC-SEL-002: Mapped parameters qualify their columns")
        void testAliasedColumns() {
            Expression projection = ObjectInit.anonymous()
                .bind("OrderId", orderId)
                .bind("Paid", new MemberAccess(p, "Paid", ValueType.DOUBLE))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .parameterAliases(Map.of("o", "o", "p", "i"))
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("o.ORDERID AS OrderId, i.PAID AS Paid");
        }

        @Test
        @DisplayName("TC-SEL-003: Whole-row projection selects everything")
        void testParameterProjection() {
            assertThat(SelectClauseBuilder.plain(translator).build(o)).isEqualTo("*");
        }

        @Test
        @DisplayName("TC-SEL-004: Repeated aliases get a numeric suffix")
        void testDuplicateAlias() {
            Expression projection = ObjectInit.anonymous()
                .bind("A", amount)
                .bind("A", region)
                .build();

            assertThat(SelectClauseBuilder.plain(translator).build(projection))
                .isEqualTo("AMOUNT AS A, REGION AS A_1");
        }

        @Test
        @DisplayName("TC-SEL-005: String length renders LEN")
        void testStringLength() {
            Expression projection = ObjectInit.anonymous()
                .bind("RegionLength", new MemberAccess(region, "Length", ValueType.INT))
                .build();

            assertThat(SelectClauseBuilder.plain(translator).build(projection))
                .isEqualTo("LEN(REGION) AS RegionLength");
        }

        @Test
        @DisplayName("TC-SEL-006: Function calls are translated with column names")
        void testFunctionCall() {
            Expression projection = ObjectInit.anonymous()
                .bind("Upper", MethodCall.instance(region, "ToUpper", ValueType.STRING))
                .build();

            assertThat(SelectClauseBuilder.plain(translator).build(projection))
                .isEqualTo("UPPER(REGION) AS Upper");
        }

        @Test
        @DisplayName("TC-SEL-007: Nested object initializers are rejected")
        void testNestedObjectInit() {
            Expression projection = ObjectInit.anonymous()
                .bind("Inner", ObjectInit.anonymous().bind("A", amount).build())
                .build();

            assertThatThrownBy(() -> SelectClauseBuilder.plain(translator).build(projection))
                .isInstanceOf(UnsupportedConstructException.class);
        }

        @Test
        @DisplayName("TC-SEL-008: Null projection is rejected")
        void testNullProjection() {
            assertThatThrownBy(() -> SelectClauseBuilder.plain(translator).build(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-null expression");
        }
    }

    // ==================== Grouping ====================

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("TC-SEL-010: Grouping key expands to the GROUP BY keys")
        void testGroupKeyExpansion() {
            Expression projection = ObjectInit.anonymous()
                .bind("CustomerId", groupKey(g, ValueType.INT))
                .bind("Total", aggregate("Sum", ValueType.DOUBLE, g, x,
                    new MemberAccess(x, "Amount", ValueType.DOUBLE)))
                .bind("Count", count(g))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .groupByKeys("CustomerId")
                .build()
                .build(projection);

            logData("SELECT", sql);
            assertThat(sql).isEqualTo("CustomerId AS CustomerId, SUM(AMOUNT) AS Total, COUNT(*) AS Count");
        }

        @Test
        @DisplayName("TC-SEL-011: Composite key parts follow the DTO order")
        void testCompositeKeyOrder() {
            Expression projection = ObjectInit.named("RegionTotals")
                .bind("CustomerId", groupKeyPart(g, "CustomerId", ValueType.INT))
                .bind("Region", groupKeyPart(g, "Region", ValueType.STRING))
                .bind("Total", aggregate("Sum", ValueType.DOUBLE, g, x,
                    new MemberAccess(x, "Amount", ValueType.DOUBLE)))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .groupByKeys("CustomerId, Region")
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("CUSTOMERID AS CustomerId, REGION AS Region, SUM(AMOUNT) AS Total");
        }

        @Test
        @DisplayName("TC-SEL-012: DTO keys out of GROUP BY order are rejected")
        void testCompositeKeyOrderMismatch() {
            Expression projection = ObjectInit.named("RegionTotals")
                .bind("Region", groupKeyPart(g, "Region", ValueType.STRING))
                .bind("CustomerId", groupKeyPart(g, "CustomerId", ValueType.INT))
                .build();

            SelectClauseBuilder builder = SelectClauseBuilder.builder(translator)
                .groupByKeys("CustomerId, Region")
                .build();

            assertThatThrownBy(() -> builder.build(projection))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("The order of GroupBy keys does not match the output DTO definition");
        }

        @Test
        @DisplayName("TC-SEL-013: Aggregates mixed with columns need a grouping")
        void testAggregateMixing() {
            Expression mixed = new BinaryExpression(
                MethodCall.staticCall("Enumerable", "Sum", ValueType.DOUBLE, amount),
                BinaryExpression.Operator.ADD, amount);
            Expression projection = ObjectInit.anonymous().bind("Total", mixed).build();

            assertThatThrownBy(() -> SelectClauseBuilder.plain(translator).build(projection))
                .isInstanceOf(ValidationException.class)
                .hasMessage("SELECT clause cannot mix aggregate functions with non-aggregate columns without GROUP BY");
        }

        @Test
        @DisplayName("TC-SEL-014: Nested aggregates are rejected")
        void testNestedAggregates() {
            MethodCall inner = MethodCall.staticCall("Enumerable", "Sum", ValueType.DOUBLE, amount);
            MethodCall outer = MethodCall.staticCall("Enumerable", "Max", ValueType.DOUBLE, inner);
            Expression projection = ObjectInit.anonymous().bind("M", outer).build();

            assertThatThrownBy(() -> SelectClauseBuilder.plain(translator).build(projection))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Nested aggregate functions are not supported");
        }
    }

    // ==================== Decimal hints ====================

    @Nested
    @DisplayName("Decimal Hints")
    class DecimalHintTests {

        @Test
        @DisplayName("TC-SEL-020: Hinted aliases are cast to DECIMAL")
        void testDecimalCast() {
            Expression projection = ObjectInit.anonymous().bind("Amount", amount).build();

            String sql = SelectClauseBuilder.builder(translator)
                .decimalHints(Map.of("amount", new DecimalType(10, 2)))
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("CAST(AMOUNT AS DECIMAL(10, 2)) AS Amount");
        }

        @Test
        @DisplayName("TC-SEL-021: Existing casts are not wrapped twice")
        void testExistingCast() {
            Expression projection = ObjectInit.anonymous()
                .bind("Amount", MethodCall.staticCall("Decimal", "Parse", ValueType.DECIMAL, region))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .decimalHints(Map.of("Amount", new DecimalType(10, 2)))
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("CAST(REGION AS DECIMAL(18, 2)) AS Amount");
        }
    }

    // ==================== Hub overrides ====================

    @Nested
    @DisplayName("Hub Overrides")
    class HubOverrideTests {

        private final MemberAccess price = new MemberAccess(x, "Price", ValueType.DOUBLE);

        @Test
        @DisplayName("TC-SEL-030: Aggregates are retargeted onto hub columns")
        void testAggregateRetarget() {
            Expression projection = ObjectInit.named("Bar")
                .bind("Symbol", groupKey(g, ValueType.STRING))
                .bind("High", aggregate("Max", ValueType.DOUBLE, g, x, price))
                .bind("AvgPrice", aggregate("Average", ValueType.DOUBLE, g, x, price))
                .build();

            SelectClauseBuilder builder = SelectClauseBuilder.builder(translator)
                .groupByKeys("SYMBOL")
                .overrides(Map.of(
                    "High", HubProjectionOverride.forAggregate("HIGH", "Max"),
                    "AvgPrice", HubProjectionOverride.forAggregate("SUMPRICE", "Average")), " ")
                .build();
            String sql = builder.build(projection);

            logData("SELECT", sql);
            assertThat(builder.hasOverrides()).isTrue();
            assertThat(sql).isEqualTo(
                "SYMBOL AS SYMBOL, MAX(o.HIGH) AS High, (SUM(o.SUMPRICE) / SUM(CNT)) AS AvgPrice");
        }

        @Test
        @DisplayName("TC-SEL-031: Average over a non-sum column stays AVG")
        void testAverageOverPlainColumn() {
            Expression projection = ObjectInit.anonymous()
                .bind("AvgPrice", aggregate("Average", ValueType.DOUBLE, g, x, price))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .overrides(Map.of("AvgPrice", HubProjectionOverride.forAggregate("h.PRICE", "Average")), "h")
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("AVG(h.PRICE) AS AvgPrice");
        }

        @Test
        @DisplayName("TC-SEL-032: Non-aggregate members without a function read the latest value")
        void testLatestByOffset() {
            Expression projection = ObjectInit.anonymous()
                .bind("Last", new MemberAccess(o, "Price", ValueType.DOUBLE))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .overrides(Map.of("Last", new HubProjectionOverride("CLOSE", null, false)), null)
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("LATEST_BY_OFFSET(CLOSE) AS Last");
        }

        @Test
        @DisplayName("TC-SEL-033: Excluded members are dropped")
        void testExcludedMembers() {
            Expression projection = ObjectInit.anonymous()
                .bind("Symbol", groupKey(g, ValueType.STRING))
                .bind("WindowStartRaw", new MemberAccess(o, "Ts", ValueType.DATETIME))
                .bind("High", aggregate("Max", ValueType.DOUBLE, g, x, price))
                .build();

            String sql = SelectClauseBuilder.builder(translator)
                .groupByKeys("SYMBOL")
                .overrides(Map.of(), null)
                .exclude(Set.of("windowstartraw"))
                .build()
                .build(projection);

            assertThat(sql).isEqualTo("SYMBOL AS SYMBOL, MAX(PRICE) AS High");
        }
    }
}
