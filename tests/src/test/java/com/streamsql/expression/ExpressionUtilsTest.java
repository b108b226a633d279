package com.streamsql.expression;

import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.streamsql.test.QueryFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExpressionUtils} and the expression node factories.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Utility Tests")
public class ExpressionUtilsTest extends TestBase {

    private static final Set<String> AGGREGATES = Set.of("Sum", "Count", "Max");

    private final Parameter o = Parameter.of("o");
    private final Parameter g = Parameter.grouping("g");
    private final Parameter x = Parameter.of("x");
    private final MemberAccess amount = new MemberAccess(o, "Amount", ValueType.DOUBLE);

    // ==================== Tree walking ====================

    @Nested
    @DisplayName("Tree Walking")
    class TreeWalkingTests {

        @Test
        @DisplayName("TC-EXU-001: Children follow evaluation order")
        void testChildren() {
            BinaryExpression sum = new BinaryExpression(amount, BinaryExpression.Operator.ADD, Constant.of(1));
            MethodCall upper = MethodCall.instance(new MemberAccess(o, "Region", ValueType.STRING),
                "ToUpper", ValueType.STRING);

            assertThat(ExpressionUtils.children(sum)).containsExactly(amount, Constant.of(1));
            assertThat(ExpressionUtils.children(upper)).hasSize(1);
            assertThat(ExpressionUtils.children(Constant.of(1))).isEmpty();
        }

        @Test
        @DisplayName("TC-EXU-002: Depth and node count")
        void testDepthAndNodes() {
            Expression expr = greaterThan(
                new BinaryExpression(amount, BinaryExpression.Operator.MULTIPLY, Constant.of(2)),
                Constant.of(100));

            assertThat(ExpressionUtils.depth(Constant.of(1))).isEqualTo(1);
            assertThat(ExpressionUtils.depth(expr)).isEqualTo(4);
            assertThat(ExpressionUtils.nodeCount(expr)).isEqualTo(6);
        }

        @Test
        @DisplayName("TC-EXU-003: Conversions are unwrapped")
        void testUnwrapConvert() {
            Expression converted = UnaryExpression.convert(UnaryExpression.convert(amount, ValueType.DECIMAL),
                ValueType.DOUBLE);

            assertThat(ExpressionUtils.unwrapConvert(converted)).isSameAs(amount);
            assertThat(ExpressionUtils.unwrapConvert(UnaryExpression.not(new MemberAccess(o, "IsActive", ValueType.BOOLEAN)))).isInstanceOf(UnaryExpression.class);
        }
    }

    // ==================== Calls ====================

    @Nested
    @DisplayName("Aggregate Detection")
    class AggregateDetectionTests {

        @Test
        @DisplayName("TC-EXU-010: Calls are found anywhere in the tree")
        void testContainsCall() {
            Expression total = aggregate("Sum", ValueType.DOUBLE, g, x, new MemberAccess(x, "Amount", ValueType.DOUBLE));

            assertThat(ExpressionUtils.containsCall(greaterThan(total, Constant.of(10)), AGGREGATES::contains)).isTrue();
            assertThat(ExpressionUtils.containsCall(amount, AGGREGATES::contains)).isFalse();
        }

        @Test
        @DisplayName("TC-EXU-011: Aggregates inside aggregates are nested")
        void testNestedCalls() {
            MemberAccess price = new MemberAccess(x, "Price", ValueType.DOUBLE);
            MethodCall inner = aggregate("Max", ValueType.DOUBLE, g, x, price);
            MethodCall outer = aggregate("Sum", ValueType.DOUBLE, g, x, inner);
            BinaryExpression sideBySide = new BinaryExpression(inner, BinaryExpression.Operator.ADD, count(g));

            assertThat(ExpressionUtils.hasNestedCalls(outer, AGGREGATES::contains)).isTrue();
            assertThat(ExpressionUtils.hasNestedCalls(sideBySide, AGGREGATES::contains)).isFalse();
        }

        @Test
        @DisplayName("TC-EXU-012: Extension calls carry their receiver as first argument")
        void testExtensionShape() {
            MethodCall call = count(g);

            assertThat(call.isStatic()).isTrue();
            assertThat(call.receiver()).isNull();
            assertThat(call.arguments()).containsExactly(g);
            assertThatThrownBy(() -> new MethodCall("Enumerable", "Count", null, List.of(), true, true,
                ValueType.LONG))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be static and carry its receiver");
        }
    }

    // ==================== Members ====================

    @Nested
    @DisplayName("Members")
    class MemberTests {

        @Test
        @DisplayName("TC-EXU-020: Group key references")
        void testGroupKey() {
            assertThat(ExpressionUtils.isGroupKeyObject(groupKey(g, ValueType.INT))).isTrue();
            assertThat(ExpressionUtils.isGroupKeyMember(groupKeyPart(g, "Region", ValueType.STRING))).isTrue();
            assertThat(ExpressionUtils.isGroupKeyObject(groupKeyPart(g, "Region", ValueType.STRING))).isFalse();
            assertThat(ExpressionUtils.isGroupKeyMember(amount)).isFalse();
        }

        @Test
        @DisplayName("TC-EXU-021: Member paths and roots")
        void testPathAndRoot() {
            MemberAccess nested = groupKeyPart(g, "Region", ValueType.STRING);

            assertThat(ExpressionUtils.memberPath(nested)).containsExactly("Key", "Region");
            assertThat(ExpressionUtils.memberRoot(nested)).isEqualTo(g);
            assertThat(ExpressionUtils.findParameter(Lambda.of(o, amount), Parameter::isGrouping)).isNull();
            assertThat(ExpressionUtils.findParameter(nested, Parameter::isGrouping)).isEqualTo(g);
        }

        @Test
        @DisplayName("TC-EXU-022: Names are sanitized to identifier characters")
        void testSanitizeName() {
            assertThat(ExpressionUtils.sanitizeName("Order Id")).isEqualTo("Order_Id");
            assertThat(ExpressionUtils.sanitizeName("a-b.c")).isEqualTo("a_b_c");
            assertThat(ExpressionUtils.sanitizeName(null)).isEmpty();
        }
    }
}
