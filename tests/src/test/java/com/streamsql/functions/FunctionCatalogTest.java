package com.streamsql.functions;

import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.Parameter;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.DecimalType;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FunctionCatalog} and {@link FunctionMapping}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Function Catalog Tests")
public class FunctionCatalogTest extends TestBase {

    private final FunctionCatalog catalog = FunctionCatalog.defaults();

    // ==================== Lookup ====================

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @ParameterizedTest
        @CsvSource({
            "ToUpper, UPPER",
            "ToLower, LOWER",
            "Sum, SUM",
            "Average, AVG",
            "LatestByOffset, LATEST_BY_OFFSET",
            "Ceiling, CEIL",
            "Length, LEN",
            "ArrayContains, ARRAY_CONTAINS"
        })
        @DisplayName("TC-CAT-001: Built-in method names map to dialect functions")
        void testBuiltInMappings(String method, String function) {
            assertThat(catalog.lookup(method)).get()
                .extracting(FunctionMapping::function)
                .isEqualTo(function);
        }

        @Test
        @DisplayName("TC-CAT-002: Lookup is case-sensitive and null-safe")
        void testLookupCaseSensitive() {
            assertThat(catalog.lookup("toupper")).isEmpty();
            assertThat(catalog.lookup(null)).isEmpty();
            assertThat(catalog.has("ToUpper")).isTrue();
            assertThat(catalog.has(null)).isFalse();
        }

        @Test
        @DisplayName("TC-CAT-003: Aggregates are recognized by source method name")
        void testAggregates() {
            assertThat(catalog.isAggregateFunction("Sum")).isTrue();
            assertThat(catalog.isAggregateFunction("Count")).isTrue();
            assertThat(catalog.isAggregateFunction("TopKDistinct")).isTrue();
            assertThat(catalog.isAggregateFunction("ToUpper")).isFalse();
        }

        @Test
        @DisplayName("TC-CAT-004: Special-handling functions are reported sorted")
        void testSpecialHandling() {
            assertThat(catalog.specialHandlingFunctions())
                .containsExactly("Case", "Convert", "Count", "Parse", "ToString");
        }

        @Test
        @DisplayName("TC-CAT-011: Categories are listed in declaration order")
        void testFunctionsByCategory() {
            assertThat(catalog.functionsByCategory().keySet()).containsExactly(
                "String", "Math", "Date", "Aggregate", "Array", "JSON", "Cast", "Conditional",
                "URL", "GEO", "Crypto", "Window");
            assertThat(catalog.functionsByCategory().get("Aggregate"))
                .startsWith("Sum", "Count", "Max", "Min", "Average");
        }

        @Test
        @DisplayName("TC-CAT-012: Single-category lookup returns the members or nothing")
        void testFunctionsInCategory() {
            assertThat(catalog.functionsInCategory("Date"))
                .contains("Year", "Hour", "WeekOfYear")
                .doesNotContain("Sum");
            assertThat(catalog.functionsInCategory("Crypto")).containsExactly("Md5", "Sha1", "Sha256");
            assertThat(catalog.functionsInCategory("Geometry")).isEmpty();
            assertThat(catalog.functionsInCategory("date")).isEmpty();
            assertThat(catalog.functionsInCategory(null)).isEmpty();
        }
    }

    // ==================== Type inference ====================

    @ParameterizedTest
    @CsvSource({
        "Sum, DOUBLE",
        "count, BIGINT",
        "Max, ANY",
        "TopK, ARRAY",
        "Histogram, MAP",
        "ToInt32, INTEGER",
        "ToInt64, BIGINT",
        "ToBoolean, BOOLEAN",
        "ToString, VARCHAR",
        "Frobnicate, UNKNOWN"
    })
    @DisplayName("TC-CAT-005: Result type inferred from method name")
    void testInferType(String method, String expected) {
        assertThat(catalog.inferTypeFromMethodName(method)).isEqualTo(expected);
    }

    @Test
    @DisplayName("TC-CAT-006: ToDecimal uses the catalog decimal type")
    void testInferDecimal() {
        assertThat(catalog.inferTypeFromMethodName("ToDecimal")).isEqualTo("DECIMAL(18, 2)");

        FunctionCatalog wide = catalog.toBuilder().decimalType(new DecimalType(38, 9)).build();
        assertThat(wide.inferTypeFromMethodName("ToDecimal")).isEqualTo("DECIMAL(38, 9)");
    }

    // ==================== Extension ====================

    @Nested
    @DisplayName("Extension")
    class ExtensionTests {

        @Test
        @DisplayName("TC-CAT-007: Derived catalog adds mappings without touching the defaults")
        void testToBuilderDoesNotMutateDefaults() {
            FunctionCatalog extended = catalog.toBuilder()
                .register("Greatest", FunctionMapping.of("GREATEST", 2, FunctionMapping.UNBOUNDED))
                .build();

            assertThat(extended.has("Greatest")).isTrue();
            assertThat(extended.size()).isEqualTo(catalog.size() + 1);
            assertThat(FunctionCatalog.defaults().has("Greatest")).isFalse();
        }

        @Test
        @DisplayName("TC-CAT-008: Blank method names are rejected")
        void testBlankRegistration() {
            assertThatThrownBy(() -> FunctionCatalog.builder().register(" ", FunctionMapping.of("X", 1)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-CAT-009: Unknown registrations are listed under Other")
        void testDebugInfo() {
            String info = catalog.toBuilder()
                .register("Greatest", FunctionMapping.of("GREATEST", 2, FunctionMapping.UNBOUNDED))
                .build()
                .debugInfo();
            logData("Catalog listing", info.length() + " chars");

            assertThat(info).contains("[Aggregate]");
            assertThat(info).contains("• Sum → SUM (args: 1-1)");
            assertThat(info).contains("[Other]");
            assertThat(info).contains("• Greatest → GREATEST (args: 2-*)");
        }
    }

    // ==================== Aggregate nesting ====================

    @Test
    @DisplayName("TC-CAT-010: Nested aggregates are detected")
    void testNestedAggregates() {
        Parameter g = Parameter.grouping("g");
        Parameter x = Parameter.of("x");
        MethodCall inner = MethodCall.extension("Enumerable", "Max", ValueType.DOUBLE, g,
            Lambda.of(x, new MemberAccess(x, "Price", ValueType.DOUBLE)));
        MethodCall outer = MethodCall.extension("Enumerable", "Sum", ValueType.DOUBLE, g, Lambda.of(x, inner));

        assertThat(catalog.containsAggregate(inner)).isTrue();
        assertThat(catalog.hasNestedAggregates(inner)).isFalse();
        assertThat(catalog.hasNestedAggregates(outer)).isTrue();
    }

    // ==================== Mapping ====================

    @Nested
    @DisplayName("Function Mapping")
    class MappingTests {

        @Test
        @DisplayName("TC-MAP-001: Standard call joins arguments")
        void testStandardCall() {
            assertThat(FunctionMapping.of("CONCAT", 2, FunctionMapping.UNBOUNDED)
                .generateStandardCall("a", "b", "c")).isEqualTo("CONCAT(a, b, c)");
        }

        @Test
        @DisplayName("TC-MAP-002: Templates substitute positional placeholders")
        void testTemplate() {
            FunctionMapping right = catalog.lookup("Right").orElseThrow();
            assertThat(right.generateStandardCall("Name", "3"))
                .isEqualTo("SUBSTRING(Name, CASE WHEN LEN(Name) - 3 + 1 < 1 THEN 1 ELSE LEN(Name) - 3 + 1 END, 3)");
        }

        @Test
        @DisplayName("TC-MAP-003: Argument count outside the bounds is rejected")
        void testInvalidArgCount() {
            assertThatThrownBy(() -> FunctionMapping.of("ABS", 1).generateStandardCall("a", "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 1-1, got 2");
        }

        @Test
        @DisplayName("TC-MAP-004: Inverted bounds are rejected")
        void testInvalidBounds() {
            assertThatThrownBy(() -> FunctionMapping.of("X", 3, 1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-MAP-005: with-methods keep the other flags")
        void testWithMethods() {
            FunctionMapping mapping = FunctionMapping.of("UPPER", 1).withGroupBy().withOrderBy();
            assertThat(mapping.allowedInGroupBy()).isTrue();
            assertThat(mapping.allowedInOrderBy()).isTrue();
            assertThat(mapping.specialHandling()).isFalse();
            assertThat(mapping.withSpecialHandling().allowedInGroupBy()).isTrue();
        }
    }
}
