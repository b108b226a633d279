package com.streamsql.generator;

import com.streamsql.config.CompilerConfig;
import com.streamsql.exception.TypeIncompatibilityException;
import com.streamsql.exception.UnsupportedConstructException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Conditional;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Expression;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.MemberAccess;
import com.streamsql.expression.MethodCall;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.expression.UnaryExpression;
import com.streamsql.functions.FunctionCatalog;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExpressionTranslator}: catalog-driven calls, special handlers,
 * operators and structural limits.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Expression Translator Tests")
public class ExpressionTranslatorTest extends TestBase {

    private final Parameter o = Parameter.of("o");
    private final MemberAccess name = new MemberAccess(o, "Name", ValueType.STRING);
    private final MemberAccess qty = new MemberAccess(o, "Qty", ValueType.INT);
    private final MemberAccess amount = new MemberAccess(o, "Amount", ValueType.DOUBLE);
    private final MemberAccess ts = new MemberAccess(o, "Ts", ValueType.DATETIME);
    private final MemberAccess code = new MemberAccess(o, "Code", ValueType.STRING);

    private ExpressionTranslator translator;

    @Override
    protected void doSetUp() {
        translator = new ExpressionTranslator(FunctionCatalog.defaults());
    }

    // ==================== String functions ====================

    @Nested
    @DisplayName("String Functions")
    class StringFunctionTests {

        @Test
        @DisplayName("TC-TRN-001: Instance receiver becomes the first argument")
        void testToUpper() {
            MethodCall call = MethodCall.instance(name, "ToUpper", ValueType.STRING);

            assertThat(translator.translateCall(call)).isEqualTo("UPPER(Name)");
        }

        @Test
        @DisplayName("TC-TRN-002: Resolver qualifies member references")
        void testResolver() {
            MethodCall call = MethodCall.instance(name, "ToLower", ValueType.STRING);

            assertThat(translator.translateCall(call, m -> "o." + m.member())).isEqualTo("LOWER(o.Name)");
        }

        @Test
        @DisplayName("TC-TRN-003: Substring keeps its arguments in order")
        void testSubstring() {
            MethodCall call = MethodCall.instance(name, "Substring", ValueType.STRING,
                Constant.of(1), Constant.of(3));

            assertThat(translator.translateCall(call)).isEqualTo("SUBSTRING(Name, 1, 3)");
        }

        @Test
        @DisplayName("TC-TRN-004: Contains renders through its template")
        void testContainsTemplate() {
            MethodCall call = MethodCall.instance(name, "Contains", ValueType.BOOLEAN, Constant.of("x"));

            assertThat(translator.translateCall(call)).isEqualTo("INSTR(Name, 'x') > 0");
        }

        @Test
        @DisplayName("TC-TRN-005: Argument count outside the mapping bounds is rejected")
        void testArgumentCount() {
            MethodCall call = MethodCall.instance(name, "Substring", ValueType.STRING);

            assertThatThrownBy(() -> translator.translateCall(call))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Method 'Substring' expects 2-3 arguments, but got 1");
        }

        @Test
        @DisplayName("TC-TRN-006: UPPER over a number is a type error")
        void testUpperOverNumber() {
            MethodCall call = MethodCall.instance(qty, "ToUpper", ValueType.STRING);

            assertThatThrownBy(() -> translator.translateCall(call))
                .isInstanceOf(TypeIncompatibilityException.class)
                .hasMessageContaining("UPPER");
        }
    }

    // ==================== Date functions ====================

    @Nested
    @DisplayName("Date Functions")
    class DateFunctionTests {

        @Test
        @DisplayName("TC-TRN-010: Date parts extract from a TIMESTAMP cast")
        void testYear() {
            MethodCall call = MethodCall.instance(ts, "Year", ValueType.INT);

            assertThat(translator.translateCall(call)).isEqualTo("EXTRACT(YEAR FROM CAST(Ts AS TIMESTAMP))");
        }

        @Test
        @DisplayName("TC-TRN-011: AddDays renders DATEADD with the amount first")
        void testAddDays() {
            MethodCall call = MethodCall.instance(ts, "AddDays", ValueType.DATETIME, Constant.of(7));

            assertThat(translator.translateCall(call)).isEqualTo("DATEADD('day', 7, Ts)");
        }

        @Test
        @DisplayName("TC-TRN-012: ToString of a timestamp formats it in UTC")
        void testTimestampToString() {
            MethodCall call = MethodCall.instance(ts, "ToString", ValueType.STRING);

            assertThat(translator.translateCall(call))
                .isEqualTo("FORMAT_TIMESTAMP(CAST(Ts AS TIMESTAMP), 'yyyy-MM-dd''T''HH:mm:ssXXX', 'UTC')");
        }
    }

    // ==================== Casts ====================

    @Nested
    @DisplayName("Casts")
    class CastTests {

        @Test
        @DisplayName("TC-TRN-020: ToString of a number casts to VARCHAR")
        void testNumberToString() {
            MethodCall call = MethodCall.instance(qty, "ToString", ValueType.STRING);

            assertThat(translator.translateCall(call)).isEqualTo("CAST(Qty AS VARCHAR)");
        }

        @Test
        @DisplayName("TC-TRN-021: Convert.ToInt32 falls back to a CAST")
        void testConvertToInt32() {
            MethodCall call = MethodCall.staticCall("Convert", "ToInt32", ValueType.INT, code);

            assertThat(translator.translateCall(call)).isEqualTo("CAST(Code AS INTEGER)");
        }

        @Test
        @DisplayName("TC-TRN-022: Parse casts to the result type")
        void testParse() {
            MethodCall toInt = MethodCall.staticCall("Int32", "Parse", ValueType.INT, code);
            MethodCall toDecimal = MethodCall.staticCall("Decimal", "Parse", ValueType.DECIMAL, code);

            assertThat(translator.translateCall(toInt)).isEqualTo("CAST(Code AS INTEGER)");
            assertThat(translator.translateCall(toDecimal)).isEqualTo("CAST(Code AS DECIMAL(18, 2))");
        }

        @Test
        @DisplayName("TC-TRN-023: Decimal precision follows the configuration")
        void testParseWithConfiguredDecimal() {
            ExpressionTranslator wide = new ExpressionTranslator(
                FunctionCatalog.defaults(), CompilerConfig.defaults().withDecimal(28, 6));
            MethodCall call = MethodCall.staticCall("Decimal", "Parse", ValueType.DECIMAL, code);

            assertThat(wide.translateCall(call)).isEqualTo("CAST(Code AS DECIMAL(28, 6))");
        }
    }

    // ==================== Aggregates and conditionals ====================

    @Nested
    @DisplayName("Aggregates And Conditionals")
    class AggregateTests {

        @Test
        @DisplayName("TC-TRN-030: Count over a selector lambda is COUNT(*)")
        void testCountLambda() {
            Parameter g = Parameter.grouping("g");
            Parameter x = Parameter.of("x");
            MethodCall call = MethodCall.extension("Enumerable", "Count", ValueType.LONG, g,
                Lambda.of(x, new MemberAccess(x, "IsActive", ValueType.BOOLEAN)));

            assertThat(translator.translateCall(call)).isEqualTo("COUNT(*)");
        }

        @Test
        @DisplayName("TC-TRN-031: Count over a column counts that column")
        void testCountColumn() {
            MethodCall call = MethodCall.staticCall("Enumerable", "Count", ValueType.LONG, amount);

            assertThat(translator.translateCall(call)).isEqualTo("COUNT(Amount)");
        }

        @Test
        @DisplayName("TC-TRN-032: SUM over text is a type error")
        void testSumOverString() {
            Parameter g = Parameter.grouping("g");
            Parameter x = Parameter.of("x");
            MethodCall call = MethodCall.extension("Enumerable", "Sum", ValueType.DOUBLE, g,
                Lambda.of(x, new MemberAccess(x, "Name", ValueType.STRING)));

            assertThatThrownBy(() -> translator.translateCall(call))
                .isInstanceOfSatisfying(TypeIncompatibilityException.class, e -> {
                    assertThat(e.getFunctionName()).isEqualTo("SUM");
                    assertThat(e.getArgumentCategory()).isEqualTo("STRING");
                });
        }

        @Test
        @DisplayName("TC-TRN-033: Case pairs conditions with results and keeps a trailing ELSE")
        void testCase() {
            MethodCall call = MethodCall.staticCall("Sql", "Case", ValueType.STRING,
                new BinaryExpression(amount, BinaryExpression.Operator.GREATER_THAN, Constant.of(10)),
                Constant.of("big"), Constant.of("small"));

            assertThat(translator.translateCall(call)).isEqualTo("CASE WHEN (Amount > 10) THEN 'big' ELSE 'small' END");
        }

        @Test
        @DisplayName("TC-TRN-034: Ternary renders as CASE WHEN")
        void testConditional() {
            Expression conditional = new Conditional(
                new BinaryExpression(amount, BinaryExpression.Operator.GREATER_THAN, Constant.of(10)),
                Constant.of("high"), Constant.of("low"));

            assertThat(translator.translate(conditional, MemberResolver.BARE))
                .isEqualTo("CASE WHEN (Amount > 10) THEN 'high' ELSE 'low' END");
        }

        @Test
        @DisplayName("TC-TRN-035: Ternary branches of different types are rejected")
        void testConditionalTypeMismatch() {
            Expression conditional = new Conditional(
                new MemberAccess(o, "IsActive", ValueType.BOOLEAN), Constant.of("yes"), Constant.of(0));

            assertThatThrownBy(() -> translator.translate(conditional, MemberResolver.BARE))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("CASE expression type mismatch");
        }
    }

    // ==================== Operators and literals ====================

    @Nested
    @DisplayName("Operators And Literals")
    class OperatorTests {

        @Test
        @DisplayName("TC-TRN-040: Negation wraps its operand")
        void testNot() {
            Expression not = UnaryExpression.not(new MemberAccess(o, "IsActive", ValueType.BOOLEAN));

            assertThat(translator.translate(not, MemberResolver.BARE)).isEqualTo("NOT (IsActive)");
        }

        @Test
        @DisplayName("TC-TRN-041: Null coalescing renders COALESCE")
        void testCoalesce() {
            Expression coalesce = new BinaryExpression(name, BinaryExpression.Operator.COALESCE, Constant.of("n/a"));

            assertThat(translator.translate(coalesce, MemberResolver.BARE)).isEqualTo("COALESCE(Name, 'n/a')");
        }

        @Test
        @DisplayName("TC-TRN-042: Implicit conversions are transparent")
        void testConvert() {
            Expression widened = new BinaryExpression(UnaryExpression.convert(qty, ValueType.LONG),
                BinaryExpression.Operator.MULTIPLY, Constant.of(2L));

            assertThat(translator.translate(widened, MemberResolver.BARE)).isEqualTo("(Qty * 2)");
        }

        @Test
        @DisplayName("TC-TRN-043: String literals escape single quotes")
        void testLiterals() {
            assertThat(SqlLiterals.safeToString("it's")).isEqualTo("'it''s'");
            assertThat(SqlLiterals.safeToString(null)).isEqualTo("NULL");
            assertThat(SqlLiterals.safeToString(Boolean.TRUE)).isEqualTo("true");
            assertThat(SqlLiterals.safeToString(42)).isEqualTo("42");
        }

        @Test
        @DisplayName("TC-TRN-044: Object initializers cannot be function arguments")
        void testObjectInitRejected() {
            Expression init = ObjectInit.anonymous().bind("A", name).build();

            assertThatThrownBy(() -> translator.translate(init, MemberResolver.BARE))
                .isInstanceOf(UnsupportedConstructException.class);
        }
    }

    // ==================== Unsupported constructs ====================

    @Nested
    @DisplayName("Unsupported Constructs")
    class UnsupportedTests {

        @Test
        @DisplayName("TC-TRN-050: Unknown methods are rejected with their name")
        void testUnknownMethod() {
            MethodCall call = MethodCall.instance(name, "Frobnicate", ValueType.STRING, Constant.of(1), Constant.of(2));

            assertThatThrownBy(() -> translator.translateCall(call))
                .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Function 'Frobnicate' is not supported.");
                    assertThat(e.getConstruct()).isEqualTo("Frobnicate");
                });
        }

        @Test
        @DisplayName("TC-TRN-051: Core string functions must come from the catalog")
        void testMissingCoreFunction() {
            ExpressionTranslator bare = new ExpressionTranslator(FunctionCatalog.builder().build());
            MethodCall call = MethodCall.instance(name, "ToUpper", ValueType.STRING);

            assertThatThrownBy(() -> bare.translateCall(call))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessage("Function 'ToUpper' is not supported in the target KSQL version.");
        }

        @Test
        @DisplayName("TC-TRN-052: Expressions deeper than the configured limit are rejected")
        void testDepthLimit() {
            ExpressionTranslator shallow = new ExpressionTranslator(
                FunctionCatalog.defaults(), CompilerConfig.defaults().withLimits(10, 2, 1000));
            Expression nested = amount;
            for (int i = 0; i < 4; i++) {
                nested = MethodCall.instance(nested, "Abs", ValueType.DOUBLE);
            }
            MethodCall call = (MethodCall) nested;

            assertThatThrownBy(() -> shallow.translateCall(call))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Expression depth exceeds maximum allowed depth of 2");
        }

        @Test
        @DisplayName("TC-TRN-053: Expressions with too many nodes are rejected")
        void testNodeLimit() {
            ExpressionTranslator small = new ExpressionTranslator(
                FunctionCatalog.defaults(), CompilerConfig.defaults().withLimits(10, 50, 3));
            MethodCall call = MethodCall.staticCall("String", "Concat", ValueType.STRING, name, code, name);

            assertThatThrownBy(() -> small.translateCall(call))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Expression complexity exceeds maximum allowed nodes of 3");
        }
    }
}
