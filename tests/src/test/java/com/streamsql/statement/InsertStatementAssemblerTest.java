package com.streamsql.statement;

import com.streamsql.exception.CompilationScopeException;
import com.streamsql.exception.StatementGenerationException;
import com.streamsql.exception.ValidationException;
import com.streamsql.expression.BinaryExpression;
import com.streamsql.expression.Constant;
import com.streamsql.expression.Lambda;
import com.streamsql.expression.ObjectInit;
import com.streamsql.expression.Parameter;
import com.streamsql.logical.QueryModel;
import com.streamsql.test.TestBase;
import com.streamsql.test.TestCategories;
import com.streamsql.types.ValueType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.streamsql.test.QueryFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link InsertStatementAssembler}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("INSERT Statement Assembler Tests")
public class InsertStatementAssemblerTest extends TestBase {

    private final Parameter o = Parameter.of("o");
    private final Parameter p = Parameter.of("p");
    private final Parameter g = Parameter.grouping("g");
    private final Parameter x = Parameter.of("x");

    private InsertStatementAssembler assembler;
    private CompilationScope scope;

    @Override
    protected void doSetUp() {
        assembler = new InsertStatementAssembler();
        scope = CompilationScope.open("insert-tests");
    }

    @Test
    @DisplayName("TC-ISA-001: Filtered insert keeps the primary alias")
    void testFilteredInsert() {
        QueryModel model = QueryModel.builder()
            .source(ORDERS)
            .where(Lambda.of(o, greaterThan(ORDERS.member(o, "Amount"), Constant.of(100))))
            .select(Lambda.of(o, ObjectInit.anonymous()
                .bind("Id", ORDERS.member(o, "OrderId"))
                .bind("Amount", ORDERS.member(o, "Amount"))
                .build()))
            .build();

        String sql = assembler.build(scope, "ORDERS_ARCHIVE", model);

        logData("SQL", sql);
        assertThat(sql).isEqualTo(
            "INSERT INTO ORDERS_ARCHIVE SELECT o.ORDERID AS Id, o.AMOUNT AS Amount\n"
                + "FROM ORDERS o\n"
                + "WHERE (o.Amount > 100)\n"
                + "EMIT CHANGES;");
    }

    @Test
    @DisplayName("TC-ISA-002: Missing projection selects every column")
    void testSelectStar() {
        QueryModel model = QueryModel.builder().source(ORDERS).build();

        assertThat(assembler.build(scope, "ORDERS_ARCHIVE", model))
            .isEqualTo("INSERT INTO ORDERS_ARCHIVE SELECT *\nFROM ORDERS o\nEMIT CHANGES;");
    }

    @Test
    @DisplayName("TC-ISA-003: Grouped insert renders GROUP BY and HAVING")
    void testGroupedInsert() {
        QueryModel model = QueryModel.builder()
            .source(ORDERS)
            .groupBy(Lambda.of(o, ORDERS.member(o, "CustomerId")))
            .having(Lambda.of(g, greaterThan(count(g), Constant.of(10))))
            .select(Lambda.of(g, ObjectInit.anonymous()
                .bind("CustomerId", groupKey(g, ValueType.INT))
                .bind("Total", aggregate("Sum", ValueType.DOUBLE, g, x, ORDERS.member(x, "Amount")))
                .build()))
            .build();

        String sql = assembler.build(scope, "CUSTOMER_TOTALS", model);

        logData("SQL", sql);
        assertThat(sql).isEqualTo(
            "INSERT INTO CUSTOMER_TOTALS SELECT CustomerId AS CustomerId, SUM(o.AMOUNT) AS Total\n"
                + "FROM ORDERS o\n"
                + "GROUP BY CustomerId\n"
                + "HAVING (COUNT(*) > 10)\n"
                + "EMIT CHANGES;");
        assertThat(sql).doesNotContain("WITH (");
    }

    @Test
    @DisplayName("TC-ISA-004: Joined insert")
    void testJoinedInsert() {
        QueryModel model = QueryModel.builder()
            .source(ORDERS)
            .join(PAYMENTS, Lambda.of(o, p,
                BinaryExpression.equal(ORDERS.member(o, "OrderId"), PAYMENTS.member(p, "OrderId"))))
            .within(120)
            .build();

        String sql = assembler.build(scope, "ORDER_PAYMENTS", model);

        assertThat(sql).contains("FROM ORDERS o JOIN PAYMENTS i WITHIN 120 SECONDS ON (o.OrderId = i.OrderId)");
    }

    @Test
    @DisplayName("TC-ISA-005: Argument and precondition errors")
    void testErrors() {
        QueryModel model = QueryModel.builder().source(ORDERS).build();

        assertThatThrownBy(() -> assembler.build(scope, "", model))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Target name is required");
        assertThatThrownBy(() -> assembler.build(null, "ORDERS_ARCHIVE", model))
            .isInstanceOf(CompilationScopeException.class);
        assertThatThrownBy(() -> assembler.build(scope, "ORDERS_ARCHIVE", QueryModel.builder().build()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Source types are required");
    }

    @Test
    @DisplayName("TC-ISA-006: Unexpected failures are wrapped with the target name")
    void testWrappedFailure() {
        QueryModel model = QueryModel.builder().source(ORDERS).build();

        StatementGenerationException e = catchThrowableOfType(
            () -> assembler.build(scope, "ORDERS_ARCHIVE", model, source -> {
                throw new RuntimeException("boom");
            }),
            StatementGenerationException.class);

        assertThat(e).hasMessage("Failed to generate INSERT statement (statement: ORDERS_ARCHIVE)");
        assertThat(e.getStatementName()).isEqualTo("ORDERS_ARCHIVE");
    }
}
