/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.strata.printer;

import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.OrderExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.WindowExpr;
import com.strata.ast.WindowFrame;
import com.strata.ast.WindowFunction;
import com.strata.compiler.BaseCompilerTest;
import com.strata.compiler.CompileContext;
import com.strata.config.CompilerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.compare;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.inlined;
import static com.strata.ast.Exprs.tuple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ClickHousePrinter. Untyped operands count as nullable, which makes the null-safety
 * wrappers easy to observe.
 */
@DisplayName("ClickHousePrinter Tests")
class ClickHousePrinterTest extends BaseCompilerTest {

    private static PrintedQuery print(Expr node) {
        return Printer.print(node, Dialect.CLICKHOUSE, CompilerSettings.defaults(), TEAM_ID);
    }

    private static String sql(Expr node) {
        return print(node).sql();
    }

    @Nested
    @DisplayName("Literal Tests")
    class LiteralTests {

        @Test
        @DisplayName("Should bind strings as numbered parameters")
        void shouldBindStrings() {
            PrintedQuery printed = print(call("concat", constant("a"), constant("b")));

            assertEquals("concat(%(strata_val_0)s, %(strata_val_1)s)", printed.sql());
            assertEquals(Map.of("strata_val_0", "a", "strata_val_1", "b"), printed.params());
        }

        @Test
        @DisplayName("Should print numbers and booleans inline")
        void shouldPrintNumbersInline() {
            PrintedQuery printed = print(call("concat", constant(42L), constant(1.5), Constant.TRUE));

            assertEquals("concat(42, 1.5, true)", printed.sql());
            assertTrue(printed.params().isEmpty());
        }

        @Test
        @DisplayName("Should escape inlined strings")
        void shouldEscapeInlinedStrings() {
            assertEquals("lower('it\\'s a \\\\ path')", sql(call("lower", inlined("it's a \\ path"))));
        }

        @Test
        @DisplayName("Should print array element access with brackets")
        void shouldPrintArrayElement() {
            assertEquals("arr[1]", sql(call("arrayElement", field("arr"), constant(1L))));
        }
    }

    @Nested
    @DisplayName("Null Safety Tests")
    class NullSafetyTests {

        @Test
        @DisplayName("Should default equality to false when one side is nullable")
        void shouldWrapEqualityWithOneNullableSide() {
            assertEquals("ifNull(equals(a, 1), 0)", sql(eq(field("a"), constant(1L))));
        }

        @Test
        @DisplayName("Should default inequality to true when one side is nullable")
        void shouldWrapInequalityWithOneNullableSide() {
            assertEquals("ifNull(notEquals(a, 1), 1)", sql(compare(CompareOperator.NOT_EQ, field("a"), constant(1L))));
        }

        @Test
        @DisplayName("Should treat two NULLs as equal")
        void shouldTreatTwoNullsAsEqual() {
            assertEquals("ifNull(equals(a, b), and(isNull(a), isNull(b)))", sql(eq(field("a"), field("b"))));
            assertEquals("ifNull(notEquals(a, b), or(isNotNull(a), isNotNull(b)))",
                    sql(compare(CompareOperator.NOT_EQ, field("a"), field("b"))));
        }

        @Test
        @DisplayName("Should turn a comparison with NULL into a null check")
        void shouldTurnNullComparisonIntoCheck() {
            assertEquals("isNull(a)", sql(eq(field("a"), Constant.NULL)));
            assertEquals("isNotNull(a)", sql(compare(CompareOperator.NOT_EQ, Constant.NULL, field("a"))));
            assertEquals("1", sql(eq(Constant.NULL, Constant.NULL)));
        }

        @Test
        @DisplayName("Should ignore the right side of IN for nullability")
        void shouldIgnoreRightSideOfIn() {
            Expr in = compare(CompareOperator.IN, constant(1L), field("ids"));

            assertEquals("in(1, ids)", sql(in));
            assertEquals("ifNull(in(a, tuple(1, 2)), 0)",
                    sql(compare(CompareOperator.IN, field("a"), tuple(List.of(constant(1L), constant(2L))))));
        }

        @Test
        @DisplayName("Should leave comparisons of non-nullable columns bare")
        void shouldLeaveNonNullableComparisonsBare() {
            String sql = compile(select("events", eq(field("event"), constant("x")), field("event"))).sql();

            assertTrue(sql.contains("equals(events.event, %(strata_val_0)s)"), sql);
            assertFalse(sql.contains("ifNull("), sql);
        }
    }

    @Nested
    @DisplayName("Window Tests")
    class WindowTests {

        private WindowFunction lag(WindowFrame frame) {
            WindowExpr over = new WindowExpr(List.of(field("person_id")),
                    List.of(new OrderExpr(field("timestamp"), OrderExpr.Order.ASC)), frame);
            return new WindowFunction("lag", List.of(field("event")), over);
        }

        @Test
        @DisplayName("Should emulate lag with an explicit whole-partition frame")
        void shouldEmulateLag() {
            assertEquals("lagInFrame(event) OVER (PARTITION BY person_id ORDER BY timestamp ASC "
                    + "ROWS BETWEEN UNBOUNDED PRECEDING AND UNBOUNDED FOLLOWING)", sql(lag(null)));
        }

        @Test
        @DisplayName("Should keep the frame the window gave")
        void shouldKeepGivenFrame() {
            WindowFrame frame = new WindowFrame(WindowFrame.Method.ROWS, new WindowFrame.Bound(
                    WindowFrame.BoundKind.PRECEDING, 1), WindowFrame.Bound.currentRow());

            assertEquals("lagInFrame(event) OVER (PARTITION BY person_id ORDER BY timestamp ASC "
                    + "ROWS BETWEEN 1 PRECEDING AND CURRENT ROW)", sql(lag(frame)));
        }

        @Test
        @DisplayName("Should print lag natively for Postgres")
        void shouldPrintLagNativelyForPostgres() {
            assertEquals("lag(event) OVER (PARTITION BY person_id ORDER BY timestamp ASC)",
                    Printer.print(lag(null), Dialect.POSTGRES, CompilerSettings.defaults(), TEAM_ID).sql());
        }
    }

    @Test
    @DisplayName("Should expand cohort membership into a subquery")
    void shouldExpandCohortMembership() {
        String sql = sql(compare(CompareOperator.IN_COHORT, field("person_id"), constant(5L)));

        assertEquals("in(person_id, (SELECT person_id FROM cohort_people "
                + "WHERE and(equals(team_id, 1), equals(cohort_id, 5))))", sql);
    }

    @Test
    @DisplayName("Should append settings and format only to a SELECT")
    void shouldAppendTrailingClausesToSelect() {
        CompilerSettings settings = CompilerSettings.defaults().withOutputFormat("TabSeparated");
        SelectQuery query = select("events", null, field("event"));

        assertEquals("SELECT event FROM events LIMIT 50000 SETTINGS max_execution_time=60, join_use_nulls=1 "
                + "FORMAT TabSeparated",
                Printer.print(query, Dialect.CLICKHOUSE, settings, TEAM_ID).sql());
        assertEquals("lower(event)", Printer.print(call("lower", field("event")), Dialect.CLICKHOUSE, settings,
                TEAM_ID).sql());
    }

    @Test
    @DisplayName("Should print the same tree identically twice")
    void shouldPrintIdempotently() {
        CompileContext context = context();
        Expr prepared = compiler.prepare(select("events",
                eq(field("properties", "$browser"), constant("Chrome")), field("event")), context);

        PrintedQuery first = Printer.print(prepared, context);
        PrintedQuery second = Printer.print(prepared, context);

        assertEquals(first, second);
    }
}
