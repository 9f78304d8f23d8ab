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

import com.strata.ast.ArrayJoin;
import com.strata.ast.Call;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Lambda;
import com.strata.compiler.BaseCompilerTest;
import com.strata.config.CompilerSettings;
import com.strata.errors.ImpossibleAstError;
import com.strata.errors.UnsupportedFeatureError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.compare;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.inlined;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PostgresPrinter Tests")
class PostgresPrinterTest extends BaseCompilerTest {

    private static String sql(Expr node) {
        return Printer.print(node, Dialect.POSTGRES, CompilerSettings.defaults(), TEAM_ID).sql();
    }

    @Nested
    @DisplayName("Null Safety Tests")
    class NullSafetyTests {

        @Test
        @DisplayName("Should use IS NOT DISTINCT FROM when both sides are nullable")
        void shouldUseDistinctFrom() {
            assertEquals("(a IS NOT DISTINCT FROM b)", sql(eq(field("a"), field("b"))));
            assertEquals("(a IS DISTINCT FROM b)", sql(compare(CompareOperator.NOT_EQ, field("a"), field("b"))));
        }

        @Test
        @DisplayName("Should coalesce a comparison with one nullable side")
        void shouldCoalesceOneNullableSide() {
            assertEquals("COALESCE((a = 1), FALSE)", sql(eq(field("a"), constant(1L))));
            assertEquals("COALESCE((a <> 1), TRUE)", sql(compare(CompareOperator.NOT_EQ, field("a"), constant(1L))));
            assertEquals("COALESCE((a > 1), FALSE)", sql(compare(CompareOperator.GT, field("a"), constant(1L))));
            assertEquals("COALESCE((a !~ 1), TRUE)",
                    sql(compare(CompareOperator.NOT_REGEX, field("a"), constant(1L))));
        }

        @Test
        @DisplayName("Should print a comparison with NULL as IS NULL")
        void shouldPrintIsNull() {
            assertEquals("(a IS NULL)", sql(eq(field("a"), Constant.NULL)));
            assertEquals("(a IS NOT NULL)", sql(compare(CompareOperator.NOT_EQ, field("a"), Constant.NULL)));
        }

        @Test
        @DisplayName("Should leave comparisons of non-nullable columns bare")
        void shouldLeaveNonNullableComparisonsBare() {
            String sql = compile(select("events", eq(field("event"), constant("x")), field("event")),
                    context().withDialect(Dialect.POSTGRES)).sql();

            assertTrue(sql.contains("(events.event = :strata_val_0)"), sql);
            assertFalse(sql.contains("COALESCE"), sql);
        }
    }

    @Nested
    @DisplayName("Template Tests")
    class TemplateTests {

        @Test
        @DisplayName("Should substitute positional arguments")
        void shouldSubstitutePositionalArguments() {
            assertEquals("(x = y)", PostgresPrinter.expand("({0} = {1})", List.of("x", "y")));
        }

        @Test
        @DisplayName("Should splice the remaining arguments")
        void shouldSpliceRemainingArguments() {
            assertEquals("f(a, b, c)", PostgresPrinter.expand("f({0*})", List.of("a", "b", "c")));
            assertEquals("g(a; b || c)", PostgresPrinter.expand("g({0}; {1*: || })", List.of("a", "b", "c")));
        }

        @Test
        @DisplayName("Should reject a template that needs a missing argument")
        void shouldRejectMissingArgument() {
            assertThrows(ImpossibleAstError.class, () -> PostgresPrinter.expand("({0} = {1})", List.of("x")));
        }

        @Test
        @DisplayName("Should print count without arguments as count(*)")
        void shouldPrintCountStar() {
            assertEquals("count(*)", sql(call("count")));
        }

        @Test
        @DisplayName("Should escape inlined strings by doubling quotes")
        void shouldEscapeInlinedStrings() {
            assertEquals("lower('it''s')", sql(call("lower", inlined("it's"))));
        }
    }

    @Nested
    @DisplayName("Unsupported Feature Tests")
    class UnsupportedFeatureTests {

        @Test
        @DisplayName("Should reject lambdas")
        void shouldRejectLambdas() {
            Expr node = call("arrayMap", new Lambda(List.of("x"), field("x")), field("arr"));

            UnsupportedFeatureError error = assertThrows(UnsupportedFeatureError.class, () -> sql(node));
            assertEquals(Dialect.POSTGRES, error.getDialect());
        }

        @Test
        @DisplayName("Should reject parametric aggregations")
        void shouldRejectParametricAggregations() {
            Expr node = new Call("count", List.of(field("a")), List.of(constant(1L)), false, null);

            assertThrows(UnsupportedFeatureError.class, () -> sql(node));
        }

        @Test
        @DisplayName("Should reject functions without a Postgres form")
        void shouldRejectFunctionsWithoutPostgresForm() {
            assertThrows(UnsupportedFeatureError.class, () -> sql(call("arrayElement", field("a"), constant(1L))));
        }

        @Test
        @DisplayName("Should reject ARRAY JOIN before printing anything")
        void shouldRejectArrayJoin() {
            Expr node = select("events", null, field("event")).toBuilder()
                    .arrayJoin(new ArrayJoin(ArrayJoin.Kind.INNER, List.of(field("tags"))))
                    .build();

            UnsupportedFeatureError error = assertThrows(UnsupportedFeatureError.class, () -> sql(node));
            assertEquals("ARRAY JOIN is not supported by the POSTGRES dialect", error.getMessage());
        }
    }
}
