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

package com.strata.compiler;

import com.strata.ast.CompareOperation;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.SelectQuery;
import com.strata.ast.TraversingVisitor;
import com.strata.catalog.MaterializationCatalog;
import com.strata.catalog.PropertyValueType;
import com.strata.config.CompilerSettings;
import com.strata.config.Modifiers;
import com.strata.errors.QueryError;
import com.strata.errors.ResolutionError;
import com.strata.joins.SessionTableVersion;
import com.strata.printer.Dialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.strata.ast.Exprs.compare;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.or;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end compilation: every pass followed by the ClickHouse printer.
 */
@DisplayName("QueryCompiler Tests")
class QueryCompilerTest extends BaseCompilerTest {

    private static int indexOf(String sql, String fragment) {
        int index = sql.indexOf(fragment);
        assertTrue(index >= 0, () -> "Expected '" + fragment + "' in: " + sql);
        return index;
    }

    @Nested
    @DisplayName("Person Pushdown Tests")
    class PersonPushdownTests {

        private SelectQuery emailQuery(Expr where) {
            return select("events", where, field("event"));
        }

        private Expr emailEquals(String value) {
            return eq(field("person", "properties", "email"), constant(value));
        }

        @Test
        @DisplayName("Should push a person email filter into the persons subquery")
        void shouldPushPersonEmailFilter() {
            CompiledQuery compiled = compile(emailQuery(emailEquals("a@x.com")));
            String sql = compiled.sql();

            int subquery = indexOf(sql, "in(raw_persons.id, (SELECT raw_persons.id FROM person AS raw_persons WHERE ");
            int pushed = indexOf(sql, "JSONExtractRaw(raw_persons.properties, ");
            assertTrue(pushed > subquery, "pushed filter must sit inside the persons subquery");
            indexOf(sql, "AS events__person");
            indexOf(sql, "JSONExtractRaw(events__person.properties, ");

            assertTrue(compiled.params().containsValue("email"));
            assertTrue(compiled.params().containsValue("a@x.com"));
        }

        @Test
        @DisplayName("Should still push when the filter is OR'd with literal false")
        void shouldPushWhenOrWithFalse() {
            CompiledQuery compiled = compile(emailQuery(or(emailEquals("a@x.com"), constant(false))));

            indexOf(compiled.sql(), "JSONExtractRaw(raw_persons.properties, ");
            assertTrue(compiled.params().containsValue("a@x.com"));
        }

        @Test
        @DisplayName("Should push nothing when the filter is OR'd with literal true")
        void shouldNotPushWhenOrWithTrue() {
            CompiledQuery compiled = compile(emailQuery(or(emailEquals("a@x.com"), constant(true))));

            assertFalse(compiled.sql().contains("in(raw_persons.id"));
            assertFalse(compiled.sql().contains("JSONExtractRaw(raw_persons.properties"));
            indexOf(compiled.sql(), "JSONExtractRaw(events__person.properties, ");
        }

        @Test
        @DisplayName("Should not push when pushdown is disabled")
        void shouldNotPushWhenDisabled() {
            CompileContext context = context(Modifiers.defaults().withEnablePushdown(false));
            CompiledQuery compiled = compile(emailQuery(emailEquals("a@x.com")), context);

            assertFalse(compiled.sql().contains("in(raw_persons.id"));
        }

        @Test
        @DisplayName("Should not push a non null-rejecting filter into the LEFT JOINed persons")
        void shouldNotPushNonNullRejectingFilter() {
            Expr where = compare(CompareOperator.NOT_EQ, field("person", "properties", "email"), constant("a@x.com"));
            CompiledQuery compiled = compile(emailQuery(where));

            assertFalse(compiled.sql().contains("in(raw_persons.id"));
        }
    }

    @Nested
    @DisplayName("Session Pushdown Tests")
    class SessionPushdownTests {

        @Test
        @DisplayName("Should widen a session start bound on the composite key schema")
        void shouldWidenSessionStartOnCompositeKey() {
            Expr where = compare(CompareOperator.GT_EQ, field("session", "$start_timestamp"),
                    constant("2024-01-01 00:00:00"));
            CompileContext context = context(Modifiers.defaults().withSessionTableVersion(SessionTableVersion.V2));
            CompiledQuery compiled = compile(select("events", where, field("event")), context);
            String sql = compiled.sql();

            int from = indexOf(sql, "FROM raw_sessions WHERE ");
            int widened = indexOf(sql, "greaterOrEquals(fromUnixTimestamp64Milli(toUInt64(bitShiftRight("
                    + "raw_sessions.session_id_v7, 80))), minus(toDateTime(");
            assertTrue(widened > from);
            indexOf(sql, "toIntervalSecond(86400)");
            assertTrue(compiled.params().containsValue("2024-01-01 00:00:00"));
        }

        @Test
        @DisplayName("Should widen on the partition timestamp for the V3 schema")
        void shouldWidenOnPartitionTimestampForV3() {
            Expr where = compare(CompareOperator.LT, field("session", "$start_timestamp"),
                    constant("2024-01-01 00:00:00"));
            CompileContext context = context(Modifiers.defaults().withSessionTableVersion(SessionTableVersion.V3));
            CompiledQuery compiled = compile(select("events", where, field("event")), context);

            indexOf(compiled.sql(), "FROM raw_sessions_v3 AS raw_sessions WHERE ");
            indexOf(compiled.sql(), "lessOrEquals(raw_sessions.session_timestamp, plus(toDateTime(");
        }

        @Test
        @DisplayName("Should widen a session start bound on the min timestamp for the V1 schema")
        void shouldWidenOnMinTimestampForV1() {
            Expr where = compare(CompareOperator.GT_EQ, field("session", "$start_timestamp"),
                    constant("2024-01-01 00:00:00"));
            CompileContext context = context(Modifiers.defaults().withSessionTableVersion(SessionTableVersion.V1));
            String sql = compile(select("events", where, field("event")), context).sql();

            int from = indexOf(sql, "FROM sessions AS raw_sessions WHERE ");
            int widened = indexOf(sql, "greaterOrEquals(raw_sessions.min_timestamp, minus(toDateTime(");
            assertTrue(widened > from);
            indexOf(sql, "toIntervalSecond(86400)");
            assertFalse(sql.contains("session_id_v7"), sql);
        }

        @Test
        @DisplayName("Should join V1 sessions on the string session id")
        void shouldJoinV1SessionsOnStringId() {
            CompileContext context = context(Modifiers.defaults().withSessionTableVersion(SessionTableVersion.V1));
            String sql = compile(select("events", null, field("session", "$session_duration")), context).sql();

            indexOf(sql, "SELECT raw_sessions.session_id, ");
            indexOf(sql, "GROUP BY raw_sessions.session_id");
            indexOf(sql, " AS events__session ON equals(events.`$session_id`, events__session.session_id)");
            assertFalse(sql.contains("accurateCast"), sql);
        }

        @Test
        @DisplayName("Should read NULL for events without a session when the start bound is pushed")
        void shouldKeepOuterSessionComparisonNullSafe() {
            Expr where = compare(CompareOperator.LT, field("session", "$start_timestamp"),
                    constant("2024-01-01 00:00:00"));
            CompileContext context = context(Modifiers.defaults().withSessionTableVersion(SessionTableVersion.V1));
            String sql = compile(select("events", where, field("event")), context).sql();

            indexOf(sql, "lessOrEquals(raw_sessions.min_timestamp, plus(toDateTime(");
            int outer = indexOf(sql, "ifNull(less(events__session.`$start_timestamp`, ");
            assertTrue(outer > indexOf(sql, " AS events__session ON "), sql);
            assertTrue(sql.endsWith("SETTINGS max_execution_time=60, join_use_nulls=1"), sql);
        }
    }

    @Nested
    @DisplayName("Boolean Property Tests")
    class BooleanPropertyTests {

        private final MaterializationCatalog catalog = MaterializationCatalog.builder()
                .json("events", "is_paid", PropertyValueType.BOOLEAN)
                .build();

        private CompileContext booleanContext() {
            return context(Modifiers.defaults(), catalog);
        }

        private SelectQuery query(Constant value) {
            return select("events", eq(field("properties", "is_paid"), value), field("event"));
        }

        private void assertNoStringComparison(Expr prepared) {
            List<CompareOperation> offending = new ArrayList<>();
            new TraversingVisitor() {
                @Override
                public Void visitCompareOperation(CompareOperation node) {
                    if (isString(node.left()) || isString(node.right())) {
                        offending.add(node);
                    }
                    return super.visitCompareOperation(node);
                }

                private boolean isString(Expr expr) {
                    return expr instanceof Constant c && c.value() instanceof String;
                }
            }.traverse(prepared);
            assertTrue(offending.isEmpty(), () -> "Residual string comparisons: " + offending);
        }

        @Test
        @DisplayName("Should compare a boolean property with true as a boolean")
        void shouldCompareWithTrue() {
            SelectQuery query = query(constant(true));
            assertNoStringComparison(compiler.prepare(query, booleanContext()));

            String sql = compile(query, booleanContext()).sql();
            indexOf(sql, "equals(transform(toString(");
            indexOf(sql, ", true), 0)");
        }

        @Test
        @DisplayName("Should compare a boolean property with false as a boolean")
        void shouldCompareWithFalse() {
            SelectQuery query = query(constant(false));
            assertNoStringComparison(compiler.prepare(query, booleanContext()));

            String sql = compile(query, booleanContext()).sql();
            indexOf(sql, "equals(transform(toString(");
            indexOf(sql, ", false), 0)");
        }

        @Test
        @DisplayName("Should check a boolean property for null on the typed value")
        void shouldCheckForNull() {
            SelectQuery query = query(Constant.NULL);
            assertNoStringComparison(compiler.prepare(query, booleanContext()));

            indexOf(compile(query, booleanContext()).sql(), "isNull(transform(toString(");
        }
    }

    @Nested
    @DisplayName("Output Tests")
    class OutputTests {

        @Test
        @DisplayName("Should guard the events table by team and cap the limit")
        void shouldGuardTenantAndCapLimit() {
            CompiledQuery compiled = compile(select("events", null, field("event")));

            assertEquals("SELECT events.event FROM events WHERE equals(events.team_id, 1) LIMIT 50000 "
                    + "SETTINGS max_execution_time=60, join_use_nulls=1", compiled.sql());
            assertTrue(compiled.params().isEmpty());
            assertEquals(Dialect.CLICKHOUSE, compiled.dialect());
        }

        @Test
        @DisplayName("Should append the configured output format")
        void shouldAppendOutputFormat() {
            CompileContext context = context(CompilerSettings.defaults().withOutputFormat("JSONEachRow"));
            CompiledQuery compiled = compile(select("events", null, field("event")), context);

            assertTrue(compiled.sql().endsWith(" FORMAT JSONEachRow"));
        }

        @Test
        @DisplayName("Should serialize the compiled query to JSON")
        void shouldSerializeToJson() {
            CompiledQuery compiled = compile(select("events", eq(field("event"), constant("$pageview")), field("event")));
            String json = compiled.toJson();

            assertTrue(json.contains("\"dialect\":\"clickhouse\""));
            assertTrue(json.contains("$pageview"));
        }

        @Test
        @DisplayName("Should print for Postgres with named parameters")
        void shouldPrintForPostgres() {
            CompileContext context = context().withDialect(Dialect.POSTGRES);
            CompiledQuery compiled = compile(select("events", eq(field("event"), constant("$pageview")),
                    field("event")), context);

            assertTrue(compiled.sql().contains("(events.event = :strata_val_"));
            assertEquals(Dialect.POSTGRES, compiled.dialect());
        }
    }

    @Nested
    @DisplayName("Error Tests")
    class ErrorTests {

        @Test
        @DisplayName("Should report an unknown field with a suggestion")
        void shouldReportUnknownField() {
            ResolutionError error = assertThrows(ResolutionError.class,
                    () -> compile(select("events", null, field("evnt"))));

            assertEquals("event", error.getSuggestion());
        }

        @Test
        @DisplayName("Should reject a tree larger than the configured size")
        void shouldRejectOversizedTree() {
            CompileContext context = context(CompilerSettings.defaults().withMaxAstSize(3));
            assertThrows(QueryError.class, () -> compile(select("events", eq(field("event"), constant("x")),
                    field("event")), context));
        }
    }
}
