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

package com.strata.resolver;

import com.strata.ast.CompareOperation;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.JoinConstraint;
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.FieldAliasType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.LazyJoinType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.TableType;
import com.strata.compiler.BaseCompilerTest;
import com.strata.config.CompilerSettings;
import com.strata.errors.QueryError;
import com.strata.errors.ResolutionError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.strata.ast.Exprs.alias;
import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Resolver Tests")
class ResolverTest extends BaseCompilerTest {

    private SelectQuery resolveSelect(SelectQuery query) {
        return (SelectQuery) resolve(query, context());
    }

    private Expr firstColumn(SelectQuery query) {
        return resolveSelect(query).select().get(0);
    }

    @Nested
    @DisplayName("Field Binding Tests")
    class FieldBindingTests {

        @Test
        @DisplayName("Should bind a column to its table")
        void shouldBindColumn() {
            Field resolved = (Field) firstColumn(select("events", null, field("event")));

            FieldType type = assertInstanceOf(FieldType.class, resolved.type());
            assertEquals("event", type.name());
            TableType table = assertInstanceOf(TableType.class, type.tableType());
            assertEquals("events", table.table().name());
        }

        @Test
        @DisplayName("Should bind a property path to the properties blob")
        void shouldBindPropertyPath() {
            Field resolved = (Field) firstColumn(select("events", null, field("properties", "$browser")));

            PropertyType type = assertInstanceOf(PropertyType.class, resolved.type());
            assertEquals(List.of("$browser"), type.chain());
            assertEquals("properties", type.fieldType().name());
        }

        @Test
        @DisplayName("Should walk a lazy join")
        void shouldWalkLazyJoin() {
            Field resolved = (Field) firstColumn(select("events", null, field("person", "properties", "email")));

            PropertyType type = assertInstanceOf(PropertyType.class, resolved.type());
            LazyJoinType join = assertInstanceOf(LazyJoinType.class, type.fieldType().tableType());
            assertEquals("events__person", join.alias());
            assertEquals(List.of("person", "properties", "email"), resolved.chain());
        }

        @Test
        @DisplayName("Should see a SELECT alias in WHERE")
        void shouldSeeAliasInWhere() {
            SelectQuery query = select("events", eq(field("e"), constant("x")), alias("e", field("event")));
            CompareOperation where = (CompareOperation) resolveSelect(query).where();

            FieldAliasType type = assertInstanceOf(FieldAliasType.class, where.left().type());
            assertEquals("e", type.alias());
        }

        @Test
        @DisplayName("Should expand the asterisk to visible columns only")
        void shouldExpandAsteriskToVisibleColumns() {
            List<String> names = new ArrayList<>();
            for (Expr column : resolveSelect(select("events", null, field("*"))).select()) {
                names.add(((FieldType) column.type()).name());
            }

            assertTrue(names.contains("event"));
            assertTrue(names.contains("properties"));
            assertFalse(names.contains("person_created_at"));
            assertFalse(names.contains("event_person_id"));
        }

        @Test
        @DisplayName("Should resolve a subquery against its own tables")
        void shouldResolveSubqueryAgainstOwnTables() {
            SelectQuery inner = select("events", eq(field("event"), constant("$pageview")), call("count"));
            SelectQuery outer = SelectQuery.builder()
                    .select(alias("c", inner))
                    .selectFrom(JoinExpr.from(field("events"), "x"))
                    .build();

            Resolver.Resolution resolution = new Resolver().analyze(outer, context());

            Scope innermost = resolution.scopes().get(0);
            assertEquals(List.of("events"), new ArrayList<>(innermost.tables().keySet()));
            assertEquals(List.of("x"), new ArrayList<>(resolution.scopes().get(1).tables().keySet()));
        }
    }

    @Nested
    @DisplayName("Error Tests")
    class ErrorTests {

        @Test
        @DisplayName("Should reject a field that only an enclosing query can see")
        void shouldRejectEnclosingQueryField() {
            SelectQuery inner = select("events", eq(field("event"), field("x", "event")), call("count"));
            SelectQuery outer = SelectQuery.builder()
                    .select(field("event"), alias("c", inner))
                    .selectFrom(JoinExpr.from(field("events"), "x"))
                    .build();

            ResolutionError error = assertThrows(ResolutionError.class, () -> resolve(outer, context()));
            assertTrue(error.getMessage().startsWith("Unable to resolve field 'x.event'"));
            assertEquals("x.event", error.getChain());
        }

        @Test
        @DisplayName("Should reject an unqualified name found only in an enclosing query")
        void shouldRejectUnqualifiedEnclosingName() {
            SelectQuery inner = SelectQuery.builder().select(field("event")).build();

            ResolutionError error = assertThrows(ResolutionError.class,
                    () -> resolve(select("events", null, inner), context()));
            assertTrue(error.getMessage().contains("enclosing query"));
        }

        @Test
        @DisplayName("Should suggest the nearest table name")
        void shouldSuggestNearestTable() {
            ResolutionError error = assertThrows(ResolutionError.class,
                    () -> resolve(select("evnts", null, field("event")), context()));

            assertEquals("events", error.getSuggestion());
            assertEquals("evnts", error.getChain());
        }

        @Test
        @DisplayName("Should suggest the nearest function name")
        void shouldSuggestNearestFunction() {
            ResolutionError error = assertThrows(ResolutionError.class,
                    () -> resolve(select("events", null, call("lowr", field("event"))), context()));

            assertEquals("lower", error.getSuggestion());
        }

        @Test
        @DisplayName("Should reject a call with the wrong number of arguments")
        void shouldRejectWrongArity() {
            assertThrows(ResolutionError.class,
                    () -> resolve(select("events", null, call("lower", field("event"), field("event"))), context()));
        }

        @Test
        @DisplayName("Should reject an aggregation nested in another")
        void shouldRejectNestedAggregation() {
            assertThrows(QueryError.class,
                    () -> resolve(select("events", null, call("sum", call("count"))), context()));
        }

        @Test
        @DisplayName("Should reject a member access on a plain column")
        void shouldRejectMemberOfPlainColumn() {
            assertThrows(ResolutionError.class,
                    () -> resolve(select("events", null, field("event", "name")), context()));
        }

        @Test
        @DisplayName("Should reject a field outside of any SELECT")
        void shouldRejectFieldOutsideSelect() {
            assertThrows(ResolutionError.class, () -> resolve(field("event"), context()));
        }

        @Test
        @DisplayName("Should reject a name found in two tables of the same SELECT")
        void shouldRejectAmbiguousName() {
            JoinExpr from = JoinExpr.from(field("events"), null)
                    .append(new JoinExpr("JOIN", field("events"), "e2", JoinConstraint.on(constant(true)), null,
                            null, null));
            SelectQuery query = SelectQuery.builder().select(field("event")).selectFrom(from).build();

            ResolutionError error = assertThrows(ResolutionError.class, () -> resolve(query, context()));
            assertTrue(error.getMessage().startsWith("Ambiguous reference"));
        }

        @Test
        @DisplayName("Should reject a duplicate table alias")
        void shouldRejectDuplicateTableAlias() {
            JoinExpr from = JoinExpr.from(field("events"), null)
                    .append(new JoinExpr("JOIN", field("events"), null, JoinConstraint.on(constant(true)), null,
                            null, null));
            SelectQuery query = SelectQuery.builder().select(field("events", "event")).selectFrom(from).build();

            assertThrows(QueryError.class, () -> resolve(query, context()));
        }

        @Test
        @DisplayName("Should reject subqueries nested deeper than the limit")
        void shouldRejectDeepSubqueries() {
            SelectQuery inner = select("events", null, field("event"));
            SelectQuery outer = SelectQuery.builder()
                    .select(field("event"))
                    .selectFrom(JoinExpr.from(inner, "sub"))
                    .build();
            CompilerSettings settings = CompilerSettings.defaults().withMaxSubqueryDepth(1);

            assertThrows(QueryError.class, () -> resolve(outer, context(settings)));
        }
    }
}
