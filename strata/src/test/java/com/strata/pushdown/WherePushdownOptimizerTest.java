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

package com.strata.pushdown;

import com.strata.ast.And;
import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Field;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.FieldAliasType;
import com.strata.ast.types.FieldType;
import com.strata.ast.types.PropertyType;
import com.strata.ast.types.SelectQueryAliasType;
import com.strata.ast.types.SelectQueryType;
import com.strata.errors.ImpossibleAstError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static com.strata.ast.Exprs.and;
import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.compare;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.not;
import static com.strata.ast.Exprs.or;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for WherePushdownOptimizer.
 * Filters are built over a synthetic target with exact fields {@code email}, {@code id} and
 * {@code properties}, an approximate field {@code started}, a reachable but undecidable field
 * {@code created_at}, and an unrelated outer table.
 */
@DisplayName("WherePushdownOptimizer Tests")
class WherePushdownOptimizerTest {
    static final SelectQueryAliasType TARGET = new SelectQueryAliasType("persons", new SelectQueryType(Map.of(), Map.of()));
    static final SelectQueryAliasType OUTER = new SelectQueryAliasType("events", new SelectQueryType(Map.of(), Map.of()));

    private final WherePushdownOptimizer optimizer = new WherePushdownOptimizer(Duration.ofDays(1));
    private final PushdownTarget target = new PushdownTarget(TARGET,
            Map.of("email", field("email"), "id", field("id"), "properties", field("properties")),
            Map.of("started", field("approx_start")));

    static Field local(String name) {
        return new Field(List.of("persons", name), new FieldType(name, TARGET));
    }

    static Field outer(String name) {
        return new Field(List.of("events", name), new FieldType(name, OUTER));
    }

    static Field property(String key) {
        return new Field(List.of("person", "properties", key),
                new PropertyType(List.of(key), new FieldType("properties", TARGET)));
    }

    private Optional<Expr> push(Expr where) {
        return optimizer.pushdown(where, target);
    }

    private static Expr emailIsX() {
        return eq(local("email"), constant("x"));
    }

    private static Expr pushedEmailIsX() {
        return eq(field("email"), constant("x"));
    }

    static Stream<Arguments> undecidableForms() {
        return Stream.of(
                Arguments.of("field of another table", eq(outer("event"), constant("$pageview"))),
                Arguments.of("reachable field without an exact mapping", eq(local("created_at"), constant("2024-01-01"))),
                Arguments.of("subquery operand", compare(CompareOperator.IN, local("id"),
                        SelectQuery.builder().select(field("person_id")).build())),
                Arguments.of("NOT over a widened bound", not(compare(CompareOperator.GT_EQ, local("started"),
                        constant("2024-01-01")))),
                Arguments.of("OR with an undecidable operand", or(eq(local("email"), constant("y")),
                        eq(outer("event"), constant("$pageview")))),
                Arguments.of("call over an outer field", call("startsWith", outer("event"), constant("$")))
        );
    }

    @Nested
    @DisplayName("Leaf Tests")
    class LeafTests {

        @Test
        @DisplayName("Should rewrite an exact leaf into the target's names")
        void shouldRewriteExactLeaf() {
            assertEquals(Optional.of(pushedEmailIsX()), push(emailIsX()));
        }

        @Test
        @DisplayName("Should rewrite a property path onto the target's properties column")
        void shouldRewritePropertyPath() {
            Expr where = eq(property("email"), constant("a@x.com"));

            assertEquals(Optional.of(eq(field("properties", "email"), constant("a@x.com"))), push(where));
        }

        @Test
        @DisplayName("Should see through a SELECT alias")
        void shouldSeeThroughSelectAlias() {
            Field aliased = new Field(List.of("e"), new FieldAliasType("e", new FieldType("email", TARGET)));
            Optional<Expr> pushed = optimizer.pushdown(eq(aliased, constant("x")), target,
                    Map.of("e", local("email")));

            assertEquals(Optional.of(pushedEmailIsX()), pushed);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.strata.pushdown.WherePushdownOptimizerTest#undecidableForms")
        @DisplayName("Should push nothing for an undecidable form on its own")
        void shouldPushNothingForUndecidableForm(String description, Expr undecidable) {
            assertEquals(Optional.empty(), push(undecidable));
        }
    }

    @Nested
    @DisplayName("AND Narrowing Tests")
    class AndNarrowingTests {

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.strata.pushdown.WherePushdownOptimizerTest#undecidableForms")
        @DisplayName("Should drop an undecidable AND operand and keep the rest")
        void shouldDropUndecidableOperand(String description, Expr undecidable) {
            assertEquals(Optional.of(pushedEmailIsX()), push(and(emailIsX(), undecidable)));
            assertEquals(Optional.of(pushedEmailIsX()), push(and(undecidable, emailIsX())));
        }

        @Test
        @DisplayName("Should drop several undecidable operands at once")
        void shouldDropSeveralUndecidableOperands() {
            Expr where = and(
                    eq(outer("event"), constant("$pageview")),
                    emailIsX(),
                    eq(local("created_at"), constant("2024-01-01")),
                    compare(CompareOperator.IN, local("id"), SelectQuery.builder().select(field("person_id")).build()),
                    eq(local("id"), constant("p1")));

            assertEquals(Optional.of(and(pushedEmailIsX(), eq(field("id"), constant("p1")))), push(where));
        }

        @Test
        @DisplayName("Should push nothing when every operand is undecidable")
        void shouldPushNothingWhenAllUndecidable() {
            Expr where = and(eq(outer("event"), constant("a")), eq(local("created_at"), constant("b")));

            assertEquals(Optional.empty(), push(where));
        }

        @Test
        @DisplayName("Should narrow inside an OR operand")
        void shouldNarrowInsideOrOperand() {
            Expr where = or(
                    and(emailIsX(), eq(outer("event"), constant("a"))),
                    eq(local("id"), constant("p1")));

            assertEquals(Optional.of(or(pushedEmailIsX(), eq(field("id"), constant("p1")))), push(where));
        }
    }

    @Nested
    @DisplayName("OR Abandonment Tests")
    class OrAbandonmentTests {

        @Test
        @DisplayName("Should abandon an OR with one undecidable operand")
        void shouldAbandonOrWithUndecidableOperand() {
            Expr where = or(emailIsX(), eq(outer("event"), constant("$pageview")));

            assertEquals(Optional.empty(), push(where));
        }

        @Test
        @DisplayName("Should keep an OR whose operands are all exact")
        void shouldKeepExactOr() {
            Expr where = or(emailIsX(), eq(local("id"), constant("p1")));

            assertEquals(Optional.of(or(pushedEmailIsX(), eq(field("id"), constant("p1")))), push(where));
        }

        @Test
        @DisplayName("Should keep the AND sibling of an abandoned OR")
        void shouldKeepSiblingOfAbandonedOr() {
            Expr where = and(or(emailIsX(), eq(outer("event"), constant("a"))), eq(local("id"), constant("p1")));

            assertEquals(Optional.of(eq(field("id"), constant("p1"))), push(where));
        }
    }

    @Nested
    @DisplayName("Constant Folding Tests")
    class ConstantFoldingTests {

        @Test
        @DisplayName("Should absorb a literal false OR operand")
        void shouldAbsorbFalseInOr() {
            assertEquals(Optional.of(pushedEmailIsX()), push(or(emailIsX(), constant(false))));
        }

        @Test
        @DisplayName("Should push nothing when OR'd with literal true")
        void shouldPushNothingWhenOrWithTrue() {
            assertEquals(Optional.empty(), push(or(emailIsX(), constant(true))));
        }

        @Test
        @DisplayName("Should push literal false when AND'd with it")
        void shouldPushFalseWhenAndWithFalse() {
            assertEquals(Optional.of(Constant.FALSE), push(and(emailIsX(), constant(false))));
        }

        @Test
        @DisplayName("Should remove a double negation")
        void shouldRemoveDoubleNegation() {
            assertEquals(Optional.of(pushedEmailIsX()), push(not(not(emailIsX()))));
        }

        @Test
        @DisplayName("Should keep NOT over an exact operand")
        void shouldKeepNotOverExactOperand() {
            assertEquals(Optional.of(not(pushedEmailIsX())), push(not(emailIsX())));
        }

        @Test
        @DisplayName("Should reject an AND without operands")
        void shouldRejectEmptyAnd() {
            assertThrows(ImpossibleAstError.class, () -> push(new And(List.of())));
        }
    }

    @Nested
    @DisplayName("Widening Tests")
    class WideningTests {

        private Expr shifted(String function, String value) {
            return call(function, call("toDateTime", constant(value)), call("toIntervalSecond", constant(86400L)));
        }

        @Test
        @DisplayName("Should widen a lower bound by the lookback")
        void shouldWidenLowerBound() {
            Expr where = compare(CompareOperator.GT_EQ, local("started"), constant("2024-01-01"));

            assertEquals(Optional.of(compare(CompareOperator.GT_EQ, field("approx_start"), shifted("minus", "2024-01-01"))),
                    push(where));
        }

        @Test
        @DisplayName("Should widen an upper bound by the lookback")
        void shouldWidenUpperBound() {
            Expr where = compare(CompareOperator.LT, local("started"), constant("2024-01-01"));

            assertEquals(Optional.of(compare(CompareOperator.LT_EQ, field("approx_start"), shifted("plus", "2024-01-01"))),
                    push(where));
        }

        @Test
        @DisplayName("Should widen a flipped comparison")
        void shouldWidenFlippedComparison() {
            Expr where = compare(CompareOperator.LT_EQ, constant("2024-01-01"), local("started"));

            assertEquals(Optional.of(compare(CompareOperator.GT_EQ, field("approx_start"), shifted("minus", "2024-01-01"))),
                    push(where));
        }

        @Test
        @DisplayName("Should widen equality into a window")
        void shouldWidenEqualityIntoWindow() {
            Expr where = eq(local("started"), constant("2024-01-01"));

            Expr expected = and(
                    compare(CompareOperator.GT_EQ, field("approx_start"), shifted("minus", "2024-01-01")),
                    compare(CompareOperator.LT_EQ, field("approx_start"), shifted("plus", "2024-01-01")));
            assertEquals(Optional.of(expected), push(where));
        }

        @Test
        @DisplayName("Should not widen against a bound that reads a field")
        void shouldNotWidenAgainstFieldBound() {
            Expr where = compare(CompareOperator.GT_EQ, local("started"), outer("timestamp"));

            assertEquals(Optional.empty(), push(where));
        }

        @Test
        @DisplayName("Should keep a widened bound next to an exact operand")
        void shouldKeepWidenedBoundInAnd() {
            Expr where = and(emailIsX(), compare(CompareOperator.GT, local("started"), constant("2024-01-01")));

            Expr expected = and(pushedEmailIsX(),
                    compare(CompareOperator.GT_EQ, field("approx_start"), shifted("minus", "2024-01-01")));
            assertEquals(Optional.of(expected), push(where));
        }
    }
}
