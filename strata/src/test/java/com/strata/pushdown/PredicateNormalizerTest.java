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
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.Or;
import com.strata.errors.ImpossibleAstError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.strata.ast.Exprs.and;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.not;
import static com.strata.ast.Exprs.or;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PredicateNormalizer Tests")
class PredicateNormalizerTest {
    private final PredicateNormalizer normalizer = new PredicateNormalizer();

    private static final Expr A = eq(field("a"), constant(1L));
    private static final Expr B = eq(field("b"), constant(2L));
    private static final Expr C = eq(field("c"), constant(3L));

    @Nested
    @DisplayName("Flattening Tests")
    class FlatteningTests {

        @Test
        @DisplayName("Should flatten nested ANDs")
        void shouldFlattenNestedAnds() {
            assertEquals(new And(List.of(A, B, C)), normalizer.normalize(and(A, and(B, C))));
        }

        @Test
        @DisplayName("Should flatten nested ORs")
        void shouldFlattenNestedOrs() {
            assertEquals(new Or(List.of(A, B, C)), normalizer.normalize(or(or(A, B), C)));
        }

        @Test
        @DisplayName("Should not merge an OR into its parent AND")
        void shouldNotMergeMixedConnectives() {
            Expr predicate = and(A, or(B, C));

            assertEquals(predicate, normalizer.normalize(predicate));
        }
    }

    @Nested
    @DisplayName("Negation Tests")
    class NegationTests {

        @Test
        @DisplayName("Should remove a double negation")
        void shouldRemoveDoubleNegation() {
            assertEquals(A, normalizer.normalize(not(not(A))));
        }

        @Test
        @DisplayName("Should keep one negation out of three")
        void shouldKeepOddNegation() {
            assertEquals(not(A), normalizer.normalize(not(not(not(A)))));
        }

        @Test
        @DisplayName("Should remove a double negation below an AND")
        void shouldRemoveNestedDoubleNegation() {
            assertEquals(new And(List.of(A, B)), normalizer.normalize(and(not(not(A)), B)));
        }
    }

    @Nested
    @DisplayName("Constant Folding Tests")
    class ConstantFoldingTests {

        @Test
        @DisplayName("Should drop a true AND operand")
        void shouldDropTrueAndOperand() {
            assertEquals(A, normalizer.normalize(and(A, Constant.TRUE)));
        }

        @Test
        @DisplayName("Should fold an AND with false to false")
        void shouldFoldAndWithFalse() {
            assertEquals(Constant.FALSE, normalizer.normalize(and(A, B, Constant.FALSE)));
        }

        @Test
        @DisplayName("Should fold an OR with true to true")
        void shouldFoldOrWithTrue() {
            assertEquals(Constant.TRUE, normalizer.normalize(or(A, Constant.TRUE)));
        }

        @Test
        @DisplayName("Should fold an OR of falses to false")
        void shouldFoldOrOfFalses() {
            assertEquals(Constant.FALSE, normalizer.normalize(or(Constant.FALSE, Constant.FALSE)));
        }

        @Test
        @DisplayName("Should fold an AND of trues to true")
        void shouldFoldAndOfTrues() {
            assertEquals(Constant.TRUE, normalizer.normalize(and(Constant.TRUE, Constant.TRUE)));
        }

        @Test
        @DisplayName("Should fold NOT over a literal")
        void shouldFoldNotOverLiteral() {
            assertEquals(Constant.FALSE, normalizer.normalize(not(Constant.TRUE)));
            assertEquals(Constant.TRUE, normalizer.normalize(not(and(A, Constant.FALSE))));
        }

        @Test
        @DisplayName("Should leave a NULL literal alone")
        void shouldLeaveNullAlone() {
            Expr predicate = and(A, Constant.NULL);

            assertEquals(predicate, normalizer.normalize(predicate));
        }
    }

    @Nested
    @DisplayName("Malformed Tree Tests")
    class MalformedTreeTests {

        @Test
        @DisplayName("Should reject an empty OR")
        void shouldRejectEmptyOr() {
            assertThrows(ImpossibleAstError.class, () -> normalizer.normalize(new Or(List.of())));
        }

        @Test
        @DisplayName("Should reject an empty AND nested under NOT")
        void shouldRejectNestedEmptyAnd() {
            assertThrows(ImpossibleAstError.class, () -> normalizer.normalize(not(or(A, new And(List.of())))));
        }
    }
}
