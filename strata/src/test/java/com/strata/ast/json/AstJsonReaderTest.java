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

package com.strata.ast.json;

import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.JoinExpr;
import com.strata.ast.OrderExpr;
import com.strata.ast.SelectQuery;
import com.strata.common.StrataException;
import com.strata.compiler.BaseCompilerTest;
import com.strata.errors.ImpossibleAstError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.strata.ast.Exprs.alias;
import static com.strata.ast.Exprs.and;
import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AstJsonReader Tests")
class AstJsonReaderTest extends BaseCompilerTest {

    private static String fixture(String name) throws IOException {
        try (InputStream input = AstJsonReaderTest.class.getResourceAsStream("/ast/" + name)) {
            assertNotNull(input, "fixture must be on the test classpath");
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("Node Tests")
    class NodeTests {

        @Test
        @DisplayName("Should read a whole SELECT")
        void shouldReadSelect() throws IOException {
            SelectQuery expected = SelectQuery.builder()
                    .select(field("event"), alias("c", call("count")))
                    .selectFrom(JoinExpr.from(field("events"), null))
                    .where(and(eq(field("event"), constant("$pageview")),
                            eq(field("properties", "$browser"), constant("Chrome"))))
                    .groupBy(List.of(field("event")))
                    .orderBy(List.of(new OrderExpr(field("c"), OrderExpr.Order.DESC)))
                    .limit(constant(10L))
                    .build();

            assertEquals(expected, AstJsonReader.read(fixture("pageviews_by_event.json")));
        }

        @Test
        @DisplayName("Should read constant values with their Java types")
        void shouldReadConstantValues() {
            assertEquals(constant(42L), AstJsonReader.read("{\"node\": \"Constant\", \"value\": 42}"));
            assertEquals(constant(1.5), AstJsonReader.read("{\"node\": \"Constant\", \"value\": 1.5}"));
            assertEquals(Constant.TRUE, AstJsonReader.read("{\"node\": \"Constant\", \"value\": true}"));
            assertEquals(Constant.NULL, AstJsonReader.read("{\"node\": \"Constant\", \"value\": null}"));
            assertEquals(Constant.NULL, AstJsonReader.read("{\"node\": \"Constant\"}"));

            Expr big = AstJsonReader.read("{\"node\": \"Constant\", \"value\": 18446744073709551616}");
            assertEquals(new BigInteger("18446744073709551616"),
                    ((java.math.BigDecimal) ((Constant) big).value()).toBigIntegerExact());
        }

        @Test
        @DisplayName("Should keep the inline flag of a constant")
        void shouldKeepInlineFlag() {
            Constant constant = (Constant) AstJsonReader.read("{\"node\": \"Constant\", \"value\": \"UUID\", \"inline\": true}");

            assertTrue(constant.inline());
        }
    }

    @Nested
    @DisplayName("Malformed Payload Tests")
    class MalformedPayloadTests {

        @Test
        @DisplayName("Should reject an unknown node kind")
        void shouldRejectUnknownKind() {
            assertThrows(ImpossibleAstError.class, () -> AstJsonReader.read("{\"node\": \"Union\"}"));
        }

        @Test
        @DisplayName("Should reject a missing required member")
        void shouldRejectMissingMember() {
            ImpossibleAstError error = assertThrows(ImpossibleAstError.class,
                    () -> AstJsonReader.read("{\"node\": \"Not\"}"));

            assertEquals("Not is missing 'expr'", error.getMessage());
        }

        @Test
        @DisplayName("Should reject an unknown comparison operator")
        void shouldRejectUnknownOperator() {
            assertThrows(ImpossibleAstError.class, () -> AstJsonReader.read("{\"node\": \"CompareOperation\", "
                    + "\"op\": \"~~\", \"left\": {\"node\": \"Constant\"}, \"right\": {\"node\": \"Constant\"}}"));
        }

        @Test
        @DisplayName("Should reject a non-object root")
        void shouldRejectNonObjectRoot() {
            assertThrows(ImpossibleAstError.class, () -> AstJsonReader.read("[1, 2]"));
        }

        @Test
        @DisplayName("Should reject text that is not JSON")
        void shouldRejectInvalidJson() {
            assertThrows(StrataException.class, () -> AstJsonReader.read("{\"node\": "));
        }
    }

    @Test
    @DisplayName("Should compile a tree read from JSON")
    void shouldCompileTreeReadFromJson() throws IOException {
        String sql = compile(AstJsonReader.read(fixture("pageviews_by_event.json"))).sql();

        assertTrue(sql.startsWith("SELECT events.event, count() AS c FROM events WHERE "), sql);
        assertTrue(sql.contains(" GROUP BY events.event ORDER BY c DESC LIMIT 10 "), sql);
    }
}
