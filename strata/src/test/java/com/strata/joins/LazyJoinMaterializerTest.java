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

package com.strata.joins;

import com.strata.ast.SelectQuery;
import com.strata.compiler.BaseCompilerTest;
import com.strata.config.Modifiers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.strata.ast.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for LazyJoinMaterializer. Checks which joins the compiled SQL carries for each way of
 * reaching persons and sessions from events.
 */
@DisplayName("LazyJoinMaterializer Tests")
class LazyJoinMaterializerTest extends BaseCompilerTest {

    private static int occurrences(String sql, String fragment) {
        int count = 0;
        for (int i = sql.indexOf(fragment); i >= 0; i = sql.indexOf(fragment, i + 1)) {
            count++;
        }
        return count;
    }

    private String sql(SelectQuery query, PersonJoinStrategy strategy) {
        return compile(query, context(Modifiers.defaults().withPersonJoinStrategy(strategy))).sql();
    }

    @Test
    @DisplayName("Should add no join when no lazy field is read")
    void shouldAddNoJoinWithoutLazyFields() {
        String sql = compile(select("events", null, field("event"), field("properties", "$browser"))).sql();

        assertFalse(sql.contains(" JOIN "), sql);
    }

    @Nested
    @DisplayName("Person Join Tests")
    class PersonJoinTests {

        @Test
        @DisplayName("Should join overrides and persons when person ids are corrected")
        void shouldJoinOverridesAndPersons() {
            String sql = sql(select("events", null, field("person", "properties", "email")),
                    PersonJoinStrategy.PERSON_ID_OVERRIDES_JOINED);

            assertTrue(sql.contains(" AS events__override ON "), sql);
            assertTrue(sql.contains(" AS events__person ON "), sql);
            assertTrue(sql.contains("LEFT JOIN (SELECT "), sql);
        }

        @Test
        @DisplayName("Should join persons once however many person fields are read")
        void shouldJoinPersonsOnce() {
            String sql = sql(select("events", null, field("person", "properties", "email"),
                    field("person", "properties", "name"), field("person", "id")),
                    PersonJoinStrategy.PERSON_ID_OVERRIDES_JOINED);

            assertEquals(1, occurrences(sql, " AS events__person ON "), sql);
        }

        @Test
        @DisplayName("Should reach persons through the distinct id mapping")
        void shouldJoinThroughDistinctIds() {
            String sql = sql(select("events", null, field("person", "properties", "email")),
                    PersonJoinStrategy.DISTINCT_ID_JOINED);

            assertTrue(sql.contains("INNER JOIN (SELECT "), sql);
            assertTrue(sql.contains(" AS events__pdi ON "), sql);
            assertTrue(sql.contains(" AS events__pdi__person ON "), sql);
            assertFalse(sql.contains("events__override"), sql);
        }

        @Test
        @DisplayName("Should read person columns off the event row without a join")
        void shouldReadDenormalizedPersonColumns() {
            String sql = sql(select("events", null, field("person", "properties", "email")),
                    PersonJoinStrategy.PERSON_ID_ON_EVENTS);

            assertFalse(sql.contains(" JOIN "), sql);
            assertTrue(sql.contains("events.person_properties"), sql);
        }
    }

    @Test
    @DisplayName("Should join sessions when a session field is read")
    void shouldJoinSessions() {
        String sql = compile(select("events", null, field("session", "$session_duration"))).sql();

        assertTrue(sql.contains("LEFT JOIN (SELECT "), sql);
        assertTrue(sql.contains(" AS events__session ON "), sql);
        assertTrue(sql.contains("events__session.`$session_duration`"), sql);
    }
}
