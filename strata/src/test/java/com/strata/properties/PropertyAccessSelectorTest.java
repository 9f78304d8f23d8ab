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

package com.strata.properties;

import com.strata.ast.CompareOperator;
import com.strata.ast.Constant;
import com.strata.ast.Expr;
import com.strata.ast.SelectQuery;
import com.strata.catalog.MaterializationCatalog;
import com.strata.catalog.PropertyValueType;
import com.strata.compiler.BaseCompilerTest;
import com.strata.config.Modifiers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.strata.ast.Exprs.call;
import static com.strata.ast.Exprs.compare;
import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static com.strata.ast.Exprs.tuple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for PropertyAccessSelector. Each test compiles a query against a catalog and checks which
 * physical read the printed SQL uses.
 */
@DisplayName("PropertyAccessSelector Tests")
class PropertyAccessSelectorTest extends BaseCompilerTest {
    private static final String MAP_COLUMN = "properties_group_custom";

    private String sql(SelectQuery query, Modifiers modifiers, MaterializationCatalog catalog) {
        return compile(query, context(modifiers, catalog)).sql();
    }

    private SelectQuery readPlan() {
        return select("events", null, field("properties", "plan"));
    }

    private SelectQuery filterPlan(Expr where) {
        return select("events", where, field("event"));
    }

    private static Expr plan() {
        return field("properties", "plan");
    }

    @Nested
    @DisplayName("Strategy Order Tests")
    class StrategyOrderTests {

        @Test
        @DisplayName("Should order strategies by descending priority")
        void shouldOrderStrategiesByPriority() {
            List<PropertyAccessStrategy> strategies = new PropertyAccessSelector().strategies();

            assertEquals(4, strategies.size());
            assertEquals("DedicatedColumn", strategies.get(0).getName());
            assertEquals("SideTableSlot", strategies.get(1).getName());
            assertEquals("MapColumn", strategies.get(2).getName());
            assertEquals("JsonExtract", strategies.get(3).getName());
            for (int i = 1; i < strategies.size(); i++) {
                assertTrue(strategies.get(i - 1).getPriority() > strategies.get(i).getPriority());
            }
        }

        @Test
        @DisplayName("Should prefer a dedicated column over every other storage")
        void shouldPreferDedicatedColumn() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .dedicatedColumn("events", "plan", "mat_plan", false)
                    .sideTableSlot("events", "plan", 3, PropertyValueType.STRING)
                    .mapColumn("events", "plan", MAP_COLUMN)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults(), catalog);

            assertTrue(sql.contains("events.mat_plan"), sql);
            assertFalse(sql.contains("property_slots"), sql);
            assertFalse(sql.contains("JSONExtractRaw"), sql);
        }

        @Test
        @DisplayName("Should prefer a side table slot over a map column")
        void shouldPreferSlotOverMap() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .sideTableSlot("events", "plan", 3, PropertyValueType.STRING)
                    .mapColumn("events", "plan", MAP_COLUMN)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults().withMapColumnMode(MapColumnMode.ENABLED), catalog);

            assertTrue(sql.contains("events__slot_3.value_string"), sql);
            assertFalse(sql.contains("has(events." + MAP_COLUMN), sql);
        }
    }

    @Nested
    @DisplayName("Read Tests")
    class ReadTests {

        @Test
        @DisplayName("Should read from the JSON blob without a catalog entry")
        void shouldReadFromJson() {
            String sql = sql(readPlan(), Modifiers.defaults(), MaterializationCatalog.empty());

            assertTrue(sql.contains("replaceRegexpAll(nullIf(nullIf(JSONExtractRaw(events.properties, "), sql);
        }

        @Test
        @DisplayName("Should normalize nulls when reading a nullable dedicated column")
        void shouldNormalizeNullableDedicatedColumn() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .dedicatedColumn("events", "plan", "mat_plan", true)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults(), catalog);

            assertTrue(sql.contains("nullIf(nullIf(events.mat_plan, "), sql);
            assertFalse(sql.contains("JSONExtractRaw"), sql);
        }

        @Test
        @DisplayName("Should read a non-nullable dedicated column bare")
        void shouldReadNonNullableDedicatedColumnBare() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .dedicatedColumn("events", "plan", "mat_plan", false)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults(), catalog);

            assertTrue(sql.startsWith("SELECT events.mat_plan"), sql);
            assertFalse(sql.contains("nullIf("), sql);
        }

        @Test
        @DisplayName("Should read a side table slot through a LEFT JOIN")
        void shouldReadSlotThroughJoin() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .sideTableSlot("events", "revenue", 7, PropertyValueType.NUMERIC)
                    .build();
            String sql = sql(select("events", null, field("properties", "revenue")), Modifiers.defaults(), catalog);

            assertTrue(sql.contains("LEFT JOIN property_slots AS events__slot_7 ON "), sql);
            assertTrue(sql.contains("events__slot_7.value_numeric"), sql);
        }

        @Test
        @DisplayName("Should guard a map column read with has")
        void shouldGuardMapRead() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .mapColumn("events", "plan", MAP_COLUMN)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults().withMapColumnMode(MapColumnMode.ENABLED), catalog);

            assertTrue(sql.contains("if(has(events." + MAP_COLUMN + ", 'plan'), events." + MAP_COLUMN + "["), sql);
        }

        @Test
        @DisplayName("Should ignore map columns while they are disabled")
        void shouldIgnoreDisabledMapColumns() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .mapColumn("events", "plan", MAP_COLUMN)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults(), catalog);

            assertFalse(sql.contains(MAP_COLUMN), sql);
            assertTrue(sql.contains("JSONExtractRaw(events.properties, "), sql);
        }

        @Test
        @DisplayName("Should read from JSON when materialization is disabled")
        void shouldReadFromJsonWhenMaterializationDisabled() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .dedicatedColumn("events", "plan", "mat_plan", false)
                    .build();
            String sql = sql(readPlan(), Modifiers.defaults().withMaterializationEnabled(false), catalog);

            assertFalse(sql.contains("mat_plan"), sql);
            assertTrue(sql.contains("JSONExtractRaw(events.properties, "), sql);
        }

        @Test
        @DisplayName("Should convert a numeric property read from JSON")
        void shouldConvertNumericJsonRead() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .json("events", "revenue", PropertyValueType.NUMERIC)
                    .build();
            String sql = sql(select("events", null, field("properties", "revenue")), Modifiers.defaults(), catalog);

            assertTrue(sql.contains("toFloat64OrNull(replaceRegexpAll("), sql);
        }
    }

    @Nested
    @DisplayName("Typed Read Tests")
    class TypedReadTests {

        @Test
        @DisplayName("Should parse a datetime property")
        void shouldParseDatetimeProperty() {
            MaterializationCatalog catalog = MaterializationCatalog.builder()
                    .json("events", "signup", PropertyValueType.DATETIME)
                    .build();
            String sql = sql(select("events", null, field("properties", "signup")), Modifiers.defaults(), catalog);

            assertTrue(sql.contains("parseDateTime64BestEffortOrNull(replaceRegexpAll(nullIf(nullIf("), sql);
        }

        @Test
        @DisplayName("Should skip null normalization for a reserved property")
        void shouldSkipNullNormalizationForReservedProperty() {
            String sql = sql(select("events", null, field("properties", "$trace_id")), Modifiers.defaults(),
                    MaterializationCatalog.empty());

            assertTrue(sql.contains("replaceRegexpAll(JSONExtractRaw(events.properties, "), sql);
            assertFalse(sql.contains("nullIf("), sql);
        }

        @Test
        @DisplayName("Should compare a reserved property without a null-safety wrapper")
        void shouldCompareReservedPropertyBare() {
            String sql = sql(filterPlan(eq(field("properties", "$trace_id"), constant("abc"))), Modifiers.defaults(),
                    MaterializationCatalog.empty());

            assertTrue(sql.contains("equals(replaceRegexpAll(JSONExtractRaw(events.properties, "), sql);
            assertFalse(sql.contains("ifNull("), sql);
        }
    }

    @Nested
    @DisplayName("Map Specialization Tests")
    class MapSpecializationTests {
        private final MaterializationCatalog catalog = MaterializationCatalog.builder()
                .mapColumn("events", "plan", MAP_COLUMN)
                .build();

        private String optimized(Expr where) {
            return sql(filterPlan(where), Modifiers.defaults().withMapColumnMode(MapColumnMode.OPTIMIZED), catalog);
        }

        @Test
        @DisplayName("Should compare the map element directly for a non-empty string")
        void shouldCompareElementDirectly() {
            String sql = optimized(eq(plan(), constant("pro")));

            assertTrue(sql.contains("equals(events." + MAP_COLUMN + "["), sql);
            assertFalse(sql.contains("has("), sql);
        }

        @Test
        @DisplayName("Should require the key when comparing with the empty string")
        void shouldRequireKeyForEmptyString() {
            String sql = optimized(eq(plan(), constant("")));

            assertTrue(sql.contains("and(has(events." + MAP_COLUMN + ", 'plan'), equals(events." + MAP_COLUMN + "["),
                    sql);
        }

        @Test
        @DisplayName("Should turn a null check into a key check")
        void shouldTurnNullCheckIntoKeyCheck() {
            assertTrue(optimized(eq(plan(), Constant.NULL)).contains("not(has(events." + MAP_COLUMN + ", 'plan'))"));
            assertTrue(optimized(call("isNotNull", plan())).contains("has(events." + MAP_COLUMN + ", 'plan')"));
        }

        @Test
        @DisplayName("Should check membership on the map element")
        void shouldCheckMembershipOnElement() {
            String sql = optimized(compare(CompareOperator.IN, plan(), tuple(List.of(constant("a"), constant("b")))));

            assertTrue(sql.contains("in(events." + MAP_COLUMN + "["), sql);
            assertFalse(sql.contains("has("), sql);
        }

        @Test
        @DisplayName("Should keep the generic read when only enabled")
        void shouldKeepGenericReadWhenEnabled() {
            String sql = sql(filterPlan(eq(plan(), constant("pro"))),
                    Modifiers.defaults().withMapColumnMode(MapColumnMode.ENABLED), catalog);

            assertTrue(sql.contains("if(has(events." + MAP_COLUMN + ", 'plan')"), sql);
        }
    }
}
