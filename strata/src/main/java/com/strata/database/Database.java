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

package com.strata.database;

import com.google.common.collect.ImmutableMap;
import com.strata.ast.types.ValueKind;
import com.strata.catalog.MaterializationCatalog;
import com.strata.catalog.MaterializedProperty;
import com.strata.catalog.PropertyStorage;
import com.strata.catalog.ReservedProperties;
import com.strata.config.Modifiers;
import com.strata.joins.PersonJoinStrategy;
import com.strata.joins.SessionTableVersion;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.strata.ast.Exprs.*;

/**
 * The logical schema queries are written against. The shape of a few fields depends on the
 * {@link Modifiers}: how {@code events.person} reaches persons and which session table generation backs
 * {@code sessions}. Catalog columns are added as hidden fields so property access strategies can bind to
 * them.
 */
public final class Database {
    public static final String EVENTS = "events";
    public static final String RAW_PERSONS = "raw_persons";
    public static final String RAW_PERSON_DISTINCT_IDS = "raw_person_distinct_ids";
    public static final String RAW_PERSON_DISTINCT_ID_OVERRIDES = "raw_person_distinct_id_overrides";
    public static final String PERSON_DISTINCT_IDS = "person_distinct_ids";
    public static final String PERSON_DISTINCT_ID_OVERRIDES = "person_distinct_id_overrides";
    public static final String RAW_SESSIONS = "raw_sessions";
    public static final String PROPERTY_SLOTS = "property_slots";
    public static final String COHORT_PEOPLE = "cohort_people";
    public static final String EVENTS_PERSON_CATALOG_TABLE = "events_person";

    private final Map<String, Table> tables;
    private final Modifiers modifiers;

    private Database(Map<String, Table> tables, Modifiers modifiers) {
        this.tables = ImmutableMap.copyOf(tables);
        this.modifiers = modifiers;
    }

    public static Database create(Modifiers modifiers, MaterializationCatalog catalog) {
        Map<String, Table> tables = new LinkedHashMap<>();

        PhysicalTable rawPersons = new PhysicalTable(RAW_PERSONS, "person", "id");
        rawPersons.addField(ColumnField.of("id", ValueKind.UUID));
        rawPersons.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        rawPersons.addField(ColumnField.of("created_at", ValueKind.DATETIME));
        rawPersons.addField(JsonPropertiesField.of("properties", PersonsTable.CATALOG_TABLE));
        rawPersons.addField(ColumnField.of("is_identified", ValueKind.BOOLEAN));
        rawPersons.addField(ColumnField.of("is_deleted", ValueKind.INTEGER));
        rawPersons.addField(ColumnField.of("version", ValueKind.INTEGER));

        PhysicalTable rawDistinctIds = mappingTable(RAW_PERSON_DISTINCT_IDS, "person_distinct_id2");
        PhysicalTable rawOverrides = mappingTable(RAW_PERSON_DISTINCT_ID_OVERRIDES, "person_distinct_id_overrides");

        PersonsTable persons = new PersonsTable(rawPersons);
        VersionedMappingTable distinctIds = new VersionedMappingTable(PERSON_DISTINCT_IDS, rawDistinctIds);
        distinctIds.addPersonJoin(persons);
        VersionedMappingTable overrides = new VersionedMappingTable(PERSON_DISTINCT_ID_OVERRIDES, rawOverrides);
        overrides.addPersonJoin(persons);

        SessionTableVersion sessionVersion = modifiers.sessionTableVersion();
        PhysicalTable rawSessions = rawSessionsTable(sessionVersion);
        SessionsTable sessions = new SessionsTable(rawSessions, sessionVersion);

        PhysicalTable propertySlots = new PhysicalTable(PROPERTY_SLOTS, "property_slots", null);
        propertySlots.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        propertySlots.addField(ColumnField.of("entity_id", ValueKind.STRING));
        propertySlots.addField(ColumnField.of("slot", ValueKind.INTEGER));
        propertySlots.addField(ColumnField.nullable("value_string", ValueKind.STRING));
        propertySlots.addField(ColumnField.nullable("value_numeric", ValueKind.FLOAT));
        propertySlots.addField(ColumnField.nullable("value_bool", ValueKind.BOOLEAN));
        propertySlots.addField(ColumnField.nullable("value_datetime", ValueKind.DATETIME));

        PhysicalTable cohortPeople = new PhysicalTable(COHORT_PEOPLE, "cohort_people", null);
        cohortPeople.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        cohortPeople.addField(ColumnField.of("cohort_id", ValueKind.INTEGER));
        cohortPeople.addField(ColumnField.of("person_id", ValueKind.UUID));
        cohortPeople.addField(ColumnField.of("sign", ValueKind.INTEGER));
        cohortPeople.addField(ColumnField.of("version", ValueKind.INTEGER));

        PhysicalTable events = eventsTable(modifiers.personJoinStrategy(), persons, distinctIds, overrides, sessions);

        tables.put(EVENTS, events);
        tables.put(PersonsTable.NAME, persons);
        tables.put(PERSON_DISTINCT_IDS, distinctIds);
        tables.put(PERSON_DISTINCT_ID_OVERRIDES, overrides);
        tables.put(SessionsTable.NAME, sessions);
        tables.put(COHORT_PEOPLE, cohortPeople);
        tables.put(RAW_PERSONS, rawPersons);
        tables.put(RAW_PERSON_DISTINCT_IDS, rawDistinctIds);
        tables.put(RAW_PERSON_DISTINCT_ID_OVERRIDES, rawOverrides);
        tables.put(RAW_SESSIONS, rawSessions);
        tables.put(PROPERTY_SLOTS, propertySlots);

        if (modifiers.materializationEnabled()) {
            addCatalogFields(tables, catalog, propertySlots);
        }
        return new Database(tables, modifiers);
    }

    private static PhysicalTable mappingTable(String name, String physicalName) {
        PhysicalTable table = new PhysicalTable(name, physicalName, null);
        table.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        table.addField(ColumnField.of("distinct_id", ValueKind.STRING));
        table.addField(ColumnField.of("person_id", ValueKind.UUID));
        table.addField(ColumnField.of("is_deleted", ValueKind.INTEGER));
        table.addField(ColumnField.of("version", ValueKind.INTEGER));
        return table;
    }

    private static PhysicalTable rawSessionsTable(SessionTableVersion version) {
        PhysicalTable table = new PhysicalTable(RAW_SESSIONS, version.physicalTable(), null);
        if (version.hasUuidKey()) {
            table.addField(ColumnField.of("session_id_v7", ValueKind.INTEGER));
        } else {
            table.addField(ColumnField.of("session_id", ValueKind.STRING));
        }
        if (version == SessionTableVersion.V3) {
            table.addField(ColumnField.of("session_timestamp", ValueKind.DATETIME));
        }
        table.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        table.addField(ColumnField.of("distinct_id", ValueKind.STRING));
        table.addField(ColumnField.of("min_timestamp", ValueKind.DATETIME));
        table.addField(ColumnField.of("max_timestamp", ValueKind.DATETIME));
        table.addField(ColumnField.nullable("entry_url", ValueKind.STRING));
        table.addField(ColumnField.nullable("end_url", ValueKind.STRING));
        table.addField(ColumnField.of("pageview_count", ValueKind.INTEGER));
        table.addField(ColumnField.of("autocapture_count", ValueKind.INTEGER));
        return table;
    }

    private static PhysicalTable eventsTable(PersonJoinStrategy strategy, PersonsTable persons,
                                             VersionedMappingTable distinctIds, VersionedMappingTable overrides,
                                             SessionsTable sessions) {
        PhysicalTable events = new PhysicalTable(EVENTS, "events", "uuid");
        events.addField(ColumnField.of("uuid", ValueKind.UUID));
        events.addField(ColumnField.of("event", ValueKind.STRING));
        events.addField(JsonPropertiesField.of("properties", EVENTS));
        events.addField(ColumnField.of("timestamp", ValueKind.DATETIME));
        events.addField(ColumnField.of("team_id", ValueKind.INTEGER));
        events.addField(ColumnField.of("distinct_id", ValueKind.STRING));
        events.addField(ColumnField.of("elements_chain", ValueKind.STRING));
        events.addField(ColumnField.of("created_at", ValueKind.DATETIME));
        events.addField(ColumnField.of("$session_id", ValueKind.STRING));
        events.addField(ColumnField.of("$window_id", ValueKind.STRING));
        events.addField(new JsonPropertiesField("person_properties", "person_properties",
                EVENTS_PERSON_CATALOG_TABLE, true));
        events.addField(ColumnField.hidden("person_created_at", ValueKind.DATETIME, false));

        switch (strategy) {
            case PERSON_ID_ON_EVENTS:
                events.addField(ColumnField.of("person_id", ValueKind.UUID));
                events.addField(new VirtualTableField("person", Map.of(
                        "id", FieldTraverser.of("id", "person_id"),
                        "properties", FieldTraverser.of("properties", "person_properties"),
                        "created_at", FieldTraverser.of("created_at", "person_created_at")), false));
                break;
            case PERSON_ID_OVERRIDES_JOINED:
                events.addField(new ColumnField("event_person_id", "person_id", ValueKind.UUID, false, true));
                events.addField(new LazyJoin("override", overrides, "LEFT JOIN", List.of("distinct_id"),
                        List.of("distinct_id"), (from, to) -> eq(field(from, "distinct_id"), field(to, "distinct_id")),
                        true));
                events.addField(new ExpressionField("person_id", call("if",
                        not(call("empty", field("override", "distinct_id"))),
                        field("override", "person_id"),
                        field("event_person_id")), false));
                events.addField(new LazyJoin("person", persons, "LEFT JOIN", List.of("person_id"), List.of("id"),
                        (from, to) -> eq(field(from, "person_id"), field(to, "id")), false));
                break;
            case DISTINCT_ID_JOINED:
                events.addField(new LazyJoin("pdi", distinctIds, "INNER JOIN", List.of("distinct_id"),
                        List.of("distinct_id"), (from, to) -> eq(field(from, "distinct_id"), field(to, "distinct_id")),
                        false));
                events.addField(FieldTraverser.of("person_id", "pdi", "person_id"));
                events.addField(FieldTraverser.of("person", "pdi", "person"));
                break;
            default:
                throw new IllegalArgumentException("Unknown person join strategy " + strategy);
        }

        SessionTableVersion version = sessions.version();
        events.addField(new LazyJoin("session", sessions, "LEFT JOIN", List.of("$session_id"),
                List.of(version.hasUuidKey() ? "session_id_v7" : "session_id"),
                (from, to) -> version.hasUuidKey()
                        ? eq(call("toUInt128", call("accurateCast", field(from, "$session_id"), inlined("UUID"))),
                        field(to, "session_id_v7"))
                        : eq(field(from, "$session_id"), field(to, "session_id")),
                false));
        return events;
    }

    /**
     * Registers dedicated and map columns as hidden columns, and side-table slots as hidden lazy joins, on
     * every table whose JSON properties the catalog entry describes.
     */
    private static void addCatalogFields(Map<String, Table> tables, MaterializationCatalog catalog,
                                         PhysicalTable propertySlots) {
        for (MaterializedProperty property : catalog.entries()) {
            for (Table table : tables.values()) {
                if (!table.catalogTables().contains(property.table())) {
                    continue;
                }
                if (property.storage() == PropertyStorage.DEDICATED_COLUMN) {
                    boolean nullable = property.nullable() && !ReservedProperties.isReserved(property.property());
                    table.addFieldIfAbsent(ColumnField.hidden(property.column(), ValueKind.STRING, nullable));
                } else if (property.storage() == PropertyStorage.MAP_COLUMN) {
                    table.addFieldIfAbsent(ColumnField.hidden(property.column(), ValueKind.MAP, false));
                } else if (property.storage() == PropertyStorage.SIDE_TABLE_SLOT && table.entityIdField() != null) {
                    table.addFieldIfAbsent(slotJoin(table, property.slot(), propertySlots));
                }
            }
        }
    }

    public static String slotFieldName(int slot) {
        return "slot_" + slot;
    }

    private static LazyJoin slotJoin(Table table, int slot, PhysicalTable propertySlots) {
        String idField = table.entityIdField();
        return new LazyJoin(slotFieldName(slot), propertySlots, "LEFT JOIN", List.of(idField), List.of("entity_id", "slot"),
                (from, to) -> and(
                        eq(field(from, idField), field(to, "entity_id")),
                        eq(field(to, "slot"), constant((long) slot))),
                true);
    }

    @Nullable
    public Table getTable(String name) {
        return tables.get(name);
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public Modifiers modifiers() {
        return modifiers;
    }
}
