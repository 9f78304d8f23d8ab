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

package com.strata.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.strata.JSONUtils;
import com.strata.common.StrataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Locale;

/**
 * Reads a catalog snapshot exported by the catalog service:
 * <pre>
 * {"properties": [
 *   {"table": "events", "property": "$browser", "storage": "DEDICATED_COLUMN",
 *    "column": "mat_$browser", "value_type": "STRING", "nullable": true},
 *   {"table": "person", "property": "plan", "storage": "SIDE_TABLE_SLOT", "slot": 3}
 * ]}
 * </pre>
 */
public final class CatalogSnapshotReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogSnapshotReader.class);

    private CatalogSnapshotReader() {
    }

    public static MaterializationCatalog read(String json) {
        return read(JSONUtils.readTree(json));
    }

    public static MaterializationCatalog read(InputStream input) {
        return read(JSONUtils.readTree(input));
    }

    public static MaterializationCatalog read(JsonNode root) {
        JsonNode properties = root.path("properties");
        if (!properties.isArray()) {
            throw new StrataException("Catalog snapshot must contain a 'properties' array");
        }
        MaterializationCatalog.Builder builder = MaterializationCatalog.builder();
        for (JsonNode node : properties) {
            builder.add(readEntry(node));
        }
        MaterializationCatalog catalog = builder.build();
        LOGGER.debug("Loaded materialization catalog with {} entries", catalog.size());
        return catalog;
    }

    private static MaterializedProperty readEntry(JsonNode node) {
        String table = requireText(node, "table");
        String property = requireText(node, "property");
        try {
            PropertyStorage storage = PropertyStorage.valueOf(node.path("storage").asText("JSON").toUpperCase(Locale.ROOT));
            PropertyValueType valueType = PropertyValueType.valueOf(
                    node.path("value_type").asText("STRING").toUpperCase(Locale.ROOT));
            String column = node.hasNonNull("column") ? node.get("column").asText() : null;
            int slot = node.path("slot").asInt(-1);
            boolean nullable = node.path("nullable").asBoolean(true);
            return new MaterializedProperty(table, property, storage, column, slot, valueType, nullable);
        } catch (IllegalArgumentException e) {
            throw new StrataException("Invalid catalog entry for " + table + "." + property + ": " + e.getMessage(), e);
        }
    }

    private static String requireText(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual()) {
            throw new StrataException("Catalog entry is missing '" + name + "'");
        }
        return value.asText();
    }
}
