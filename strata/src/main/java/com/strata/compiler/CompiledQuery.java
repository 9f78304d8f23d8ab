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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.strata.JSONUtils;
import com.strata.printer.Dialect;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a compile: the SQL text, the values of its bound parameters and the dialect it targets.
 */
public record CompiledQuery(String sql, Map<String, Object> params, Dialect dialect) {
    public CompiledQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        params = ImmutableMap.copyOf(params);
    }

    /**
     * Payload for the execution client: {@code {"dialect": ..., "sql": ..., "params": {...}}}.
     */
    public String toJson() {
        ObjectNode root = JSONUtils.objectMapper.createObjectNode();
        root.put("dialect", dialect.name().toLowerCase(Locale.ROOT));
        root.put("sql", sql);
        root.set("params", JSONUtils.objectMapper.valueToTree(params));
        return JSONUtils.writeValueAsString(root);
    }
}
