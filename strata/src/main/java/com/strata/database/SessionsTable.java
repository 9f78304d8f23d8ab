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

import com.strata.ast.Expr;
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.types.TableOrSelectType;
import com.strata.ast.types.ValueKind;
import com.strata.compiler.CompileContext;
import com.strata.joins.SessionTableVersion;
import com.strata.pushdown.PushdownTarget;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.strata.ast.Exprs.*;

/**
 * One row per session, aggregated from raw partitioned session rows of the configured
 * {@link SessionTableVersion}. Timestamps use {@code min}/{@code max}, entry fields {@code argMin}, exit
 * fields {@code argMax} and counters {@code sum}.
 */
public class SessionsTable extends LazyTable {
    public static final String NAME = "sessions";

    private final PhysicalTable rawTable;
    private final SessionTableVersion version;

    SessionsTable(PhysicalTable rawTable, SessionTableVersion version) {
        super(NAME);
        this.rawTable = rawTable;
        this.version = version;
        addField(ColumnField.of("session_id", ValueKind.STRING));
        if (version.hasUuidKey()) {
            addField(ColumnField.hidden("session_id_v7", ValueKind.INTEGER, false));
        }
        addField(ColumnField.of("distinct_id", ValueKind.STRING));
        addField(ColumnField.of("$start_timestamp", ValueKind.DATETIME));
        addField(ColumnField.of("$end_timestamp", ValueKind.DATETIME));
        addField(ColumnField.nullable("$entry_current_url", ValueKind.STRING));
        addField(ColumnField.nullable("$end_current_url", ValueKind.STRING));
        addField(ColumnField.of("$pageview_count", ValueKind.INTEGER));
        addField(ColumnField.of("$autocapture_count", ValueKind.INTEGER));
        addField(ColumnField.of("$session_duration", ValueKind.INTEGER));
    }

    public SessionTableVersion version() {
        return version;
    }

    /**
     * Session id as a string, computed from the raw key.
     */
    static Expr sessionIdOf(SessionTableVersion version, @Nullable String raw) {
        if (!version.hasUuidKey()) {
            return raw == null ? field("session_id") : field(raw, "session_id");
        }
        Expr key = raw == null ? field("session_id_v7") : field(raw, "session_id_v7");
        return call("toString", call("reinterpretAsUUID", call("bitOr",
                call("bitShiftLeft", key, constant(64L)),
                call("bitShiftRight", key, constant(64L)))));
    }

    /**
     * Per raw row approximation of the session start: the key's embedded time for UUID keys, the
     * partition timestamp for V3, the row's own bound for V1.
     */
    static Expr approximateTimestampOf(SessionTableVersion version, String boundColumn) {
        switch (version) {
            case V2:
                return call("fromUnixTimestamp64Milli",
                        call("toUInt64", call("bitShiftRight", field("session_id_v7"), constant(80L))));
            case V3:
                return field("session_timestamp");
            default:
                return field(boundColumn);
        }
    }

    private Expr aggregateOf(String name, String raw) {
        switch (name) {
            case "session_id":
                return sessionIdOf(version, raw);
            case "session_id_v7":
                return field(raw, "session_id_v7");
            case "distinct_id":
                return call("any", field(raw, "distinct_id"));
            case "$start_timestamp":
                return call("min", field(raw, "min_timestamp"));
            case "$end_timestamp":
                return call("max", field(raw, "max_timestamp"));
            case "$entry_current_url":
                return call("argMin", field(raw, "entry_url"), field(raw, "min_timestamp"));
            case "$end_current_url":
                return call("argMax", field(raw, "end_url"), field(raw, "max_timestamp"));
            case "$pageview_count":
                return call("sum", field(raw, "pageview_count"));
            case "$autocapture_count":
                return call("sum", field(raw, "autocapture_count"));
            case "$session_duration":
                return call("dateDiff", inlined("second"), call("min", field(raw, "min_timestamp")),
                        call("max", field(raw, "max_timestamp")));
            default:
                throw new IllegalArgumentException("Unknown session field " + name);
        }
    }

    @Override
    public SelectQuery materialize(Set<String> requestedFields, @Nullable Expr pushedFilter, CompileContext context) {
        String raw = rawTable.name();
        String key = version.hasUuidKey() ? "session_id_v7" : "session_id";
        List<Expr> select = new ArrayList<>();
        select.add(field(raw, key));
        for (String name : requestedFields) {
            if (name.equals(key)) {
                continue;
            }
            select.add(alias(name, aggregateOf(name, raw)));
        }
        return SelectQuery.builder()
                .select(select)
                .selectFrom(JoinExpr.from(field(raw), null))
                .where(pushedFilter)
                .groupBy(List.of(field(raw, key)))
                .build();
    }

    /**
     * {@code session_id} is exact. {@code $start_timestamp} and {@code $end_timestamp} are approximated per
     * raw row and get widened by the session lookback. Every other field is aggregated and cannot be
     * decided on raw rows.
     */
    @Override
    public PushdownTarget pushdownTarget(TableOrSelectType scope, CompileContext context) {
        Map<String, Expr> exact = new LinkedHashMap<>();
        exact.put("session_id", sessionIdOf(version, null));
        Map<String, Expr> approximate = new LinkedHashMap<>();
        approximate.put("$start_timestamp", approximateTimestampOf(version, "min_timestamp"));
        approximate.put("$end_timestamp", approximateTimestampOf(version, "max_timestamp"));
        return new PushdownTarget(scope, exact, approximate);
    }
}
