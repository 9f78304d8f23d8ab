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

/**
 * Physical generations of the session table.
 */
public enum SessionTableVersion {
    /**
     * {@code sessions}: string session id, plain min/max timestamp columns.
     */
    V1("sessions"),

    /**
     * {@code raw_sessions}: UUIDv7 key whose high 48 bits carry the session start in milliseconds.
     */
    V2("raw_sessions"),

    /**
     * {@code raw_sessions_v3}: UUIDv7 key plus a {@code session_timestamp} partition column.
     */
    V3("raw_sessions_v3");

    private final String physicalTable;

    SessionTableVersion(String physicalTable) {
        this.physicalTable = physicalTable;
    }

    public String physicalTable() {
        return physicalTable;
    }

    public boolean hasUuidKey() {
        return this != V1;
    }
}
