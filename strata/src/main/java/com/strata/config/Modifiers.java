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

package com.strata.config;

import com.strata.joins.PersonJoinStrategy;
import com.strata.joins.SessionTableVersion;
import com.strata.properties.MapColumnMode;

import java.util.Objects;

/**
 * Per-tenant and per-query switches that select optimizer and schema-version behaviour.
 */
public record Modifiers(boolean enablePushdown, PersonJoinStrategy personJoinStrategy,
                        SessionTableVersion sessionTableVersion, MapColumnMode mapColumnMode,
                        boolean materializationEnabled) {

    public Modifiers {
        Objects.requireNonNull(personJoinStrategy, "personJoinStrategy must not be null");
        Objects.requireNonNull(sessionTableVersion, "sessionTableVersion must not be null");
        Objects.requireNonNull(mapColumnMode, "mapColumnMode must not be null");
    }

    public static Modifiers defaults() {
        return new Modifiers(true, PersonJoinStrategy.PERSON_ID_OVERRIDES_JOINED, SessionTableVersion.V2,
                MapColumnMode.DISABLED, true);
    }

    public Modifiers withEnablePushdown(boolean value) {
        return new Modifiers(value, personJoinStrategy, sessionTableVersion, mapColumnMode, materializationEnabled);
    }

    public Modifiers withPersonJoinStrategy(PersonJoinStrategy value) {
        return new Modifiers(enablePushdown, value, sessionTableVersion, mapColumnMode, materializationEnabled);
    }

    public Modifiers withSessionTableVersion(SessionTableVersion value) {
        return new Modifiers(enablePushdown, personJoinStrategy, value, mapColumnMode, materializationEnabled);
    }

    public Modifiers withMapColumnMode(MapColumnMode value) {
        return new Modifiers(enablePushdown, personJoinStrategy, sessionTableVersion, value, materializationEnabled);
    }

    public Modifiers withMaterializationEnabled(boolean value) {
        return new Modifiers(enablePushdown, personJoinStrategy, sessionTableVersion, mapColumnMode, value);
    }
}
