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

import com.strata.common.StrataException;
import com.strata.joins.PersonJoinStrategy;
import com.strata.joins.SessionTableVersion;
import com.strata.properties.MapColumnMode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Reads {@link CompilerSettings} and {@link Modifiers} from Typesafe Config. Defaults live in the
 * module's {@code reference.conf} under {@code strata.compiler} and {@code strata.modifiers}.
 */
public final class StrataConfig {
    private final CompilerSettings settings;
    private final Modifiers modifiers;

    private StrataConfig(CompilerSettings settings, Modifiers modifiers) {
        this.settings = settings;
        this.modifiers = modifiers;
    }

    public static StrataConfig load() {
        return from(ConfigFactory.load());
    }

    public static StrataConfig from(Config config) {
        try {
            Config compiler = config.getConfig("strata.compiler");
            String outputFormat = compiler.hasPath("output_format") ? compiler.getString("output_format") : null;
            if (outputFormat != null && outputFormat.isBlank()) {
                outputFormat = null;
            }
            CompilerSettings settings = new CompilerSettings(
                    compiler.getInt("max_limit"),
                    compiler.getInt("max_ast_depth"),
                    compiler.getInt("max_ast_size"),
                    compiler.getInt("max_subquery_depth"),
                    compiler.getInt("max_execution_time_seconds"),
                    outputFormat,
                    compiler.getDuration("session_lookback"),
                    ZoneId.of(compiler.getString("timezone"))
            );

            Config mods = config.getConfig("strata.modifiers");
            Modifiers modifiers = new Modifiers(
                    mods.getBoolean("enable_pushdown"),
                    mods.getEnum(PersonJoinStrategy.class, "person_join_strategy"),
                    mods.getEnum(SessionTableVersion.class, "session_table_version"),
                    mods.getEnum(MapColumnMode.class, "map_column_mode"),
                    mods.getBoolean("materialization_enabled")
            );
            return new StrataConfig(settings, modifiers);
        } catch (ConfigException | IllegalArgumentException | DateTimeException e) {
            throw new StrataException("Invalid strata configuration: " + e.getMessage(), e);
        }
    }

    public CompilerSettings getSettings() {
        return settings;
    }

    public Modifiers getModifiers() {
        return modifiers;
    }
}
