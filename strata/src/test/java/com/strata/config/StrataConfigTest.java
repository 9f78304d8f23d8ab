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
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StrataConfig Tests")
class StrataConfigTest {

    private static Config withOverrides(String overrides) {
        return ConfigFactory.parseString(overrides).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    @Test
    @DisplayName("Should load the defaults from reference.conf")
    void shouldLoadDefaults() {
        StrataConfig config = StrataConfig.load();

        assertEquals(CompilerSettings.defaults(), config.getSettings());
        assertEquals(Modifiers.defaults(), config.getModifiers());
    }

    @Test
    @DisplayName("Should apply overrides on top of the defaults")
    void shouldApplyOverrides() {
        StrataConfig config = StrataConfig.from(withOverrides(
                "strata.compiler.max_limit = 100\n"
                        + "strata.compiler.output_format = JSONEachRow\n"
                        + "strata.compiler.session_lookback = 2h\n"
                        + "strata.compiler.timezone = \"Europe/Istanbul\"\n"
                        + "strata.modifiers.person_join_strategy = DISTINCT_ID_JOINED\n"
                        + "strata.modifiers.session_table_version = V3\n"
                        + "strata.modifiers.map_column_mode = OPTIMIZED\n"
                        + "strata.modifiers.enable_pushdown = false\n"));

        CompilerSettings settings = config.getSettings();
        assertEquals(100, settings.maxLimit());
        assertEquals("JSONEachRow", settings.outputFormat());
        assertEquals(Duration.ofHours(2), settings.sessionLookback());
        assertEquals(ZoneId.of("Europe/Istanbul"), settings.timezone());

        Modifiers modifiers = config.getModifiers();
        assertEquals(PersonJoinStrategy.DISTINCT_ID_JOINED, modifiers.personJoinStrategy());
        assertEquals(SessionTableVersion.V3, modifiers.sessionTableVersion());
        assertEquals(MapColumnMode.OPTIMIZED, modifiers.mapColumnMode());
        assertFalse(modifiers.enablePushdown());
        assertTrue(modifiers.materializationEnabled());
    }

    @Test
    @DisplayName("Should treat an empty output format as none")
    void shouldTreatEmptyOutputFormatAsNone() {
        assertNull(StrataConfig.from(withOverrides("strata.compiler.output_format = \"\"")).getSettings().outputFormat());
    }

    @Test
    @DisplayName("Should reject an unknown enum value")
    void shouldRejectUnknownEnumValue() {
        StrataException error = assertThrows(StrataException.class,
                () -> StrataConfig.from(withOverrides("strata.modifiers.session_table_version = V9")));

        assertTrue(error.getMessage().startsWith("Invalid strata configuration"));
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectNonPositiveLimit() {
        assertThrows(StrataException.class, () -> StrataConfig.from(withOverrides("strata.compiler.max_limit = 0")));
    }

    @Test
    @DisplayName("Should reject an unknown timezone")
    void shouldRejectUnknownTimezone() {
        assertThrows(StrataException.class,
                () -> StrataConfig.from(withOverrides("strata.compiler.timezone = \"Mars/Olympus\"")));
    }
}
