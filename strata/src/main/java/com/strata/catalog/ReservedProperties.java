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

import java.util.Set;

/**
 * High-cardinality system properties that are always present when set and never hold the empty or
 * {@code "null"} placeholder. Their reads skip null normalization and are typed non-nullable.
 */
public final class ReservedProperties {
    private static final Set<String> RESERVED = Set.of("$session_id", "$window_id", "$trace_id", "$span_id");

    private ReservedProperties() {
    }

    public static boolean isReserved(String property) {
        return RESERVED.contains(property);
    }
}
