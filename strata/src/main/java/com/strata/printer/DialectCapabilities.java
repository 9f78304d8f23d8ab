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

package com.strata.printer;

/**
 * What a dialect can express natively.
 *
 * @param nativeWindowOffsets whether {@code lag}/{@code lead} exist as window functions
 */
public record DialectCapabilities(boolean sampling, boolean arrayJoin, boolean limitBy, boolean cohortMembership,
                                  NullSafety nullSafety, boolean nativeWindowOffsets) {

    public enum NullSafety {
        /**
         * Comparisons are printed as written.
         */
        NONE,
        /**
         * Comparisons on nullable operands are wrapped in {@code ifNull}/{@code isNull}.
         */
        WRAPPED,
        /**
         * The dialect has null-safe operators, {@code IS [NOT] DISTINCT FROM}.
         */
        NATIVE
    }
}
