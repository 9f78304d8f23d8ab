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

package com.strata.ast;

/**
 * Controls what {@link CloningVisitor} carries over to the copy.
 */
public record CloneOptions(boolean retainTypes) {
    private static final CloneOptions KEEP = new CloneOptions(true);
    private static final CloneOptions CLEAR = new CloneOptions(false);

    /**
     * Copy with resolved types stripped, used to compare trees structurally.
     */
    public static CloneOptions clearTypes() {
        return CLEAR;
    }

    public static CloneOptions keepTypes() {
        return KEEP;
    }
}
