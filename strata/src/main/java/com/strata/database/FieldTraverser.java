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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * An alias for another chain on the same table: resolving {@code name.rest} resolves {@code chain.rest}
 * instead.
 */
public record FieldTraverser(String name, List<String> chain, boolean hidden) implements DatabaseField {
    public FieldTraverser {
        Objects.requireNonNull(name, "name must not be null");
        chain = ImmutableList.copyOf(chain);
    }

    public static FieldTraverser of(String name, String... chain) {
        return new FieldTraverser(name, List.of(chain), false);
    }
}
