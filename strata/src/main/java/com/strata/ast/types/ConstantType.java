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

package com.strata.ast.types;

import java.util.Objects;

public record ConstantType(ValueKind kind, boolean nullable) implements ResolvedType {
    public static final ConstantType UNKNOWN = new ConstantType(ValueKind.UNKNOWN, true);
    public static final ConstantType BOOLEAN = new ConstantType(ValueKind.BOOLEAN, false);

    public ConstantType {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ConstantType of(ValueKind kind, boolean nullable) {
        return new ConstantType(kind, nullable);
    }

    public ConstantType withNullable(boolean newNullable) {
        return new ConstantType(kind, newNullable);
    }
}
