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

/**
 * Type information the resolver attaches to expression nodes. Table-like types describe what a name
 * in a FROM clause binds to; field types describe what a column reference binds to; value types
 * describe literals and call results.
 */
public sealed interface ResolvedType permits TableOrSelectType, FieldType, PropertyType, FieldAliasType,
        AsteriskType, LambdaArgumentType, ConstantType, CallType {
}
