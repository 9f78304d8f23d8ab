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

package com.strata.properties;

import com.google.common.collect.ImmutableList;
import com.strata.ast.Expr;
import com.strata.compiler.CompileContext;

/**
 * Reads the property out of the JSON blob. Always applicable, so it is the fallback.
 */
public class JsonExtractStrategy implements PropertyAccessStrategy {

    @Override
    public Expr read(PropertyAccess access, CompileContext context) {
        ImmutableList<String> keys = ImmutableList.<String>builder()
                .add(access.property())
                .addAll(access.nestedChain())
                .build();
        Expr raw = PropertyExprs.extractJson(PropertyExprs.column(access.propertiesField()), keys, !access.isReserved());
        return PropertyExprs.typed(raw, access.valueType(), context.settings().timezone());
    }

    @Override
    public String getName() {
        return "JsonExtract";
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public boolean canApply(PropertyAccess access, CompileContext context) {
        return true;
    }
}
