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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.strata.ast.types.ResolvedType;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A dotted identifier chain such as {@code event}, {@code e.timestamp} or {@code person.properties.email}.
 */
public record Field(List<String> chain, @Nullable ResolvedType type) implements Expr {
    public Field {
        Preconditions.checkArgument(chain != null && !chain.isEmpty(), "field chain must not be empty");
        chain = ImmutableList.copyOf(chain);
    }

    public Field(List<String> chain) {
        this(chain, null);
    }

    public boolean isAsterisk() {
        return chain.size() == 1 && "*".equals(chain.get(0));
    }

    public String dotted() {
        return Joiner.on('.').join(chain);
    }

    @Override
    public Field withType(@Nullable ResolvedType type) {
        return new Field(chain, type);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitField(this);
    }
}
