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

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * {@code ROWS|RANGE BETWEEN start AND end}. A single-bound frame has a null {@code end}.
 */
public record WindowFrame(Method method, Bound start, @Nullable Bound end) {
    public enum Method {
        ROWS,
        RANGE
    }

    public enum BoundKind {
        PRECEDING,
        CURRENT_ROW,
        FOLLOWING
    }

    /**
     * A frame bound. A null offset means UNBOUNDED.
     */
    public record Bound(BoundKind kind, @Nullable Integer offset) {
        public Bound {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        public static Bound unboundedPreceding() {
            return new Bound(BoundKind.PRECEDING, null);
        }

        public static Bound unboundedFollowing() {
            return new Bound(BoundKind.FOLLOWING, null);
        }

        public static Bound currentRow() {
            return new Bound(BoundKind.CURRENT_ROW, null);
        }
    }

    public WindowFrame {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(start, "start must not be null");
    }

    public static WindowFrame unbounded() {
        return new WindowFrame(Method.ROWS, Bound.unboundedPreceding(), Bound.unboundedFollowing());
    }
}
