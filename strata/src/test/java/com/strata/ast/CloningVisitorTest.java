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

import com.strata.compiler.BaseCompilerTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.strata.ast.Exprs.constant;
import static com.strata.ast.Exprs.eq;
import static com.strata.ast.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CloningVisitor Tests")
class CloningVisitorTest extends BaseCompilerTest {

    private CompareOperation resolvedWhere() {
        SelectQuery resolved = (SelectQuery) resolve(select("events", eq(field("event"), constant("$pageview")),
                field("event")), context());
        return (CompareOperation) resolved.where();
    }

    @Test
    @DisplayName("Should keep resolved types when asked to")
    void shouldKeepResolvedTypes() {
        CompareOperation where = resolvedWhere();
        assertNotNull(where.type());

        Expr copy = CloningVisitor.cloneExpr(where, CloneOptions.keepTypes());
        assertEquals(where, copy);
        assertNotNull(copy.type());
    }

    @Test
    @DisplayName("Should strip resolved types from every node of the copy")
    void shouldStripResolvedTypes() {
        CompareOperation where = resolvedWhere();

        CompareOperation copy = (CompareOperation) CloningVisitor.cloneExpr(where, CloneOptions.clearTypes());
        assertNull(copy.type());
        assertNull(copy.left().type());
        assertNull(copy.right().type());
        assertEquals(copy, CloningVisitor.cloneExpr(copy, CloneOptions.clearTypes()));
    }

    @Test
    @DisplayName("Should expose the retain flag of each option")
    void shouldExposeRetainFlag() {
        assertTrue(CloneOptions.keepTypes().retainTypes());
        assertFalse(CloneOptions.clearTypes().retainTypes());
    }
}
