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

package com.strata.compiler;

import com.strata.ast.Expr;

/**
 * One stage of the compile pipeline. A pass never mutates its input; it returns a new tree.
 */
public interface CompilerPass {

    Expr apply(Expr node, CompileContext context);

    /**
     * Get the name of this pass.
     *
     * @return pass name for logging
     */
    String getName();
}
