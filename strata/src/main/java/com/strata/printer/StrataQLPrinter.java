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

import com.google.common.base.Joiner;
import com.strata.ast.Constant;
import com.strata.ast.Field;
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.config.CompilerSettings;
import com.strata.functions.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a tree back as query text, for debugging and round-trip checks. Constants are inlined, fields
 * keep the chain they were written with, and no tenant guards or limit caps are added.
 */
public class StrataQLPrinter extends SqlPrinter {

    public StrataQLPrinter(CompilerSettings settings, FunctionRegistry functions) {
        super(Dialect.STRATAQL, settings, 0L, functions);
    }

    @Override
    protected String placeholder(String name) {
        return "{" + name + "}";
    }

    @Override
    protected String escapeString(String value) {
        return value.replace("'", "''");
    }

    @Override
    protected String printEquals(String left, String right) {
        return "(" + left + " = " + right + ")";
    }

    @Override
    protected boolean guardsTenants() {
        return false;
    }

    @Override
    protected boolean capsLimit() {
        return false;
    }

    @Override
    public String visitConstant(Constant node) {
        Object value = node.value();
        if (value != null && !(value instanceof Boolean) && !(value instanceof Number)) {
            return inlineLiteral(value);
        }
        return super.visitConstant(node);
    }

    @Override
    public String visitField(Field node) {
        List<String> parts = new ArrayList<>();
        for (String element : node.chain()) {
            parts.add(element.equals("*") ? "*" : quote(element));
        }
        return Joiner.on('.').join(parts);
    }

    @Override
    protected String printJoinTable(JoinExpr join) {
        if (join.table() instanceof SelectQuery) {
            return super.printJoinTable(join);
        }
        String table = visit(join.table());
        return join.alias() == null ? table : table + " AS " + quote(join.alias());
    }
}
