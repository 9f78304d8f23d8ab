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

import com.strata.ast.CompareOperation;
import com.strata.ast.Expr;
import com.strata.ast.JoinExpr;
import com.strata.ast.SelectQuery;
import com.strata.ast.TraversingVisitor;
import com.strata.errors.UnsupportedFeatureError;

/**
 * Walks the whole tree before printing and rejects constructs the dialect lacks, so that no partial
 * SQL is ever produced for an unsupported query.
 */
public class CapabilityChecker extends TraversingVisitor {
    private final Dialect dialect;
    private final DialectCapabilities capabilities;

    public CapabilityChecker(Dialect dialect) {
        this.dialect = dialect;
        this.capabilities = dialect.capabilities();
    }

    public static void check(Expr node, Dialect dialect) {
        new CapabilityChecker(dialect).traverse(node);
    }

    @Override
    public Void visitSelectQuery(SelectQuery node) {
        if (node.arrayJoin() != null && !capabilities.arrayJoin()) {
            throw new UnsupportedFeatureError(dialect, "ARRAY JOIN");
        }
        if (node.limitBy() != null && !capabilities.limitBy()) {
            throw new UnsupportedFeatureError(dialect, "LIMIT BY");
        }
        return super.visitSelectQuery(node);
    }

    @Override
    public Void visitJoinExpr(JoinExpr node) {
        if (node.sample() != null && !capabilities.sampling()) {
            throw new UnsupportedFeatureError(dialect, "SAMPLE");
        }
        return super.visitJoinExpr(node);
    }

    @Override
    public Void visitCompareOperation(CompareOperation node) {
        if (node.op().isCohort() && !capabilities.cohortMembership()) {
            throw new UnsupportedFeatureError(dialect, "IN COHORT");
        }
        return super.visitCompareOperation(node);
    }
}
