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

/**
 * Comparison operators of the query language.
 */
public enum CompareOperator {
    EQ("="),
    NOT_EQ("!="),
    GT(">"),
    GT_EQ(">="),
    LT("<"),
    LT_EQ("<="),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE"),
    ILIKE("ILIKE"),
    NOT_ILIKE("NOT ILIKE"),
    IN("IN"),
    NOT_IN("NOT IN"),
    REGEX("=~"),
    NOT_REGEX("!~"),
    IREGEX("=~*"),
    NOT_IREGEX("!~*"),
    IN_COHORT("IN COHORT"),
    NOT_IN_COHORT("NOT IN COHORT");

    private final String symbol;

    CompareOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == GT_EQ || this == LT || this == LT_EQ;
    }

    public boolean isCohort() {
        return this == IN_COHORT || this == NOT_IN_COHORT;
    }

    /**
     * Operator with its operands swapped: {@code a < b} is {@code b > a}.
     */
    public CompareOperator flip() {
        switch (this) {
            case GT:
                return LT;
            case GT_EQ:
                return LT_EQ;
            case LT:
                return GT;
            case LT_EQ:
                return GT_EQ;
            case EQ:
            case NOT_EQ:
                return this;
            default:
                throw new IllegalStateException("Operator " + this + " cannot be flipped");
        }
    }
}
