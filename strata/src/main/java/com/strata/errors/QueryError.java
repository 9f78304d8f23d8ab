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

package com.strata.errors;

import com.strata.common.StrataException;

import javax.annotation.Nullable;

/**
 * A problem with the user's query. The message is safe to show to the query author.
 */
public class QueryError extends StrataException {
    private final String chain;
    private final String suggestion;

    public QueryError(String message) {
        this(message, null, null);
    }

    public QueryError(String message, @Nullable String chain, @Nullable String suggestion) {
        super(suggestion == null ? message : message + ". Did you mean '" + suggestion + "'?");
        this.chain = chain;
        this.suggestion = suggestion;
    }

    /**
     * The offending identifier chain, if the error is about one.
     */
    @Nullable
    public String getChain() {
        return chain;
    }

    /**
     * The nearest valid alternative, if one was close enough.
     */
    @Nullable
    public String getSuggestion() {
        return suggestion;
    }
}
