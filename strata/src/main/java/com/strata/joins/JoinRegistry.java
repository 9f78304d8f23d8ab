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

package com.strata.joins;

import com.google.common.collect.ImmutableList;
import com.strata.ast.types.LazyJoinType;
import com.strata.ast.types.Types;
import com.strata.database.LazyJoin;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The joins requested by one SELECT, in the order they are spliced. Two requests for the same table
 * over the same key with the same join type from the same source share one join.
 */
public class JoinRegistry {
    private final Map<JoinKey, JoinRequest> byKey = new HashMap<>();
    private final List<JoinRequest> requests = new ArrayList<>();

    record JoinKey(String table, String field, List<String> fromFields, List<String> toFields, String joinType,
                   String scope) {
        static JoinKey of(LazyJoinType type) {
            LazyJoin lazyJoin = type.lazyJoin();
            return new JoinKey(lazyJoin.joinTable().name(), lazyJoin.name(), lazyJoin.fromFields(),
                    lazyJoin.toFields(), lazyJoin.joinType(), String.valueOf(Types.aliasOf(type.sourceType())));
        }
    }

    /**
     * The request serving this lazy join, null when it has not been registered.
     */
    @Nullable
    public JoinRequest lookup(LazyJoinType type) {
        return byKey.get(JoinKey.of(type));
    }

    public boolean isJoined(LazyJoinType type) {
        return byKey.containsKey(JoinKey.of(type));
    }

    /**
     * Registers the request unless an equivalent join exists already.
     *
     * @return the request that serves the join, the existing one for a duplicate
     */
    public JoinRequest register(JoinRequest request) {
        JoinKey key = JoinKey.of(request.lazyJoinType());
        JoinRequest existing = byKey.get(key);
        if (existing != null) {
            return existing;
        }
        byKey.put(key, request);
        requests.add(request);
        return request;
    }

    public List<JoinRequest> requests() {
        return ImmutableList.copyOf(requests);
    }

    public int size() {
        return requests.size();
    }
}
