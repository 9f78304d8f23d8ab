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

/**
 * How the {@code person} virtual field of events reaches person rows.
 */
public enum PersonJoinStrategy {
    /**
     * Person id and properties are denormalized onto the event row. No join.
     */
    PERSON_ID_ON_EVENTS,

    /**
     * The event's person id is corrected through the distinct id override table, then persons are joined
     * on the effective id.
     */
    PERSON_ID_OVERRIDES_JOINED,

    /**
     * Events join the distinct id mapping on {@code distinct_id}, which in turn joins persons.
     */
    DISTINCT_ID_JOINED
}
