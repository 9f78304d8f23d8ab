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

package com.strata.common.utils;

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Finds the closest candidate to a misspelled name, used to build "Perhaps you meant ..." hints.
 */
public final class NearestMatch {
    // Candidates farther away than this share of the input length are not worth suggesting.
    private static final double MAX_DISTANCE_RATIO = 0.4;

    private NearestMatch() {
    }

    /**
     * Returns the candidate with the smallest edit distance to {@code input}, or null when
     * nothing is close enough to be a plausible typo.
     *
     * @param input      the name that failed to resolve
     * @param candidates the valid names at that position
     * @return the closest candidate or null
     */
    @Nullable
    public static String find(String input, Collection<String> candidates) {
        Preconditions.checkNotNull(input, "input must not be null");
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = distance(input.toLowerCase(), candidate.toLowerCase());
            if (distance < bestDistance || (distance == bestDistance && best != null && candidate.compareTo(best) < 0)) {
                best = candidate;
                bestDistance = distance;
            }
        }
        if (best == null) {
            return null;
        }
        int limit = Math.max(2, (int) Math.ceil(Math.max(input.length(), best.length()) * MAX_DISTANCE_RATIO));
        return bestDistance <= limit ? best : null;
    }

    /**
     * Levenshtein distance with a two-row table.
     */
    public static int distance(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
