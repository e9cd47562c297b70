package io.gedpaths.pipeline;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.gedpaths.mapping.PairKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Removes pairs that already have a result, so that re-running a batch only computes
/// what is missing.
public final class ResumeFilter {

    private ResumeFilter() {
    }

    /// Returns the pending pairs without those in `existing`, preserving the order of
    /// `pending`. Neither argument is modified.
    public static List<PairKey> filter(List<PairKey> pending, Collection<PairKey> existing) {
        if (existing.isEmpty()) {
            return new ArrayList<>(pending);
        }
        Set<PairKey> done = existing instanceof Set ? (Set<PairKey>) existing : new HashSet<>(existing);
        List<PairKey> remaining = new ArrayList<>(pending.size());
        for (PairKey pair : pending) {
            if (!done.contains(pair)) {
                remaining.add(pair);
            }
        }
        return remaining;
    }
}
