package io.gedpaths.stats;

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

import io.gedpaths.editpath.EditOperation;
import io.gedpaths.mapping.PairKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Statistics of a single edit path.
///
/// @param pair the path's pair
/// @param length number of operations
/// @param nodeCounts node count of every snapshot
/// @param edgeCounts edge count of every snapshot
/// @param connected connectivity of every snapshot
/// @param operationCounts number of operations per category, every category present
/// @param positions step indices at which each category occurs, every category present
/// @param buckets per category, the number of its operations in each position bucket
public record PathStatistics(
    PairKey pair,
    int length,
    int[] nodeCounts,
    int[] edgeCounts,
    boolean[] connected,
    Map<EditOperation, Integer> operationCounts,
    Map<EditOperation, List<Integer>> positions,
    Map<EditOperation, int[]> buckets
) {
    public PathStatistics {
        operationCounts = Collections.unmodifiableMap(new EnumMap<>(operationCounts));
        positions = Collections.unmodifiableMap(new EnumMap<>(positions));
        buckets = Collections.unmodifiableMap(new EnumMap<>(buckets));
    }

    public int count(EditOperation operation) {
        return operationCounts.get(operation);
    }

    public int snapshotCount() {
        return nodeCounts.length;
    }

    public int connectedSnapshots() {
        int n = 0;
        for (boolean c : connected) {
            if (c) n++;
        }
        return n;
    }

    public boolean allConnected() {
        return connectedSnapshots() == connected.length;
    }
}
