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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Result of [PathStatisticsAggregator#aggregate].
public final class PathStatisticsSummary {
    private final List<PathStatistics> paths;
    private final Map<String, ValueStatistics> metrics;
    private final Map<EditOperation, int[]> bucketTotals;
    private final int bucketCount;

    PathStatisticsSummary(List<PathStatistics> paths, Map<String, ValueStatistics> metrics,
                          Map<EditOperation, int[]> bucketTotals, int bucketCount) {
        this.paths = List.copyOf(paths);
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.bucketTotals = new EnumMap<>(bucketTotals);
        this.bucketCount = bucketCount;
    }

    public List<PathStatistics> paths() {
        return paths;
    }

    /// Global metrics by name, in a stable order.
    public Map<String, ValueStatistics> metrics() {
        return metrics;
    }

    public ValueStatistics metric(String name) {
        ValueStatistics stats = metrics.get(name);
        if (stats == null) {
            throw new IllegalArgumentException("Unknown metric: " + name);
        }
        return stats;
    }

    /// Operations of `operation` per position bucket, summed over all paths.
    public int[] bucketTotals(EditOperation operation) {
        return bucketTotals.get(operation).clone();
    }

    public int bucketCount() {
        return bucketCount;
    }

    /// Per path, the step indices at which `operation` occurred.
    public List<List<Integer>> positions(EditOperation operation) {
        List<List<Integer>> rows = new ArrayList<>(paths.size());
        for (PathStatistics path : paths) {
            rows.add(path.positions().get(operation));
        }
        return rows;
    }
}
