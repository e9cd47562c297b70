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
import io.gedpaths.editpath.EditPath;
import io.gedpaths.editpath.EditStep;
import io.gedpaths.graph.LabeledGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Computes per-path and global statistics over edit paths.
///
/// ## Position buckets
///
/// The operations of a path of length `n` are spread over `bucketCount` equal-width
/// buckets by step index:
///
/// ```text
/// bucket(step) = min(bucketCount - 1, floor(step / (n / bucketCount)))
/// ```
///
/// Every operation lands in exactly one bucket and bucket indices never decrease
/// along the path. Paths shorter than `bucketCount` leave some buckets empty.
///
/// ## Global metrics
///
/// | metric | one value per |
/// |---|---|
/// | `EditPathLength` | path |
/// | `SnapshotNodeCount`, `SnapshotEdgeCount` | snapshot |
/// | `<Category>Count`, e.g. `NodeInsertCount` | path |
/// | `ConnectedSnapshotFraction` | path |
public class PathStatisticsAggregator {
    private static final Logger logger = LogManager.getLogger(PathStatisticsAggregator.class);

    public static final int DEFAULT_BUCKET_COUNT = 10;

    public static final String PATH_LENGTH = "EditPathLength";
    public static final String SNAPSHOT_NODE_COUNT = "SnapshotNodeCount";
    public static final String SNAPSHOT_EDGE_COUNT = "SnapshotEdgeCount";
    public static final String CONNECTED_FRACTION = "ConnectedSnapshotFraction";

    private final int bucketCount;

    public PathStatisticsAggregator() {
        this(DEFAULT_BUCKET_COUNT);
    }

    public PathStatisticsAggregator(int bucketCount) {
        if (bucketCount < 1) {
            throw new IllegalArgumentException("bucketCount must be at least 1, got: " + bucketCount);
        }
        this.bucketCount = bucketCount;
    }

    public int bucketCount() {
        return bucketCount;
    }

    /// Bucket of operation `step` in a path with `length` operations.
    ///
    /// @throws IllegalArgumentException if `step` is not within `[0, length)`
    public static int bucketOf(int step, int length, int bucketCount) {
        if (step < 0 || step >= length) {
            throw new IllegalArgumentException("step " + step + " out of range [0, " + length + ")");
        }
        double width = (double) length / bucketCount;
        int bucket = (int) Math.floor(step / width);
        return Math.min(bucketCount - 1, Math.max(0, bucket));
    }

    public PathStatistics analyze(EditPath path) {
        List<LabeledGraph> snapshots = path.snapshots();
        int[] nodeCounts = new int[snapshots.size()];
        int[] edgeCounts = new int[snapshots.size()];
        boolean[] connected = new boolean[snapshots.size()];
        for (int i = 0; i < snapshots.size(); i++) {
            LabeledGraph snapshot = snapshots.get(i);
            nodeCounts[i] = snapshot.nodeCount();
            edgeCounts[i] = snapshot.edgeCount();
            connected[i] = snapshot.isConnected();
        }

        Map<EditOperation, Integer> counts = new EnumMap<>(EditOperation.class);
        Map<EditOperation, List<Integer>> positions = new EnumMap<>(EditOperation.class);
        Map<EditOperation, int[]> buckets = new EnumMap<>(EditOperation.class);
        for (EditOperation operation : EditOperation.values()) {
            counts.put(operation, 0);
            positions.put(operation, new ArrayList<>());
            buckets.put(operation, new int[bucketCount]);
        }
        int length = path.length();
        for (EditStep step : path.steps()) {
            counts.merge(step.operation(), 1, Integer::sum);
            positions.get(step.operation()).add(step.step());
            buckets.get(step.operation())[bucketOf(step.step(), length, bucketCount)]++;
        }
        for (EditOperation operation : EditOperation.values()) {
            positions.put(operation, List.copyOf(positions.get(operation)));
        }
        return new PathStatistics(path.pair(), length, nodeCounts, edgeCounts, connected, counts, positions, buckets);
    }

    /// Analyzes every path and derives the global metrics.
    public PathStatisticsSummary aggregate(List<EditPath> paths) {
        List<PathStatistics> perPath = new ArrayList<>(paths.size());
        for (EditPath path : paths) {
            perPath.add(analyze(path));
        }

        List<Integer> lengths = new ArrayList<>();
        List<Integer> nodeCounts = new ArrayList<>();
        List<Integer> edgeCounts = new ArrayList<>();
        List<Double> connectedFractions = new ArrayList<>();
        Map<EditOperation, List<Integer>> categoryCounts = new EnumMap<>(EditOperation.class);
        Map<EditOperation, int[]> bucketTotals = new EnumMap<>(EditOperation.class);
        for (EditOperation operation : EditOperation.values()) {
            categoryCounts.put(operation, new ArrayList<>());
            bucketTotals.put(operation, new int[bucketCount]);
        }

        for (PathStatistics stats : perPath) {
            lengths.add(stats.length());
            for (int i = 0; i < stats.snapshotCount(); i++) {
                nodeCounts.add(stats.nodeCounts()[i]);
                edgeCounts.add(stats.edgeCounts()[i]);
            }
            connectedFractions.add((double) stats.connectedSnapshots() / stats.snapshotCount());
            for (EditOperation operation : EditOperation.values()) {
                categoryCounts.get(operation).add(stats.count(operation));
                int[] totals = bucketTotals.get(operation);
                int[] pathBuckets = stats.buckets().get(operation);
                for (int b = 0; b < bucketCount; b++) {
                    totals[b] += pathBuckets[b];
                }
            }
        }

        Map<String, ValueStatistics> metrics = new LinkedHashMap<>();
        metrics.put(PATH_LENGTH, ValueStatistics.compute(PATH_LENGTH, lengths));
        metrics.put(SNAPSHOT_NODE_COUNT, ValueStatistics.compute(SNAPSHOT_NODE_COUNT, nodeCounts));
        metrics.put(SNAPSHOT_EDGE_COUNT, ValueStatistics.compute(SNAPSHOT_EDGE_COUNT, edgeCounts));
        for (EditOperation operation : EditOperation.values()) {
            String name = operation.displayName() + "Count";
            metrics.put(name, ValueStatistics.compute(name, categoryCounts.get(operation)));
        }
        metrics.put(CONNECTED_FRACTION, ValueStatistics.compute(CONNECTED_FRACTION, connectedFractions));

        logger.info("Aggregated statistics over {} paths", perPath.size());
        return new PathStatisticsSummary(perPath, metrics, bucketTotals, bucketCount);
    }
}
