package io.gedpaths.solver.greedy;

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

import io.gedpaths.graph.GraphDataset;
import io.gedpaths.graph.LabeledGraph;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.solver.EditCostModel;
import io.gedpaths.solver.EditCosts;
import io.gedpaths.solver.SolverConfig;
import io.gedpaths.solver.SolverEnvironment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.IntStream;

/// Greedy node assignment driven by label agreement and degree similarity.
///
/// Source nodes are visited by descending degree (ties by index) and each is
/// assigned to the free target node with the smallest local cost, where the local
/// cost is the relabel cost plus half the edge cost of the degree difference.
/// Source nodes left over once the target side is exhausted are deleted, target
/// nodes left over are inserted. The reported distance is the cost induced by the
/// resulting assignment, so it is always an upper bound of the true edit distance.
///
/// The environment precomputes label histograms for every graph of the dataset
/// when it is created and caches per-graph visiting orders as pairs are solved.
/// It must only be used from one thread at a time.
public class GreedySolverEnvironment implements SolverEnvironment {
    private static final Logger logger = LogManager.getLogger(GreedySolverEnvironment.class);

    private final GraphDataset dataset;
    private final EditCostModel costModel;
    private final Map<Integer, Integer>[] nodeHistograms;
    private final Map<Integer, Integer>[] edgeHistograms;
    private final Map<Integer, int[]> visitOrders = new HashMap<>();

    @SuppressWarnings("unchecked")
    public GreedySolverEnvironment(GraphDataset dataset, SolverConfig config) {
        this.dataset = dataset;
        this.costModel = config.costModel();
        this.nodeHistograms = new Map[dataset.size()];
        this.edgeHistograms = new Map[dataset.size()];
        for (int id = 0; id < dataset.size(); id++) {
            LabeledGraph graph = dataset.graph(id);
            nodeHistograms[id] = EditCosts.nodeLabelHistogram(graph);
            edgeHistograms[id] = EditCosts.edgeLabelHistogram(graph);
        }
        if (!config.methodOptions().isEmpty()) {
            logger.debug("GREEDY ignores method options '{}'", config.methodOptions());
        }
    }

    @Override
    public MappingResult solve(PairKey pair) {
        long start = System.nanoTime();
        LabeledGraph source = dataset.graph(pair.a());
        LabeledGraph target = dataset.graph(pair.b());

        int[] forward = new int[source.nodeCount()];
        int[] backward = new int[target.nodeCount()];
        Arrays.fill(forward, MappingResult.UNMAPPED);
        Arrays.fill(backward, MappingResult.UNMAPPED);

        for (int i : visitOrder(pair.a(), source)) {
            int best = MappingResult.UNMAPPED;
            double bestCost = Double.POSITIVE_INFINITY;
            for (int j = 0; j < target.nodeCount(); j++) {
                if (backward[j] != MappingResult.UNMAPPED) {
                    continue;
                }
                double cost = localCost(source, i, target, j);
                if (cost < bestCost) {
                    bestCost = cost;
                    best = j;
                }
            }
            if (best == MappingResult.UNMAPPED) {
                break;
            }
            forward[i] = best;
            backward[best] = i;
        }

        double distance = EditCosts.inducedCost(source, target, forward, backward, costModel);
        double lowerBound = EditCosts.labelLowerBound(
            nodeHistograms[pair.a()], source.nodeCount(), nodeHistograms[pair.b()], target.nodeCount(),
            edgeHistograms[pair.a()], source.edgeCount(), edgeHistograms[pair.b()], target.edgeCount(),
            costModel);
        double runtime = (System.nanoTime() - start) / 1e9;
        logger.debug("Solved {} distance={} lowerBound={}", pair, distance, lowerBound);
        return new MappingResult(pair, distance, Math.min(lowerBound, distance), distance, forward, backward, runtime);
    }

    private double localCost(LabeledGraph source, int i, LabeledGraph target, int j) {
        double cost = source.label(i) == target.label(j) ? 0 : costModel.nodeRelabel();
        int degreeDiff = Math.abs(source.degree(i) - target.degree(j));
        return cost + 0.5 * degreeDiff * Math.min(costModel.edgeInsert(), costModel.edgeDelete());
    }

    private int[] visitOrder(int id, LabeledGraph graph) {
        return visitOrders.computeIfAbsent(id, k -> IntStream.range(0, graph.nodeCount())
            .boxed()
            .sorted(Comparator.comparingInt((Integer n) -> -graph.degree(n)).thenComparingInt(n -> n))
            .mapToInt(Integer::intValue)
            .toArray());
    }
}
