package io.gedpaths.solver;

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

import io.gedpaths.graph.LabeledGraph;
import io.gedpaths.mapping.MappingResult;

import java.util.HashMap;
import java.util.Map;

/// Cost functions over node correspondences.
public final class EditCosts {

    private EditCosts() {
    }

    /// Computes the edit cost induced by a node correspondence.
    ///
    /// @param source the source graph
    /// @param target the target graph
    /// @param forward source node to target node, [MappingResult#UNMAPPED] for deletions
    /// @param backward target node to source node, [MappingResult#UNMAPPED] for insertions
    /// @param model the cost model
    /// @return the induced cost
    public static double inducedCost(LabeledGraph source, LabeledGraph target, int[] forward, int[] backward,
                                     EditCostModel model) {
        double cost = 0;
        for (int i = 0; i < source.nodeCount(); i++) {
            int j = forward[i];
            if (j == MappingResult.UNMAPPED) {
                cost += model.nodeDelete();
            } else if (source.label(i) != target.label(j)) {
                cost += model.nodeRelabel();
            }
        }
        for (int j = 0; j < target.nodeCount(); j++) {
            if (backward[j] == MappingResult.UNMAPPED) {
                cost += model.nodeInsert();
            }
        }
        for (LabeledGraph.Edge e : source.edges()) {
            int fu = forward[e.u()];
            int fv = forward[e.v()];
            if (fu == MappingResult.UNMAPPED || fv == MappingResult.UNMAPPED || !target.hasEdge(fu, fv)) {
                cost += model.edgeDelete();
            } else if (target.edgeLabel(fu, fv) != e.label()) {
                cost += model.edgeRelabel();
            }
        }
        for (LabeledGraph.Edge e : target.edges()) {
            int bu = backward[e.u()];
            int bv = backward[e.v()];
            if (bu == MappingResult.UNMAPPED || bv == MappingResult.UNMAPPED || !source.hasEdge(bu, bv)) {
                cost += model.edgeInsert();
            }
        }
        return cost;
    }

    /// A lower bound on the edit distance from label multisets and sizes alone.
    ///
    /// Every node (edge) of the larger side that cannot be paired with an equally
    /// labeled node (edge) of the other side needs at least one operation.
    public static double labelLowerBound(Map<Integer, Integer> sourceNodeLabels, int sourceNodes,
                                         Map<Integer, Integer> targetNodeLabels, int targetNodes,
                                         Map<Integer, Integer> sourceEdgeLabels, int sourceEdges,
                                         Map<Integer, Integer> targetEdgeLabels, int targetEdges,
                                         EditCostModel model) {
        int nodeOps = Math.max(sourceNodes, targetNodes) - overlap(sourceNodeLabels, targetNodeLabels);
        int edgeOps = Math.max(sourceEdges, targetEdges) - overlap(sourceEdgeLabels, targetEdgeLabels);
        double nodeUnit = Math.min(model.nodeRelabel(), Math.min(model.nodeInsert(), model.nodeDelete()));
        double edgeUnit = Math.min(model.edgeRelabel(), Math.min(model.edgeInsert(), model.edgeDelete()));
        return nodeOps * nodeUnit + edgeOps * edgeUnit;
    }

    /// Counts node labels of a graph.
    public static Map<Integer, Integer> nodeLabelHistogram(LabeledGraph graph) {
        Map<Integer, Integer> histogram = new HashMap<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            histogram.merge(graph.label(i), 1, Integer::sum);
        }
        return histogram;
    }

    /// Counts edge labels of a graph.
    public static Map<Integer, Integer> edgeLabelHistogram(LabeledGraph graph) {
        Map<Integer, Integer> histogram = new HashMap<>();
        for (LabeledGraph.Edge e : graph.edges()) {
            histogram.merge(e.label(), 1, Integer::sum);
        }
        return histogram;
    }

    private static int overlap(Map<Integer, Integer> a, Map<Integer, Integer> b) {
        int common = 0;
        for (Map.Entry<Integer, Integer> entry : a.entrySet()) {
            common += Math.min(entry.getValue(), b.getOrDefault(entry.getKey(), 0));
        }
        return common;
    }
}
