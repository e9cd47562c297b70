package io.gedpaths.editpath;

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
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;

import java.util.ArrayList;
import java.util.List;

/// Turns a node correspondence into an [EditPath].
///
/// ## Stable ids
///
/// Edits are expressed on stable node ids so that ids never shift while a path is
/// built. Source node `i` keeps id `i`; an inserted target node `j` gets id
/// `sourceNodes + j`; a mapped target node takes the id of its source node.
///
/// ## Required edits
///
/// - unmapped source node: node deletion, after its edges are deleted
/// - unmapped target node: node insertion
/// - mapped node with a different label: node relabel
/// - source edge without a mapped counterpart: edge deletion
/// - target edge without a mapped counterpart: edge insertion
/// - mapped edge with a different label: edge relabel
///
/// At every step the [EditOrderingStrategy] picks one of the remaining edits that is
/// legal on the current graph, and the resulting graph becomes the next snapshot.
public class EditPathBuilder {
    private final EditOrderingStrategy strategy;

    public EditPathBuilder(EditOrderingStrategy strategy) {
        this.strategy = strategy;
    }

    /// Builds the path from `source` to `target` for `result`.
    ///
    /// @param result a mapping whose pair ids are `source` and `target`, in that order
    /// @throws InvalidCorrespondenceException if the correspondence is not valid for the two graphs
    public EditPath build(MappingResult result, LabeledGraph source, LabeledGraph target) {
        PairKey pair = result.pair();
        List<Edit> remaining = requiredEdits(result, source, target);

        WorkingGraph current = WorkingGraph.of(source);
        List<LabeledGraph> snapshots = new ArrayList<>(remaining.size() + 1);
        List<EditStep> steps = new ArrayList<>(remaining.size());
        snapshots.add(current.toGraph(snapshotName(pair, 0)));

        while (!remaining.isEmpty()) {
            List<Edit> legal = new ArrayList<>();
            for (Edit edit : remaining) {
                if (current.isLegal(edit)) {
                    legal.add(edit);
                }
            }
            if (legal.isEmpty()) {
                throw new IllegalStateException("No applicable edit left for pair " + pair + ", remaining: "
                    + remaining);
            }
            Edit chosen = strategy.pick(legal, current);
            current.apply(chosen);
            remaining.remove(chosen);
            steps.add(new EditStep(pair.a(), steps.size(), pair.b(), chosen.operation()));
            snapshots.add(current.toGraph(snapshotName(pair, steps.size())));
        }
        return new EditPath(pair, snapshots, steps);
    }

    /// Computes the edits `result` implies, in no particular order.
    ///
    /// @throws InvalidCorrespondenceException if the maps do not match the graph sizes,
    ///     contain duplicates or out-of-range entries, or disagree with each other
    public static List<Edit> requiredEdits(MappingResult result, LabeledGraph source, LabeledGraph target) {
        PairKey pair = result.pair();
        int[] forward = result.forwardMap();
        int[] backward = result.backwardMap();
        if (forward.length != source.nodeCount() || backward.length != target.nodeCount()) {
            throw new InvalidCorrespondenceException(pair, "map sizes " + forward.length + "/" + backward.length
                + " do not match graph sizes " + source.nodeCount() + "/" + target.nodeCount());
        }
        if (!ValidityChecker.isValid(result)) {
            throw new InvalidCorrespondenceException(pair, "duplicate node assignment");
        }
        for (int i = 0; i < forward.length; i++) {
            int j = forward[i];
            if (j != MappingResult.UNMAPPED && (j >= backward.length || backward[j] != i)) {
                throw new InvalidCorrespondenceException(pair, "source node " + i + " maps to " + j
                    + " which does not map back");
            }
        }
        for (int j = 0; j < backward.length; j++) {
            int i = backward[j];
            if (i != MappingResult.UNMAPPED && (i >= forward.length || forward[i] != j)) {
                throw new InvalidCorrespondenceException(pair, "target node " + j + " maps to " + i
                    + " which does not map back");
            }
        }

        int sourceNodes = source.nodeCount();
        int[] stableTarget = new int[target.nodeCount()];
        for (int j = 0; j < stableTarget.length; j++) {
            stableTarget[j] = backward[j] == MappingResult.UNMAPPED ? sourceNodes + j : backward[j];
        }

        List<Edit> edits = new ArrayList<>();
        for (int i = 0; i < sourceNodes; i++) {
            int j = forward[i];
            if (j == MappingResult.UNMAPPED) {
                edits.add(Edit.node(EditOperation.NODE_DELETE, i, source.label(i)));
            } else if (source.label(i) != target.label(j)) {
                edits.add(Edit.node(EditOperation.NODE_RELABEL, i, target.label(j)));
            }
        }
        for (int j = 0; j < target.nodeCount(); j++) {
            if (backward[j] == MappingResult.UNMAPPED) {
                edits.add(Edit.node(EditOperation.NODE_INSERT, stableTarget[j], target.label(j)));
            }
        }
        for (LabeledGraph.Edge edge : source.edges()) {
            int fu = forward[edge.u()];
            int fv = forward[edge.v()];
            if (fu != MappingResult.UNMAPPED && fv != MappingResult.UNMAPPED && target.hasEdge(fu, fv)) {
                int targetLabel = target.edgeLabel(fu, fv);
                if (targetLabel != edge.label()) {
                    edits.add(Edit.edge(EditOperation.EDGE_RELABEL, edge.u(), edge.v(), targetLabel));
                }
            } else {
                edits.add(Edit.edge(EditOperation.EDGE_DELETE, edge.u(), edge.v(), edge.label()));
            }
        }
        for (LabeledGraph.Edge edge : target.edges()) {
            boolean bothMapped = backward[edge.u()] != MappingResult.UNMAPPED
                && backward[edge.v()] != MappingResult.UNMAPPED;
            if (!bothMapped || !source.hasEdge(backward[edge.u()], backward[edge.v()])) {
                edits.add(Edit.edge(EditOperation.EDGE_INSERT, stableTarget[edge.u()], stableTarget[edge.v()],
                    edge.label()));
            }
        }
        return edits;
    }

    private static String snapshotName(PairKey pair, int step) {
        return pair.a() + "_" + pair.b() + "_" + step;
    }
}
