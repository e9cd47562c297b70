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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Mutable graph on stable node ids, the intermediate state while a path is built.
///
/// Node ids are not contiguous: deleted ids leave gaps and inserted nodes get ids
/// above the source range. [#toGraph] compacts them in ascending id order.
public final class WorkingGraph {
    private final TreeMap<Integer, Integer> labels;
    private final TreeMap<Long, Integer> edges;
    private final Map<Integer, Integer> degrees;

    private WorkingGraph(TreeMap<Integer, Integer> labels, TreeMap<Long, Integer> edges,
                         Map<Integer, Integer> degrees) {
        this.labels = labels;
        this.edges = edges;
        this.degrees = degrees;
    }

    public static WorkingGraph of(LabeledGraph graph) {
        WorkingGraph working = new WorkingGraph(new TreeMap<>(), new TreeMap<>(), new HashMap<>());
        for (int i = 0; i < graph.nodeCount(); i++) {
            working.labels.put(i, graph.label(i));
            working.degrees.put(i, 0);
        }
        for (LabeledGraph.Edge edge : graph.edges()) {
            working.putEdge(edge.u(), edge.v(), edge.label());
        }
        return working;
    }

    public WorkingGraph copy() {
        return new WorkingGraph(new TreeMap<>(labels), new TreeMap<>(edges), new HashMap<>(degrees));
    }

    public boolean hasNode(int node) {
        return labels.containsKey(node);
    }

    public boolean hasEdge(int u, int v) {
        return edges.containsKey(key(u, v));
    }

    public int degree(int node) {
        return degrees.getOrDefault(node, 0);
    }

    public int nodeCount() {
        return labels.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /// Whether `edit` can be applied now.
    ///
    /// A node can only be deleted once it has no edges left, and an edge can only be
    /// inserted once both endpoints exist.
    public boolean isLegal(Edit edit) {
        switch (edit.operation()) {
            case NODE_INSERT:
                return !hasNode(edit.u());
            case NODE_DELETE:
                return hasNode(edit.u()) && degree(edit.u()) == 0;
            case NODE_RELABEL:
                return hasNode(edit.u());
            case EDGE_INSERT:
                return hasNode(edit.u()) && hasNode(edit.v()) && !hasEdge(edit.u(), edit.v());
            case EDGE_DELETE:
            case EDGE_RELABEL:
                return hasEdge(edit.u(), edit.v());
            default:
                throw new IllegalStateException("Unhandled operation: " + edit.operation());
        }
    }

    /// Applies a legal edit.
    ///
    /// @throws IllegalStateException if the edit is not legal on this graph
    public void apply(Edit edit) {
        if (!isLegal(edit)) {
            throw new IllegalStateException("Edit " + edit + " is not applicable");
        }
        switch (edit.operation()) {
            case NODE_INSERT:
                labels.put(edit.u(), edit.label());
                degrees.put(edit.u(), 0);
                break;
            case NODE_DELETE:
                labels.remove(edit.u());
                degrees.remove(edit.u());
                break;
            case NODE_RELABEL:
                labels.put(edit.u(), edit.label());
                break;
            case EDGE_INSERT:
                putEdge(edit.u(), edit.v(), edit.label());
                break;
            case EDGE_DELETE:
                edges.remove(key(edit.u(), edit.v()));
                degrees.merge(edit.u(), -1, Integer::sum);
                degrees.merge(edit.v(), -1, Integer::sum);
                break;
            case EDGE_RELABEL:
                edges.put(key(edit.u(), edit.v()), edit.label());
                break;
            default:
                throw new IllegalStateException("Unhandled operation: " + edit.operation());
        }
    }

    /// Whether the graph would be connected after applying `edit`. This graph is not changed.
    public boolean isConnectedAfter(Edit edit) {
        WorkingGraph next = copy();
        next.apply(edit);
        return next.toGraph("candidate").isConnected();
    }

    /// Returns the compacted, immutable snapshot of the current state.
    public LabeledGraph toGraph(String name) {
        Map<Integer, Integer> index = new HashMap<>();
        int[] nodeLabels = new int[labels.size()];
        int next = 0;
        for (Map.Entry<Integer, Integer> entry : labels.entrySet()) {
            index.put(entry.getKey(), next);
            nodeLabels[next++] = entry.getValue();
        }
        List<LabeledGraph.Edge> compacted = new ArrayList<>(edges.size());
        for (Map.Entry<Long, Integer> entry : edges.entrySet()) {
            int u = (int) (entry.getKey() >>> 32);
            int v = (int) (entry.getKey() & 0xffffffffL);
            compacted.add(new LabeledGraph.Edge(index.get(u), index.get(v), entry.getValue()));
        }
        return LabeledGraph.of(name, nodeLabels, compacted);
    }

    private void putEdge(int u, int v, int label) {
        edges.put(key(u, v), label);
        degrees.merge(u, 1, Integer::sum);
        degrees.merge(v, 1, Integer::sum);
    }

    private static long key(int u, int v) {
        int lo = Math.min(u, v);
        int hi = Math.max(u, v);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }
}
