package io.gedpaths.graph;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// An immutable, undirected graph with integer node labels and integer edge labels.
///
/// Nodes are addressed by their local index `0 .. nodeCount()-1`. Edges are stored
/// normalized so that `u < v`; self loops and parallel edges are not representable.
/// Instances are safe to share across threads without locking.
///
/// ```text
///   nodes:  0:[C]  1:[N]  2:[O]
///   edges:  (0,1):1  (1,2):2
/// ```
public final class LabeledGraph {

    /// An undirected labeled edge with `u < v`.
    ///
    /// @param u the smaller endpoint
    /// @param v the larger endpoint
    /// @param label the edge label
    public record Edge(int u, int v, int label) implements Comparable<Edge> {
        public Edge {
            if (u == v) {
                throw new IllegalArgumentException("self loops are not supported: (" + u + "," + v + ")");
            }
            if (u > v) {
                int tmp = u;
                u = v;
                v = tmp;
            }
        }

        @Override
        public int compareTo(Edge o) {
            int c = Integer.compare(u, o.u);
            return c != 0 ? c : Integer.compare(v, o.v);
        }
    }

    private final String name;
    private final int[] nodeLabels;
    private final List<Edge> edges;
    private final Map<Long, Integer> edgeLabels;
    private final int[][] adjacency;

    private LabeledGraph(String name, int[] nodeLabels, List<Edge> edges) {
        this.name = name;
        this.nodeLabels = nodeLabels;
        List<Edge> sorted = new ArrayList<>(edges);
        Collections.sort(sorted);
        this.edges = Collections.unmodifiableList(sorted);
        this.edgeLabels = new HashMap<>(sorted.size() * 2);

        int[] degree = new int[nodeLabels.length];
        for (Edge e : sorted) {
            if (e.u() < 0 || e.v() >= nodeLabels.length) {
                throw new IllegalArgumentException("edge (" + e.u() + "," + e.v() + ") out of range for "
                    + nodeLabels.length + " nodes in graph " + name);
            }
            if (edgeLabels.put(key(e.u(), e.v()), e.label()) != null) {
                throw new IllegalArgumentException("duplicate edge (" + e.u() + "," + e.v() + ") in graph " + name);
            }
            degree[e.u()]++;
            degree[e.v()]++;
        }
        this.adjacency = new int[nodeLabels.length][];
        for (int i = 0; i < nodeLabels.length; i++) {
            adjacency[i] = new int[degree[i]];
        }
        int[] fill = new int[nodeLabels.length];
        for (Edge e : sorted) {
            adjacency[e.u()][fill[e.u()]++] = e.v();
            adjacency[e.v()][fill[e.v()]++] = e.u();
        }
    }

    /// Creates a graph from node labels and edges.
    ///
    /// @param name a display name, may be empty
    /// @param nodeLabels one label per node
    /// @param edges the edges, any endpoint order
    /// @return a new graph
    public static LabeledGraph of(String name, int[] nodeLabels, List<Edge> edges) {
        Objects.requireNonNull(nodeLabels, "nodeLabels cannot be null");
        Objects.requireNonNull(edges, "edges cannot be null");
        return new LabeledGraph(name == null ? "" : name, nodeLabels.clone(), edges);
    }

    /// Returns an empty builder.
    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static long key(int u, int v) {
        int a = Math.min(u, v);
        int b = Math.max(u, v);
        return ((long) a << 32) | (b & 0xffffffffL);
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodeLabels.length;
    }

    public int edgeCount() {
        return edges.size();
    }

    public int label(int node) {
        return nodeLabels[node];
    }

    /// Returns a copy of the node labels.
    public int[] nodeLabels() {
        return nodeLabels.clone();
    }

    /// Returns the sorted, unmodifiable edge list.
    public List<Edge> edges() {
        return edges;
    }

    public boolean hasEdge(int u, int v) {
        return u != v && edgeLabels.containsKey(key(u, v));
    }

    /// Returns the label of edge `(u,v)`.
    ///
    /// @throws IllegalArgumentException if there is no such edge
    public int edgeLabel(int u, int v) {
        Integer label = edgeLabels.get(key(u, v));
        if (label == null) {
            throw new IllegalArgumentException("no edge (" + u + "," + v + ") in graph " + name);
        }
        return label;
    }

    public int degree(int node) {
        return adjacency[node].length;
    }

    /// Returns the neighbors of a node. The returned array must not be modified.
    public int[] neighbors(int node) {
        return adjacency[node];
    }

    /// Checks whether the graph is connected. The empty graph counts as connected.
    public boolean isConnected() {
        int n = nodeLabels.length;
        if (n <= 1) {
            return true;
        }
        boolean[] seen = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        seen[0] = true;
        int visited = 1;
        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (int next : adjacency[node]) {
                if (!seen[next]) {
                    seen[next] = true;
                    visited++;
                    queue.add(next);
                }
            }
        }
        return visited == n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabeledGraph)) {
            return false;
        }
        LabeledGraph that = (LabeledGraph) o;
        return Arrays.equals(nodeLabels, that.nodeLabels) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nodeLabels) + edges.hashCode();
    }

    @Override
    public String toString() {
        return "LabeledGraph{" + name + ", nodes=" + nodeLabels.length + ", edges=" + edges.size() + "}";
    }

    /// Incremental builder for [LabeledGraph].
    public static final class Builder {
        private final String name;
        private final List<Integer> labels = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /// Adds a node and returns its index.
        public int addNode(int label) {
            labels.add(label);
            return labels.size() - 1;
        }

        public Builder node(int label) {
            addNode(label);
            return this;
        }

        public Builder edge(int u, int v, int label) {
            edges.add(new Edge(u, v, label));
            return this;
        }

        public Builder edge(int u, int v) {
            return edge(u, v, 0);
        }

        public LabeledGraph build() {
            int[] nodeLabels = new int[labels.size()];
            for (int i = 0; i < nodeLabels.length; i++) {
                nodeLabels[i] = labels.get(i);
            }
            return new LabeledGraph(name == null ? "" : name, nodeLabels, edges);
        }
    }
}
