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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// An ordered, immutable collection of graphs addressed by their position (the graph id).
///
/// Once constructed a dataset is shared read-only by every worker of a run.
public final class GraphDataset {

    private final String name;
    private final List<LabeledGraph> graphs;

    public GraphDataset(String name, List<LabeledGraph> graphs) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.graphs = Collections.unmodifiableList(List.copyOf(graphs));
    }

    public String name() {
        return name;
    }

    public int size() {
        return graphs.size();
    }

    /// Returns the graph with the given id.
    ///
    /// @throws IllegalArgumentException if the id is outside `[0, size())`
    public LabeledGraph graph(int id) {
        checkId(id);
        return graphs.get(id);
    }

    public List<LabeledGraph> graphs() {
        return graphs;
    }

    /// Validates a graph id against this dataset.
    ///
    /// @throws IllegalArgumentException if the id is outside `[0, size())`
    public void checkId(int id) {
        if (id < 0 || id >= graphs.size()) {
            throw new IllegalArgumentException("Graph id " + id + " out of range [0, " + graphs.size()
                + ") for dataset " + name);
        }
    }

    @Override
    public String toString() {
        return "GraphDataset{" + name + ", graphs=" + graphs.size() + "}";
    }
}
