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

/// Edit cost models understood by the built-in solvers.
public enum EditCostModel {
    /// Every node and edge insertion, deletion and relabel costs 1.
    CONSTANT(1, 1, 1, 1, 1, 1);

    private final double nodeInsert;
    private final double nodeDelete;
    private final double nodeRelabel;
    private final double edgeInsert;
    private final double edgeDelete;
    private final double edgeRelabel;

    EditCostModel(double nodeInsert, double nodeDelete, double nodeRelabel,
                  double edgeInsert, double edgeDelete, double edgeRelabel) {
        this.nodeInsert = nodeInsert;
        this.nodeDelete = nodeDelete;
        this.nodeRelabel = nodeRelabel;
        this.edgeInsert = edgeInsert;
        this.edgeDelete = edgeDelete;
        this.edgeRelabel = edgeRelabel;
    }

    public double nodeInsert() {
        return nodeInsert;
    }

    public double nodeDelete() {
        return nodeDelete;
    }

    public double nodeRelabel() {
        return nodeRelabel;
    }

    public double edgeInsert() {
        return edgeInsert;
    }

    public double edgeDelete() {
        return edgeDelete;
    }

    public double edgeRelabel() {
        return edgeRelabel;
    }
}
