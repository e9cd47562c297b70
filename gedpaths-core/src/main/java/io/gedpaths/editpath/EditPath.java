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
import io.gedpaths.mapping.PairKey;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Snapshots `g0 .. gk` from a source to a target graph, with the `k` steps between them.
public final class EditPath {
    private final PairKey pair;
    private final List<LabeledGraph> snapshots;
    private final List<EditStep> steps;

    public EditPath(PairKey pair, List<LabeledGraph> snapshots, List<EditStep> steps) {
        if (snapshots.isEmpty()) {
            throw new IllegalArgumentException("An edit path needs at least one snapshot");
        }
        if (snapshots.size() != steps.size() + 1) {
            throw new IllegalArgumentException("Path " + pair + " has " + snapshots.size()
                + " snapshots but " + steps.size() + " steps");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).step() != i) {
                throw new IllegalArgumentException("Step " + i + " of path " + pair + " is numbered "
                    + steps.get(i).step());
            }
        }
        this.pair = pair;
        this.snapshots = List.copyOf(snapshots);
        this.steps = List.copyOf(steps);
    }

    public PairKey pair() {
        return pair;
    }

    public List<LabeledGraph> snapshots() {
        return snapshots;
    }

    public LabeledGraph snapshot(int index) {
        return snapshots.get(index);
    }

    public LabeledGraph source() {
        return snapshots.get(0);
    }

    public LabeledGraph target() {
        return snapshots.get(snapshots.size() - 1);
    }

    public List<EditStep> steps() {
        return steps;
    }

    /// Number of operations, one less than the number of snapshots.
    public int length() {
        return steps.size();
    }

    public List<EditOperation> operations() {
        List<EditOperation> operations = new ArrayList<>(steps.size());
        for (EditStep step : steps) {
            operations.add(step.operation());
        }
        return operations;
    }

    public Map<EditOperation, Integer> operationCounts() {
        Map<EditOperation, Integer> counts = new EnumMap<>(EditOperation.class);
        for (EditOperation operation : EditOperation.values()) {
            counts.put(operation, 0);
        }
        for (EditStep step : steps) {
            counts.merge(step.operation(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        return "EditPath{" + pair + ", length=" + length() + "}";
    }
}
