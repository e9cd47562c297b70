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

import io.gedpaths.TestGraphs;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.graph.LabeledGraph;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.pipeline.PairSet;
import io.gedpaths.solver.EditCostModel;
import io.gedpaths.solver.EditCosts;
import io.gedpaths.solver.SolverConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GreedySolverEnvironmentTest {

    private final GraphDataset dataset = TestGraphs.toyDataset();
    private final GreedySolverEnvironment solver = new GreedySolverEnvironment(dataset, new SolverConfig("GREEDY"));

    @Test
    void identicalGraphsHaveDistanceZero() {
        GraphDataset twins = new GraphDataset("TWINS", List.of(
            TestGraphs.chain("x", 0, 1, 2, 1), TestGraphs.chain("y", 0, 1, 2, 1)));

        MappingResult result = new GreedySolverEnvironment(twins, new SolverConfig("GREEDY")).solve(new PairKey(0, 1));

        assertThat(result.distance()).isZero();
        assertThat(result.lowerBound()).isZero();
    }

    @Test
    void everyResultIsValidAndConsistent() {
        for (PairKey pair : PairSet.allPairs(dataset.size()).pairs()) {
            MappingResult result = solver.solve(pair);
            LabeledGraph source = dataset.graph(pair.a());
            LabeledGraph target = dataset.graph(pair.b());

            assertThat(ValidityChecker.isValid(result)).as("valid %s", pair).isTrue();
            assertThat(result.forwardSize()).isEqualTo(source.nodeCount());
            assertThat(result.backwardSize()).isEqualTo(target.nodeCount());
            assertThat(result.lowerBound()).isLessThanOrEqualTo(result.distance());
            assertThat(result.upperBound()).isEqualTo(result.distance());
            assertThat(result.distance()).isEqualTo(EditCosts.inducedCost(source, target, result.forwardMap(),
                result.backwardMap(), EditCostModel.CONSTANT));
            for (int i = 0; i < result.forwardSize(); i++) {
                int j = result.forward(i);
                if (j != MappingResult.UNMAPPED) {
                    assertThat(result.backward(j)).isEqualTo(i);
                }
            }
        }
    }

    @Test
    void smallerSourceIsFullyMapped() {
        MappingResult result = solver.solve(new PairKey(0, 4));

        assertThat(result.forwardMap()).doesNotContain(MappingResult.UNMAPPED);
        assertThat(result.backwardMap()).containsOnlyOnce(MappingResult.UNMAPPED);
    }

    @Test
    void solvingIsDeterministic() {
        assertThat(solver.solve(new PairKey(1, 2)).forwardMap())
            .containsExactly(new GreedySolverEnvironment(dataset, new SolverConfig("greedy"))
                .solve(new PairKey(1, 2)).forwardMap());
    }
}
