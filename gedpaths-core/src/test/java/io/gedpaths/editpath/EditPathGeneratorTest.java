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

import io.gedpaths.TestGraphs;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.pipeline.PairSet;
import io.gedpaths.solver.SolverConfig;
import io.gedpaths.solver.greedy.GreedySolverEnvironment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditPathGeneratorTest {

    private final GraphDataset dataset = TestGraphs.toyDataset();
    private final List<MappingResult> results = solveAll();

    private List<MappingResult> solveAll() {
        GreedySolverEnvironment solver = new GreedySolverEnvironment(dataset, new SolverConfig("GREEDY"));
        List<MappingResult> all = new ArrayList<>();
        for (PairKey pair : PairSet.allPairs(dataset.size()).pairs()) {
            all.add(solver.solve(pair));
        }
        return all;
    }

    @Test
    void skipsInvalidMappings() {
        List<MappingResult> withCorrupt = new ArrayList<>(results);
        withCorrupt.set(0, TestGraphs.result(0, 1, 1, new int[]{0, 0, 1}, new int[]{0, 1, 2}));

        EditPathGenerator.Selection selection = EditPathGenerator.select(withCorrupt, Optional.empty(), 0, 42);

        assertThat(selection.skippedInvalid()).containsExactly(new PairKey(0, 1));
        assertThat(selection.selected()).hasSize(results.size() - 1);
    }

    @Test
    void restrictsToOnePair() {
        EditPathGenerator.Selection selection =
            EditPathGenerator.select(results, Optional.of(new PairKey(2, 3)), 0, 42);

        assertThat(selection.selected()).extracting(MappingResult::pair).containsExactly(new PairKey(2, 3));
    }

    @Test
    void missingPairIsRejected() {
        List<MappingResult> withoutPair = new ArrayList<>(results);
        withoutPair.removeIf(r -> r.pair().equals(new PairKey(2, 3)));

        assertThatThrownBy(() -> EditPathGenerator.select(withoutPair, Optional.of(new PairKey(2, 3)), 0, 42))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(2, 3)");
    }

    @Test
    void samplingIsSeededAndSorted() {
        List<MappingResult> first = EditPathGenerator.select(results, Optional.empty(), 4, 5).selected();
        List<MappingResult> second = EditPathGenerator.select(results, Optional.empty(), 4, 5).selected();

        assertThat(first).hasSize(4).isEqualTo(second);
        assertThat(first).extracting(MappingResult::pair).isSorted();
    }

    @Test
    void limitAboveAvailableKeepsEverything() {
        assertThat(EditPathGenerator.select(results, Optional.empty(), 1000, 5).selected()).hasSameSizeAs(results);
    }

    @Test
    void generatesOnePathPerMapping() {
        List<EditPath> paths = new EditPathGenerator(dataset, new EditPathBuilder(new CanonicalOrderingStrategy()))
            .generate(results);

        assertThat(paths).hasSameSizeAs(results);
        for (EditPath path : paths) {
            assertThat(path.source()).isEqualTo(dataset.graph(path.pair().a()));
        }
    }
}
