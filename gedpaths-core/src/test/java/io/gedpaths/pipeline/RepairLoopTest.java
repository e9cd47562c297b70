package io.gedpaths.pipeline;

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
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.solver.SolverEnvironmentFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RepairLoopTest {

    private static final MappingResult CORRUPT =
        TestGraphs.result(0, 1, 3, new int[]{1, 1, 2}, new int[]{0, 1, 2});
    private static final MappingResult VALID =
        TestGraphs.result(0, 2, 1, new int[]{0, 1}, new int[]{0, 1});

    @Test
    void recomputedValidResultReplacesCorruptOneInPlace() {
        MappingResult fixed = TestGraphs.result(0, 1, 2, new int[]{2, 0, 1}, new int[]{1, 2, 0});
        List<MappingResult> results = new ArrayList<>(List.of(CORRUPT, VALID));
        List<Integer> invalid = ValidityChecker.invalidIndices(results);

        RepairLoop.Report report = new RepairLoop(() -> pair -> fixed).repair(results, invalid);

        assertThat(invalid).containsExactly(0);
        assertThat(results.get(0).forwardMap()).containsExactly(2, 0, 1);
        assertThat(results.get(1)).isSameAs(VALID);
        assertThat(report.repaired()).containsExactly(new PairKey(0, 1));
        assertThat(report.stillInvalid()).isEmpty();
    }

    @Test
    void resultStillInvalidAfterRetryIsKeptAndReported() {
        List<MappingResult> results = new ArrayList<>(List.of(CORRUPT));

        RepairLoop.Report report = new RepairLoop(() -> pair -> CORRUPT).repair(results, List.of(0));

        assertThat(results).containsExactly(CORRUPT);
        assertThat(report.repaired()).isEmpty();
        assertThat(report.stillInvalid()).containsExactly(new PairKey(0, 1));
    }

    @Test
    void solverFailureCountsAsStillInvalid() {
        List<MappingResult> results = new ArrayList<>(List.of(CORRUPT));

        RepairLoop.Report report = new RepairLoop(() -> pair -> {
            throw new IllegalStateException("boom");
        }).repair(results, List.of(0));

        assertThat(report.stillInvalid()).containsExactly(new PairKey(0, 1));
        assertThat(results).containsExactly(CORRUPT);
    }

    @Test
    void eachInvalidPairIsRecomputedExactlyOnce() {
        AtomicInteger calls = new AtomicInteger();
        SolverEnvironmentFactory factory = () -> pair -> {
            calls.incrementAndGet();
            return CORRUPT;
        };
        List<MappingResult> results = new ArrayList<>(List.of(CORRUPT, VALID, CORRUPT));

        new RepairLoop(factory).repair(results, List.of(0, 2));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void nothingToRepairCreatesNoEnvironment() {
        AtomicInteger created = new AtomicInteger();
        List<MappingResult> results = new ArrayList<>(List.of(VALID));

        RepairLoop.Report report = new RepairLoop(() -> {
            created.incrementAndGet();
            return pair -> VALID;
        }).repair(results, List.of());

        assertThat(created.get()).isZero();
        assertThat(report.attempted()).isZero();
    }
}
