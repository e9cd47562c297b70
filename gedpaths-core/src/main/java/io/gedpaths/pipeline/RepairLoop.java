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

import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.solver.SolverEnvironment;
import io.gedpaths.solver.SolverEnvironmentFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Recomputes invalid results one pair at a time, in a single pass.
///
/// A recomputed result replaces the original only if it passes validation.
/// Pairs that are still invalid afterwards stay in the collection and are named
/// in the returned [Report].
public class RepairLoop {
    private static final Logger logger = LogManager.getLogger(RepairLoop.class);

    private final SolverEnvironmentFactory environmentFactory;

    public RepairLoop(SolverEnvironmentFactory environmentFactory) {
        this.environmentFactory = environmentFactory;
    }

    /// Outcome of one repair pass.
    ///
    /// @param repaired pairs whose result was replaced
    /// @param stillInvalid pairs left invalid, including those whose recomputation failed
    public record Report(List<PairKey> repaired, List<PairKey> stillInvalid) {
        public Report {
            repaired = List.copyOf(repaired);
            stillInvalid = List.copyOf(stillInvalid);
        }

        public static Report empty() {
            return new Report(List.of(), List.of());
        }

        public int attempted() {
            return repaired.size() + stillInvalid.size();
        }
    }

    /// Repairs the entries of `results` at `invalidIndices`, updating the list in place.
    ///
    /// @param results a mutable result list
    /// @param invalidIndices indices reported by [ValidityChecker#invalidIndices]
    public Report repair(List<MappingResult> results, List<Integer> invalidIndices) {
        if (invalidIndices.isEmpty()) {
            logger.info("No invalid mappings to repair among {}", results.size());
            return Report.empty();
        }
        logger.warn("Found {} invalid mappings, recomputing", invalidIndices.size());

        List<PairKey> repaired = new ArrayList<>();
        List<PairKey> stillInvalid = new ArrayList<>();
        try (SolverEnvironment environment = environmentFactory.create()) {
            for (int index : invalidIndices) {
                PairKey pair = results.get(index).pair();
                MappingResult recomputed;
                try {
                    recomputed = environment.solve(pair);
                } catch (RuntimeException e) {
                    logger.error("Recomputing pair {} failed: {}", pair, e.toString(), e);
                    stillInvalid.add(pair);
                    continue;
                }
                if (ValidityChecker.isValid(recomputed)) {
                    results.set(index, recomputed);
                    repaired.add(pair);
                    logger.debug("Repaired mapping for pair {}", pair);
                } else {
                    stillInvalid.add(pair);
                    logger.warn("Mapping for pair {} is still invalid after recomputation", pair);
                }
            }
        }
        logger.info("Repaired {} of {} invalid mappings", repaired.size(), invalidIndices.size());
        return new Report(repaired, stillInvalid);
    }
}
