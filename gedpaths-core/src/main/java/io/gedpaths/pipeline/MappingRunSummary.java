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

import io.gedpaths.mapping.PairKey;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/// What a [MappingPipeline] run did.
///
/// @param requestedPairs pairs asked for
/// @param skippedPairs requested pairs that already had a result
/// @param scheduledPairs pairs handed to the executor
/// @param failedPairs pairs of failed chunks, left pending
/// @param existingRepair repair pass over results loaded from an earlier run
/// @param mergedRepair repair pass over the merged result set
/// @param totalResults results in the canonical file after the run
/// @param canonicalFile the canonical result file
/// @param elapsed wall time of the run
public record MappingRunSummary(
    int requestedPairs,
    int skippedPairs,
    int scheduledPairs,
    List<PairKey> failedPairs,
    RepairLoop.Report existingRepair,
    RepairLoop.Report mergedRepair,
    int totalResults,
    Path canonicalFile,
    Duration elapsed
) {
    public MappingRunSummary {
        failedPairs = List.copyOf(failedPairs);
    }

    /// Pairs still invalid after repair, from both passes.
    public List<PairKey> invalidPairs() {
        return Stream.concat(existingRepair.stillInvalid().stream(),
                mergedRepair.stillInvalid().stream())
            .distinct()
            .sorted()
            .toList();
    }

    public boolean isComplete() {
        return failedPairs.isEmpty() && invalidPairs().isEmpty();
    }
}
