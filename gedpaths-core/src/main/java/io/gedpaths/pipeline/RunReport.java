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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Aggregated outcomes of one parallel run, ordered by chunk index.
public final class RunReport {

    private final List<ChunkOutcome> outcomes;
    private final Duration elapsed;

    public RunReport(List<ChunkOutcome> outcomes, Duration elapsed) {
        List<ChunkOutcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparingInt(ChunkOutcome::chunkIndex));
        this.outcomes = List.copyOf(sorted);
        this.elapsed = elapsed;
    }

    public List<ChunkOutcome> outcomes() {
        return outcomes;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public int totalChunks() {
        return outcomes.size();
    }

    public int succeededChunks() {
        return (int) outcomes.stream().filter(ChunkOutcome::isSuccess).count();
    }

    public List<ChunkOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }

    /// Every pair left pending because its chunk failed, in canonical order.
    public List<PairKey> failedPairs() {
        List<PairKey> failed = new ArrayList<>();
        for (ChunkOutcome outcome : outcomes) {
            failed.addAll(outcome.failedPairs());
        }
        failed.sort(PairKey.ORDER);
        return failed;
    }

    public boolean isComplete() {
        return failures().isEmpty();
    }
}
