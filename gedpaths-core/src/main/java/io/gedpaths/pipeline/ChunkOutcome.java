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
import java.util.List;
import java.util.Optional;

/// The result of processing one [WorkChunk]: either the shard it produced, or the
/// pairs it failed to produce and why.
public final class ChunkOutcome {

    private final WorkChunk chunk;
    private final int workerIndex;
    private final Path shard;
    private final Throwable failure;

    private ChunkOutcome(WorkChunk chunk, int workerIndex, Path shard, Throwable failure) {
        this.chunk = chunk;
        this.workerIndex = workerIndex;
        this.shard = shard;
        this.failure = failure;
    }

    public static ChunkOutcome success(WorkChunk chunk, int workerIndex, Path shard) {
        return new ChunkOutcome(chunk, workerIndex, shard, null);
    }

    public static ChunkOutcome failure(WorkChunk chunk, int workerIndex, Throwable cause) {
        return new ChunkOutcome(chunk, workerIndex, null, cause);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int chunkIndex() {
        return chunk.index();
    }

    public WorkChunk chunk() {
        return chunk;
    }

    public Optional<Path> shard() {
        return Optional.ofNullable(shard);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /// The pairs left without a result, empty on success.
    public List<PairKey> failedPairs() {
        return isSuccess() ? List.of() : chunk.pairs();
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "ChunkOutcome{chunk=" + chunk.index() + ", worker=" + workerIndex + ", ok, shard=" + shard + "}"
            : "ChunkOutcome{chunk=" + chunk.index() + ", worker=" + workerIndex + ", failed: " + failure + "}";
    }
}
