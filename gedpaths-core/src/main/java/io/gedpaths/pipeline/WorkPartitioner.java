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

import java.util.ArrayList;
import java.util.List;

/// Splits the sorted pending pairs into contiguous chunks.
///
/// With more than one worker the input is cut into about `10 × threads` chunks, so
/// that uneven per-pair cost evens out across workers. With a single worker the whole
/// input is one chunk. The partition depends only on the input and the thread count.
public final class WorkPartitioner {

    /// Number of chunks created per worker thread.
    public static final int CHUNKS_PER_THREAD = 10;

    private WorkPartitioner() {
    }

    /// Partitions `pairs` for `threads` workers.
    ///
    /// @param pairs the pairs, in canonical order
    /// @param threads the worker count, at least 1
    /// @return the chunks in order; empty if `pairs` is empty
    public static List<WorkChunk> partition(List<PairKey> pairs, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        List<WorkChunk> chunks = new ArrayList<>();
        int total = pairs.size();
        if (total == 0) {
            return chunks;
        }
        if (threads == 1) {
            chunks.add(new WorkChunk(0, pairs));
            return chunks;
        }
        int chunkCount = threads * CHUNKS_PER_THREAD;
        int chunkSize = Math.max(1, (total + chunkCount - 1) / chunkCount);
        for (int start = 0; start < total; start += chunkSize) {
            int end = Math.min(total, start + chunkSize);
            chunks.add(new WorkChunk(chunks.size(), pairs.subList(start, end)));
        }
        return chunks;
    }
}
