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

import java.util.List;

/// A contiguous slice of the sorted pending pairs, processed as one unit of work.
///
/// @param index position of the chunk in the partition
/// @param pairs the pairs of this chunk, in canonical order
public record WorkChunk(int index, List<PairKey> pairs) {

    public WorkChunk {
        pairs = List.copyOf(pairs);
    }

    public int size() {
        return pairs.size();
    }
}
