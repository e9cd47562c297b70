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

import java.nio.file.Path;
import java.util.function.Predicate;

/// Names the shard files of a run below a shard root directory.
///
/// ```text
/// <root>/worker_<w>/chunk_<c>/<db>_ged_mapping.bin
/// ```
public final class ShardLayout {

    /// Fragment every shard file name contains.
    public static final String SHARD_MARKER = "_ged_mapping";
    public static final String SHARD_EXTENSION = ".bin";

    private final Path root;
    private final String datasetName;

    public ShardLayout(Path root, String datasetName) {
        this.root = root;
        this.datasetName = datasetName;
    }

    public Path root() {
        return root;
    }

    /// Returns the output handle for a chunk processed by a worker.
    public ShardOutput outputFor(int workerIndex, int chunkIndex) {
        Path dir = root.resolve(String.format("worker_%03d", workerIndex))
            .resolve(String.format("chunk_%06d", chunkIndex));
        return new ShardOutput(dir.resolve(datasetName + SHARD_MARKER + SHARD_EXTENSION));
    }

    /// Matches the files written through [#outputFor].
    public static Predicate<Path> shardFileMatcher() {
        return path -> {
            String name = path.getFileName().toString();
            return name.contains(SHARD_MARKER) && name.endsWith(SHARD_EXTENSION);
        };
    }
}
