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

/// File layout of the mapping results of one method on one dataset.
///
/// ```text
/// <mappings>/<method>/<db>/<db>_ged_mapping.bin
/// <mappings>/<method>/<db>/<db>_ged_mapping.csv
/// <mappings>/<method>/<db>/graph_ids.txt
/// <mappings>/<method>/<db>/tmp/...          (shards)
/// ```
///
/// @param mappingsRoot root directory of all mapping results
/// @param method solver method name
/// @param datasetName dataset name
public record MappingPaths(Path mappingsRoot, String method, String datasetName) {

    public Path datasetDir() {
        return mappingsRoot.resolve(method).resolve(datasetName);
    }

    public Path canonicalFile() {
        return datasetDir().resolve(datasetName + ShardLayout.SHARD_MARKER + ShardLayout.SHARD_EXTENSION);
    }

    public Path csvFile() {
        return datasetDir().resolve(datasetName + ShardLayout.SHARD_MARKER + ".csv");
    }

    public Path graphIdsFile() {
        return datasetDir().resolve("graph_ids.txt");
    }

    public Path shardRoot() {
        return datasetDir().resolve("tmp");
    }

    public ShardLayout shardLayout() {
        return new ShardLayout(shardRoot(), datasetName);
    }
}
