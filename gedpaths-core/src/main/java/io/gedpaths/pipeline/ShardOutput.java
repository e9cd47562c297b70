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
import io.gedpaths.mapping.MappingResultCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

/// The output handle of one chunk task. Each handle points at its own file, so
/// concurrent tasks never write to the same location.
///
/// @param file the shard file this task writes
public record ShardOutput(Path file) {

    /// Writes the results of the task, replacing anything written before.
    ///
    /// @throws IOException if the shard cannot be written
    public void write(Collection<MappingResult> results) throws IOException {
        MappingResultCodec.write(file, results);
    }
}
