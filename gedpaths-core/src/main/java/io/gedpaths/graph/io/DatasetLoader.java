package io.gedpaths.graph.io;

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

import io.gedpaths.graph.GraphDataset;

import java.io.IOException;
import java.nio.file.Path;

/// Loads a named graph dataset from a processed-data directory.
///
/// Implementations must return a fully materialized dataset; it is treated as
/// immutable for the rest of the run.
public interface DatasetLoader {

    /// Loads the dataset `name` from `path`.
    ///
    /// @param name the dataset name, e.g. `MUTAG`
    /// @param path the processed-data directory
    /// @return the loaded dataset
    /// @throws IOException if the dataset cannot be found or read
    GraphDataset loadDataset(String name, Path path) throws IOException;
}
