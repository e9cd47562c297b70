package io.gedpaths.editpath;

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

/// File layout of the edit paths of one method on one dataset.
///
/// ```text
/// <paths>/<method>/<db>/<db>_edit_paths.bin
/// <paths>/<method>/<db>/<db>_edit_paths_info.csv
/// <paths>/<method>/<db>/Evaluation/
/// ```
public record EditPathLayout(Path pathsRoot, String method, String datasetName) {

    public Path datasetDir() {
        return pathsRoot.resolve(method).resolve(datasetName);
    }

    public Path snapshotFile() {
        return datasetDir().resolve(datasetName + "_edit_paths.bin");
    }

    public Path infoFile() {
        return datasetDir().resolve(datasetName + "_edit_paths_info.csv");
    }

    public Path evaluationDir() {
        return datasetDir().resolve("Evaluation");
    }
}
