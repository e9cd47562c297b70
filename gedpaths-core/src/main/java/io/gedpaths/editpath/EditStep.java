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

/// An operation located in a path: `step` turns snapshot `step` into snapshot `step + 1`.
///
/// @param sourceId source graph id of the path
/// @param step zero-based operation index within the path
/// @param targetId target graph id of the path
/// @param operation the edit applied
public record EditStep(int sourceId, int step, int targetId, EditOperation operation) {
    public EditStep {
        if (step < 0) {
            throw new IllegalArgumentException("step must not be negative: " + step);
        }
    }
}
