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

import java.util.List;

/// Chooses the next edit of a path.
///
/// Implementations may keep state across calls (a random generator, for example)
/// and must not modify the graph they are given.
public interface EditOrderingStrategy {

    /// Picks one of `legalEdits`, which is never empty.
    ///
    /// @param legalEdits the remaining edits that can be applied to `current` now
    /// @param current the graph before the chosen edit
    Edit pick(List<Edit> legalEdits, WorkingGraph current);
}
