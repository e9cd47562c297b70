package io.gedpaths.solver;

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
import io.gedpaths.mapping.PairKey;

/// A stateful solver bound to one dataset and one [SolverConfig].
///
/// An environment may be reused for any number of [#solve] calls but only ever from
/// one thread at a time; it is never shared between workers.
public interface SolverEnvironment extends AutoCloseable {

    /// Computes the distance and node correspondence for one pair.
    ///
    /// @param pair the pair to solve, `a` is the source and `b` the target graph
    /// @return the computed result
    MappingResult solve(PairKey pair);

    /// Releases any resources held by this environment.
    @Override
    default void close() {
    }
}
