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

import io.gedpaths.util.RandomGenerators;

/// Selectable edit ordering strategies.
public enum PathStrategy {
    CANONICAL,
    RANDOM;

    /// Creates a strategy instance.
    ///
    /// @param seed seed for [#RANDOM], ignored by [#CANONICAL]
    /// @param connectedOnly wrap the strategy in a [ConnectivityPreservingStrategy]
    public EditOrderingStrategy create(long seed, boolean connectedOnly) {
        EditOrderingStrategy strategy = this == RANDOM
            ? new RandomOrderingStrategy(RandomGenerators.create(seed))
            : new CanonicalOrderingStrategy();
        return connectedOnly ? new ConnectivityPreservingStrategy(strategy) : strategy;
    }
}
