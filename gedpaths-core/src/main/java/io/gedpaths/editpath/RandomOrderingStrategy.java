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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;

/// Picks uniformly among the legal edits, reproducibly for a given generator seed.
public class RandomOrderingStrategy implements EditOrderingStrategy {
    private final UniformRandomProvider rng;

    public RandomOrderingStrategy(UniformRandomProvider rng) {
        this.rng = rng;
    }

    @Override
    public Edit pick(List<Edit> legalEdits, WorkingGraph current) {
        return legalEdits.get(rng.nextInt(legalEdits.size()));
    }
}
