package io.gedpaths.command.common;

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

import picocli.CommandLine;

/**
 * Shared random seed option for pair sampling, mapping sampling and randomized edit ordering.
 */
public class RandomSeedOption {

    public static final long DEFAULT_SEED = 42L;

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed (default: ${DEFAULT-VALUE})",
        defaultValue = "42"
    )
    private long seed = DEFAULT_SEED;

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.valueOf(seed);
    }
}
