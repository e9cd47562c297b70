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
 * Shared parallel execution options.
 * Provides {@code --parallel} and {@code --threads} for commands that compute mappings
 * concurrently.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Use all but one of the available CPU cores"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"-t", "--threads"},
        description = "Number of worker threads (default: 1, or cores - 1 with --parallel)"
    )
    private Integer explicitThreads;

    /**
     * Gets the worker thread count. An explicit {@code --threads} wins over
     * {@code --parallel}.
     *
     * @return the thread count, at least 1
     * @throws IllegalArgumentException if {@code --threads} is below 1
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            if (explicitThreads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1, got: " + explicitThreads);
            }
            return explicitThreads;
        }
        if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }

    /**
     * Checks if the requested thread count exceeds the available cores.
     */
    public boolean exceedsAvailableCores() {
        return explicitThreads != null && explicitThreads > Runtime.getRuntime().availableProcessors();
    }
}
