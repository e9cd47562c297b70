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

import io.gedpaths.solver.EditCostModel;
import io.gedpaths.solver.SolverConfig;
import picocli.CommandLine;

/**
 * Shared solver method options.
 */
public class SolverOption {

    @CommandLine.Option(
        names = {"--method"},
        description = "Solver method name (default: ${DEFAULT-VALUE})",
        defaultValue = "GREEDY"
    )
    private String method;

    @CommandLine.Option(
        names = {"--cost"},
        description = "Edit cost model: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "CONSTANT"
    )
    private EditCostModel costModel;

    @CommandLine.Option(
        names = {"--method-options"},
        description = "Free-form options passed to the solver method"
    )
    private String methodOptions;

    /**
     * Gets the method name as used in output paths.
     */
    public String getMethod() {
        return toConfig().method();
    }

    public SolverConfig toConfig() {
        return new SolverConfig(method, costModel, methodOptions);
    }
}
