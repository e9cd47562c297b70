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

import java.util.Locale;
import java.util.Objects;

/// Immutable solver configuration shared by every environment of a run.
///
/// @param method the solver method name, resolved through [SolverProviders]
/// @param costModel the edit cost model
/// @param methodOptions free-form options passed through to the method, may be empty
public record SolverConfig(String method, EditCostModel costModel, String methodOptions) {

    public SolverConfig {
        Objects.requireNonNull(method, "method cannot be null");
        Objects.requireNonNull(costModel, "costModel cannot be null");
        method = method.trim().toUpperCase(Locale.ROOT);
        methodOptions = methodOptions == null ? "" : methodOptions.trim();
    }

    public SolverConfig(String method) {
        this(method, EditCostModel.CONSTANT, "");
    }
}
