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

import io.gedpaths.graph.GraphDataset;

/// Service provider for a named solver method.
///
/// Providers are discovered with [java.util.ServiceLoader] and registered under
/// `META-INF/services/io.gedpaths.solver.SolverProvider`.
public interface SolverProvider {

    /// The method name this provider answers to, upper case.
    String name();

    /// Creates a new environment over `dataset`.
    SolverEnvironment create(GraphDataset dataset, SolverConfig config);
}
