package io.gedpaths.solver.greedy;

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

import com.google.auto.service.AutoService;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.solver.SolverConfig;
import io.gedpaths.solver.SolverEnvironment;
import io.gedpaths.solver.SolverProvider;

/// Registers [GreedySolverEnvironment] under the method name `GREEDY`.
@AutoService(SolverProvider.class)
public class GreedySolverProvider implements SolverProvider {

    public static final String NAME = "GREEDY";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SolverEnvironment create(GraphDataset dataset, SolverConfig config) {
        return new GreedySolverEnvironment(dataset, config);
    }
}
