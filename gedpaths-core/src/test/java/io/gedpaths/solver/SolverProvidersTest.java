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

import io.gedpaths.TestGraphs;
import io.gedpaths.mapping.PairKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolverProvidersTest {

    @Test
    void greedyIsRegistered() {
        assertThat(SolverProviders.names()).contains("GREEDY");
        assertThat(SolverProviders.find(" greedy ")).isPresent();
    }

    @Test
    void factoryCreatesWorkingEnvironments() {
        SolverEnvironmentFactory factory = SolverProviders.factory(TestGraphs.toyDataset(), new SolverConfig("GREEDY"));

        try (SolverEnvironment environment = factory.create()) {
            assertThat(environment.solve(new PairKey(0, 1)).pair()).isEqualTo(new PairKey(0, 1));
        }
    }

    @Test
    void unknownMethodIsAConfigurationError() {
        assertThatThrownBy(() -> SolverProviders.factory(TestGraphs.toyDataset(), new SolverConfig("F2")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown solver method: F2")
            .hasMessageContaining("GREEDY");
    }

    @Test
    void configNormalizesMethodName() {
        SolverConfig config = new SolverConfig(" refine ", EditCostModel.CONSTANT, null);

        assertThat(config.method()).isEqualTo("REFINE");
        assertThat(config.methodOptions()).isEmpty();
    }
}
