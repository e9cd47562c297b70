package io.gedpaths.stats;

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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValueStatisticsTest {

    @Test
    void usesPopulationStandardDeviation() {
        ValueStatistics stats = ValueStatistics.compute("x", new double[]{2, 4, 4, 4, 5, 5, 7, 9});

        assertThat(stats.count()).isEqualTo(8);
        assertThat(stats.mean()).isEqualTo(5.0);
        assertThat(stats.stdDev()).isCloseTo(2.0, within(1e-12));
        assertThat(stats.min()).isEqualTo(2.0);
        assertThat(stats.max()).isEqualTo(9.0);
    }

    @Test
    void acceptsBoxedNumbers() {
        ValueStatistics stats = ValueStatistics.compute("n", List.of(1, 2L, 3.0));

        assertThat(stats.name()).isEqualTo("n");
        assertThat(stats.values()).containsExactly(1, 2, 3);
        assertThat(stats.mean()).isEqualTo(2.0);
    }

    @Test
    void singleValueHasZeroSpread() {
        ValueStatistics stats = ValueStatistics.compute("one", new double[]{3.5});

        assertThat(stats.stdDev()).isZero();
        assertThat(stats.min()).isEqualTo(stats.max());
    }

    @Test
    void emptyInputHasNaNMoments() {
        ValueStatistics stats = ValueStatistics.compute("empty", new double[0]);

        assertThat(stats.count()).isZero();
        assertThat(stats.mean()).isNaN();
        assertThat(stats.stdDev()).isNaN();
        assertThat(stats.min()).isNaN();
        assertThat(stats.max()).isNaN();
    }

    @Test
    void copiesInput() {
        double[] values = {1, 2};
        ValueStatistics stats = ValueStatistics.compute("c", values);
        values[0] = 100;

        assertThat(stats.values()).containsExactly(1, 2);
    }
}
