package io.gedpaths.util;

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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.ListSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Seeded random number generators for sampling and ordering.
 * Based on Apache Commons RNG; the same seed always reproduces the same sequence.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm.
     *
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Shuffles a list in place.
     *
     * @param <T> The type of elements in the list
     * @param list The list to shuffle
     * @param rng The random number generator
     */
    public static <T> void shuffle(List<T> list, UniformRandomProvider rng) {
        ListSampler.shuffle(rng, list);
    }
}
