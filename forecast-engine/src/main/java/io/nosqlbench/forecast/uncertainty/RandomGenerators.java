package io.nosqlbench.forecast.uncertainty;

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
import org.apache.commons.rng.simple.RandomSource;

/// Random sources for the stochastic parts of the engine. Every simulation takes an
/// explicit provider; there is no shared global generator.
///
/// All generators are XorShiRo256++ (256-bit state, fast, good in high dimensions).
public final class RandomGenerators {

    static final RandomSource DEFAULT_SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomGenerators() {
    }

    /// Creates a seeded generator.
    public static RestorableUniformRandomProvider create(long seed) {
        return DEFAULT_SOURCE.create(seed);
    }

    /// Creates a generator from an optional seed; `null` gives a randomly seeded one.
    public static RestorableUniformRandomProvider create(Long seed) {
        return seed != null ? create(seed.longValue()) : DEFAULT_SOURCE.create();
    }

    /// Draws independent child seeds from a master generator, one per parallel task, so
    /// results do not depend on the order tasks run in.
    ///
    /// @param master the master generator
    /// @param count the number of seeds
    /// @return the seeds
    public static long[] childSeeds(UniformRandomProvider master, int count) {
        long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = master.nextLong();
        }
        return seeds;
    }
}
