package io.nosqlbench.forecast.fit;

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

import org.apache.commons.rng.UniformRandomProvider;

/// Draws parameters from an approximation of the posterior around its mode.
public interface PosteriorSampler {

    /// @param objective the log-posterior the mode was found for
    /// @param mode the maximum a-posteriori point
    /// @param count the number of draws
    /// @param rng the random source; the only source of randomness
    /// @return the draws
    /// @throws io.nosqlbench.forecast.errors.OptimizationException when the curvature at the mode
    ///     does not define a proper Gaussian
    PosteriorDraws sample(PosteriorObjective objective, PosteriorMode mode, int count, UniformRandomProvider rng);
}
