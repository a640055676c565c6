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

import java.util.Objects;
import java.util.Optional;

/// The outcome of a successful fit: the MAP parameters and, when requested, the Laplace
/// draws around them.
public final class FitResult {

    private final FittedParameters map;
    private final PosteriorDraws draws;
    private final double logPosterior;
    private final int iterations;

    public FitResult(FittedParameters map, PosteriorDraws draws, double logPosterior, int iterations) {
        this.map = Objects.requireNonNull(map, "map cannot be null");
        this.draws = draws;
        this.logPosterior = logPosterior;
        this.iterations = iterations;
    }

    public FittedParameters getMap() {
        return map;
    }

    public Optional<PosteriorDraws> getDraws() {
        return Optional.ofNullable(draws);
    }

    public double getLogPosterior() {
        return logPosterior;
    }

    public int getIterations() {
        return iterations;
    }
}
