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

import io.nosqlbench.forecast.family.LikelihoodFamily;

import java.util.stream.IntStream;

/// Observation-level bounds: the family's quantile function evaluated at the fitted
/// linear predictor of each row. Needs only a point estimate, so it is available with
/// or without posterior draws.
public final class DataVariability {

    private final LikelihoodFamily family;
    private final boolean parallel;

    public DataVariability(LikelihoodFamily family, boolean parallel) {
        this.family = family;
        this.parallel = parallel;
    }

    /// @param eta the linear predictor per row
    /// @param dispersion the family's dispersion
    /// @param levels the quantile levels of the interval
    /// @return `{lower, upper}` on the observation scale
    public double[][] bounds(double[] eta, double dispersion, QuantileLevels levels) {
        double[] lower = new double[eta.length];
        double[] upper = new double[eta.length];
        IntStream rows = IntStream.range(0, eta.length);
        (parallel ? rows.parallel() : rows).forEach(i -> {
            lower[i] = family.quantile(levels.getLower(), eta[i], dispersion);
            upper[i] = family.quantile(levels.getUpper(), eta[i], dispersion);
        });
        return new double[][]{lower, upper};
    }
}
