package io.nosqlbench.forecast.trend;

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

import io.nosqlbench.forecast.design.ChangepointMatrix;

/**
 * Piecewise-linear trend in normalized time.
 *
 * <pre>{@code
 * trend(t) = (k + A(t) . delta) * t + (m + A(t) . gamma)      gamma_j = -tc_j * delta_j
 * }</pre>
 *
 * <p>The offset correction {@code gamma} keeps the trend continuous at every changepoint
 * while the slope jumps by {@code delta_j}.
 */
public final class PiecewiseLinearTrend {

    private PiecewiseLinearTrend() {
    }

    /**
     * Evaluates the trend at every row of a changepoint matrix.
     *
     * @param params the trend parameters; one delta per matrix column
     * @param basis the changepoint indicator matrix
     * @return the trend per row, normalized units
     */
    public static double[] evaluate(TrendParameters params, ChangepointMatrix basis) {
        if (params.changepointCount() != basis.columns()) {
            throw new IllegalArgumentException("expected " + basis.columns() + " rate adjustments, got "
                + params.changepointCount());
        }
        double[] trend = new double[basis.rows()];
        for (int i = 0; i < trend.length; i++) {
            double rate = params.getK();
            double offset = params.getM();
            for (int j = 0; j < basis.columns(); j++) {
                double a = basis.get(i, j);
                if (a == 0.0) {
                    break;
                }
                rate += params.delta(j);
                offset -= basis.changepoint(j) * params.delta(j);
            }
            trend[i] = rate * basis.time(i) + offset;
        }
        return trend;
    }

    /**
     * Evaluates the trend at one normalized time with arbitrary changepoints.
     *
     * @param k the base rate
     * @param m the offset
     * @param changepoints the changepoints, increasing
     * @param delta the rate adjustments
     * @param count the number of leading changepoints to use
     * @param t the normalized time
     * @return the trend value
     */
    public static double value(double k, double m, double[] changepoints, double[] delta, int count, double t) {
        double rate = k;
        double offset = m;
        for (int j = 0; j < count && t >= changepoints[j]; j++) {
            rate += delta[j];
            offset -= changepoints[j] * delta[j];
        }
        return rate * t + offset;
    }
}
