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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Per-row quantiles over a set of sampled trajectories, with linear interpolation
 * between order statistics (estimation type R-7).
 */
public final class EmpiricalQuantiles {

    private EmpiricalQuantiles() {
    }

    /**
     * Computes one quantile per row.
     *
     * @param samples the trajectories, {@code samples[s][row]}
     * @param probability the cumulative probability, in (0, 1)
     * @return the quantile of each row across trajectories
     */
    public static double[] perRow(double[][] samples, double probability) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("no samples to take quantiles over");
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        int rows = samples[0].length;
        double[] column = new double[samples.length];
        double[] result = new double[rows];
        for (int row = 0; row < rows; row++) {
            for (int s = 0; s < samples.length; s++) {
                column[s] = samples[s][row];
            }
            result[row] = percentile.evaluate(column, probability * 100.0);
        }
        return result;
    }
}
