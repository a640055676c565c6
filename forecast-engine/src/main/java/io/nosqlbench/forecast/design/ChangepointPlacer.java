package io.nosqlbench.forecast.design;

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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.series.PredictionFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Chooses the candidate changepoints of the trend, in normalized time.
 *
 * <h2>Automatic placement</h2>
 *
 * <pre>{@code
 * eligible = floor(rows * changepointRange)
 * n        = min(nChangepoints, eligible - 1)
 * index_j  = round(j * (eligible - 1) / n)      j = 1..n
 * }</pre>
 *
 * <p>The changepoints sit on observed timestamps evenly spaced by row index, never on the
 * first row. Asking for more than the eligible rows allow reduces the count.
 *
 * <h2>Explicit placement</h2>
 *
 * <p>Explicit instants are used as given, sorted, and must lie strictly inside the
 * training span.
 */
public final class ChangepointPlacer {

    private static final Logger logger = LogManager.getLogger(ChangepointPlacer.class);

    private ChangepointPlacer() {
    }

    /**
     * Places changepoints evenly over the leading fraction of the training rows.
     *
     * @param t the normalized training times, increasing
     * @param nChangepoints the requested count, non-negative
     * @param changepointRange the eligible fraction of rows, in (0, 1]
     * @return the changepoints in normalized time, increasing
     */
    public static double[] place(double[] t, int nChangepoints, double changepointRange) {
        if (nChangepoints < 0) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.NEGATIVE_CHANGEPOINTS,
                "n_changepoints must be >= 0, got " + nChangepoints);
        }
        if (!(changepointRange > 0.0 && changepointRange <= 1.0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_CHANGEPOINT_RANGE,
                "changepoint_range must be in (0, 1], got " + changepointRange);
        }
        int eligible = (int) Math.floor(t.length * changepointRange);
        int n = nChangepoints;
        if (n + 1 > eligible) {
            n = Math.max(0, eligible - 1);
            logger.warn("n_changepoints reduced from {} to {}: only {} rows fall inside changepoint_range {}",
                nChangepoints, n, eligible, changepointRange);
        }
        double[] changepoints = new double[n];
        for (int j = 1; j <= n; j++) {
            int index = (int) Math.rint((double) j * (eligible - 1) / n);
            changepoints[j - 1] = t[index];
        }
        return changepoints;
    }

    /**
     * Normalizes explicitly given changepoints.
     *
     * @param instants the changepoint instants
     * @param scaling the scaling context of the training series
     * @return the changepoints in normalized time, increasing
     * @throws ForecastConfigurationException {@code INVALID_CHANGEPOINTS} for an instant outside
     *     the open training span, or a duplicate
     */
    public static double[] explicit(List<Instant> instants, ScalingContext scaling) {
        List<Instant> sorted = new ArrayList<>(instants);
        sorted.sort(null);
        double[] changepoints = new double[sorted.size()];
        for (int j = 0; j < changepoints.length; j++) {
            double t = scaling.normalizeTime(PredictionFrame.toEpochSeconds(sorted.get(j)));
            if (!(t > 0.0 && t < 1.0)) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_CHANGEPOINTS,
                    "changepoint " + sorted.get(j) + " is not strictly inside the training span");
            }
            if (j > 0 && t <= changepoints[j - 1]) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_CHANGEPOINTS,
                    "changepoint " + sorted.get(j) + " is given twice");
            }
            changepoints[j] = t;
        }
        return changepoints;
    }
}
