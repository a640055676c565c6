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

import io.nosqlbench.forecast.trend.TrendParameters;

import java.util.Arrays;
import java.util.Objects;

/**
 * One point of the parameter space in normalized units: the trend, the regression
 * coefficients and the dispersion proxy {@code kappa} (NaN for families without one).
 */
public final class FittedParameters {

    private final TrendParameters trend;
    private final double[] beta;
    private final double kappa;

    public FittedParameters(TrendParameters trend, double[] beta, double kappa) {
        this.trend = Objects.requireNonNull(trend, "trend cannot be null");
        this.beta = Objects.requireNonNull(beta, "beta cannot be null").clone();
        this.kappa = kappa;
    }

    /**
     * Unpacks a flat parameter vector.
     *
     * @param layout the positions of the parameters
     * @param x the parameter vector
     * @return the structured parameters
     */
    public static FittedParameters of(ParameterLayout layout, double[] x) {
        if (x.length != layout.size()) {
            throw new IllegalArgumentException("expected " + layout.size() + " parameters, got " + x.length);
        }
        double[] delta = Arrays.copyOfRange(x, layout.deltaOffset(), layout.betaOffset());
        double[] beta = Arrays.copyOfRange(x, layout.betaOffset(), layout.betaOffset() + layout.regressors());
        double kappa = layout.hasDispersion() ? ParameterLayout.kappa(x[layout.dispersionIndex()]) : Double.NaN;
        return new FittedParameters(new TrendParameters(x[ParameterLayout.K], x[ParameterLayout.M], delta), beta, kappa);
    }

    public TrendParameters getTrend() {
        return trend;
    }

    public double[] getBeta() {
        return beta.clone();
    }

    public double beta(int j) {
        return beta[j];
    }

    public double getKappa() {
        return kappa;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FittedParameters)) {
            return false;
        }
        FittedParameters that = (FittedParameters) o;
        return Double.compare(kappa, that.kappa) == 0 && trend.equals(that.trend) && Arrays.equals(beta, that.beta);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(trend, kappa) + Arrays.hashCode(beta);
    }

    @Override
    public String toString() {
        return "FittedParameters{" + trend + ", beta=" + Arrays.toString(beta) + ", kappa=" + kappa + '}';
    }
}
