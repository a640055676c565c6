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

/**
 * Prior scales of the model parameters, all in normalized space.
 *
 * <pre>{@code
 * k, m     ~ Normal(0, 5)
 * delta_j  ~ Laplace(0, tau) * Normal(0, tau)        tau = changepointPriorScale
 * beta_j   ~ Normal(0, s_j)                          s_j = design column prior scale
 * kappa    ~ HalfNormal(dispersionPriorScale)           kappa = floor + exp(u)
 * }</pre>
 *
 * <p>The dispersion density is taken over the coordinate {@code u} the optimizer sees, so it
 * carries the Jacobian {@code exp(u)}. That factor vanishes as {@code kappa} approaches
 * {@link ParameterLayout#DISPERSION_FLOOR}, which keeps the mode at a finite {@code u} even
 * when the data show no dispersion at all.
 *
 * <p>The absolute value in the Laplace term is smoothed as
 * {@code sqrt(delta^2 + w^2) - w} so the log-posterior has a continuous gradient.
 */
public final class PriorSpec {

    public static final double TREND_SCALE = 5.0;
    public static final double SMOOTHING = 1e-3;

    private final double changepointPriorScale;
    private final double dispersionPriorScale;
    private final double[] regressorScales;

    public PriorSpec(double changepointPriorScale, double dispersionPriorScale, double[] regressorScales) {
        this.changepointPriorScale = changepointPriorScale;
        this.dispersionPriorScale = dispersionPriorScale;
        this.regressorScales = Objects.requireNonNull(regressorScales, "regressorScales cannot be null").clone();
    }

    public double getChangepointPriorScale() {
        return changepointPriorScale;
    }

    public double getDispersionPriorScale() {
        return dispersionPriorScale;
    }

    public double regressorScale(int j) {
        return regressorScales[j];
    }

    public int regressorCount() {
        return regressorScales.length;
    }

    /**
     * Adds the log prior density, up to a constant, and its gradient.
     *
     * @param layout the parameter layout
     * @param x the parameter vector
     * @param gradient receives the prior gradient, added in place; may be null
     * @return the log prior
     */
    double logPrior(ParameterLayout layout, double[] x, double[] gradient) {
        double lp = 0.0;
        lp += normal(x, ParameterLayout.K, TREND_SCALE, gradient);
        lp += normal(x, ParameterLayout.M, TREND_SCALE, gradient);

        double tau = changepointPriorScale;
        for (int j = 0; j < layout.changepoints(); j++) {
            int idx = layout.deltaOffset() + j;
            double d = x[idx];
            double root = Math.sqrt(d * d + SMOOTHING * SMOOTHING);
            lp -= (root - SMOOTHING) / tau + 0.5 * (d / tau) * (d / tau);
            if (gradient != null) {
                gradient[idx] -= d / root / tau + d / (tau * tau);
            }
        }
        for (int j = 0; j < layout.regressors(); j++) {
            lp += normal(x, layout.betaOffset() + j, regressorScales[j], gradient);
        }
        if (layout.hasDispersion()) {
            int idx = layout.dispersionIndex();
            double spread = Math.exp(x[idx]);
            double z = ParameterLayout.kappa(x[idx]) / dispersionPriorScale;
            lp += x[idx] - 0.5 * z * z;
            if (gradient != null) {
                gradient[idx] += 1.0 - z * spread / dispersionPriorScale;
            }
        }
        return lp;
    }

    private static double normal(double[] x, int idx, double scale, double[] gradient) {
        double z = x[idx] / scale;
        if (gradient != null) {
            gradient[idx] -= z / scale;
        }
        return -0.5 * z * z;
    }
}
