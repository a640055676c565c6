package io.nosqlbench.forecast.family;

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

/**
 * Beta shape parameters for the proportion families from a mean and the dispersion
 * proxy {@code kappa}, where {@code kappa^2} is the variance of the proportion.
 *
 * <p>A beta variance must stay below {@code p(1-p)}; {@code kappa} is clamped per
 * observation to {@code sqrt((1 - 1e-6) * min(varianceMax, p(1-p)))} so the implied
 * precision stays positive.
 */
final class ProportionDispersion {

    private static final double VARIANCE_MARGIN = 1.0 - 1e-6;

    private ProportionDispersion() {
    }

    /**
     * Returns the largest admissible {@code kappa} for a mean proportion.
     *
     * @param p the mean proportion, already clipped
     * @param varianceMax the configured variance ceiling
     * @return the upper bound of kappa at this proportion
     */
    static double maxKappa(double p, double varianceMax) {
        return Math.sqrt(VARIANCE_MARGIN * Math.min(varianceMax, p * (1.0 - p)));
    }

    /**
     * Returns {@code {alpha, beta}} of the beta distribution with mean {@code p} and
     * variance {@code min(kappa, maxKappa)^2}.
     *
     * @param p the mean proportion
     * @param kappa the dispersion proxy
     * @param varianceMax the configured variance ceiling
     * @return the two shape parameters
     */
    static double[] shapes(double p, double kappa, double varianceMax) {
        double clipped = LinkFunction.clipUnit(p);
        double bounded = Math.min(kappa, maxKappa(clipped, varianceMax));
        double variance = bounded * bounded;
        double precision = clipped * (1.0 - clipped) / variance - 1.0;
        return new double[]{clipped * precision, (1.0 - clipped) * precision};
    }
}
