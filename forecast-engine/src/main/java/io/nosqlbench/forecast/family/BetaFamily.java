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

import io.nosqlbench.forecast.serialize.TypeName;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.special.Beta;

/**
 * Proportions in [0, 1] with a logit link.
 *
 * <pre>{@code
 * y ~ Beta(p * nu, (1 - p) * nu)     p = logit^-1(eta)
 * Var(y) = min(kappa, kappa_max(p))^2 = p(1-p) / (nu + 1)
 * }</pre>
 *
 * <p>Observations of exactly 0 or 1 are accepted and clipped by
 * {@link LinkFunction#EPSILON} before the density is evaluated.
 */
@TypeName(BetaFamily.TAG)
public final class BetaFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "beta";

    private final double varianceMax;

    /**
     * @param varianceMax the ceiling on the proportion variance, in (0, 0.25]
     */
    public BetaFamily(double varianceMax) {
        if (!(varianceMax > 0 && varianceMax <= 0.25)) {
            throw new IllegalArgumentException("varianceMax must be in (0, 0.25], got: " + varianceMax);
        }
        this.varianceMax = varianceMax;
    }

    public double getVarianceMax() {
        return varianceMax;
    }

    @Override
    public String getTag() {
        return TAG;
    }

    @Override
    public LinkFunction getLink() {
        return LinkFunction.LOGIT;
    }

    @Override
    public boolean hasDispersion() {
        return true;
    }

    @Override
    public double initialKappa() {
        return 0.1;
    }

    @Override
    public void validateObservations(double[] observed) {
        requireRange(observed, 0.0, 1.0, true, "proportions in [0, 1]");
    }

    @Override
    public double link(double value) {
        return LinkFunction.LOGIT.apply(value);
    }

    @Override
    public double dispersion(double kappa, double linkedScale) {
        return kappa;
    }

    @Override
    public double logLikelihood(double observed, double eta, double kappa) {
        double[] shapes = ProportionDispersion.shapes(LinkFunction.LOGIT.inverse(eta), kappa, varianceMax);
        double y = LinkFunction.clipUnit(observed);
        return (shapes[0] - 1.0) * Math.log(y) + (shapes[1] - 1.0) * Math.log1p(-y)
            - Beta.logBeta(shapes[0], shapes[1]);
    }

    @Override
    public double mean(double eta, double kappa) {
        return LinkFunction.LOGIT.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double kappa) {
        double[] shapes = ProportionDispersion.shapes(LinkFunction.LOGIT.inverse(eta), kappa, varianceMax);
        double q = new BetaDistribution(shapes[0], shapes[1]).inverseCumulativeProbability(probability);
        return Math.min(Math.max(q, 0.0), 1.0);
    }
}
