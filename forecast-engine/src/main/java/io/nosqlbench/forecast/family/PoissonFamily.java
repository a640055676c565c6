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
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.special.Gamma;

/**
 * Poisson counts with a log link. No dispersion is fitted: the variance equals the mean.
 *
 * <pre>{@code
 * y ~ Poisson(lambda)           lambda = exp(eta)
 * }</pre>
 */
@TypeName(PoissonFamily.TAG)
public final class PoissonFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "poisson";

    /** Smallest rate handed to the quantile function. */
    private static final double MIN_RATE = 1e-12;

    @Override
    public String getTag() {
        return TAG;
    }

    @Override
    public LinkFunction getLink() {
        return LinkFunction.LOG;
    }

    @Override
    public boolean hasDispersion() {
        return false;
    }

    @Override
    public double initialKappa() {
        return 1.0;
    }

    @Override
    public void validateObservations(double[] observed) {
        requireCounts(observed, Long.MAX_VALUE);
    }

    @Override
    public double scalingTransform(double observed) {
        return Math.log(observed + 0.5);
    }

    @Override
    public double link(double value) {
        return LinkFunction.LOG.apply(value);
    }

    @Override
    public double dispersion(double kappa, double linkedScale) {
        return Double.NaN;
    }

    @Override
    public double logLikelihood(double observed, double eta, double dispersion) {
        return observed * eta - LinkFunction.LOG.inverse(eta) - Gamma.logGamma(observed + 1.0);
    }

    @Override
    public double logLikelihoodDerivative(double observed, double eta, double dispersion) {
        return observed - LinkFunction.LOG.inverse(eta);
    }

    @Override
    public double mean(double eta, double dispersion) {
        return LinkFunction.LOG.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double dispersion) {
        double rate = Math.max(mean(eta, dispersion), MIN_RATE);
        return new PoissonDistribution(rate).inverseCumulativeProbability(probability);
    }
}
