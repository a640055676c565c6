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
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.special.Gamma;

/**
 * Positive continuous observations with a log link.
 *
 * <pre>{@code
 * y ~ Gamma(shape, rate)        shape = 1 / kappa^2, rate = shape / exp(eta)
 * }</pre>
 *
 * <p>{@code kappa} is the coefficient of variation. Unlike the proportion families the
 * shape is not clamped against {@code variance_max}.
 */
@TypeName(GammaFamily.TAG)
public final class GammaFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "gamma";

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
        return true;
    }

    @Override
    public double initialKappa() {
        return 0.5;
    }

    @Override
    public void validateObservations(double[] observed) {
        requireRange(observed, 0.0, Double.POSITIVE_INFINITY, false, "strictly positive");
    }

    @Override
    public double link(double value) {
        return LinkFunction.LOG.apply(value);
    }

    @Override
    public double dispersion(double kappa, double linkedScale) {
        return 1.0 / (kappa * kappa);
    }

    @Override
    public double logLikelihood(double observed, double eta, double shape) {
        double inverseMean = Math.exp(-Math.min(Math.max(eta, -LinkFunction.MAX_EXPONENT), LinkFunction.MAX_EXPONENT));
        return shape * (Math.log(shape) - eta) - Gamma.logGamma(shape)
            + (shape - 1.0) * Math.log(observed) - shape * observed * inverseMean;
    }

    @Override
    public double logLikelihoodDerivative(double observed, double eta, double shape) {
        double inverseMean = Math.exp(-Math.min(Math.max(eta, -LinkFunction.MAX_EXPONENT), LinkFunction.MAX_EXPONENT));
        return shape * (observed * inverseMean - 1.0);
    }

    @Override
    public double mean(double eta, double shape) {
        return LinkFunction.LOG.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double shape) {
        return new GammaDistribution(shape, mean(eta, shape) / shape).inverseCumulativeProbability(probability);
    }
}
