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
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Gaussian observation noise with an identity link.
 *
 * <pre>{@code
 * y ~ Normal(eta, sigma)        sigma = kappa * linked_scale
 * }</pre>
 *
 * <p>{@code kappa} is the noise standard deviation in normalized units, so its prior
 * behaves the same whatever the units of the metric.
 */
@TypeName(NormalFamily.TAG)
public final class NormalFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "normal";

    private static final double HALF_LOG_TWO_PI = 0.5 * Math.log(2 * Math.PI);

    @Override
    public String getTag() {
        return TAG;
    }

    @Override
    public LinkFunction getLink() {
        return LinkFunction.IDENTITY;
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
        requireRange(observed, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true, "finite");
    }

    @Override
    public double link(double value) {
        return value;
    }

    @Override
    public double dispersion(double kappa, double linkedScale) {
        return kappa * linkedScale;
    }

    @Override
    public double logLikelihood(double observed, double eta, double sigma) {
        double z = (observed - eta) / sigma;
        return -HALF_LOG_TWO_PI - Math.log(sigma) - 0.5 * z * z;
    }

    @Override
    public double logLikelihoodDerivative(double observed, double eta, double sigma) {
        return (observed - eta) / (sigma * sigma);
    }

    @Override
    public double mean(double eta, double sigma) {
        return eta;
    }

    @Override
    public double quantile(double probability, double eta, double sigma) {
        return new NormalDistribution(eta, sigma).inverseCumulativeProbability(probability);
    }
}
