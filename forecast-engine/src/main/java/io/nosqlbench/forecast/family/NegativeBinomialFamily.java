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
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;

/**
 * Over-dispersed counts with a log link, in the mean/size parameterization.
 *
 * <pre>{@code
 * y ~ NegBinomial(mu, phi)      mu = exp(eta), phi = 1 / kappa^2
 * Var(y) = mu + kappa^2 * mu^2
 * }</pre>
 *
 * <p>As {@code kappa} shrinks the family approaches {@link PoissonFamily}.
 */
@TypeName(NegativeBinomialFamily.TAG)
public final class NegativeBinomialFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "negative_binomial";

    private static final int MAX_COUNT = Integer.MAX_VALUE / 2;

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
        return 1.0 / (kappa * kappa);
    }

    @Override
    public double logLikelihood(double observed, double eta, double phi) {
        double mu = LinkFunction.LOG.inverse(eta);
        double logDenominator = Math.log(phi + mu);
        return Gamma.logGamma(observed + phi) - Gamma.logGamma(phi) - Gamma.logGamma(observed + 1.0)
            + phi * (Math.log(phi) - logDenominator)
            + observed * (Math.log(mu) - logDenominator);
    }

    @Override
    public double logLikelihoodDerivative(double observed, double eta, double phi) {
        double mu = LinkFunction.LOG.inverse(eta);
        return observed - (observed + phi) * mu / (phi + mu);
    }

    @Override
    public double mean(double eta, double phi) {
        return LinkFunction.LOG.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double phi) {
        double mu = mean(eta, phi);
        double success = phi / (phi + mu);
        return DiscreteQuantiles.search(k -> Beta.regularizedBeta(success, phi, k + 1.0), probability, mu, MAX_COUNT);
    }
}
