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
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * Successes out of a fixed number of trials, with a logit link on the success
 * probability.
 *
 * <pre>{@code
 * y ~ Binomial(capacity, p)     p = logit^-1(eta)
 * }</pre>
 *
 * <p>The mean and quantiles are reported as counts in {@code [0, capacity]}; the linked
 * scale is the logit of the proportion {@code y / capacity}.
 */
@TypeName(BinomialFamily.TAG)
public final class BinomialFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "binomial";

    private final int capacity;

    /**
     * @param capacity the number of trials per observation; must be positive
     */
    public BinomialFamily(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
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
        return false;
    }

    @Override
    public double initialKappa() {
        return 1.0;
    }

    @Override
    public void validateObservations(double[] observed) {
        requireCounts(observed, capacity);
    }

    @Override
    public double scalingTransform(double observed) {
        return LinkFunction.LOGIT.apply((observed + 0.5) / (capacity + 1.0));
    }

    @Override
    public double link(double value) {
        return LinkFunction.LOGIT.apply(value / capacity);
    }

    @Override
    public double dispersion(double kappa, double linkedScale) {
        return Double.NaN;
    }

    @Override
    public double logLikelihood(double observed, double eta, double dispersion) {
        int k = (int) observed;
        return CombinatoricsUtils.binomialCoefficientLog(capacity, k)
            + observed * eta - capacity * LinkFunction.softplus(eta);
    }

    @Override
    public double logLikelihoodDerivative(double observed, double eta, double dispersion) {
        return observed - capacity * LinkFunction.LOGIT.inverse(eta);
    }

    @Override
    public double mean(double eta, double dispersion) {
        return capacity * LinkFunction.LOGIT.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double dispersion) {
        double p = LinkFunction.clipUnit(LinkFunction.LOGIT.inverse(eta));
        return new BinomialDistribution(capacity, p).inverseCumulativeProbability(probability);
    }
}
