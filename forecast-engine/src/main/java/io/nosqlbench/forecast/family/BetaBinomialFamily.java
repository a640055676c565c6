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
import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * Over-dispersed successes out of a fixed number of trials: a binomial whose success
 * probability is itself beta distributed, with the same dispersion proxy and clamping
 * as {@link BetaFamily}.
 *
 * <pre>{@code
 * p_i ~ Beta(p * nu, (1 - p) * nu)    p = logit^-1(eta)
 * y   ~ Binomial(capacity, p_i)
 * }</pre>
 */
@TypeName(BetaBinomialFamily.TAG)
public final class BetaBinomialFamily extends AbstractLikelihoodFamily {

    public static final String TAG = "beta_binomial";

    private final int capacity;
    private final double varianceMax;

    /**
     * @param capacity the number of trials per observation; must be positive
     * @param varianceMax the ceiling on the variance of the success probability
     */
    public BetaBinomialFamily(int capacity, double varianceMax) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (!(varianceMax > 0 && varianceMax <= 0.25)) {
            throw new IllegalArgumentException("varianceMax must be in (0, 0.25], got: " + varianceMax);
        }
        this.capacity = capacity;
        this.varianceMax = varianceMax;
    }

    public int getCapacity() {
        return capacity;
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
        return kappa;
    }

    @Override
    public double logLikelihood(double observed, double eta, double kappa) {
        double[] shapes = ProportionDispersion.shapes(LinkFunction.LOGIT.inverse(eta), kappa, varianceMax);
        return logMass((int) observed, shapes[0], shapes[1]);
    }

    private double logMass(int k, double alpha, double beta) {
        return CombinatoricsUtils.binomialCoefficientLog(capacity, k)
            + Beta.logBeta(k + alpha, capacity - k + beta) - Beta.logBeta(alpha, beta);
    }

    @Override
    public double mean(double eta, double kappa) {
        return capacity * LinkFunction.LOGIT.inverse(eta);
    }

    @Override
    public double quantile(double probability, double eta, double kappa) {
        double[] shapes = ProportionDispersion.shapes(LinkFunction.LOGIT.inverse(eta), kappa, varianceMax);
        double cumulative = 0.0;
        for (int k = 0; k < capacity; k++) {
            cumulative += Math.exp(logMass(k, shapes[0], shapes[1]));
            if (cumulative >= probability) {
                return k;
            }
        }
        return capacity;
    }
}
