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
 * Maps a distribution's mean parameter to the unbounded linear predictor, and back.
 *
 * <p>{@link #apply} clips its argument away from the boundaries of the link's domain by
 * {@link #EPSILON} so that boundary observations (a zero count, a proportion of exactly
 * 0 or 1) map to finite values.
 */
public enum LinkFunction {

    IDENTITY {
        @Override
        public double apply(double mean) {
            return mean;
        }

        @Override
        public double inverse(double eta) {
            return eta;
        }
    },

    LOG {
        @Override
        public double apply(double mean) {
            return Math.log(Math.max(mean, EPSILON));
        }

        @Override
        public double inverse(double eta) {
            return Math.exp(Math.min(eta, MAX_EXPONENT));
        }
    },

    LOGIT {
        @Override
        public double apply(double mean) {
            double p = clipUnit(mean);
            return Math.log(p) - Math.log1p(-p);
        }

        @Override
        public double inverse(double eta) {
            if (eta >= 0) {
                return 1.0 / (1.0 + Math.exp(-eta));
            }
            double e = Math.exp(eta);
            return e / (1.0 + e);
        }
    };

    /** Distance kept from the boundaries of bounded domains. */
    public static final double EPSILON = 1e-6;

    /** Largest exponent passed to {@link Math#exp}; keeps rates finite during optimization. */
    static final double MAX_EXPONENT = 700.0;

    /**
     * Maps a mean-scale value to the linear-predictor scale.
     *
     * @param mean the value on the distribution's mean scale
     * @return the linked value
     */
    public abstract double apply(double mean);

    /**
     * Maps a linear predictor back to the mean scale.
     *
     * @param eta the linear predictor
     * @return the mean-scale value
     */
    public abstract double inverse(double eta);

    /**
     * Clips a proportion into {@code [EPSILON, 1 - EPSILON]}.
     *
     * @param p the proportion
     * @return the clipped proportion
     */
    public static double clipUnit(double p) {
        return Math.min(Math.max(p, EPSILON), 1.0 - EPSILON);
    }

    /** Numerically stable {@code log(1 + exp(x))}. */
    static double softplus(double x) {
        if (x > 0) {
            return x + Math.log1p(Math.exp(-x));
        }
        return Math.log1p(Math.exp(x));
    }
}
