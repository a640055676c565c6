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

import java.util.function.IntToDoubleFunction;

/**
 * Percent-point search for discrete distributions given only their CDF.
 */
final class DiscreteQuantiles {

    private DiscreteQuantiles() {
    }

    /**
     * Finds the smallest {@code k} in {@code [0, max]} with {@code cdf(k) >= probability}
     * by exponential bracketing from {@code hint} followed by bisection.
     *
     * @param cdf the cumulative distribution function over non-negative integers
     * @param probability the target probability
     * @param hint a starting guess, typically the mean
     * @param max the largest admissible value
     * @return the quantile
     */
    static int search(IntToDoubleFunction cdf, double probability, double hint, int max) {
        if (cdf.applyAsDouble(0) >= probability) {
            return 0;
        }
        int hi = (int) Math.min(max, Math.max(1.0, Math.ceil(hint)));
        int lo = 0;
        while (hi < max && cdf.applyAsDouble(hi) < probability) {
            lo = hi;
            hi = (int) Math.min(max, 2L * hi);
        }
        // invariant: cdf(lo) < probability, cdf(hi) >= probability (or hi == max)
        while (hi - lo > 1) {
            int mid = lo + (hi - lo) / 2;
            if (cdf.applyAsDouble(mid) >= probability) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return hi;
    }
}
