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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;

/**
 * Shared domain checks for the likelihood families.
 */
abstract class AbstractLikelihoodFamily implements LikelihoodFamily {

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getTag() + "]";
    }

    ForecastConfigurationException domainError(int row, double value, String expected) {
        return new ForecastConfigurationException(ConfigurationErrorKind.DOMAIN_MISMATCH,
            getTag() + " observations must be " + expected + ", got " + value + " at row " + row);
    }

    void requireCounts(double[] observed, long upperBound) {
        for (int i = 0; i < observed.length; i++) {
            double y = observed[i];
            if (y < 0 || y != Math.rint(y)) {
                throw domainError(i, y, "non-negative integers");
            }
            if (y > upperBound) {
                throw domainError(i, y, "at most the capacity " + upperBound);
            }
        }
    }

    void requireRange(double[] observed, double lower, double upper, boolean lowerInclusive, String expected) {
        for (int i = 0; i < observed.length; i++) {
            double y = observed[i];
            boolean aboveLower = lowerInclusive ? y >= lower : y > lower;
            if (!Double.isFinite(y) || !aboveLower || y > upper) {
                throw domainError(i, y, expected);
            }
        }
    }
}
