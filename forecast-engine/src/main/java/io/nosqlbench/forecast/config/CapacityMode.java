package io.nosqlbench.forecast.config;

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

import java.util.Locale;

/// How the number of trials is determined for the bounded count families
/// (binomial and beta-binomial).
public enum CapacityMode {
    /// `capacity_value` is the number of trials.
    CONSTANT,
    /// The number of trials is `ceil(max(y) * capacity_value)`.
    FACTOR;

    /// Resolves the number of trials for the observed values.
    ///
    /// @param value the configured `capacity_value`
    /// @param observed the observed counts
    /// @return the number of trials, at least 1
    public int resolve(double value, double[] observed) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_CAPACITY,
                "capacity_value must be a positive number for capacity_mode " + tag() + ", got " + value);
        }
        switch (this) {
            case CONSTANT:
                return (int) Math.round(value);
            case FACTOR:
                double max = 0.0;
                for (double y : observed) {
                    max = Math.max(max, y);
                }
                return Math.max(1, (int) Math.ceil(max * value));
            default:
                throw new IllegalStateException("Unhandled capacity mode " + this);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a capacity mode tag.
    ///
    /// @param tag `constant` or `factor`
    /// @return the mode
    public static CapacityMode fromTag(String tag) {
        for (CapacityMode mode : values()) {
            if (mode.tag().equalsIgnoreCase(tag.trim())) {
                return mode;
            }
        }
        throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
            "unknown capacity_mode '" + tag + "', expected constant or factor");
    }
}
