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

/// Point-estimation modes the fitting orchestrator supports. Only the
/// maximum-a-posteriori estimate is available.
public enum OptimizeMode {
    MAP;

    public static OptimizeMode fromTag(String tag) {
        for (OptimizeMode mode : values()) {
            if (mode.name().equalsIgnoreCase(tag.trim())) {
                return mode;
            }
        }
        throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
            "unsupported optimize_mode '" + tag + "', only MAP is available");
    }
}
