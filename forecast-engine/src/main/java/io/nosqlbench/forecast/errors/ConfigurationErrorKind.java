package io.nosqlbench.forecast.errors;

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

/// Identifies which precondition a [ForecastConfigurationException] reports.
public enum ConfigurationErrorKind {
    /// The `model` tag does not name a registered likelihood family.
    INVALID_FAMILY,
    /// `n_changepoints` is negative.
    NEGATIVE_CHANGEPOINTS,
    /// `changepoint_range` is outside (0, 1].
    INVALID_CHANGEPOINT_RANGE,
    /// Explicit changepoints are unsorted or outside the training span.
    INVALID_CHANGEPOINTS,
    /// Observed values do not belong to the family's domain.
    DOMAIN_MISMATCH,
    /// Zero time span, too few rows, or a constant linked response.
    DEGENERATE_SERIES,
    /// An external regressor is constant over the training rows.
    CONSTANT_REGRESSOR,
    /// A frame lacks a regressor column the model was fitted with.
    MISSING_REGRESSOR,
    /// Timestamps are not strictly increasing.
    NON_MONOTONIC_TIMESTAMPS,
    /// A bounded count family was configured without a capacity.
    MISSING_CAPACITY,
    /// A configuration value is out of range or of the wrong type.
    INVALID_PARAMETER,
    /// A configuration layer names a key the engine does not know.
    UNKNOWN_PARAMETER
}
