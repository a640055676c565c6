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

import java.util.Objects;

/// Raised when inputs or settings violate a precondition of the engine. Always thrown
/// before an optimization is attempted.
public class ForecastConfigurationException extends ForecastException {

    private final ConfigurationErrorKind kind;

    public ForecastConfigurationException(ConfigurationErrorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public ForecastConfigurationException(ConfigurationErrorKind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    /// Returns the violated precondition.
    /// @return the error kind
    public ConfigurationErrorKind getKind() {
        return kind;
    }
}
