package io.nosqlbench.forecast.design;

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

/// The shape of an event's effect around one occurrence.
///
/// Implementations are serialized by type name, so each one carries a
/// [io.nosqlbench.forecast.serialize.TypeName] annotation.
public interface EventProfile {

    /// Returns the effect at an offset from the occurrence.
    ///
    /// @param offsetSeconds seconds since the occurrence; negative before it
    /// @return the effect, between 0 and 1
    double value(double offsetSeconds);

    /// Returns the half-width, in seconds, beyond which the effect is treated as zero.
    /// @return the reach of the profile, positive
    double reach();
}
