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

import io.nosqlbench.forecast.config.Durations;
import io.nosqlbench.forecast.serialize.TypeName;

import java.time.Duration;
import java.util.Objects;

/// A heavy-tailed peak whose full width at half maximum is `width`:
/// `1 / (1 + 4 (offset / width)^2)`.
@TypeName("cauchy")
public final class CauchyProfile implements EventProfile {

    // value at the reach is about 6e-6
    private static final double REACH_WIDTHS = 200.0;

    private final Duration width;

    public CauchyProfile(Duration width) {
        this.width = BoxProfile.requirePositive(width);
    }

    public Duration getWidth() {
        return width;
    }

    @Override
    public double value(double offsetSeconds) {
        double z = offsetSeconds / Durations.toSeconds(width);
        return 1.0 / (1.0 + 4.0 * z * z);
    }

    @Override
    public double reach() {
        return REACH_WIDTHS * Durations.toSeconds(width);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CauchyProfile && width.equals(((CauchyProfile) o).width);
    }

    @Override
    public int hashCode() {
        return Objects.hash("cauchy", width);
    }

    @Override
    public String toString() {
        return "cauchy(" + width + ")";
    }
}
