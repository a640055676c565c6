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

/// A bell centered on the occurrence: `exp(-offset^2 / (2 width^2))`.
@TypeName("gaussian")
public final class GaussianProfile implements EventProfile {

    private static final double REACH_WIDTHS = 8.0;

    private final Duration width;

    public GaussianProfile(Duration width) {
        this.width = BoxProfile.requirePositive(width);
    }

    public Duration getWidth() {
        return width;
    }

    @Override
    public double value(double offsetSeconds) {
        double z = offsetSeconds / Durations.toSeconds(width);
        return Math.exp(-0.5 * z * z);
    }

    @Override
    public double reach() {
        return REACH_WIDTHS * Durations.toSeconds(width);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GaussianProfile && width.equals(((GaussianProfile) o).width);
    }

    @Override
    public int hashCode() {
        return Objects.hash("gaussian", width);
    }

    @Override
    public String toString() {
        return "gaussian(" + width + ")";
    }
}
