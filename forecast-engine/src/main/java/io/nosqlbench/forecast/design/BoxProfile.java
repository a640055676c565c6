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

/// A unit step over `[occurrence, occurrence + width)`.
@TypeName("box")
public final class BoxProfile implements EventProfile {

    private final Duration width;

    public BoxProfile(Duration width) {
        this.width = requirePositive(width);
    }

    public Duration getWidth() {
        return width;
    }

    @Override
    public double value(double offsetSeconds) {
        return offsetSeconds >= 0 && offsetSeconds < Durations.toSeconds(width) ? 1.0 : 0.0;
    }

    @Override
    public double reach() {
        return Durations.toSeconds(width);
    }

    static Duration requirePositive(Duration width) {
        Objects.requireNonNull(width, "width cannot be null");
        if (width.isNegative() || width.isZero()) {
            throw new IllegalArgumentException("profile width must be positive, got " + width);
        }
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoxProfile && width.equals(((BoxProfile) o).width);
    }

    @Override
    public int hashCode() {
        return Objects.hash("box", width);
    }

    @Override
    public String toString() {
        return "box(" + width + ")";
    }
}
