package io.nosqlbench.forecast.uncertainty;

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

/// The two cumulative probabilities of a central interval: `(1 - w) / 2` and
/// `(1 + w) / 2` for an interval width `w`.
public final class QuantileLevels {

    private final double width;
    private final double lower;
    private final double upper;

    private QuantileLevels(double width) {
        this.width = width;
        this.lower = (1.0 - width) / 2.0;
        this.upper = (1.0 + width) / 2.0;
    }

    /// @param intervalWidth the probability mass of the interval, in (0, 1)
    /// @return the quantile levels
    public static QuantileLevels of(double intervalWidth) {
        if (!(intervalWidth > 0.0 && intervalWidth < 1.0)) {
            throw new IllegalArgumentException("interval width must be in (0, 1), got " + intervalWidth);
        }
        return new QuantileLevels(intervalWidth);
    }

    public double getWidth() {
        return width;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return "QuantileLevels{" + lower + ", " + upper + '}';
    }
}
