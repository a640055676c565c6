package io.nosqlbench.forecast.trend;

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

import java.util.Arrays;
import java.util.Objects;

/// Normalized-space trend parameters: base rate `k`, offset `m` and one rate
/// adjustment `delta` per changepoint.
public final class TrendParameters {

    private final double k;
    private final double m;
    private final double[] delta;

    public TrendParameters(double k, double m, double[] delta) {
        this.k = k;
        this.m = m;
        this.delta = Objects.requireNonNull(delta, "delta cannot be null").clone();
    }

    public double getK() {
        return k;
    }

    public double getM() {
        return m;
    }

    public double[] getDelta() {
        return delta.clone();
    }

    public int changepointCount() {
        return delta.length;
    }

    public double delta(int j) {
        return delta[j];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrendParameters)) {
            return false;
        }
        TrendParameters that = (TrendParameters) o;
        return Double.compare(k, that.k) == 0 && Double.compare(m, that.m) == 0 && Arrays.equals(delta, that.delta);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(k, m) + Arrays.hashCode(delta);
    }

    @Override
    public String toString() {
        return "TrendParameters{k=" + k + ", m=" + m + ", delta=" + Arrays.toString(delta) + '}';
    }
}
