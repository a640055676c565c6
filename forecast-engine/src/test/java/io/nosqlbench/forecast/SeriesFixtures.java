package io.nosqlbench.forecast;

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

import io.nosqlbench.forecast.series.TimeSeries;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Synthetic series shared by the tests.
 */
public final class SeriesFixtures {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private SeriesFixtures() {
    }

    public static List<Instant> daily(int count) {
        return daily(START, count);
    }

    public static List<Instant> daily(Instant start, int count) {
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(start.plus(Duration.ofDays(i)));
        }
        return timestamps;
    }

    public static TimeSeries dailySeries(int count, IntToDoubleFunction value) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = value.applyAsDouble(i);
        }
        return TimeSeries.of(daily(count), values);
    }

    /// Daily Poisson counts with a constant rate.
    public static TimeSeries poissonCounts(int count, double rate, long seed) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        DiscreteSampler sampler = PoissonSampler.of(rng, rate);
        return dailySeries(count, i -> sampler.sample());
    }

    /// A linear ramp with weekly waves and deterministic jitter.
    public static TimeSeries weeklyRamp(int count) {
        return dailySeries(count, i -> 10.0 + 0.05 * i
            + 2.0 * Math.sin(2 * Math.PI * i / 7.0)
            + 0.3 * Math.sin(1.7 * i));
    }
}
