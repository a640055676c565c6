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

import io.nosqlbench.forecast.trend.PiecewiseLinearTrend;
import io.nosqlbench.forecast.trend.TrendParameters;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Monte-Carlo simulation of future trend paths.
 *
 * <h2>Model</h2>
 *
 * <p>Beyond the training span ({@code t > 1}) new changepoints arrive as a Poisson
 * process with the density of the fitted ones, and each carries a Laplace distributed
 * rate change with the fitted mean absolute magnitude:
 *
 * <pre>{@code
 * T        = max(t)
 * S        = number of fitted changepoints                (per unit of normalized time)
 * n_new    ~ Poisson(S * (T - 1))
 * c_new    ~ Uniform(1, T]                                  sorted
 * lambda   = mean(|delta|) + 1e-8
 * d_new    ~ Laplace(0, lambda)
 * }</pre>
 *
 * <p>Path {@code i} starts from base parameters {@code i mod bases.size()}, so with a
 * set of Laplace draws every draw seeds its share of the paths.
 *
 * <p>Each path runs with its own generator, seeded from the master generator before any
 * path starts, so parallel and sequential runs give the same paths.
 */
public final class TrendUncertaintySimulator {

    private static final Logger logger = LogManager.getLogger(TrendUncertaintySimulator.class);

    static final double LAPLACE_FLOOR = 1e-8;

    private final boolean parallel;

    public TrendUncertaintySimulator(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * Simulates trend paths at normalized times.
     *
     * @param bases the starting trend parameters, cycled over the paths
     * @param changepoints the fitted changepoints in normalized time
     * @param t the normalized times to evaluate, any order
     * @param samples the number of paths
     * @param master the master generator
     * @return {@code paths[sample][row]} in normalized units
     */
    public double[][] simulate(List<TrendParameters> bases, double[] changepoints, double[] t, int samples,
                               UniformRandomProvider master) {
        if (bases.isEmpty()) {
            throw new IllegalArgumentException("at least one base trend is needed");
        }
        double horizon = Arrays.stream(t).max().orElse(0.0);
        long[] seeds = RandomGenerators.childSeeds(master, samples);
        double[][] paths = new double[samples][];
        IntStream indexes = IntStream.range(0, samples);
        (parallel ? indexes.parallel() : indexes).forEach(i -> paths[i] =
            path(bases.get(i % bases.size()), changepoints, t, horizon, RandomGenerators.create(seeds[i])));
        logger.debug("simulated {} trend paths to normalized horizon {}", samples, horizon);
        return paths;
    }

    static double[] path(TrendParameters base, double[] changepoints, double[] t, double horizon,
                         UniformRandomProvider rng) {
        double[] allChangepoints = changepoints;
        double[] allDelta = base.getDelta();
        int count = changepoints.length;
        if (horizon > 1.0 && count > 0) {
            double density = count;
            int added = PoissonSampler.of(rng, density * (horizon - 1.0)).sample();
            if (added > 0) {
                double lambda = meanAbsolute(allDelta) + LAPLACE_FLOOR;
                ContinuousSampler position = ContinuousUniformSampler.of(rng, 1.0, horizon);
                ContinuousSampler magnitude = ZigguratSampler.Exponential.of(rng, lambda);
                double[] newPoints = new double[added];
                for (int j = 0; j < added; j++) {
                    newPoints[j] = position.sample();
                }
                Arrays.sort(newPoints);
                allChangepoints = Arrays.copyOf(changepoints, count + added);
                allDelta = Arrays.copyOf(allDelta, count + added);
                for (int j = 0; j < added; j++) {
                    allChangepoints[count + j] = newPoints[j];
                    double d = magnitude.sample();
                    allDelta[count + j] = rng.nextBoolean() ? d : -d;
                }
                count += added;
            }
        }
        double[] trend = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            trend[i] = PiecewiseLinearTrend.value(base.getK(), base.getM(), allChangepoints, allDelta, count, t[i]);
        }
        return trend;
    }

    private static double meanAbsolute(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += Math.abs(v);
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}
