package io.nosqlbench.forecast.fit;

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

import io.nosqlbench.forecast.config.OptimizeMode;
import io.nosqlbench.forecast.errors.OptimizationException;
import io.nosqlbench.forecast.trend.TrendParameters;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Drives one fit: MAP optimization, then optional Laplace sampling around the mode.
 * Either the whole fit succeeds and a {@link FitResult} is returned, or an
 * {@link OptimizationException} is thrown and nothing is produced.
 */
public final class FittingOrchestrator {

    private static final Logger logger = LogManager.getLogger(FittingOrchestrator.class);

    private final PosteriorOptimizer optimizer;
    private final PosteriorSampler sampler;

    public FittingOrchestrator(PosteriorOptimizer optimizer, PosteriorSampler sampler) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer cannot be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler cannot be null");
    }

    /**
     * Fits the parameters of an objective.
     *
     * @param objective the log-posterior built from design matrix, trend basis, family and priors
     * @param initialTrend the starting trend
     * @param mode the optimization mode
     * @param useLaplace whether to draw from the Laplace approximation
     * @param laplaceSamples the number of draws when sampling
     * @param rng the random source of the draws
     * @return the fitted parameters
     * @throws OptimizationException when the optimizer or the sampler fails
     */
    public FitResult fit(PosteriorObjective objective, TrendParameters initialTrend, OptimizeMode mode,
                         boolean useLaplace, int laplaceSamples, UniformRandomProvider rng) {
        Objects.requireNonNull(mode, "mode cannot be null");
        ParameterLayout layout = objective.getLayout();
        logger.info("fitting {} model: {} rows, {} parameters, mode {}, laplace {}",
            objective.getFamily().getTag(), objective.rows(), layout.size(), mode, useLaplace);

        PosteriorMode found = optimizer.maximize(objective, objective.initialPoint(initialTrend));
        for (double v : found.getPoint()) {
            if (!Double.isFinite(v)) {
                throw new OptimizationException("optimizer returned a non-finite parameter vector");
            }
        }
        FittedParameters map = FittedParameters.of(layout, found.getPoint());

        PosteriorDraws draws = null;
        if (useLaplace) {
            draws = sampler.sample(objective, found, laplaceSamples, rng);
        }
        logger.info("fit converged in {} iterations, log-posterior {}", found.getIterations(), found.getLogPosterior());
        return new FitResult(map, draws, found.getLogPosterior(), found.getIterations());
    }
}
