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

import io.nosqlbench.forecast.errors.OptimizationException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * MAP search with the Polak-Ribière non-linear conjugate gradient method of
 * commons-math. Converges when the log-posterior changes by less than the tolerances
 * between two iterations.
 */
public final class ConjugateGradientOptimizer implements PosteriorOptimizer {

    private static final Logger logger = LogManager.getLogger(ConjugateGradientOptimizer.class);

    public static final int DEFAULT_MAX_ITERATIONS = 20_000;
    public static final int DEFAULT_MAX_EVALUATIONS = 400_000;
    public static final double DEFAULT_TOLERANCE = 1e-10;

    private final int maxIterations;
    private final int maxEvaluations;
    private final double tolerance;

    public ConjugateGradientOptimizer() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_EVALUATIONS, DEFAULT_TOLERANCE);
    }

    public ConjugateGradientOptimizer(int maxIterations, int maxEvaluations, double tolerance) {
        if (maxIterations <= 0 || maxEvaluations <= 0 || !(tolerance > 0)) {
            throw new IllegalArgumentException("limits must be positive: iterations=" + maxIterations
                + ", evaluations=" + maxEvaluations + ", tolerance=" + tolerance);
        }
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
        this.tolerance = tolerance;
    }

    @Override
    public PosteriorMode maximize(PosteriorObjective objective, double[] initial) {
        double start = objective.value(initial);
        if (!Double.isFinite(start)) {
            throw new OptimizationException("log-posterior is not finite at the starting point: " + start);
        }
        NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
            NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
            new SimpleValueChecker(tolerance, tolerance));
        PointValuePair optimum;
        try {
            optimum = optimizer.optimize(
                new MaxEval(maxEvaluations),
                new MaxIter(maxIterations),
                new ObjectiveFunction(objective.asFunction()),
                new ObjectiveFunctionGradient(objective.asGradient()),
                GoalType.MAXIMIZE,
                new InitialGuess(initial));
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new OptimizationException("conjugate gradient search failed after "
                + optimizer.getIterations() + " iterations: " + e.getMessage(), e);
        }
        double value = optimum.getValue();
        if (!Double.isFinite(value)) {
            throw new OptimizationException("log-posterior is not finite at the optimum: " + value);
        }
        logger.debug("log-posterior {} -> {} in {} iterations, {} evaluations",
            start, value, optimizer.getIterations(), optimizer.getEvaluations());
        return new PosteriorMode(optimum.getPoint(), value, optimizer.getIterations(), optimizer.getEvaluations());
    }
}
