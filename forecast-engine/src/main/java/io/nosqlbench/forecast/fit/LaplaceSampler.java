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
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Laplace approximation: a Gaussian centered on the mode whose covariance is the inverse
 * of the negative Hessian of the log-posterior there.
 *
 * <h2>Procedure</h2>
 *
 * <pre>{@code
 * H[., j] = (grad(x + h e_j) - grad(x - h e_j)) / 2h         columns in parallel
 * H       = (H + H^T) / 2
 * Sigma   = (-H)^-1                                           via Cholesky
 * draw    = x + L z,   L L^T = Sigma,   z ~ N(0, I)
 * }</pre>
 *
 * <p>When the negative Hessian is not positive definite, the curvature is repaired from its
 * eigen-decomposition: each eigenvalue is replaced by its absolute value, floored at
 * {@code max(1e-6 * largest, 1 / TREND_SCALE^2)}, the curvature of the widest prior. Only a
 * Hessian with no curvature at all, or with non-finite entries, fails.
 */
public final class LaplaceSampler implements PosteriorSampler {

    private static final Logger logger = LogManager.getLogger(LaplaceSampler.class);

    private static final double RELATIVE_STEP = 1e-5;
    private static final double SYMMETRY_THRESHOLD = 1e-8;
    private static final double POSITIVITY_THRESHOLD = 1e-14;
    private static final double RELATIVE_EIGEN_FLOOR = 1e-6;
    private static final double ABSOLUTE_EIGEN_FLOOR = 1.0 / (PriorSpec.TREND_SCALE * PriorSpec.TREND_SCALE);

    private final boolean parallel;

    public LaplaceSampler() {
        this(true);
    }

    /**
     * @param parallel whether to evaluate the Hessian columns concurrently
     */
    public LaplaceSampler(boolean parallel) {
        this.parallel = parallel;
    }

    @Override
    public PosteriorDraws sample(PosteriorObjective objective, PosteriorMode mode, int count, UniformRandomProvider rng) {
        if (count < 0) {
            throw new IllegalArgumentException("draw count must be >= 0, got " + count);
        }
        double[] center = mode.getPoint();
        RealMatrix factor = covarianceFactor(hessian(objective, center));
        ContinuousSampler gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
        ParameterLayout layout = objective.getLayout();

        int n = center.length;
        List<FittedParameters> draws = new ArrayList<>(count);
        double[] z = new double[n];
        for (int d = 0; d < count; d++) {
            for (int i = 0; i < n; i++) {
                z[i] = gaussian.sample();
            }
            double[] x = factor.operate(z);
            for (int i = 0; i < n; i++) {
                x[i] += center[i];
            }
            draws.add(FittedParameters.of(layout, x));
        }
        logger.debug("drew {} Laplace samples over {} parameters", count, n);
        return new PosteriorDraws(draws);
    }

    double[][] hessian(PosteriorObjective objective, double[] x) {
        int n = x.length;
        double[][] columns = new double[n][];
        IntStream indexes = IntStream.range(0, n);
        (parallel ? indexes.parallel() : indexes).forEach(j -> {
            double h = RELATIVE_STEP * Math.max(1.0, Math.abs(x[j]));
            double[] up = x.clone();
            double[] down = x.clone();
            up[j] += h;
            down[j] -= h;
            double[] gUp = objective.gradient(up);
            double[] gDown = objective.gradient(down);
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = (gUp[i] - gDown[i]) / (2 * h);
            }
            columns[j] = column;
        });
        double[][] hessian = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                hessian[i][j] = 0.5 * (columns[j][i] + columns[i][j]);
            }
        }
        return hessian;
    }

    /**
     * Factors the covariance of the Laplace approximation.
     *
     * @param hessian the symmetric Hessian of the log-posterior at the mode
     * @return {@code F} with {@code F F^T = (-H)^-1}; lower triangular unless the curvature was repaired
     * @throws OptimizationException when the Hessian is non-finite or has no curvature
     */
    static RealMatrix covarianceFactor(double[][] hessian) {
        for (double[] row : hessian) {
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    throw new OptimizationException("curvature at the mode is not finite");
                }
            }
        }
        RealMatrix precision = MatrixUtils.createRealMatrix(hessian).scalarMultiply(-1.0);
        try {
            RealMatrix covariance = new CholeskyDecomposition(precision, SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD)
                .getSolver().getInverse();
            RealMatrix symmetric = covariance.add(covariance.transpose()).scalarMultiply(0.5);
            return new CholeskyDecomposition(symmetric, SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD).getL();
        } catch (MathIllegalArgumentException e) {
            return repairedFactor(precision, e.getMessage());
        }
    }

    private static RealMatrix repairedFactor(RealMatrix precision, String reason) {
        RealMatrix symmetric = precision.add(precision.transpose()).scalarMultiply(0.5);
        EigenDecomposition eigen;
        try {
            eigen = new EigenDecomposition(symmetric);
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            throw new OptimizationException("curvature at the mode does not define a Gaussian approximation: "
                + e.getMessage(), e);
        }
        double[] values = eigen.getRealEigenvalues();
        double largest = 0.0;
        for (double value : values) {
            largest = Math.max(largest, Math.abs(value));
        }
        if (!(largest > 0.0)) {
            throw new OptimizationException("curvature at the mode does not define a Gaussian approximation: "
                + "the Hessian is zero");
        }
        double floor = Math.max(RELATIVE_EIGEN_FLOOR * largest, ABSOLUTE_EIGEN_FLOOR);
        int repaired = 0;
        RealMatrix v = eigen.getV();
        RealMatrix factor = MatrixUtils.createRealMatrix(values.length, values.length);
        for (int j = 0; j < values.length; j++) {
            double value = values[j];
            if (!(value >= floor)) {
                value = Math.max(Math.abs(value), floor);
                repaired++;
            }
            double scale = 1.0 / Math.sqrt(value);
            for (int i = 0; i < values.length; i++) {
                factor.setEntry(i, j, v.getEntry(i, j) * scale);
            }
        }
        logger.warn("curvature at the mode is not negative definite ({}); repaired {} of {} directions",
            reason, repaired, values.length);
        return factor;
    }
}
