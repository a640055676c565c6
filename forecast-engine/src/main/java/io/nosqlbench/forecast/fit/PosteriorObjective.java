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

import io.nosqlbench.forecast.design.ChangepointMatrix;
import io.nosqlbench.forecast.design.DesignMatrix;
import io.nosqlbench.forecast.design.ScalingContext;
import io.nosqlbench.forecast.family.LikelihoodFamily;
import io.nosqlbench.forecast.trend.TrendParameters;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;

import java.util.Objects;

/**
 * The log-posterior of one fit, over the flat parameter vector of a
 * {@link ParameterLayout}.
 *
 * <h2>Linear predictor</h2>
 *
 * <pre>{@code
 * eta_i = linkedOffset + linkedScale * (trend_i + X_i . beta)
 * }</pre>
 *
 * <h2>Gradient</h2>
 *
 * <p>With {@code g_i = d logLik_i / d eta_i} from the family and {@code sc} the linked
 * scale:
 *
 * <pre>{@code
 * d/dk       = sc * sum_i g_i t_i
 * d/dm       = sc * sum_i g_i
 * d/ddelta_j = sc * sum_i g_i A_ij (t_i - tc_j)
 * d/dbeta_j  = sc * sum_i g_i X_ij
 * }</pre>
 *
 * The derivative with respect to the dispersion coordinate is taken numerically, since
 * {@code kappa} enters each family differently.
 *
 * <p>Instances are immutable and safe to evaluate from several threads.
 */
public final class PosteriorObjective {

    private static final double DISPERSION_STEP = 1e-5;

    private final double[] observed;
    private final DesignMatrix design;
    private final ChangepointMatrix trendBasis;
    private final LikelihoodFamily family;
    private final ScalingContext scaling;
    private final PriorSpec priors;
    private final ParameterLayout layout;

    public PosteriorObjective(double[] observed, DesignMatrix design, ChangepointMatrix trendBasis,
                              LikelihoodFamily family, ScalingContext scaling, PriorSpec priors) {
        this.observed = Objects.requireNonNull(observed, "observed cannot be null").clone();
        this.design = Objects.requireNonNull(design, "design cannot be null");
        this.trendBasis = Objects.requireNonNull(trendBasis, "trendBasis cannot be null");
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.scaling = Objects.requireNonNull(scaling, "scaling cannot be null");
        this.priors = Objects.requireNonNull(priors, "priors cannot be null");
        if (design.rows() != observed.length || trendBasis.rows() != observed.length) {
            throw new IllegalArgumentException("row counts differ: observed=" + observed.length
                + ", design=" + design.rows() + ", trend=" + trendBasis.rows());
        }
        if (priors.regressorCount() != design.columns()) {
            throw new IllegalArgumentException("expected " + design.columns() + " regressor prior scales, got "
                + priors.regressorCount());
        }
        this.layout = new ParameterLayout(trendBasis.columns(), design.columns(), family.hasDispersion());
    }

    public ParameterLayout getLayout() {
        return layout;
    }

    public LikelihoodFamily getFamily() {
        return family;
    }

    public ScalingContext getScaling() {
        return scaling;
    }

    public int rows() {
        return observed.length;
    }

    /**
     * Packs an initial trend and the family's initial dispersion into a parameter vector,
     * with all regression coefficients at zero.
     *
     * @param trend the initial trend
     * @return the starting point
     */
    public double[] initialPoint(TrendParameters trend) {
        double[] x = new double[layout.size()];
        x[ParameterLayout.K] = trend.getK();
        x[ParameterLayout.M] = trend.getM();
        for (int j = 0; j < layout.changepoints(); j++) {
            x[layout.deltaOffset() + j] = trend.delta(j);
        }
        if (layout.hasDispersion()) {
            x[layout.dispersionIndex()] = ParameterLayout.dispersionCoordinate(family.initialKappa());
        }
        return x;
    }

    /**
     * Computes the linear predictor of every training row.
     *
     * @param x the parameter vector
     * @return {@code eta} per row
     */
    public double[] linearPredictor(double[] x) {
        double[] beta = new double[layout.regressors()];
        System.arraycopy(x, layout.betaOffset(), beta, 0, beta.length);
        double[] eta = new double[observed.length];
        for (int i = 0; i < eta.length; i++) {
            double rate = x[ParameterLayout.K];
            double offset = x[ParameterLayout.M];
            for (int j = 0; j < layout.changepoints() && trendBasis.get(i, j) != 0.0; j++) {
                double d = x[layout.deltaOffset() + j];
                rate += d;
                offset -= trendBasis.changepoint(j) * d;
            }
            double trend = rate * trendBasis.time(i) + offset;
            eta[i] = scaling.toLinked(trend + design.dot(i, beta));
        }
        return eta;
    }

    double dispersion(double[] x) {
        return layout.hasDispersion()
            ? family.dispersion(ParameterLayout.kappa(x[layout.dispersionIndex()]), scaling.getLinkedScale())
            : Double.NaN;
    }

    private double logLikelihood(double[] eta, double dispersion) {
        double sum = 0.0;
        for (int i = 0; i < eta.length; i++) {
            sum += family.logLikelihood(observed[i], eta[i], dispersion);
        }
        return sum;
    }

    /**
     * Evaluates the log-posterior, up to an additive constant.
     *
     * @param x the parameter vector
     * @return the log-posterior; non-finite where the likelihood is degenerate
     */
    public double value(double[] x) {
        return logLikelihood(linearPredictor(x), dispersion(x)) + priors.logPrior(layout, x, null);
    }

    /**
     * Evaluates the gradient of {@link #value}.
     *
     * @param x the parameter vector
     * @return the gradient
     */
    public double[] gradient(double[] x) {
        double[] eta = linearPredictor(x);
        double dispersion = dispersion(x);
        double sc = scaling.getLinkedScale();
        double[] grad = new double[layout.size()];
        for (int i = 0; i < eta.length; i++) {
            double g = sc * family.logLikelihoodDerivative(observed[i], eta[i], dispersion);
            double t = trendBasis.time(i);
            grad[ParameterLayout.K] += g * t;
            grad[ParameterLayout.M] += g;
            for (int j = 0; j < layout.changepoints() && trendBasis.get(i, j) != 0.0; j++) {
                grad[layout.deltaOffset() + j] += g * (t - trendBasis.changepoint(j));
            }
            for (int j = 0; j < layout.regressors(); j++) {
                grad[layout.betaOffset() + j] += g * design.get(i, j);
            }
        }
        if (layout.hasDispersion()) {
            int idx = layout.dispersionIndex();
            double u = x[idx];
            double upper = logLikelihood(eta, family.dispersion(ParameterLayout.kappa(u + DISPERSION_STEP), sc));
            double lower = logLikelihood(eta, family.dispersion(ParameterLayout.kappa(u - DISPERSION_STEP), sc));
            grad[idx] = (upper - lower) / (2 * DISPERSION_STEP);
        }
        priors.logPrior(layout, x, grad);
        return grad;
    }

    /**
     * @return this objective as a commons-math function
     */
    public MultivariateFunction asFunction() {
        return this::value;
    }

    /**
     * @return the gradient as a commons-math vector function
     */
    public MultivariateVectorFunction asGradient() {
        return this::gradient;
    }
}
