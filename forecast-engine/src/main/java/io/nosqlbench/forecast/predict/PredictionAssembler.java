package io.nosqlbench.forecast.predict;

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
import io.nosqlbench.forecast.fit.FittedParameters;
import io.nosqlbench.forecast.fit.PosteriorDraws;
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.trend.PiecewiseLinearTrend;
import io.nosqlbench.forecast.trend.TrendParameters;
import io.nosqlbench.forecast.uncertainty.DataVariability;
import io.nosqlbench.forecast.uncertainty.EmpiricalQuantiles;
import io.nosqlbench.forecast.uncertainty.QuantileLevels;
import io.nosqlbench.forecast.uncertainty.TrendUncertaintySimulator;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines the point forecast, the trend with its simulated bounds, the confidence
 * bounds from posterior draws and the data-variability bounds into one
 * {@link PredictionTable}.
 *
 * <h2>Columns</h2>
 *
 * <pre>{@code
 * yhat_linked      = eta = linkedOffset + linkedScale * (trend + X . beta)      MAP parameters
 * yhat             = family mean at eta
 * trend_linked     = linkedOffset + linkedScale * trend
 * trend_*          = quantiles of simulated trend paths; equal to trend without paths
 * yhat_upper/lower = quantiles of eta over the draws; equal to yhat without draws
 * observed_*       = family quantiles at the MAP eta; *_linked is their link
 * }</pre>
 *
 * <p>Quantiles are taken on the linked scale and mapped through the family mean, which
 * is monotone in {@code eta}.
 */
public final class PredictionAssembler {

    private static final Logger logger = LogManager.getLogger(PredictionAssembler.class);

    private final LikelihoodFamily family;
    private final ScalingContext scaling;
    private final double[] changepoints;
    private final FittedParameters map;
    private final PosteriorDraws draws;
    private final int trendSamples;
    private final boolean parallel;

    /**
     * @param family the likelihood family of the fit
     * @param scaling the scaling context of the fit
     * @param changepoints the fitted changepoints in normalized time
     * @param map the MAP parameters
     * @param draws the Laplace draws, or null when the fit did not sample
     * @param trendSamples the number of simulated trend paths; 0 disables trend bounds
     * @param parallel whether simulations may run concurrently
     */
    public PredictionAssembler(LikelihoodFamily family, ScalingContext scaling, double[] changepoints,
                               FittedParameters map, PosteriorDraws draws, int trendSamples, boolean parallel) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.scaling = Objects.requireNonNull(scaling, "scaling cannot be null");
        this.changepoints = changepoints.clone();
        this.map = Objects.requireNonNull(map, "map cannot be null");
        this.draws = draws != null && draws.size() > 0 ? draws : null;
        this.trendSamples = trendSamples;
        this.parallel = parallel;
    }

    /**
     * Assembles the prediction for a frame.
     *
     * @param frame the timestamps to predict
     * @param design the design matrix evaluated on the frame
     * @param intervalWidth the probability mass of every interval
     * @param rng the random source of the trend simulation
     * @return the prediction table
     */
    public PredictionTable assemble(PredictionFrame frame, DesignMatrix design, double intervalWidth,
                                    UniformRandomProvider rng) {
        QuantileLevels levels = QuantileLevels.of(intervalWidth);
        int rows = frame.size();
        double[] t = scaling.normalizeTimes(frame.epochSeconds());
        ChangepointMatrix basis = ChangepointMatrix.of(t, changepoints);
        double dispersion = family.hasDispersion()
            ? family.dispersion(map.getKappa(), scaling.getLinkedScale())
            : Double.NaN;

        double[] trend = PiecewiseLinearTrend.evaluate(map.getTrend(), basis);
        double[] trendLinked = new double[rows];
        double[] eta = new double[rows];
        for (int i = 0; i < rows; i++) {
            trendLinked[i] = scaling.toLinked(trend[i]);
            eta[i] = scaling.toLinked(trend[i] + design.dot(i, map.getBeta()));
        }

        double[][] paths = null;
        double[] trendLower = trendLinked;
        double[] trendUpper = trendLinked;
        if (trendSamples > 0) {
            paths = new TrendUncertaintySimulator(parallel).simulate(bases(), changepoints, t, trendSamples, rng);
            trendLower = toLinked(EmpiricalQuantiles.perRow(paths, levels.getLower()));
            trendUpper = toLinked(EmpiricalQuantiles.perRow(paths, levels.getUpper()));
        }

        double[] yhatLower = eta;
        double[] yhatUpper = eta;
        if (draws != null) {
            double[][] samples = drawPredictors(basis, design, paths);
            yhatLower = EmpiricalQuantiles.perRow(samples, levels.getLower());
            yhatUpper = EmpiricalQuantiles.perRow(samples, levels.getUpper());
        }

        double[][] observed = new DataVariability(family, parallel).bounds(eta, dispersion, levels);

        EnumMap<PredictionColumn, double[]> columns = new EnumMap<>(PredictionColumn.class);
        putPair(columns, PredictionColumn.YHAT, eta, dispersion);
        putPair(columns, PredictionColumn.YHAT_UPPER, yhatUpper, dispersion);
        putPair(columns, PredictionColumn.YHAT_LOWER, yhatLower, dispersion);
        putPair(columns, PredictionColumn.TREND, trendLinked, dispersion);
        putPair(columns, PredictionColumn.TREND_UPPER, trendUpper, dispersion);
        putPair(columns, PredictionColumn.TREND_LOWER, trendLower, dispersion);
        columns.put(PredictionColumn.OBSERVED_LOWER, observed[0]);
        columns.put(PredictionColumn.OBSERVED_UPPER, observed[1]);
        columns.put(PredictionColumn.OBSERVED_LOWER_LINKED, link(observed[0]));
        columns.put(PredictionColumn.OBSERVED_UPPER_LINKED, link(observed[1]));

        logger.debug("assembled {} rows, interval width {}, {} trend paths, {} draws",
            rows, intervalWidth, trendSamples, draws == null ? 0 : draws.size());
        return new PredictionTable(frame.timestamps(), columns, components(design), intervalWidth);
    }

    private List<TrendParameters> bases() {
        List<TrendParameters> bases = new ArrayList<>();
        if (draws == null) {
            bases.add(map.getTrend());
        } else {
            for (FittedParameters draw : draws.asList()) {
                bases.add(draw.getTrend());
            }
        }
        return bases;
    }

    // linear predictor per draw; when trend paths exist, path i was started from draw i mod draws
    private double[][] drawPredictors(ChangepointMatrix basis, DesignMatrix design, double[][] paths) {
        int count = paths != null ? paths.length : draws.size();
        double[][] samples = new double[count][basis.rows()];
        for (int s = 0; s < count; s++) {
            FittedParameters draw = draws.get(s % draws.size());
            double[] trend = paths != null ? paths[s] : PiecewiseLinearTrend.evaluate(draw.getTrend(), basis);
            double[] beta = draw.getBeta();
            for (int i = 0; i < basis.rows(); i++) {
                samples[s][i] = scaling.toLinked(trend[i] + design.dot(i, beta));
            }
        }
        return samples;
    }

    private void putPair(EnumMap<PredictionColumn, double[]> columns, PredictionColumn column,
                         double[] linked, double dispersion) {
        double[] mean = new double[linked.length];
        for (int i = 0; i < linked.length; i++) {
            mean[i] = family.mean(linked[i], dispersion);
        }
        columns.put(column, mean);
        columns.put(column.linked(), linked.clone());
    }

    private double[] toLinked(double[] normalized) {
        double[] linked = new double[normalized.length];
        for (int i = 0; i < linked.length; i++) {
            linked[i] = scaling.toLinked(normalized[i]);
        }
        return linked;
    }

    private double[] link(double[] values) {
        double[] linked = new double[values.length];
        for (int i = 0; i < linked.length; i++) {
            linked[i] = family.link(values[i]);
        }
        return linked;
    }

    private Map<String, double[]> components(DesignMatrix design) {
        Map<String, double[]> components = new LinkedHashMap<>();
        double[] beta = map.getBeta();
        for (String name : design.componentNames()) {
            double[] contribution = new double[design.rows()];
            for (int i = 0; i < contribution.length; i++) {
                contribution[i] = scaling.getLinkedScale() * design.dot(i, beta, name);
            }
            components.put(name, contribution);
        }
        return components;
    }
}
