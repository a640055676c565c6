package io.nosqlbench.forecast.model;

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

import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.design.DesignComponent;
import io.nosqlbench.forecast.design.DesignMatrix;
import io.nosqlbench.forecast.design.DesignMatrixBuilder;
import io.nosqlbench.forecast.design.Event;
import io.nosqlbench.forecast.design.ExternalRegressor;
import io.nosqlbench.forecast.design.PriorScaleDefaults;
import io.nosqlbench.forecast.design.ScalingContext;
import io.nosqlbench.forecast.design.Seasonality;
import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.family.LikelihoodFamily;
import io.nosqlbench.forecast.fit.FittedParameters;
import io.nosqlbench.forecast.fit.PosteriorDraws;
import io.nosqlbench.forecast.predict.PredictionAssembler;
import io.nosqlbench.forecast.predict.PredictionTable;
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.trend.DenormalizedTrend;
import io.nosqlbench.forecast.uncertainty.RandomGenerators;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The immutable result of a successful fit. Holds everything needed to predict: the
 * resolved configuration, the family, the scaling context, the components, the MAP
 * parameters and the optional Laplace draws.
 *
 * <p>Predict calls never modify the model and may run concurrently. With a configured
 * seed, repeated calls with the same frame give identical tables.
 */
public final class FittedForecastModel {

    private static final long PREDICTION_STREAM = 0x9E3779B97F4A7C15L;

    private final ForecastConfig config;
    private final LikelihoodFamily family;
    private final ScalingContext scaling;
    private final double[] changepoints;
    private final List<Seasonality> seasonalities;
    private final List<Event> events;
    private final List<ExternalRegressor> regressors;
    private final FittedParameters map;
    private final PosteriorDraws draws;
    private final List<Instant> trainingTimestamps;
    private final Duration samplingPeriod;
    private final double logPosterior;

    FittedForecastModel(ForecastConfig config, LikelihoodFamily family, ScalingContext scaling, double[] changepoints,
                        List<Seasonality> seasonalities, List<Event> events, List<ExternalRegressor> regressors,
                        FittedParameters map, PosteriorDraws draws, List<Instant> trainingTimestamps,
                        Duration samplingPeriod, double logPosterior) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.scaling = Objects.requireNonNull(scaling, "scaling cannot be null");
        this.changepoints = changepoints.clone();
        this.seasonalities = List.copyOf(seasonalities);
        this.events = List.copyOf(events);
        this.regressors = List.copyOf(regressors);
        this.map = Objects.requireNonNull(map, "map cannot be null");
        this.draws = draws;
        this.trainingTimestamps = List.copyOf(trainingTimestamps);
        this.samplingPeriod = Objects.requireNonNull(samplingPeriod, "samplingPeriod cannot be null");
        this.logPosterior = logPosterior;
    }

    public ForecastConfig getConfig() {
        return config;
    }

    public LikelihoodFamily getFamily() {
        return family;
    }

    public ScalingContext getScaling() {
        return scaling;
    }

    public FittedParameters getParameters() {
        return map;
    }

    public Optional<PosteriorDraws> getDraws() {
        return Optional.ofNullable(draws);
    }

    public List<Seasonality> getSeasonalities() {
        return seasonalities;
    }

    public List<Event> getEvents() {
        return events;
    }

    public List<ExternalRegressor> getRegressors() {
        return regressors;
    }

    public List<Instant> getTrainingTimestamps() {
        return trainingTimestamps;
    }

    public Duration getSamplingPeriod() {
        return samplingPeriod;
    }

    public double getLogPosterior() {
        return logPosterior;
    }

    /**
     * @return the changepoints in normalized time
     */
    public double[] getChangepoints() {
        return changepoints.clone();
    }

    public List<Instant> changepointInstants() {
        List<Instant> instants = new ArrayList<>(changepoints.length);
        for (double c : changepoints) {
            instants.add(PredictionFrame.fromEpochSeconds(scaling.denormalizeTime(c)));
        }
        return instants;
    }

    /**
     * @return the MAP trend in original units
     */
    public DenormalizedTrend denormalizedTrend() {
        return DenormalizedTrend.of(map.getTrend(), changepoints, scaling);
    }

    /**
     * Predicts with the configured interval width.
     *
     * @param frame the timestamps to predict, with every external regressor
     * @return the prediction table
     */
    public PredictionTable predict(PredictionFrame frame) {
        return predict(frame, config.getIntervalWidth());
    }

    /**
     * Predicts with an interval width for this call only.
     *
     * @param frame the timestamps to predict, with every external regressor
     * @param intervalWidth the probability mass of all intervals, in (0, 1)
     * @return the prediction table
     * @throws ForecastConfigurationException {@code MISSING_REGRESSOR} when the frame lacks a regressor
     */
    public PredictionTable predict(PredictionFrame frame, double intervalWidth) {
        Objects.requireNonNull(frame, "frame cannot be null");
        if (!(intervalWidth > 0.0 && intervalWidth < 1.0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "interval_width must be in (0, 1), got " + intervalWidth);
        }
        for (ExternalRegressor regressor : regressors) {
            if (!frame.hasRegressor(regressor.getName())) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_REGRESSOR,
                    "prediction frame has no column for regressor '" + regressor.getName() + "'");
            }
        }
        DesignMatrix design = designBuilder().build(frame, scaling);
        PredictionAssembler assembler = new PredictionAssembler(family, scaling, changepoints, map, draws,
            config.getTrendSamples(), config.isParallel());
        Long seed = config.getSeed().map(s -> s ^ PREDICTION_STREAM).orElse(null);
        return assembler.assemble(frame, design, intervalWidth, RandomGenerators.create(seed));
    }

    /**
     * Extends the training timestamps by whole sampling periods.
     *
     * @param periods the number of future steps, non-negative
     * @param includeHistory whether to start the frame with the training timestamps
     * @return the frame
     * @throws ForecastConfigurationException {@code MISSING_REGRESSOR} when the model uses
     *     external regressors, whose future values only the caller knows
     */
    public PredictionFrame makeFutureFrame(int periods, boolean includeHistory) {
        if (periods < 0) {
            throw new IllegalArgumentException("periods must be >= 0, got " + periods);
        }
        if (!regressors.isEmpty()) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_REGRESSOR,
                "model uses external regressors; supply a prediction frame with their values");
        }
        List<Instant> timestamps = new ArrayList<>();
        if (includeHistory) {
            timestamps.addAll(trainingTimestamps);
        }
        Instant last = trainingTimestamps.get(trainingTimestamps.size() - 1);
        for (int k = 1; k <= periods; k++) {
            timestamps.add(last.plus(samplingPeriod.multipliedBy(k)));
        }
        return PredictionFrame.of(timestamps);
    }

    private DesignMatrixBuilder designBuilder() {
        List<DesignComponent> components = new ArrayList<>();
        components.addAll(seasonalities);
        components.addAll(events);
        components.addAll(regressors);
        return new DesignMatrixBuilder(components, priorDefaults(config));
    }

    static PriorScaleDefaults priorDefaults(ForecastConfig config) {
        return new PriorScaleDefaults(config.getSeasonalityPriorScale(), config.getEventPriorScale());
    }

    @Override
    public String toString() {
        return "FittedForecastModel{" + family + ", rows=" + trainingTimestamps.size()
            + ", changepoints=" + changepoints.length + ", laplace=" + (draws != null) + '}';
    }
}
