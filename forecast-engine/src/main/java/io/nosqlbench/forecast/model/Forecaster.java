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

import io.nosqlbench.forecast.config.Durations;
import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.design.ChangepointMatrix;
import io.nosqlbench.forecast.design.ChangepointPlacer;
import io.nosqlbench.forecast.design.DesignComponent;
import io.nosqlbench.forecast.design.DesignMatrix;
import io.nosqlbench.forecast.design.DesignMatrixBuilder;
import io.nosqlbench.forecast.design.Event;
import io.nosqlbench.forecast.design.ExternalRegressor;
import io.nosqlbench.forecast.design.ScalingContext;
import io.nosqlbench.forecast.design.Seasonality;
import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.errors.ModelNotFittedException;
import io.nosqlbench.forecast.family.FamilyRegistry;
import io.nosqlbench.forecast.family.LikelihoodFamily;
import io.nosqlbench.forecast.fit.ConjugateGradientOptimizer;
import io.nosqlbench.forecast.fit.FitResult;
import io.nosqlbench.forecast.fit.FittingOrchestrator;
import io.nosqlbench.forecast.fit.LaplaceSampler;
import io.nosqlbench.forecast.fit.PosteriorObjective;
import io.nosqlbench.forecast.fit.PosteriorOptimizer;
import io.nosqlbench.forecast.fit.PosteriorSampler;
import io.nosqlbench.forecast.fit.PriorSpec;
import io.nosqlbench.forecast.predict.PredictionTable;
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.series.TimeSeries;
import io.nosqlbench.forecast.trend.TrendInitializer;
import io.nosqlbench.forecast.trend.TrendParameters;
import io.nosqlbench.forecast.uncertainty.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the engine: configure the components once, fit a series, then predict
 * from the fitted model.
 *
 * <pre>{@code
 * Forecaster forecaster = Forecaster.builder(ForecastConfig.builder("poisson").build())
 *     .addSeasonality(Seasonality.weekly())
 *     .build();
 * FittedForecastModel model = forecaster.fit(series);
 * PredictionTable table = model.predict(model.makeFutureFrame(30, true));
 * }</pre>
 *
 * <h2>Lifecycle</h2>
 *
 * <p>A fit first discards any previous model, then validates every input before the
 * optimizer runs. Only a completely successful fit is published; after a failure
 * {@link #predict} throws {@link ModelNotFittedException} until the next successful fit.
 */
public final class Forecaster {

    private static final Logger logger = LogManager.getLogger(Forecaster.class);

    private final ForecastConfig config;
    private final List<Seasonality> seasonalities;
    private final List<Event> events;
    private final List<ExternalRegressor> regressors;
    private final PosteriorOptimizer optimizer;
    private final PosteriorSampler sampler;

    private volatile FittedForecastModel fitted;

    private Forecaster(Builder builder) {
        this.config = builder.config;
        this.seasonalities = List.copyOf(builder.seasonalities);
        this.events = List.copyOf(builder.events);
        this.regressors = List.copyOf(builder.regressors);
        this.optimizer = builder.optimizer != null ? builder.optimizer : new ConjugateGradientOptimizer();
        this.sampler = builder.sampler != null ? builder.sampler : new LaplaceSampler(config.isParallel());
    }

    public static Builder builder(ForecastConfig config) {
        return new Builder(config);
    }

    public ForecastConfig getConfig() {
        return config;
    }

    /**
     * Fits the model to a series.
     *
     * @param series the training series
     * @return the fitted model, also retained for {@link #predict}
     * @throws ForecastConfigurationException when an input violates a precondition
     * @throws io.nosqlbench.forecast.errors.OptimizationException when the optimizer fails
     */
    public FittedForecastModel fit(TimeSeries series) {
        Objects.requireNonNull(series, "series cannot be null");
        fitted = null;

        LikelihoodFamily family = createFamily(series.values());
        family.validateObservations(series.values());
        List<String> regressorNames = new ArrayList<>();
        for (ExternalRegressor regressor : regressors) {
            regressorNames.add(regressor.getName());
        }
        ScalingContext scaling = ScalingContext.compute(series, family, regressorNames);

        double[] t = scaling.normalizeTimes(series.epochSeconds());
        double[] changepoints = config.getChangepoints()
            .map(instants -> ChangepointPlacer.explicit(instants, scaling))
            .orElseGet(() -> ChangepointPlacer.place(t, config.getNChangepoints(), config.getChangepointRange()));
        ChangepointMatrix trendBasis = ChangepointMatrix.of(t, changepoints);

        DesignMatrix design = new DesignMatrixBuilder(components(), FittedForecastModel.priorDefaults(config))
            .buildTraining(series.frame(), scaling);
        double[] columnScales = new double[design.columns()];
        for (int j = 0; j < columnScales.length; j++) {
            columnScales[j] = design.priorScale(j);
        }
        PriorSpec priors = new PriorSpec(config.getChangepointPriorScale(), config.getDispersionPriorScale(), columnScales);
        PosteriorObjective objective = new PosteriorObjective(series.values(), design, trendBasis, family, scaling, priors);
        TrendParameters initial = TrendInitializer.initialize(t, series.values(), family, scaling, changepoints.length);

        FitResult result = new FittingOrchestrator(optimizer, sampler).fit(objective, initial, config.getOptimizeMode(),
            config.isUseLaplace(), config.effectiveLaplaceSamples(), RandomGenerators.create(config.getSeed().orElse(null)));

        Duration period = config.getSamplingPeriod().orElseGet(() -> inferSamplingPeriod(series.epochSeconds()));
        FittedForecastModel model = new FittedForecastModel(config, family, scaling, changepoints, seasonalities, events,
            regressors, result.getMap(), result.getDraws().orElse(null), series.timestamps(), period,
            result.getLogPosterior());
        fitted = model;
        logger.info("fitted {} on {} rows with {} changepoints and {} design columns",
            family.getTag(), series.size(), changepoints.length, design.columns());
        return model;
    }

    private LikelihoodFamily createFamily(double[] observed) {
        Integer capacity = null;
        if (FamilyRegistry.requiresCapacity(config.getModel())) {
            double value = config.getCapacityValue().orElseThrow(() -> new ForecastConfigurationException(
                ConfigurationErrorKind.MISSING_CAPACITY,
                "model '" + config.getModel() + "' needs " + ForecastConfig.CAPACITY_VALUE));
            capacity = config.getCapacityMode().resolve(value, observed);
        }
        return FamilyRegistry.create(config.getModel(), capacity, config.getVarianceMax());
    }

    private List<DesignComponent> components() {
        List<DesignComponent> components = new ArrayList<>();
        components.addAll(seasonalities);
        components.addAll(events);
        components.addAll(regressors);
        return components;
    }

    static Duration inferSamplingPeriod(double[] epochSeconds) {
        double[] diffs = new double[epochSeconds.length - 1];
        for (int i = 1; i < epochSeconds.length; i++) {
            diffs[i - 1] = epochSeconds[i] - epochSeconds[i - 1];
        }
        Arrays.sort(diffs);
        int mid = diffs.length / 2;
        double median = diffs.length % 2 == 1 ? diffs[mid] : 0.5 * (diffs[mid - 1] + diffs[mid]);
        return Durations.ofSeconds(median);
    }

    public boolean isFitted() {
        return fitted != null;
    }

    /**
     * @return the model of the last successful fit
     * @throws ModelNotFittedException before a successful fit
     */
    public FittedForecastModel getFitted() {
        FittedForecastModel model = fitted;
        if (model == null) {
            throw new ModelNotFittedException("no fitted model; call fit() first");
        }
        return model;
    }

    public PredictionTable predict(PredictionFrame frame) {
        return getFitted().predict(frame);
    }

    public PredictionTable predict(PredictionFrame frame, double intervalWidth) {
        return getFitted().predict(frame, intervalWidth);
    }

    public PredictionFrame makeFutureFrame(int periods, boolean includeHistory) {
        return getFitted().makeFutureFrame(periods, includeHistory);
    }

    /**
     * Collects the components and collaborators of a {@link Forecaster}.
     */
    public static final class Builder {
        private final ForecastConfig config;
        private final List<Seasonality> seasonalities = new ArrayList<>();
        private final List<Event> events = new ArrayList<>();
        private final List<ExternalRegressor> regressors = new ArrayList<>();
        private PosteriorOptimizer optimizer;
        private PosteriorSampler sampler;

        private Builder(ForecastConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
        }

        public Builder addSeasonality(Seasonality seasonality) {
            seasonalities.add(Objects.requireNonNull(seasonality, "seasonality cannot be null"));
            return this;
        }

        public Builder addEvent(Event event) {
            events.add(Objects.requireNonNull(event, "event cannot be null"));
            return this;
        }

        public Builder addRegressor(ExternalRegressor regressor) {
            regressors.add(Objects.requireNonNull(regressor, "regressor cannot be null"));
            return this;
        }

        public Builder addRegressor(String name) {
            return addRegressor(new ExternalRegressor(name));
        }

        public Builder optimizer(PosteriorOptimizer optimizer) {
            this.optimizer = optimizer;
            return this;
        }

        public Builder sampler(PosteriorSampler sampler) {
            this.sampler = sampler;
            return this;
        }

        public Forecaster build() {
            return new Forecaster(this);
        }
    }
}
