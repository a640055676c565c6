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


import io.nosqlbench.forecast.SeriesFixtures;
import io.nosqlbench.forecast.config.CapacityMode;
import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.design.Seasonality;
import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.errors.ModelNotFittedException;
import io.nosqlbench.forecast.fit.ParameterLayout;
import io.nosqlbench.forecast.predict.PredictionColumn;
import io.nosqlbench.forecast.predict.PredictionTable;
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ForecasterTest {

    private static ForecastConfig.Builder poisson() {
        return ForecastConfig.builder("poisson").nChangepoints(0).seed(11L).trendSamples(200);
    }

    @Test
    void constantPoissonRateIsRecoveredOnTheLinkedScale() {
        TimeSeries series = SeriesFixtures.poissonCounts(100, 20.0, 5L);
        Forecaster forecaster = Forecaster.builder(poisson().build()).build();
        FittedForecastModel model = forecaster.fit(series);

        PredictionTable table = model.predict(series.frame());
        double[] trend = table.column(PredictionColumn.TREND_LINKED);
        for (double value : trend) {
            assertEquals(Math.log(20.0), value, 0.15);
        }
        assertEquals(100, table.size());
    }

    @Test
    void observedBoundsCoverHeldOutCounts() {
        Forecaster forecaster = Forecaster.builder(poisson().build()).build();
        forecaster.fit(SeriesFixtures.poissonCounts(100, 20.0, 5L));

        PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(50, false));
        double[] heldOut = SeriesFixtures.poissonCounts(50, 20.0, 99L).values();
        double[] lower = table.column(PredictionColumn.OBSERVED_LOWER);
        double[] upper = table.column(PredictionColumn.OBSERVED_UPPER);
        int covered = 0;
        for (int i = 0; i < heldOut.length; i++) {
            if (lower[i] <= heldOut[i] && heldOut[i] <= upper[i]) {
                covered++;
            }
        }
        assertTrue(covered >= 33, "covered " + covered + " of 50");
    }

    @Test
    void observedBoundsCoverHeldOutCountsAcrossSeeds() {
        int covered = 0;
        int total = 0;
        for (long seed = 1; seed <= 5; seed++) {
            Forecaster forecaster = Forecaster.builder(poisson().seed(seed).trendSamples(100).build()).build();
            forecaster.fit(SeriesFixtures.poissonCounts(100, 15.0, 100L + seed));
            PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(50, false), 0.8);
            double[] heldOut = SeriesFixtures.poissonCounts(50, 15.0, 200L + seed).values();
            double[] lower = table.column(PredictionColumn.OBSERVED_LOWER);
            double[] upper = table.column(PredictionColumn.OBSERVED_UPPER);
            for (int i = 0; i < heldOut.length; i++) {
                total++;
                if (lower[i] <= heldOut[i] && heldOut[i] <= upper[i]) {
                    covered++;
                }
            }
        }
        double rate = (double) covered / total;
        assertTrue(rate >= 0.68 && rate <= 0.97, "coverage " + rate);
    }

    @Test
    void withoutLaplaceTheConfidenceBoundsCollapseOntoYhat() {
        Forecaster forecaster = Forecaster.builder(poisson().useLaplace(false).build()).build();
        forecaster.fit(SeriesFixtures.poissonCounts(60, 8.0, 3L));
        PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(10, true));
        assertArrayEquals(table.column(PredictionColumn.YHAT), table.column(PredictionColumn.YHAT_UPPER));
        assertArrayEquals(table.column(PredictionColumn.YHAT), table.column(PredictionColumn.YHAT_LOWER));
        assertArrayEquals(table.column(PredictionColumn.YHAT_LINKED), table.column(PredictionColumn.YHAT_LOWER_LINKED));
    }

    @Test
    void laplaceBoundsBracketTheMapForecast() {
        ForecastConfig config = ForecastConfig.builder("normal")
            .nChangepoints(4).useLaplace(true).laplaceSamples(200).trendSamples(0).seed(21L).build();
        Forecaster forecaster = Forecaster.builder(config).addSeasonality(new Seasonality("weekly", 7.0, 2)).build();
        FittedForecastModel model = forecaster.fit(SeriesFixtures.weeklyRamp(56));
        assertTrue(model.getDraws().isPresent());

        PredictionTable table = model.predict(model.makeFutureFrame(0, true));
        double[] yhat = table.column(PredictionColumn.YHAT);
        double[] lower = table.column(PredictionColumn.YHAT_LOWER);
        double[] upper = table.column(PredictionColumn.YHAT_UPPER);
        boolean someWidth = false;
        for (int i = 0; i < yhat.length; i++) {
            assertTrue(lower[i] <= yhat[i] && yhat[i] <= upper[i], "row " + i);
            someWidth |= upper[i] > lower[i];
        }
        assertTrue(someWidth);
        assertTrue(table.components().containsKey("weekly"));
    }

    @Test
    void widerIntervalsContainNarrowerOnes() {
        Forecaster forecaster = Forecaster.builder(poisson().nChangepoints(3).build()).build();
        FittedForecastModel model = forecaster.fit(SeriesFixtures.poissonCounts(80, 12.0, 8L));
        PredictionFrame frame = model.makeFutureFrame(30, false);
        PredictionTable narrow = model.predict(frame, 0.5);
        PredictionTable wide = model.predict(frame, 0.95);
        assertEquals(0.95, wide.getIntervalWidth());
        for (int i = 0; i < frame.size(); i++) {
            assertTrue(wide.get(i, PredictionColumn.OBSERVED_LOWER) <= narrow.get(i, PredictionColumn.OBSERVED_LOWER));
            assertTrue(wide.get(i, PredictionColumn.OBSERVED_UPPER) >= narrow.get(i, PredictionColumn.OBSERVED_UPPER));
            assertTrue(wide.get(i, PredictionColumn.TREND_LOWER) <= narrow.get(i, PredictionColumn.TREND_LOWER) + 1e-12);
            assertTrue(wide.get(i, PredictionColumn.TREND_UPPER) >= narrow.get(i, PredictionColumn.TREND_UPPER) - 1e-12);
        }
    }

    @Test
    void betaForecastsStayInsideTheUnitInterval() {
        TimeSeries series = SeriesFixtures.dailySeries(70, i -> 0.4 + 0.15 * Math.sin(2 * Math.PI * i / 7.0));
        ForecastConfig config = ForecastConfig.builder("beta").nChangepoints(3).trendSamples(100).seed(4L).build();
        Forecaster forecaster = Forecaster.builder(config).addSeasonality(Seasonality.weekly()).build();
        forecaster.fit(series);
        PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(28, true));
        for (PredictionColumn column : new PredictionColumn[]{PredictionColumn.YHAT,
            PredictionColumn.OBSERVED_LOWER, PredictionColumn.OBSERVED_UPPER, PredictionColumn.TREND}) {
            for (double value : table.column(column)) {
                assertTrue(value >= 0.0 && value <= 1.0, column + " = " + value);
            }
        }
    }

    @Test
    void binomialBoundsRespectTheCapacity() {
        TimeSeries series = SeriesFixtures.poissonCounts(60, 10.0, 13L);
        ForecastConfig config = ForecastConfig.builder("binomial").nChangepoints(2).trendSamples(50)
            .capacityMode(CapacityMode.CONSTANT).capacityValue(40.0).seed(2L).build();
        Forecaster forecaster = Forecaster.builder(config).build();
        forecaster.fit(series);
        PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(20, false));
        for (double value : table.column(PredictionColumn.OBSERVED_UPPER)) {
            assertTrue(value <= 40.0, "upper " + value);
        }
        for (double value : table.column(PredictionColumn.OBSERVED_LOWER)) {
            assertTrue(value >= 0.0, "lower " + value);
        }
    }

    @Test
    void binomialWithoutCapacityIsRejected() {
        Forecaster forecaster = Forecaster.builder(ForecastConfig.builder("binomial").build()).build();
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
            () -> forecaster.fit(SeriesFixtures.poissonCounts(30, 5.0, 1L)));
        assertEquals(ConfigurationErrorKind.MISSING_CAPACITY, e.getKind());
        assertFalse(forecaster.isFitted());
    }

    @Test
    void negativeCountsDoNotMatchPoisson() {
        TimeSeries series = SeriesFixtures.dailySeries(20, i -> i == 7 ? -1.0 : 3.0);
        Forecaster forecaster = Forecaster.builder(poisson().build()).build();
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
            () -> forecaster.fit(series));
        assertEquals(ConfigurationErrorKind.DOMAIN_MISMATCH, e.getKind());
    }

    @Test
    void externalRegressorsMustBeSuppliedAtPrediction() {
        int n = 60;
        double[] load = new double[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            load[i] = i % 3;
            values[i] = 5.0 + 2.0 * load[i] + 0.1 * Math.sin(i);
        }
        TimeSeries series = TimeSeries.of(SeriesFixtures.daily(n), values, Map.of("load", load));
        ForecastConfig config = ForecastConfig.builder("normal").nChangepoints(2).trendSamples(50).seed(6L).build();
        Forecaster forecaster = Forecaster.builder(config).addRegressor("load").build();
        FittedForecastModel model = forecaster.fit(series);

        ForecastConfigurationException noFuture = assertThrows(ForecastConfigurationException.class,
            () -> model.makeFutureFrame(5, false));
        assertEquals(ConfigurationErrorKind.MISSING_REGRESSOR, noFuture.getKind());

        List<Instant> future = SeriesFixtures.daily(SeriesFixtures.START.plus(Duration.ofDays(n)), 3);
        ForecastConfigurationException missing = assertThrows(ForecastConfigurationException.class,
            () -> model.predict(PredictionFrame.of(future)));
        assertEquals(ConfigurationErrorKind.MISSING_REGRESSOR, missing.getKind());

        PredictionTable table = model.predict(PredictionFrame.of(future, Map.of("load", new double[]{0.0, 1.0, 2.0})));
        double[] yhat = table.column(PredictionColumn.YHAT);
        assertTrue(yhat[2] - yhat[0] > 3.0, "regressor effect " + (yhat[2] - yhat[0]));
        assertTrue(table.components().containsKey("load"));
    }

    @Test
    void predictionBeforeFitIsRejected() {
        Forecaster forecaster = Forecaster.builder(poisson().build()).build();
        assertFalse(forecaster.isFitted());
        assertThrows(ModelNotFittedException.class, forecaster::getFitted);
        assertThrows(ModelNotFittedException.class, () -> forecaster.makeFutureFrame(3, false));
        assertThrows(ModelNotFittedException.class,
            () -> forecaster.predict(PredictionFrame.of(SeriesFixtures.daily(3))));
    }

    @Test
    void invalidIntervalWidthIsRejectedPerCall() {
        Forecaster forecaster = Forecaster.builder(poisson().build()).build();
        FittedForecastModel model = forecaster.fit(SeriesFixtures.poissonCounts(30, 6.0, 2L));
        PredictionFrame frame = model.makeFutureFrame(2, false);
        for (double width : new double[]{0.0, 1.0, -0.2, Double.NaN}) {
            ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
                () -> model.predict(frame, width));
            assertEquals(ConfigurationErrorKind.INVALID_PARAMETER, e.getKind());
        }
    }

    @Test
    void sameSeedGivesIdenticalPredictions() {
        ForecastConfig config = ForecastConfig.builder("normal").nChangepoints(3).useLaplace(true)
            .laplaceSamples(50).trendSamples(100).parallel(false).seed(77L).build();
        TimeSeries series = SeriesFixtures.weeklyRamp(42);
        PredictionTable first = Forecaster.builder(config).build().fit(series).predict(series.frame());
        PredictionTable second = Forecaster.builder(config).build().fit(series).predict(series.frame());
        for (PredictionColumn column : PredictionColumn.values()) {
            assertArrayEquals(first.column(column), second.column(column), column.columnName());
        }
    }

    @Test
    void zeroTrendSamplesGivesFlatTrendBounds() {
        Forecaster forecaster = Forecaster.builder(poisson().nChangepoints(3).trendSamples(0).build()).build();
        forecaster.fit(SeriesFixtures.poissonCounts(40, 9.0, 17L));
        PredictionTable table = forecaster.predict(forecaster.makeFutureFrame(15, false));
        assertArrayEquals(table.column(PredictionColumn.TREND), table.column(PredictionColumn.TREND_UPPER));
        assertArrayEquals(table.column(PredictionColumn.TREND), table.column(PredictionColumn.TREND_LOWER));
    }

    @Test
    void futureFrameContinuesAtTheSamplingPeriod() {
        FittedForecastModel model = Forecaster.builder(poisson().build()).build()
            .fit(SeriesFixtures.poissonCounts(30, 6.0, 2L));
        assertEquals(Duration.ofDays(1), model.getSamplingPeriod());

        PredictionFrame future = model.makeFutureFrame(4, false);
        assertEquals(4, future.size());
        assertEquals(SeriesFixtures.START.plus(Duration.ofDays(30)), future.timestamp(0));
        assertEquals(SeriesFixtures.START.plus(Duration.ofDays(33)), future.timestamp(3));

        PredictionFrame withHistory = model.makeFutureFrame(4, true);
        assertEquals(34, withHistory.size());
        assertEquals(SeriesFixtures.START, withHistory.timestamp(0));
        assertEquals(0, model.makeFutureFrame(0, false).size());
        assertThrows(IllegalArgumentException.class, () -> model.makeFutureFrame(-1, false));
    }

    @Test
    void configuredSamplingPeriodOverridesInference() {
        ForecastConfig config = poisson().samplingPeriod(Duration.ofHours(12)).build();
        FittedForecastModel model = Forecaster.builder(config).build().fit(SeriesFixtures.poissonCounts(20, 4.0, 9L));
        assertEquals(Duration.ofHours(12), model.getSamplingPeriod());
        assertEquals(SeriesFixtures.START.plus(Duration.ofDays(19)).plus(Duration.ofHours(12)),
            model.makeFutureFrame(1, false).timestamp(0));
    }

    @Test
    void explicitChangepointsAreKept() {
        List<Instant> changepoints = List.of(SeriesFixtures.START.plus(Duration.ofDays(10)),
            SeriesFixtures.START.plus(Duration.ofDays(25)));
        ForecastConfig config = poisson().changepoints(changepoints).build();
        FittedForecastModel model = Forecaster.builder(config).build().fit(SeriesFixtures.poissonCounts(40, 6.0, 3L));
        List<Instant> fitted = model.changepointInstants();
        assertEquals(2, fitted.size());
        for (int j = 0; j < fitted.size(); j++) {
            long drift = Math.abs(Duration.between(changepoints.get(j), fitted.get(j)).toMillis());
            assertTrue(drift < 1000, "changepoint " + j + " drifted " + drift + "ms");
        }
    }

    @Test
    void samplingPeriodIsTheMedianSpacing() {
        double day = 86_400.0;
        assertEquals(Duration.ofDays(1), Forecaster.inferSamplingPeriod(new double[]{0, day, 2 * day, 3 * day}));
        assertEquals(Duration.ofDays(1),
            Forecaster.inferSamplingPeriod(new double[]{0, day, 2 * day, 9 * day, 10 * day}));
        assertEquals(Duration.ofHours(36), Forecaster.inferSamplingPeriod(new double[]{0, day, 4 * day, 5.5 * day}));
    }

    @Test
    void gammaFitFollowsAPositiveRamp() {
        TimeSeries series = SeriesFixtures.weeklyRamp(70);
        ForecastConfig config = ForecastConfig.builder("gamma").nChangepoints(3).trendSamples(50).seed(8L).build();
        FittedForecastModel model = Forecaster.builder(config).addSeasonality(Seasonality.weekly()).build().fit(series);
        assertTrue(model.getParameters().getKappa() >= ParameterLayout.DISPERSION_FLOOR);

        PredictionTable history = model.predict(series.frame());
        double[] yhat = history.column(PredictionColumn.YHAT);
        for (int i = 0; i < yhat.length; i++) {
            assertEquals(series.values()[i], yhat[i], 1.5, "row " + i);
        }
        PredictionTable future = model.predict(model.makeFutureFrame(14, false));
        for (double value : future.column(PredictionColumn.OBSERVED_LOWER)) {
            assertTrue(value > 0.0, "lower " + value);
        }
    }

    @Test
    void negativeBinomialBoundsAreCountsAroundTheRate() {
        ForecastConfig config = ForecastConfig.builder("negative_binomial").nChangepoints(2).trendSamples(50)
            .seed(12L).build();
        Forecaster forecaster = Forecaster.builder(config).build();
        FittedForecastModel model = forecaster.fit(SeriesFixtures.poissonCounts(90, 15.0, 5L));
        PredictionTable table = model.predict(model.makeFutureFrame(20, false));
        double[] yhat = table.column(PredictionColumn.YHAT);
        double[] lower = table.column(PredictionColumn.OBSERVED_LOWER);
        double[] upper = table.column(PredictionColumn.OBSERVED_UPPER);
        for (int i = 0; i < yhat.length; i++) {
            assertEquals(15.0, yhat[i], 2.5, "row " + i);
            assertEquals(Math.rint(lower[i]), lower[i], 0.0);
            assertEquals(Math.rint(upper[i]), upper[i], 0.0);
            assertTrue(lower[i] >= 0.0 && lower[i] < yhat[i] && yhat[i] < upper[i], "row " + i);
        }
    }

    @Test
    void betaBinomialBoundsRespectTheCapacity() {
        TimeSeries series = SeriesFixtures.dailySeries(60, i -> 12.0 + (i % 7 == 0 ? 6.0 : 0.0) + (i % 3));
        ForecastConfig config = ForecastConfig.builder("beta_binomial").nChangepoints(2).trendSamples(50)
            .capacityMode(CapacityMode.CONSTANT).capacityValue(30.0).seed(3L).build();
        FittedForecastModel model = Forecaster.builder(config).build().fit(series);
        PredictionTable table = model.predict(model.makeFutureFrame(21, true));
        for (PredictionColumn column : new PredictionColumn[]{PredictionColumn.YHAT,
            PredictionColumn.OBSERVED_LOWER, PredictionColumn.OBSERVED_UPPER}) {
            for (double value : table.column(column)) {
                assertTrue(value >= 0.0 && value <= 30.0, column + " = " + value);
            }
        }
    }

    @Test
    void laplaceFitsNegativeBinomialCountsWithSeasonality() {
        ForecastConfig config = ForecastConfig.builder("negative_binomial").useLaplace(true).laplaceSamples(100)
            .trendSamples(50).seed(5L).build();
        FittedForecastModel model = Forecaster.builder(config).addSeasonality(Seasonality.weekly()).build()
            .fit(SeriesFixtures.poissonCounts(90, 15.0, 5L));
        assertTrue(model.getDraws().isPresent());
        assertTrue(model.getParameters().getKappa() >= ParameterLayout.DISPERSION_FLOOR);

        PredictionTable table = model.predict(model.makeFutureFrame(14, true));
        for (PredictionColumn column : PredictionColumn.values()) {
            for (double value : table.column(column)) {
                assertTrue(Double.isFinite(value), column + " = " + value);
            }
        }
        double[] yhat = table.column(PredictionColumn.YHAT);
        double[] lower = table.column(PredictionColumn.YHAT_LOWER);
        double[] upper = table.column(PredictionColumn.YHAT_UPPER);
        for (int i = 0; i < yhat.length; i++) {
            assertTrue(lower[i] <= yhat[i] && yhat[i] <= upper[i], "row " + i);
        }
    }

    @Test
    void laplaceFitsGammaWithSeasonality() {
        ForecastConfig config = ForecastConfig.builder("gamma").nChangepoints(4).useLaplace(true)
            .laplaceSamples(100).trendSamples(0).seed(9L).build();
        FittedForecastModel model = Forecaster.builder(config).addSeasonality(Seasonality.weekly()).build()
            .fit(SeriesFixtures.weeklyRamp(63));
        assertTrue(model.getDraws().isPresent());
        PredictionTable table = model.predict(model.makeFutureFrame(7, true));
        double[] lower = table.column(PredictionColumn.YHAT_LOWER);
        double[] upper = table.column(PredictionColumn.YHAT_UPPER);
        boolean someWidth = false;
        for (int i = 0; i < lower.length; i++) {
            assertTrue(Double.isFinite(lower[i]) && Double.isFinite(upper[i]), "row " + i);
            someWidth |= upper[i] > lower[i];
        }
        assertTrue(someWidth);
    }

    @Test
    void exactLinearProportionsConvergeUnderTheNormalFamily() {
        TimeSeries series = SeriesFixtures.dailySeries(90, i -> 0.1 + 0.85 * i / 89.0);
        ForecastConfig config = ForecastConfig.builder("normal").trendSamples(0).seed(1L).build();
        FittedForecastModel model = Forecaster.builder(config).addSeasonality(Seasonality.weekly()).build().fit(series);
        assertTrue(model.getParameters().getKappa() >= ParameterLayout.DISPERSION_FLOOR);

        double[] yhat = model.predict(series.frame()).column(PredictionColumn.YHAT);
        for (int i = 0; i < yhat.length; i++) {
            assertEquals(series.values()[i], yhat[i], 0.02, "row " + i);
        }
    }

    @Test
    void betaStaysInsideTheUnitIntervalWhereNormalExtrapolatesPastIt() {
        TimeSeries series = SeriesFixtures.dailySeries(90, i -> 0.1 + 0.85 * i / 89.0 + 0.02 * Math.sin(1.7 * i));
        PredictionTable normal = fitAndForecast(ForecastConfig.builder("normal"), series);
        PredictionTable beta = fitAndForecast(ForecastConfig.builder("beta"), series);

        for (PredictionColumn column : new PredictionColumn[]{PredictionColumn.YHAT,
            PredictionColumn.OBSERVED_LOWER, PredictionColumn.OBSERVED_UPPER}) {
            for (double value : beta.column(column)) {
                assertTrue(value >= 0.0 && value <= 1.0, column + " = " + value);
            }
        }
        double[] normalUpper = normal.column(PredictionColumn.OBSERVED_UPPER);
        assertTrue(normalUpper[normalUpper.length - 1] > 1.0, "normal upper " + normalUpper[normalUpper.length - 1]);
    }

    private static PredictionTable fitAndForecast(ForecastConfig.Builder builder, TimeSeries series) {
        FittedForecastModel model = Forecaster.builder(builder.nChangepoints(3).trendSamples(50).seed(14L).build())
            .build().fit(series);
        return model.predict(model.makeFutureFrame(60, true));
    }

    @Test
    void componentsAreCopies() {
        Forecaster forecaster = Forecaster.builder(poisson().build()).addSeasonality(Seasonality.weekly()).build();
        FittedForecastModel model = forecaster.fit(SeriesFixtures.poissonCounts(42, 10.0, 4L));
        PredictionTable table = model.predict(model.makeFutureFrame(7, false));
        double before = table.components().get("weekly")[0];
        table.components().get("weekly")[0] = before + 100.0;
        assertEquals(before, table.components().get("weekly")[0]);
        assertThrows(UnsupportedOperationException.class, () -> table.components().remove("weekly"));
    }
}
