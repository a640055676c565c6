package io.nosqlbench.forecast.design;

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
import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.family.NormalFamily;
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class DesignMatrixBuilderTest {

    private static final PriorScaleDefaults DEFAULTS = new PriorScaleDefaults(3.0, 5.0);

    private static ScalingContext scaling(TimeSeries series, List<String> regressors) {
        return ScalingContext.compute(series, new NormalFamily(), regressors);
    }

    @Test
    void seasonalityColumnsAreInterleavedFourierTerms() {
        Seasonality weekly = Seasonality.weekly();
        assertThat(weekly.columnNames()).containsExactly(
            "weekly_sin1", "weekly_cos1", "weekly_sin2", "weekly_cos2", "weekly_sin3", "weekly_cos3");
        PredictionFrame frame = PredictionFrame.of(SeriesFixtures.daily(15));
        double[][] columns = weekly.evaluate(frame, null);
        for (int j = 0; j < columns.length; j++) {
            assertThat(columns[j][0]).isCloseTo(columns[j][7], within(1e-9));
            assertThat(columns[j][3]).isCloseTo(columns[j][14], within(1e-9));
        }
        for (int i = 0; i < 15; i++) {
            double sin = columns[0][i];
            double cos = columns[1][i];
            assertThat(sin * sin + cos * cos).isCloseTo(1.0, within(1e-12));
        }
    }

    @Test
    void seasonalityValidatesItsShape() {
        assertThatThrownBy(() -> new Seasonality("bad", 0.0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Seasonality("bad", 7.0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Seasonality.yearly().getOrder()).isEqualTo(10);
    }

    @Test
    void boxEventCoversItsWidth() {
        Event promo = Event.single("promo", new BoxProfile(Duration.ofDays(2)), Instant.parse("2024-01-04T00:00:00Z"));
        double[] column = promo.evaluate(PredictionFrame.of(SeriesFixtures.daily(8)), null)[0];
        assertThat(column).containsExactly(0, 0, 0, 1, 1, 0, 0, 0);
    }

    @Test
    void periodicEventRepeats() {
        Event payday = Event.periodic("payday", new BoxProfile(Duration.ofDays(1)),
            Instant.parse("2024-01-02T00:00:00Z"), Duration.ofDays(7));
        double[] column = payday.evaluate(PredictionFrame.of(SeriesFixtures.daily(16)), null)[0];
        for (int i = 0; i < column.length; i++) {
            assertThat(column[i]).isEqualTo(i % 7 == 1 ? 1.0 : 0.0);
        }
        assertThat(payday.isPeriodic()).isTrue();
        assertThat(payday.getOccurrences()).isEmpty();
    }

    @Test
    void gaussianAndCauchyProfilesPeakAtTheOccurrence() {
        GaussianProfile gaussian = new GaussianProfile(Duration.ofHours(12));
        CauchyProfile cauchy = new CauchyProfile(Duration.ofHours(12));
        assertThat(gaussian.value(0.0)).isEqualTo(1.0);
        assertThat(cauchy.value(0.0)).isEqualTo(1.0);
        assertThat(gaussian.value(43200.0)).isCloseTo(Math.exp(-0.5), within(1e-12));
        assertThat(cauchy.value(43200.0)).isCloseTo(0.2, within(1e-12));
        assertThat(gaussian.value(-43200.0)).isEqualTo(gaussian.value(43200.0));
        assertThat(cauchy.reach()).isGreaterThan(gaussian.reach());
    }

    @Test
    void intermittentOccurrencesAdd() {
        Event sale = Event.intermittent("sale", new BoxProfile(Duration.ofDays(3)),
            List.of(Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-03T00:00:00Z")));
        double[] column = sale.evaluate(PredictionFrame.of(SeriesFixtures.daily(6)), null)[0];
        assertThat(column).containsExactly(0, 1, 2, 2, 1, 0);
    }

    @Test
    void builderConcatenatesComponentsWithPriorScales() {
        TimeSeries series = TimeSeries.of(SeriesFixtures.daily(10), new double[]{1, 3, 2, 5, 4, 6, 5, 8, 7, 9},
            Map.of("price", new double[]{5, 6, 7, 8, 9, 10, 11, 12, 13, 15}));
        Seasonality weekly = new Seasonality("weekly", 7.0, 2, 0.5);
        Event event = Event.single("launch", new BoxProfile(Duration.ofDays(1)), Instant.parse("2024-01-05T00:00:00Z"));
        ExternalRegressor price = new ExternalRegressor("price");
        DesignMatrixBuilder builder = new DesignMatrixBuilder(List.of(weekly, event, price), DEFAULTS);

        DesignMatrix design = builder.buildTraining(series.frame(), scaling(series, List.of("price")));
        assertThat(design.rows()).isEqualTo(10);
        assertThat(design.columns()).isEqualTo(6);
        assertThat(design.names()).containsExactly(
            "weekly_sin1", "weekly_cos1", "weekly_sin2", "weekly_cos2", "launch", "price");
        assertThat(design.priorScale(0)).isEqualTo(0.5);
        assertThat(design.priorScale(4)).isEqualTo(5.0);
        assertThat(design.priorScale(5)).isEqualTo(5.0);
        assertThat(design.componentRange("launch")).containsExactly(4, 5);
        assertThat(design.column(5)[0]).isEqualTo(0.0);
        assertThat(design.column(5)[9]).isEqualTo(1.0);
        assertThat(design.column(4)[4]).isEqualTo(1.0);

        double[] beta = {1, 0, 0, 0, 2, 3};
        assertThat(design.dot(4, beta)).isCloseTo(design.get(4, 0) + 2.0 + 3.0 * design.get(4, 5), within(1e-12));
        assertThat(design.dot(4, beta, "launch")).isEqualTo(2.0);
    }

    @Test
    void regressorValuesOutsideTheTrainingRangeExtrapolate() {
        TimeSeries series = TimeSeries.of(SeriesFixtures.daily(3), new double[]{1, 2, 3},
            Map.of("price", new double[]{10, 20, 30}));
        ScalingContext scaling = scaling(series, List.of("price"));
        PredictionFrame future = PredictionFrame.of(SeriesFixtures.daily(SeriesFixtures.START.plus(Duration.ofDays(3)), 1),
            Map.of("price", new double[]{40}));
        assertThat(new ExternalRegressor("price").evaluate(future, scaling)[0][0]).isEqualTo(1.5);
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> new DesignMatrixBuilder(List.of(Seasonality.weekly(), Seasonality.weekly()), DEFAULTS))
            .isInstanceOfSatisfying(ForecastConfigurationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ConfigurationErrorKind.INVALID_PARAMETER));
    }

    @Test
    void emptyDesignHasNoColumns() {
        DesignMatrix design = new DesignMatrixBuilder(List.of(), DEFAULTS)
            .build(PredictionFrame.of(SeriesFixtures.daily(4)), null);
        assertThat(design.columns()).isZero();
        assertThat(design.dot(2, new double[0])).isZero();
        assertThat(DesignMatrix.empty(4).rows()).isEqualTo(4);
    }
}
