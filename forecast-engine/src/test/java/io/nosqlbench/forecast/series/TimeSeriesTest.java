package io.nosqlbench.forecast.series;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TimeSeriesTest {

    @Test
    void builderCollectsRowsAndRegressors() {
        TimeSeries series = TimeSeries.builder()
            .add(Instant.parse("2024-01-01T00:00:00Z"), 1.0, Map.of("temp", 3.0))
            .add(Instant.parse("2024-01-02T00:00:00Z"), 2.0, Map.of("temp", 4.0))
            .build();
        assertEquals(2, series.size());
        assertArrayEquals(new double[]{3.0, 4.0}, series.regressor("temp"));
        assertEquals(86400.0, series.epochSeconds()[1] - series.epochSeconds()[0], 0.0);
        assertTrue(series.frame().hasRegressor("temp"));
    }

    @Test
    void timestampsMustIncrease() {
        List<Instant> timestamps = List.of(SeriesFixtures.START, SeriesFixtures.START);
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
            () -> TimeSeries.of(timestamps, new double[]{1.0, 2.0}));
        assertEquals(ConfigurationErrorKind.NON_MONOTONIC_TIMESTAMPS, e.getKind());
    }

    @Test
    void valuesMustBeFinite() {
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
            () -> TimeSeries.of(SeriesFixtures.daily(2), new double[]{1.0, Double.NaN}));
        assertEquals(ConfigurationErrorKind.DOMAIN_MISMATCH, e.getKind());
    }

    @Test
    void lengthsMustAgree() {
        assertThrows(IllegalArgumentException.class, () -> TimeSeries.of(SeriesFixtures.daily(3), new double[]{1.0}));
        assertThrows(IllegalArgumentException.class,
            () -> PredictionFrame.of(SeriesFixtures.daily(3), Map.of("x", new double[]{1.0})));
    }

    @Test
    void missingRegressorIsReported() {
        PredictionFrame frame = PredictionFrame.of(SeriesFixtures.daily(3));
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
            () -> frame.regressor("price"));
        assertEquals(ConfigurationErrorKind.MISSING_REGRESSOR, e.getKind());
    }

    @Test
    void epochSecondConversionKeepsSubSecondPrecision() {
        Instant instant = Instant.parse("2024-05-06T07:08:09.250Z");
        assertEquals(instant, PredictionFrame.fromEpochSeconds(PredictionFrame.toEpochSeconds(instant)));
    }
}
