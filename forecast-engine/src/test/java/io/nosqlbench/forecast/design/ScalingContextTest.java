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
import io.nosqlbench.forecast.family.BinomialFamily;
import io.nosqlbench.forecast.family.NormalFamily;
import io.nosqlbench.forecast.family.PoissonFamily;
import io.nosqlbench.forecast.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ScalingContextTest {

    @Test
    void normalizesTimeOverTheTrainingSpan() {
        TimeSeries series = SeriesFixtures.dailySeries(11, i -> i);
        ScalingContext scaling = ScalingContext.compute(series, new NormalFamily(), List.of());
        double[] t = scaling.normalizeTimes(series.epochSeconds());
        assertEquals(0.0, t[0], 0.0);
        assertEquals(1.0, t[10], 1e-12);
        assertEquals(0.5, t[5], 1e-12);
        assertEquals(series.epochSeconds()[3], scaling.denormalizeTime(t[3]), 1e-3);
    }

    @Test
    void linkedRangeMapsToUnitInterval() {
        TimeSeries series = SeriesFixtures.dailySeries(5, i -> 2.0 + 3.0 * i);
        ScalingContext scaling = ScalingContext.compute(series, new NormalFamily(), List.of());
        assertEquals(2.0, scaling.getLinkedOffset(), 0.0);
        assertEquals(12.0, scaling.getLinkedScale(), 0.0);
        assertEquals(14.0, scaling.toLinked(1.0), 1e-12);
        assertEquals(0.25, scaling.fromLinked(5.0), 1e-12);
    }

    @Test
    void countFamiliesUseTheContinuityCorrectedTransform() {
        TimeSeries series = SeriesFixtures.dailySeries(3, i -> i == 0 ? 0.0 : 9.0);
        ScalingContext scaling = ScalingContext.compute(series, new PoissonFamily(), List.of());
        assertEquals(Math.log(0.5), scaling.getLinkedOffset(), 1e-12);
        assertEquals(Math.log(9.5) - Math.log(0.5), scaling.getLinkedScale(), 1e-12);

        ScalingContext binomial = ScalingContext.compute(
            SeriesFixtures.dailySeries(3, i -> i * 5.0), new BinomialFamily(10), List.of());
        assertTrue(Double.isFinite(binomial.getLinkedOffset()));
        assertTrue(binomial.getLinkedScale() > 0);
    }

    @Test
    void degenerateSeriesAreRejected() {
        assertKind(ConfigurationErrorKind.DEGENERATE_SERIES,
            () -> ScalingContext.compute(SeriesFixtures.dailySeries(1, i -> 1.0), new NormalFamily(), List.of()));
        assertKind(ConfigurationErrorKind.DEGENERATE_SERIES,
            () -> ScalingContext.compute(SeriesFixtures.dailySeries(6, i -> 4.0), new NormalFamily(), List.of()));
    }

    @Test
    void regressorsAreRangeScaled() {
        TimeSeries series = TimeSeries.of(SeriesFixtures.daily(3), new double[]{1, 2, 4},
            Map.of("temp", new double[]{10, 20, 30}, "flat", new double[]{1, 1, 1}));
        ScalingContext scaling = ScalingContext.compute(series, new NormalFamily(), List.of("temp"));
        assertEquals(0.5, scaling.regressor("temp").normalize(20.0), 1e-12);
        assertKind(ConfigurationErrorKind.MISSING_REGRESSOR, () -> scaling.regressor("humidity"));
        assertKind(ConfigurationErrorKind.CONSTANT_REGRESSOR,
            () -> ScalingContext.compute(series, new NormalFamily(), List.of("flat")));
    }

    private static void assertKind(ConfigurationErrorKind kind, org.junit.jupiter.api.function.Executable executable) {
        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class, executable);
        assertEquals(kind, e.getKind());
    }
}
