package io.nosqlbench.forecast.uncertainty;

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

import io.nosqlbench.forecast.trend.PiecewiseLinearTrend;
import io.nosqlbench.forecast.trend.TrendParameters;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TrendUncertaintySimulatorTest {

    private static final double[] CHANGEPOINTS = {0.2, 0.4, 0.6};
    private static final TrendParameters BASE = new TrendParameters(0.3, 0.1, new double[]{0.2, -0.1, 0.15});

    private static double[] horizonTimes() {
        double[] t = new double[31];
        for (int i = 0; i < t.length; i++) {
            t[i] = 0.1 * i;
        }
        return t;
    }

    @Test
    void pathsMatchTheBaseTrendInsideTheTrainingSpan() {
        double[] t = horizonTimes();
        double[][] paths = new TrendUncertaintySimulator(false)
            .simulate(List.of(BASE), CHANGEPOINTS, t, 50, RandomGenerators.create(1L));
        for (double[] path : paths) {
            for (int i = 0; i <= 10; i++) {
                assertEquals(PiecewiseLinearTrend.value(0.3, 0.1, CHANGEPOINTS, BASE.getDelta(), 3, t[i]), path[i], 1e-12);
            }
        }
    }

    @Test
    void bandWidensWithTheHorizon() {
        double[] t = horizonTimes();
        double[][] paths = new TrendUncertaintySimulator(true)
            .simulate(List.of(BASE), CHANGEPOINTS, t, 2000, RandomGenerators.create(2L));
        double[] lower = EmpiricalQuantiles.perRow(paths, 0.1);
        double[] upper = EmpiricalQuantiles.perRow(paths, 0.9);
        double atOne = upper[10] - lower[10];
        double atTwo = upper[20] - lower[20];
        double atThree = upper[30] - lower[30];
        assertEquals(0.0, atOne, 1e-12);
        assertTrue(atTwo > 0.0);
        assertTrue(atThree > atTwo, atTwo + " then " + atThree);
    }

    @Test
    void noChangepointsMeansNoTrendUncertainty() {
        double[] t = horizonTimes();
        TrendParameters straight = new TrendParameters(0.3, 0.1, new double[0]);
        double[][] paths = new TrendUncertaintySimulator(false)
            .simulate(List.of(straight), new double[0], t, 20, RandomGenerators.create(3L));
        for (double[] path : paths) {
            assertEquals(0.3 * 3.0 + 0.1, path[30], 1e-12);
        }
    }

    @Test
    void basesAreUsedRoundRobin() {
        double[] t = {0.0, 0.5, 1.0};
        TrendParameters other = new TrendParameters(-1.0, 2.0, new double[]{0.0, 0.0, 0.0});
        double[][] paths = new TrendUncertaintySimulator(false)
            .simulate(List.of(BASE, other), CHANGEPOINTS, t, 4, RandomGenerators.create(4L));
        assertEquals(0.1, paths[0][0], 1e-12);
        assertEquals(2.0, paths[1][0], 1e-12);
        assertEquals(0.1, paths[2][0], 1e-12);
        assertEquals(1.0, paths[3][2], 1e-12);
    }

    @Test
    void seededSimulationIsReproducibleAcrossThreading() {
        double[] t = horizonTimes();
        double[][] serial = new TrendUncertaintySimulator(false)
            .simulate(List.of(BASE), CHANGEPOINTS, t, 64, RandomGenerators.create(9L));
        double[][] parallel = new TrendUncertaintySimulator(true)
            .simulate(List.of(BASE), CHANGEPOINTS, t, 64, RandomGenerators.create(9L));
        assertArrayEquals(serial, parallel);
    }

    @Test
    void requiresABaseTrend() {
        assertThrows(IllegalArgumentException.class, () -> new TrendUncertaintySimulator(false)
            .simulate(List.of(), CHANGEPOINTS, horizonTimes(), 5, RandomGenerators.create(1L)));
    }
}
