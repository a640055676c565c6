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

import io.nosqlbench.forecast.family.BetaFamily;
import io.nosqlbench.forecast.family.NormalFamily;
import io.nosqlbench.forecast.family.PoissonFamily;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DataVariabilityTest {

    @Test
    void quantileLevelsAreCentered() {
        QuantileLevels levels = QuantileLevels.of(0.8);
        assertEquals(0.1, levels.getLower(), 1e-12);
        assertEquals(0.9, levels.getUpper(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> QuantileLevels.of(0.0));
        assertThrows(IllegalArgumentException.class, () -> QuantileLevels.of(1.0));
    }

    @Test
    void normalBoundsAreUnbounded() {
        double[][] bounds = new DataVariability(new NormalFamily(), false)
            .bounds(new double[]{0.0, 0.01}, 5.0, QuantileLevels.of(0.95));
        assertTrue(bounds[0][0] < -9.0, "normal lower bound goes negative near zero");
    }

    @Test
    void betaBoundsStayInsideTheUnitInterval() {
        double[] eta = {-2.0, -1.0, 0.0, 1.0, 2.0};
        double[][] bounds = new DataVariability(new BetaFamily(0.25), true).bounds(eta, 0.1, QuantileLevels.of(0.95));
        for (int i = 0; i < eta.length; i++) {
            assertTrue(bounds[0][i] >= 0.0 && bounds[1][i] <= 1.0);
            assertTrue(bounds[0][i] <= bounds[1][i]);
        }
    }

    @Test
    void widerIntervalsContainNarrowerOnes() {
        DataVariability variability = new DataVariability(new PoissonFamily(), false);
        double[] eta = {Math.log(5.0), Math.log(50.0)};
        double[][] narrow = variability.bounds(eta, Double.NaN, QuantileLevels.of(0.5));
        double[][] wide = variability.bounds(eta, Double.NaN, QuantileLevels.of(0.95));
        for (int i = 0; i < eta.length; i++) {
            assertTrue(wide[0][i] <= narrow[0][i]);
            assertTrue(wide[1][i] >= narrow[1][i]);
        }
    }

    @Test
    void empiricalQuantilesInterpolate() {
        double[][] samples = {{1.0, 10.0}, {2.0, 20.0}, {3.0, 30.0}, {4.0, 40.0}, {5.0, 50.0}};
        assertArrayEquals(new double[]{3.0, 30.0}, EmpiricalQuantiles.perRow(samples, 0.5), 1e-12);
        assertArrayEquals(new double[]{1.4, 14.0}, EmpiricalQuantiles.perRow(samples, 0.1), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> EmpiricalQuantiles.perRow(new double[0][], 0.5));
    }
}
