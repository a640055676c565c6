package io.nosqlbench.forecast.trend;

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

import io.nosqlbench.forecast.design.ScalingContext;
import io.nosqlbench.forecast.family.LikelihoodFamily;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/// Starting point for the trend parameters: a least-squares line through the response on
/// the normalized linked scale, with every rate adjustment at zero.
public final class TrendInitializer {

    private TrendInitializer() {
    }

    public static TrendParameters initialize(double[] t, double[] observed, LikelihoodFamily family,
                                             ScalingContext scaling, int changepoints) {
        SimpleRegression regression = new SimpleRegression(true);
        double sum = 0.0;
        for (int i = 0; i < t.length; i++) {
            double y = scaling.fromLinked(family.scalingTransform(observed[i]));
            regression.addData(t[i], y);
            sum += y;
        }
        double k = regression.getSlope();
        double m = regression.getIntercept();
        if (!Double.isFinite(k) || !Double.isFinite(m)) {
            k = 0.0;
            m = sum / t.length;
        }
        return new TrendParameters(k, m, new double[changepoints]);
    }
}
