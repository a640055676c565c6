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

import io.nosqlbench.forecast.series.PredictionFrame;

import java.util.List;

/**
 * A named group of design-matrix columns: a seasonality, an event or an external
 * regressor. Columns are a pure function of the frame and the scaling context, so the
 * same component re-evaluates at any horizon.
 */
public interface DesignComponent {

    String getName();

    /**
     * @return the column names, in the order {@link #evaluate} fills them
     */
    List<String> columnNames();

    /**
     * Returns the prior scale of this component's coefficients.
     *
     * @param defaults the configured default scales
     * @return the explicit scale of the component, or the matching default
     */
    double priorScale(PriorScaleDefaults defaults);

    /**
     * Evaluates the columns at every row of a frame.
     *
     * @param frame the timestamps, and regressor values where needed
     * @param scaling the scaling context of the fitted series
     * @return one array per column, each of length {@code frame.size()}
     */
    double[][] evaluate(PredictionFrame frame, ScalingContext scaling);
}
