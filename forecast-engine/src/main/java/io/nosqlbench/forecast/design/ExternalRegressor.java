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
import java.util.Objects;

/// A caller-supplied covariate column, range-scaled with its training minimum and range.
public final class ExternalRegressor implements DesignComponent {

    private final String name;
    private final Double priorScale;

    public ExternalRegressor(String name, Double priorScale) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (priorScale != null && !(priorScale > 0)) {
            throw new IllegalArgumentException("prior scale must be positive, got " + priorScale);
        }
        this.priorScale = priorScale;
    }

    public ExternalRegressor(String name) {
        this(name, null);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> columnNames() {
        return List.of(name);
    }

    @Override
    public double priorScale(PriorScaleDefaults defaults) {
        return priorScale != null ? priorScale : defaults.getEvent();
    }

    @Override
    public double[][] evaluate(PredictionFrame frame, ScalingContext scaling) {
        double[] raw = frame.regressor(name);
        ScalingContext.RegressorScaling range = scaling.regressor(name);
        double[] column = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            column[i] = range.normalize(raw[i]);
        }
        return new double[][]{column};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExternalRegressor)) {
            return false;
        }
        ExternalRegressor that = (ExternalRegressor) o;
        return name.equals(that.name) && Objects.equals(priorScale, that.priorScale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, priorScale);
    }

    @Override
    public String toString() {
        return "ExternalRegressor{" + name + '}';
    }
}
