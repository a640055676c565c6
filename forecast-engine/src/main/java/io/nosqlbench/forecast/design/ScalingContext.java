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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;
import io.nosqlbench.forecast.family.LikelihoodFamily;
import io.nosqlbench.forecast.series.TimeSeries;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-series scalars that map raw inputs into the normalized space the model is fit in,
 * and back.
 *
 * <h2>Time</h2>
 *
 * <pre>{@code
 * t = (epochSeconds - timeOffset) / timeScale       first row -> 0, last row -> 1
 * }</pre>
 *
 * <h2>Response</h2>
 *
 * <p>The response is never rescaled itself. Instead the linear predictor is mapped to the
 * family's linked scale:
 *
 * <pre>{@code
 * eta = linkedOffset + linkedScale * (trend + X * beta)
 * }</pre>
 *
 * where {@code linkedOffset} and {@code linkedScale} are the minimum and range of the
 * family's scaling transform of the observations.
 *
 * <h2>Regressors</h2>
 *
 * <p>Each external regressor is range-scaled with its training minimum and range.
 *
 * <p>Instances are immutable and owned by one fitted model.
 */
public final class ScalingContext {

    private final double timeOffset;
    private final double timeScale;
    private final double linkedOffset;
    private final double linkedScale;
    private final Map<String, RegressorScaling> regressors;

    public ScalingContext(double timeOffset, double timeScale, double linkedOffset, double linkedScale,
                          Map<String, RegressorScaling> regressors) {
        if (!(timeScale > 0) || !(linkedScale > 0)) {
            throw new IllegalArgumentException("scales must be positive: time=" + timeScale + ", linked=" + linkedScale);
        }
        this.timeOffset = timeOffset;
        this.timeScale = timeScale;
        this.linkedOffset = linkedOffset;
        this.linkedScale = linkedScale;
        this.regressors = Collections.unmodifiableMap(new LinkedHashMap<>(regressors));
    }

    /**
     * Computes the scaling context of a training series.
     *
     * @param series the training series, already validated against the family
     * @param family the likelihood family supplying the scaling transform
     * @param regressorNames the external regressors the model uses
     * @return the scaling context
     * @throws ForecastConfigurationException {@code DEGENERATE_SERIES} for fewer than two rows
     *     or a constant transformed response, {@code CONSTANT_REGRESSOR} for a constant regressor
     */
    public static ScalingContext compute(TimeSeries series, LikelihoodFamily family, Collection<String> regressorNames) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(family, "family cannot be null");
        if (series.size() < 2) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.DEGENERATE_SERIES,
                "at least two observations are needed, got " + series.size());
        }
        double[] seconds = series.epochSeconds();
        double timeOffset = seconds[0];
        double timeScale = seconds[seconds.length - 1] - timeOffset;
        if (!(timeScale > 0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.DEGENERATE_SERIES,
                "training span is zero");
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double y : series.values()) {
            double linked = family.scalingTransform(y);
            min = Math.min(min, linked);
            max = Math.max(max, linked);
        }
        if (!(max - min > 0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.DEGENERATE_SERIES,
                "the " + family.getTag() + " response is constant on the linked scale");
        }

        Map<String, RegressorScaling> regressors = new LinkedHashMap<>();
        for (String name : regressorNames) {
            regressors.put(name, RegressorScaling.of(name, series.regressor(name)));
        }
        return new ScalingContext(timeOffset, timeScale, min, max - min, regressors);
    }

    public double getTimeOffset() {
        return timeOffset;
    }

    public double getTimeScale() {
        return timeScale;
    }

    public double getLinkedOffset() {
        return linkedOffset;
    }

    public double getLinkedScale() {
        return linkedScale;
    }

    public double normalizeTime(double epochSeconds) {
        return (epochSeconds - timeOffset) / timeScale;
    }

    public double[] normalizeTimes(double[] epochSeconds) {
        double[] t = new double[epochSeconds.length];
        for (int i = 0; i < t.length; i++) {
            t[i] = normalizeTime(epochSeconds[i]);
        }
        return t;
    }

    public double denormalizeTime(double t) {
        return timeOffset + t * timeScale;
    }

    /**
     * Maps a normalized additive value to the linked scale.
     *
     * @param normalized trend plus regression terms in normalized units
     * @return the linear predictor {@code eta}
     */
    public double toLinked(double normalized) {
        return linkedOffset + linkedScale * normalized;
    }

    public double fromLinked(double eta) {
        return (eta - linkedOffset) / linkedScale;
    }

    /**
     * @param name a regressor the model was trained with
     * @return its scaling
     * @throws ForecastConfigurationException {@code MISSING_REGRESSOR} for an unknown name
     */
    public RegressorScaling regressor(String name) {
        RegressorScaling scaling = regressors.get(name);
        if (scaling == null) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_REGRESSOR,
                "no scaling for regressor '" + name + "'");
        }
        return scaling;
    }

    public Map<String, RegressorScaling> getRegressors() {
        return regressors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScalingContext)) {
            return false;
        }
        ScalingContext that = (ScalingContext) o;
        return Double.compare(timeOffset, that.timeOffset) == 0
            && Double.compare(timeScale, that.timeScale) == 0
            && Double.compare(linkedOffset, that.linkedOffset) == 0
            && Double.compare(linkedScale, that.linkedScale) == 0
            && regressors.equals(that.regressors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeOffset, timeScale, linkedOffset, linkedScale, regressors);
    }

    @Override
    public String toString() {
        return "ScalingContext{timeOffset=" + timeOffset + ", timeScale=" + timeScale
            + ", linkedOffset=" + linkedOffset + ", linkedScale=" + linkedScale
            + ", regressors=" + regressors.keySet() + '}';
    }

    /**
     * Range scaling of one external regressor: {@code (x - min) / range}.
     */
    public static final class RegressorScaling {
        private final double min;
        private final double range;

        public RegressorScaling(double min, double range) {
            if (!(range > 0)) {
                throw new IllegalArgumentException("range must be positive, got " + range);
            }
            this.min = min;
            this.range = range;
        }

        static RegressorScaling of(String name, double[] values) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            if (!(max - min > 0)) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.CONSTANT_REGRESSOR,
                    "regressor '" + name + "' is constant over the training span");
            }
            return new RegressorScaling(min, max - min);
        }

        public double getMin() {
            return min;
        }

        public double getRange() {
            return range;
        }

        public double normalize(double value) {
            return (value - min) / range;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RegressorScaling)) {
                return false;
            }
            RegressorScaling that = (RegressorScaling) o;
            return Double.compare(min, that.min) == 0 && Double.compare(range, that.range) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(min, range);
        }
    }
}
