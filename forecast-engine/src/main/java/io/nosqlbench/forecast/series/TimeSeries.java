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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An observed metric: strictly increasing timestamps, one value per timestamp, and any
 * external regressor columns observed alongside.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * TimeSeries series = TimeSeries.builder()
 *     .add(Instant.parse("2024-01-01T00:00:00Z"), 12)
 *     .add(Instant.parse("2024-01-02T00:00:00Z"), 15)
 *     .build();
 * }</pre>
 *
 * <p>Whether the values fit the chosen family (integers for count families, [0, 1] for
 * proportions) is checked by the family when fitting, not here.
 */
public final class TimeSeries {

    private final PredictionFrame frame;
    private final double[] values;

    private TimeSeries(PredictionFrame frame, double[] values) {
        this.frame = frame;
        this.values = values;
    }

    /**
     * Creates a series from parallel lists.
     *
     * @param timestamps strictly increasing timestamps
     * @param values one value per timestamp
     * @return the series
     */
    public static TimeSeries of(List<Instant> timestamps, double[] values) {
        return of(timestamps, values, Map.of());
    }

    /**
     * Creates a series with regressor columns.
     *
     * @param timestamps strictly increasing timestamps
     * @param values one value per timestamp
     * @param regressors regressor columns keyed by name
     * @return the series
     */
    public static TimeSeries of(List<Instant> timestamps, double[] values, Map<String, double[]> regressors) {
        Objects.requireNonNull(values, "values cannot be null");
        PredictionFrame frame = PredictionFrame.of(timestamps, regressors);
        if (values.length != frame.size()) {
            throw new IllegalArgumentException("Got " + values.length + " values for " + frame.size() + " timestamps");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.DOMAIN_MISMATCH,
                    "value at row " + i + " is not finite: " + values[i]);
            }
        }
        return new TimeSeries(frame, values.clone());
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return values.length;
    }

    public double value(int row) {
        return values[row];
    }

    public double[] values() {
        return values.clone();
    }

    public Instant timestamp(int row) {
        return frame.timestamp(row);
    }

    public List<Instant> timestamps() {
        return frame.timestamps();
    }

    public double[] epochSeconds() {
        return frame.epochSeconds();
    }

    public double[] regressor(String name) {
        return frame.regressor(name);
    }

    /**
     * Returns the timestamps and regressor columns of this series as a frame, for
     * in-sample prediction.
     *
     * @return the frame view of this series
     */
    public PredictionFrame frame() {
        return frame;
    }

    /**
     * Incrementally assembles a {@link TimeSeries}.
     */
    public static final class Builder {
        private final List<Instant> timestamps = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
        private final Map<String, List<Double>> regressors = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(Instant timestamp, double value) {
            timestamps.add(timestamp);
            values.add(value);
            return this;
        }

        /**
         * Adds an observation together with regressor values for the same row.
         *
         * @param timestamp the timestamp
         * @param value the metric value
         * @param regressorValues regressor values keyed by name
         * @return this builder
         */
        public Builder add(Instant timestamp, double value, Map<String, Double> regressorValues) {
            int row = timestamps.size();
            add(timestamp, value);
            for (Map.Entry<String, Double> entry : regressorValues.entrySet()) {
                List<Double> column = regressors.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
                if (column.size() != row) {
                    throw new IllegalArgumentException("Regressor '" + entry.getKey() + "' is missing values before row " + row);
                }
                column.add(entry.getValue());
            }
            return this;
        }

        public TimeSeries build() {
            double[] raw = values.stream().mapToDouble(Double::doubleValue).toArray();
            Map<String, double[]> columns = new LinkedHashMap<>();
            regressors.forEach((name, column) -> columns.put(name, column.stream().mapToDouble(Double::doubleValue).toArray()));
            return TimeSeries.of(timestamps, raw, columns);
        }
    }
}
