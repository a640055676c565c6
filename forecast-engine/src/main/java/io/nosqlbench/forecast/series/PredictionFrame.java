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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The timestamps (and any external regressor columns) at which a fitted model is
/// evaluated. Timestamps must be strictly increasing.
///
/// Instances are immutable; accessors return copies of the underlying arrays.
public final class PredictionFrame {

    private final Instant[] timestamps;
    private final Map<String, double[]> regressors;

    PredictionFrame(Instant[] timestamps, Map<String, double[]> regressors) {
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        Objects.requireNonNull(regressors, "regressors cannot be null");
        requireStrictlyIncreasing(timestamps);
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : regressors.entrySet()) {
            double[] column = entry.getValue();
            if (column.length != timestamps.length) {
                throw new IllegalArgumentException("Regressor '" + entry.getKey() + "' has " + column.length
                    + " values for " + timestamps.length + " timestamps");
            }
            copy.put(entry.getKey(), column.clone());
        }
        this.timestamps = timestamps.clone();
        this.regressors = Collections.unmodifiableMap(copy);
    }

    /// Creates a frame of timestamps without regressor columns.
    ///
    /// @param timestamps strictly increasing timestamps
    /// @return the frame
    public static PredictionFrame of(List<Instant> timestamps) {
        return new PredictionFrame(timestamps.toArray(new Instant[0]), Map.of());
    }

    /// Creates a frame with regressor columns.
    ///
    /// @param timestamps strictly increasing timestamps
    /// @param regressors regressor columns keyed by name, each as long as the timestamps
    /// @return the frame
    public static PredictionFrame of(List<Instant> timestamps, Map<String, double[]> regressors) {
        return new PredictionFrame(timestamps.toArray(new Instant[0]), regressors);
    }

    public int size() {
        return timestamps.length;
    }

    public Instant timestamp(int row) {
        return timestamps[row];
    }

    public List<Instant> timestamps() {
        return Collections.unmodifiableList(Arrays.asList(timestamps));
    }

    /// Returns the timestamps as fractional seconds since the epoch.
    /// @return epoch seconds per row
    public double[] epochSeconds() {
        double[] seconds = new double[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            seconds[i] = toEpochSeconds(timestamps[i]);
        }
        return seconds;
    }

    public boolean hasRegressor(String name) {
        return regressors.containsKey(name);
    }

    /// Returns a copy of the named regressor column.
    ///
    /// @param name the regressor name
    /// @return the values, one per row
    /// @throws ForecastConfigurationException if the column is absent
    public double[] regressor(String name) {
        double[] column = regressors.get(name);
        if (column == null) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_REGRESSOR,
                "frame has no regressor column '" + name + "'; available: " + regressors.keySet());
        }
        return column.clone();
    }

    public List<String> regressorNames() {
        return new ArrayList<>(regressors.keySet());
    }

    Map<String, double[]> regressorMap() {
        return regressors;
    }

    /// Converts an instant to fractional epoch seconds.
    ///
    /// @param instant the instant
    /// @return seconds since 1970-01-01T00:00:00Z
    public static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }

    /// Converts fractional epoch seconds back to an instant, rounded to the nanosecond.
    ///
    /// @param epochSeconds seconds since the epoch
    /// @return the instant
    public static Instant fromEpochSeconds(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1e9);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    static void requireStrictlyIncreasing(Instant[] timestamps) {
        for (int i = 0; i < timestamps.length; i++) {
            Objects.requireNonNull(timestamps[i], "timestamp at row " + i + " cannot be null");
            if (i > 0 && !timestamps[i].isAfter(timestamps[i - 1])) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.NON_MONOTONIC_TIMESTAMPS,
                    "timestamp at row " + i + " (" + timestamps[i] + ") does not follow " + timestamps[i - 1]);
            }
        }
    }
}
