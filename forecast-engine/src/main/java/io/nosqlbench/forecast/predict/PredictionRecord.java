package io.nosqlbench.forecast.predict;

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

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// One row of a prediction.
public final class PredictionRecord {

    private final Instant timestamp;
    private final EnumMap<PredictionColumn, Double> values;

    PredictionRecord(Instant timestamp, EnumMap<PredictionColumn, Double> values) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
        this.values = values;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double get(PredictionColumn column) {
        return values.get(column);
    }

    public Map<PredictionColumn, Double> asMap() {
        return new EnumMap<>(values);
    }

    @Override
    public String toString() {
        return "PredictionRecord{" + timestamp + ", " + values + '}';
    }
}
