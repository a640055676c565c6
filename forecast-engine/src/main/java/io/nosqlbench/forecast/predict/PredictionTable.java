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
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A complete prediction: every [PredictionColumn] for every requested timestamp,
/// plus the additive contribution of each design component on the linked scale.
///
/// Tables are created fresh by every predict call and never change.
public final class PredictionTable {

    private final List<Instant> timestamps;
    private final EnumMap<PredictionColumn, double[]> columns;
    private final Map<String, double[]> components;
    private final double intervalWidth;

    PredictionTable(List<Instant> timestamps, EnumMap<PredictionColumn, double[]> columns,
                    Map<String, double[]> components, double intervalWidth) {
        for (PredictionColumn column : PredictionColumn.values()) {
            double[] values = columns.get(column);
            if (values == null || values.length != timestamps.size()) {
                throw new IllegalArgumentException("column " + column.columnName() + " is missing or has the wrong length");
            }
        }
        this.timestamps = List.copyOf(timestamps);
        this.columns = columns;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.intervalWidth = intervalWidth;
    }

    public int size() {
        return timestamps.size();
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public Instant timestamp(int row) {
        return timestamps.get(row);
    }

    public double getIntervalWidth() {
        return intervalWidth;
    }

    /// @param column the column
    /// @return a copy of the column values
    public double[] column(PredictionColumn column) {
        return columns.get(column).clone();
    }

    public double get(int row, PredictionColumn column) {
        return columns.get(column)[row];
    }

    public PredictionRecord record(int row) {
        EnumMap<PredictionColumn, Double> values = new EnumMap<>(PredictionColumn.class);
        for (PredictionColumn column : PredictionColumn.values()) {
            values.put(column, columns.get(column)[row]);
        }
        return new PredictionRecord(timestamps.get(row), values);
    }

    public List<PredictionRecord> records() {
        List<PredictionRecord> records = new ArrayList<>(size());
        for (int row = 0; row < size(); row++) {
            records.add(record(row));
        }
        return records;
    }

    /// Returns the contribution of each seasonality, event and regressor to the linear
    /// predictor, on the linked scale and without the linked offset.
    ///
    /// @return an unmodifiable map of component name to a copy of its per-row contribution
    public Map<String, double[]> components() {
        Map<String, double[]> copies = new LinkedHashMap<>();
        components.forEach((name, values) -> copies.put(name, values.clone()));
        return Collections.unmodifiableMap(copies);
    }
}
