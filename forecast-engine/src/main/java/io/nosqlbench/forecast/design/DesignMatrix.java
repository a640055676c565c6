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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-major regression design: one column per seasonality Fourier term, event or
 * regressor, with the prior scale of each column and the column range of each component.
 */
public final class DesignMatrix {

    private final int rows;
    private final double[][] columns;
    private final List<String> names;
    private final double[] priorScales;
    private final Map<String, int[]> componentRanges;

    DesignMatrix(int rows, double[][] columns, List<String> names, double[] priorScales,
                 Map<String, int[]> componentRanges) {
        if (columns.length != names.size() || columns.length != priorScales.length) {
            throw new IllegalArgumentException("column, name and prior scale counts differ: "
                + columns.length + ", " + names.size() + ", " + priorScales.length);
        }
        this.rows = rows;
        this.columns = columns;
        this.names = List.copyOf(names);
        this.priorScales = priorScales;
        this.componentRanges = Collections.unmodifiableMap(new LinkedHashMap<>(componentRanges));
    }

    /**
     * Returns an empty design with the given number of rows.
     * @param rows the row count
     * @return a design matrix without columns
     */
    public static DesignMatrix empty(int rows) {
        return new DesignMatrix(rows, new double[0][], List.of(), new double[0], Map.of());
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns.length;
    }

    public double get(int row, int column) {
        return columns[column][row];
    }

    /**
     * @param column the column index
     * @return the backing column array; callers must not modify it
     */
    public double[] column(int column) {
        return columns[column];
    }

    public String name(int column) {
        return names.get(column);
    }

    public List<String> names() {
        return names;
    }

    public double priorScale(int column) {
        return priorScales[column];
    }

    public Set<String> componentNames() {
        return componentRanges.keySet();
    }

    /**
     * @param component a component name
     * @return {@code {start, end}} column indexes, end exclusive
     */
    public int[] componentRange(String component) {
        int[] range = componentRanges.get(component);
        if (range == null) {
            throw new IllegalArgumentException("no component named '" + component + "'");
        }
        return range.clone();
    }

    /**
     * Returns {@code X[row] . beta}.
     *
     * @param row the row index
     * @param beta one coefficient per column
     * @return the regression term of the row
     */
    public double dot(int row, double[] beta) {
        double sum = 0.0;
        for (int j = 0; j < columns.length; j++) {
            sum += columns[j][row] * beta[j];
        }
        return sum;
    }

    /**
     * Returns {@code X . beta} restricted to one component's columns.
     *
     * @param row the row index
     * @param beta the full coefficient vector
     * @param component the component name
     * @return the component's contribution to the row
     */
    public double dot(int row, double[] beta, String component) {
        int[] range = componentRanges.get(component);
        double sum = 0.0;
        for (int j = range[0]; j < range[1]; j++) {
            sum += columns[j][row] * beta[j];
        }
        return sum;
    }
}
