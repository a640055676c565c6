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

/**
 * The changepoint indicator matrix {@code A}: {@code A[i][j] = 1} when row {@code i} is
 * at or after changepoint {@code j}, else 0.
 */
public final class ChangepointMatrix {

    private final double[] t;
    private final double[] changepoints;
    private final double[][] indicator;

    private ChangepointMatrix(double[] t, double[] changepoints, double[][] indicator) {
        this.t = t;
        this.changepoints = changepoints;
        this.indicator = indicator;
    }

    /**
     * Builds the indicator matrix for normalized times, which may lie outside [0, 1].
     *
     * @param t the normalized row times
     * @param changepoints the normalized changepoints, increasing
     * @return the matrix
     */
    public static ChangepointMatrix of(double[] t, double[] changepoints) {
        double[][] indicator = new double[t.length][changepoints.length];
        for (int i = 0; i < t.length; i++) {
            for (int j = 0; j < changepoints.length && t[i] >= changepoints[j]; j++) {
                indicator[i][j] = 1.0;
            }
        }
        return new ChangepointMatrix(t.clone(), changepoints.clone(), indicator);
    }

    public int rows() {
        return t.length;
    }

    public int columns() {
        return changepoints.length;
    }

    public double get(int row, int column) {
        return indicator[row][column];
    }

    public double time(int row) {
        return t[row];
    }

    public double[] times() {
        return t.clone();
    }

    public double changepoint(int column) {
        return changepoints[column];
    }

    public double[] changepoints() {
        return changepoints.clone();
    }
}
