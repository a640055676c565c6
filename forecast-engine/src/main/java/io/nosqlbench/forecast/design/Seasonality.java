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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A periodic component expressed as a truncated Fourier series.
 *
 * <pre>{@code
 * x = epochSeconds / 86400                         days since the epoch
 * columns: sin(2 pi j x / period), cos(2 pi j x / period)    for j = 1..order
 * }</pre>
 *
 * <p>Columns are evaluated on absolute time rather than normalized time, so the phase
 * does not depend on where the training span starts.
 */
public final class Seasonality implements DesignComponent {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final String name;
    private final double periodDays;
    private final int order;
    private final Double priorScale;

    /**
     * @param name the component name, used as column prefix
     * @param periodDays the period in days, e.g. 7 for weekly
     * @param order the number of sine/cosine pairs
     * @param priorScale the coefficient prior scale, or null for the configured default
     */
    public Seasonality(String name, double periodDays, int order, Double priorScale) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (!(periodDays > 0)) {
            throw new IllegalArgumentException("period must be positive, got " + periodDays);
        }
        if (order < 1) {
            throw new IllegalArgumentException("fourier order must be >= 1, got " + order);
        }
        if (priorScale != null && !(priorScale > 0)) {
            throw new IllegalArgumentException("prior scale must be positive, got " + priorScale);
        }
        this.periodDays = periodDays;
        this.order = order;
        this.priorScale = priorScale;
    }

    public Seasonality(String name, double periodDays, int order) {
        this(name, periodDays, order, null);
    }

    /// Weekly seasonality with the usual order of 3.
    public static Seasonality weekly() {
        return new Seasonality("weekly", 7.0, 3);
    }

    /// Yearly seasonality with the usual order of 10.
    public static Seasonality yearly() {
        return new Seasonality("yearly", 365.25, 10);
    }

    @Override
    public String getName() {
        return name;
    }

    public double getPeriodDays() {
        return periodDays;
    }

    public int getOrder() {
        return order;
    }

    @Override
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(2 * order);
        for (int j = 1; j <= order; j++) {
            names.add(name + "_sin" + j);
            names.add(name + "_cos" + j);
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public double priorScale(PriorScaleDefaults defaults) {
        return priorScale != null ? priorScale : defaults.getSeasonality();
    }

    @Override
    public double[][] evaluate(PredictionFrame frame, ScalingContext scaling) {
        double[] seconds = frame.epochSeconds();
        double[][] columns = new double[2 * order][seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            double phase = 2.0 * Math.PI * (seconds[i] / SECONDS_PER_DAY) / periodDays;
            for (int j = 1; j <= order; j++) {
                columns[2 * j - 2][i] = Math.sin(j * phase);
                columns[2 * j - 1][i] = Math.cos(j * phase);
            }
        }
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Seasonality)) {
            return false;
        }
        Seasonality that = (Seasonality) o;
        return Double.compare(periodDays, that.periodDays) == 0 && order == that.order
            && name.equals(that.name) && Objects.equals(priorScale, that.priorScale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, periodDays, order, priorScale);
    }

    @Override
    public String toString() {
        return "Seasonality{" + name + ", period=" + periodDays + "d, order=" + order + '}';
    }
}
