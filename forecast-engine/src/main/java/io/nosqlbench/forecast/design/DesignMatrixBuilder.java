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
import io.nosqlbench.forecast.series.PredictionFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles the design matrix of a set of components, for the training frame or any
 * prediction frame.
 *
 * <pre>{@code
 * DesignMatrixBuilder builder = new DesignMatrixBuilder(components, new PriorScaleDefaults(3.0, 3.0));
 * DesignMatrix train = builder.buildTraining(series.frame(), scaling);
 * DesignMatrix future = builder.build(futureFrame, scaling);
 * }</pre>
 */
public final class DesignMatrixBuilder {

    private static final Logger logger = LogManager.getLogger(DesignMatrixBuilder.class);

    private final List<DesignComponent> components;
    private final PriorScaleDefaults defaults;

    public DesignMatrixBuilder(List<? extends DesignComponent> components, PriorScaleDefaults defaults) {
        this.components = List.copyOf(components);
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
        Set<String> seen = new HashSet<>();
        Set<String> componentNames = new HashSet<>();
        for (DesignComponent component : this.components) {
            if (!componentNames.add(component.getName())) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                    "duplicate component name '" + component.getName() + "'");
            }
            for (String column : component.columnNames()) {
                if (!seen.add(column)) {
                    throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                        "duplicate design column '" + column + "'");
                }
            }
        }
    }

    public List<DesignComponent> getComponents() {
        return components;
    }

    /**
     * Builds the training design and warns about events whose column is zero throughout.
     *
     * @param frame the training frame
     * @param scaling the scaling context of the training series
     * @return the design matrix
     */
    public DesignMatrix buildTraining(PredictionFrame frame, ScalingContext scaling) {
        DesignMatrix matrix = build(frame, scaling);
        for (DesignComponent component : components) {
            if (component instanceof Event && isZero(matrix, component.getName())) {
                logger.warn("event '{}' has no effect inside the training span; its coefficient is set by the prior alone",
                    component.getName());
            }
        }
        return matrix;
    }

    private static boolean isZero(DesignMatrix matrix, String component) {
        int[] range = matrix.componentRange(component);
        for (int j = range[0]; j < range[1]; j++) {
            for (double v : matrix.column(j)) {
                if (v != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Evaluates every component at the rows of a frame.
     *
     * @param frame the frame to evaluate
     * @param scaling the scaling context of the training series
     * @return the design matrix
     */
    public DesignMatrix build(PredictionFrame frame, ScalingContext scaling) {
        List<double[]> columns = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<Double> scales = new ArrayList<>();
        Map<String, int[]> ranges = new LinkedHashMap<>();
        for (DesignComponent component : components) {
            int start = columns.size();
            double scale = component.priorScale(defaults);
            double[][] evaluated = component.evaluate(frame, scaling);
            List<String> columnNames = component.columnNames();
            for (int j = 0; j < evaluated.length; j++) {
                columns.add(evaluated[j]);
                names.add(columnNames.get(j));
                scales.add(scale);
            }
            ranges.put(component.getName(), new int[]{start, columns.size()});
        }
        double[] priorScales = new double[scales.size()];
        for (int j = 0; j < priorScales.length; j++) {
            priorScales[j] = scales.get(j);
        }
        logger.debug("built design of {} rows x {} columns", frame.size(), columns.size());
        return new DesignMatrix(frame.size(), columns.toArray(new double[0][]), names, priorScales, ranges);
    }
}
