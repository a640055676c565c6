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
 * Default prior scales for components that do not carry their own.
 */
public final class PriorScaleDefaults {

    private final double seasonality;
    private final double event;

    public PriorScaleDefaults(double seasonality, double event) {
        this.seasonality = seasonality;
        this.event = event;
    }

    public double getSeasonality() {
        return seasonality;
    }

    /**
     * @return the default scale for events and external regressors
     */
    public double getEvent() {
        return event;
    }
}
