package io.nosqlbench.forecast.trend;

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

import io.nosqlbench.forecast.design.ScalingContext;

import java.util.Arrays;

/**
 * Trend parameters expressed in original units: the linked scale per elapsed second of
 * time since the first training timestamp.
 *
 * <pre>{@code
 * rate   = k * linkedScale / timeScale
 * offset = linkedOffset + linkedScale * m
 * delta' = delta * linkedScale / timeScale
 * c'     = tc * timeScale                              seconds after the first timestamp
 *
 * trend(e) = (rate + sum_{c'_j <= e} delta'_j) * e + offset - sum_{c'_j <= e} c'_j * delta'_j
 * }</pre>
 */
public final class DenormalizedTrend {

    private final double rate;
    private final double offset;
    private final double[] delta;
    private final double[] changepointSeconds;
    private final double timeOffset;

    private DenormalizedTrend(double rate, double offset, double[] delta, double[] changepointSeconds, double timeOffset) {
        this.rate = rate;
        this.offset = offset;
        this.delta = delta;
        this.changepointSeconds = changepointSeconds;
        this.timeOffset = timeOffset;
    }

    /**
     * Maps normalized parameters to original units.
     *
     * @param params the normalized trend parameters
     * @param changepoints the normalized changepoints
     * @param scaling the scaling context of the fit
     * @return the denormalized trend
     */
    public static DenormalizedTrend of(TrendParameters params, double[] changepoints, ScalingContext scaling) {
        double sc = scaling.getLinkedScale();
        double span = scaling.getTimeScale();
        double[] delta = new double[params.changepointCount()];
        double[] seconds = new double[changepoints.length];
        for (int j = 0; j < delta.length; j++) {
            delta[j] = params.delta(j) * sc / span;
            seconds[j] = changepoints[j] * span;
        }
        return new DenormalizedTrend(params.getK() * sc / span, scaling.getLinkedOffset() + sc * params.getM(),
            delta, seconds, scaling.getTimeOffset());
    }

    /**
     * Maps back to normalized parameters.
     *
     * @param scaling the scaling context of the fit
     * @return the normalized trend parameters
     */
    public TrendParameters normalize(ScalingContext scaling) {
        double sc = scaling.getLinkedScale();
        double span = scaling.getTimeScale();
        double[] normalized = new double[delta.length];
        for (int j = 0; j < delta.length; j++) {
            normalized[j] = delta[j] * span / sc;
        }
        return new TrendParameters(rate * span / sc, (offset - scaling.getLinkedOffset()) / sc, normalized);
    }

    /**
     * Evaluates the trend on the linked scale.
     *
     * @param epochSeconds the timestamp
     * @return the linked trend value
     */
    public double valueAt(double epochSeconds) {
        double elapsed = epochSeconds - timeOffset;
        double r = rate;
        double o = offset;
        for (int j = 0; j < delta.length && elapsed >= changepointSeconds[j]; j++) {
            r += delta[j];
            o -= changepointSeconds[j] * delta[j];
        }
        return r * elapsed + o;
    }

    public double getRate() {
        return rate;
    }

    public double getOffset() {
        return offset;
    }

    public double[] getDelta() {
        return delta.clone();
    }

    public double[] getChangepointSeconds() {
        return changepointSeconds.clone();
    }

    @Override
    public String toString() {
        return "DenormalizedTrend{rate=" + rate + "/s, offset=" + offset + ", delta=" + Arrays.toString(delta) + '}';
    }
}
