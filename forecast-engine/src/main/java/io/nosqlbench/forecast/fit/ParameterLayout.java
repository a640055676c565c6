package io.nosqlbench.forecast.fit;

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
 * Positions of the model parameters in the flat vector the optimizer works on.
 *
 * <pre>{@code
 * [ k, m, delta_1 .. delta_C, beta_1 .. beta_P, u ]        kappa = DISPERSION_FLOOR + exp(u)
 * }</pre>
 *
 * The trailing dispersion coordinate {@code u} is present only for families with a free
 * dispersion. {@code kappa} never drops below {@link #DISPERSION_FLOOR}.
 */
public final class ParameterLayout {

    public static final int K = 0;
    public static final int M = 1;

    /** Lower bound of the dispersion proxy {@code kappa}. */
    public static final double DISPERSION_FLOOR = 1e-2;

    private final int changepoints;
    private final int regressors;
    private final boolean dispersion;

    public ParameterLayout(int changepoints, int regressors, boolean dispersion) {
        if (changepoints < 0 || regressors < 0) {
            throw new IllegalArgumentException("negative parameter counts: " + changepoints + ", " + regressors);
        }
        this.changepoints = changepoints;
        this.regressors = regressors;
        this.dispersion = dispersion;
    }

    public int changepoints() {
        return changepoints;
    }

    public int regressors() {
        return regressors;
    }

    public boolean hasDispersion() {
        return dispersion;
    }

    public int deltaOffset() {
        return 2;
    }

    public int betaOffset() {
        return 2 + changepoints;
    }

    /**
     * @return the index of the dispersion coordinate, or -1 without dispersion
     */
    public int dispersionIndex() {
        return dispersion ? 2 + changepoints + regressors : -1;
    }

    /**
     * @param u the dispersion coordinate
     * @return {@code kappa}
     */
    public static double kappa(double u) {
        return DISPERSION_FLOOR + Math.exp(u);
    }

    /**
     * Inverse of {@link #kappa(double)}.
     *
     * @param kappa a dispersion proxy above {@link #DISPERSION_FLOOR}
     * @return the dispersion coordinate
     */
    public static double dispersionCoordinate(double kappa) {
        if (!(kappa > DISPERSION_FLOOR)) {
            throw new IllegalArgumentException("kappa must exceed " + DISPERSION_FLOOR + ", got " + kappa);
        }
        return Math.log(kappa - DISPERSION_FLOOR);
    }

    public int size() {
        return 2 + changepoints + regressors + (dispersion ? 1 : 0);
    }

    @Override
    public String toString() {
        return "ParameterLayout{changepoints=" + changepoints + ", regressors=" + regressors
            + ", dispersion=" + dispersion + ", size=" + size() + '}';
    }
}
