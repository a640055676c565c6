package io.nosqlbench.forecast.family;

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
 * An observation-noise family: the distribution of each observation given the linear
 * predictor at its timestamp.
 *
 * <h2>Contract</h2>
 *
 * <pre>{@code
 *   eta   = linked_offset + linked_scale * (trend + X * beta)     linear predictor
 *   mean  = link^-1(eta)                                           expected observation
 *   disp  = dispersion(kappa, linked_scale)                        family's own dispersion
 *   y     ~ Family(mean, disp)
 * }</pre>
 *
 * <p>{@code kappa} is the dispersion proxy the optimizer works with. Each family maps it
 * to its natural dispersion parameter; families without a free dispersion report
 * {@link #hasDispersion()} {@code false} and ignore it.
 *
 * <h2>Domain</h2>
 *
 * <p>Families reject observations outside their support with a
 * {@link io.nosqlbench.forecast.errors.ForecastConfigurationException} of kind
 * {@code DOMAIN_MISMATCH}; values are never silently coerced. The mean and quantile
 * functions stay within the support for any finite {@code eta}.
 *
 * <p>Adding a family means adding one implementation and registering it with
 * {@link FamilyRegistry}; nothing else in the engine branches on the family type.
 */
public interface LikelihoodFamily {

    /**
     * Returns the registry tag of this family.
     * @return the tag, e.g. {@code "poisson"}
     */
    String getTag();

    /**
     * Returns the link between the mean and the linear predictor.
     * @return the link function
     */
    LinkFunction getLink();

    /**
     * Returns whether the family has a free dispersion parameter to fit.
     * @return true if {@code kappa} is estimated
     */
    boolean hasDispersion();

    /**
     * Returns the starting value of {@code kappa} for the optimizer.
     * @return the initial dispersion proxy, positive
     */
    double initialKappa();

    /**
     * Checks that every observation lies in the family's support.
     *
     * @param observed the observed values
     * @throws io.nosqlbench.forecast.errors.ForecastConfigurationException on the first violation
     */
    void validateObservations(double[] observed);

    /**
     * Maps an observation to the linked scale for computing the scaling context. Count
     * families use a continuity-corrected transform so that zero counts stay finite.
     *
     * @param observed an observed value
     * @return the linked value
     */
    default double scalingTransform(double observed) {
        return link(observed);
    }

    /**
     * Maps a value on the observation scale to the linked scale, clipping at the
     * boundaries of the support.
     *
     * @param value a value on the observation scale
     * @return the linked value
     */
    double link(double value);

    /**
     * Maps the dispersion proxy to the family's dispersion parameter.
     *
     * @param kappa the dispersion proxy, positive
     * @param linkedScale the scale of the linked response
     * @return the family's dispersion, or NaN when the family has none
     */
    double dispersion(double kappa, double linkedScale);

    /**
     * Log-density (or log-mass) of one observation.
     *
     * @param observed the observation
     * @param eta the linear predictor at the observation
     * @param dispersion the value returned by {@link #dispersion}
     * @return the log-likelihood contribution
     */
    double logLikelihood(double observed, double eta, double dispersion);

    /**
     * Derivative of {@link #logLikelihood} with respect to {@code eta}. The default is a
     * central difference; families with a closed form override it.
     *
     * @param observed the observation
     * @param eta the linear predictor at the observation
     * @param dispersion the family's dispersion
     * @return d logLikelihood / d eta
     */
    default double logLikelihoodDerivative(double observed, double eta, double dispersion) {
        double h = 1e-6 * Math.max(1.0, Math.abs(eta));
        return (logLikelihood(observed, eta + h, dispersion) - logLikelihood(observed, eta - h, dispersion)) / (2 * h);
    }

    /**
     * Expected observation for a linear predictor.
     *
     * @param eta the linear predictor
     * @param dispersion the family's dispersion
     * @return the mean on the observation scale
     */
    double mean(double eta, double dispersion);

    /**
     * Percent-point function of the observation distribution.
     *
     * @param probability the cumulative probability, in (0, 1)
     * @param eta the linear predictor
     * @param dispersion the family's dispersion
     * @return the smallest value whose cumulative probability reaches {@code probability}
     */
    double quantile(double probability, double eta, double dispersion);
}
