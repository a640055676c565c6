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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The closed set of likelihood families, keyed by their tag.
 *
 * <p>Tags are matched after canonicalization, so {@code "Negative-Binomial"},
 * {@code "negative binomial"} and {@code "negative_binomial"} all name the same family.
 *
 * <pre>{@code
 * LikelihoodFamily family = FamilyRegistry.create("binomial", 40, 0.25);
 * }</pre>
 */
public final class FamilyRegistry {

    @FunctionalInterface
    private interface Factory {
        LikelihoodFamily create(Integer capacity, double varianceMax);
    }

    private static final Map<String, Factory> FACTORIES = new LinkedHashMap<>();
    private static final Map<String, Class<? extends LikelihoodFamily>> TYPES = new LinkedHashMap<>();

    static {
        register(NormalFamily.TAG, NormalFamily.class, (c, v) -> new NormalFamily());
        register(PoissonFamily.TAG, PoissonFamily.class, (c, v) -> new PoissonFamily());
        register(GammaFamily.TAG, GammaFamily.class, (c, v) -> new GammaFamily());
        register(BetaFamily.TAG, BetaFamily.class, (c, v) -> new BetaFamily(v));
        register(NegativeBinomialFamily.TAG, NegativeBinomialFamily.class, (c, v) -> new NegativeBinomialFamily());
        register(BinomialFamily.TAG, BinomialFamily.class, (c, v) -> new BinomialFamily(c));
        register(BetaBinomialFamily.TAG, BetaBinomialFamily.class, (c, v) -> new BetaBinomialFamily(c, v));
    }

    private static final Set<String> CAPACITY_TAGS = Set.of(BinomialFamily.TAG, BetaBinomialFamily.TAG);

    private FamilyRegistry() {
    }

    private static void register(String tag, Class<? extends LikelihoodFamily> type, Factory factory) {
        FACTORIES.put(tag, factory);
        TYPES.put(tag, type);
    }

    /**
     * Normalizes a user-supplied tag: lowercase, with dashes and spaces as underscores.
     *
     * @param tag the tag as given
     * @return the canonical form
     */
    public static String canonicalTag(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    public static boolean isRegistered(String tag) {
        return FACTORIES.containsKey(canonicalTag(tag));
    }

    /**
     * @return the registered tags, in registration order
     */
    public static Set<String> tags() {
        return Collections.unmodifiableSet(FACTORIES.keySet());
    }

    /**
     * Returns whether the family counts successes out of a capacity.
     *
     * @param tag a registered tag
     * @return true for the binomial and beta-binomial families
     */
    public static boolean requiresCapacity(String tag) {
        return CAPACITY_TAGS.contains(canonicalTag(tag));
    }

    /**
     * Returns the implementation class for a tag, for serialization.
     *
     * @param tag a registered tag
     * @return the family class
     */
    public static Class<? extends LikelihoodFamily> typeOf(String tag) {
        Class<? extends LikelihoodFamily> type = TYPES.get(canonicalTag(tag));
        if (type == null) {
            throw unknown(tag);
        }
        return type;
    }

    /**
     * Creates a family instance.
     *
     * @param tag the family tag
     * @param capacity the resolved number of trials; required by the capacity families and ignored otherwise
     * @param varianceMax the variance ceiling of the proportion families
     * @return a new family
     * @throws ForecastConfigurationException of kind {@code INVALID_FAMILY} for an unknown tag, or
     *     {@code MISSING_CAPACITY} when a capacity family gets no capacity
     */
    public static LikelihoodFamily create(String tag, Integer capacity, double varianceMax) {
        String canonical = canonicalTag(tag);
        Factory factory = FACTORIES.get(canonical);
        if (factory == null) {
            throw unknown(tag);
        }
        if (CAPACITY_TAGS.contains(canonical) && (capacity == null || capacity <= 0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.MISSING_CAPACITY,
                "model '" + canonical + "' needs a positive capacity, got " + capacity);
        }
        return factory.create(capacity, varianceMax);
    }

    private static ForecastConfigurationException unknown(String tag) {
        return new ForecastConfigurationException(ConfigurationErrorKind.INVALID_FAMILY,
            "unknown model '" + tag + "', expected one of " + tags());
    }
}
