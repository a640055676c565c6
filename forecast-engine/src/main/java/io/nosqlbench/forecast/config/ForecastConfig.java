package io.nosqlbench.forecast.config;

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
import io.nosqlbench.forecast.family.FamilyRegistry;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Fully resolved settings consumed by the forecasting engine.
 *
 * <h2>Keys</h2>
 *
 * <p>Each setting has a snake_case key used by configuration layers:
 *
 * <pre>{@code
 * model                   family tag (normal, poisson, gamma, beta, negative_binomial,
 *                         beta_binomial, binomial)
 * n_changepoints          number of candidate changepoints              (25)
 * changepoint_range       fraction of the training rows eligible        (0.8)
 * changepoints            explicit changepoint instants                 (none)
 * seasonality_prior_scale normal prior scale of Fourier coefficients    (3.0)
 * event_prior_scale       normal prior scale of event/regressor coefs   (3.0)
 * changepoint_prior_scale Laplace prior scale of rate adjustments       (0.05)
 * dispersion_prior_scale  half-normal prior scale of the dispersion     (3.0)
 * interval_width          two-sided mass of every band                  (0.8)
 * use_laplace             draw from the Laplace approximation           (false)
 * trend_samples           trend-uncertainty simulations                 (1000)
 * laplace_samples         posterior draws, 0 follows trend_samples      (0)
 * variance_max            proportion variance ceiling                   (0.25)
 * capacity_mode           constant | factor                             (constant)
 * capacity_value          trials, or factor over max(y)                 (none)
 * sampling_period         step of future frames                         (inferred)
 * seed                    random seed for simulations and draws         (random)
 * optimize_mode           MAP                                           (MAP)
 * parallel                run simulations on the common pool            (true)
 * }</pre>
 *
 * <p>Instances are validated on construction and immutable. Layered resolution lives in
 * {@link ConfigResolver}; this class only knows how to read one flat map.
 */
public final class ForecastConfig {

    public static final String MODEL = "model";
    public static final String N_CHANGEPOINTS = "n_changepoints";
    public static final String CHANGEPOINT_RANGE = "changepoint_range";
    public static final String CHANGEPOINTS = "changepoints";
    public static final String SEASONALITY_PRIOR_SCALE = "seasonality_prior_scale";
    public static final String EVENT_PRIOR_SCALE = "event_prior_scale";
    public static final String CHANGEPOINT_PRIOR_SCALE = "changepoint_prior_scale";
    public static final String DISPERSION_PRIOR_SCALE = "dispersion_prior_scale";
    public static final String INTERVAL_WIDTH = "interval_width";
    public static final String USE_LAPLACE = "use_laplace";
    public static final String TREND_SAMPLES = "trend_samples";
    public static final String LAPLACE_SAMPLES = "laplace_samples";
    public static final String VARIANCE_MAX = "variance_max";
    public static final String CAPACITY_MODE = "capacity_mode";
    public static final String CAPACITY_VALUE = "capacity_value";
    public static final String SAMPLING_PERIOD = "sampling_period";
    public static final String SEED = "seed";
    public static final String OPTIMIZE_MODE = "optimize_mode";
    public static final String PARALLEL = "parallel";

    /** Every key a configuration layer may contain. */
    public static final Set<String> KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
        MODEL, N_CHANGEPOINTS, CHANGEPOINT_RANGE, CHANGEPOINTS, SEASONALITY_PRIOR_SCALE, EVENT_PRIOR_SCALE,
        CHANGEPOINT_PRIOR_SCALE, DISPERSION_PRIOR_SCALE, INTERVAL_WIDTH, USE_LAPLACE, TREND_SAMPLES,
        LAPLACE_SAMPLES, VARIANCE_MAX, CAPACITY_MODE, CAPACITY_VALUE, SAMPLING_PERIOD, SEED, OPTIMIZE_MODE,
        PARALLEL)));

    static final int DEFAULT_LAPLACE_SAMPLES = 1000;

    private final String model;
    private final int nChangepoints;
    private final double changepointRange;
    private final List<Instant> changepoints;
    private final double seasonalityPriorScale;
    private final double eventPriorScale;
    private final double changepointPriorScale;
    private final double dispersionPriorScale;
    private final double intervalWidth;
    private final boolean useLaplace;
    private final int trendSamples;
    private final int laplaceSamples;
    private final double varianceMax;
    private final CapacityMode capacityMode;
    private final Double capacityValue;
    private final Duration samplingPeriod;
    private final Long seed;
    private final OptimizeMode optimizeMode;
    private final boolean parallel;

    private ForecastConfig(Builder builder) {
        this.model = FamilyRegistry.canonicalTag(Objects.requireNonNull(builder.model, "model cannot be null"));
        this.nChangepoints = builder.nChangepoints;
        this.changepointRange = builder.changepointRange;
        this.changepoints = builder.changepoints == null ? null : List.copyOf(builder.changepoints);
        this.seasonalityPriorScale = builder.seasonalityPriorScale;
        this.eventPriorScale = builder.eventPriorScale;
        this.changepointPriorScale = builder.changepointPriorScale;
        this.dispersionPriorScale = builder.dispersionPriorScale;
        this.intervalWidth = builder.intervalWidth;
        this.useLaplace = builder.useLaplace;
        this.trendSamples = builder.trendSamples;
        this.laplaceSamples = builder.laplaceSamples;
        this.varianceMax = builder.varianceMax;
        this.capacityMode = Objects.requireNonNull(builder.capacityMode, "capacity_mode cannot be null");
        this.capacityValue = builder.capacityValue;
        this.samplingPeriod = builder.samplingPeriod;
        this.seed = builder.seed;
        this.optimizeMode = Objects.requireNonNull(builder.optimizeMode, "optimize_mode cannot be null");
        this.parallel = builder.parallel;
        validate();
    }

    private void validate() {
        if (!FamilyRegistry.isRegistered(model)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_FAMILY,
                "unknown model '" + model + "', expected one of " + FamilyRegistry.tags());
        }
        if (nChangepoints < 0) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.NEGATIVE_CHANGEPOINTS,
                "n_changepoints must be >= 0, got " + nChangepoints);
        }
        if (!(changepointRange > 0.0 && changepointRange <= 1.0)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_CHANGEPOINT_RANGE,
                "changepoint_range must be in (0, 1], got " + changepointRange);
        }
        requirePositive(SEASONALITY_PRIOR_SCALE, seasonalityPriorScale);
        requirePositive(EVENT_PRIOR_SCALE, eventPriorScale);
        requirePositive(CHANGEPOINT_PRIOR_SCALE, changepointPriorScale);
        requirePositive(DISPERSION_PRIOR_SCALE, dispersionPriorScale);
        if (!(intervalWidth > 0.0 && intervalWidth < 1.0)) {
            throw invalid(INTERVAL_WIDTH + " must be in (0, 1), got " + intervalWidth);
        }
        if (trendSamples < 0) {
            throw invalid(TREND_SAMPLES + " must be >= 0, got " + trendSamples);
        }
        if (laplaceSamples < 0) {
            throw invalid(LAPLACE_SAMPLES + " must be >= 0, got " + laplaceSamples);
        }
        if (!(varianceMax > 0.0 && varianceMax <= 0.25)) {
            throw invalid(VARIANCE_MAX + " must be in (0, 0.25], got " + varianceMax);
        }
        if (capacityValue != null && !(capacityValue > 0)) {
            throw invalid(CAPACITY_VALUE + " must be positive, got " + capacityValue);
        }
        if (samplingPeriod != null && (samplingPeriod.isNegative() || samplingPeriod.isZero())) {
            throw invalid(SAMPLING_PERIOD + " must be positive, got " + samplingPeriod);
        }
    }

    private static void requirePositive(String key, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw invalid(key + " must be a positive finite number, got " + value);
        }
    }

    private static ForecastConfigurationException invalid(String message) {
        return new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER, message);
    }

    /**
     * Returns a builder pre-populated with the default values.
     *
     * @param model the family tag
     * @return a new builder
     */
    public static Builder builder(String model) {
        return new Builder().model(model);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.model = model;
        builder.nChangepoints = nChangepoints;
        builder.changepointRange = changepointRange;
        builder.changepoints = changepoints;
        builder.seasonalityPriorScale = seasonalityPriorScale;
        builder.eventPriorScale = eventPriorScale;
        builder.changepointPriorScale = changepointPriorScale;
        builder.dispersionPriorScale = dispersionPriorScale;
        builder.intervalWidth = intervalWidth;
        builder.useLaplace = useLaplace;
        builder.trendSamples = trendSamples;
        builder.laplaceSamples = laplaceSamples;
        builder.varianceMax = varianceMax;
        builder.capacityMode = capacityMode;
        builder.capacityValue = capacityValue;
        builder.samplingPeriod = samplingPeriod;
        builder.seed = seed;
        builder.optimizeMode = optimizeMode;
        builder.parallel = parallel;
        return builder;
    }

    /**
     * Returns the built-in defaults as a configuration layer. The layer has no
     * {@code model} entry since there is no default family.
     *
     * @return the default layer
     */
    public static Map<String, Object> defaultLayer() {
        Builder defaults = new Builder();
        Map<String, Object> layer = new LinkedHashMap<>();
        layer.put(N_CHANGEPOINTS, defaults.nChangepoints);
        layer.put(CHANGEPOINT_RANGE, defaults.changepointRange);
        layer.put(SEASONALITY_PRIOR_SCALE, defaults.seasonalityPriorScale);
        layer.put(EVENT_PRIOR_SCALE, defaults.eventPriorScale);
        layer.put(CHANGEPOINT_PRIOR_SCALE, defaults.changepointPriorScale);
        layer.put(DISPERSION_PRIOR_SCALE, defaults.dispersionPriorScale);
        layer.put(INTERVAL_WIDTH, defaults.intervalWidth);
        layer.put(USE_LAPLACE, defaults.useLaplace);
        layer.put(TREND_SAMPLES, defaults.trendSamples);
        layer.put(LAPLACE_SAMPLES, defaults.laplaceSamples);
        layer.put(VARIANCE_MAX, defaults.varianceMax);
        layer.put(CAPACITY_MODE, defaults.capacityMode.tag());
        layer.put(OPTIMIZE_MODE, defaults.optimizeMode.name());
        layer.put(PARALLEL, defaults.parallel);
        return layer;
    }

    /**
     * Reads a flat map of settings. Keys absent from the map keep their defaults.
     *
     * @param values settings keyed by snake_case name
     * @return the validated configuration
     * @throws ForecastConfigurationException for unknown keys or malformed values
     */
    public static ForecastConfig fromMap(Map<String, ?> values) {
        Builder builder = new Builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (!KEYS.contains(key)) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.UNKNOWN_PARAMETER,
                    "unknown configuration key '" + key + "'");
            }
            if (value == null) {
                continue;
            }
            switch (key) {
                case MODEL:
                    builder.model(asString(key, value));
                    break;
                case N_CHANGEPOINTS:
                    builder.nChangepoints(asInt(key, value));
                    break;
                case CHANGEPOINT_RANGE:
                    builder.changepointRange(asDouble(key, value));
                    break;
                case CHANGEPOINTS:
                    builder.changepoints(asInstants(key, value));
                    break;
                case SEASONALITY_PRIOR_SCALE:
                    builder.seasonalityPriorScale(asDouble(key, value));
                    break;
                case EVENT_PRIOR_SCALE:
                    builder.eventPriorScale(asDouble(key, value));
                    break;
                case CHANGEPOINT_PRIOR_SCALE:
                    builder.changepointPriorScale(asDouble(key, value));
                    break;
                case DISPERSION_PRIOR_SCALE:
                    builder.dispersionPriorScale(asDouble(key, value));
                    break;
                case INTERVAL_WIDTH:
                    builder.intervalWidth(asDouble(key, value));
                    break;
                case USE_LAPLACE:
                    builder.useLaplace(asBoolean(key, value));
                    break;
                case TREND_SAMPLES:
                    builder.trendSamples(asInt(key, value));
                    break;
                case LAPLACE_SAMPLES:
                    builder.laplaceSamples(asInt(key, value));
                    break;
                case VARIANCE_MAX:
                    builder.varianceMax(asDouble(key, value));
                    break;
                case CAPACITY_MODE:
                    builder.capacityMode(CapacityMode.fromTag(asString(key, value)));
                    break;
                case CAPACITY_VALUE:
                    builder.capacityValue(asDouble(key, value));
                    break;
                case SAMPLING_PERIOD:
                    builder.samplingPeriod(Durations.parse(asString(key, value)));
                    break;
                case SEED:
                    builder.seed(asLongValue(key, value));
                    break;
                case OPTIMIZE_MODE:
                    builder.optimizeMode(OptimizeMode.fromTag(asString(key, value)));
                    break;
                case PARALLEL:
                    builder.parallel(asBoolean(key, value));
                    break;
                default:
                    throw new IllegalStateException("Unhandled key " + key);
            }
        }
        if (builder.model == null) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_FAMILY,
                "no model given, expected one of " + FamilyRegistry.tags());
        }
        return builder.build();
    }

    private static String asString(String key, Object value) {
        return value.toString();
    }

    private static long asLongValue(String key, Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d)) {
                throw invalid(key + " must be an integer, got " + value);
            }
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static int asInt(String key, Object value) {
        long parsed = asLongValue(key, value);
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            throw invalid(key + " is out of range: " + value);
        }
        return (int) parsed;
    }

    private static double asDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                key + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw invalid(key + " must be true or false, got '" + value + "'");
    }

    private static List<Instant> asInstants(String key, Object value) {
        List<Instant> instants = new ArrayList<>();
        if (value instanceof Iterable<?>) {
            for (Object item : (Iterable<?>) value) {
                instants.add(asInstant(key, item));
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    instants.add(asInstant(key, part));
                }
            }
        }
        return instants;
    }

    private static Instant asInstant(String key, Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        try {
            return Instant.parse(value.toString().trim());
        } catch (DateTimeParseException e) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                key + " entries must be ISO-8601 instants, got '" + value + "'", e);
        }
    }

    public String getModel() {
        return model;
    }

    public int getNChangepoints() {
        return nChangepoints;
    }

    public double getChangepointRange() {
        return changepointRange;
    }

    /**
     * Returns the explicitly configured changepoints, if any.
     * @return explicit changepoints, empty when they are placed automatically
     */
    public Optional<List<Instant>> getChangepoints() {
        return Optional.ofNullable(changepoints);
    }

    public double getSeasonalityPriorScale() {
        return seasonalityPriorScale;
    }

    public double getEventPriorScale() {
        return eventPriorScale;
    }

    public double getChangepointPriorScale() {
        return changepointPriorScale;
    }

    public double getDispersionPriorScale() {
        return dispersionPriorScale;
    }

    public double getIntervalWidth() {
        return intervalWidth;
    }

    public boolean isUseLaplace() {
        return useLaplace;
    }

    public int getTrendSamples() {
        return trendSamples;
    }

    public int getLaplaceSamples() {
        return laplaceSamples;
    }

    /**
     * Returns the number of Laplace draws to take: {@code laplace_samples} when set,
     * otherwise {@code trend_samples}, otherwise 1000.
     *
     * @return the effective draw count
     */
    public int effectiveLaplaceSamples() {
        if (laplaceSamples > 0) {
            return laplaceSamples;
        }
        return trendSamples > 0 ? trendSamples : DEFAULT_LAPLACE_SAMPLES;
    }

    public double getVarianceMax() {
        return varianceMax;
    }

    public CapacityMode getCapacityMode() {
        return capacityMode;
    }

    public Optional<Double> getCapacityValue() {
        return Optional.ofNullable(capacityValue);
    }

    public Optional<Duration> getSamplingPeriod() {
        return Optional.ofNullable(samplingPeriod);
    }

    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    public OptimizeMode getOptimizeMode() {
        return optimizeMode;
    }

    public boolean isParallel() {
        return parallel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastConfig)) return false;
        ForecastConfig that = (ForecastConfig) o;
        return nChangepoints == that.nChangepoints
            && Double.compare(that.changepointRange, changepointRange) == 0
            && Double.compare(that.seasonalityPriorScale, seasonalityPriorScale) == 0
            && Double.compare(that.eventPriorScale, eventPriorScale) == 0
            && Double.compare(that.changepointPriorScale, changepointPriorScale) == 0
            && Double.compare(that.dispersionPriorScale, dispersionPriorScale) == 0
            && Double.compare(that.intervalWidth, intervalWidth) == 0
            && useLaplace == that.useLaplace
            && trendSamples == that.trendSamples
            && laplaceSamples == that.laplaceSamples
            && Double.compare(that.varianceMax, varianceMax) == 0
            && parallel == that.parallel
            && model.equals(that.model)
            && Objects.equals(changepoints, that.changepoints)
            && capacityMode == that.capacityMode
            && Objects.equals(capacityValue, that.capacityValue)
            && Objects.equals(samplingPeriod, that.samplingPeriod)
            && Objects.equals(seed, that.seed)
            && optimizeMode == that.optimizeMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, nChangepoints, changepointRange, changepoints, seasonalityPriorScale,
            eventPriorScale, changepointPriorScale, dispersionPriorScale, intervalWidth, useLaplace,
            trendSamples, laplaceSamples, varianceMax, capacityMode, capacityValue, samplingPeriod, seed,
            optimizeMode, parallel);
    }

    @Override
    public String toString() {
        return "ForecastConfig[model=" + model + ", n_changepoints=" + nChangepoints
            + ", changepoint_range=" + changepointRange + ", interval_width=" + intervalWidth
            + ", use_laplace=" + useLaplace + ", trend_samples=" + trendSamples + "]";
    }

    /**
     * Mutable builder for {@link ForecastConfig}; starts from the defaults.
     */
    public static final class Builder {
        private String model;
        private int nChangepoints = 25;
        private double changepointRange = 0.8;
        private List<Instant> changepoints;
        private double seasonalityPriorScale = 3.0;
        private double eventPriorScale = 3.0;
        private double changepointPriorScale = 0.05;
        private double dispersionPriorScale = 3.0;
        private double intervalWidth = 0.8;
        private boolean useLaplace = false;
        private int trendSamples = 1000;
        private int laplaceSamples = 0;
        private double varianceMax = 0.25;
        private CapacityMode capacityMode = CapacityMode.CONSTANT;
        private Double capacityValue;
        private Duration samplingPeriod;
        private Long seed;
        private OptimizeMode optimizeMode = OptimizeMode.MAP;
        private boolean parallel = true;

        private Builder() {
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder nChangepoints(int nChangepoints) {
            this.nChangepoints = nChangepoints;
            return this;
        }

        public Builder changepointRange(double changepointRange) {
            this.changepointRange = changepointRange;
            return this;
        }

        public Builder changepoints(List<Instant> changepoints) {
            this.changepoints = changepoints;
            return this;
        }

        public Builder seasonalityPriorScale(double seasonalityPriorScale) {
            this.seasonalityPriorScale = seasonalityPriorScale;
            return this;
        }

        public Builder eventPriorScale(double eventPriorScale) {
            this.eventPriorScale = eventPriorScale;
            return this;
        }

        public Builder changepointPriorScale(double changepointPriorScale) {
            this.changepointPriorScale = changepointPriorScale;
            return this;
        }

        public Builder dispersionPriorScale(double dispersionPriorScale) {
            this.dispersionPriorScale = dispersionPriorScale;
            return this;
        }

        public Builder intervalWidth(double intervalWidth) {
            this.intervalWidth = intervalWidth;
            return this;
        }

        public Builder useLaplace(boolean useLaplace) {
            this.useLaplace = useLaplace;
            return this;
        }

        public Builder trendSamples(int trendSamples) {
            this.trendSamples = trendSamples;
            return this;
        }

        public Builder laplaceSamples(int laplaceSamples) {
            this.laplaceSamples = laplaceSamples;
            return this;
        }

        public Builder varianceMax(double varianceMax) {
            this.varianceMax = varianceMax;
            return this;
        }

        public Builder capacityMode(CapacityMode capacityMode) {
            this.capacityMode = capacityMode;
            return this;
        }

        public Builder capacityValue(Double capacityValue) {
            this.capacityValue = capacityValue;
            return this;
        }

        public Builder samplingPeriod(Duration samplingPeriod) {
            this.samplingPeriod = samplingPeriod;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder optimizeMode(OptimizeMode optimizeMode) {
            this.optimizeMode = optimizeMode;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public ForecastConfig build() {
            return new ForecastConfig(this);
        }
    }
}
