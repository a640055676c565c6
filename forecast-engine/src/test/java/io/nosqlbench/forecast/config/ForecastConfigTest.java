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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ForecastConfigTest {

    @Test
    void builderDefaults() {
        ForecastConfig config = ForecastConfig.builder("Poisson").build();
        assertThat(config.getModel()).isEqualTo("poisson");
        assertThat(config.getNChangepoints()).isEqualTo(25);
        assertThat(config.getChangepointRange()).isEqualTo(0.8);
        assertThat(config.getIntervalWidth()).isEqualTo(0.8);
        assertThat(config.getTrendSamples()).isEqualTo(1000);
        assertThat(config.isUseLaplace()).isFalse();
        assertThat(config.getCapacityMode()).isEqualTo(CapacityMode.CONSTANT);
        assertThat(config.getCapacityValue()).isEmpty();
        assertThat(config.getSeed()).isEmpty();
        assertThat(config.getChangepoints()).isEmpty();
        assertThat(config.getOptimizeMode()).isEqualTo(OptimizeMode.MAP);
    }

    @Test
    void effectiveLaplaceSamplesFallsBackToTrendSamples() {
        assertThat(ForecastConfig.builder("normal").build().effectiveLaplaceSamples()).isEqualTo(1000);
        assertThat(ForecastConfig.builder("normal").trendSamples(200).build().effectiveLaplaceSamples()).isEqualTo(200);
        assertThat(ForecastConfig.builder("normal").trendSamples(0).build().effectiveLaplaceSamples())
            .isEqualTo(ForecastConfig.DEFAULT_LAPLACE_SAMPLES);
        assertThat(ForecastConfig.builder("normal").laplaceSamples(50).build().effectiveLaplaceSamples()).isEqualTo(50);
    }

    @Test
    void fromMapAcceptsTextValues() {
        Map<String, Object> values = new HashMap<>();
        values.put(ForecastConfig.MODEL, "binomial");
        values.put(ForecastConfig.N_CHANGEPOINTS, "4");
        values.put(ForecastConfig.USE_LAPLACE, "TRUE");
        values.put(ForecastConfig.CAPACITY_MODE, "factor");
        values.put(ForecastConfig.CAPACITY_VALUE, "1.5");
        values.put(ForecastConfig.SAMPLING_PERIOD, "1h");
        values.put(ForecastConfig.SEED, "42");
        values.put(ForecastConfig.CHANGEPOINTS, "2024-01-10T00:00:00Z, 2024-02-01T00:00:00Z");

        ForecastConfig config = ForecastConfig.fromMap(values);
        assertThat(config.getNChangepoints()).isEqualTo(4);
        assertThat(config.isUseLaplace()).isTrue();
        assertThat(config.getCapacityMode()).isEqualTo(CapacityMode.FACTOR);
        assertThat(config.getCapacityValue()).contains(1.5);
        assertThat(config.getSamplingPeriod()).contains(Duration.ofHours(1));
        assertThat(config.getSeed()).contains(42L);
        assertThat(config.getChangepoints().orElseThrow())
            .containsExactly(Instant.parse("2024-01-10T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));
    }

    @Test
    void rejectsInvalidSettings() {
        assertKind(() -> ForecastConfig.builder("lognormal").build(), ConfigurationErrorKind.INVALID_FAMILY);
        assertKind(() -> ForecastConfig.builder("normal").nChangepoints(-1).build(),
            ConfigurationErrorKind.NEGATIVE_CHANGEPOINTS);
        assertKind(() -> ForecastConfig.builder("normal").changepointRange(0.0).build(),
            ConfigurationErrorKind.INVALID_CHANGEPOINT_RANGE);
        assertKind(() -> ForecastConfig.builder("normal").changepointRange(1.2).build(),
            ConfigurationErrorKind.INVALID_CHANGEPOINT_RANGE);
        assertKind(() -> ForecastConfig.builder("normal").intervalWidth(1.0).build(),
            ConfigurationErrorKind.INVALID_PARAMETER);
        assertKind(() -> ForecastConfig.builder("beta").varianceMax(0.3).build(),
            ConfigurationErrorKind.INVALID_PARAMETER);
        assertKind(() -> ForecastConfig.builder("normal").changepointPriorScale(0.0).build(),
            ConfigurationErrorKind.INVALID_PARAMETER);
    }

    @Test
    void fromMapRejectsUnknownKeysAndMissingModel() {
        assertKind(() -> ForecastConfig.fromMap(Map.of("model", "normal", "n_changepoint", 3)),
            ConfigurationErrorKind.UNKNOWN_PARAMETER);
        assertKind(() -> ForecastConfig.fromMap(Map.of("n_changepoints", 3)), ConfigurationErrorKind.INVALID_FAMILY);
        assertKind(() -> ForecastConfig.fromMap(Map.of("model", "normal", "n_changepoints", 2.5)),
            ConfigurationErrorKind.INVALID_PARAMETER);
        assertKind(() -> ForecastConfig.fromMap(Map.of("model", "normal", "use_laplace", "yes")),
            ConfigurationErrorKind.INVALID_PARAMETER);
    }

    @Test
    void toBuilderRoundTrips() {
        ForecastConfig config = ForecastConfig.builder("gamma").seed(7L).trendSamples(10).build();
        assertThat(config.toBuilder().build()).isEqualTo(config);
        assertThat(config.toBuilder().seed(8L).build()).isNotEqualTo(config);
    }

    @Test
    void capacityModes() {
        double[] observed = {3.0, 9.0, 4.0};
        assertThat(CapacityMode.CONSTANT.resolve(20.0, observed)).isEqualTo(20);
        assertThat(CapacityMode.FACTOR.resolve(1.5, observed)).isEqualTo(14);
        assertThat(CapacityMode.fromTag(" Factor ")).isEqualTo(CapacityMode.FACTOR);
        assertKind(() -> CapacityMode.CONSTANT.resolve(0.0, observed), ConfigurationErrorKind.MISSING_CAPACITY);
        assertKind(() -> CapacityMode.fromTag("ratio"), ConfigurationErrorKind.INVALID_PARAMETER);
    }

    @Test
    void durations() {
        assertThat(Durations.parse("1d")).isEqualTo(Duration.ofDays(1));
        assertThat(Durations.parse("15min")).isEqualTo(Duration.ofMinutes(15));
        assertThat(Durations.parse("PT6H")).isEqualTo(Duration.ofHours(6));
        assertThat(Durations.parse("0.5h")).isEqualTo(Duration.ofMinutes(30));
        assertThat(Durations.toSeconds(Duration.ofMillis(1500))).isEqualTo(1.5);
        assertKind(() -> Durations.parse("3 fortnights"), ConfigurationErrorKind.INVALID_PARAMETER);
        assertKind(() -> Durations.parse("0s"), ConfigurationErrorKind.INVALID_PARAMETER);
    }

    @Test
    void resolverAppliesLayersInPrecedenceOrder() {
        Map<String, Object> global = new LinkedHashMap<>();
        global.put("model", "poisson");
        global.put("n_changepoints", 10);
        global.put("interval_width", 0.9);
        Map<String, Object> local = new LinkedHashMap<>();
        local.put("n_changepoints", 5);
        local.put("seed", null);
        Map<String, Object> explicit = Map.of("interval_width", "0.5");

        ForecastConfig config = ConfigResolver.resolve(ForecastConfig.defaultLayer(), global, local, explicit);
        assertThat(config.getModel()).isEqualTo("poisson");
        assertThat(config.getNChangepoints()).isEqualTo(5);
        assertThat(config.getIntervalWidth()).isEqualTo(0.5);
        assertThat(config.getChangepointRange()).isEqualTo(0.8);
        assertThat(config.getSeed()).isEmpty();
    }

    @Test
    void resolverToleratesMissingLayers() {
        ForecastConfig config = ConfigResolver.resolve(ForecastConfig.defaultLayer(), null, Map.of("model", "gamma"), null);
        assertThat(config.getModel()).isEqualTo("gamma");
        assertThat(ConfigResolver.resolveOverDefaults(Map.of("model", "beta"), Map.of("variance_max", 0.1)).getVarianceMax())
            .isEqualTo(0.1);
    }

    @Test
    void resolverRejectsUnknownKeysInAnyLayer() {
        assertKind(() -> ConfigResolver.resolve(null, Map.of("model", "normal"), Map.of("bogus", 1), null),
            ConfigurationErrorKind.UNKNOWN_PARAMETER);
    }

    @Test
    void mergeKeepsLaterValues() {
        Map<String, Object> merged = ConfigResolver.merge(List.of(Map.of("seed", 1), Map.of("seed", 2)));
        assertThat(merged).containsEntry("seed", 2);
    }

    private static void assertKind(org.assertj.core.api.ThrowableAssert.ThrowingCallable callable,
                                   ConfigurationErrorKind kind) {
        assertThatThrownBy(callable)
            .isInstanceOfSatisfying(ForecastConfigurationException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
