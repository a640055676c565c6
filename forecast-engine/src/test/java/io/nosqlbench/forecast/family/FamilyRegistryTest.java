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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class FamilyRegistryTest {

    @Test
    void registersAllSevenFamilies() {
        assertThat(FamilyRegistry.tags()).containsExactly(
            "normal", "poisson", "gamma", "beta", "negative_binomial", "binomial", "beta_binomial");
    }

    @Test
    void canonicalizesUserTags() {
        assertThat(FamilyRegistry.canonicalTag(" Negative-Binomial ")).isEqualTo("negative_binomial");
        assertThat(FamilyRegistry.isRegistered("Beta Binomial")).isTrue();
        assertThat(FamilyRegistry.isRegistered("lognormal")).isFalse();
    }

    @Test
    void createsTheRightImplementation() {
        assertThat(FamilyRegistry.create("poisson", null, 0.25)).isInstanceOf(PoissonFamily.class);
        assertThat(FamilyRegistry.create("GAMMA", null, 0.25)).isInstanceOf(GammaFamily.class);
        LikelihoodFamily binomial = FamilyRegistry.create("binomial", 40, 0.25);
        assertThat(binomial).isInstanceOf(BinomialFamily.class);
        assertThat(((BinomialFamily) binomial).getCapacity()).isEqualTo(40);
        assertThat(((BetaFamily) FamilyRegistry.create("beta", null, 0.1)).getVarianceMax()).isEqualTo(0.1);
        assertThat(FamilyRegistry.typeOf("beta_binomial")).isEqualTo(BetaBinomialFamily.class);
    }

    @Test
    void capacityFamiliesRequireACapacity() {
        assertThat(FamilyRegistry.requiresCapacity("binomial")).isTrue();
        assertThat(FamilyRegistry.requiresCapacity("poisson")).isFalse();
        assertThatThrownBy(() -> FamilyRegistry.create("beta_binomial", null, 0.25))
            .isInstanceOfSatisfying(ForecastConfigurationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ConfigurationErrorKind.MISSING_CAPACITY));
        assertThatThrownBy(() -> FamilyRegistry.create("binomial", 0, 0.25))
            .isInstanceOfSatisfying(ForecastConfigurationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ConfigurationErrorKind.MISSING_CAPACITY));
    }

    @Test
    void unknownTagIsAnInvalidFamily() {
        assertThatThrownBy(() -> FamilyRegistry.create("weibull", null, 0.25))
            .isInstanceOfSatisfying(ForecastConfigurationException.class,
                e -> assertThat(e.getKind()).isEqualTo(ConfigurationErrorKind.INVALID_FAMILY))
            .hasMessageContaining("weibull");
    }
}
