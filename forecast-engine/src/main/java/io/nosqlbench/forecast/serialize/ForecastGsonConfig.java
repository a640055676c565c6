package io.nosqlbench.forecast.serialize;

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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.forecast.design.BoxProfile;
import io.nosqlbench.forecast.design.CauchyProfile;
import io.nosqlbench.forecast.design.EventProfile;
import io.nosqlbench.forecast.design.GaussianProfile;
import io.nosqlbench.forecast.family.FamilyRegistry;
import io.nosqlbench.forecast.family.LikelihoodFamily;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/// Shared Gson configuration for fitted-model persistence.
///
/// - snake_case field names, matching the configuration keys
/// - NaN and infinities allowed, since families without dispersion store `kappa` as NaN
/// - ISO-8601 strings for [Instant] and [Duration]
/// - type-discriminated [LikelihoodFamily] and [EventProfile]
///
/// The returned instances are thread-safe.
public final class ForecastGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private ForecastGsonConfig() {
    }

    /// @return the shared pretty-printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a compact instance, one document per line
    public static Gson compactGson() {
        return builder().create();
    }

    /// @return a builder with all engine adapters registered
    public static GsonBuilder builder() {
        TypeNameAdapterFactory<LikelihoodFamily> families = TypeNameAdapterFactory.of(LikelihoodFamily.class);
        for (String tag : FamilyRegistry.tags()) {
            families.registerType(FamilyRegistry.typeOf(tag));
        }
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .registerTypeAdapter(Duration.class, new DurationAdapter().nullSafe())
            .registerTypeAdapterFactory(families)
            .registerTypeAdapterFactory(TypeNameAdapterFactory.of(EventProfile.class)
                .registerType(BoxProfile.class)
                .registerType(GaussianProfile.class)
                .registerType(CauchyProfile.class));
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            return Instant.parse(in.nextString());
        }
    }

    private static final class DurationAdapter extends TypeAdapter<Duration> {
        @Override
        public void write(JsonWriter out, Duration value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Duration read(JsonReader in) throws IOException {
            return Duration.parse(in.nextString());
        }
    }
}
