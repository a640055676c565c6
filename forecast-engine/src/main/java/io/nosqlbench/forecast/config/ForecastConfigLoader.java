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
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads configuration layers from YAML documents.
 *
 * <p>A layer is a single mapping of snake_case keys, for example:
 *
 * <pre>{@code
 * model: poisson
 * n_changepoints: 10
 * interval_width: 0.95
 * sampling_period: 1d
 * }</pre>
 */
public final class ForecastConfigLoader {

    private ForecastConfigLoader() {
    }

    /**
     * Loads a configuration layer from a YAML file.
     *
     * @param path the file to read
     * @return the layer, keyed by setting name
     */
    public static Map<String, Object> loadLayer(Path path) {
        try {
            return parseLayer(Files.readString(path), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read configuration layer " + path, e);
        }
    }

    /**
     * Parses a configuration layer from YAML text. An empty document yields an empty layer.
     *
     * @param yaml the document
     * @param origin a description of where the text came from, for error messages
     * @return the layer, keyed by setting name
     */
    public static Map<String, Object> parseLayer(String yaml, String origin) {
        Load load = new Load(LoadSettings.builder().setLabel(origin).build());
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "malformed YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                origin + " must contain a mapping of settings, got " + document.getClass().getSimpleName());
        }
        Map<String, Object> layer = new LinkedHashMap<>();
        ((Map<?, ?>) document).forEach((key, value) -> layer.put(String.valueOf(key), value));
        return layer;
    }
}
