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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves layered partial configurations into one {@link ForecastConfig}.
 *
 * <h2>Precedence</h2>
 *
 * <pre>{@code
 *   defaults  <  global settings  <  local settings  <  explicit call arguments
 * }</pre>
 *
 * <p>Each layer is an optional flat map of snake_case keys. A key present in a later
 * layer replaces the value of earlier layers; a {@code null} value leaves the earlier
 * value in place. Unknown keys fail fast in whichever layer they appear.
 *
 * <p>This lives outside the numeric core: the engine only ever sees the resolved
 * {@link ForecastConfig}.
 */
public final class ConfigResolver {
    private static final Logger logger = LogManager.getLogger(ConfigResolver.class);

    private ConfigResolver() {
    }

    /**
     * Resolves four optional layers, the first of which is usually
     * {@link ForecastConfig#defaultLayer()}.
     *
     * @param defaults the lowest-precedence layer, may be null
     * @param global global settings, may be null
     * @param local local (per run) settings, may be null
     * @param explicit explicit call arguments, may be null
     * @return the validated configuration
     */
    public static ForecastConfig resolve(Map<String, ?> defaults, Map<String, ?> global,
                                         Map<String, ?> local, Map<String, ?> explicit) {
        return ForecastConfig.fromMap(merge(Arrays.asList(defaults, global, local, explicit)));
    }

    /**
     * Resolves the built-in defaults overlaid by the given layers in increasing
     * precedence.
     *
     * @param layers the layers, lowest precedence first; entries may be null
     * @return the validated configuration
     */
    @SafeVarargs
    public static ForecastConfig resolveOverDefaults(Map<String, ?>... layers) {
        List<Map<String, ?>> ordered = new ArrayList<>();
        ordered.add(ForecastConfig.defaultLayer());
        ordered.addAll(Arrays.asList(layers));
        return ForecastConfig.fromMap(merge(ordered));
    }

    static Map<String, Object> merge(List<? extends Map<String, ?>> layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        int level = 0;
        for (Map<String, ?> layer : layers) {
            if (layer != null) {
                for (Map.Entry<String, ?> entry : layer.entrySet()) {
                    if (!ForecastConfig.KEYS.contains(entry.getKey())) {
                        throw new ForecastConfigurationException(ConfigurationErrorKind.UNKNOWN_PARAMETER,
                            "unknown configuration key '" + entry.getKey() + "' in layer " + level);
                    }
                    if (entry.getValue() != null) {
                        Object previous = merged.put(entry.getKey(), entry.getValue());
                        if (previous != null && !previous.equals(entry.getValue())) {
                            logger.debug("layer {} overrides {}: {} -> {}", level, entry.getKey(), previous, entry.getValue());
                        }
                    }
                }
            }
            level++;
        }
        return merged;
    }
}
