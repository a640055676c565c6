package io.nosqlbench.command.forecast.subcommands;

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

import io.nosqlbench.forecast.config.ConfigResolver;
import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.config.ForecastConfigLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Shared options for the layered configuration of a fit. Mixed into subcommands with
/// [CommandLine.Mixin].
public class ConfigLayerOptions {

    @CommandLine.Option(names = {"--global-config"},
        description = "YAML file of global settings")
    Path globalConfig;

    @CommandLine.Option(names = {"--local-config"},
        description = "YAML file of local settings, overriding global settings")
    Path localConfig;

    @CommandLine.Option(names = {"--set"},
        description = "Explicit setting as key=value, overriding both files (repeatable)")
    Map<String, String> explicit = new LinkedHashMap<>();

    /// Resolves defaults, the two files and the explicit settings into one configuration.
    /// @return the validated configuration
    public ForecastConfig resolve() {
        Map<String, Object> global = globalConfig == null ? null : ForecastConfigLoader.loadLayer(globalConfig);
        Map<String, Object> local = localConfig == null ? null : ForecastConfigLoader.loadLayer(localConfig);
        return ConfigResolver.resolve(ForecastConfig.defaultLayer(), global, local, explicit);
    }
}
