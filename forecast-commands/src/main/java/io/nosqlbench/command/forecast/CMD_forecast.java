package io.nosqlbench.command.forecast;

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

import io.nosqlbench.command.forecast.subcommands.CMD_forecast_fit;
import io.nosqlbench.command.forecast.subcommands.CMD_forecast_predict;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Forecasting Tool

 Fits additive forecast models to a time series and produces predictions with
 uncertainty intervals.

 ## Subcommands
 - `fit`: fit a model to a CSV series, save it as JSON, optionally write predictions
 - `predict`: load a saved model and write predictions for a future or supplied frame

 ## Configuration layers
 Settings are resolved in increasing precedence: built-in defaults, `--global-config`,
 `--local-config`, then `--set key=value` arguments.

 # Basic Usage
 ```
 forecast fit --input sales.csv --output model.json --set model=poisson --periods 30 --predictions out.csv
 forecast predict --model model.json --periods 30 --output out.csv
 ```
 */
@CommandLine.Command(name = "forecast",
    header = "Fit and predict with additive forecast models",
    description = "This provides utilities for fitting forecast models and predicting from them.\n" +
        "Use subcommands to fit a series or to predict from a saved model.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"},
    subcommands = {
        CMD_forecast_fit.class,
        CMD_forecast_predict.class,
        CommandLine.HelpCommand.class
    })
public class CMD_forecast implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_forecast.class);

    /**
     * Create the default CMD_forecast command
     */
    public CMD_forecast() {
    }

    /**
     * Run a forecast command
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// Builds the command line with the same parser settings [#main(String[])] uses.
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_forecast())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        logger.debug("no subcommand given");
        CommandLine.usage(this, System.out);
        return 0;
    }
}
