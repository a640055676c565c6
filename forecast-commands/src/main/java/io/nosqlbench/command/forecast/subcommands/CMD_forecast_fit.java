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

import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.design.Seasonality;
import io.nosqlbench.forecast.errors.ForecastException;
import io.nosqlbench.forecast.io.PredictionCsvWriter;
import io.nosqlbench.forecast.io.SeriesCsvReader;
import io.nosqlbench.forecast.model.FittedForecastModel;
import io.nosqlbench.forecast.model.Forecaster;
import io.nosqlbench.forecast.predict.PredictionTable;
import io.nosqlbench.forecast.serialize.FittedModelSerializer;
import io.nosqlbench.forecast.series.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Subcommand that fits a model to a CSV series and saves it as JSON.
 */
@CommandLine.Command(name = "fit",
    header = "Fit a forecast model to a time series",
    description = "Read a CSV series, fit a model under the layered configuration and save it as JSON.\n" +
        "Optionally predict a number of future periods in the same run.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_forecast_fit implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_forecast_fit.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-i", "--input"},
        description = "Input CSV file with a header row",
        required = true)
    private Path inputPath;

    @CommandLine.Option(names = {"-o", "--output"},
        description = "Output JSON file for the fitted model",
        required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"-f", "--force"},
        description = "Force overwrite if output files already exist")
    private boolean force = false;

    @CommandLine.Option(names = {"--timestamp-column"},
        description = "Name of the timestamp column",
        defaultValue = SeriesCsvReader.DEFAULT_TIMESTAMP_COLUMN)
    private String timestampColumn = SeriesCsvReader.DEFAULT_TIMESTAMP_COLUMN;

    @CommandLine.Option(names = {"--metric-column"},
        description = "Name of the metric column",
        defaultValue = SeriesCsvReader.DEFAULT_METRIC_COLUMN)
    private String metricColumn = SeriesCsvReader.DEFAULT_METRIC_COLUMN;

    @CommandLine.Option(names = {"--regressor"},
        description = "Column to use as an external regressor (repeatable)")
    private List<String> regressors = new ArrayList<>();

    @CommandLine.Option(names = {"--seasonality"},
        description = "Seasonality as name:period_days:order, e.g. weekly:7:3 (repeatable)")
    private List<String> seasonalities = new ArrayList<>();

    @CommandLine.Option(names = {"--periods"},
        description = "Number of future periods to predict after fitting",
        defaultValue = "0")
    private int periods = 0;

    @CommandLine.Option(names = {"--include-history"},
        description = "Include the training timestamps in the predictions")
    private boolean includeHistory = false;

    @CommandLine.Option(names = {"--predictions"},
        description = "Output CSV file for predictions; required with --periods or --include-history")
    private Path predictionsPath;

    @CommandLine.Mixin
    private ConfigLayerOptions configOptions = new ConfigLayerOptions();

    @Override
    public Integer call() {
        try {
            if (!force && Files.exists(outputPath)) {
                logger.error("Output file {} already exists, use --force to overwrite", outputPath);
                return EXIT_ERROR;
            }
            boolean predicting = periods > 0 || includeHistory;
            if (predicting && predictionsPath == null) {
                logger.error("--predictions is required when predicting");
                return EXIT_ERROR;
            }
            if (predicting && !force && Files.exists(predictionsPath)) {
                logger.error("Predictions file {} already exists, use --force to overwrite", predictionsPath);
                return EXIT_ERROR;
            }
            if (predicting && !regressors.isEmpty()) {
                logger.error("Cannot predict without values for regressors {}; "
                    + "fit without --periods and run 'predict --frame' instead", regressors);
                return EXIT_ERROR;
            }

            ForecastConfig config = configOptions.resolve();
            Forecaster.Builder builder = Forecaster.builder(config);
            for (String text : seasonalities) {
                builder.addSeasonality(parseSeasonality(text));
            }
            regressors.forEach(builder::addRegressor);
            Forecaster forecaster = builder.build();

            TimeSeries series = new SeriesCsvReader(timestampColumn, metricColumn, regressors).readSeries(inputPath);
            logger.info("Read {} rows from {}", series.size(), inputPath);
            FittedForecastModel model = forecaster.fit(series);

            // nothing is written until both outputs are ready
            PredictionTable table = predicting ? model.predict(model.makeFutureFrame(periods, includeHistory)) : null;
            FittedModelSerializer.save(outputPath, model);
            logger.info("Saved {} to {}", model, outputPath);
            if (table != null) {
                new PredictionCsvWriter(timestampColumn, false).write(table, predictionsPath);
                logger.info("Wrote {} predictions to {}", table.size(), predictionsPath);
            }
            return EXIT_SUCCESS;
        } catch (ForecastException | IllegalArgumentException e) {
            logger.error("Fit failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (UncheckedIOException e) {
            logger.error("I/O error: {}", e.getMessage(), e.getCause());
            return EXIT_ERROR;
        }
    }

    /**
     * Parses {@code name:period_days:order}.
     * @param text the seasonality text
     * @return the seasonality
     */
    static Seasonality parseSeasonality(String text) {
        String[] parts = text.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("seasonality must be name:period_days:order, got '" + text + "'");
        }
        return new Seasonality(parts[0].trim(), Double.parseDouble(parts[1].trim()), Integer.parseInt(parts[2].trim()));
    }
}
