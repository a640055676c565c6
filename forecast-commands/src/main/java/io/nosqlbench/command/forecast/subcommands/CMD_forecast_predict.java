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

import io.nosqlbench.forecast.errors.ForecastException;
import io.nosqlbench.forecast.io.PredictionCsvWriter;
import io.nosqlbench.forecast.io.SeriesCsvReader;
import io.nosqlbench.forecast.model.FittedForecastModel;
import io.nosqlbench.forecast.predict.PredictionTable;
import io.nosqlbench.forecast.design.ExternalRegressor;
import io.nosqlbench.forecast.serialize.FittedModelSerializer;
import io.nosqlbench.forecast.series.PredictionFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// Subcommand that loads a saved model and writes predictions.
@CommandLine.Command(name = "predict",
    header = "Predict from a saved forecast model",
    description = "Load a model written by 'fit' and predict either future periods or the timestamps of a CSV frame.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_forecast_predict implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_forecast_predict.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-m", "--model"},
        description = "Model JSON file written by the fit subcommand",
        required = true)
    private Path modelPath;

    @CommandLine.Option(names = {"-o", "--output"},
        description = "Output CSV file for predictions",
        required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"-f", "--force"},
        description = "Force overwrite if the output file already exists")
    private boolean force = false;

    @CommandLine.Option(names = {"--frame"},
        description = "CSV file of timestamps (and regressor values) to predict at")
    private Path framePath;

    @CommandLine.Option(names = {"--timestamp-column"},
        description = "Name of the timestamp column in the frame and the output",
        defaultValue = SeriesCsvReader.DEFAULT_TIMESTAMP_COLUMN)
    private String timestampColumn = SeriesCsvReader.DEFAULT_TIMESTAMP_COLUMN;

    @CommandLine.Option(names = {"--periods"},
        description = "Number of future periods to predict when no frame is given",
        defaultValue = "0")
    private int periods = 0;

    @CommandLine.Option(names = {"--include-history"},
        description = "Include the training timestamps when no frame is given")
    private boolean includeHistory = false;

    @CommandLine.Option(names = {"--interval-width"},
        description = "Interval width in (0, 1); defaults to the width the model was fitted with")
    private Double intervalWidth;

    @CommandLine.Option(names = {"--components"},
        description = "Also write the per-component contributions")
    private boolean components = false;

    @Override
    public Integer call() {
        try {
            if (!force && Files.exists(outputPath)) {
                logger.error("Output file {} already exists, use --force to overwrite", outputPath);
                return EXIT_ERROR;
            }
            FittedForecastModel model = FittedModelSerializer.load(modelPath);
            logger.info("Loaded {} from {}", model, modelPath);

            PredictionFrame frame;
            if (framePath != null) {
                List<String> regressorColumns = model.getRegressors().stream()
                    .map(ExternalRegressor::getName)
                    .collect(Collectors.toList());
                frame = new SeriesCsvReader(timestampColumn, SeriesCsvReader.DEFAULT_METRIC_COLUMN, regressorColumns)
                    .readFrame(framePath);
            } else if (periods > 0 || includeHistory) {
                frame = model.makeFutureFrame(periods, includeHistory);
            } else {
                logger.error("Nothing to predict: give --frame, --periods or --include-history");
                return EXIT_ERROR;
            }

            PredictionTable table = intervalWidth == null ? model.predict(frame) : model.predict(frame, intervalWidth);
            new PredictionCsvWriter(timestampColumn, components).write(table, outputPath);
            logger.info("Wrote {} predictions to {}", table.size(), outputPath);
            return EXIT_SUCCESS;
        } catch (ForecastException | IllegalArgumentException e) {
            logger.error("Predict failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
