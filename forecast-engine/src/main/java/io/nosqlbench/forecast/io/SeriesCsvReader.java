package io.nosqlbench.forecast.io;

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
import io.nosqlbench.forecast.series.PredictionFrame;
import io.nosqlbench.forecast.series.TimeSeries;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a series or a prediction frame from a CSV file with a header row.
 *
 * <pre>{@code
 * ds,y,temperature
 * 2024-01-01,12,3.5
 * 2024-01-02T00:00:00Z,15,4.0
 * }</pre>
 *
 * <p>Timestamps may be ISO instants, ISO local date-times or ISO dates; the latter two
 * are read as UTC. Rows must already be in increasing time order.
 */
public final class SeriesCsvReader {

    private static final Logger logger = LogManager.getLogger(SeriesCsvReader.class);

    public static final String DEFAULT_TIMESTAMP_COLUMN = "ds";
    public static final String DEFAULT_METRIC_COLUMN = "y";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .build();

    private final String timestampColumn;
    private final String metricColumn;
    private final List<String> regressorColumns;

    public SeriesCsvReader(String timestampColumn, String metricColumn, List<String> regressorColumns) {
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn cannot be null");
        this.metricColumn = Objects.requireNonNull(metricColumn, "metricColumn cannot be null");
        this.regressorColumns = List.copyOf(regressorColumns);
    }

    public SeriesCsvReader() {
        this(DEFAULT_TIMESTAMP_COLUMN, DEFAULT_METRIC_COLUMN, List.of());
    }

    public TimeSeries readSeries(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TimeSeries series = readSeries(reader);
            logger.info("read {} observations from {}", series.size(), path);
            return series;
        }
    }

    /**
     * @param reader CSV content with a header row
     * @return the series
     * @throws IOException if reading fails
     * @throws ForecastConfigurationException for a missing column, an unreadable timestamp
     *     ({@code INVALID_PARAMETER}) or a non-numeric metric ({@code DOMAIN_MISMATCH})
     */
    public TimeSeries readSeries(Reader reader) throws IOException {
        Table table = read(reader, true);
        return TimeSeries.of(table.timestamps, table.metric, table.regressors);
    }

    public PredictionFrame readFrame(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readFrame(reader);
        }
    }

    /**
     * Reads timestamps and regressor columns; a metric column, if present, is ignored.
     *
     * @param reader CSV content with a header row
     * @return the frame
     * @throws IOException if reading fails
     */
    public PredictionFrame readFrame(Reader reader) throws IOException {
        Table table = read(reader, false);
        return PredictionFrame.of(table.timestamps, table.regressors);
    }

    private Table read(Reader reader, boolean withMetric) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            requireColumn(header, timestampColumn);
            if (withMetric) {
                requireColumn(header, metricColumn);
            }
            for (String column : regressorColumns) {
                requireColumn(header, column);
            }

            List<Instant> timestamps = new ArrayList<>();
            List<Double> metric = new ArrayList<>();
            Map<String, List<Double>> regressors = new LinkedHashMap<>();
            regressorColumns.forEach(c -> regressors.put(c, new ArrayList<>()));
            for (CSVRecord record : parser) {
                long row = record.getRecordNumber();
                timestamps.add(parseTimestamp(record.get(timestampColumn), row));
                if (withMetric) {
                    metric.add(parseNumber(record.get(metricColumn), metricColumn, row,
                        ConfigurationErrorKind.DOMAIN_MISMATCH));
                }
                for (String column : regressorColumns) {
                    regressors.get(column).add(parseNumber(record.get(column), column, row,
                        ConfigurationErrorKind.INVALID_PARAMETER));
                }
            }
            Map<String, double[]> columns = new LinkedHashMap<>();
            regressors.forEach((name, values) -> columns.put(name, toArray(values)));
            return new Table(timestamps, toArray(metric), columns);
        }
    }

    private static void requireColumn(List<String> header, String column) {
        if (!header.contains(column)) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "CSV has no column '" + column + "', found " + header);
        }
    }

    private static double parseNumber(String text, String column, long row, ConfigurationErrorKind kind) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ForecastConfigurationException(kind,
                "column '" + column + "' row " + row + " is not a number: '" + text + "'", e);
        }
    }

    /**
     * Parses an ISO instant, ISO local date-time or ISO date; the latter two as UTC.
     *
     * @param text the timestamp text
     * @return the instant
     */
    public static Instant parseTimestamp(String text) {
        return parseTimestamp(text, -1);
    }

    private static Instant parseTimestamp(String text, long row) {
        String trimmed = text.trim();
        try {
            if (trimmed.endsWith("Z") || trimmed.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(trimmed).toInstant();
            }
            if (trimmed.contains("T")) {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            }
            return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "unreadable timestamp '" + text + "'" + (row >= 0 ? " at row " + row : ""), e);
        }
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    private static final class Table {
        private final List<Instant> timestamps;
        private final double[] metric;
        private final Map<String, double[]> regressors;

        private Table(List<Instant> timestamps, double[] metric, Map<String, double[]> regressors) {
            this.timestamps = timestamps;
            this.metric = metric;
            this.regressors = regressors;
        }
    }
}
