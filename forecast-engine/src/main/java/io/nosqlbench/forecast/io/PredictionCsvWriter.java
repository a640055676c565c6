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

import io.nosqlbench.forecast.predict.PredictionColumn;
import io.nosqlbench.forecast.predict.PredictionTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Writes a prediction table as CSV: the timestamp, every [PredictionColumn] in
/// declaration order and, optionally, the linked contribution of each component.
public final class PredictionCsvWriter {

    private static final Logger logger = LogManager.getLogger(PredictionCsvWriter.class);

    private final String timestampColumn;
    private final boolean includeComponents;

    public PredictionCsvWriter(String timestampColumn, boolean includeComponents) {
        this.timestampColumn = timestampColumn;
        this.includeComponents = includeComponents;
    }

    public PredictionCsvWriter() {
        this(SeriesCsvReader.DEFAULT_TIMESTAMP_COLUMN, false);
    }

    public void write(PredictionTable table, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
        logger.info("wrote {} prediction rows to {}", table.size(), path);
    }

    public void write(PredictionTable table, Writer writer) throws IOException {
        List<String> header = new ArrayList<>();
        header.add(timestampColumn);
        header.addAll(PredictionColumn.columnNames());
        Map<String, double[]> components = includeComponents ? table.components() : Map.of();
        header.addAll(components.keySet());

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(new String[0]))
            .setRecordSeparator('\n')
            .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (int row = 0; row < table.size(); row++) {
            List<Object> values = new ArrayList<>(header.size());
            values.add(table.timestamp(row).toString());
            for (PredictionColumn column : PredictionColumn.values()) {
                values.add(table.get(row, column));
            }
            for (double[] component : components.values()) {
                values.add(component[row]);
            }
            printer.printRecord(values);
        }
        printer.flush();
    }
}
