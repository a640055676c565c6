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


import io.nosqlbench.forecast.SeriesFixtures;
import io.nosqlbench.forecast.config.ForecastConfig;
import io.nosqlbench.forecast.design.Seasonality;
import io.nosqlbench.forecast.model.FittedForecastModel;
import io.nosqlbench.forecast.model.Forecaster;
import io.nosqlbench.forecast.predict.PredictionColumn;
import io.nosqlbench.forecast.predict.PredictionTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PredictionCsvWriterTest {

    private static PredictionTable table;

    @BeforeAll
    static void predict() {
        ForecastConfig config = ForecastConfig.builder("normal").nChangepoints(2).trendSamples(30).seed(8L).build();
        FittedForecastModel model = Forecaster.builder(config).addSeasonality(new Seasonality("weekly", 7.0, 1))
            .build()
            .fit(SeriesFixtures.weeklyRamp(28));
        table = model.predict(model.makeFutureFrame(5, false));
    }

    private static List<CSVRecord> parse(String csv) throws IOException {
        try (CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
            .parse(new StringReader(csv))) {
            List<CSVRecord> records = new ArrayList<>(parser.getRecords());
            assertFalse(parser.getHeaderNames().isEmpty());
            return records;
        }
    }

    @Test
    void writesTimestampAndAllPredictionColumns() throws IOException {
        StringWriter out = new StringWriter();
        new PredictionCsvWriter().write(table, out);
        String csv = out.toString();

        String header = csv.substring(0, csv.indexOf('\n'));
        List<String> expected = new ArrayList<>();
        expected.add("ds");
        expected.addAll(PredictionColumn.columnNames());
        assertEquals(String.join(",", expected), header);

        List<CSVRecord> records = parse(csv);
        assertEquals(5, records.size());
        assertEquals(table.timestamp(0).toString(), records.get(0).get("ds"));
        assertEquals(table.get(4, PredictionColumn.YHAT_UPPER), Double.parseDouble(records.get(4).get("yhat_upper")));
        assertEquals(table.get(2, PredictionColumn.TREND_LOWER_LINKED),
            Double.parseDouble(records.get(2).get("trend_lower_linked")));
    }

    @Test
    void componentsAreAppendedOnRequest(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("predictions.csv");
        new PredictionCsvWriter("timestamp", true).write(table, file);
        String csv = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(csv.startsWith("timestamp,yhat,"));

        List<CSVRecord> records = parse(csv);
        assertEquals(table.components().get("weekly")[3], Double.parseDouble(records.get(3).get("weekly")));
    }
}
