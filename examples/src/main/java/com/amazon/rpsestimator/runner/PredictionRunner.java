/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */
package com.amazon.rpsestimator.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.input.EventRecord;
import com.amazon.rpsestimator.input.TimeFieldResolver;
import com.amazon.rpsestimator.predictor.EnsemblePredictor;
import com.amazon.rpsestimator.predictor.PredictionResult;
import com.amazon.rpsestimator.predictor.PredictionRow;
import com.amazon.rpsestimator.predictor.PredictionSummary;
import com.amazon.rpsestimator.rate.RateBuilder;
import com.amazon.rpsestimator.serialize.JsonFilePredictionStore;
import com.amazon.rpsestimator.serialize.ModelArtifactLoader;

/**
 * Reads delimited event records with a header row, predicts the request rate
 * of every interval and writes one output line per predicted interval.
 */
@Slf4j
public class PredictionRunner {

    public static final String[] RESULT_COLUMNS = { "timestamp", "actual", "base_prediction",
            "corrected_prediction" };

    public static void main(String... args) throws IOException {
        PredictionRunner runner = new PredictionRunner();
        runner.parse(args);
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    protected final ArgumentParser argumentParser;
    protected final Clock clock;
    protected int lineNumber;
    @Getter
    protected PredictionResult lastResult;

    public PredictionRunner() {
        this(new ArgumentParser(PredictionRunner.class.getName(),
                "Estimate the request rate per interval of the events read from stdin."), Clock.systemUTC());
    }

    public PredictionRunner(ArgumentParser argumentParser, Clock clock) {
        this.argumentParser = argumentParser;
        this.clock = clock;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String delimiter = Pattern.quote(argumentParser.getDelimiter());
        String[] header = null;
        List<EventRecord> records = new ArrayList<>();
        lineNumber = 0;

        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(delimiter, -1);
            if (header == null) {
                header = values;
                continue;
            }
            records.add(toRecord(header, values));
        }
        log.debug("Read {} records", records.size());

        PredictionResult result = predict(createPredictor(), records);
        writeHeader(out);
        for (PredictionRow row : result.getRows()) {
            writeRow(row, out);
        }
        out.flush();

        PredictionSummary summary = result.getSummary();
        log.info("Predicted {} intervals in mode {} (min {}, max {}, mean {})", summary.getRows(), result.getMode(),
                summary.getMinPrediction(), summary.getMaxPrediction(), summary.getMeanPrediction());
        if (!argumentParser.getStoreFile().isEmpty()) {
            new JsonFilePredictionStore(Paths.get(argumentParser.getStoreFile())).store(result.getRows(),
                    argumentParser.getSource());
        }
        lastResult = result;
    }

    protected EventRecord toRecord(String[] header, String[] values) {
        if (values.length != header.length) {
            throw new IllegalArgumentException(
                    String.format("Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                            header.length, values.length));
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            fields.put(header[i].trim(), values[i].trim());
        }
        return new EventRecord(fields);
    }

    protected EnsemblePredictor createPredictor() {
        RateBuilder rateBuilder = RateBuilder.builder().intervalWidth(argumentParser.getIntervalWidth()).build();
        return new ModelArtifactLoader().loadPredictor(Paths.get(argumentParser.getModelsDirectory()), rateBuilder);
    }

    protected PredictionResult predict(EnsemblePredictor predictor, List<EventRecord> records) {
        TimeFieldResolver resolver = predictor.getTimeFieldResolver();
        if (argumentParser.getSynthesizeTimestamps() && !records.isEmpty()
                && !resolver.findTimeField(records).isPresent()) {
            log.warn("No time field among {}; assigning timestamps one second apart",
                    records.get(0).getFields().keySet());
            Instant start = clock.instant();
            List<Instant> timestamps = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                timestamps.add(start.plusSeconds(i));
            }
            return predictor.predictTimestamps(timestamps);
        }
        return predictor.predict(records);
    }

    protected void writeHeader(PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        for (String column : RESULT_COLUMNS) {
            joiner.add(column);
        }
        out.println(joiner.toString());
    }

    protected void writeRow(PredictionRow row, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        joiner.add(row.getTimestamp().toString());
        joiner.add(Double.toString(row.getActual()));
        joiner.add(Double.toString(row.getBasePrediction()));
        joiner.add(Double.toString(row.getCorrectedPrediction()));
        out.println(joiner.toString());
    }
}
