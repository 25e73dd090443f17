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
package com.amazon.rpsestimator.examples;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import com.amazon.rpsestimator.features.FeatureNames;
import com.amazon.rpsestimator.model.ConstantRegressionModel;
import com.amazon.rpsestimator.model.LinearRegressionModel;
import com.amazon.rpsestimator.predictor.EnsemblePredictor;
import com.amazon.rpsestimator.predictor.PredictionMode;
import com.amazon.rpsestimator.predictor.PredictionResult;
import com.amazon.rpsestimator.predictor.PredictionRow;
import com.amazon.rpsestimator.predictor.PredictionSummary;
import com.amazon.rpsestimator.rate.RateBuilder;
import com.amazon.rpsestimator.serialize.ModelArtifactLoader;
import com.amazon.rpsestimator.testutils.EventDataSets;

/**
 * Write a linear base model and a residual model to a models directory, load
 * them back and predict an hour of Poisson traffic with an injected burst.
 */
public class BurstyTrafficExample implements Example {

    public static void main(String[] args) throws Exception {
        new BurstyTrafficExample().run();
    }

    @Override
    public String command() {
        return "bursty";
    }

    @Override
    public String description() {
        return "predict bursty traffic with linear models loaded from a models directory";
    }

    @Override
    public void run() throws Exception {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        List<Instant> calm = EventDataSets.poisson(start, Duration.ofHours(1), 5, 42L);
        List<Instant> events = EventDataSets.withBurst(calm, start.plus(Duration.ofMinutes(30)),
                Duration.ofMinutes(5), 6000, 7L);

        List<String> features = Arrays.asList(FeatureNames.BASELINE, FeatureNames.EWMA_FAST, FeatureNames.LAG_1,
                FeatureNames.BURST_STRENGTH);
        LinearRegressionModel base = new LinearRegressionModel(0, new double[] { 0.6, 0.4, 0.5, 2.0 }, features);

        Path models = Files.createTempDirectory("rps-models");
        ModelArtifactLoader loader = new ModelArtifactLoader();
        loader.writeModel(base, models.resolve(ModelArtifactLoader.BASE_MODEL_FILE));
        loader.writeModel(new ConstantRegressionModel(-2), models.resolve(ModelArtifactLoader.RESIDUAL_MODEL_FILE));

        EnsemblePredictor predictor = loader.loadPredictor(models, new RateBuilder());
        PredictionResult result = predictor.predictTimestamps(events);
        PredictionSummary summary = result.getSummary();

        System.out.printf("events = %d, predicted intervals = %d, mode = %s%n", events.size(), result.size(),
                result.getMode());
        System.out.printf("corrected prediction min = %.1f, max = %.1f, mean = %.1f%n", summary.getMinPrediction(),
                summary.getMaxPrediction(), summary.getMeanPrediction());

        PredictionRow peak = result.getRows().get(0);
        for (PredictionRow row : result.getRows()) {
            if (row.getActual() > peak.getActual()) {
                peak = row;
            }
        }
        System.out.printf("busiest interval %s: actual = %.1f, corrected = %.1f%n", peak.getTimestamp(),
                peak.getActual(), peak.getCorrectedPrediction());

        if (result.getMode() != PredictionMode.FULL || summary.getMinPrediction() < 0) {
            throw new IllegalStateException("expected non-negative predictions from both models");
        }
        System.out.println("Looks good!");
    }
}
