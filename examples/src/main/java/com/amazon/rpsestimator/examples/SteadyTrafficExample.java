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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.amazon.rpsestimator.model.ConstantRegressionModel;
import com.amazon.rpsestimator.predictor.EnsemblePredictor;
import com.amazon.rpsestimator.predictor.PredictionMode;
import com.amazon.rpsestimator.predictor.PredictionResult;
import com.amazon.rpsestimator.predictor.PredictionRow;
import com.amazon.rpsestimator.testutils.EventDataSets;

/**
 * Predict ten minutes of perfectly steady traffic, one request per second,
 * with a constant base model.
 */
public class SteadyTrafficExample implements Example {

    public static void main(String[] args) throws Exception {
        new SteadyTrafficExample().run();
    }

    @Override
    public String command() {
        return "steady";
    }

    @Override
    public String description() {
        return "predict ten minutes of steady traffic with a constant model";
    }

    @Override
    public void run() throws Exception {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        List<Instant> events = EventDataSets.evenlySpaced(start, 600, Duration.ofSeconds(1));

        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(100))
                .build();
        PredictionResult result = predictor.predictTimestamps(events);

        System.out.printf("events = %d, predicted intervals = %d, mode = %s%n", events.size(), result.size(),
                result.getMode());
        for (PredictionRow row : result.getRows()) {
            System.out.printf("%s actual = %.1f corrected = %.1f%n", row.getTimestamp(), row.getActual(),
                    row.getCorrectedPrediction());
        }

        // the first five intervals only fill the look-back window
        if (result.size() != 5 || result.getMode() != PredictionMode.BASE_ONLY) {
            throw new IllegalStateException("expected five base-only predictions");
        }
        System.out.println("Looks good!");
    }
}
