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
package com.amazon.rpsestimator.predictor;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Row count and min / max / mean of the corrected predictions of a batch. The
 * statistics are NaN for an empty batch.
 */
@Getter
@ToString
@AllArgsConstructor
public class PredictionSummary {

    private final int rows;

    private final double minPrediction;

    private final double maxPrediction;

    private final double meanPrediction;

    public static PredictionSummary of(List<PredictionRow> rows) {
        if (rows.isEmpty()) {
            return new PredictionSummary(0, Double.NaN, Double.NaN, Double.NaN);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (PredictionRow row : rows) {
            double value = row.getCorrectedPrediction();
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        return new PredictionSummary(rows.size(), min, max, sum / rows.size());
    }
}
