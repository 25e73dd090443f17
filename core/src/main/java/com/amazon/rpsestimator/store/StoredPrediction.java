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
package com.amazon.rpsestimator.store;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.rpsestimator.predictor.PredictionRow;

/**
 * A persisted prediction point, tagged with the batch it came from.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class StoredPrediction {

    public static final String CURRENT_VERSION = "v1";

    private final Instant timestamp;

    private final double actual;

    private final double basePrediction;

    private final double correctedPrediction;

    private final String source;

    private final String version;

    public static StoredPrediction of(PredictionRow row, String source) {
        return new StoredPrediction(row.getTimestamp(), row.getActual(), row.getBasePrediction(),
                row.getCorrectedPrediction(), source, CURRENT_VERSION);
    }

    public PredictionRow toPredictionRow() {
        return new PredictionRow(timestamp, actual, basePrediction, correctedPrediction);
    }
}
