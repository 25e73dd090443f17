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

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The prediction for one interval. {@code actual} is the observed request rate
 * of the interval; {@code correctedPrediction} is the base prediction plus the
 * residual correction, never below 0.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class PredictionRow {

    private final Instant timestamp;

    private final double actual;

    private final double basePrediction;

    private final double correctedPrediction;
}
