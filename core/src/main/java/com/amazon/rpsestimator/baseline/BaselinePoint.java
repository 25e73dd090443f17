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
package com.amazon.rpsestimator.baseline;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A rate point extended with its smoothed baseline. All smoothed values are
 * derived from earlier points only; for the first point of a series they are
 * NaN, and so is the residual.
 */
@Getter
@ToString
@AllArgsConstructor
public class BaselinePoint {

    private final Instant timestamp;

    private final long requestRate;

    private final double ewmaSlow;

    private final double ewmaFast;

    private final double baseline;

    private final double residual;

    public boolean isDefined() {
        return !Double.isNaN(residual);
    }
}
