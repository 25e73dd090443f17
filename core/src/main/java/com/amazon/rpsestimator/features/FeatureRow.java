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
package com.amazon.rpsestimator.features;

import java.time.Instant;
import java.util.Arrays;

import lombok.Getter;
import lombok.ToString;

/**
 * One engineered row. The values are positional; their names are held by the
 * enclosing {@link FeatureFrame}.
 */
@Getter
@ToString
public class FeatureRow {

    private final Instant timestamp;

    private final long requestRate;

    private final double[] values;

    public FeatureRow(Instant timestamp, long requestRate, double[] values) {
        this.timestamp = timestamp;
        this.requestRate = requestRate;
        this.values = Arrays.copyOf(values, values.length);
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double getValue(int index) {
        return values[index];
    }
}
