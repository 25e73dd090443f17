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
package com.amazon.rpsestimator.model;

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * Predicts the same value for every row, whatever the features.
 */
@Getter
public class ConstantRegressionModel implements IRegressionModel {

    private final double value;

    private final List<String> recordedFeatureNames;

    public ConstantRegressionModel(double value) {
        this(value, null);
    }

    public ConstantRegressionModel(double value, List<String> recordedFeatureNames) {
        checkArgument(Double.isFinite(value), "value must be finite");
        this.value = value;
        this.recordedFeatureNames = (recordedFeatureNames == null) ? null
                : Collections.unmodifiableList(new ArrayList<>(recordedFeatureNames));
    }

    @Override
    public double[] predict(double[][] features) {
        checkNotNull(features, "features cannot be null");
        double[] answer = new double[features.length];
        Arrays.fill(answer, value);
        return answer;
    }

    @Override
    public Optional<List<String>> getFeatureNames() {
        return Optional.ofNullable(recordedFeatureNames);
    }
}
