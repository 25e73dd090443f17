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
 * {@code intercept + sum(coefficients[j] * x[j])}. The model records the name
 * of the feature each coefficient applies to, so a feature schema can be read
 * off the model itself.
 */
@Getter
public class LinearRegressionModel implements IRegressionModel {

    private final double intercept;

    private final double[] coefficients;

    private final List<String> recordedFeatureNames;

    public LinearRegressionModel(double intercept, double[] coefficients, List<String> recordedFeatureNames) {
        checkNotNull(coefficients, "coefficients cannot be null");
        checkNotNull(recordedFeatureNames, "feature names cannot be null");
        checkArgument(coefficients.length == recordedFeatureNames.size(),
                "one feature name is required per coefficient");
        this.intercept = intercept;
        this.coefficients = Arrays.copyOf(coefficients, coefficients.length);
        this.recordedFeatureNames = Collections.unmodifiableList(new ArrayList<>(recordedFeatureNames));
    }

    @Override
    public double[] predict(double[][] features) {
        checkNotNull(features, "features cannot be null");
        double[] answer = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            checkArgument(features[i].length == coefficients.length, "expected " + coefficients.length
                    + " features but row " + i + " has " + features[i].length);
            double sum = intercept;
            for (int j = 0; j < coefficients.length; j++) {
                sum += coefficients[j] * features[i][j];
            }
            answer[i] = sum;
        }
        return answer;
    }

    public double[] getCoefficients() {
        return Arrays.copyOf(coefficients, coefficients.length);
    }

    @Override
    public Optional<List<String>> getFeatureNames() {
        return Optional.of(recordedFeatureNames);
    }
}
