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

import java.util.List;
import java.util.Optional;

/**
 * A trained regression estimator. Callers hand it a matrix whose columns follow
 * the model's feature schema and get one prediction per row back.
 */
public interface IRegressionModel {

    /**
     * @param features one array per row, columns ordered per the feature schema
     * @return one prediction per row
     */
    double[] predict(double[][] features);

    /**
     * @return the feature names recorded in the model at training time, if the
     *         model keeps them
     */
    default Optional<List<String>> getFeatureNames() {
        return Optional.empty();
    }
}
