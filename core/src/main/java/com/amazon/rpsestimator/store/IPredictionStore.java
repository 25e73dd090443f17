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

import java.util.Comparator;
import java.util.List;

import com.amazon.rpsestimator.predictor.PredictionRow;

/**
 * Where prediction series are kept for later range queries. A point with the
 * same timestamp and source as an earlier one replaces it.
 */
public interface IPredictionStore {

    Comparator<StoredPrediction> ORDER = Comparator.comparing(StoredPrediction::getTimestamp)
            .thenComparing(StoredPrediction::getSource);

    /**
     * @param rows   the prediction series
     * @param source identifies the batch, typically the uploaded file name
     */
    void store(List<PredictionRow> rows, String source);

    /**
     * @param range the time range, inclusive at both ends
     * @return the stored points in the range, ordered by timestamp then source
     */
    List<StoredPrediction> query(TimeRange range);
}
