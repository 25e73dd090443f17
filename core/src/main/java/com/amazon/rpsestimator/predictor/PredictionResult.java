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

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class PredictionResult {

    private final List<PredictionRow> rows;

    private final PredictionMode mode;

    public PredictionResult(List<PredictionRow> rows, PredictionMode mode) {
        checkNotNull(rows, "rows cannot be null");
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.mode = checkNotNull(mode, "mode cannot be null");
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public PredictionSummary getSummary() {
        return PredictionSummary.of(rows);
    }
}
