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

/**
 * How a prediction result was produced. Every mode other than {@link #FULL}
 * and {@link #BASE_ONLY} is a degraded, best-effort result.
 */
public enum PredictionMode {

    /**
     * base prediction corrected by the residual model
     */
    FULL,

    /**
     * no residual model is loaded; the corrected prediction is the base
     * prediction clamped at 0
     */
    BASE_ONLY,

    /**
     * the residual model failed for this batch and was treated as predicting 0
     */
    RESIDUAL_FAILED,

    /**
     * no base model is loaded; every prediction is 0
     */
    NO_BASE_MODEL,

    /**
     * the batch is too short for any row to have a full look-back window; no
     * rows are produced
     */
    INSUFFICIENT_HISTORY;

    public boolean isDegraded() {
        return this != FULL && this != BASE_ONLY;
    }
}
