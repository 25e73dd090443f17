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
package com.amazon.rpsestimator.serialize;

import java.time.Instant;

import com.amazon.rpsestimator.serialize.state.StoredPredictionState;
import com.amazon.rpsestimator.store.StoredPrediction;

public class StoredPredictionMapper implements IStateMapper<StoredPrediction, StoredPredictionState> {

    @Override
    public StoredPredictionState toState(StoredPrediction model) {
        StoredPredictionState state = new StoredPredictionState();
        state.setTimestamp(model.getTimestamp().toEpochMilli());
        state.setActual(model.getActual());
        state.setBasePrediction(model.getBasePrediction());
        state.setCorrectedPrediction(model.getCorrectedPrediction());
        state.setSource(model.getSource());
        state.setVersion(model.getVersion());
        return state;
    }

    @Override
    public StoredPrediction toModel(StoredPredictionState state) {
        String version = (state.getVersion() == null) ? StoredPrediction.CURRENT_VERSION : state.getVersion();
        return new StoredPrediction(Instant.ofEpochMilli(state.getTimestamp()), state.getActual(),
                state.getBasePrediction(), state.getCorrectedPrediction(), state.getSource(), version);
    }
}
