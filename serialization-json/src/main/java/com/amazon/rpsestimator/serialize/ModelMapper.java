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

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;

import com.amazon.rpsestimator.model.ConstantRegressionModel;
import com.amazon.rpsestimator.model.IRegressionModel;
import com.amazon.rpsestimator.model.LinearRegressionModel;
import com.amazon.rpsestimator.serialize.state.ModelState;
import com.amazon.rpsestimator.serialize.state.Version;

public class ModelMapper implements IStateMapper<IRegressionModel, ModelState> {

    public static final String CONSTANT = "constant";

    public static final String LINEAR = "linear";

    @Override
    public ModelState toState(IRegressionModel model) {
        checkNotNull(model, "model cannot be null");
        ModelState state = new ModelState();
        if (model instanceof ConstantRegressionModel) {
            ConstantRegressionModel constant = (ConstantRegressionModel) model;
            state.setType(CONSTANT);
            state.setConstant(constant.getValue());
            constant.getFeatureNames().ifPresent(names -> state.setFeatureNames(new ArrayList<>(names)));
        } else if (model instanceof LinearRegressionModel) {
            LinearRegressionModel linear = (LinearRegressionModel) model;
            state.setType(LINEAR);
            state.setIntercept(linear.getIntercept());
            state.setCoefficients(linear.getCoefficients());
            state.setFeatureNames(new ArrayList<>(linear.getRecordedFeatureNames()));
        } else {
            throw new IllegalArgumentException("cannot serialize model of type " + model.getClass().getName());
        }
        return state;
    }

    @Override
    public IRegressionModel toModel(ModelState state) {
        checkNotNull(state, "state cannot be null");
        checkArgument(state.getVersion() == null || Version.V1_0.equals(state.getVersion()),
                "unsupported model version " + state.getVersion());
        checkArgument(state.getType() != null, "model type is missing");
        switch (state.getType()) {
        case CONSTANT:
            return new ConstantRegressionModel(state.getConstant(), state.getFeatureNames());
        case LINEAR:
            checkArgument(state.getCoefficients() != null, "a linear model needs coefficients");
            checkArgument(state.getFeatureNames() != null, "a linear model needs feature names");
            return new LinearRegressionModel(state.getIntercept(), state.getCoefficients(), state.getFeatureNames());
        default:
            throw new IllegalArgumentException("unknown model type " + state.getType());
        }
    }
}
