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
package com.amazon.rpsestimator;

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.rpsestimator.features.FeatureNames;
import com.amazon.rpsestimator.model.IRegressionModel;
import com.amazon.rpsestimator.model.LinearRegressionModel;
import com.amazon.rpsestimator.serialize.ModelMapper;
import com.amazon.rpsestimator.serialize.state.ModelState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ModelMapperBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        ObjectMapper jsonMapper;
        ModelMapper mapper;
        String json;

        @Setup(Level.Trial)
        public void setUp() throws JsonProcessingException {
            List<String> names = FeatureNames.ALL;
            double[] coefficients = new double[names.size()];
            for (int i = 0; i < coefficients.length; i++) {
                coefficients[i] = i * 0.01;
            }
            jsonMapper = new ObjectMapper();
            mapper = new ModelMapper();
            json = jsonMapper.writeValueAsString(mapper.toState(new LinearRegressionModel(0, coefficients, names)));
        }
    }

    @Benchmark
    public IRegressionModel readModel(BenchmarkState state) throws JsonProcessingException {
        return state.mapper.toModel(state.jsonMapper.readValue(state.json, ModelState.class));
    }

    @Benchmark
    public String roundTrip(BenchmarkState state) throws JsonProcessingException {
        IRegressionModel model = state.mapper.toModel(state.jsonMapper.readValue(state.json, ModelState.class));
        return state.jsonMapper.writeValueAsString(state.mapper.toState(model));
    }
}
