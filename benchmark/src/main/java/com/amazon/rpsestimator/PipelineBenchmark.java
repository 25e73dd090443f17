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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.rpsestimator.baseline.BaselineDecomposer;
import com.amazon.rpsestimator.baseline.BaselineSeries;
import com.amazon.rpsestimator.features.FeatureEngineer;
import com.amazon.rpsestimator.features.FeatureFrame;
import com.amazon.rpsestimator.model.ConstantRegressionModel;
import com.amazon.rpsestimator.model.LinearRegressionModel;
import com.amazon.rpsestimator.predictor.EnsemblePredictor;
import com.amazon.rpsestimator.predictor.PredictionResult;
import com.amazon.rpsestimator.rate.RateBuilder;
import com.amazon.rpsestimator.rate.RateSeries;
import com.amazon.rpsestimator.schema.FallbackSchemaSource;
import com.amazon.rpsestimator.testutils.EventDataSets;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class PipelineBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "1", "6", "24" })
        int hours;

        @Param({ "20" })
        double eventsPerSecond;

        List<Instant> events;
        RateSeries rates;
        BaselineSeries baseline;
        FeatureFrame frame;
        EnsemblePredictor predictor;

        @Setup(Level.Trial)
        public void setUpData() {
            Instant start = Instant.parse("2024-01-01T00:00:00Z");
            events = EventDataSets.withBurst(
                    EventDataSets.poisson(start, Duration.ofHours(hours), eventsPerSecond, 42L),
                    start.plus(Duration.ofMinutes(30)), Duration.ofMinutes(5), 10_000, 7L);

            List<String> names = FallbackSchemaSource.FALLBACK_FEATURES;
            double[] coefficients = new double[names.size()];
            for (int i = 0; i < coefficients.length; i++) {
                coefficients[i] = 1.0 / (i + 1);
            }
            predictor = EnsemblePredictor.builder().baseModel(new LinearRegressionModel(1, coefficients, names))
                    .residualModel(new ConstantRegressionModel(-0.5)).build();

            rates = new RateBuilder().build(events);
            baseline = new BaselineDecomposer().decompose(rates);
            frame = new FeatureEngineer().engineer(baseline);
        }
    }

    @Benchmark
    public RateSeries buildRates(BenchmarkState state) {
        return new RateBuilder().build(state.events);
    }

    @Benchmark
    public FeatureFrame engineerFeatures(BenchmarkState state, Blackhole blackhole) {
        BaselineSeries baseline = new BaselineDecomposer().decompose(state.rates);
        blackhole.consume(baseline);
        return new FeatureEngineer().engineer(baseline);
    }

    @Benchmark
    public PredictionResult predictFrame(BenchmarkState state) {
        return state.predictor.predict(state.frame);
    }

    @Benchmark
    public PredictionResult predictEvents(BenchmarkState state) {
        return state.predictor.predictTimestamps(state.events);
    }
}
