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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.amazon.rpsestimator.features.FeatureFrame;
import com.amazon.rpsestimator.features.FeatureNames;
import com.amazon.rpsestimator.input.EventRecord;
import com.amazon.rpsestimator.input.PreconditionException;
import com.amazon.rpsestimator.model.ConstantRegressionModel;
import com.amazon.rpsestimator.model.IRegressionModel;
import com.amazon.rpsestimator.model.LinearRegressionModel;
import com.amazon.rpsestimator.model.ModelArtifact;
import com.amazon.rpsestimator.schema.FallbackSchemaSource;
import com.amazon.rpsestimator.schema.SchemaMismatchException;
import com.amazon.rpsestimator.schema.SchemaOrigin;
import com.amazon.rpsestimator.testutils.EventDataSets;

public class EnsemblePredictorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static List<Instant> steadyEvents() {
        return EventDataSets.evenlySpaced(START, 600, Duration.ofSeconds(1));
    }

    private static List<EventRecord> records(List<Instant> timestamps) {
        return timestamps.stream().map(t -> EventRecord.of("timestamp", t.toString())).collect(Collectors.toList());
    }

    private static LinearRegressionModel linearModel() {
        List<String> names = FallbackSchemaSource.FALLBACK_FEATURES;
        double[] coefficients = new double[names.size()];
        Arrays.fill(coefficients, 0.1);
        coefficients[0] = 0.8;
        return new LinearRegressionModel(2, coefficients, names);
    }

    @Test
    public void testSteadyTrafficWithConstantModel() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(100))
                .build();
        PredictionResult result = predictor.predict(records(steadyEvents()));

        assertEquals(PredictionMode.BASE_ONLY, result.getMode());
        assertEquals(5, result.size());
        for (int i = 0; i < result.size(); i++) {
            PredictionRow row = result.getRows().get(i);
            assertEquals(START.plus(Duration.ofMinutes(5 + i)), row.getTimestamp());
            assertEquals(60, row.getActual(), 1e-9);
            assertEquals(100, row.getBasePrediction(), 1e-9);
            assertEquals(100, row.getCorrectedPrediction(), 1e-9);
        }
        assertEquals(SchemaOrigin.FALLBACK, predictor.getFeatureSchema().get().getOrigin());
    }

    @Test
    public void testResidualCorrection() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(100))
                .residualModel(new ConstantRegressionModel(-30)).build();
        PredictionResult result = predictor.predictTimestamps(steadyEvents());
        assertEquals(PredictionMode.FULL, result.getMode());
        for (PredictionRow row : result.getRows()) {
            assertEquals(100, row.getBasePrediction(), 1e-9);
            assertEquals(70, row.getCorrectedPrediction(), 1e-9);
        }
    }

    @Test
    public void testCorrectedPredictionIsClampedAtZero() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(-50))
                .residualModel(new ConstantRegressionModel(10)).build();
        PredictionResult result = predictor.predictTimestamps(steadyEvents());
        assertEquals(5, result.size());
        for (PredictionRow row : result.getRows()) {
            assertEquals(-50, row.getBasePrediction(), 1e-9);
            assertEquals(0, row.getCorrectedPrediction(), 0);
        }
    }

    @Test
    public void testFailingResidualModelDegradesToBase() {
        IRegressionModel residual = mock(IRegressionModel.class);
        when(residual.predict(any())).thenThrow(new IllegalArgumentException("bad shape"));
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(linearModel()).residualModel(residual)
                .build();

        List<Instant> events = EventDataSets.poisson(START, Duration.ofMinutes(30), 2, 17L);
        PredictionResult result = predictor.predictTimestamps(events);
        assertEquals(PredictionMode.RESIDUAL_FAILED, result.getMode());
        assertTrue(result.getMode().isDegraded());
        assertFalse(result.isEmpty());
        for (PredictionRow row : result.getRows()) {
            assertEquals(Math.max(row.getBasePrediction(), 0), row.getCorrectedPrediction(), 0);
        }
    }

    @Test
    public void testNonFiniteResidualOutputDegradesToBase() {
        IRegressionModel residual = matrix -> {
            double[] values = new double[matrix.length];
            Arrays.fill(values, Double.NaN);
            return values;
        };
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(100))
                .residualModel(residual).build();
        PredictionResult result = predictor.predictTimestamps(steadyEvents());

        assertEquals(PredictionMode.RESIDUAL_FAILED, result.getMode());
        assertEquals(5, result.size());
        for (PredictionRow row : result.getRows()) {
            assertEquals(100, row.getCorrectedPrediction(), 1e-9);
        }
    }

    @Test
    public void testNaNBasePredictionIsClampedToZero() {
        IRegressionModel base = mock(IRegressionModel.class);
        when(base.predict(any())).thenAnswer(invocation -> {
            double[][] matrix = invocation.getArgument(0);
            double[] values = new double[matrix.length];
            Arrays.fill(values, Double.NaN);
            return values;
        });
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(base).build();
        PredictionResult result = predictor.predictTimestamps(steadyEvents());

        assertFalse(result.isEmpty());
        for (PredictionRow row : result.getRows()) {
            assertEquals(0, row.getCorrectedPrediction(), 0);
        }
        assertEquals(0, EnsemblePredictor.clampToZero(-3.5), 0);
        assertEquals(7.5, EnsemblePredictor.clampToZero(7.5), 0);
    }

    @Test
    public void testWrongBaseModelOutputLength() {
        IRegressionModel base = mock(IRegressionModel.class);
        when(base.predict(any())).thenReturn(new double[1]);
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(base).build();
        assertThrows(IllegalStateException.class, () -> predictor.predictTimestamps(steadyEvents()));
    }

    @Test
    public void testSchemaMismatch() {
        LinearRegressionModel model = new LinearRegressionModel(0, new double[] { 1, 1 },
                Arrays.asList(FeatureNames.LAG_1, "queue_depth"));
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(model).build();
        SchemaMismatchException exception = assertThrows(SchemaMismatchException.class,
                () -> predictor.predictTimestamps(steadyEvents()));
        assertEquals(Collections.singletonList("queue_depth"), exception.getMissingFeatures());
    }

    @Test
    public void testManifestOrdersColumns() {
        LinearRegressionModel model = new LinearRegressionModel(0, new double[] { 1, 0 },
                Arrays.asList("x0", "x1"));
        ModelArtifact artifact = new ModelArtifact("base", model,
                Arrays.asList(FeatureNames.BASELINE, FeatureNames.LAG_1));
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(artifact).build();
        PredictionResult result = predictor.predictTimestamps(steadyEvents());
        assertEquals(SchemaOrigin.MANIFEST, predictor.getFeatureSchema().get().getOrigin());
        for (PredictionRow row : result.getRows()) {
            assertEquals(60, row.getBasePrediction(), 1e-9);
        }
    }

    @Test
    public void testShortHistory() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(100))
                .build();
        List<Instant> events = EventDataSets.evenlySpaced(START, 300, Duration.ofSeconds(1));
        PredictionResult result = predictor.predictTimestamps(events);
        assertTrue(result.isEmpty());
        assertEquals(PredictionMode.INSUFFICIENT_HISTORY, result.getMode());

        PredictionResult empty = predictor.predict(Collections.emptyList());
        assertTrue(empty.isEmpty());
        assertEquals(PredictionMode.INSUFFICIENT_HISTORY, empty.getMode());
    }

    @Test
    public void testNoBaseModel() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().build();
        assertFalse(predictor.hasBaseModel());
        assertFalse(predictor.getFeatureSchema().isPresent());

        List<Instant> events = new ArrayList<>(
                Arrays.asList(START.plusSeconds(70), START.plusSeconds(5), START.plusSeconds(10)));
        PredictionResult result = predictor.predictTimestamps(events);
        assertEquals(PredictionMode.NO_BASE_MODEL, result.getMode());
        assertEquals(3, result.size());
        assertEquals(START.plusSeconds(5), result.getRows().get(0).getTimestamp());
        assertEquals(2, result.getRows().get(0).getActual(), 0);
        assertEquals(START.plusSeconds(70), result.getRows().get(2).getTimestamp());
        assertEquals(1, result.getRows().get(2).getActual(), 0);
        for (PredictionRow row : result.getRows()) {
            assertEquals(0, row.getBasePrediction(), 0);
            assertEquals(0, row.getCorrectedPrediction(), 0);
        }
        assertThrows(IllegalStateException.class, () -> predictor.predict(
                new FeatureFrame(FeatureNames.ALL, Collections.emptyList())));
    }

    @Test
    public void testMissingTimeField() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(new ConstantRegressionModel(1)).build();
        List<EventRecord> records = Collections.singletonList(EventRecord.of("value", "12"));
        assertThrows(PreconditionException.class, () -> predictor.predict(records));
    }

    @Test
    public void testBurstRaisesPredictions() {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(linearModel()).build();
        List<Instant> calm = EventDataSets.evenlySpaced(START, 1200, Duration.ofSeconds(1));
        List<Instant> bursty = EventDataSets.withBurst(calm, START.plus(Duration.ofMinutes(12)),
                Duration.ofMinutes(2), 600, 3L);
        PredictionResult calmResult = predictor.predictTimestamps(calm);
        PredictionResult burstResult = predictor.predictTimestamps(bursty);
        assertEquals(calmResult.size(), burstResult.size());
        assertThat(burstResult.getSummary().getMaxPrediction(),
                greaterThanOrEqualTo(calmResult.getSummary().getMaxPrediction()));
        for (PredictionRow row : burstResult.getRows()) {
            assertThat(row.getCorrectedPrediction(), greaterThanOrEqualTo(0.0));
        }
    }

    @Test
    public void testDeterministicAndThreadSafe() throws Exception {
        EnsemblePredictor predictor = EnsemblePredictor.builder().baseModel(linearModel())
                .residualModel(new ConstantRegressionModel(-1)).build();
        List<Instant> events = EventDataSets.poisson(START, Duration.ofMinutes(45), 3, 99L);
        PredictionResult expected = predictor.predictTimestamps(events);
        assertEquals(expected.getRows(), predictor.predictTimestamps(events).getRows());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<PredictionResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> predictor.predictTimestamps(events));
            }
            for (Future<PredictionResult> future : executor.invokeAll(tasks)) {
                assertEquals(expected.getRows(), future.get().getRows());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
