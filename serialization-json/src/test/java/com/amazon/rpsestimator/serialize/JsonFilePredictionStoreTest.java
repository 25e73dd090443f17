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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.rpsestimator.predictor.PredictionRow;
import com.amazon.rpsestimator.store.StoredPrediction;
import com.amazon.rpsestimator.store.TimeRange;

public class JsonFilePredictionStoreTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static final TimeRange ALL = new TimeRange(START, START.plusSeconds(3600));

    private static PredictionRow row(int minute, double corrected) {
        return new PredictionRow(START.plusSeconds(60L * minute), 40, corrected - 1, corrected);
    }

    @Test
    public void testStoreAndReopen(@TempDir Path directory) {
        Path file = directory.resolve("history").resolve("predictions.json");
        JsonFilePredictionStore store = new JsonFilePredictionStore(file);
        assertTrue(store.query(ALL).isEmpty());

        store.store(Arrays.asList(row(1, 11), row(0, 10)), "first.csv");
        assertTrue(Files.exists(file));

        List<StoredPrediction> reopened = new JsonFilePredictionStore(file).query(ALL);
        assertEquals(2, reopened.size());
        assertEquals(START, reopened.get(0).getTimestamp());
        assertEquals(10, reopened.get(0).getCorrectedPrediction(), 0);
        assertEquals(9, reopened.get(0).getBasePrediction(), 0);
        assertEquals(40, reopened.get(0).getActual(), 0);
        assertEquals("first.csv", reopened.get(0).getSource());
        assertEquals(StoredPrediction.CURRENT_VERSION, reopened.get(0).getVersion());
    }

    @Test
    public void testReplaceBySourceAndTimestamp(@TempDir Path directory) {
        JsonFilePredictionStore store = new JsonFilePredictionStore(directory.resolve("predictions.json"));
        store.store(Arrays.asList(row(0, 10), row(1, 11)), "a");
        store.store(Collections.singletonList(row(0, 20)), "a");
        store.store(Collections.singletonList(row(0, 30)), "b");

        List<StoredPrediction> points = store.query(ALL);
        assertEquals(3, points.size());
        assertEquals("a", points.get(0).getSource());
        assertEquals(20, points.get(0).getCorrectedPrediction(), 0);
        assertEquals("b", points.get(1).getSource());
        assertEquals(START.plusSeconds(60), points.get(2).getTimestamp());

        List<StoredPrediction> first = store.query(new TimeRange(START, START));
        assertEquals(2, first.size());
    }

    @Test
    public void testCorruptFile(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("predictions.json");
        Files.write(file, "[1, 2".getBytes(StandardCharsets.UTF_8));
        JsonFilePredictionStore store = new JsonFilePredictionStore(file);
        assertThrows(UncheckedIOException.class, () -> store.query(ALL));
        assertThrows(UncheckedIOException.class,
                () -> store.store(Collections.singletonList(row(0, 1)), "a"));
    }
}
