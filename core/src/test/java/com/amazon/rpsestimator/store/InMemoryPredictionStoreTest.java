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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rpsestimator.predictor.PredictionRow;

public class InMemoryPredictionStoreTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryPredictionStore store;

    @BeforeEach
    public void setUp() {
        store = new InMemoryPredictionStore();
    }

    private static PredictionRow row(int minute, double corrected) {
        return new PredictionRow(START.plusSeconds(60L * minute), 50, corrected, corrected);
    }

    @Test
    public void testStoreAndQuery() {
        store.store(Arrays.asList(row(2, 20), row(0, 10), row(1, 15)), "upload.csv");
        List<StoredPrediction> all = store.query(new TimeRange(START, START.plusSeconds(600)));
        assertEquals(3, all.size());
        assertThat(all.stream().map(StoredPrediction::getCorrectedPrediction).collect(Collectors.toList()),
                contains(10.0, 15.0, 20.0));
        for (StoredPrediction prediction : all) {
            assertEquals(StoredPrediction.CURRENT_VERSION, prediction.getVersion());
            assertEquals("upload.csv", prediction.getSource());
        }
        assertEquals(row(0, 10), all.get(0).toPredictionRow());
    }

    @Test
    public void testRangeIsInclusive() {
        store.store(Arrays.asList(row(0, 1), row(1, 2), row(2, 3), row(3, 4)), "a");
        List<StoredPrediction> slice = store.query(new TimeRange(START.plusSeconds(60), START.plusSeconds(120)));
        assertEquals(2, slice.size());
        assertEquals(START.plusSeconds(60), slice.get(0).getTimestamp());
        assertEquals(START.plusSeconds(120), slice.get(1).getTimestamp());
    }

    @Test
    public void testSameSourceReplacesAndSourcesCoexist() {
        store.store(Collections.singletonList(row(0, 10)), "a");
        store.store(Collections.singletonList(row(0, 12)), "a");
        store.store(Collections.singletonList(row(0, 30)), "b");
        assertEquals(2, store.size());
        List<StoredPrediction> points = store.query(new TimeRange(START, START));
        assertEquals(Arrays.asList("a", "b"),
                points.stream().map(StoredPrediction::getSource).collect(Collectors.toList()));
        assertEquals(12, points.get(0).getCorrectedPrediction(), 0);
    }

    @Test
    public void testEmptyRange() {
        store.store(Collections.singletonList(row(0, 10)), "a");
        assertTrue(store.query(new TimeRange(START.plusSeconds(1), START.plusSeconds(59))).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(START.plusSeconds(1), START));
    }
}
