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
package com.amazon.rpsestimator.rate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.rpsestimator.testutils.EventDataSets;

public class RateBuilderTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    public void testOneEventPerSecond() {
        List<Instant> events = EventDataSets.evenlySpaced(START, 600, Duration.ofSeconds(1));
        RateSeries series = new RateBuilder().build(events);
        assertEquals(10, series.size());
        assertEquals(Duration.ofSeconds(60), series.getIntervalWidth());
        for (int i = 0; i < 10; i++) {
            assertEquals(START.plusSeconds(60L * i), series.get(i).getTimestamp());
            assertEquals(60, series.get(i).getRequestRate());
        }
    }

    @Test
    public void testGapsAreFilledWithZero() {
        List<Instant> events = Arrays.asList(START.plusSeconds(5), START.plusSeconds(10),
                START.plusSeconds(4 * 60 + 1));
        RateSeries series = new RateBuilder().build(events);
        assertEquals(5, series.size());
        long[] expected = { 2, 0, 0, 0, 1 };
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], series.get(i).getRequestRate());
        }
    }

    @Test
    public void testUnsortedInputAndEpochAlignment() {
        List<Instant> events = new ArrayList<>(Arrays.asList(Instant.parse("2024-01-01T00:02:59.999Z"),
                Instant.parse("2024-01-01T00:01:00Z"), Instant.parse("2024-01-01T00:00:59.999Z"),
                Instant.parse("2024-01-01T00:00:30Z")));
        Collections.shuffle(events);
        RateSeries series = new RateBuilder().build(events);
        assertEquals(3, series.size());
        assertEquals(START, series.get(0).getTimestamp());
        assertEquals(2, series.get(0).getRequestRate());
        // an event on a boundary belongs to the interval starting there
        assertEquals(1, series.get(1).getRequestRate());
        assertEquals(1, series.get(2).getRequestRate());
    }

    @Test
    public void testEmptyAndSingleEvent() {
        assertTrue(new RateBuilder().build(Collections.emptyList()).isEmpty());
        RateSeries single = new RateBuilder().build(Collections.singletonList(START.plusSeconds(61)));
        assertEquals(1, single.size());
        assertEquals(START.plusSeconds(60), single.get(0).getTimestamp());
    }

    @Test
    public void testCustomInterval() {
        RateBuilder builder = RateBuilder.builder().intervalWidth(Duration.ofSeconds(10)).build();
        List<Instant> events = EventDataSets.evenlySpaced(START, 60, Duration.ofSeconds(1));
        RateSeries series = builder.build(events);
        assertEquals(6, series.size());
        assertEquals(10, series.get(5).getRequestRate());
        assertEquals(START.plusSeconds(10), builder.intervalStart(START.plusSeconds(19)));
    }

    @Test
    public void testPreEpochTimestamps() {
        RateSeries series = new RateBuilder().build(Collections.singletonList(Instant.ofEpochSecond(-1)));
        assertEquals(Instant.ofEpochSecond(-60), series.get(0).getTimestamp());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> RateBuilder.builder().intervalWidth(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> RateBuilder.builder().intervalWidth(Duration.ofNanos(1_500_000)).build());
        assertThrows(NullPointerException.class, () -> RateBuilder.builder().intervalWidth(null).build());
        RateBuilder small = RateBuilder.builder().maxIntervals(3).build();
        assertThrows(IllegalArgumentException.class,
                () -> small.build(Arrays.asList(START, START.plus(Duration.ofMinutes(3)))));
        assertThrows(NullPointerException.class, () -> new RateBuilder().build(Arrays.asList(START, null)));
    }

    @Test
    public void testSeriesRejectsIrregularSpacing() {
        List<RatePoint> points = Arrays.asList(new RatePoint(START, 1), new RatePoint(START.plusSeconds(120), 1));
        assertThrows(IllegalArgumentException.class, () -> new RateSeries(Duration.ofSeconds(60), points));
        assertThrows(IllegalArgumentException.class,
                () -> new RateSeries(Duration.ofSeconds(60), Collections.singletonList(new RatePoint(START, -1))));
    }
}
