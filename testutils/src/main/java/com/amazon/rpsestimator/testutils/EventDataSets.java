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
package com.amazon.rpsestimator.testutils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Generators of raw event timestamps. Every generator with a seed is
 * deterministic for that seed.
 */
public class EventDataSets {

    private EventDataSets() {
    }

    /**
     * @param start   time of the first event
     * @param count   number of events
     * @param spacing gap between consecutive events
     * @return evenly spaced events, in time order
     */
    public static List<Instant> evenlySpaced(Instant start, int count, Duration spacing) {
        List<Instant> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            events.add(start.plus(spacing.multipliedBy(i)));
        }
        return events;
    }

    /**
     * events with exponentially distributed gaps, so counts per interval are
     * Poisson distributed
     *
     * @param start          time of the first possible event
     * @param length         how long to generate for
     * @param eventsPerSecond the mean arrival rate
     * @param seed           random seed
     * @return events in time order
     */
    public static List<Instant> poisson(Instant start, Duration length, double eventsPerSecond, long seed) {
        Random prg = new Random(seed);
        List<Instant> events = new ArrayList<>();
        long endNanos = length.toNanos();
        double meanGapNanos = 1e9 / eventsPerSecond;
        long t = 0;
        while (true) {
            t += (long) (-Math.log(1 - prg.nextDouble()) * meanGapNanos);
            if (t >= endNanos) {
                break;
            }
            events.add(start.plusNanos(t));
        }
        return events;
    }

    /**
     * adds {@code extraEvents} events spread uniformly over
     * {@code [burstStart, burstStart + burstLength)} and returns the merged,
     * sorted list
     */
    public static List<Instant> withBurst(List<Instant> events, Instant burstStart, Duration burstLength,
            int extraEvents, long seed) {
        Random prg = new Random(seed);
        List<Instant> merged = new ArrayList<>(events);
        long lengthNanos = burstLength.toNanos();
        for (int i = 0; i < extraEvents; i++) {
            merged.add(burstStart.plusNanos((long) (prg.nextDouble() * lengthNanos)));
        }
        Collections.sort(merged);
        return merged;
    }

    /**
     * one event per entry of {@code counts}, placed at the start of consecutive
     * intervals of width {@code interval}; count i events go into interval i
     */
    public static List<Instant> fromCounts(Instant start, Duration interval, long[] counts) {
        List<Instant> events = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            Instant intervalStart = start.plus(interval.multipliedBy(i));
            for (long j = 0; j < counts[i]; j++) {
                events.add(intervalStart);
            }
        }
        return events;
    }

    /**
     * a daily-cycle request profile sampled per interval: a sinusoid around
     * {@code mean} with the given amplitude, plus uniform noise
     */
    public static long[] seasonalCounts(int intervals, double mean, double amplitude, int period, double noise,
            long seed) {
        Random prg = new Random(seed);
        long[] counts = new long[intervals];
        for (int i = 0; i < intervals; i++) {
            double value = mean + amplitude * Math.sin(2 * Math.PI * i / period) + noise * (2 * prg.nextDouble() - 1);
            counts[i] = Math.max(0, Math.round(value));
        }
        return counts;
    }
}
