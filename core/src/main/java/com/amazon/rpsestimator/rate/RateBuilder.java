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

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Converts raw event timestamps into a {@link RateSeries}. Events are grouped
 * into left-closed intervals aligned to the epoch, so an event exactly on a
 * boundary belongs to the interval that starts there. Every interval between
 * the first and the last event is present; empty ones carry a rate of 0.
 */
@Getter
public class RateBuilder {

    public static final Duration DEFAULT_INTERVAL_WIDTH = Duration.ofSeconds(60);

    public static final int DEFAULT_MAX_INTERVALS = 1_000_000;

    private final Duration intervalWidth;

    private final int maxIntervals;

    public RateBuilder() {
        this(builder());
    }

    protected RateBuilder(Builder builder) {
        checkNotNull(builder.intervalWidth, "interval width cannot be null");
        checkArgument(builder.intervalWidth.toMillis() > 0, "interval width must be at least one millisecond");
        checkArgument(builder.intervalWidth.getNano() % 1_000_000 == 0,
                "interval width must be a whole number of milliseconds");
        checkArgument(builder.maxIntervals > 0, "maximum number of intervals must be positive");
        this.intervalWidth = builder.intervalWidth;
        this.maxIntervals = builder.maxIntervals;
    }

    /**
     * @param timestamp an event time
     * @return the start of the interval holding the event
     */
    public Instant intervalStart(Instant timestamp) {
        long width = intervalWidth.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(timestamp.toEpochMilli(), width) * width);
    }

    /**
     * builds the rate series; the input does not need to be sorted
     *
     * @param timestamps event times
     * @return the gap-free series, empty for an empty input
     */
    public RateSeries build(List<Instant> timestamps) {
        checkNotNull(timestamps, "timestamps cannot be null");
        if (timestamps.isEmpty()) {
            return new RateSeries(intervalWidth, Collections.emptyList());
        }
        List<Instant> sorted = new ArrayList<>(timestamps);
        for (Instant timestamp : sorted) {
            checkNotNull(timestamp, "timestamps cannot contain null");
        }
        Collections.sort(sorted);

        long width = intervalWidth.toMillis();
        long first = Math.floorDiv(sorted.get(0).toEpochMilli(), width);
        long last = Math.floorDiv(sorted.get(sorted.size() - 1).toEpochMilli(), width);
        long intervals = last - first + 1;
        checkArgument(intervals <= maxIntervals,
                "events span " + intervals + " intervals, more than the maximum of " + maxIntervals);

        long[] counts = new long[(int) intervals];
        for (Instant timestamp : sorted) {
            counts[(int) (Math.floorDiv(timestamp.toEpochMilli(), width) - first)]++;
        }
        List<RatePoint> points = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            points.add(new RatePoint(Instant.ofEpochMilli((first + i) * width), counts[i]));
        }
        return new RateSeries(intervalWidth, points);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration intervalWidth = DEFAULT_INTERVAL_WIDTH;
        private int maxIntervals = DEFAULT_MAX_INTERVALS;

        public Builder intervalWidth(Duration intervalWidth) {
            this.intervalWidth = intervalWidth;
            return this;
        }

        public Builder maxIntervals(int maxIntervals) {
            this.maxIntervals = maxIntervals;
            return this;
        }

        public RateBuilder build() {
            return new RateBuilder(this);
        }
    }
}
