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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Gap-free, equally spaced count-per-interval series. Timestamps are interval
 * starts and increase by exactly {@link #getIntervalWidth()} from one point to
 * the next.
 */
@Getter
public class RateSeries {

    private final Duration intervalWidth;

    private final List<RatePoint> points;

    public RateSeries(Duration intervalWidth, List<RatePoint> points) {
        checkNotNull(intervalWidth, "interval width cannot be null");
        checkNotNull(points, "points cannot be null");
        for (int i = 1; i < points.size(); i++) {
            checkArgument(
                    points.get(i - 1).getTimestamp().plus(intervalWidth).equals(points.get(i).getTimestamp()),
                    "points must be equally spaced by the interval width");
        }
        for (RatePoint point : points) {
            checkArgument(point.getRequestRate() >= 0, "request rate cannot be negative");
        }
        this.intervalWidth = intervalWidth;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public RatePoint get(int index) {
        return points.get(index);
    }

    /**
     * @return the request rates as doubles, in time order
     */
    public double[] getRequestRates() {
        double[] rates = new double[points.size()];
        for (int i = 0; i < rates.length; i++) {
            rates[i] = points.get(i).getRequestRate();
        }
        return rates;
    }
}
