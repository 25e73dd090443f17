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
package com.amazon.rpsestimator.baseline;

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.rpsestimator.rate.RatePoint;
import com.amazon.rpsestimator.rate.RateSeries;

/**
 * Splits a rate series into a smooth baseline and a residual. The baseline at
 * row i blends a slow and a fast exponential average of rows 0..i-1; row i
 * itself is folded into the averages only after its baseline is read, so no
 * rate leaks into its own baseline.
 */
public class BaselineDecomposer {

    public static final double SLOW_ALPHA = 0.02;

    public static final double FAST_ALPHA = 0.15;

    public static final double SLOW_WEIGHT = 0.7;

    public static final double FAST_WEIGHT = 0.3;

    public BaselineSeries decompose(RateSeries series) {
        checkNotNull(series, "series cannot be null");
        ExponentialAverage slow = new ExponentialAverage(SLOW_ALPHA);
        ExponentialAverage fast = new ExponentialAverage(FAST_ALPHA);
        List<BaselinePoint> points = new ArrayList<>(series.size());
        for (RatePoint point : series.getPoints()) {
            double ewmaSlow = slow.getMean();
            double ewmaFast = fast.getMean();
            double baseline = SLOW_WEIGHT * ewmaSlow + FAST_WEIGHT * ewmaFast;
            double residual = point.getRequestRate() - baseline;
            points.add(new BaselinePoint(point.getTimestamp(), point.getRequestRate(), ewmaSlow, ewmaFast, baseline,
                    residual));
            slow.update(point.getRequestRate());
            fast.update(point.getRequestRate());
        }
        return new BaselineSeries(series.getIntervalWidth(), points);
    }
}
