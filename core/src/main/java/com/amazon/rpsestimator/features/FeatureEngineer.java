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
package com.amazon.rpsestimator.features;

import static com.amazon.rpsestimator.CommonUtils.allFinite;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;
import static com.amazon.rpsestimator.CommonUtils.sampleStandardDeviation;

import java.util.ArrayList;
import java.util.List;

import com.amazon.rpsestimator.baseline.BaselinePoint;
import com.amazon.rpsestimator.baseline.BaselineSeries;

/**
 * Derives lag, rolling-statistic and burst features from the residual of a
 * {@link BaselineSeries}. Every feature of row i reads residuals of rows before
 * i only: lags read {@code r[i - k]} and rolling windows of width w cover
 * {@code r[i - w] .. r[i - 1]}. The first row has no baseline; within a window
 * its residual counts as 0. Rows whose windows would reach before the first row
 * are dropped, so a series of n rows yields {@code max(0, n - LOOKBACK)} rows.
 */
public class FeatureEngineer {

    public static final int[] LAGS = { 1, 2, 3, 5 };

    public static final int[] WINDOWS = { 3, 5 };

    public static final int LOOKBACK = 5;

    public static final double BURST_EPSILON = 1e-5;

    public FeatureFrame engineer(BaselineSeries series) {
        checkNotNull(series, "series cannot be null");
        int n = series.size();
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            BaselinePoint point = series.get(i);
            residuals[i] = point.isDefined() ? point.getResidual() : 0;
        }

        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double[] values = computeRow(series.get(i), residuals, i);
            if (allFinite(values)) {
                BaselinePoint point = series.get(i);
                rows.add(new FeatureRow(point.getTimestamp(), point.getRequestRate(), values));
            }
        }
        return new FeatureFrame(FeatureNames.ALL, rows);
    }

    double[] computeRow(BaselinePoint point, double[] residuals, int i) {
        double lag1 = lag(residuals, i, 1);
        double lag2 = lag(residuals, i, 2);
        double lag3 = lag(residuals, i, 3);
        double lag5 = lag(residuals, i, 5);
        double rollStd3 = rollingStd(residuals, i, 3);
        double rollMax3 = rollingMax(residuals, i, 3);
        double rollMin3 = rollingMin(residuals, i, 3);
        double rollStd5 = rollingStd(residuals, i, 5);
        double rollMax5 = rollingMax(residuals, i, 5);
        double rollMin5 = rollingMin(residuals, i, 5);

        double diff1 = lag1 - lag2;
        double diff2 = lag1 - lag3;
        double acceleration = diff1 - diff2;
        double absDiff1 = Math.abs(diff1);
        double burstStrength = absDiff1 / (rollStd3 + BURST_EPSILON);
        double rangeExpand = rollMax5 - rollMin5;

        return new double[] { point.getEwmaSlow(), point.getEwmaFast(), point.getBaseline(), lag1, lag2, lag3, lag5,
                rollStd3, rollMax3, rollMin3, rollStd5, rollMax5, rollMin5, diff1, diff2, acceleration, absDiff1,
                burstStrength, rangeExpand };
    }

    static double lag(double[] residuals, int i, int k) {
        return (i - k >= 0) ? residuals[i - k] : Double.NaN;
    }

    static double rollingStd(double[] residuals, int i, int window) {
        return (i - window >= 0) ? sampleStandardDeviation(residuals, i - window, i) : Double.NaN;
    }

    static double rollingMax(double[] residuals, int i, int window) {
        if (i - window < 0) {
            return Double.NaN;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (int j = i - window; j < i; j++) {
            max = Math.max(max, residuals[j]);
        }
        return max;
    }

    static double rollingMin(double[] residuals, int i, int window) {
        if (i - window < 0) {
            return Double.NaN;
        }
        double min = Double.POSITIVE_INFINITY;
        for (int j = i - window; j < i; j++) {
            min = Math.min(min, residuals[j]);
        }
        return min;
    }
}
