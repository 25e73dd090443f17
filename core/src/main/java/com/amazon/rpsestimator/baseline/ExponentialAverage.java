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

import static com.amazon.rpsestimator.CommonUtils.checkArgument;

/**
 * An exponentially weighted moving average with a fixed decay. The first
 * observation seeds the average; every later observation y moves it to
 * {@code (1 - alpha) * mean + alpha * y}. Before the first observation the mean
 * is undefined.
 */
public class ExponentialAverage {

    protected final double alpha;

    protected double mean = Double.NaN;

    protected int count = 0;

    public ExponentialAverage(double alpha) {
        checkArgument(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]");
        this.alpha = alpha;
    }

    public void update(double value) {
        if (count == 0) {
            mean = value;
        } else {
            mean = (1 - alpha) * mean + alpha * value;
        }
        ++count;
    }

    /**
     * @return the current average, NaN if nothing has been observed
     */
    public double getMean() {
        return mean;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getCount() {
        return count;
    }

    public void reset() {
        mean = Double.NaN;
        count = 0;
    }
}
