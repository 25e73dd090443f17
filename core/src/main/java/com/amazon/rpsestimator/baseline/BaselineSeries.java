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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

@Getter
public class BaselineSeries {

    private final Duration intervalWidth;

    private final List<BaselinePoint> points;

    public BaselineSeries(Duration intervalWidth, List<BaselinePoint> points) {
        checkNotNull(intervalWidth, "interval width cannot be null");
        checkNotNull(points, "points cannot be null");
        this.intervalWidth = intervalWidth;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public BaselinePoint get(int index) {
        return points.get(index);
    }

    public double[] getResiduals() {
        double[] residuals = new double[points.size()];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = points.get(i).getResidual();
        }
        return residuals;
    }
}
