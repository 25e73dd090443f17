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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Names of the columns produced by {@link FeatureEngineer}, in the order the
 * engineer emits them.
 */
public final class FeatureNames {

    public static final String EWMA_SLOW = "ewma_slow";
    public static final String EWMA_FAST = "ewma_fast";
    public static final String BASELINE = "baseline";
    public static final String LAG_1 = "lag_1";
    public static final String LAG_2 = "lag_2";
    public static final String LAG_3 = "lag_3";
    public static final String LAG_5 = "lag_5";
    public static final String ROLL_STD_3 = "roll_std_3";
    public static final String ROLL_MAX_3 = "roll_max_3";
    public static final String ROLL_MIN_3 = "roll_min_3";
    public static final String ROLL_STD_5 = "roll_std_5";
    public static final String ROLL_MAX_5 = "roll_max_5";
    public static final String ROLL_MIN_5 = "roll_min_5";
    public static final String DIFF_1 = "diff_1";
    public static final String DIFF_2 = "diff_2";
    public static final String ACCELERATION = "acceleration";
    public static final String ABS_DIFF_1 = "abs_diff_1";
    public static final String BURST_STRENGTH = "burst_strength";
    public static final String RANGE_EXPAND = "range_expand";

    public static final List<String> ALL = Collections.unmodifiableList(Arrays.asList(EWMA_SLOW, EWMA_FAST,
            BASELINE, LAG_1, LAG_2, LAG_3, LAG_5, ROLL_STD_3, ROLL_MAX_3, ROLL_MIN_3, ROLL_STD_5, ROLL_MAX_5,
            ROLL_MIN_5, DIFF_1, DIFF_2, ACCELERATION, ABS_DIFF_1, BURST_STRENGTH, RANGE_EXPAND));

    private FeatureNames() {
    }
}
