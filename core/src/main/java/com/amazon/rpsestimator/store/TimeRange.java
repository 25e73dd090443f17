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

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A closed time interval {@code [start, end]}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TimeRange {

    private final Instant start;

    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        checkNotNull(start, "start cannot be null");
        checkNotNull(end, "end cannot be null");
        checkArgument(!end.isBefore(start), "end cannot precede start");
        this.start = start;
        this.end = end;
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }
}
