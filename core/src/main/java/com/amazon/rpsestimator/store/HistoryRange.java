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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import lombok.Getter;

/**
 * The trailing windows offered for history queries.
 */
@Getter
public enum HistoryRange {

    LAST_HOUR("1h", Duration.ofHours(1)),

    LAST_SIX_HOURS("6h", Duration.ofHours(6)),

    LAST_DAY("24h", Duration.ofHours(24));

    private final String label;

    private final Duration duration;

    HistoryRange(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    /**
     * @param label one of "1h", "6h", "24h"
     * @return the matching range; {@link #LAST_HOUR} for any other label
     */
    public static HistoryRange fromLabel(String label) {
        for (HistoryRange range : values()) {
            if (range.label.equals(label)) {
                return range;
            }
        }
        return LAST_HOUR;
    }

    public TimeRange toTimeRange(Clock clock) {
        Instant now = clock.instant();
        return new TimeRange(now.minus(duration), now);
    }
}
