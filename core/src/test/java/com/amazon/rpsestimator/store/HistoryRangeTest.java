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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class HistoryRangeTest {

    @ParameterizedTest
    @CsvSource({ "1h, LAST_HOUR", "6h, LAST_SIX_HOURS", "24h, LAST_DAY", "7d, LAST_HOUR", "'', LAST_HOUR" })
    public void testFromLabel(String label, HistoryRange expected) {
        assertEquals(expected, HistoryRange.fromLabel(label));
    }

    @Test
    public void testNullLabelDefaults() {
        assertEquals(HistoryRange.LAST_HOUR, HistoryRange.fromLabel(null));
    }

    @Test
    public void testToTimeRange() {
        Instant now = Instant.parse("2024-01-02T00:00:00Z");
        TimeRange range = HistoryRange.LAST_SIX_HOURS.toTimeRange(Clock.fixed(now, ZoneOffset.UTC));
        assertEquals(Instant.parse("2024-01-01T18:00:00Z"), range.getStart());
        assertEquals(now, range.getEnd());
        assertTrue(range.contains(now));
        assertFalse(range.contains(now.plusMillis(1)));
    }
}
