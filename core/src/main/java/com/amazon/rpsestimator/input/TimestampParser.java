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

package com.amazon.rpsestimator.input;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the textual time values found in uploaded data. Accepted forms are
 * ISO-8601 instants or offset date-times, ISO local date-times and dates (read
 * as UTC, with a space allowed in place of the 'T'), and numeric epoch values.
 * Numbers below {@link #EPOCH_MILLIS_THRESHOLD} are epoch seconds, larger ones
 * epoch milliseconds.
 */
public class TimestampParser {

    public static final double EPOCH_MILLIS_THRESHOLD = 1e11;

    private TimestampParser() {
    }

    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PreconditionException("empty time value");
        }
        String value = text.trim();
        Instant numeric = parseEpoch(value);
        if (numeric != null) {
            return numeric;
        }
        String normalized = (value.length() > 10 && value.charAt(10) == ' ')
                ? value.substring(0, 10) + 'T' + value.substring(11)
                : value;
        Instant parsed = parseOffset(normalized);
        if (parsed == null) {
            parsed = parseLocal(normalized);
        }
        if (parsed == null) {
            try {
                parsed = LocalDate.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC)
                        .toInstant();
            } catch (DateTimeParseException e) {
                throw new PreconditionException("cannot parse time value: " + value, e);
            }
        }
        return parsed;
    }

    static Instant parseOffset(String value) {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Instant parseLocal(String value) {
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Instant parseEpoch(String value) {
        double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
        if (!Double.isFinite(number)) {
            throw new PreconditionException("cannot parse time value: " + value);
        }
        try {
            if (Math.abs(number) < EPOCH_MILLIS_THRESHOLD) {
                long seconds = (long) Math.floor(number);
                long nanos = Math.round((number - seconds) * 1e9);
                return Instant.ofEpochSecond(seconds, nanos);
            }
            return Instant.ofEpochMilli((long) number);
        } catch (DateTimeException | ArithmeticException e) {
            throw new PreconditionException("time value out of range: " + value, e);
        }
    }
}
