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

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * Finds the time column of an uploaded batch and turns every record into an
 * event timestamp. The recognized names are tried in order against the first
 * record; the first one present becomes the time field for the whole batch.
 */
@Getter
public class TimeFieldResolver {

    public static final List<String> DEFAULT_TIME_FIELDS = Collections
            .unmodifiableList(Arrays.asList("timestamp", "time", "date", "ts"));

    private final List<String> recognizedFields;

    public TimeFieldResolver() {
        this(DEFAULT_TIME_FIELDS);
    }

    public TimeFieldResolver(List<String> recognizedFields) {
        checkNotNull(recognizedFields, "recognized fields cannot be null");
        checkArgument(!recognizedFields.isEmpty(), "at least one time field name is required");
        this.recognizedFields = Collections.unmodifiableList(new ArrayList<>(recognizedFields));
    }

    /**
     * @param records the uploaded batch
     * @return the time field of the batch, empty if the batch is empty or no
     *         recognized field is present
     */
    public Optional<String> findTimeField(List<EventRecord> records) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        EventRecord first = records.get(0);
        return recognizedFields.stream().filter(first::hasField).findFirst();
    }

    /**
     * extracts one timestamp per record, in input order
     *
     * @param records the uploaded batch
     * @return the event timestamps
     * @throws PreconditionException if the batch is not empty and has no usable
     *                               time field
     */
    public List<Instant> extractTimestamps(List<EventRecord> records) {
        checkNotNull(records, "records cannot be null");
        if (records.isEmpty()) {
            return Collections.emptyList();
        }
        String field = findTimeField(records).orElseThrow(() -> new PreconditionException(
                "no time field found; expected one of " + recognizedFields));
        List<Instant> timestamps = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            final int row = i;
            String value = records.get(i).getField(field).orElseThrow(
                    () -> new PreconditionException("record " + row + " has no value for time field " + field));
            timestamps.add(TimestampParser.parse(value));
        }
        return timestamps;
    }
}
