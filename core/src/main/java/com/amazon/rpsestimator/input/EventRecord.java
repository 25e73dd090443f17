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

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of uploaded tabular data. Only the time field is read by the
 * pipeline; every other column is carried but ignored.
 */
@Getter
@ToString
@EqualsAndHashCode
public class EventRecord {

    private final Map<String, String> fields;

    public EventRecord(Map<String, String> fields) {
        checkNotNull(fields, "fields cannot be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * a record holding a single column
     *
     * @param name  column name
     * @param value column value
     * @return the record
     */
    public static EventRecord of(String name, String value) {
        return new EventRecord(Collections.singletonMap(name, value));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public Optional<String> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
