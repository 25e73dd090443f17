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

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.predictor.PredictionRow;

/**
 * A thread-safe store held in memory, keyed by timestamp and then source.
 */
@Slf4j
public class InMemoryPredictionStore implements IPredictionStore {

    private final ConcurrentSkipListMap<Instant, Map<String, StoredPrediction>> points = new ConcurrentSkipListMap<>();

    @Override
    public void store(List<PredictionRow> rows, String source) {
        checkNotNull(rows, "rows cannot be null");
        checkNotNull(source, "source cannot be null");
        for (PredictionRow row : rows) {
            points.computeIfAbsent(row.getTimestamp(), t -> new ConcurrentHashMap<>()).put(source,
                    StoredPrediction.of(row, source));
        }
        log.info("Stored {} points from {}", rows.size(), source);
    }

    @Override
    public List<StoredPrediction> query(TimeRange range) {
        checkNotNull(range, "range cannot be null");
        NavigableMap<Instant, Map<String, StoredPrediction>> slice = points.subMap(range.getStart(), true,
                range.getEnd(), true);
        List<StoredPrediction> answer = new ArrayList<>();
        for (Map<String, StoredPrediction> bySource : slice.values()) {
            answer.addAll(bySource.values());
        }
        answer.sort(ORDER);
        return answer;
    }

    public int size() {
        return points.values().stream().mapToInt(Map::size).sum();
    }
}
