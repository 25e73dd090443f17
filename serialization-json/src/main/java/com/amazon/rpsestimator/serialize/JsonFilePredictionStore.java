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
package com.amazon.rpsestimator.serialize;

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.predictor.PredictionRow;
import com.amazon.rpsestimator.serialize.state.PredictionStoreState;
import com.amazon.rpsestimator.serialize.state.StoredPredictionState;
import com.amazon.rpsestimator.store.IPredictionStore;
import com.amazon.rpsestimator.store.StoredPrediction;
import com.amazon.rpsestimator.store.TimeRange;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A prediction store kept as a single JSON document. Every call to
 * {@link #store} reads the document, merges the new points and writes it back
 * whole. Timestamps are kept to millisecond precision.
 */
@Slf4j
public class JsonFilePredictionStore implements IPredictionStore {

    @Getter
    private final Path file;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final StoredPredictionMapper mapper = new StoredPredictionMapper();

    private final ReentrantLock lock = new ReentrantLock();

    public JsonFilePredictionStore(Path file) {
        this.file = checkNotNull(file, "file cannot be null");
    }

    @Override
    public void store(List<PredictionRow> rows, String source) {
        checkNotNull(rows, "rows cannot be null");
        checkNotNull(source, "source cannot be null");
        lock.lock();
        try {
            Map<Key, StoredPrediction> points = new LinkedHashMap<>();
            for (StoredPrediction existing : readAll()) {
                points.put(new Key(existing.getTimestamp(), existing.getSource()), existing);
            }
            for (PredictionRow row : rows) {
                StoredPrediction prediction = mapper.toModel(mapper.toState(StoredPrediction.of(row, source)));
                points.put(new Key(prediction.getTimestamp(), source), prediction);
            }
            List<StoredPrediction> sorted = new ArrayList<>(points.values());
            sorted.sort(ORDER);
            PredictionStoreState state = new PredictionStoreState();
            for (StoredPrediction prediction : sorted) {
                state.getPoints().add(mapper.toState(prediction));
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), state);
            log.info("Stored {} points from {} in {}", rows.size(), source, file);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write prediction store " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredPrediction> query(TimeRange range) {
        checkNotNull(range, "range cannot be null");
        lock.lock();
        try {
            List<StoredPrediction> answer = new ArrayList<>();
            for (StoredPrediction prediction : readAll()) {
                if (range.contains(prediction.getTimestamp())) {
                    answer.add(prediction);
                }
            }
            answer.sort(ORDER);
            return answer;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read prediction store " + file, e);
        } finally {
            lock.unlock();
        }
    }

    List<StoredPrediction> readAll() throws IOException {
        List<StoredPrediction> answer = new ArrayList<>();
        if (!Files.exists(file)) {
            return answer;
        }
        PredictionStoreState state = objectMapper.readValue(file.toFile(), PredictionStoreState.class);
        if (state.getPoints() != null) {
            for (StoredPredictionState point : state.getPoints()) {
                answer.add(mapper.toModel(point));
            }
        }
        return answer;
    }

    @EqualsAndHashCode
    @AllArgsConstructor
    private static final class Key {
        private final Instant timestamp;
        private final String source;
    }
}
