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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.model.IRegressionModel;
import com.amazon.rpsestimator.model.ModelArtifact;
import com.amazon.rpsestimator.predictor.EnsemblePredictor;
import com.amazon.rpsestimator.rate.RateBuilder;
import com.amazon.rpsestimator.serialize.state.ModelState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads model artifacts from a models directory. An artifact that is missing
 * or cannot be read is reported as absent rather than failing, so that the
 * predictor can run in one of its degraded modes.
 */
@Slf4j
@Getter
public class ModelArtifactLoader {

    public static final String BASE_MODEL_FILE = "inference_model.json";

    public static final String RESIDUAL_MODEL_FILE = "residual_model.json";

    public static final String MANIFEST_FILE = "feature_manifest.json";

    public static final String BASE_MODEL_NAME = "inference_model";

    public static final String RESIDUAL_MODEL_NAME = "residual_model";

    private final ObjectMapper objectMapper;

    private final ModelMapper modelMapper = new ModelMapper();

    public ModelArtifactLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ModelArtifactLoader(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "object mapper cannot be null");
    }

    public Optional<ModelArtifact> loadBase(Path directory) {
        Optional<List<String>> manifest = loadManifest(directory.resolve(MANIFEST_FILE));
        return loadModel(directory.resolve(BASE_MODEL_FILE))
                .map(model -> new ModelArtifact(BASE_MODEL_NAME, model, manifest.orElse(null)));
    }

    public Optional<ModelArtifact> loadResidual(Path directory) {
        return loadModel(directory.resolve(RESIDUAL_MODEL_FILE))
                .map(model -> new ModelArtifact(RESIDUAL_MODEL_NAME, model));
    }

    public Optional<IRegressionModel> loadModel(Path file) {
        checkNotNull(file, "file cannot be null");
        if (!Files.isRegularFile(file)) {
            log.warn("Model artifact {} not found", file);
            return Optional.empty();
        }
        try {
            ModelState state = objectMapper.readValue(file.toFile(), ModelState.class);
            IRegressionModel model = modelMapper.toModel(state);
            log.info("Loaded {} model from {}", state.getType(), file);
            return Optional.of(model);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load model artifact {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * reads a feature manifest, either a JSON array of feature names or an
     * object with a {@code features} array
     */
    public Optional<List<String>> loadManifest(Path file) {
        checkNotNull(file, "file cannot be null");
        if (!Files.isRegularFile(file)) {
            log.debug("No feature manifest at {}", file);
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            JsonNode names = (root != null && root.isObject()) ? root.get("features") : root;
            if (names == null || !names.isArray()) {
                log.warn("Feature manifest {} has no feature list, ignoring it", file);
                return Optional.empty();
            }
            List<String> features = new ArrayList<>();
            for (JsonNode name : names) {
                features.add(name.asText());
            }
            log.info("Loaded feature manifest with {} features from {}", features.size(), file);
            return Optional.of(features);
        } catch (IOException e) {
            log.warn("Failed to read feature manifest {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public void writeModel(IRegressionModel model, Path file) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), modelMapper.toState(model));
    }

    public void writeManifest(List<String> features, Path file) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), features);
    }

    /**
     * builds a predictor from whatever artifacts the directory holds
     */
    public EnsemblePredictor loadPredictor(Path directory, RateBuilder rateBuilder) {
        checkNotNull(directory, "directory cannot be null");
        return EnsemblePredictor.builder().baseModel(loadBase(directory).orElse(null))
                .residualModel(loadResidual(directory).orElse(null)).rateBuilder(rateBuilder).build();
    }
}
