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
package com.amazon.rpsestimator.schema;

import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.model.ModelArtifact;

/**
 * Tries each {@link ISchemaSource} in order and returns the first schema found.
 * The default chain is manifest, then the model's own feature names, then the
 * fallback catalogue.
 */
@Slf4j
@Getter
public class FeatureSchemaResolver {

    private final List<ISchemaSource> sources;

    public FeatureSchemaResolver() {
        this(Arrays.asList(new ManifestSchemaSource(), new IntrospectionSchemaSource(), new FallbackSchemaSource()));
    }

    public FeatureSchemaResolver(List<ISchemaSource> sources) {
        checkNotNull(sources, "sources cannot be null");
        checkArgument(!sources.isEmpty(), "at least one schema source is required");
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    }

    /**
     * @param artifact the loaded model
     * @return the first schema offered by the chain
     * @throws IllegalStateException if no source offers a schema
     */
    public FeatureSchema resolve(ModelArtifact artifact) {
        checkNotNull(artifact, "artifact cannot be null");
        for (ISchemaSource source : sources) {
            Optional<FeatureSchema> schema = source.resolve(artifact);
            if (schema.isPresent()) {
                log.info("Resolved {} features for model {} from {}", schema.get().size(), artifact.getName(),
                        schema.get().getOrigin());
                return schema.get();
            }
        }
        throw new IllegalStateException("no feature schema available for model " + artifact.getName());
    }
}
