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

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.model.ModelArtifact;

@Slf4j
public class ManifestSchemaSource implements ISchemaSource {

    @Override
    public Optional<FeatureSchema> resolve(ModelArtifact artifact) {
        return artifact.getManifest().filter(names -> !names.isEmpty()).filter(names -> {
            if (!FeatureSchema.isValid(names)) {
                log.warn("Ignoring manifest of model {} with blank or duplicate feature names {}",
                        artifact.getName(), names);
                return false;
            }
            return true;
        }).map(names -> new FeatureSchema(names, SchemaOrigin.MANIFEST));
    }
}
