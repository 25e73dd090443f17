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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.amazon.rpsestimator.model.ModelArtifact;

/**
 * The twelve highest-importance features of the reference model, ordered by
 * importance. This list is a snapshot of one trained model and is reproduced
 * verbatim.
 */
public class FallbackSchemaSource implements ISchemaSource {

    public static final List<String> FALLBACK_FEATURES = Collections.unmodifiableList(Arrays.asList("ewma_fast",
            "ewma_slow", "lag_5", "roll_max_5", "lag_1", "roll_min_5", "lag_2", "burst_strength", "diff_2",
            "acceleration", "roll_max_3", "roll_min_3"));

    public static final FeatureSchema FALLBACK_SCHEMA = new FeatureSchema(FALLBACK_FEATURES, SchemaOrigin.FALLBACK);

    @Override
    public Optional<FeatureSchema> resolve(ModelArtifact artifact) {
        return Optional.of(FALLBACK_SCHEMA);
    }
}
