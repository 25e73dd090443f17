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
package com.amazon.rpsestimator.model;

import static com.amazon.rpsestimator.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * A loaded model together with the feature manifest that was shipped next to
 * it, if any.
 */
@Getter
public class ModelArtifact {

    private final String name;

    private final IRegressionModel model;

    private final List<String> manifest;

    public ModelArtifact(String name, IRegressionModel model) {
        this(name, model, null);
    }

    public ModelArtifact(String name, IRegressionModel model, List<String> manifest) {
        this.name = checkNotNull(name, "name cannot be null");
        this.model = checkNotNull(model, "model cannot be null");
        this.manifest = (manifest == null) ? null : Collections.unmodifiableList(new ArrayList<>(manifest));
    }

    public Optional<List<String>> getManifest() {
        return Optional.ofNullable(manifest);
    }
}
