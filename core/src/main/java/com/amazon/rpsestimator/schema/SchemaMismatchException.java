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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Raised when engineered features do not cover what a model expects, or when
 * the ordered matrix does not have one column per schema feature.
 */
@Getter
public class SchemaMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingFeatures;

    private final List<String> expectedFeatures;

    private final List<String> foundFeatures;

    public SchemaMismatchException(String message, List<String> missingFeatures, List<String> expectedFeatures,
            List<String> foundFeatures) {
        super(message);
        this.missingFeatures = Collections.unmodifiableList(new ArrayList<>(missingFeatures));
        this.expectedFeatures = Collections.unmodifiableList(new ArrayList<>(expectedFeatures));
        this.foundFeatures = Collections.unmodifiableList(new ArrayList<>(foundFeatures));
    }
}
