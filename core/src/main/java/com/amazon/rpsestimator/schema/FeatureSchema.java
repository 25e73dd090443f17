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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The ordered feature names a model expects. Immutable once built.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FeatureSchema {

    private final List<String> featureNames;

    @EqualsAndHashCode.Exclude
    private final SchemaOrigin origin;

    public FeatureSchema(List<String> featureNames, SchemaOrigin origin) {
        checkNotNull(featureNames, "feature names cannot be null");
        checkNotNull(origin, "origin cannot be null");
        checkArgument(!featureNames.isEmpty(), "a feature schema needs at least one feature");
        Set<String> seen = new HashSet<>();
        for (String name : featureNames) {
            checkArgument(name != null && !name.isBlank(), "feature names cannot be blank");
            checkArgument(seen.add(name), "duplicate feature name " + name);
        }
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.origin = origin;
    }

    /**
     * @param featureNames candidate names
     * @return true if the names are non-empty, non-blank and distinct
     */
    public static boolean isValid(List<String> featureNames) {
        if (featureNames == null || featureNames.isEmpty()) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        for (String name : featureNames) {
            if (name == null || name.isBlank() || !seen.add(name)) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return featureNames.size();
    }

    /**
     * @param available the columns produced by feature engineering
     * @return the schema features not present among the available columns, in
     *         schema order
     */
    public List<String> findMissing(Collection<String> available) {
        Set<String> present = new HashSet<>(available);
        List<String> missing = new ArrayList<>();
        for (String name : featureNames) {
            if (!present.contains(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * @param available the columns produced by feature engineering
     * @throws SchemaMismatchException if any schema feature is missing
     */
    public void validate(List<String> available) {
        List<String> missing = findMissing(available);
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(
                    "missing features " + missing + "; expected " + featureNames + " but found " + available,
                    missing, featureNames, available);
        }
    }
}
