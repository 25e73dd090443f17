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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class LinearRegressionModelTest {

    @Test
    public void testPredict() {
        LinearRegressionModel model = new LinearRegressionModel(5, new double[] { 2, -1 },
                Arrays.asList("lag_1", "lag_2"));
        double[] answer = model.predict(new double[][] { { 1, 1 }, { 10, 3 }, { 0, 0 } });
        assertArrayEquals(new double[] { 6, 22, 5 }, answer, 1e-12);
        assertEquals(Optional.of(Arrays.asList("lag_1", "lag_2")), model.getFeatureNames());
        assertEquals(0, model.predict(new double[0][]).length);
    }

    @Test
    public void testWrongWidth() {
        LinearRegressionModel model = new LinearRegressionModel(0, new double[] { 1 },
                Collections.singletonList("lag_1"));
        assertThrows(IllegalArgumentException.class, () -> model.predict(new double[][] { { 1, 2 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new LinearRegressionModel(0, new double[] { 1, 2 }, Collections.singletonList("lag_1")));
    }

    @Test
    public void testConstantModel() {
        ConstantRegressionModel model = new ConstantRegressionModel(7.5);
        assertArrayEquals(new double[] { 7.5, 7.5 }, model.predict(new double[2][3]), 0);
        assertTrue(model.getFeatureNames().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new ConstantRegressionModel(Double.NaN));
    }
}
