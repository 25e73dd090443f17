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
package com.amazon.rpsestimator;

import static com.amazon.rpsestimator.CommonUtils.allFinite;
import static com.amazon.rpsestimator.CommonUtils.checkArgument;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;
import static com.amazon.rpsestimator.CommonUtils.checkState;
import static com.amazon.rpsestimator.CommonUtils.sampleStandardDeviation;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> checkArgument(true, "fine"));
        IllegalArgumentException argument = assertThrows(IllegalArgumentException.class,
                () -> checkArgument(false, "bad argument"));
        assertEquals("bad argument", argument.getMessage());
        IllegalStateException state = assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
        assertEquals("bad state", state.getMessage());
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "null"));
        assertEquals("value", checkNotNull("value", "null"));
    }

    @Test
    public void testAllFinite() {
        assertTrue(allFinite(new double[0]));
        assertTrue(allFinite(new double[] { 1.0, -2.0 }));
        assertFalse(allFinite(new double[] { 1.0, Double.NaN }));
        assertFalse(allFinite(new double[] { Double.POSITIVE_INFINITY }));
    }

    @Test
    public void testSampleStandardDeviation() {
        double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };
        // population deviation is 2; sample deviation uses n - 1
        assertEquals(Math.sqrt(32.0 / 7), sampleStandardDeviation(values, 0, values.length), 1e-12);
        assertEquals(Math.sqrt(2), sampleStandardDeviation(values, 0, 2), 1e-12);
        assertEquals(0.0, sampleStandardDeviation(values, 1, 4), 1e-12);
        assertTrue(Double.isNaN(sampleStandardDeviation(values, 3, 4)));
    }
}
