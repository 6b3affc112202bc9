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

package com.hbc.anomaly.inputtypes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ObservationTest {

    @Test
    public void testScalar() {
        Observation.Scalar scalar = Observation.of(0.5);
        assertTrue(scalar.isScalar());
        assertEquals(0.5, scalar.getValue());
    }

    @Test
    public void testVectorIsCopied() {
        double[] values = new double[] { 1, 2, 3 };
        Observation.Vector vector = Observation.of(values);
        values[0] = 100;
        assertFalse(vector.isScalar());
        assertEquals(3, vector.getDimensions());
        assertArrayEquals(new double[] { 1, 2, 3 }, vector.getValues());

        vector.getValues()[1] = 100;
        assertArrayEquals(new double[] { 1, 2, 3 }, vector.getValues());
    }

    @Test
    public void testMissingVector() {
        Observation.Vector vector = Observation.of((double[]) null);
        assertNull(vector.getValues());
        assertEquals(0, vector.getDimensions());
    }

    @Test
    public void testParseValue() {
        assertEquals(0.25, Observation.parseValue("0.25"));
        assertEquals(-3.0, Observation.parseValue(" -3 "));
        assertTrue(Double.isNaN(Observation.parseValue("n/a")));
        assertTrue(Double.isNaN(Observation.parseValue("")));
        assertTrue(Double.isNaN(Observation.parseValue(null)));
        assertTrue(Double.isInfinite(Observation.parseValue("Infinity")));
    }
}
