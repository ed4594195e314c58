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

package com.amazon.windowedensemble;

import static com.amazon.windowedensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> CommonUtils.checkArgument(true, "unused"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommonUtils.checkArgument(false, "bad argument"));
        assertEquals("bad argument", e.getMessage());
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "bad state"));
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "missing"));
    }

    @Test
    public void testCheckMatrix() {
        assertEquals(0, CommonUtils.checkMatrix(new double[0][], "points"));
        assertEquals(3, CommonUtils.checkMatrix(new double[][] { { 1, 2, 3 } }, "points"));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkMatrix(new double[][] { {} }, "points"));
        assertThrows(NullPointerException.class,
                () -> CommonUtils.checkMatrix(new double[][] { { 1 }, null }, "points"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommonUtils.checkMatrix(new double[][] { { 1 }, { Double.NaN } }, "features"));
        assertEquals("features must contain only finite values", e.getMessage());
    }

    @Test
    public void testDistances() {
        assertEquals(25.0, CommonUtils.squaredDistance(new double[] { 0, 0 }, new double[] { 3, 4 }), EPSILON);
        assertEquals(5.0, CommonUtils.euclideanDistance(new double[] { 0, 0 }, new double[] { -3, 4 }), EPSILON);
    }
}
