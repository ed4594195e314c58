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

package com.amazon.windowedensemble.data;

import static com.amazon.windowedensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DatasetTest {

    @Test
    public void testStandardize() {
        double[][] raw = { { 1, 10 }, { 3, 10 }, { 5, 10 } };
        Dataset dataset = Dataset.standardize(raw, new long[] { 100, 200, 300 });

        assertEquals(3, dataset.size());
        assertEquals(2, dataset.getDimensions());
        assertTrue(dataset.getStandardizer().isPresent());
        double scale = Math.sqrt(8.0 / 3);
        assertArrayEquals(new double[] { -2 / scale, 0 }, dataset.getPoint(0), EPSILON);
        assertArrayEquals(new double[] { 0, 0 }, dataset.getPoint(1), EPSILON);
        assertArrayEquals(new double[] { 2 / scale, 0 }, dataset.getPoint(2), EPSILON);
        assertTrue(dataset.hasTimestamps());
        assertEquals(300L, dataset.getTimestamp(2));
    }

    @Test
    public void testOfStandardizedKeepsValues() {
        double[][] points = { { 0.5, -1 }, { 2, 3 } };
        Dataset dataset = Dataset.ofStandardized(points);
        assertFalse(dataset.getStandardizer().isPresent());
        assertFalse(dataset.hasTimestamps());
        assertArrayEquals(points[1], dataset.getPoint(1));

        points[1][0] = 42;
        assertEquals(2.0, dataset.getPoint(1)[0]);
        assertThrows(IllegalArgumentException.class, () -> dataset.getTimestamp(0));
    }

    @Test
    public void testSlices() {
        Dataset dataset = Dataset.ofStandardized(new double[][] { { 0 }, { 1 }, { 2 }, { 3 } });
        double[][] slice = dataset.getPoints(1, 3);
        assertEquals(2, slice.length);
        assertArrayEquals(new double[] { 1 }, slice[0]);
        assertEquals(0, dataset.getPoints(2, 2).length);
        assertThrows(IllegalArgumentException.class, () -> dataset.getPoints(3, 2));
        assertThrows(IllegalArgumentException.class, () -> dataset.getPoints(0, 5));
    }

    @Test
    public void testEmpty() {
        Dataset dataset = Dataset.standardize(new double[0][]);
        assertEquals(0, dataset.size());
        assertFalse(dataset.getStandardizer().isPresent());
    }

    @Test
    public void testInvalidInput() {
        assertThrows(NullPointerException.class, () -> Dataset.standardize(null));
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.standardize(new double[][] { { 1, 2 }, { 3 } }));
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.ofStandardized(new double[][] { { 1 }, { Double.NaN } }));
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.ofStandardized(new double[][] { { 1 }, { Double.POSITIVE_INFINITY } }));
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.standardize(new double[][] { { 1 }, { 2 } }, new long[] { 1 }));
    }
}
