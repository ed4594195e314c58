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

package com.amazon.windowedensemble.preprocessor;

import static com.amazon.windowedensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class StandardizerTest {

    @Test
    public void testColumnsHaveZeroMeanAndUnitVariance() {
        Random random = new Random(7);
        double[][] points = new double[500][3];
        for (double[] row : points) {
            row[0] = 5 + 3 * random.nextGaussian();
            row[1] = -2 + 0.1 * random.nextGaussian();
            row[2] = random.nextDouble() * 1000;
        }
        Standardizer standardizer = Standardizer.fit(points);
        assertEquals(3, standardizer.getDimensions());
        double[][] transformed = standardizer.transform(points);

        for (int j = 0; j < 3; j++) {
            double mean = 0;
            for (double[] row : transformed) {
                mean += row[j];
            }
            mean /= transformed.length;
            double variance = 0;
            for (double[] row : transformed) {
                variance += (row[j] - mean) * (row[j] - mean);
            }
            variance /= transformed.length;
            assertEquals(0.0, mean, 1e-9);
            assertEquals(1.0, variance, 1e-9);
        }
    }

    @Test
    public void testConstantColumnIsOnlyCentered() {
        double[][] points = { { 4, 1 }, { 4, 3 } };
        Standardizer standardizer = Standardizer.fit(points);
        assertArrayEquals(new double[] { 4, 2 }, standardizer.getMean(), EPSILON);
        assertArrayEquals(new double[] { 1, 1 }, standardizer.getScale(), EPSILON);
        assertArrayEquals(new double[] { 0, -1 }, standardizer.transform(points[0]), EPSILON);
    }

    @Test
    public void testTransformDoesNotModifyInput() {
        double[][] points = { { 1 }, { 3 } };
        Standardizer.fit(points).transform(points);
        assertArrayEquals(new double[] { 1 }, points[0]);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Standardizer.fit(new double[0][]));
        Standardizer standardizer = Standardizer.fit(new double[][] { { 1, 2 } });
        assertThrows(IllegalArgumentException.class, () -> standardizer.transform(new double[] { 1 }));
    }
}
