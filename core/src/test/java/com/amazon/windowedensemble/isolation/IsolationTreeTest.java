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

package com.amazon.windowedensemble.isolation;

import static com.amazon.windowedensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class IsolationTreeTest {

    private static List<Integer> all(int n) {
        List<Integer> list = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            list.add(i);
        }
        return list;
    }

    @Test
    public void testAveragePathLength() {
        assertEquals(0.0, IsolationTree.averagePathLength(0));
        assertEquals(0.0, IsolationTree.averagePathLength(1));
        assertEquals(1.0, IsolationTree.averagePathLength(2));
        double expected = 2 * (Math.log(255) + IsolationTree.EULER_CONSTANT) - 2 * 255.0 / 256;
        assertEquals(expected, IsolationTree.averagePathLength(256), EPSILON);
        assertTrue(IsolationTree.averagePathLength(3) > 1.0);
    }

    @Test
    public void testSinglePointTree() {
        double[][] points = { { 1, 2 } };
        IsolationTree tree = IsolationTree.grow(points, all(1), 4, 0L);
        assertEquals(1, tree.getNumberOfNodes());
        assertEquals(0.0, tree.pathLength(new double[] { 5, 5 }));
    }

    @Test
    public void testDuplicatePointsFormOneLeaf() {
        double[][] points = { { 1, 1 }, { 1, 1 }, { 1, 1 } };
        IsolationTree tree = IsolationTree.grow(points, all(3), 4, 0L);
        assertEquals(1, tree.getNumberOfNodes());
        assertEquals(IsolationTree.averagePathLength(3), tree.pathLength(points[0]), EPSILON);
    }

    @Test
    public void testDistinctPointsAreIsolatedWithinMaxDepth() {
        double[][] points = new double[16][];
        for (int i = 0; i < 16; i++) {
            points[i] = new double[] { i, (i * 7) % 16 };
        }
        IsolationTree tree = IsolationTree.grow(points, all(16), 100, 17L);
        assertEquals(31, tree.getNumberOfNodes());
        for (double[] point : points) {
            double length = tree.pathLength(point);
            assertTrue(length >= 1 && length <= 15);
            assertEquals(Math.rint(length), length);
        }
    }

    @Test
    public void testDepthLimit() {
        double[][] points = new double[64][];
        for (int i = 0; i < 64; i++) {
            points[i] = new double[] { i };
        }
        IsolationTree tree = IsolationTree.grow(points, all(64), 2, 3L);
        assertEquals(2, tree.getMaxDepth());
        assertTrue(tree.getNumberOfNodes() <= 7);
        for (double[] point : points) {
            assertTrue(tree.pathLength(point) <= 2 + IsolationTree.averagePathLength(64));
        }
    }

    @Test
    public void testSameSeedSameTree() {
        double[][] points = new double[50][];
        for (int i = 0; i < 50; i++) {
            points[i] = new double[] { Math.sin(i), Math.cos(3 * i) };
        }
        IsolationTree first = IsolationTree.grow(points, all(50), 6, 99L);
        IsolationTree second = IsolationTree.grow(points, all(50), 6, 99L);
        assertEquals(first.getNumberOfNodes(), second.getNumberOfNodes());
        for (double[] point : points) {
            assertEquals(first.pathLength(point), second.pathLength(point));
        }
    }

    @Test
    public void testSubsampleOnly() {
        double[][] points = { { 0 }, { 1 }, { 2 }, { 100 } };
        IsolationTree tree = IsolationTree.grow(points, Arrays.asList(0, 1, 2), 10, 5L);
        assertEquals(5, tree.getNumberOfNodes());
    }

    @Test
    public void testPointOnCutValueGoesLeft() {
        Cut cut = new Cut(1, 0.25);
        assertTrue(Cut.isLeftOf(new double[] { 9, 0.25 }, cut));
        assertTrue(Cut.isLeftOf(new double[] { 9, -3 }, cut));
        assertFalse(Cut.isLeftOf(new double[] { -9, 0.26 }, cut));
    }

    @Test
    public void testInvalidArguments() {
        double[][] points = { { 0 } };
        assertThrows(IllegalArgumentException.class, () -> IsolationTree.grow(points, Collections.emptyList(), 3, 0L));
        assertThrows(IllegalArgumentException.class, () -> IsolationTree.grow(points, all(1), -1, 0L));
    }
}
