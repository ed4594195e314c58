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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * An isolation tree grown on a fixed subsample. Internal nodes hold a
 * {@link Cut}; leaves hold the number of sampled points that reached them. The
 * node arrays are filled once during construction and never change afterwards.
 */
public class IsolationTree {

    public static final int Null = -1;

    /**
     * Euler-Mascheroni constant, used by the harmonic number approximation.
     */
    static final double EULER_CONSTANT = 0.5772156649;

    private final int[] leftIndex;
    private final int[] rightIndex;
    private final int[] cutDimension;
    private final double[] cutValue;
    private final int[] mass;

    private final int maxDepth;

    private IsolationTree(int[] leftIndex, int[] rightIndex, int[] cutDimension, double[] cutValue, int[] mass,
            int maxDepth) {
        this.leftIndex = leftIndex;
        this.rightIndex = rightIndex;
        this.cutDimension = cutDimension;
        this.cutValue = cutValue;
        this.mass = mass;
        this.maxDepth = maxDepth;
    }

    /**
     * Grows a tree over the given rows.
     *
     * @param points   all observations
     * @param sample   indices of the rows that form the subsample of this tree
     * @param maxDepth depth at which growth stops
     * @param seed     seed for the cuts; equal seeds give equal trees
     * @return the tree
     */
    public static IsolationTree grow(double[][] points, List<Integer> sample, int maxDepth, long seed) {
        checkArgument(!sample.isEmpty(), "cannot grow a tree on an empty sample");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        NodeLists nodes = new NodeLists();
        makeTreeInt(points, sample, seed, 0, maxDepth, nodes);
        return new IsolationTree(nodes.toArray(nodes.left), nodes.toArray(nodes.right),
                nodes.toArray(nodes.dimension), nodes.values.stream().mapToDouble(Double::doubleValue).toArray(),
                nodes.toArray(nodes.mass), maxDepth);
    }

    private static int makeTreeInt(double[][] points, List<Integer> pointList, long seed, int depth, int maxDepth,
            NodeLists nodes) {
        int node = nodes.add();
        if (pointList.size() <= 1 || depth >= maxDepth) {
            nodes.mass.set(node, pointList.size());
            return node;
        }

        Random ring = new Random(seed);
        long leftSeed = ring.nextLong();
        long rightSeed = ring.nextLong();
        Cut cut = getCut(points, pointList, ring);
        if (cut == null) {
            // all sampled points coincide
            nodes.mass.set(node, pointList.size());
            return node;
        }

        List<Integer> leftList = new ArrayList<>();
        List<Integer> rightList = new ArrayList<>();
        for (int index : pointList) {
            if (Cut.isLeftOf(points[index], cut)) {
                leftList.add(index);
            } else {
                rightList.add(index);
            }
        }

        int left = makeTreeInt(points, leftList, leftSeed, depth + 1, maxDepth, nodes);
        int right = makeTreeInt(points, rightList, rightSeed, depth + 1, maxDepth, nodes);
        nodes.left.set(node, left);
        nodes.right.set(node, right);
        nodes.dimension.set(node, cut.getDimension());
        nodes.values.set(node, cut.getValue());
        return node;
    }

    /**
     * Chooses a dimension uniformly among the dimensions in which the points are
     * not constant, and a cut value uniformly within the range of that dimension.
     */
    private static Cut getCut(double[][] points, List<Integer> pointList, Random ring) {
        int dimensions = points[pointList.get(0)].length;
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        Arrays.fill(min, Double.MAX_VALUE);
        Arrays.fill(max, -Double.MAX_VALUE);
        for (int index : pointList) {
            double[] point = points[index];
            for (int j = 0; j < dimensions; j++) {
                min[j] = Math.min(min[j], point[j]);
                max[j] = Math.max(max[j], point[j]);
            }
        }

        int[] candidates = new int[dimensions];
        int count = 0;
        for (int j = 0; j < dimensions; j++) {
            if (max[j] > min[j]) {
                candidates[count++] = j;
            }
        }
        if (count == 0) {
            return null;
        }

        int td = candidates[ring.nextInt(count)];
        double cutValue = min[td] + (max[td] - min[td]) * ring.nextDouble();
        if (cutValue >= max[td]) {
            cutValue = min[td];
        }
        return new Cut(td, cutValue);
    }

    /**
     * The depth at which a point is isolated, with the unresolved part of a leaf
     * that holds several points estimated by {@link #averagePathLength(int)}.
     *
     * @param point the query point
     * @return the path length
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (leftIndex[node] != Null) {
            node = (point[cutDimension[node]] <= cutValue[node]) ? leftIndex[node] : rightIndex[node];
            ++depth;
        }
        return depth + averagePathLength(mass[node]);
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * of n points, {@code c(n) = 2H(n-1) - 2(n-1)/n}.
     *
     * @param n number of points
     * @return c(n), with c(0) = c(1) = 0 and c(2) = 1
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_CONSTANT) - 2.0 * (n - 1.0) / n;
    }

    public int getNumberOfNodes() {
        return mass.length;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private static class NodeLists {
        final List<Integer> left = new ArrayList<>();
        final List<Integer> right = new ArrayList<>();
        final List<Integer> dimension = new ArrayList<>();
        final List<Double> values = new ArrayList<>();
        final List<Integer> mass = new ArrayList<>();

        int add() {
            left.add(Null);
            right.add(Null);
            dimension.add(Null);
            values.add(0.0);
            mass.add(0);
            return mass.size() - 1;
        }

        int[] toArray(List<Integer> list) {
            return list.stream().mapToInt(Integer::intValue).toArray();
        }
    }
}
