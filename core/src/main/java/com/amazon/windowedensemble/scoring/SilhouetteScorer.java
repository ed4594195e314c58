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

package com.amazon.windowedensemble.scoring;

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;
import static com.amazon.windowedensemble.CommonUtils.euclideanDistance;

import java.util.Arrays;

/**
 * The mean silhouette coefficient with Euclidean distance. For an observation
 * with mean intra-cluster distance {@code a} and mean distance {@code b} to the
 * nearest other cluster the coefficient is {@code (b - a) / max(a, b)}; an
 * observation that is alone in its cluster contributes 0.
 *
 * The metric is undefined, and {@link #UNDEFINED_SCORE} is returned, unless the
 * number of distinct labels is between 2 and {@code n - 1}.
 */
public class SilhouetteScorer implements IQualityScorer {

    @Override
    public double score(double[][] points, int[] labels) {
        checkNotNull(points, "points must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(points.length == labels.length, "there must be one label per point");
        int n = points.length;

        // relabel to 0..k-1
        int[] distinct = Arrays.stream(labels).distinct().sorted().toArray();
        int k = distinct.length;
        if (k < 2 || k > n - 1) {
            return UNDEFINED_SCORE;
        }
        int[] cluster = new int[n];
        int[] clusterSize = new int[k];
        for (int i = 0; i < n; i++) {
            cluster[i] = Arrays.binarySearch(distinct, labels[i]);
            clusterSize[cluster[i]]++;
        }

        double total = 0;
        double[] distanceSum = new double[k];
        for (int i = 0; i < n; i++) {
            if (clusterSize[cluster[i]] == 1) {
                continue;
            }
            Arrays.fill(distanceSum, 0);
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    distanceSum[cluster[j]] += euclideanDistance(points[i], points[j]);
                }
            }
            double a = distanceSum[cluster[i]] / (clusterSize[cluster[i]] - 1);
            double b = Double.MAX_VALUE;
            for (int c = 0; c < k; c++) {
                if (c != cluster[i]) {
                    b = Math.min(b, distanceSum[c] / clusterSize[c]);
                }
            }
            double denominator = Math.max(a, b);
            if (denominator > 0) {
                total += (b - a) / denominator;
            }
        }
        return total / n;
    }
}
