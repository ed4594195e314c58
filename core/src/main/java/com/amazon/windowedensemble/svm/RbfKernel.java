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

package com.amazon.windowedensemble.svm;

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.squaredDistance;

/**
 * Gaussian kernel {@code K(x, y) = exp(-gamma * |x - y|^2)}.
 */
public class RbfKernel {

    private final double gamma;

    public RbfKernel(double gamma) {
        checkArgument(gamma > 0 && Double.isFinite(gamma), "gamma must be a positive finite number");
        this.gamma = gamma;
    }

    /**
     * The width used when no explicit gamma is given: {@code 1 / (d * var(X))},
     * where the variance is taken over all entries of the matrix. A matrix with no
     * variance gets gamma 1.
     *
     * @param points rows of observations
     * @return the scaled gamma
     */
    public static double scaledGamma(double[][] points) {
        int dimensions = points[0].length;
        double sum = 0;
        long count = 0;
        for (double[] row : points) {
            for (double value : row) {
                sum += value;
                count++;
            }
        }
        double mean = sum / count;
        double squares = 0;
        for (double[] row : points) {
            for (double value : row) {
                squares += (value - mean) * (value - mean);
            }
        }
        double variance = squares / count;
        return (variance > 0) ? 1.0 / (dimensions * variance) : 1.0;
    }

    public double apply(double[] x, double[] y) {
        return Math.exp(-gamma * squaredDistance(x, y));
    }

    public double getGamma() {
        return gamma;
    }
}
