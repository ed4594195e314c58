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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkMatrix;

import java.util.Arrays;

/**
 * Column standardization to zero mean and unit variance. The statistics are
 * computed once over the full matrix and are read-only afterwards; windows never
 * recompute them. Population (not sample) variance is used, and a column with
 * zero variance is only centered.
 */
public class Standardizer {

    private final double[] mean;
    private final double[] scale;

    Standardizer(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    /**
     * Computes the column statistics of a matrix.
     *
     * @param points rows of observations; must be rectangular and non-empty
     * @return a standardizer holding the statistics
     */
    public static Standardizer fit(double[][] points) {
        int dimensions = checkMatrix(points, "points");
        checkArgument(points.length > 0, "cannot standardize an empty matrix");

        double[] mean = new double[dimensions];
        for (double[] row : points) {
            for (int j = 0; j < dimensions; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            mean[j] /= points.length;
        }

        double[] scale = new double[dimensions];
        for (double[] row : points) {
            for (int j = 0; j < dimensions; j++) {
                double t = row[j] - mean[j];
                scale[j] += t * t;
            }
        }
        for (int j = 0; j < dimensions; j++) {
            double deviation = Math.sqrt(scale[j] / points.length);
            scale[j] = (deviation > 0) ? deviation : 1.0;
        }
        return new Standardizer(mean, scale);
    }

    public double[][] transform(double[][] points) {
        int dimensions = checkMatrix(points, "points");
        checkArgument(points.length == 0 || dimensions == mean.length, "incorrect number of columns");
        double[][] result = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            result[i] = transform(points[i]);
        }
        return result;
    }

    public double[] transform(double[] point) {
        checkArgument(point.length == mean.length, "incorrect number of columns");
        double[] result = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            result[j] = (point[j] - mean[j]) / scale[j];
        }
        return result;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getScale() {
        return Arrays.copyOf(scale, scale.length);
    }

    public int getDimensions() {
        return mean.length;
    }
}
