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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkMatrix;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

import com.amazon.windowedensemble.preprocessor.Standardizer;

/**
 * An ordered sequence of observations with a constant number of standardized
 * features, and optionally a parallel sequence of timestamps. Timestamps are
 * carried for reporting only; detection never reads them.
 */
public class Dataset {

    private final double[][] points;

    private final long[] timestamps;

    /**
     * The number of features of every observation, 0 for an empty dataset.
     */
    @Getter
    private final int dimensions;

    /**
     * The statistics used to standardize the data, if the dataset standardized
     * its input itself.
     */
    private final Standardizer standardizer;

    private Dataset(double[][] points, long[] timestamps, int dimensions, Standardizer standardizer) {
        this.points = points;
        this.timestamps = timestamps;
        this.dimensions = dimensions;
        this.standardizer = standardizer;
    }

    /**
     * Wraps a matrix that is already standardized.
     *
     * @param points     rows of observations in time order
     * @param timestamps optional timestamps, one per row; may be null
     * @return a dataset
     */
    public static Dataset ofStandardized(double[][] points, long[] timestamps) {
        int dimensions = checkMatrix(points, "points");
        checkTimestamps(points, timestamps);
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            copy[i] = Arrays.copyOf(points[i], dimensions);
        }
        return new Dataset(copy, copyOf(timestamps), dimensions, null);
    }

    public static Dataset ofStandardized(double[][] points) {
        return ofStandardized(points, null);
    }

    /**
     * Standardizes raw features with statistics computed over the whole matrix,
     * before any windowing.
     *
     * @param points     raw rows of observations in time order
     * @param timestamps optional timestamps, one per row; may be null
     * @return a dataset of standardized observations
     */
    public static Dataset standardize(double[][] points, long[] timestamps) {
        int dimensions = checkMatrix(points, "points");
        checkTimestamps(points, timestamps);
        if (points.length == 0) {
            return new Dataset(new double[0][], copyOf(timestamps), dimensions, null);
        }
        Standardizer standardizer = Standardizer.fit(points);
        return new Dataset(standardizer.transform(points), copyOf(timestamps), dimensions, standardizer);
    }

    public static Dataset standardize(double[][] points) {
        return standardize(points, null);
    }

    private static void checkTimestamps(double[][] points, long[] timestamps) {
        checkArgument(timestamps == null || timestamps.length == points.length,
                "timestamps must have one entry per observation");
    }

    private static long[] copyOf(long[] timestamps) {
        return (timestamps == null) ? null : Arrays.copyOf(timestamps, timestamps.length);
    }

    public int size() {
        return points.length;
    }

    public double[] getPoint(int index) {
        return Arrays.copyOf(points[index], dimensions);
    }

    /**
     * Copies the rows {@code [start, end)}.
     *
     * @param start first row, inclusive
     * @param end   last row, exclusive
     * @return the rows of the slice
     */
    public double[][] getPoints(int start, int end) {
        checkArgument(0 <= start && start <= end && end <= points.length, "invalid slice");
        double[][] slice = new double[end - start][];
        for (int i = start; i < end; i++) {
            slice[i - start] = Arrays.copyOf(points[i], dimensions);
        }
        return slice;
    }

    public boolean hasTimestamps() {
        return timestamps != null;
    }

    public long getTimestamp(int index) {
        checkArgument(timestamps != null, "dataset has no timestamps");
        return timestamps[index];
    }

    public Optional<Standardizer> getStandardizer() {
        return Optional.ofNullable(standardizer);
    }
}
