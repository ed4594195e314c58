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
import static com.amazon.windowedensemble.CommonUtils.checkMatrix;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import com.amazon.windowedensemble.model.IFittedModel;

/**
 * An isolation forest: an ensemble of {@link IsolationTree}s, each grown on a
 * subsample drawn without replacement. The anomaly score of a point is
 * {@code 2^(-E[h(x)] / c(subsampleSize))}, so scores close to 1 are anomalous
 * and scores well below 0.5 are normal.
 *
 * With a contamination fraction the decision threshold is the
 * {@code 100 * (1 - contamination)} percentile of the scores of the fitting
 * data, so roughly that fraction of the fitting data is labeled as outliers.
 * Without one the threshold is {@link #DEFAULT_SCORE_THRESHOLD}.
 */
@Getter
public class IsolationForest implements IFittedModel {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_MAX_SUBSAMPLE_SIZE = 256;

    public static final double DEFAULT_SCORE_THRESHOLD = 0.5;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final List<IsolationTree> trees;

    private final int subsampleSize;

    private final int dimensions;

    /**
     * Contamination fraction in (0, 0.5], or NaN when the fixed threshold is used.
     */
    private final double contamination;

    private final double scoreThreshold;

    private IsolationForest(Builder builder) {
        checkNotNull(builder.points, "points must not be null");
        int columns = checkMatrix(builder.points, "points");
        checkArgument(builder.points.length > 0, "cannot fit an isolation forest to no points");
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(Double.isNaN(builder.contamination)
                || (builder.contamination > 0 && builder.contamination <= 0.5), "contamination must be in (0, 0.5]");

        double[][] points = builder.points;
        int n = points.length;
        this.dimensions = columns;
        this.contamination = builder.contamination;
        this.subsampleSize = resolveSubsampleSize(builder.maxSamples, n);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(subsampleSize, 2)) / Math.log(2));

        Random rng = new Random(builder.randomSeed);
        List<IsolationTree> list = new ArrayList<>(builder.numberOfTrees);
        for (int i = 0; i < builder.numberOfTrees; i++) {
            List<Integer> sample = sampleWithoutReplacement(n, subsampleSize, rng);
            list.add(IsolationTree.grow(points, sample, maxDepth, rng.nextLong()));
        }
        this.trees = Collections.unmodifiableList(list);

        if (Double.isNaN(contamination)) {
            this.scoreThreshold = DEFAULT_SCORE_THRESHOLD;
        } else {
            double[] scores = new double[n];
            for (int i = 0; i < n; i++) {
                scores[i] = score(points[i]);
            }
            this.scoreThreshold = percentile(scores, 100.0 * (1.0 - contamination));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A fraction in (0, 1] selects that share of the points, NaN selects
     * {@code min(DEFAULT_MAX_SUBSAMPLE_SIZE, n)}.
     */
    static int resolveSubsampleSize(double maxSamples, int n) {
        if (Double.isNaN(maxSamples)) {
            return Math.min(DEFAULT_MAX_SUBSAMPLE_SIZE, n);
        }
        checkArgument(maxSamples > 0 && maxSamples <= 1, "maxSamples must be a fraction in (0, 1]");
        return Math.max(1, (int) (maxSamples * n));
    }

    /**
     * Partial Fisher-Yates shuffle; the first {@code size} entries form the sample.
     */
    private static List<Integer> sampleWithoutReplacement(int n, int size, Random rng) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        List<Integer> sample = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int j = i + rng.nextInt(n - i);
            int t = indices[i];
            indices[i] = indices[j];
            indices[j] = t;
            sample.add(indices[i]);
        }
        return sample;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values     the values; not modified
     * @param percentile in [0, 100]
     * @return the interpolated percentile
     */
    static double percentile(double[] values, double percentile) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    @Override
    public double score(double[] point) {
        checkArgument(point.length == dimensions, "incorrect number of dimensions");
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        double normalizer = IsolationTree.averagePathLength(subsampleSize);
        double ratio = (normalizer > 0) ? sum / (trees.size() * normalizer) : 1.0;
        return Math.pow(2.0, -ratio);
    }

    @Override
    public int[] predict(double[][] points) {
        int[] labels = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            labels[i] = (score(points[i]) > scoreThreshold) ? OUTLIER : INLIER;
        }
        return labels;
    }

    public int getNumberOfTrees() {
        return trees.size();
    }

    public static class Builder {

        private double[][] points;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private double contamination = Double.NaN;
        private double maxSamples = Double.NaN;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder points(double[][] points) {
            this.points = points;
            return this;
        }

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder maxSamples(double maxSamples) {
            this.maxSamples = maxSamples;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public IsolationForest build() {
            return new IsolationForest(this);
        }
    }
}
