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

package com.amazon.windowedensemble.testutils;

import java.util.Random;

/**
 * This class samples points from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. One of the
 * normal distributions is considered the base distribution, the second is
 * considered the anomaly distribution, and there are random transitions between
 * the two. All randomness is derived from the seed, so two calls with the same
 * arguments produce identical data.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 6.0, 1.0, 0.02, 0.5);
    }

    public NormalMixtureTestData(double baseMu, double anomalyMu) {
        this(baseMu, 1.0, anomalyMu, 1.0, 0.02, 0.5);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestDataWithLabels(numberOfRows, numberOfColumns, seed).getData();
    }

    /**
     * Generates data together with the ground truth: label 1 for every row drawn
     * from the anomaly distribution.
     *
     * @param numberOfRows    number of observations
     * @param numberOfColumns number of features per observation
     * @param seed            seed of the random generator
     * @return the data and its labels
     */
    public MultiDimDataWithLabels generateTestDataWithLabels(int numberOfRows, int numberOfColumns, long seed) {
        double[][] data = new double[numberOfRows][numberOfColumns];
        int[] labels = new int[numberOfRows];
        Random rng = new Random(seed);
        boolean anomaly = false;

        for (int i = 0; i < numberOfRows; i++) {
            if (!anomaly) {
                fillRow(data[i], rng, baseMu, baseSigma);
                if (rng.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else {
                fillRow(data[i], rng, anomalyMu, anomalySigma);
                labels[i] = 1;
                if (rng.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                }
            }
        }

        return new MultiDimDataWithLabels(data, labels);
    }

    /**
     * Base distribution only, with single outliers planted at the given rows.
     *
     * @param numberOfRows    number of observations
     * @param numberOfColumns number of features per observation
     * @param outlierRows     rows to replace by anomaly draws
     * @param seed            seed of the random generator
     * @return the data and its labels
     */
    public MultiDimDataWithLabels generateWithPlantedOutliers(int numberOfRows, int numberOfColumns,
            int[] outlierRows, long seed) {
        double[][] data = new double[numberOfRows][numberOfColumns];
        int[] labels = new int[numberOfRows];
        Random rng = new Random(seed);
        for (int i = 0; i < numberOfRows; i++) {
            fillRow(data[i], rng, baseMu, baseSigma);
        }
        for (int row : outlierRows) {
            double sign = rng.nextBoolean() ? 1.0 : -1.0;
            for (int j = 0; j < numberOfColumns; j++) {
                data[row][j] = sign * anomalyMu + anomalySigma * rng.nextGaussian();
            }
            labels[row] = 1;
        }
        return new MultiDimDataWithLabels(data, labels);
    }

    private static void fillRow(double[] row, Random rng, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = mu + sigma * rng.nextGaussian();
        }
    }
}
