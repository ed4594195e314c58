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

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.model.IFittedModel;
import com.amazon.windowedensemble.model.IModelFamily;

/**
 * Isolation forests, parameterized by ensemble size, contamination fraction and
 * subsample fraction. Every fit uses the same random seed.
 */
public class IsolationForestFamily implements IModelFamily {

    public static final String NAME = "isolationForest";

    public static final String NUMBER_OF_TREES = "numberOfTrees";

    public static final String CONTAMINATION = "contamination";

    public static final String MAX_SAMPLES = "maxSamples";

    private final long randomSeed;

    public IsolationForestFamily(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public IsolationForestFamily() {
        this(IsolationForest.DEFAULT_RANDOM_SEED);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * 100 trees, no contamination fraction (fixed threshold 0.5) and at most 256
     * points per tree.
     */
    @Override
    public GridPoint getDefaultParameters() {
        return GridPoint.builder().put(NUMBER_OF_TREES, IsolationForest.DEFAULT_NUMBER_OF_TREES)
                .put(CONTAMINATION, Double.NaN).put(MAX_SAMPLES, Double.NaN).build();
    }

    @Override
    public HyperparameterGrid getDefaultGrid() {
        return HyperparameterGrid.builder().dimension(NUMBER_OF_TREES, 50, 100, 200)
                .dimension(CONTAMINATION, 0.01, 0.05, 0.1).dimension(MAX_SAMPLES, 0.5, 0.75, 1.0).build();
    }

    @Override
    public int getMinimumSampleSize() {
        return 2;
    }

    @Override
    public void validate(HyperparameterGrid grid) {
        for (String name : grid.getDimensionNames()) {
            checkArgument(NUMBER_OF_TREES.equals(name) || CONTAMINATION.equals(name) || MAX_SAMPLES.equals(name),
                    "unknown isolation forest parameter " + name);
        }
        for (GridPoint point : grid.getPoints()) {
            if (point.contains(NUMBER_OF_TREES)) {
                checkArgument(point.getInt(NUMBER_OF_TREES) > 0, "numberOfTrees must be greater than 0");
            }
            double contamination = point.getOrDefault(CONTAMINATION, Double.NaN);
            checkArgument(Double.isNaN(contamination) || (contamination > 0 && contamination <= 0.5),
                    "contamination must be in (0, 0.5]");
            double maxSamples = point.getOrDefault(MAX_SAMPLES, Double.NaN);
            checkArgument(Double.isNaN(maxSamples) || (maxSamples > 0 && maxSamples <= 1),
                    "maxSamples must be a fraction in (0, 1]");
        }
    }

    @Override
    public IFittedModel fit(double[][] points, GridPoint parameters) {
        int numberOfTrees = parameters.contains(NUMBER_OF_TREES) ? parameters.getInt(NUMBER_OF_TREES)
                : IsolationForest.DEFAULT_NUMBER_OF_TREES;
        return IsolationForest.builder().points(points).numberOfTrees(numberOfTrees)
                .contamination(parameters.getOrDefault(CONTAMINATION, Double.NaN))
                .maxSamples(parameters.getOrDefault(MAX_SAMPLES, Double.NaN)).randomSeed(randomSeed).build();
    }

    public long getRandomSeed() {
        return randomSeed;
    }
}
