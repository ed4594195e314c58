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

package com.amazon.windowedensemble.model;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;

/**
 * A family of unsupervised outlier models. The tuner and the engine only see
 * this interface; the parameters that a family understands are named in its
 * grids and {@link GridPoint}s.
 */
public interface IModelFamily {

    /**
     * @return a short name used in logs and reports
     */
    String getName();

    /**
     * @return the parameters of the fallback model, used when no grid point
     *         yields a well defined quality score
     */
    GridPoint getDefaultParameters();

    /**
     * @return the grid searched when the caller does not provide one
     */
    HyperparameterGrid getDefaultGrid();

    /**
     * @return the smallest number of observations for which a search is
     *         meaningful; smaller windows go straight to the fallback model
     */
    int getMinimumSampleSize();

    /**
     * Validates that every point of a grid holds acceptable parameters for this
     * family.
     *
     * @param grid a grid
     * @throws IllegalArgumentException if a parameter is missing or out of range
     */
    void validate(HyperparameterGrid grid);

    /**
     * Fits a fresh model. Initialization is deterministic: two calls with the
     * same arguments return models with identical predictions.
     *
     * @param points     rows of observations
     * @param parameters one grid point
     * @return the fitted model
     */
    IFittedModel fit(double[][] points, GridPoint parameters);
}
