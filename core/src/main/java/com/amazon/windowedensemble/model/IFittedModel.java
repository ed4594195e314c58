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

/**
 * A model that has been fit to a set of observations. Implementations are
 * immutable once fit, so a fitted model may be shared between threads.
 */
public interface IFittedModel {

    int OUTLIER = 1;

    int INLIER = 0;

    /**
     * Labels observations.
     *
     * @param points rows of observations with the dimensions used for fitting
     * @return one label per row, {@link #OUTLIER} or {@link #INLIER}
     */
    int[] predict(double[][] points);

    /**
     * A real valued outlier score; larger values are more anomalous. The scale
     * depends on the model family.
     *
     * @param point an observation
     * @return the outlier score of the observation
     */
    double score(double[] point);
}
