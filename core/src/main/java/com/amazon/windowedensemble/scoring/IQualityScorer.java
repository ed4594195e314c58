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

/**
 * An unsupervised cluster-separation quality metric over a set of observations
 * and a label assignment. Implementations are side-effect free, so one instance
 * can serve every model family and every window.
 */
public interface IQualityScorer {

    /**
     * Returned when the metric is undefined, for example when every observation
     * carries the same label.
     */
    double UNDEFINED_SCORE = -1.0;

    /**
     * @param points rows of observations
     * @param labels one label per row; any set of distinct values
     * @return a score in [-1, 1], or {@link #UNDEFINED_SCORE}
     */
    double score(double[][] points, int[] labels);
}
