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

package com.amazon.windowedensemble.tuning;

import lombok.Builder;
import lombok.Getter;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.model.IFittedModel;

/**
 * The outcome of tuning one model family on one window. The labels are the
 * predictions of {@link #getModel()} on the window it was tuned on, so callers
 * never refit the model to obtain them.
 */
@Getter
@Builder
public class TuningResult {

    private final String family;

    private final IFittedModel model;

    private final GridPoint parameters;

    private final int[] labels;

    private final double score;

    /**
     * number of complete passes over the grid
     */
    private final int rounds;

    private final int candidatesEvaluated;

    @Builder.Default
    private final FallbackReason fallbackReason = FallbackReason.NONE;

    public boolean isFallback() {
        return fallbackReason != FallbackReason.NONE;
    }

    public int getNumberOfAnomalies() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }
}
