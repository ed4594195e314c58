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

import lombok.Getter;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.model.IFittedModel;

/**
 * A candidate model fit under one grid point, with its labels on the window and
 * their quality score.
 */
@Getter
public class CandidateEvaluation {

    private final GridPoint parameters;

    private final IFittedModel model;

    private final int[] labels;

    private final double score;

    public CandidateEvaluation(GridPoint parameters, IFittedModel model, int[] labels, double score) {
        this.parameters = parameters;
        this.model = model;
        this.labels = labels;
        this.score = score;
    }
}
