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

package com.amazon.windowedensemble.returntypes;

import lombok.Builder;
import lombok.Getter;

import com.amazon.windowedensemble.tuning.TuningResult;

/**
 * What happened on one window: the tuning outcome of each family, the
 * diagnostic score of each family's labels and the number of observations the
 * combined vote flagged.
 */
@Getter
@Builder
public class WindowSummary {

    private final int index;

    private final int start;

    private final int end;

    private final TuningResult primary;

    private final TuningResult secondary;

    private final double primaryScore;

    private final double secondaryScore;

    private final int[] labels;

    public int getNumberOfAnomalies() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }
}
