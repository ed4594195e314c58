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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The quality scores of one model family, one per window in window order.
 * Entries can only be appended. A window whose labels form a single cluster
 * records {@link com.amazon.windowedensemble.scoring.IQualityScorer#UNDEFINED_SCORE}.
 */
public class DiagnosticTrace {

    private final String family;

    private final List<Double> scores = new ArrayList<>();

    public DiagnosticTrace(String family) {
        this.family = family;
    }

    public void append(double score) {
        checkArgument(!Double.isNaN(score), "score must be a number");
        scores.add(score);
    }

    public String getFamily() {
        return family;
    }

    public double get(int windowIndex) {
        return scores.get(windowIndex);
    }

    public int size() {
        return scores.size();
    }

    public List<Double> getScores() {
        return Collections.unmodifiableList(scores);
    }

    public double[] toArray() {
        return scores.stream().mapToDouble(Double::doubleValue).toArray();
    }

    @Override
    public String toString() {
        return family + scores;
    }
}
