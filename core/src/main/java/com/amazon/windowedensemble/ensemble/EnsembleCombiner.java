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

package com.amazon.windowedensemble.ensemble;

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.windowedensemble.model.IFittedModel;

/**
 * Weighted vote of two binary label streams. For each observation
 * {@code combined = (wA * a + wB * b) / (wA + wB)}, and the final label is an
 * outlier if and only if {@code combined} is strictly greater than the decision
 * threshold. With weights (0.6, 0.4) and threshold 0.5 the first stream decides
 * alone; with threshold 0.6 both streams must agree.
 */
@Getter
public class EnsembleCombiner {

    public static final double DEFAULT_PRIMARY_WEIGHT = 0.6;

    public static final double DEFAULT_SECONDARY_WEIGHT = 0.4;

    public static final double DEFAULT_DECISION_THRESHOLD = 0.5;

    private final double primaryWeight;

    private final double secondaryWeight;

    private final double decisionThreshold;

    public EnsembleCombiner(double primaryWeight, double secondaryWeight, double decisionThreshold) {
        checkArgument(primaryWeight >= 0 && Double.isFinite(primaryWeight), "primaryWeight must be non-negative");
        checkArgument(secondaryWeight >= 0 && Double.isFinite(secondaryWeight),
                "secondaryWeight must be non-negative");
        checkArgument(primaryWeight + secondaryWeight > 0, "the weights must not both be zero");
        checkArgument(decisionThreshold > 0 && decisionThreshold < 1, "decisionThreshold must be in (0, 1)");
        this.primaryWeight = primaryWeight;
        this.secondaryWeight = secondaryWeight;
        this.decisionThreshold = decisionThreshold;
    }

    /**
     * @param primary   labels of the first family, 0 or 1
     * @param secondary labels of the second family, 0 or 1, same length
     * @return the combined labels
     */
    public int[] combine(int[] primary, int[] secondary) {
        checkNotNull(primary, "primary labels must not be null");
        checkNotNull(secondary, "secondary labels must not be null");
        checkArgument(primary.length == secondary.length, "label streams must have the same length");
        int[] result = new int[primary.length];
        for (int i = 0; i < primary.length; i++) {
            checkArgument(isBinary(primary[i]) && isBinary(secondary[i]), "labels must be 0 or 1");
            result[i] = (combinedValue(primary[i], secondary[i]) > decisionThreshold) ? IFittedModel.OUTLIER
                    : IFittedModel.INLIER;
        }
        return result;
    }

    public double combinedValue(int primary, int secondary) {
        return (primaryWeight * primary + secondaryWeight * secondary) / (primaryWeight + secondaryWeight);
    }

    private static boolean isBinary(int label) {
        return label == IFittedModel.INLIER || label == IFittedModel.OUTLIER;
    }
}
