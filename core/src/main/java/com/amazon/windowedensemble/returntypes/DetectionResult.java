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

import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.model.IFittedModel;

/**
 * The output of a detection pass: one binary label per observation, and for
 * each model family a trace with one quality score per window.
 */
public class DetectionResult {

    private final int[] labels;

    private final DiagnosticTrace primaryTrace;

    private final DiagnosticTrace secondaryTrace;

    private final List<WindowSummary> windows;

    private final Dataset dataset;

    public DetectionResult(Dataset dataset, int[] labels, DiagnosticTrace primaryTrace,
            DiagnosticTrace secondaryTrace, List<WindowSummary> windows) {
        checkArgument(labels.length == dataset.size(), "one label per observation is required");
        checkArgument(primaryTrace.size() == windows.size() && secondaryTrace.size() == windows.size(),
                "one score per window is required");
        this.dataset = dataset;
        this.labels = labels;
        this.primaryTrace = primaryTrace;
        this.secondaryTrace = secondaryTrace;
        this.windows = Collections.unmodifiableList(new ArrayList<>(windows));
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public int getLabel(int index) {
        return labels[index];
    }

    public int size() {
        return labels.length;
    }

    public DiagnosticTrace getPrimaryTrace() {
        return primaryTrace;
    }

    public DiagnosticTrace getSecondaryTrace() {
        return secondaryTrace;
    }

    public List<WindowSummary> getWindows() {
        return windows;
    }

    public int getAnomalyCount() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }

    public int[] getAnomalyIndices() {
        int[] indices = new int[getAnomalyCount()];
        int next = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == IFittedModel.OUTLIER) {
                indices[next++] = i;
            }
        }
        return indices;
    }

    /**
     * @return the timestamps of the flagged observations, or an empty array if the
     *         dataset has no timestamps
     */
    public long[] getAnomalyTimestamps() {
        if (!dataset.hasTimestamps()) {
            return new long[0];
        }
        int[] indices = getAnomalyIndices();
        long[] timestamps = new long[indices.length];
        for (int i = 0; i < indices.length; i++) {
            timestamps[i] = dataset.getTimestamp(indices[i]);
        }
        return timestamps;
    }
}
