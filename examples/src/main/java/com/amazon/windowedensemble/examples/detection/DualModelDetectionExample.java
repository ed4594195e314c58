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

package com.amazon.windowedensemble.examples.detection;

import com.amazon.windowedensemble.AnomalyDetectionEngine;
import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.examples.Example;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.returntypes.WindowSummary;
import com.amazon.windowedensemble.testutils.MultiDimDataWithLabels;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

/**
 * Runs the detector with its default configuration on a mixture of two normal
 * distributions and compares the labels with the ground truth.
 */
public class DualModelDetectionExample implements Example {

    public static void main(String[] args) throws Exception {
        new DualModelDetectionExample().run();
    }

    @Override
    public String command() {
        return "detect";
    }

    @Override
    public String description() {
        return "detect anomalies with an isolation forest and a one-class SVM tuned per window";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 3;
        int dataSize = 600;
        long seed = 17L;

        MultiDimDataWithLabels data = new NormalMixtureTestData().generateTestDataWithLabels(dataSize, dimensions,
                seed);
        AnomalyDetectionEngine engine = AnomalyDetectionEngine.builder().build();
        DetectionResult result = engine.detect(Dataset.standardize(data.getData()));

        System.out.printf("observations = %d, dimensions = %d, windowSize = %d%n", dataSize, dimensions,
                engine.getWindowSize());
        for (WindowSummary window : result.getWindows()) {
            System.out.printf("window %d [%d, %d): %s %s silhouette %.3f, %s %s silhouette %.3f, anomalies %d%n",
                    window.getIndex(), window.getStart(), window.getEnd(), window.getPrimary().getFamily(),
                    window.getPrimary().getParameters(), window.getPrimaryScore(), window.getSecondary().getFamily(),
                    window.getSecondary().getParameters(), window.getSecondaryScore(),
                    window.getNumberOfAnomalies());
        }

        int[] truth = data.getLabels();
        int[] labels = result.getLabels();
        int truePositives = 0;
        int falsePositives = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == 1) {
                if (truth[i] == 1) {
                    truePositives++;
                } else {
                    falsePositives++;
                }
            }
        }

        System.out.printf("planted anomalies = %d, flagged = %d, true positives = %d, false positives = %d%n",
                data.getNumberOfAnomalies(), result.getAnomalyCount(), truePositives, falsePositives);
    }
}
