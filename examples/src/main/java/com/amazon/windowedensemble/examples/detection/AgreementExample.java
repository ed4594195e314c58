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
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.isolation.IsolationForestFamily;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.svm.OneClassSvmFamily;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

/**
 * Compares the default decision threshold, where the isolation forest decides
 * alone, with a threshold of 0.6, where both families must flag an observation.
 */
public class AgreementExample implements Example {

    public static void main(String[] args) throws Exception {
        new AgreementExample().run();
    }

    @Override
    public String command() {
        return "agreement";
    }

    @Override
    public String description() {
        return "require both model families to agree before flagging an observation";
    }

    @Override
    public void run() throws Exception {
        HyperparameterGrid forestGrid = HyperparameterGrid.builder()
                .dimension(IsolationForestFamily.NUMBER_OF_TREES, 50, 100)
                .dimension(IsolationForestFamily.CONTAMINATION, 0.02, 0.05).build();
        HyperparameterGrid svmGrid = HyperparameterGrid.builder().dimension(OneClassSvmFamily.NU, 0.02, 0.05)
                .dimension(OneClassSvmFamily.GAMMA, 0.1, 0.5).build();

        Dataset dataset = Dataset.standardize(new NormalMixtureTestData().generateTestData(450, 2, 3L));

        for (double threshold : new double[] { 0.5, 0.6 }) {
            AnomalyDetectionEngine engine = AnomalyDetectionEngine.builder().primaryGrid(forestGrid)
                    .secondaryGrid(svmGrid).decisionThreshold(threshold).build();
            DetectionResult result = engine.detect(dataset);
            System.out.printf("threshold = %.1f, flagged = %d, forest silhouettes = %s, svm silhouettes = %s%n",
                    threshold, result.getAnomalyCount(), result.getPrimaryTrace().getScores(),
                    result.getSecondaryTrace().getScores());
        }
    }
}
