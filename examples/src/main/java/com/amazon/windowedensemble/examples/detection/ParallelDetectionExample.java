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

import java.util.Arrays;

import com.amazon.windowedensemble.AnomalyDetectionEngine;
import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.examples.Example;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

public class ParallelDetectionExample implements Example {

    public static void main(String[] args) throws Exception {
        new ParallelDetectionExample().run();
    }

    @Override
    public String command() {
        return "parallel";
    }

    @Override
    public String description() {
        return "process windows on a thread pool and compare with sequential processing";
    }

    @Override
    public void run() throws Exception {
        int threadPoolSize = 4;
        Dataset dataset = Dataset.standardize(new NormalMixtureTestData().generateTestData(1200, 4, 23L));

        long start = System.currentTimeMillis();
        DetectionResult sequential = AnomalyDetectionEngine.builder().build().detect(dataset);
        long sequentialMillis = System.currentTimeMillis() - start;

        start = System.currentTimeMillis();
        DetectionResult parallel = AnomalyDetectionEngine.builder().parallelExecutionEnabled(true)
                .threadPoolSize(threadPoolSize).build().detect(dataset);
        long parallelMillis = System.currentTimeMillis() - start;

        System.out.printf("windows = %d, sequential = %d ms, parallel (%d threads) = %d ms%n",
                sequential.getWindows().size(), sequentialMillis, threadPoolSize, parallelMillis);

        if (!Arrays.equals(sequential.getLabels(), parallel.getLabels())
                || !Arrays.equals(sequential.getPrimaryTrace().toArray(), parallel.getPrimaryTrace().toArray())
                || !Arrays.equals(sequential.getSecondaryTrace().toArray(), parallel.getSecondaryTrace().toArray())) {
            throw new IllegalStateException("parallel detection does not agree with sequential detection");
        }

        System.out.println("Looks good!");
    }
}
