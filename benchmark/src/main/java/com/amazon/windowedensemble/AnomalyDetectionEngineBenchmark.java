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

package com.amazon.windowedensemble;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class AnomalyDetectionEngineBenchmark {
    public static final int DATA_SIZE = 1500;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        @Param({ "150" })
        int windowSize;

        Dataset dataset;
        AnomalyDetectionEngine engine;

        @Setup(Level.Trial)
        public void setUp() {
            dataset = Dataset.standardize(new NormalMixtureTestData().generateTestData(DATA_SIZE, 3, 0L));
            engine = AnomalyDetectionEngine.builder().windowSize(windowSize)
                    .parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @Benchmark
    public DetectionResult detect(BenchmarkState state) {
        return state.engine.detect(state.dataset);
    }
}
