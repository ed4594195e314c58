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

import com.amazon.windowedensemble.isolation.IsolationForestFamily;
import com.amazon.windowedensemble.scoring.SilhouetteScorer;
import com.amazon.windowedensemble.svm.OneClassSvmFamily;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;
import com.amazon.windowedensemble.tuning.ModelTuner;
import com.amazon.windowedensemble.tuning.TuningResult;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ModelTunerBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "150", "300" })
        int windowSize;

        @Param({ "4" })
        int dimensions;

        double[][] window;
        ModelTuner forestTuner;
        ModelTuner svmTuner;

        @Setup(Level.Trial)
        public void setUp() {
            window = new NormalMixtureTestData().generateTestData(windowSize, dimensions, 0L);
            forestTuner = ModelTuner.builder().family(new IsolationForestFamily()).build();
            svmTuner = ModelTuner.builder().family(new OneClassSvmFamily()).build();
        }
    }

    @Benchmark
    public TuningResult tuneIsolationForest(BenchmarkState state) {
        return state.forestTuner.tune(state.window);
    }

    @Benchmark
    public TuningResult tuneOneClassSvm(BenchmarkState state) {
        return state.svmTuner.tune(state.window);
    }

    @Benchmark
    public double silhouette(BenchmarkState state) {
        int[] labels = new int[state.window.length];
        for (int i = 0; i < labels.length; i += 10) {
            labels[i] = 1;
        }
        return new SilhouetteScorer().score(state.window, labels);
    }
}
