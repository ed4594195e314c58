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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;
import static com.amazon.windowedensemble.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.data.Window;
import com.amazon.windowedensemble.data.WindowSegmenter;
import com.amazon.windowedensemble.ensemble.EnsembleCombiner;
import com.amazon.windowedensemble.executor.AbstractOrderedExecutor;
import com.amazon.windowedensemble.executor.ParallelExecutor;
import com.amazon.windowedensemble.executor.SequentialExecutor;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.isolation.IsolationForest;
import com.amazon.windowedensemble.isolation.IsolationForestFamily;
import com.amazon.windowedensemble.model.IModelFamily;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.returntypes.DiagnosticTrace;
import com.amazon.windowedensemble.returntypes.WindowSummary;
import com.amazon.windowedensemble.scoring.IQualityScorer;
import com.amazon.windowedensemble.scoring.SilhouetteScorer;
import com.amazon.windowedensemble.svm.OneClassSvmFamily;
import com.amazon.windowedensemble.tuning.ModelTuner;
import com.amazon.windowedensemble.tuning.TuningResult;

/**
 * The windowed dual-model anomaly detector.
 *
 * A detection pass splits the dataset into consecutive windows of
 * {@code windowSize} observations. On every window each of the two model
 * families is tuned independently by a {@link ModelTuner}; the labels of each
 * tuned model are scored for the diagnostic traces, and the two label streams
 * are merged by the {@link EnsembleCombiner} into the slice of the final label
 * vector that belongs to the window. No state is carried from one window to the
 * next, so windows may be processed in parallel without changing the result.
 *
 * By default the primary family is an isolation forest and the secondary family
 * a one-class SVM.
 */
@Slf4j
@Getter
public class AnomalyDetectionEngine {

    /**
     * Default number of observations per window.
     */
    public static final int DEFAULT_WINDOW_SIZE = 150;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int windowSize;

    private final ModelTuner primaryTuner;

    private final ModelTuner secondaryTuner;

    private final IQualityScorer scorer;

    private final EnsembleCombiner combiner;

    private final AbstractOrderedExecutor executor;

    AnomalyDetectionEngine(int windowSize, ModelTuner primaryTuner, ModelTuner secondaryTuner, IQualityScorer scorer,
            EnsembleCombiner combiner, AbstractOrderedExecutor executor) {
        checkArgument(windowSize >= 1, "windowSize must be at least 1");
        this.windowSize = windowSize;
        this.primaryTuner = checkNotNull(primaryTuner, "primaryTuner must not be null");
        this.secondaryTuner = checkNotNull(secondaryTuner, "secondaryTuner must not be null");
        this.scorer = checkNotNull(scorer, "scorer must not be null");
        this.combiner = checkNotNull(combiner, "combiner must not be null");
        this.executor = checkNotNull(executor, "executor must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a detection pass.
     *
     * @param dataset standardized observations
     * @return one label per observation and one diagnostic score per window and
     *         family
     */
    public DetectionResult detect(Dataset dataset) {
        checkNotNull(dataset, "dataset must not be null");
        WindowSegmenter segmenter = new WindowSegmenter(dataset, windowSize);
        log.info("detecting anomalies in {} observations using {} windows of size {}", dataset.size(),
                segmenter.getNumberOfWindows(), windowSize);

        List<WindowSummary> summaries;
        if (executor.isParallel()) {
            summaries = executor.mapInOrder(segmenter.toList(), this::processWindow);
        } else {
            summaries = new ArrayList<>(segmenter.getNumberOfWindows());
            for (Window window : segmenter) {
                summaries.add(processWindow(window));
            }
        }

        int[] labels = new int[dataset.size()];
        DiagnosticTrace primaryTrace = new DiagnosticTrace(primaryTuner.getFamily().getName());
        DiagnosticTrace secondaryTrace = new DiagnosticTrace(secondaryTuner.getFamily().getName());
        for (WindowSummary summary : summaries) {
            int[] slice = summary.getLabels();
            checkState(slice.length == summary.getEnd() - summary.getStart(), "label slice does not match window");
            System.arraycopy(slice, 0, labels, summary.getStart(), slice.length);
            primaryTrace.append(summary.getPrimaryScore());
            secondaryTrace.append(summary.getSecondaryScore());
        }

        DetectionResult result = new DetectionResult(dataset, labels, primaryTrace, secondaryTrace, summaries);
        log.info("flagged {} of {} observations", result.getAnomalyCount(), dataset.size());
        return result;
    }

    /**
     * Tunes both families on one window and combines their labels.
     *
     * @param window the window
     * @return the labels of the window and the diagnostics
     */
    WindowSummary processWindow(Window window) {
        double[][] points = window.getPoints();
        TuningResult primary = primaryTuner.tune(points);
        TuningResult secondary = secondaryTuner.tune(points);

        double primaryScore = scorer.score(points, primary.getLabels());
        double secondaryScore = scorer.score(points, secondary.getLabels());
        int[] labels = combiner.combine(primary.getLabels(), secondary.getLabels());

        log.debug("{}: {} {} score {} fallback {}, {} {} score {} fallback {}", window, primary.getFamily(),
                primary.getParameters(), primaryScore, primary.getFallbackReason(), secondary.getFamily(),
                secondary.getParameters(), secondaryScore, secondary.getFallbackReason());

        return WindowSummary.builder().index(window.getIndex()).start(window.getStart()).end(window.getEnd())
                .primary(primary).secondary(secondary).primaryScore(primaryScore).secondaryScore(secondaryScore)
                .labels(labels).build();
    }

    public static class Builder {

        private int windowSize = DEFAULT_WINDOW_SIZE;
        private IModelFamily primaryFamily;
        private HyperparameterGrid primaryGrid;
        private IModelFamily secondaryFamily;
        private HyperparameterGrid secondaryGrid;
        private double primaryWeight = EnsembleCombiner.DEFAULT_PRIMARY_WEIGHT;
        private double secondaryWeight = EnsembleCombiner.DEFAULT_SECONDARY_WEIGHT;
        private double decisionThreshold = EnsembleCombiner.DEFAULT_DECISION_THRESHOLD;
        private int maxTuningRounds = ModelTuner.DEFAULT_MAX_ROUNDS;
        private double convergenceTolerance = ModelTuner.DEFAULT_CONVERGENCE_TOLERANCE;
        private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        /**
         * Sets the first model family. Without this call the engine uses an
         * isolation forest seeded with {@link #randomSeed(long)}.
         *
         * @param family the family
         * @param grid   its grid, or null for the family's default grid
         * @return this builder
         */
        public Builder primaryFamily(IModelFamily family, HyperparameterGrid grid) {
            this.primaryFamily = family;
            this.primaryGrid = grid;
            return this;
        }

        public Builder primaryGrid(HyperparameterGrid grid) {
            this.primaryGrid = grid;
            return this;
        }

        /**
         * Sets the second model family. Without this call the engine uses a
         * one-class SVM.
         *
         * @param family the family
         * @param grid   its grid, or null for the family's default grid
         * @return this builder
         */
        public Builder secondaryFamily(IModelFamily family, HyperparameterGrid grid) {
            this.secondaryFamily = family;
            this.secondaryGrid = grid;
            return this;
        }

        public Builder secondaryGrid(HyperparameterGrid grid) {
            this.secondaryGrid = grid;
            return this;
        }

        public Builder weights(double primaryWeight, double secondaryWeight) {
            this.primaryWeight = primaryWeight;
            this.secondaryWeight = secondaryWeight;
            return this;
        }

        public Builder decisionThreshold(double decisionThreshold) {
            this.decisionThreshold = decisionThreshold;
            return this;
        }

        public Builder maxTuningRounds(int maxTuningRounds) {
            this.maxTuningRounds = maxTuningRounds;
            return this;
        }

        public Builder convergenceTolerance(double convergenceTolerance) {
            this.convergenceTolerance = convergenceTolerance;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        /**
         * Validates the configuration. Every violation is reported here, before any
         * window is processed.
         *
         * @return the engine
         * @throws IllegalArgumentException if the configuration is invalid
         */
        public AnomalyDetectionEngine build() {
            checkArgument(windowSize >= 1, "windowSize must be at least 1");
            checkArgument(!threadPoolSize.isPresent() || parallelExecutionEnabled,
                    "threadPoolSize may only be set when parallel execution is enabled");
            threadPoolSize.ifPresent(size -> checkArgument(size > 0, "threadPoolSize must be greater than 0"));

            EnsembleCombiner combiner = new EnsembleCombiner(primaryWeight, secondaryWeight, decisionThreshold);
            AbstractOrderedExecutor executor = parallelExecutionEnabled
                    ? new ParallelExecutor(threadPoolSize.orElse(Runtime.getRuntime().availableProcessors()))
                    : new SequentialExecutor();
            IQualityScorer scorer = new SilhouetteScorer();

            IModelFamily first = (primaryFamily != null) ? primaryFamily : new IsolationForestFamily(randomSeed);
            IModelFamily second = (secondaryFamily != null) ? secondaryFamily : new OneClassSvmFamily();
            ModelTuner primaryTuner = ModelTuner.builder().family(first).grid(primaryGrid).maxRounds(maxTuningRounds)
                    .convergenceTolerance(convergenceTolerance).scorer(scorer).executor(executor).build();
            ModelTuner secondaryTuner = ModelTuner.builder().family(second).grid(secondaryGrid)
                    .maxRounds(maxTuningRounds).convergenceTolerance(convergenceTolerance).scorer(scorer)
                    .executor(executor).build();

            return new AnomalyDetectionEngine(windowSize, primaryTuner, secondaryTuner, scorer, combiner, executor);
        }
    }
}
