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

package com.amazon.windowedensemble.tuning;

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.windowedensemble.executor.AbstractOrderedExecutor;
import com.amazon.windowedensemble.executor.SequentialExecutor;
import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.model.IFittedModel;
import com.amazon.windowedensemble.model.IModelFamily;
import com.amazon.windowedensemble.scoring.IQualityScorer;
import com.amazon.windowedensemble.scoring.SilhouetteScorer;

/**
 * Exhaustive grid search for one model family on one window.
 *
 * A round evaluates every grid point in grid order: a fresh model is fit, its
 * labels on the window are predicted and scored. The evaluations are folded
 * into a {@link TuningAccumulator} that is carried across rounds. Rounds repeat
 * until the best score of a round differs from the best score of the previous
 * round by less than the convergence tolerance, or until the round cap.
 *
 * When no candidate attains a defined score, or when the window is too small
 * for the family, the result is the family's default model fit on the whole
 * window. This is logged and never thrown.
 */
@Slf4j
@Getter
public class ModelTuner {

    public static final int DEFAULT_MAX_ROUNDS = 10;

    public static final double DEFAULT_CONVERGENCE_TOLERANCE = 0.01;

    private final IModelFamily family;

    private final HyperparameterGrid grid;

    private final int maxRounds;

    private final double convergenceTolerance;

    private final IQualityScorer scorer;

    private final AbstractOrderedExecutor executor;

    protected ModelTuner(Builder builder) {
        checkNotNull(builder.family, "family must not be null");
        checkArgument(builder.maxRounds >= 1, "maxRounds must be at least 1");
        checkArgument(builder.convergenceTolerance >= 0 && Double.isFinite(builder.convergenceTolerance),
                "convergenceTolerance must be a non-negative finite number");
        this.family = builder.family;
        this.grid = (builder.grid != null) ? builder.grid : builder.family.getDefaultGrid();
        this.family.validate(grid);
        this.maxRounds = builder.maxRounds;
        this.convergenceTolerance = builder.convergenceTolerance;
        this.scorer = (builder.scorer != null) ? builder.scorer : new SilhouetteScorer();
        this.executor = (builder.executor != null) ? builder.executor : new SequentialExecutor();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the grid point whose model best separates its own outlier labels on
     * the window.
     *
     * @param points the observations of one window, at least one
     * @return the tuning result; never null, and always carries a fitted model
     */
    public TuningResult tune(double[][] points) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.length > 0, "window must hold at least one observation");
        if (points.length < family.getMinimumSampleSize()) {
            log.warn("{}: window of {} observations is below the minimum of {}, using default parameters",
                    family.getName(), points.length, family.getMinimumSampleSize());
            return fallback(points, FallbackReason.INSUFFICIENT_WINDOW_SIZE, 0, 0);
        }

        List<GridPoint> candidates = grid.getPoints();
        TuningAccumulator accumulator = TuningAccumulator.empty();
        double previousRoundBest = Double.NEGATIVE_INFINITY;
        int rounds = 0;

        while (rounds < maxRounds) {
            ++rounds;
            List<CandidateEvaluation> evaluations = executor.mapInOrder(candidates, p -> evaluate(points, p));

            double roundBest = Double.NEGATIVE_INFINITY;
            for (CandidateEvaluation evaluation : evaluations) {
                accumulator = accumulator.accept(evaluation);
                roundBest = Math.max(roundBest, evaluation.getScore());
            }

            double improvement = roundBest - previousRoundBest;
            log.debug("{}: round {} best score {} (overall {})", family.getName(), rounds, roundBest,
                    accumulator.getBestScore());
            if (Math.abs(improvement) < convergenceTolerance) {
                break;
            }
            previousRoundBest = roundBest;
        }

        if (!accumulator.getBest().isPresent()) {
            log.warn("{}: none of the {} grid points produced two clusters on a window of {} observations, "
                    + "using default parameters", family.getName(), candidates.size(), points.length);
            return fallback(points, FallbackReason.NO_VIABLE_CANDIDATE, rounds, accumulator.getEvaluated());
        }

        CandidateEvaluation best = accumulator.getBest().get();
        return TuningResult.builder().family(family.getName()).model(best.getModel())
                .parameters(best.getParameters()).labels(best.getLabels()).score(best.getScore()).rounds(rounds)
                .candidatesEvaluated(accumulator.getEvaluated()).build();
    }

    CandidateEvaluation evaluate(double[][] points, GridPoint parameters) {
        IFittedModel model = family.fit(points, parameters);
        int[] labels = model.predict(points);
        return new CandidateEvaluation(parameters, model, labels, scorer.score(points, labels));
    }

    private TuningResult fallback(double[][] points, FallbackReason reason, int rounds, int evaluated) {
        GridPoint parameters = family.getDefaultParameters();
        CandidateEvaluation evaluation = evaluate(points, parameters);
        return TuningResult.builder().family(family.getName()).model(evaluation.getModel()).parameters(parameters)
                .labels(evaluation.getLabels()).score(evaluation.getScore()).rounds(rounds)
                .candidatesEvaluated(evaluated).fallbackReason(reason).build();
    }

    public static class Builder {

        private IModelFamily family;
        private HyperparameterGrid grid;
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private double convergenceTolerance = DEFAULT_CONVERGENCE_TOLERANCE;
        private IQualityScorer scorer;
        private AbstractOrderedExecutor executor;

        public Builder family(IModelFamily family) {
            this.family = family;
            return this;
        }

        public Builder grid(HyperparameterGrid grid) {
            this.grid = grid;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder convergenceTolerance(double convergenceTolerance) {
            this.convergenceTolerance = convergenceTolerance;
            return this;
        }

        public Builder scorer(IQualityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder executor(AbstractOrderedExecutor executor) {
            this.executor = executor;
            return this;
        }

        public ModelTuner build() {
            return new ModelTuner(this);
        }
    }
}
