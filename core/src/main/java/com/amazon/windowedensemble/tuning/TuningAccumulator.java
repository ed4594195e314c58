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

import static com.amazon.windowedensemble.scoring.IQualityScorer.UNDEFINED_SCORE;

import java.util.Optional;

/**
 * The state of a search folded over candidate evaluations: the best score seen
 * and the candidate that first attained it. Instances are immutable;
 * {@link #accept(CandidateEvaluation)} returns the next state.
 *
 * The initial best score is {@link com.amazon.windowedensemble.scoring.IQualityScorer#UNDEFINED_SCORE},
 * and replacement requires a strictly greater score. Consequently a candidate
 * with an undefined score never becomes the best, and among equal scores the
 * earliest candidate is kept.
 */
public final class TuningAccumulator {

    private static final TuningAccumulator EMPTY = new TuningAccumulator(UNDEFINED_SCORE, null, 0);

    private final double bestScore;

    private final CandidateEvaluation best;

    private final int evaluated;

    private TuningAccumulator(double bestScore, CandidateEvaluation best, int evaluated) {
        this.bestScore = bestScore;
        this.best = best;
        this.evaluated = evaluated;
    }

    public static TuningAccumulator empty() {
        return EMPTY;
    }

    public TuningAccumulator accept(CandidateEvaluation evaluation) {
        if (evaluation.getScore() > bestScore) {
            return new TuningAccumulator(evaluation.getScore(), evaluation, evaluated + 1);
        }
        return new TuningAccumulator(bestScore, best, evaluated + 1);
    }

    public double getBestScore() {
        return bestScore;
    }

    public Optional<CandidateEvaluation> getBest() {
        return Optional.ofNullable(best);
    }

    /**
     * @return the number of evaluations folded so far, across all rounds
     */
    public int getEvaluated() {
        return evaluated;
    }
}
