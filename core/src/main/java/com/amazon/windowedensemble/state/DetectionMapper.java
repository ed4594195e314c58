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

package com.amazon.windowedensemble.state;

import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.windowedensemble.AnomalyDetectionEngine;
import com.amazon.windowedensemble.data.Dataset;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.returntypes.DetectionResult;
import com.amazon.windowedensemble.returntypes.WindowSummary;
import com.amazon.windowedensemble.tuning.TuningResult;

/**
 * Converts between the structured request/response objects and the engine. A
 * request is fully validated by {@link #toEngine(DetectionRequest)} and
 * {@link #toDataset(DetectionRequest)} before any window is processed.
 */
public class DetectionMapper {

    public AnomalyDetectionEngine toEngine(DetectionRequest request) {
        checkNotNull(request, "request must not be null");
        return AnomalyDetectionEngine.builder().windowSize(request.getWindowSize())
                .primaryGrid(toGrid(request.getPrimaryGrid())).secondaryGrid(toGrid(request.getSecondaryGrid()))
                .weights(request.getPrimaryWeight(), request.getSecondaryWeight())
                .decisionThreshold(request.getDecisionThreshold()).maxTuningRounds(request.getMaxTuningRounds())
                .convergenceTolerance(request.getConvergenceTolerance()).randomSeed(request.getRandomSeed())
                .parallelExecutionEnabled(request.isParallelExecutionEnabled()).build();
    }

    public Dataset toDataset(DetectionRequest request) {
        checkNotNull(request, "request must not be null");
        checkNotNull(request.getFeatures(), "features must not be null");
        return request.isStandardize() ? Dataset.standardize(request.getFeatures(), request.getTimestamps())
                : Dataset.ofStandardized(request.getFeatures(), request.getTimestamps());
    }

    /**
     * Validates the request, runs a detection pass and maps the result.
     *
     * @param request the request
     * @return the response
     */
    public DetectionResponse detect(DetectionRequest request) {
        AnomalyDetectionEngine engine = toEngine(request);
        Dataset dataset = toDataset(request);
        return toResponse(engine.detect(dataset));
    }

    public DetectionResponse toResponse(DetectionResult result) {
        checkNotNull(result, "result must not be null");
        DetectionResponse response = new DetectionResponse();
        response.setLabels(result.getLabels());
        response.setPrimaryFamily(result.getPrimaryTrace().getFamily());
        response.setSecondaryFamily(result.getSecondaryTrace().getFamily());
        response.setPrimaryScores(new ArrayList<>(result.getPrimaryTrace().getScores()));
        response.setSecondaryScores(new ArrayList<>(result.getSecondaryTrace().getScores()));
        response.setAnomalyIndices(result.getAnomalyIndices());
        response.setAnomalyTimestamps(result.getAnomalyTimestamps());

        List<WindowSummaryState> windows = new ArrayList<>(result.getWindows().size());
        for (WindowSummary summary : result.getWindows()) {
            windows.add(toState(summary));
        }
        response.setWindows(windows);
        return response;
    }

    WindowSummaryState toState(WindowSummary summary) {
        WindowSummaryState state = new WindowSummaryState();
        state.setIndex(summary.getIndex());
        state.setStart(summary.getStart());
        state.setEnd(summary.getEnd());
        state.setPrimaryParameters(parameters(summary.getPrimary()));
        state.setSecondaryParameters(parameters(summary.getSecondary()));
        state.setPrimaryScore(summary.getPrimaryScore());
        state.setSecondaryScore(summary.getSecondaryScore());
        state.setPrimaryFallbackReason(summary.getPrimary().getFallbackReason().name());
        state.setSecondaryFallbackReason(summary.getSecondary().getFallbackReason().name());
        state.setNumberOfAnomalies(summary.getNumberOfAnomalies());
        return state;
    }

    private static Map<String, Double> parameters(TuningResult result) {
        return new LinkedHashMap<>(result.getParameters().asMap());
    }

    private static HyperparameterGrid toGrid(Map<String, List<Double>> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        return HyperparameterGrid.of(candidates);
    }
}
