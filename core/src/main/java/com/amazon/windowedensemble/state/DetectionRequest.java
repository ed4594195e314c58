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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.amazon.windowedensemble.AnomalyDetectionEngine;
import com.amazon.windowedensemble.ensemble.EnsembleCombiner;
import com.amazon.windowedensemble.isolation.IsolationForest;
import com.amazon.windowedensemble.tuning.ModelTuner;

/**
 * A structured detection request: the observations and the complete engine
 * configuration. Fields left unset keep the engine defaults; a missing or empty
 * grid selects the default grid of the family.
 */
@Data
public class DetectionRequest {

    private double[][] features;

    private long[] timestamps;

    /**
     * whether the features are raw and must be standardized over the whole
     * matrix before windowing
     */
    private boolean standardize = true;

    private int windowSize = AnomalyDetectionEngine.DEFAULT_WINDOW_SIZE;

    private Map<String, List<Double>> primaryGrid = new LinkedHashMap<>();

    private Map<String, List<Double>> secondaryGrid = new LinkedHashMap<>();

    private double primaryWeight = EnsembleCombiner.DEFAULT_PRIMARY_WEIGHT;

    private double secondaryWeight = EnsembleCombiner.DEFAULT_SECONDARY_WEIGHT;

    private double decisionThreshold = EnsembleCombiner.DEFAULT_DECISION_THRESHOLD;

    private int maxTuningRounds = ModelTuner.DEFAULT_MAX_ROUNDS;

    private double convergenceTolerance = ModelTuner.DEFAULT_CONVERGENCE_TOLERANCE;

    private long randomSeed = IsolationForest.DEFAULT_RANDOM_SEED;

    private boolean parallelExecutionEnabled;
}
