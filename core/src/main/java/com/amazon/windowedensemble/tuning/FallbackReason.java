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

/**
 * Why a {@link TuningResult} holds the default-parameter model of its family
 * instead of a searched one.
 */
public enum FallbackReason {

    /**
     * the result is the best candidate of the search
     */
    NONE,
    /**
     * every grid point produced a single-cluster labeling, so no candidate had a
     * defined quality score
     */
    NO_VIABLE_CANDIDATE,
    /**
     * the window holds fewer observations than the family needs; no search was run
     */
    INSUFFICIENT_WINDOW_SIZE;
}
