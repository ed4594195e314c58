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

package com.amazon.windowedensemble.data;

import lombok.Getter;

/**
 * A contiguous half-open slice {@code [start, end)} of a {@link Dataset}. The
 * points are copied when the window is created, so a window can be processed
 * independently of every other window.
 */
@Getter
public class Window {

    /**
     * The position of this window in the sequence of windows.
     */
    private final int index;

    private final int start;

    private final int end;

    private final double[][] points;

    public Window(int index, int start, int end, double[][] points) {
        this.index = index;
        this.start = start;
        this.end = end;
        this.points = points;
    }

    public int size() {
        return end - start;
    }

    @Override
    public String toString() {
        return String.format("Window(%d, [%d, %d))", index, start, end);
    }
}
