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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Partitions a dataset into contiguous, non-overlapping windows of a fixed size.
 * The last window holds the remaining observations and may be shorter. The
 * segmenter is a lazy {@link Iterable}: windows are materialized one at a time
 * and every call to {@link #iterator()} starts over from the first window.
 */
public class WindowSegmenter implements Iterable<Window> {

    private final Dataset dataset;

    private final int windowSize;

    public WindowSegmenter(Dataset dataset, int windowSize) {
        checkNotNull(dataset, "dataset must not be null");
        checkArgument(windowSize >= 1, "windowSize must be at least 1");
        this.dataset = dataset;
        this.windowSize = windowSize;
    }

    /**
     * @return {@code ceil(N / windowSize)}
     */
    public int getNumberOfWindows() {
        int n = dataset.size();
        return n / windowSize + (n % windowSize == 0 ? 0 : 1);
    }

    public int getWindowSize() {
        return windowSize;
    }

    @Override
    public Iterator<Window> iterator() {
        return new Iterator<Window>() {

            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < dataset.size();
            }

            @Override
            public Window next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int start = next;
                int end = (dataset.size() - start <= windowSize) ? dataset.size() : start + windowSize;
                next = end;
                return new Window(start / windowSize, start, end, dataset.getPoints(start, end));
            }
        };
    }

    /**
     * Materializes all windows in order.
     *
     * @return the list of windows
     */
    public List<Window> toList() {
        List<Window> windows = new ArrayList<>(getNumberOfWindows());
        for (Window window : this) {
            windows.add(window);
        }
        return windows;
    }
}
