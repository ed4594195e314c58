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

package com.amazon.windowedensemble.testutils;

public class MultiDimDataWithLabels {

    private final double[][] data;
    private final int[] labels;

    public MultiDimDataWithLabels(double[][] data, int[] labels) {
        this.data = data;
        this.labels = labels;
    }

    public double[][] getData() {
        return data;
    }

    /**
     * @return 1 for rows drawn from the anomaly distribution, 0 otherwise
     */
    public int[] getLabels() {
        return labels;
    }

    public int getNumberOfAnomalies() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }
}
