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

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.model.IFittedModel;
import com.amazon.windowedensemble.model.IModelFamily;

public class TestUtils {

    public static final double EPSILON = 1e-9;

    /**
     * A family whose models label the first {@code round(fraction * n)} points of
     * the fitting data as outliers, where the fraction is the value of the single
     * parameter "fraction". A fraction of 0 gives a single-cluster labeling.
     */
    public static class PrefixFamily implements IModelFamily {

        public static final String FRACTION = "fraction";

        private final double defaultFraction;

        public PrefixFamily(double defaultFraction) {
            this.defaultFraction = defaultFraction;
        }

        @Override
        public String getName() {
            return "prefix";
        }

        @Override
        public GridPoint getDefaultParameters() {
            return GridPoint.builder().put(FRACTION, defaultFraction).build();
        }

        @Override
        public HyperparameterGrid getDefaultGrid() {
            return HyperparameterGrid.builder().dimension(FRACTION, 0.0, 0.1, 0.2).build();
        }

        @Override
        public int getMinimumSampleSize() {
            return 2;
        }

        @Override
        public void validate(HyperparameterGrid grid) {
        }

        @Override
        public IFittedModel fit(double[][] points, GridPoint parameters) {
            int count = (int) Math.round(parameters.get(FRACTION) * points.length);
            return new IFittedModel() {
                @Override
                public int[] predict(double[][] query) {
                    int[] labels = new int[query.length];
                    for (int i = 0; i < Math.min(count, query.length); i++) {
                        labels[i] = OUTLIER;
                    }
                    return labels;
                }

                @Override
                public double score(double[] point) {
                    return 0;
                }
            };
        }
    }
}
