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

package com.amazon.windowedensemble.grid;

import static com.amazon.windowedensemble.CommonUtils.checkArgument;
import static com.amazon.windowedensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A finite Cartesian product of named lists of candidate values.
 *
 * The order of {@link #getPoints()} is part of the contract, because the tuner
 * keeps the first of several equally scoring candidates: dimensions are
 * traversed outer-to-inner in declaration order, so the first declared
 * dimension varies slowest and the last declared dimension varies fastest.
 */
public final class HyperparameterGrid {

    private final Map<String, List<Double>> dimensions;

    private final List<GridPoint> points;

    private HyperparameterGrid(LinkedHashMap<String, List<Double>> dimensions) {
        this.dimensions = Collections.unmodifiableMap(dimensions);
        this.points = Collections.unmodifiableList(enumerate(dimensions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a grid from an insertion ordered map of candidate value lists.
     *
     * @param candidates the dimensions; iteration order of the map defines the
     *                   order of the dimensions
     * @return the grid
     */
    public static HyperparameterGrid of(Map<String, List<Double>> candidates) {
        checkNotNull(candidates, "candidates must not be null");
        Builder builder = builder();
        candidates.forEach(builder::dimension);
        return builder.build();
    }

    private static List<GridPoint> enumerate(LinkedHashMap<String, List<Double>> dimensions) {
        List<String> names = new ArrayList<>(dimensions.keySet());
        int[] sizes = new int[names.size()];
        int total = 1;
        for (int d = 0; d < names.size(); d++) {
            sizes[d] = dimensions.get(names.get(d)).size();
            total = Math.multiplyExact(total, sizes[d]);
        }

        List<GridPoint> result = new ArrayList<>(total);
        int[] counter = new int[names.size()];
        for (int n = 0; n < total; n++) {
            GridPoint.Builder point = GridPoint.builder();
            for (int d = 0; d < names.size(); d++) {
                point.put(names.get(d), dimensions.get(names.get(d)).get(counter[d]));
            }
            result.add(point.build());

            // odometer; the last dimension turns fastest
            for (int d = names.size() - 1; d >= 0; d--) {
                if (++counter[d] < sizes[d]) {
                    break;
                }
                counter[d] = 0;
            }
        }
        return result;
    }

    /**
     * @return every grid point, in the fixed iteration order
     */
    public List<GridPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public List<String> getDimensionNames() {
        return new ArrayList<>(dimensions.keySet());
    }

    public Map<String, List<Double>> getDimensions() {
        return dimensions;
    }

    @Override
    public String toString() {
        return "HyperparameterGrid" + dimensions;
    }

    public static class Builder {

        private final LinkedHashMap<String, List<Double>> dimensions = new LinkedHashMap<>();

        public Builder dimension(String name, List<Double> values) {
            checkNotNull(name, "dimension name must not be null");
            checkNotNull(values, "values of " + name + " must not be null");
            checkArgument(!values.isEmpty(), "dimension " + name + " must have at least one candidate value");
            for (Double value : values) {
                checkArgument(value != null, "dimension " + name + " must not contain null values");
            }
            checkArgument(!dimensions.containsKey(name), "duplicate dimension " + name);
            dimensions.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
            return this;
        }

        public Builder dimension(String name, double... values) {
            checkNotNull(values, "values of " + name + " must not be null");
            List<Double> list = new ArrayList<>(values.length);
            for (double value : values) {
                list.add(value);
            }
            return dimension(name, list);
        }

        public HyperparameterGrid build() {
            checkArgument(!dimensions.isEmpty(), "a grid must have at least one dimension");
            return new HyperparameterGrid(new LinkedHashMap<>(dimensions));
        }
    }
}
