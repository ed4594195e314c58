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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One concrete assignment of values to the named dimensions of a
 * {@link HyperparameterGrid}. The assignment keeps the order in which the
 * dimensions were declared. Instances are immutable.
 */
public final class GridPoint {

    private final Map<String, Double> values;

    private GridPoint(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public double get(String name) {
        Double value = values.get(name);
        checkArgument(value != null, "no parameter named " + name);
        return value;
    }

    public double getOrDefault(String name, double defaultValue) {
        return values.getOrDefault(name, defaultValue);
    }

    /**
     * Returns an integer valued parameter, such as an ensemble size. The stored
     * value must be a whole number.
     *
     * @param name the name of the parameter
     * @return the value as an int
     */
    public int getInt(String name) {
        double value = get(name);
        checkArgument(value == Math.rint(value), "parameter " + name + " must be a whole number");
        checkArgument(value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE,
                "parameter " + name + " is outside the int range");
        return (int) value;
    }

    /**
     * @return the values, in declaration order
     */
    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridPoint)) {
            return false;
        }
        return values.equals(((GridPoint) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static class Builder {

        private final LinkedHashMap<String, Double> values = new LinkedHashMap<>();

        public Builder put(String name, double value) {
            checkNotNull(name, "name must not be null");
            values.put(name, value);
            return this;
        }

        public GridPoint build() {
            return new GridPoint(new LinkedHashMap<>(values));
        }
    }
}
