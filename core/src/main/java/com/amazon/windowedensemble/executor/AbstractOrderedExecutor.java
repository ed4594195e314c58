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

package com.amazon.windowedensemble.executor;

import java.util.List;
import java.util.function.Function;

/**
 * Applies a function to every element of a list and returns the results in the
 * order of the input. Order preservation is what lets callers fold the results
 * deterministically, whether or not the elements were processed concurrently.
 */
public abstract class AbstractOrderedExecutor {

    /**
     * Apply a function to every input.
     *
     * @param inputs   The inputs, in the order in which results are expected.
     * @param function A function without side effects on shared state.
     * @param <T>      The input type.
     * @param <R>      The result type.
     * @return a list with {@code function.apply(inputs.get(i))} at position i.
     */
    public abstract <T, R> List<R> mapInOrder(List<T> inputs, Function<T, R> function);

    /**
     * @return true if inputs may be processed concurrently.
     */
    public abstract boolean isParallel();
}
