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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An implementation that uses a private thread pool to process the inputs in
 * parallel. Parallel streams over a list keep encounter order when collected, so
 * the results are positioned exactly as with {@link SequentialExecutor}. Nested
 * calls from inside a task run on the same pool.
 */
public class ParallelExecutor extends AbstractOrderedExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public <T, R> List<R> mapInOrder(List<T> inputs, Function<T, R> function) {
        return submitAndJoin(() -> inputs.parallelStream().map(function).collect(Collectors.toList()));
    }

    @Override
    public boolean isParallel() {
        return true;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private synchronized ForkJoinPool getPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return getPool().submit(callable).join();
    }
}
