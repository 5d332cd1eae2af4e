package io.depinfer.regression;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

/**
 * Evaluates indices on a {@link ForkJoinPool} and blocks until all have finished.
 *
 * <p>Results are collected from the futures in submission order, so the list is
 * ordered by index regardless of completion order. A failing task is rethrown
 * unwrapped once the batch is done.
 */
public final class ForkJoinRepeatExecutor implements RepeatExecutor, AutoCloseable {

    private final ForkJoinPool pool;
    private final boolean ownsPool;

    /**
     * Returns the default parallelism level: all available processors.
     */
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates an executor with its own pool of the given size.
     */
    public ForkJoinRepeatExecutor(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.pool = new ForkJoinPool(parallelism);
        this.ownsPool = true;
    }

    /**
     * Creates an executor on a pool owned by the caller; {@link #close()} leaves it running.
     */
    public ForkJoinRepeatExecutor(ForkJoinPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.ownsPool = false;
    }

    @Override
    public <T> List<T> map(int count, IntFunction<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        List<Callable<T>> calls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int index = i;
            calls.add(() -> task.apply(index));
        }

        List<Future<T>> futures = pool.invokeAll(calls);
        List<T> results = new ArrayList<>(count);
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for repeats", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Repeat failed", cause);
            }
        }
        return results;
    }

    public int getParallelism() {
        return pool.getParallelism();
    }

    /**
     * Shuts down the pool if this executor created it.
     */
    @Override
    public void close() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }
}
