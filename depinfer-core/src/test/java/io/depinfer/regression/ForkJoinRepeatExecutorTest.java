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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ForkJoinRepeatExecutorTest {

    @Test
    void resultsAreIndexOrdered() {
        try (ForkJoinRepeatExecutor executor = new ForkJoinRepeatExecutor(4)) {
            List<Integer> squares = executor.map(20, i -> {
                sleepQuietly((20 - i) % 7);
                return i * i;
            });

            for (int i = 0; i < 20; i++) {
                assertEquals(i * i, squares.get(i));
            }
        }
    }

    @Test
    void sequentialMatchesParallel() {
        List<String> sequential = new SequentialRepeatExecutor().map(5, i -> "r" + i);
        try (ForkJoinRepeatExecutor executor = new ForkJoinRepeatExecutor(2)) {
            assertEquals(sequential, executor.map(5, i -> "r" + i));
        }
    }

    @Test
    void failuresAreUnwrapped() {
        try (ForkJoinRepeatExecutor executor = new ForkJoinRepeatExecutor(2)) {
            assertThatThrownBy(() -> executor.map(4, i -> {
                if (i == 2) {
                    throw new SolverException("repeat two");
                }
                return i;
            }))
                .isInstanceOf(SolverException.class)
                .hasMessageContaining("repeat two");
        }
    }

    @Test
    void borrowedPoolOutlivesExecutor() {
        ForkJoinPool pool = new ForkJoinPool(2);
        try {
            try (ForkJoinRepeatExecutor executor = new ForkJoinRepeatExecutor(pool)) {
                assertEquals(2, executor.getParallelism());
                assertEquals(List.of(0, 1, 2), executor.map(3, i -> i));
            }
            assertThat(pool.isShutdown()).isFalse();
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void zeroTasksYieldEmptyList() {
        try (ForkJoinRepeatExecutor executor = new ForkJoinRepeatExecutor(1)) {
            assertThat(executor.map(0, i -> i)).isEmpty();
        }
    }

    @Test
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ForkJoinRepeatExecutor(0));
        assertThat(ForkJoinRepeatExecutor.defaultParallelism()).isPositive();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
