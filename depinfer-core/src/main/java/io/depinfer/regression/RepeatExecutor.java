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

import java.util.List;
import java.util.function.IntFunction;

/**
 * Runs a pure function over an index range and returns the results in index order.
 *
 * <p>Implementations may evaluate indices concurrently and in any order, but the
 * returned list always has {@code results.get(i) == task.apply(i)}. If any task
 * fails, {@link #map} fails and no partial results are returned.
 */
public interface RepeatExecutor {

    /**
     * @param count number of indices, starting at 0
     * @param task function to evaluate for each index
     * @return results ordered by index
     */
    <T> List<T> map(int count, IntFunction<T> task);
}
