package io.depinfer.model;

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
import java.util.Objects;

/**
 * Stabilized estimates over all regression repeats.
 *
 * @param coefficients median coefficient per protein and sample
 * @param frequencies fraction of repeats with a non-zero coefficient, in [0,1]
 * @param lambdas selected penalty per repeat, in repeat order
 * @param varianceExplained variance explained per repeat, in repeat order
 * @param inputX affinity matrix the repeats were fitted on
 * @param inputY response matrix the repeats were fitted on
 */
public record AggregatedResult(
    DependencyMatrix coefficients,
    DependencyMatrix frequencies,
    List<Double> lambdas,
    List<Double> varianceExplained,
    AffinityMatrix inputX,
    ResponseMatrix inputY
) {
    public AggregatedResult {
        Objects.requireNonNull(coefficients, "coefficients cannot be null");
        Objects.requireNonNull(frequencies, "frequencies cannot be null");
        Objects.requireNonNull(inputX, "inputX cannot be null");
        Objects.requireNonNull(inputY, "inputY cannot be null");
        lambdas = List.copyOf(lambdas);
        varianceExplained = List.copyOf(varianceExplained);
    }

    public int repeats() {
        return lambdas.size();
    }
}
