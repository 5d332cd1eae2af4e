package io.depinfer.reduce;

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
 * Options for target pre-processing.
 *
 * @param transform treat entries as Kd values and apply the log/arctan transform
 * @param dedupe collapse groups of highly similar proteins into representatives
 * @param keepTargets proteins that must stay as columns, in priority order; empty for none
 * @param cutoff cosine similarity at or above which a protein joins a representative's group
 */
public record ReductionOptions(boolean transform, boolean dedupe, List<String> keepTargets, double cutoff) {

    public static final double DEFAULT_CUTOFF = 0.8;

    public ReductionOptions {
        keepTargets = keepTargets == null ? List.of() : List.copyOf(keepTargets);
        if (Double.isNaN(cutoff) || cutoff < 0.0 || cutoff > 1.0) {
            throw new IllegalArgumentException("cutoff must be in [0, 1], got " + cutoff);
        }
    }

    /**
     * Transform and deduplicate at the default cutoff, keeping nothing explicitly.
     */
    public static ReductionOptions defaults() {
        return new ReductionOptions(true, true, List.of(), DEFAULT_CUTOFF);
    }

    public ReductionOptions withTransform(boolean transform) {
        return new ReductionOptions(transform, dedupe, keepTargets, cutoff);
    }

    public ReductionOptions withDedupe(boolean dedupe) {
        return new ReductionOptions(transform, dedupe, keepTargets, cutoff);
    }

    public ReductionOptions withKeepTargets(List<String> keepTargets) {
        return new ReductionOptions(transform, dedupe, Objects.requireNonNull(keepTargets), cutoff);
    }

    public ReductionOptions withCutoff(double cutoff) {
        return new ReductionOptions(transform, dedupe, keepTargets, cutoff);
    }
}
