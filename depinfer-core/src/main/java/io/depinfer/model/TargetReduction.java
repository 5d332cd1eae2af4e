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
 * Output of target pre-processing: the affinity matrix to fit against and the
 * similarity groups that were collapsed to produce it.
 *
 * @param targetMatrix processed (possibly transformed, possibly reduced) matrix
 * @param groups one group per retained column when deduplication ran, else empty
 */
public record TargetReduction(AffinityMatrix targetMatrix, List<SimilarityGroup> groups) {

    public TargetReduction {
        Objects.requireNonNull(targetMatrix, "targetMatrix cannot be null");
        groups = List.copyOf(groups);
    }

    /**
     * Returns only the groups that absorbed other proteins.
     */
    public List<SimilarityGroup> mergedGroups() {
        return groups.stream().filter(SimilarityGroup::isMerged).toList();
    }
}
