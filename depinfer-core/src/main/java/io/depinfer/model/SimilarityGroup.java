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
 * A set of proteins judged redundant, represented by one of them.
 *
 * <p>The member list starts with the representative, followed by the absorbed
 * proteins in priority order.
 *
 * @param representative the protein kept as a column of the reduced matrix
 * @param members all proteins of the group, representative first
 */
public record SimilarityGroup(String representative, List<String> members) {

    public SimilarityGroup {
        Objects.requireNonNull(representative, "representative cannot be null");
        members = List.copyOf(members);
        if (members.isEmpty() || !members.get(0).equals(representative)) {
            throw new IllegalArgumentException("members must start with the representative " + representative);
        }
    }

    /**
     * Returns true if the group absorbed at least one other protein.
     */
    public boolean isMerged() {
        return members.size() > 1;
    }

    public int size() {
        return members.size();
    }
}
