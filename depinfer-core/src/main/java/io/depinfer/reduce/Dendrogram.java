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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Binary merge tree produced by agglomerative clustering.
///
/// Leaves are numbered `0..n-1`. The cluster created by merge `m` is numbered
/// `n + m`. Merge heights are non-decreasing for the reducible linkages used here,
/// so cutting at a height keeps a prefix of the merge list.
///
/// @see WardLinkage
public final class Dendrogram {

    /**
     * One agglomeration step.
     *
     * @param left id of the first merged cluster
     * @param right id of the second merged cluster
     * @param height linkage distance at which the two were joined
     * @param size number of leaves under the new cluster
     */
    public record Merge(int left, int right, double height, int size) {
    }

    private final int leaves;
    private final List<Merge> merges;

    public Dendrogram(int leaves, List<Merge> merges) {
        if (leaves < 1) {
            throw new IllegalArgumentException("A dendrogram needs at least one leaf");
        }
        Objects.requireNonNull(merges, "merges cannot be null");
        if (merges.size() != leaves - 1) {
            throw new IllegalArgumentException("Expected " + (leaves - 1) + " merges, got " + merges.size());
        }
        this.leaves = leaves;
        this.merges = Collections.unmodifiableList(new ArrayList<>(merges));
    }

    public int leaves() {
        return leaves;
    }

    public List<Merge> merges() {
        return merges;
    }

    /**
     * Assigns each leaf to a flat cluster by applying every merge whose height is
     * at most {@code height}.
     *
     * <p>Cluster labels start at 0 and are numbered in order of the first leaf
     * belonging to each cluster.
     *
     * @param height cut height
     * @return cluster label per leaf
     */
    public int[] cutAtHeight(double height) {
        int[] parent = new int[leaves];
        for (int i = 0; i < leaves; i++) {
            parent[i] = i;
        }
        // any leaf of each cluster id, so merges can be replayed on leaves
        int[] leafOf = new int[2 * leaves - 1];
        for (int i = 0; i < leaves; i++) {
            leafOf[i] = i;
        }
        for (int m = 0; m < merges.size(); m++) {
            Merge merge = merges.get(m);
            leafOf[leaves + m] = leafOf[merge.left()];
            if (merge.height() <= height) {
                union(parent, leafOf[merge.left()], leafOf[merge.right()]);
            }
        }

        int[] labels = new int[leaves];
        int[] labelOfRoot = new int[leaves];
        Arrays.fill(labelOfRoot, -1);
        int next = 0;
        for (int i = 0; i < leaves; i++) {
            int root = find(parent, i);
            if (labelOfRoot[root] < 0) {
                labelOfRoot[root] = next++;
            }
            labels[i] = labelOfRoot[root];
        }
        return labels;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
