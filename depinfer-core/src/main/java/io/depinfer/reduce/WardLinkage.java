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
import java.util.List;

/**
 * Agglomerative clustering with Ward's minimum-variance criterion on a
 * precomputed distance matrix (the "ward.D2" variant: input distances are
 * squared before the Lance-Williams update and merge heights are reported on
 * the original distance scale).
 *
 * <p>Update rule for merging clusters i and j, against every other cluster k:
 * <pre>{@code
 *   D2(k, i+j) = ((n_i + n_k) D2(k,i) + (n_j + n_k) D2(k,j) - n_k D2(i,j)) / (n_i + n_j + n_k)
 * }</pre>
 *
 * <p>Ties between equally close pairs resolve to the pair with the smallest
 * indices, so the result is deterministic for a given input order.
 */
public final class WardLinkage {

    private WardLinkage() {
        // Utility class
    }

    /**
     * Builds the dendrogram for a symmetric distance matrix.
     *
     * @param distances symmetric non-negative distances with a zero diagonal
     * @return the full merge tree
     */
    public static Dendrogram cluster(double[][] distances) {
        if (distances == null || distances.length == 0) {
            throw new IllegalArgumentException("distances cannot be null or empty");
        }
        int n = distances.length;
        double[][] d2 = new double[n][n];
        for (int i = 0; i < n; i++) {
            if (distances[i].length != n) {
                throw new IllegalArgumentException("distance matrix must be square");
            }
            for (int j = 0; j < n; j++) {
                d2[i][j] = distances[i][j] * distances[i][j];
            }
        }

        boolean[] active = new boolean[n];
        int[] size = new int[n];
        int[] clusterId = new int[n];
        for (int i = 0; i < n; i++) {
            active[i] = true;
            size[i] = 1;
            clusterId[i] = i;
        }

        List<Dendrogram.Merge> merges = new ArrayList<>(n - 1);
        for (int step = 0; step < n - 1; step++) {
            int bestI = -1;
            int bestJ = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (!active[i]) continue;
                for (int j = i + 1; j < n; j++) {
                    if (active[j] && d2[i][j] < best) {
                        best = d2[i][j];
                        bestI = i;
                        bestJ = j;
                    }
                }
            }

            int ni = size[bestI];
            int nj = size[bestJ];
            for (int k = 0; k < n; k++) {
                if (!active[k] || k == bestI || k == bestJ) continue;
                int nk = size[k];
                double updated = ((ni + nk) * d2[k][bestI] + (nj + nk) * d2[k][bestJ] - nk * best)
                    / (ni + nj + nk);
                updated = Math.max(0.0, updated);
                d2[k][bestI] = updated;
                d2[bestI][k] = updated;
            }

            int left = Math.min(clusterId[bestI], clusterId[bestJ]);
            int right = Math.max(clusterId[bestI], clusterId[bestJ]);
            merges.add(new Dendrogram.Merge(left, right, Math.sqrt(best), ni + nj));

            // slot bestI now holds the merged cluster
            size[bestI] = ni + nj;
            clusterId[bestI] = n + step;
            active[bestJ] = false;
        }
        return new Dendrogram(n, merges);
    }
}
