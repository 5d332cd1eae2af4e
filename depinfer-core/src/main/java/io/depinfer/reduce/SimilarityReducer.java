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

import io.depinfer.model.AffinityMatrix;
import io.depinfer.model.SimilarityGroup;
import io.depinfer.model.TargetReduction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pre-processes a drug-protein affinity matrix and collapses redundant proteins.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * Kd matrix ──► [transform] ──► [dedupe] ──► reduced matrix + similarity groups
 *                 -log10, NaN→-10,   cosine similarity
 *                 arctan squash      priority order
 *                                    Ward.D2 dendrogram
 *                                    greedy grouping
 * }</pre>
 *
 * <h2>Grouping</h2>
 *
 * <p>Proteins are visited in priority order: proteins to keep first, in the
 * caller's order, then the rest by descending total affinity (ties keep their
 * column order). A visited protein joins the group of an earlier representative
 * if its cosine similarity to that representative is at least the cutoff;
 * otherwise it starts a new group. When several representatives qualify, the
 * one in the same Ward cluster (dendrogram cut at {@code 1 - cutoff}) wins, then
 * the most similar, then the earliest. Proteins to keep always start their own
 * group.
 *
 * <p>This guarantees that every member is within the cutoff of its
 * representative and that representatives which are not kept are mutually below
 * the cutoff, so reducing a reduced matrix again changes nothing.
 *
 * <p>The reduced matrix holds the representatives' columns in priority order.
 */
public final class SimilarityReducer {

    private static final Logger logger = LogManager.getLogger(SimilarityReducer.class);

    /** Slack for comparing similarities against the cutoff */
    static final double SIMILARITY_TOLERANCE = 1e-12;

    /**
     * Reduces with explicit arguments.
     *
     * @see #reduce(AffinityMatrix, ReductionOptions)
     */
    public TargetReduction reduce(AffinityMatrix affinity, boolean transform, boolean dedupe,
                                  List<String> keepTargets, double cutoff) {
        return reduce(affinity, new ReductionOptions(transform, dedupe, keepTargets, cutoff));
    }

    /**
     * Transforms and/or deduplicates a copy of the affinity matrix.
     *
     * @param affinity drug x protein matrix
     * @param options processing options
     * @return processed matrix and its similarity groups (empty when not deduplicating)
     * @throws IllegalArgumentException for empty input, unknown proteins to keep, or
     *         missing values that reach the similarity computation
     * @throws DegenerateReductionException if several proteins collapse into one column
     */
    public TargetReduction reduce(AffinityMatrix affinity, ReductionOptions options) {
        Objects.requireNonNull(affinity, "affinity cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (affinity.rows() == 0 || affinity.columns() == 0) {
            throw new IllegalArgumentException("affinity matrix cannot be empty: " + affinity);
        }
        List<String> keep = distinctKeepTargets(affinity, options.keepTargets());

        AffinityMatrix matrix = affinity;
        if (options.transform()) {
            matrix = AffinityTransform.apply(matrix);
            logger.debug("Transformed {} Kd values to affinity scores", (long) matrix.rows() * matrix.columns());
        }

        if (!options.dedupe()) {
            return new TargetReduction(matrix, List.of());
        }
        if (matrix.hasMissing()) {
            throw new IllegalArgumentException(
                "affinity matrix contains missing values; enable transform or impute them first");
        }

        int[] priority = priorityOrder(matrix, keep);
        Set<String> keepSet = new LinkedHashSet<>(keep);
        List<Group> groups = group(matrix, priority, keepSet, options.cutoff());

        if (matrix.columns() > 1 && groups.size() == 1) {
            throw new DegenerateReductionException("cutoff " + options.cutoff() + " collapses all "
                + matrix.columns() + " proteins into a single group");
        }

        int[] representatives = new int[groups.size()];
        List<SimilarityGroup> mapping = new ArrayList<>(groups.size());
        for (int g = 0; g < groups.size(); g++) {
            Group group = groups.get(g);
            representatives[g] = group.representative;
            List<String> members = new ArrayList<>(group.members.size());
            for (int member : group.members) {
                members.add(matrix.proteinIds().get(member));
            }
            mapping.add(new SimilarityGroup(members.get(0), members));
        }

        logger.info("Reduced {} proteins to {} target groups at cutoff {}",
            matrix.columns(), groups.size(), options.cutoff());
        return new TargetReduction(matrix.selectColumns(representatives), mapping);
    }

    private static List<String> distinctKeepTargets(AffinityMatrix affinity, List<String> keepTargets) {
        List<String> unknown = new ArrayList<>();
        Set<String> keep = new LinkedHashSet<>();
        for (String id : keepTargets) {
            if (!affinity.hasColumn(id)) {
                unknown.add(id);
            }
            keep.add(id);
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown proteins to keep: " + unknown);
        }
        return new ArrayList<>(keep);
    }

    /**
     * Column positions in priority order: kept proteins first, then by descending
     * column sum with ties in column order.
     */
    static int[] priorityOrder(AffinityMatrix matrix, List<String> keep) {
        double[] sums = matrix.columnSums();
        List<Integer> rest = new ArrayList<>();
        Set<String> keepSet = Set.copyOf(keep);
        for (int c = 0; c < matrix.columns(); c++) {
            if (!keepSet.contains(matrix.proteinIds().get(c))) {
                rest.add(c);
            }
        }
        // List.sort is stable
        rest.sort(Comparator.comparingDouble((Integer c) -> sums[c]).reversed());

        int[] order = new int[matrix.columns()];
        int i = 0;
        for (String id : keep) {
            order[i++] = matrix.columnIndexOf(id);
        }
        for (int c : rest) {
            order[i++] = c;
        }
        return order;
    }

    private static List<Group> group(AffinityMatrix matrix, int[] priority, Set<String> keep, double cutoff) {
        double[][] allColumns = matrix.toColumnArrays();
        double[][] columns = new double[priority.length][];
        for (int i = 0; i < priority.length; i++) {
            columns[i] = allColumns[priority[i]];
        }

        // indices below are positions in priority order
        double[][] similarity = CosineSimilarity.matrix(columns);
        Dendrogram tree = WardLinkage.cluster(CosineSimilarity.toDistances(similarity));
        int[] wardCluster = tree.cutAtHeight(1.0 - cutoff);

        List<Group> groups = new ArrayList<>();
        for (int p = 0; p < priority.length; p++) {
            Group target = null;
            if (!keep.contains(matrix.proteinIds().get(priority[p]))) {
                target = bestGroup(groups, p, similarity, wardCluster, cutoff);
            }
            if (target == null) {
                target = new Group(p, priority[p]);
                groups.add(target);
            }
            target.members.add(priority[p]);
        }
        return groups;
    }

    private static Group bestGroup(List<Group> groups, int p, double[][] similarity, int[] wardCluster,
                                   double cutoff) {
        Group best = null;
        boolean bestSameCluster = false;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (Group group : groups) {
            double s = similarity[p][group.position];
            if (s < cutoff - SIMILARITY_TOLERANCE) {
                continue;
            }
            boolean sameCluster = wardCluster[p] == wardCluster[group.position];
            if (best == null
                || (sameCluster && !bestSameCluster)
                || (sameCluster == bestSameCluster && s > bestSimilarity)) {
                best = group;
                bestSameCluster = sameCluster;
                bestSimilarity = s;
            }
        }
        return best;
    }

    private static final class Group {
        final int position;
        final int representative;
        final List<Integer> members = new ArrayList<>();

        Group(int position, int representative) {
            this.position = position;
            this.representative = representative;
        }
    }
}
