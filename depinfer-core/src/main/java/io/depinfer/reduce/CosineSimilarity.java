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

/**
 * Pairwise cosine similarity between feature columns.
 *
 * <p>For columns a and b, {@code sim(a,b) = a.b / (|a| |b|)}. A column with zero
 * norm has similarity 0 to every column, itself included. Results are clamped
 * to [-1, 1] to absorb rounding.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
        // Utility class
    }

    /**
     * Computes the full similarity matrix between columns.
     *
     * @param columns one array per feature, all of equal length [features][observations]
     * @return symmetric similarity matrix [features][features]
     */
    public static double[][] matrix(double[][] columns) {
        if (columns == null || columns.length == 0) {
            throw new IllegalArgumentException("columns cannot be null or empty");
        }
        int features = columns.length;
        int n = columns[0].length;

        double[] norms = new double[features];
        for (int f = 0; f < features; f++) {
            if (columns[f].length != n) {
                throw new IllegalArgumentException("Column " + f + " has " + columns[f].length
                    + " observations, expected " + n);
            }
            double sumSq = 0;
            for (double v : columns[f]) {
                sumSq += v * v;
            }
            norms[f] = Math.sqrt(sumSq);
        }

        double[][] sim = new double[features][features];
        for (int i = 0; i < features; i++) {
            sim[i][i] = norms[i] > 0 ? 1.0 : 0.0;
            for (int j = i + 1; j < features; j++) {
                double s = 0;
                if (norms[i] > 0 && norms[j] > 0) {
                    double dot = 0;
                    for (int k = 0; k < n; k++) {
                        dot += columns[i][k] * columns[j][k];
                    }
                    s = Math.max(-1.0, Math.min(1.0, dot / (norms[i] * norms[j])));
                }
                sim[i][j] = s;
                sim[j][i] = s;
            }
        }
        return sim;
    }

    /**
     * Cosine similarity of two vectors.
     */
    public static double between(double[] a, double[] b) {
        return matrix(new double[][] {a, b})[0][1];
    }

    /**
     * Converts similarities to distances {@code 1 - sim} with a zero diagonal.
     */
    public static double[][] toDistances(double[][] similarity) {
        int n = similarity.length;
        double[][] dist = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                dist[i][j] = i == j ? 0.0 : 1.0 - similarity[i][j];
            }
        }
        return dist;
    }
}
