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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CosineSimilarityTest {

    @Test
    void identicalAndScaledColumnsAreFullySimilar() {
        assertEquals(1.0, CosineSimilarity.between(new double[] {1, 2, 3}, new double[] {1, 2, 3}), 1e-12);
        assertEquals(1.0, CosineSimilarity.between(new double[] {1, 2, 3}, new double[] {2, 4, 6}), 1e-12);
    }

    @Test
    void orthogonalAndOppositeColumns() {
        assertEquals(0.0, CosineSimilarity.between(new double[] {1, 0}, new double[] {0, 1}), 1e-12);
        assertEquals(-1.0, CosineSimilarity.between(new double[] {1, 2}, new double[] {-1, -2}), 1e-12);
    }

    @Test
    void zeroColumnHasNoSimilarity() {
        double[][] sim = CosineSimilarity.matrix(new double[][] {{0, 0, 0}, {1, 1, 1}});

        assertEquals(0.0, sim[0][0]);
        assertEquals(0.0, sim[0][1]);
        assertEquals(1.0, sim[1][1]);
    }

    @Test
    void matrixIsSymmetricAndDistancesHaveZeroDiagonal() {
        double[][] columns = {{1, 0, 2}, {0, 3, 1}, {2, 2, 2}};
        double[][] sim = CosineSimilarity.matrix(columns);
        double[][] dist = CosineSimilarity.toDistances(sim);

        for (int i = 0; i < 3; i++) {
            assertEquals(0.0, dist[i][i]);
            for (int j = 0; j < 3; j++) {
                assertEquals(sim[i][j], sim[j][i], 0.0);
                if (i != j) {
                    assertEquals(1.0 - sim[i][j], dist[i][j], 0.0);
                }
            }
        }
    }

    @Test
    void rejectsUnequalLengths() {
        assertThrows(IllegalArgumentException.class,
            () -> CosineSimilarity.matrix(new double[][] {{1, 2}, {1, 2, 3}}));
    }
}
