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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CoordinateDescentLassoTest {

    private static final double[][] TRUE_COEFFICIENTS = {
        {2.0, -1.0},
        {0.0, 0.0},
        {1.5, 0.5},
        {0.0, 0.0},
        {0.0, 0.0},
    };

    private static double[][] predictors(int n, int p, long seed) {
        Random random = new Random(seed);
        double[][] x = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                x[i][j] = random.nextDouble();
            }
        }
        return x;
    }

    private static double[][] responses(double[][] x, double[][] beta, double[] intercept) {
        double[][] y = new double[x.length][intercept.length];
        for (int i = 0; i < x.length; i++) {
            for (int k = 0; k < intercept.length; k++) {
                double v = intercept[k];
                for (int j = 0; j < beta.length; j++) {
                    v += x[i][j] * beta[j][k];
                }
                y[i][k] = v;
            }
        }
        return y;
    }

    @Test
    void recoversNoiseFreeCoefficientsAtSmallestLambda() {
        double[][] x = predictors(40, 5, 1L);
        double[] intercept = {0.5, -2.0};
        double[][] y = responses(x, TRUE_COEFFICIENTS, intercept);

        LassoPath path = new CoordinateDescentLasso().fit(x, y);
        int last = path.numberOfLambdas() - 1;
        double[][] beta = path.coefficients(last);

        for (int j = 0; j < TRUE_COEFFICIENTS.length; j++) {
            for (int k = 0; k < 2; k++) {
                assertEquals(TRUE_COEFFICIENTS[j][k], beta[j][k], 0.01, "coefficient " + j + "," + k);
            }
        }
        assertEquals(intercept[0], path.intercepts(last)[0], 0.01);
        assertEquals(intercept[1], path.intercepts(last)[1], 0.01);
        assertThat(path.devRatio(last)).isGreaterThan(0.999);
    }

    @Test
    void firstLambdaSelectsNothing() {
        double[][] x = predictors(30, 4, 2L);
        double[][] y = responses(x, new double[][] {{1, 0}, {0, 1}, {1, 1}, {0, 0}}, new double[] {0, 0});

        LassoPath path = new CoordinateDescentLasso().fit(x, y);

        assertEquals(0, path.nonZeroPredictors(0));
        assertEquals(0.0, path.devRatio(0), 1e-12);
        assertThat(path.nonZeroPredictors(path.numberOfLambdas() - 1)).isGreaterThan(0);
    }

    @Test
    void lambdaSequenceIsLogSpaced() {
        double[][] x = predictors(30, 4, 3L);
        double[][] y = responses(x, new double[][] {{1}, {2}, {0}, {0}}, new double[] {1});

        double[] lambdas = new CoordinateDescentLasso().lambdaSequence(x, y);

        assertEquals(CoordinateDescentLasso.DEFAULT_LAMBDA_COUNT, lambdas.length);
        // more observations than predictors: ratio 1e-4
        assertEquals(1e-4, lambdas[lambdas.length - 1] / lambdas[0], 1e-12);
        assertEquals(lambdas[1] / lambdas[0], lambdas[50] / lambdas[49], 1e-9);
    }

    @Test
    void widerThanTallUsesShorterPath() {
        double[][] x = predictors(6, 10, 4L);
        double[][] y = new double[6][1];
        for (int i = 0; i < 6; i++) {
            y[i][0] = x[i][0] - x[i][3];
        }

        double[] lambdas = new CoordinateDescentLasso().lambdaSequence(x, y);

        assertEquals(1e-2, lambdas[lambdas.length - 1] / lambdas[0], 1e-12);
    }

    @Test
    void predictorsEnterForAllResponsesTogether() {
        double[][] x = predictors(50, 6, 5L);
        double[][] beta = {{1, 2, -1}, {0, 0, 0}, {0, 0, 0}, {0.5, 0, 0}, {0, 0, 0}, {0, 0, 0}};
        double[][] y = responses(x, beta, new double[] {0, 0, 0});
        Random noise = new Random(6L);
        for (double[] row : y) {
            for (int k = 0; k < row.length; k++) {
                row[k] += noise.nextGaussian() * 0.05;
            }
        }

        LassoPath path = new CoordinateDescentLasso().fit(x, y);

        for (int l = 0; l < path.numberOfLambdas(); l++) {
            for (double[] row : path.coefficients(l)) {
                boolean anyZero = false;
                boolean anyNonZero = false;
                for (double v : row) {
                    anyZero |= v == 0.0;
                    anyNonZero |= v != 0.0;
                }
                assertFalse(anyZero && anyNonZero, "row partially selected at lambda " + l);
            }
        }
    }

    @Test
    void predictUsesIntercepts() {
        double[][] x = predictors(20, 2, 7L);
        double[][] y = responses(x, new double[][] {{3}, {0}}, new double[] {10});

        LassoPath path = new CoordinateDescentLasso().fit(x, y);
        double[][] atZero = path.predict(0, new double[][] {{0.2, 0.9}});

        double mean = 0;
        for (double[] row : y) {
            mean += row[0];
        }
        mean /= y.length;
        assertEquals(mean, atZero[0][0], 1e-9);
    }

    @Test
    void explicitLambdasMustDescend() {
        double[][] x = predictors(10, 2, 8L);
        double[][] y = responses(x, new double[][] {{1}, {1}}, new double[] {0});

        assertThrows(IllegalArgumentException.class,
            () -> new CoordinateDescentLasso().fit(x, y, new double[] {0.1, 0.2}));
    }

    @Test
    void constantResponseIsASolverFailure() {
        double[][] x = predictors(10, 3, 9L);
        double[][] y = new double[10][2];
        for (double[] row : y) {
            row[0] = 4.0;
            row[1] = -1.0;
        }

        assertThrows(SolverException.class, () -> new CoordinateDescentLasso().fit(x, y));
    }

    @Test
    void constantPredictorsLeaveNoPath() {
        double[][] x = new double[8][2];
        double[][] y = new double[8][1];
        for (int i = 0; i < 8; i++) {
            x[i][0] = 1.0;
            x[i][1] = 2.0;
            y[i][0] = i;
        }

        assertThatThrownBy(() -> new CoordinateDescentLasso().fit(x, y))
            .isInstanceOf(SolverException.class)
            .hasMessageContaining("lambda path");
    }

    @Test
    void passLimitIsEnforced() {
        double[][] x = predictors(40, 5, 10L);
        double[][] y = responses(x, TRUE_COEFFICIENTS, new double[] {0, 0});

        assertThatThrownBy(() -> new CoordinateDescentLasso(100, 1e-7, 1).fit(x, y))
            .isInstanceOf(SolverException.class)
            .hasMessageContaining("converge");
    }

    @Test
    void mismatchedRowsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new CoordinateDescentLasso().fit(new double[3][2], new double[4][1]));
    }
}
