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

import io.depinfer.aggregate.ResultAggregator;
import io.depinfer.model.AffinityMatrix;
import io.depinfer.model.AggregatedResult;
import io.depinfer.model.RawRepeatResult;
import io.depinfer.model.ResponseMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RegressionEnsembleTest {

    /** Ten drugs, five proteins, three samples driven by proteins 1 and 3 */
    private static final AffinityMatrix x;
    private static final ResponseMatrix y;

    static {
        Random random = new Random(17L);
        double[][] affinity = new double[10][5];
        double[][] response = new double[10][3];
        for (int d = 0; d < 10; d++) {
            for (int p = 0; p < 5; p++) {
                affinity[d][p] = random.nextDouble();
            }
            response[d][0] = 2 * affinity[d][0] + random.nextGaussian() * 0.05;
            response[d][1] = -affinity[d][2] + random.nextGaussian() * 0.05;
            response[d][2] = affinity[d][0] + affinity[d][2] + random.nextGaussian() * 0.05;
        }
        x = AffinityMatrix.of(affinity);
        y = ResponseMatrix.of(response);
    }

    /**
     * Reports the first draw of its generator as the lambda, after a delay that
     * scrambles completion order.
     */
    private static final class FirstDrawSolver implements SparseRegressionSolver {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public RegressionFit fit(double[][] x, double[][] y, int folds, PenaltyRule rule,
                                 RandomGenerator random) {
            calls.incrementAndGet();
            double draw = random.nextDouble();
            try {
                Thread.sleep((long) (draw * 20));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return new RegressionFit(new double[x[0].length][y[0].length], draw, 0.5);
        }
    }

    @Test
    void ensembleShapes() {
        try (RegressionEnsemble ensemble = RegressionEnsemble.builder().parallelism(2).seed(1L).build()) {
            List<RawRepeatResult> results = ensemble.runEnsemble(x, y, 5);

            assertEquals(5, results.size());
            for (int i = 0; i < 5; i++) {
                RawRepeatResult result = results.get(i);
                assertEquals(i, result.repeat());
                assertEquals(5, result.proteins());
                assertEquals(3, result.samples());
                assertThat(result.lambda()).isPositive();
                assertThat(result.varianceExplained()).isBetween(0.0, 1.0);
            }

            AggregatedResult bundle = new ResultAggregator().aggregate(results, x, y);
            assertEquals(5, bundle.coefficients().rows());
            assertEquals(3, bundle.coefficients().columns());
            assertEquals(5, bundle.frequencies().rows());
            assertEquals(3, bundle.frequencies().columns());
            assertEquals(5, bundle.lambdas().size());
            assertEquals(5, bundle.varianceExplained().size());
        }
    }

    @Test
    void resultsFollowRepeatOrderNotCompletionOrder() {
        FirstDrawSolver solver = new FirstDrawSolver();
        try (RegressionEnsemble ensemble = RegressionEnsemble.builder()
            .solver(solver)
            .parallelism(4)
            .seed(100L)
            .build()) {

            List<RawRepeatResult> results = ensemble.runEnsemble(x, y, 12);

            assertEquals(12, solver.calls.get());
            for (int i = 0; i < 12; i++) {
                assertEquals(i, results.get(i).repeat());
                assertEquals(new Well19937c(100L + i).nextDouble(), results.get(i).lambda(), 0.0);
            }
        }
    }

    @Test
    void seededRunsAreReproducibleAcrossExecutors() {
        try (RegressionEnsemble ensemble = RegressionEnsemble.builder().parallelism(3).seed(7L).build()) {
            List<RawRepeatResult> parallel = ensemble.runEnsemble(x, y, 4);
            List<RawRepeatResult> sequential = ensemble.runEnsemble(x, y, 4, new SequentialRepeatExecutor());

            for (int i = 0; i < 4; i++) {
                assertEquals(parallel.get(i).lambda(), sequential.get(i).lambda(), 0.0);
                assertArrayEquals(parallel.get(i).coefficients(), sequential.get(i).coefficients());
            }
        }
    }

    @Test
    void unseededRunsStillProduceEveryRepeat() {
        FirstDrawSolver solver = new FirstDrawSolver();
        RegressionEnsemble ensemble = RegressionEnsemble.builder()
            .solver(solver)
            .executor(new SequentialRepeatExecutor())
            .build();

        List<RawRepeatResult> results = ensemble.runEnsemble(x, y, 3);

        assertEquals(3, results.size());
        assertEquals(3, solver.calls.get());
    }

    @Test
    void failingRepeatFailsTheRun() {
        SparseRegressionSolver failing = (xs, ys, folds, rule, random) -> {
            throw new SolverException("singular");
        };
        try (RegressionEnsemble ensemble = RegressionEnsemble.builder().solver(failing).parallelism(2).build()) {
            assertThatThrownBy(() -> ensemble.runEnsemble(x, y, 3))
                .isInstanceOf(SolverException.class)
                .hasMessageContaining("singular");
        }
    }

    @Test
    void mismatchedDrugsAreRejectedBeforeFitting() {
        FirstDrawSolver solver = new FirstDrawSolver();
        ResponseMatrix shorter = ResponseMatrix.of(new double[9][3]);
        RegressionEnsemble ensemble = RegressionEnsemble.builder()
            .solver(solver)
            .executor(new SequentialRepeatExecutor())
            .build();

        assertThatThrownBy(() -> ensemble.runEnsemble(x, shorter, 5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("10 drugs");
        assertEquals(0, solver.calls.get());
    }

    @Test
    void invalidArgumentsAreRejected() {
        RegressionEnsemble ensemble = RegressionEnsemble.builder()
            .executor(new SequentialRepeatExecutor())
            .build();
        double[][] withGap = x.toArray();
        withGap[3][1] = Double.NaN;

        assertThrows(IllegalArgumentException.class, () -> ensemble.runEnsemble(x, y, 0));
        assertThrows(IllegalArgumentException.class,
            () -> ensemble.runEnsemble(x.withValues(withGap), y, 2));
        assertThrows(IllegalArgumentException.class, () -> RegressionEnsemble.builder().folds(2));
        assertThrows(IllegalArgumentException.class, () -> RegressionEnsemble.builder().parallelism(0));
    }

    @Test
    void builderDefaults() {
        RegressionEnsemble ensemble = RegressionEnsemble.builder()
            .executor(new SequentialRepeatExecutor())
            .build();

        assertEquals(RegressionEnsemble.DEFAULT_FOLDS, ensemble.getFolds());
        assertEquals(PenaltyRule.MIN_ERROR, ensemble.getPenaltyRule());
    }
}
