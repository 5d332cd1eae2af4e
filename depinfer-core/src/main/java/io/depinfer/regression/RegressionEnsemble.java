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

import io.depinfer.model.AffinityMatrix;
import io.depinfer.model.MatrixValidation;
import io.depinfer.model.RawRepeatResult;
import io.depinfer.model.ResponseMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Runs independent cross-validated lasso fits of a response matrix against an
 * affinity matrix.
 *
 * <h2>Architecture</h2>
 *
 * <pre>{@code
 * ┌──────────────────────────────────────────────────────────────┐
 * │ validate: aligned drugs, complete matrices, repeats >= 1     │
 * └──────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌──────────────────────────────────────────────────────────────┐
 * │ RepeatExecutor.map(repeats, i -> fit(X, Y, rng(seed + i)))   │
 * │                                                              │
 * │  ┌───────────┐ ┌───────────┐ ┌───────────┐ ┌───────────┐     │
 * │  │ repeat 0  │ │ repeat 1  │ │ repeat 2  │ │ repeat N  │     │
 * │  │ k-fold CV │ │ k-fold CV │ │ k-fold CV │ │ k-fold CV │     │
 * │  └───────────┘ └───────────┘ └───────────┘ └───────────┘     │
 * └──────────────────────────────────────────────────────────────┘
 *          ↓
 *   List<RawRepeatResult> in repeat order
 * }</pre>
 *
 * <p>The input matrices are read-only and shared by all repeats. Each repeat owns
 * its random generator; with a seed, repeat {@code i} is seeded with
 * {@code seed + i} so results do not depend on scheduling.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (RegressionEnsemble ensemble = RegressionEnsemble.builder()
 *         .parallelism(8)
 *         .seed(42L)
 *         .build()) {
 *     List<RawRepeatResult> repeats = ensemble.runEnsemble(x, y, 100);
 * }
 * }</pre>
 */
public final class RegressionEnsemble implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RegressionEnsemble.class);

    public static final int DEFAULT_FOLDS = 3;

    private final SparseRegressionSolver solver;
    private final int folds;
    private final PenaltyRule penaltyRule;
    private final Long seed;
    private final RepeatExecutor executor;
    private final boolean ownsExecutor;

    private RegressionEnsemble(SparseRegressionSolver solver, int folds, PenaltyRule penaltyRule,
                               Long seed, RepeatExecutor executor, boolean ownsExecutor) {
        this.solver = solver;
        this.folds = folds;
        this.penaltyRule = penaltyRule;
        this.seed = seed;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Returns a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the repeats on this ensemble's executor.
     */
    public List<RawRepeatResult> runEnsemble(AffinityMatrix x, ResponseMatrix y, int repeats) {
        return runEnsemble(x, y, repeats, executor);
    }

    /**
     * Runs the repeats on the given executor.
     *
     * @param x drug x protein predictors
     * @param y drug x sample responses, same drugs in the same order as x
     * @param repeats number of independent fits
     * @param execute executor evaluating the repeats
     * @return one result per repeat, ordered by repeat index
     * @throws IllegalArgumentException for invalid input, before any fitting
     * @throws SolverException if any repeat fails
     */
    public List<RawRepeatResult> runEnsemble(AffinityMatrix x, ResponseMatrix y, int repeats,
                                             RepeatExecutor execute) {
        MatrixValidation.requirePositiveRepeats(repeats);
        MatrixValidation.requireAlignedDrugs(x, y);
        MatrixValidation.requireComplete(x, "affinity matrix");
        MatrixValidation.requireComplete(y, "response matrix");
        Objects.requireNonNull(execute, "executor cannot be null");

        double[][] predictors = x.toArray();
        double[][] responses = y.toArray();
        long[] seeds = repeatSeeds(repeats);

        logger.info("Running {} lasso repeats: {} drugs, {} proteins, {} samples, {}-fold CV, {}",
            repeats, x.rows(), x.columns(), y.columns(), folds, penaltyRule.label());
        long startTime = System.currentTimeMillis();

        List<RawRepeatResult> results = execute.map(repeats, i -> runRepeat(i, predictors, responses, seeds[i]));

        logger.info("Finished {} repeats in {} ms", repeats, System.currentTimeMillis() - startTime);
        return results;
    }

    private RawRepeatResult runRepeat(int repeat, double[][] x, double[][] y, long repeatSeed) {
        RandomGenerator random = new Well19937c(repeatSeed);
        RegressionFit fit;
        try {
            fit = solver.fit(x, y, folds, penaltyRule, random);
        } catch (SolverException e) {
            throw new SolverException("Repeat " + repeat + " failed: " + e.getMessage(), e);
        }
        logger.debug("Repeat {}: lambda={} varianceExplained={}", repeat, fit.lambda(), fit.varianceExplained());
        return new RawRepeatResult(repeat, fit.coefficients(), fit.lambda(), fit.varianceExplained());
    }

    private long[] repeatSeeds(int repeats) {
        long[] seeds = new long[repeats];
        if (seed != null) {
            for (int i = 0; i < repeats; i++) {
                seeds[i] = seed + i;
            }
        } else {
            RandomGenerator source = new Well19937c();
            for (int i = 0; i < repeats; i++) {
                seeds[i] = source.nextLong();
            }
        }
        return seeds;
    }

    public int getFolds() {
        return folds;
    }

    public PenaltyRule getPenaltyRule() {
        return penaltyRule;
    }

    /**
     * Closes the executor if this ensemble created it.
     */
    @Override
    public void close() {
        if (ownsExecutor && executor instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close repeat executor", e);
            }
        }
    }

    /**
     * Builder for custom RegressionEnsemble configuration.
     */
    public static final class Builder {
        private SparseRegressionSolver solver = new CrossValidatedLasso();
        private int folds = DEFAULT_FOLDS;
        private PenaltyRule penaltyRule = PenaltyRule.MIN_ERROR;
        private Long seed = null;
        private RepeatExecutor executor = null;
        private int parallelism = ForkJoinRepeatExecutor.defaultParallelism();

        private Builder() {}

        /**
         * Sets the regression solver (default: {@link CrossValidatedLasso}).
         */
        public Builder solver(SparseRegressionSolver solver) {
            this.solver = Objects.requireNonNull(solver, "solver cannot be null");
            return this;
        }

        public Builder folds(int folds) {
            if (folds < CrossValidatedLasso.MIN_FOLDS) {
                throw new IllegalArgumentException("folds must be at least " + CrossValidatedLasso.MIN_FOLDS);
            }
            this.folds = folds;
            return this;
        }

        public Builder penaltyRule(PenaltyRule penaltyRule) {
            this.penaltyRule = Objects.requireNonNull(penaltyRule, "penaltyRule cannot be null");
            return this;
        }

        /**
         * Sets the base seed for fold assignment; null draws fresh seeds per run.
         */
        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Sets the number of worker threads for an owned fork-join executor.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Uses a caller-managed executor instead of an owned fork-join pool.
         */
        public Builder executor(RepeatExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor cannot be null");
            return this;
        }

        public RegressionEnsemble build() {
            if (executor != null) {
                return new RegressionEnsemble(solver, folds, penaltyRule, seed, executor, false);
            }
            return new RegressionEnsemble(solver, folds, penaltyRule, seed,
                new ForkJoinRepeatExecutor(parallelism), true);
        }
    }
}
