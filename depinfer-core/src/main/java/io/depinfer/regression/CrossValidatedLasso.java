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

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * K-fold cross-validated multi-response lasso.
 *
 * <ol>
 *   <li>Fit the full path on all observations; its lambdas are reused for every fold.</li>
 *   <li>Assign observations to folds by a random permutation of {@code 0..folds-1}
 *       recycled over the rows.</li>
 *   <li>For each fold, fit on the remaining rows and score the held-out rows: the
 *       error of a row is its squared error summed over responses, and the fold
 *       error is the mean over its rows.</li>
 *   <li>The CV curve is the fold-size-weighted mean of the fold errors, with a
 *       standard error from their weighted spread.</li>
 *   <li>Select a lambda with the {@link PenaltyRule} and return the full-data
 *       solution at that lambda.</li>
 * </ol>
 */
public final class CrossValidatedLasso implements SparseRegressionSolver {

    private static final Logger logger = LogManager.getLogger(CrossValidatedLasso.class);

    /** Smallest fold count accepted */
    public static final int MIN_FOLDS = 3;

    private final CoordinateDescentLasso lasso;

    public CrossValidatedLasso() {
        this(new CoordinateDescentLasso());
    }

    public CrossValidatedLasso(CoordinateDescentLasso lasso) {
        this.lasso = Objects.requireNonNull(lasso, "lasso cannot be null");
    }

    /**
     * Cross-validation curve over a lambda path.
     *
     * @param lambdas the path, descending
     * @param meanError weighted mean error per lambda
     * @param standardError standard error of the mean error per lambda
     */
    public record CvCurve(double[] lambdas, double[] meanError, double[] standardError) {

        /**
         * Index of the largest lambda attaining the minimum mean error.
         */
        public int minIndex() {
            int best = 0;
            for (int l = 1; l < meanError.length; l++) {
                if (meanError[l] < meanError[best]) {
                    best = l;
                }
            }
            return best;
        }

        /**
         * Index of the largest lambda within one standard error of the minimum.
         */
        public int oneStandardErrorIndex() {
            int min = minIndex();
            double limit = meanError[min] + standardError[min];
            for (int l = 0; l < meanError.length; l++) {
                if (meanError[l] <= limit) {
                    return l;
                }
            }
            return min;
        }

        public int select(PenaltyRule rule) {
            return rule == PenaltyRule.ONE_STANDARD_ERROR ? oneStandardErrorIndex() : minIndex();
        }
    }

    @Override
    public RegressionFit fit(double[][] x, double[][] y, int folds, PenaltyRule rule, RandomGenerator random) {
        Objects.requireNonNull(rule, "rule cannot be null");
        Objects.requireNonNull(random, "random cannot be null");
        int[] foldIds = assignFolds(x.length, folds, random);
        LassoPath full = lasso.fit(x, y);
        CvCurve curve = crossValidate(x, y, full.lambdas(), foldIds);

        int index = curve.select(rule);
        logger.debug("Selected lambda {} ({}) with cv error {} and {} predictors",
            full.lambda(index), rule.label(), curve.meanError()[index], full.nonZeroPredictors(index));
        return new RegressionFit(full.coefficients(index), full.lambda(index), full.devRatio(index));
    }

    /**
     * Assigns each of n observations to one of the folds.
     *
     * @throws SolverException if there are fewer observations than folds
     */
    public static int[] assignFolds(int n, int folds, RandomGenerator random) {
        if (folds < MIN_FOLDS) {
            throw new IllegalArgumentException("folds must be at least " + MIN_FOLDS + ", got " + folds);
        }
        if (n < folds) {
            throw new SolverException("Too few observations (" + n + ") for " + folds + "-fold cross-validation");
        }
        int[] foldIds = new int[n];
        for (int i = 0; i < n; i++) {
            foldIds[i] = i % folds;
        }
        MathArrays.shuffle(foldIds, random);
        return foldIds;
    }

    /**
     * Computes the cross-validation curve for a fixed fold assignment.
     *
     * @param foldIds fold per observation, in {@code 0..folds-1}
     */
    public CvCurve crossValidate(double[][] x, double[][] y, double[] lambdas, int[] foldIds) {
        int n = x.length;
        if (foldIds.length != n) {
            throw new IllegalArgumentException("Expected " + n + " fold ids, got " + foldIds.length);
        }
        int folds = 0;
        for (int f : foldIds) {
            folds = Math.max(folds, f + 1);
        }

        double[][] foldError = new double[folds][lambdas.length];
        int[] foldSize = new int[folds];
        for (int f = 0; f < folds; f++) {
            int testCount = 0;
            for (int id : foldIds) {
                if (id == f) testCount++;
            }
            if (testCount == 0) {
                throw new SolverException("Fold " + f + " has no observations");
            }
            if (n - testCount < 2) {
                throw new SolverException("Fold " + f + " leaves " + (n - testCount) + " training observations");
            }
            foldSize[f] = testCount;

            double[][] xTrain = new double[n - testCount][];
            double[][] yTrain = new double[n - testCount][];
            double[][] xTest = new double[testCount][];
            double[][] yTest = new double[testCount][];
            int tr = 0;
            int te = 0;
            for (int i = 0; i < n; i++) {
                if (foldIds[i] == f) {
                    xTest[te] = x[i];
                    yTest[te++] = y[i];
                } else {
                    xTrain[tr] = x[i];
                    yTrain[tr++] = y[i];
                }
            }

            LassoPath path;
            try {
                path = lasso.fit(xTrain, yTrain, lambdas);
            } catch (SolverException e) {
                throw new SolverException("Fold " + f + " could not be fitted: " + e.getMessage(), e);
            }
            for (int l = 0; l < lambdas.length; l++) {
                double[][] predicted = path.predict(l, xTest);
                double sum = 0;
                for (int i = 0; i < testCount; i++) {
                    for (int k = 0; k < yTest[i].length; k++) {
                        double diff = yTest[i][k] - predicted[i][k];
                        sum += diff * diff;
                    }
                }
                foldError[f][l] = sum / testCount;
            }
        }

        double[] mean = new double[lambdas.length];
        double[] se = new double[lambdas.length];
        for (int l = 0; l < lambdas.length; l++) {
            double weighted = 0;
            for (int f = 0; f < folds; f++) {
                weighted += foldSize[f] * foldError[f][l];
            }
            mean[l] = weighted / n;

            double spread = 0;
            for (int f = 0; f < folds; f++) {
                double diff = foldError[f][l] - mean[l];
                spread += foldSize[f] * diff * diff;
            }
            se[l] = folds > 1 ? Math.sqrt(spread / n / (folds - 1)) : 0.0;
        }
        return new CvCurve(lambdas.clone(), mean, se);
    }
}
