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

/**
 * L1-penalized multivariate linear regression with cross-validated penalty
 * selection.
 *
 * <p>Implementations must not keep state between calls: the ensemble invokes a
 * single solver from many threads at once.
 */
public interface SparseRegressionSolver {

    /**
     * Fits the response matrix against the predictors.
     *
     * @param x predictors [observations][predictors]
     * @param y responses [observations][responses]
     * @param folds number of cross-validation folds
     * @param rule penalty selection rule
     * @param random source for fold assignment
     * @return coefficients, selected penalty and variance explained
     * @throws SolverException if no fit can be produced
     */
    RegressionFit fit(double[][] x, double[][] y, int folds, PenaltyRule rule, RandomGenerator random);
}
