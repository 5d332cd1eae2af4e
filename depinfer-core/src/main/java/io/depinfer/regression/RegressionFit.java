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

/**
 * Result of one cross-validated sparse regression.
 *
 * @param coefficients predictors x responses coefficients at the selected penalty (intercepts excluded)
 * @param lambda selected penalty strength
 * @param varianceExplained deviance ratio of the full-data fit at that penalty
 */
public record RegressionFit(double[][] coefficients, double lambda, double varianceExplained) {
}
