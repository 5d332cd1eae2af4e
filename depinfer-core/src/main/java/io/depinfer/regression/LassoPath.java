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
 * Container for the solutions along a lambda path of a multi-response lasso.
 *
 * <p>Lambdas are stored in descending order. For each lambda it holds the
 * coefficient matrix [predictors][responses], the per-response intercepts and
 * the deviance ratio {@code 1 - RSS/TSS} on the data the path was fitted to.
 */
public final class LassoPath {

    private final double[] lambdas;
    private final double[][][] coefficients;
    private final double[][] intercepts;
    private final double[] devRatios;
    private final int passes;

    LassoPath(double[] lambdas, double[][][] coefficients, double[][] intercepts, double[] devRatios, int passes) {
        this.lambdas = lambdas;
        this.coefficients = coefficients;
        this.intercepts = intercepts;
        this.devRatios = devRatios;
        this.passes = passes;
    }

    public int numberOfLambdas() {
        return lambdas.length;
    }

    public double lambda(int index) {
        return lambdas[index];
    }

    public double[] lambdas() {
        return lambdas.clone();
    }

    /**
     * Returns a copy of the coefficient matrix for one lambda.
     */
    public double[][] coefficients(int index) {
        double[][] source = coefficients[index];
        double[][] copy = new double[source.length][];
        for (int j = 0; j < source.length; j++) {
            copy[j] = source[j].clone();
        }
        return copy;
    }

    public double[] intercepts(int index) {
        return intercepts[index].clone();
    }

    public double devRatio(int index) {
        return devRatios[index];
    }

    /**
     * Total number of coordinate descent passes over the data.
     */
    public int passes() {
        return passes;
    }

    /**
     * Number of predictors with a non-zero coefficient row at a lambda.
     */
    public int nonZeroPredictors(int index) {
        int count = 0;
        for (double[] row : coefficients[index]) {
            for (double v : row) {
                if (v != 0.0) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }

    /**
     * Predicts responses for new observations with the solution at a lambda.
     *
     * @param index lambda index
     * @param x observations [rows][predictors]
     * @return predictions [rows][responses]
     */
    public double[][] predict(int index, double[][] x) {
        double[][] beta = coefficients[index];
        double[] b0 = intercepts[index];
        int responses = b0.length;
        double[][] prediction = new double[x.length][responses];
        for (int i = 0; i < x.length; i++) {
            double[] row = prediction[i];
            System.arraycopy(b0, 0, row, 0, responses);
            for (int j = 0; j < beta.length; j++) {
                double xij = x[i][j];
                if (xij == 0.0) continue;
                for (int k = 0; k < responses; k++) {
                    row[k] += xij * beta[j][k];
                }
            }
        }
        return prediction;
    }
}
