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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Multi-response lasso fitted by block coordinate descent along a lambda path.
///
/// ## Objective
///
/// For centered predictors `X` (n x p) and centered responses `Y` (n x K):
///
/// ```
///   1/(2n) ||Y - X B||_F^2  +  lambda * sum_j ||B_j||_2
/// ```
///
/// `B_j` is the row of coefficients of predictor `j` across all responses, so a
/// predictor is either selected for every response or for none. Intercepts are
/// unpenalized and recovered from the column means. Predictors are not
/// standardized.
///
/// ## Update
///
/// With `v_j = ||x_j||^2 / n` and residuals `R`:
///
/// ```
///   g   = x_j' R / n + v_j B_j
///   B_j = max(0, 1 - lambda / ||g||) * g / v_j
/// ```
///
/// A lambda is converged when no row moves by more than `threshold * TSS / n`
/// (in `v_j ||delta||^2`). Each lambda starts from the previous solution.
///
/// ## Lambda path
///
/// `count` values, log-spaced from `lambda_max = max_j ||x_j' Y|| / n` (where every
/// coefficient is zero) down to `lambda_max * ratio`, with ratio 0.01 when there
/// are fewer observations than predictors and 1e-4 otherwise.
///
/// Instances are immutable and may be shared between threads.
public final class CoordinateDescentLasso {

    private static final Logger logger = LogManager.getLogger(CoordinateDescentLasso.class);

    public static final int DEFAULT_LAMBDA_COUNT = 100;
    public static final double DEFAULT_THRESHOLD = 1e-7;
    public static final int DEFAULT_MAX_PASSES = 100_000;

    private final int lambdaCount;
    private final double threshold;
    private final int maxPasses;

    public CoordinateDescentLasso() {
        this(DEFAULT_LAMBDA_COUNT, DEFAULT_THRESHOLD, DEFAULT_MAX_PASSES);
    }

    /**
     * @param lambdaCount number of lambdas on a generated path
     * @param threshold relative convergence threshold
     * @param maxPasses limit on coordinate descent passes over the whole path
     */
    public CoordinateDescentLasso(int lambdaCount, double threshold, int maxPasses) {
        if (lambdaCount < 1) {
            throw new IllegalArgumentException("lambdaCount must be positive");
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive");
        }
        this.lambdaCount = lambdaCount;
        this.threshold = threshold;
        this.maxPasses = maxPasses;
    }

    /**
     * Fits the full path on a generated lambda sequence.
     */
    public LassoPath fit(double[][] x, double[][] y) {
        Centered data = Centered.of(x, y);
        return fitPath(data, lambdaSequence(data));
    }

    /**
     * Fits the path on the given lambdas, which must be in descending order.
     */
    public LassoPath fit(double[][] x, double[][] y, double[] lambdas) {
        if (lambdas == null || lambdas.length == 0) {
            throw new IllegalArgumentException("lambdas cannot be null or empty");
        }
        for (int l = 1; l < lambdas.length; l++) {
            if (lambdas[l] > lambdas[l - 1]) {
                throw new IllegalArgumentException("lambdas must be in descending order");
            }
        }
        return fitPath(Centered.of(x, y), lambdas.clone());
    }

    /**
     * Returns the lambda sequence this solver would use for the data.
     */
    public double[] lambdaSequence(double[][] x, double[][] y) {
        return lambdaSequence(Centered.of(x, y));
    }

    private double[] lambdaSequence(Centered data) {
        double lambdaMax = 0;
        for (int j = 0; j < data.p; j++) {
            double sumSq = 0;
            for (int k = 0; k < data.responses; k++) {
                double dot = 0;
                for (int i = 0; i < data.n; i++) {
                    dot += data.xc[j][i] * data.yc[i][k];
                }
                // same arithmetic as the first gradient, so lambda_max selects nothing
                double g = dot / data.n;
                sumSq += g * g;
            }
            lambdaMax = Math.max(lambdaMax, Math.sqrt(sumSq));
        }
        if (!(lambdaMax > 0)) {
            throw new SolverException("No predictor varies with the response; lambda path is empty");
        }
        double ratio = data.n < data.p ? 1e-2 : 1e-4;
        double[] lambdas = new double[lambdaCount];
        for (int l = 0; l < lambdaCount; l++) {
            double fraction = lambdaCount == 1 ? 0.0 : (double) l / (lambdaCount - 1);
            lambdas[l] = lambdaMax * Math.pow(ratio, fraction);
        }
        return lambdas;
    }

    private LassoPath fitPath(Centered data, double[] lambdas) {
        int n = data.n;
        int p = data.p;
        int responses = data.responses;

        double tss = 0;
        for (double[] row : data.yc) {
            for (double v : row) {
                tss += v * v;
            }
        }
        if (!(tss > 0)) {
            throw new SolverException("Response matrix has zero variance");
        }

        double[] v = new double[p];
        for (int j = 0; j < p; j++) {
            double sumSq = 0;
            for (double value : data.xc[j]) {
                sumSq += value * value;
            }
            v[j] = sumSq / n;
        }

        double[][] residual = new double[n][];
        for (int i = 0; i < n; i++) {
            residual[i] = data.yc[i].clone();
        }
        double[][] beta = new double[p][responses];
        double[] gradient = new double[responses];
        double[] delta = new double[responses];
        double tolerance = threshold * tss / n;

        double[][][] coefficients = new double[lambdas.length][][];
        double[][] intercepts = new double[lambdas.length][];
        double[] devRatios = new double[lambdas.length];
        int passes = 0;

        for (int l = 0; l < lambdas.length; l++) {
            double lambda = lambdas[l];
            double maxChange;
            do {
                if (++passes > maxPasses) {
                    throw new SolverException("Coordinate descent did not converge within "
                        + maxPasses + " passes (lambda=" + lambda + ")");
                }
                maxChange = 0;
                for (int j = 0; j < p; j++) {
                    if (v[j] == 0) continue;
                    double[] xj = data.xc[j];
                    double[] bj = beta[j];

                    for (int k = 0; k < responses; k++) {
                        double dot = 0;
                        for (int i = 0; i < n; i++) {
                            dot += xj[i] * residual[i][k];
                        }
                        gradient[k] = dot / n + v[j] * bj[k];
                    }
                    double norm = 0;
                    for (double g : gradient) {
                        norm += g * g;
                    }
                    norm = Math.sqrt(norm);
                    double scale = norm > lambda ? (1.0 - lambda / norm) / v[j] : 0.0;

                    double moved = 0;
                    for (int k = 0; k < responses; k++) {
                        double updated = scale * gradient[k];
                        delta[k] = updated - bj[k];
                        moved += delta[k] * delta[k];
                        bj[k] = updated;
                    }
                    if (moved == 0) continue;
                    for (int i = 0; i < n; i++) {
                        double xij = xj[i];
                        if (xij == 0) continue;
                        double[] ri = residual[i];
                        for (int k = 0; k < responses; k++) {
                            ri[k] -= xij * delta[k];
                        }
                    }
                    maxChange = Math.max(maxChange, v[j] * moved);
                }
            } while (maxChange > tolerance);

            double rss = 0;
            for (double[] row : residual) {
                for (double r : row) {
                    rss += r * r;
                }
            }
            devRatios[l] = 1.0 - rss / tss;

            double[][] snapshot = new double[p][];
            for (int j = 0; j < p; j++) {
                snapshot[j] = beta[j].clone();
            }
            coefficients[l] = snapshot;

            double[] b0 = data.yMean.clone();
            for (int j = 0; j < p; j++) {
                for (int k = 0; k < responses; k++) {
                    b0[k] -= data.xMean[j] * beta[j][k];
                }
            }
            intercepts[l] = b0;
        }

        logger.debug("Fitted {} lambdas on {}x{} predictors, {} responses in {} passes",
            lambdas.length, n, p, responses, passes);
        return new LassoPath(lambdas, coefficients, intercepts, devRatios, passes);
    }

    /**
     * Column-centered copy of the data; predictors are stored column-major.
     */
    private static final class Centered {
        final int n;
        final int p;
        final int responses;
        final double[][] xc;
        final double[][] yc;
        final double[] xMean;
        final double[] yMean;

        private Centered(int n, int p, int responses, double[][] xc, double[][] yc, double[] xMean, double[] yMean) {
            this.n = n;
            this.p = p;
            this.responses = responses;
            this.xc = xc;
            this.yc = yc;
            this.xMean = xMean;
            this.yMean = yMean;
        }

        static Centered of(double[][] x, double[][] y) {
            if (x == null || y == null || x.length == 0) {
                throw new IllegalArgumentException("x and y cannot be null or empty");
            }
            if (x.length != y.length) {
                throw new IllegalArgumentException("x has " + x.length + " rows but y has " + y.length);
            }
            int n = x.length;
            int p = x[0].length;
            int responses = y[0].length;
            if (p == 0 || responses == 0) {
                throw new IllegalArgumentException("x and y need at least one column each");
            }

            double[] xMean = new double[p];
            double[] yMean = new double[responses];
            for (int i = 0; i < n; i++) {
                if (x[i].length != p || y[i].length != responses) {
                    throw new IllegalArgumentException("Ragged input at row " + i);
                }
                for (int j = 0; j < p; j++) {
                    xMean[j] += x[i][j];
                }
                for (int k = 0; k < responses; k++) {
                    yMean[k] += y[i][k];
                }
            }
            for (int j = 0; j < p; j++) {
                xMean[j] /= n;
            }
            for (int k = 0; k < responses; k++) {
                yMean[k] /= n;
            }

            double[][] xc = new double[p][n];
            double[][] yc = new double[n][responses];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < p; j++) {
                    xc[j][i] = x[i][j] - xMean[j];
                }
                for (int k = 0; k < responses; k++) {
                    yc[i][k] = y[i][k] - yMean[k];
                }
            }
            return new Centered(n, p, responses, xc, yc, xMean, yMean);
        }
    }
}
