package io.depinfer.model;

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

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of one cross-validated regression repeat.
 *
 * <p>The coefficient matrix is copied on the way in and out; equality compares
 * its contents.
 *
 * @param repeat zero-based repeat index
 * @param coefficients proteins x samples coefficient matrix at the selected penalty
 * @param lambda selected penalty strength
 * @param varianceExplained fraction of response variance explained by the fit
 */
public record RawRepeatResult(int repeat, double[][] coefficients, double lambda, double varianceExplained) {

    public RawRepeatResult {
        coefficients = copy(Objects.requireNonNull(coefficients, "coefficients cannot be null"));
    }

    /**
     * Returns a copy of the coefficient matrix.
     */
    @Override
    public double[][] coefficients() {
        return copy(coefficients);
    }

    public int proteins() {
        return coefficients.length;
    }

    public int samples() {
        return coefficients.length == 0 || coefficients[0] == null ? 0 : coefficients[0].length;
    }

    private static double[][] copy(double[][] values) {
        double[][] copy = new double[values.length][];
        for (int p = 0; p < values.length; p++) {
            copy[p] = values[p] == null ? null : values[p].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRepeatResult that)) return false;
        return repeat == that.repeat
            && Double.compare(lambda, that.lambda) == 0
            && Double.compare(varianceExplained, that.varianceExplained) == 0
            && Arrays.deepEquals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(repeat, lambda, varianceExplained);
        return 31 * result + Arrays.deepHashCode(coefficients);
    }

    @Override
    public String toString() {
        return "RawRepeatResult{repeat=" + repeat + ", lambda=" + lambda + ", varianceExplained="
            + varianceExplained + ", coefficients=" + proteins() + "x" + samples() + "}";
    }
}
