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

import java.util.Objects;

/**
 * Input checks shared by the regression stages. Every check throws
 * {@link IllegalArgumentException} naming the offending dimension or id.
 */
public final class MatrixValidation {

    private MatrixValidation() {
        // Utility class
    }

    /**
     * Requires that the affinity and response matrices describe the same drugs in
     * the same order.
     */
    public static void requireAlignedDrugs(AffinityMatrix x, ResponseMatrix y) {
        Objects.requireNonNull(x, "affinity matrix cannot be null");
        Objects.requireNonNull(y, "response matrix cannot be null");
        if (x.rows() != y.rows()) {
            throw new IllegalArgumentException("Affinity matrix has " + x.rows()
                + " drugs but response matrix has " + y.rows());
        }
        for (int r = 0; r < x.rows(); r++) {
            String xDrug = x.drugIds().get(r);
            String yDrug = y.drugIds().get(r);
            if (!xDrug.equals(yDrug)) {
                throw new IllegalArgumentException("Drug mismatch at row " + r + ": affinity has '"
                    + xDrug + "', response has '" + yDrug + "'");
            }
        }
    }

    /**
     * Requires a non-empty matrix without missing or infinite values.
     *
     * @param name used in the error message
     */
    public static void requireComplete(LabeledMatrix matrix, String name) {
        Objects.requireNonNull(matrix, name + " cannot be null");
        if (matrix.rows() == 0 || matrix.columns() == 0) {
            throw new IllegalArgumentException(name + " cannot be empty: " + matrix);
        }
        for (int r = 0; r < matrix.rows(); r++) {
            for (int c = 0; c < matrix.columns(); c++) {
                double v = matrix.get(r, c);
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    throw new IllegalArgumentException(name + " has a non-finite value at "
                        + matrix.rowIds().get(r) + "/" + matrix.columnIds().get(c));
                }
            }
        }
    }

    public static void requirePositiveRepeats(int repeats) {
        if (repeats < 1) {
            throw new IllegalArgumentException("repeats must be a positive integer, got " + repeats);
        }
    }
}
