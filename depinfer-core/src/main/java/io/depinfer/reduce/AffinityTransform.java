package io.depinfer.reduce;

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

/**
 * Converts raw dissociation constants into bounded affinity scores.
 *
 * <p>Each Kd is mapped to pKd = -log10(Kd), so stronger binders get larger values.
 * Unmeasured pairs (NaN) receive {@link #MISSING_PKD}, a very weak affinity. The
 * result is then squashed into (0,1) with
 * <pre>{@code
 *   y = (atan((pKd + SHIFT) * GAIN) + PI/2) / PI
 * }</pre>
 * which keeps strong binders near 1 and weak or missing binders near 0.
 */
public final class AffinityTransform {

    /** pKd assigned to unmeasured drug/protein pairs */
    public static final double MISSING_PKD = -10.0;

    /** Horizontal shift of the arctan squashing curve */
    public static final double SHIFT = 2.0;

    /** Slope of the arctan squashing curve */
    public static final double GAIN = 3.0;

    private AffinityTransform() {
        // Utility class
    }

    /**
     * Converts one Kd value to its pKd, mapping NaN to {@link #MISSING_PKD}.
     *
     * @throws IllegalArgumentException if kd is zero, negative or infinite
     */
    public static double toPkd(double kd) {
        if (Double.isNaN(kd)) {
            return MISSING_PKD;
        }
        if (kd <= 0 || Double.isInfinite(kd)) {
            throw new IllegalArgumentException("Kd values must be positive and finite, got " + kd);
        }
        return -Math.log10(kd);
    }

    /**
     * Squashes a pKd value into (0,1).
     */
    public static double squash(double pkd) {
        return (Math.atan((pkd + SHIFT) * GAIN) + Math.PI / 2) / Math.PI;
    }

    /**
     * Applies the full Kd transform to one value.
     */
    public static double transform(double kd) {
        return squash(toPkd(kd));
    }

    /**
     * Returns a transformed copy of a Kd matrix.
     *
     * @param kdMatrix drug x protein matrix of dissociation constants, NaN for missing
     * @return matrix over the same ids with scores in (0,1)
     */
    public static AffinityMatrix apply(AffinityMatrix kdMatrix) {
        double[][] values = kdMatrix.toArray();
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                try {
                    values[r][c] = transform(values[r][c]);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid Kd for drug " + kdMatrix.drugIds().get(r)
                        + " and protein " + kdMatrix.proteinIds().get(c) + ": " + e.getMessage(), e);
                }
            }
        }
        return kdMatrix.withValues(values);
    }
}
