package io.depinfer.aggregate;

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
import io.depinfer.model.AggregatedResult;
import io.depinfer.model.DependencyMatrix;
import io.depinfer.model.RawRepeatResult;
import io.depinfer.model.ResponseMatrix;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Combines the per-repeat fits of an ensemble into stable estimates.
///
/// ## Outputs
///
/// | Field | Definition |
/// |-------|------------|
/// | coefficients | median over repeats of each (protein, sample) coefficient |
/// | frequencies | fraction of repeats with a non-zero coefficient |
/// | lambdas | selected penalty per repeat, in repeat order |
/// | varianceExplained | variance explained per repeat, in repeat order |
///
/// The median of an even number of values is the mean of the two middle ones.
/// The aggregator is deterministic; all randomness lives in the repeats.
public final class ResultAggregator {

    private static final Logger logger = LogManager.getLogger(ResultAggregator.class);

    /**
     * Aggregates a complete set of repeat results.
     *
     * @param results one result per repeat, ordered by repeat index
     * @param x affinity matrix the repeats were fitted on; its columns are the protein axis
     * @param y response matrix the repeats were fitted on; its columns are the sample axis
     * @return the aggregated result bundle
     * @throws IllegalArgumentException if there are no results or a repeat's
     *         coefficient matrix does not have the proteins x samples shape
     */
    public AggregatedResult aggregate(List<RawRepeatResult> results, AffinityMatrix x, ResponseMatrix y) {
        Objects.requireNonNull(results, "results cannot be null");
        Objects.requireNonNull(x, "affinity matrix cannot be null");
        Objects.requireNonNull(y, "response matrix cannot be null");
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty set of repeats");
        }

        int proteins = x.columns();
        int samples = y.columns();
        int repeats = results.size();

        // stacked[protein][sample][repeat]
        double[][][] stacked = new double[proteins][samples][repeats];
        List<Double> lambdas = new ArrayList<>(repeats);
        List<Double> varianceExplained = new ArrayList<>(repeats);
        for (int r = 0; r < repeats; r++) {
            RawRepeatResult result = Objects.requireNonNull(results.get(r), "result " + r + " is null");
            requireShape(result, r, proteins, samples);
            double[][] coefficients = result.coefficients();
            for (int p = 0; p < proteins; p++) {
                for (int s = 0; s < samples; s++) {
                    stacked[p][s][r] = coefficients[p][s];
                }
            }
            lambdas.add(result.lambda());
            varianceExplained.add(result.varianceExplained());
        }

        Median median = new Median();
        double[][] coefficientValues = new double[proteins][samples];
        double[][] frequencyValues = new double[proteins][samples];
        for (int p = 0; p < proteins; p++) {
            for (int s = 0; s < samples; s++) {
                double[] values = stacked[p][s];
                coefficientValues[p][s] = median.evaluate(values);
                frequencyValues[p][s] = selectionFrequency(values);
            }
        }

        logger.info("Aggregated {} repeats into {} x {} coefficient and frequency matrices",
            repeats, proteins, samples);
        return new AggregatedResult(
            new DependencyMatrix(x.proteinIds(), y.sampleIds(), coefficientValues),
            new DependencyMatrix(x.proteinIds(), y.sampleIds(), frequencyValues),
            lambdas,
            varianceExplained,
            x,
            y);
    }

    /**
     * Fraction of values that are non-zero.
     */
    static double selectionFrequency(double[] values) {
        int selected = 0;
        for (double v : values) {
            if (v != 0.0) {
                selected++;
            }
        }
        return (double) selected / values.length;
    }

    private static void requireShape(RawRepeatResult result, int index, int proteins, int samples) {
        double[][] coefficients = result.coefficients();
        boolean ok = coefficients.length == proteins;
        for (int p = 0; ok && p < proteins; p++) {
            ok = coefficients[p] != null && coefficients[p].length == samples;
        }
        if (!ok) {
            throw new IllegalArgumentException("Repeat " + index + " has a " + result.proteins() + " x "
                + result.samples() + " coefficient matrix, expected " + proteins + " x " + samples);
        }
    }
}
