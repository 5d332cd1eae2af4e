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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drug-by-protein affinity matrix.
 *
 * <p>Rows are drugs, columns are proteins. Entries are either raw binding
 * measurements (dissociation constants, where NaN marks an unmeasured pair) or
 * transformed affinity scores in (0,1).
 */
public final class AffinityMatrix extends LabeledMatrix {

    public AffinityMatrix(List<String> drugIds, List<String> proteinIds, double[][] values) {
        super(drugIds, proteinIds, values);
    }

    /**
     * Creates a matrix with positional ids ("drug1".., "protein1"..).
     */
    public static AffinityMatrix of(double[][] values) {
        return new AffinityMatrix(
            positionalIds("drug", values.length),
            positionalIds("protein", columnCountOf(values)),
            values);
    }

    public List<String> drugIds() {
        return rowIds();
    }

    public List<String> proteinIds() {
        return columnIds();
    }

    /**
     * Returns a new matrix holding the given columns in the given order.
     *
     * @param order column positions to keep
     */
    public AffinityMatrix selectColumns(int[] order) {
        Objects.requireNonNull(order, "order cannot be null");
        List<String> ids = new ArrayList<>(order.length);
        for (int index : order) {
            ids.add(proteinIds().get(index));
        }
        return new AffinityMatrix(drugIds(), ids, selectColumnValues(order));
    }

    /**
     * Returns a new matrix over the same ids with replaced values.
     */
    public AffinityMatrix withValues(double[][] values) {
        return new AffinityMatrix(drugIds(), proteinIds(), values);
    }
}
