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

import java.util.List;

/**
 * Protein-by-sample result matrix: dependency coefficients or selection frequencies.
 */
public final class DependencyMatrix extends LabeledMatrix {

    public DependencyMatrix(List<String> proteinIds, List<String> sampleIds, double[][] values) {
        super(proteinIds, sampleIds, values);
    }

    public List<String> proteinIds() {
        return rowIds();
    }

    public List<String> sampleIds() {
        return columnIds();
    }

    /**
     * Returns the value for a protein and sample by identifier.
     *
     * @throws IllegalArgumentException if either id is unknown
     */
    public double get(String proteinId, String sampleId) {
        int row = proteinIds().indexOf(proteinId);
        int column = columnIndexOf(sampleId);
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Unknown protein/sample: " + proteinId + "/" + sampleId);
        }
        return get(row, column);
    }
}
