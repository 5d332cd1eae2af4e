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
 * Drug-by-sample viability response matrix.
 *
 * <p>Shares its row (drug) axis with the {@link AffinityMatrix} it is fitted
 * against. Columns are samples: cell lines or primary tumors.
 */
public final class ResponseMatrix extends LabeledMatrix {

    public ResponseMatrix(List<String> drugIds, List<String> sampleIds, double[][] values) {
        super(drugIds, sampleIds, values);
    }

    /**
     * Creates a matrix with positional ids ("drug1".., "sample1"..).
     */
    public static ResponseMatrix of(double[][] values) {
        return new ResponseMatrix(
            positionalIds("drug", values.length),
            positionalIds("sample", columnCountOf(values)),
            values);
    }

    public List<String> drugIds() {
        return rowIds();
    }

    public List<String> sampleIds() {
        return columnIds();
    }
}
