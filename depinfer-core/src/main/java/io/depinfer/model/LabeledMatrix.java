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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Dense, immutable, real-valued matrix whose rows and columns carry identifiers.
///
/// ## Layout
///
/// ```
///                 column ids (proteins or samples)
///              ┌────────┬────────┬────────┐
///   row ids    │ v[0][0]│ v[0][1]│  ...   │
///   (drugs)    ├────────┼────────┼────────┤
///              │ v[1][0]│ v[1][1]│  ...   │
///              └────────┴────────┴────────┘
/// ```
///
/// Values are copied on construction and on every array accessor, so an instance
/// may be shared freely between worker threads. Missing measurements are carried
/// as [Double#NaN].
///
/// Identifiers must be unique within each axis. The concrete subclasses give the
/// axes their domain names.
///
/// @see AffinityMatrix
/// @see ResponseMatrix
/// @see DependencyMatrix
public abstract class LabeledMatrix {

    private final List<String> rowIds;
    private final List<String> columnIds;
    private final double[][] values;
    private final Map<String, Integer> columnIndex;

    protected LabeledMatrix(List<String> rowIds, List<String> columnIds, double[][] values) {
        Objects.requireNonNull(rowIds, "rowIds cannot be null");
        Objects.requireNonNull(columnIds, "columnIds cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length != rowIds.size()) {
            throw new IllegalArgumentException("Expected " + rowIds.size() + " rows, got " + values.length);
        }
        this.values = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != columnIds.size()) {
                throw new IllegalArgumentException("Row " + r + " must have " + columnIds.size() + " values");
            }
            this.values[r] = values[r].clone();
        }
        this.rowIds = Collections.unmodifiableList(new ArrayList<>(rowIds));
        this.columnIds = Collections.unmodifiableList(new ArrayList<>(columnIds));
        requireUnique(this.rowIds, "row");
        this.columnIndex = indexOf(this.columnIds);
    }

    private static void requireUnique(List<String> ids, String axis) {
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            Objects.requireNonNull(id, axis + " id cannot be null");
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate " + axis + " id: " + id);
            }
        }
    }

    private static Map<String, Integer> indexOf(List<String> ids) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String id = Objects.requireNonNull(ids.get(i), "column id cannot be null");
            if (index.put(id, i) != null) {
                throw new IllegalArgumentException("Duplicate column id: " + id);
            }
        }
        return index;
    }

    /**
     * Generates positional identifiers ("prefix1", "prefix2", ...) for unnamed axes.
     */
    protected static List<String> positionalIds(String prefix, int count) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ids.add(prefix + i);
        }
        return ids;
    }

    protected static int columnCountOf(double[][] values) {
        Objects.requireNonNull(values, "values cannot be null");
        return values.length == 0 || values[0] == null ? 0 : values[0].length;
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return columnIds.size();
    }

    public List<String> rowIds() {
        return rowIds;
    }

    public List<String> columnIds() {
        return columnIds;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /**
     * Returns the column position of the given identifier, or -1 if absent.
     */
    public int columnIndexOf(String columnId) {
        Integer index = columnIndex.get(columnId);
        return index == null ? -1 : index;
    }

    public boolean hasColumn(String columnId) {
        return columnIndex.containsKey(columnId);
    }

    /**
     * Returns a copy of one column as a dense vector over the rows.
     */
    public double[] column(int column) {
        double[] result = new double[values.length];
        for (int r = 0; r < values.length; r++) {
            result[r] = values[r][column];
        }
        return result;
    }

    /**
     * Returns a copy of the values, row-major.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    /**
     * Returns the values transposed: one array per column.
     */
    public double[][] toColumnArrays() {
        double[][] transposed = new double[columnIds.size()][values.length];
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < columnIds.size(); c++) {
                transposed[c][r] = values[r][c];
            }
        }
        return transposed;
    }

    /**
     * Returns true if any entry is NaN.
     */
    public boolean hasMissing() {
        for (double[] row : values) {
            for (double v : row) {
                if (Double.isNaN(v)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the sum of each column. NaN entries propagate.
     */
    public double[] columnSums() {
        double[] sums = new double[columnIds.size()];
        for (double[] row : values) {
            for (int c = 0; c < sums.length; c++) {
                sums[c] += row[c];
            }
        }
        return sums;
    }

    /**
     * Copies the selected columns, in the given order, into a new values array.
     */
    protected double[][] selectColumnValues(int[] columnOrder) {
        double[][] selected = new double[values.length][columnOrder.length];
        for (int r = 0; r < values.length; r++) {
            for (int i = 0; i < columnOrder.length; i++) {
                selected[r][i] = values[r][columnOrder[i]];
            }
        }
        return selected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LabeledMatrix that = (LabeledMatrix) o;
        return rowIds.equals(that.rowIds)
            && columnIds.equals(that.columnIds)
            && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowIds, columnIds, Arrays.deepHashCode(values));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + rows() + " x " + columns() + "]";
    }
}
