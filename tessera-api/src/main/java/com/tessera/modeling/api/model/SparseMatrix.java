/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.util.Arrays;

/**
 * Compressed sparse row view of the constraint matrix.
 *
 * <p>Row {@code r} occupies positions {@code rowStarts[r]} (inclusive) to
 * {@code rowStarts[r + 1]} (exclusive) of {@code columnIndices} and {@code values}.
 */
public record SparseMatrix(int rowCount, int columnCount, int[] rowStarts, int[] columnIndices, double[] values) {

    public int nonZeroCount() {
        return values.length;
    }

    public double get(int row, int column) {
        int from = rowStarts[row];
        int to = rowStarts[row + 1];
        int k = Arrays.binarySearch(columnIndices, from, to, column);
        return k >= 0 ? values[k] : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SparseMatrix)) return false;
        SparseMatrix other = (SparseMatrix) o;
        return rowCount == other.rowCount
                && columnCount == other.columnCount
                && Arrays.equals(rowStarts, other.rowStarts)
                && Arrays.equals(columnIndices, other.columnIndices)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = 31 * rowCount + columnCount;
        result = 31 * result + Arrays.hashCode(rowStarts);
        result = 31 * result + Arrays.hashCode(columnIndices);
        return 31 * result + Arrays.hashCode(values);
    }
}
