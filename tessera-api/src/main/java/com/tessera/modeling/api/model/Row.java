/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One generated constraint row: {@code sum(coefficients[k] * x[columns[k]]) sense rhs}.
 * Column indices are strictly increasing.
 */
public record Row(
        int index,
        RowLabel label,
        int[] columns,
        double[] coefficients,
        RowSense sense,
        double rhs
) implements Serializable {

    public Row {
        if (columns.length != coefficients.length) {
            throw new IllegalArgumentException("columns and coefficients differ in length");
        }
        columns = columns.clone();
        coefficients = coefficients.clone();
    }

    public String template() {
        return label.template();
    }

    public int size() {
        return columns.length;
    }

    @Override
    public int[] columns() {
        return columns.clone();
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    public int columnAt(int k) {
        return columns[k];
    }

    public double coefficientAt(int k) {
        return coefficients[k];
    }

    /**
     * Returns the coefficient of the given column, or 0 if the row does not reference it.
     */
    public double coefficientOf(int column) {
        int k = Arrays.binarySearch(columns, column);
        return k >= 0 ? coefficients[k] : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row other = (Row) o;
        return index == other.index
                && Double.compare(rhs, other.rhs) == 0
                && label.equals(other.label)
                && sense == other.sense
                && Arrays.equals(columns, other.columns)
                && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(index);
        result = 31 * result + label.hashCode();
        result = 31 * result + Arrays.hashCode(columns);
        result = 31 * result + Arrays.hashCode(coefficients);
        result = 31 * result + sense.hashCode();
        result = 31 * result + Double.hashCode(rhs);
        return result;
    }

    @Override
    public String toString() {
        return "Row[" + label.format() + ", nnz=" + columns.length + ", " + sense.symbol() + " " + rhs + "]";
    }
}
