/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * The cost row. {@code constant} is the objective offset left after all variable terms are collected.
 */
public record ObjectiveRow(
        String name,
        ObjectiveDirection direction,
        int[] columns,
        double[] coefficients,
        double constant
) implements Serializable {

    public ObjectiveRow {
        if (columns.length != coefficients.length) {
            throw new IllegalArgumentException("columns and coefficients differ in length");
        }
        columns = columns.clone();
        coefficients = coefficients.clone();
    }

    @Override
    public int[] columns() {
        return columns.clone();
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    public int size() {
        return columns.length;
    }

    public double coefficientOf(int column) {
        int k = Arrays.binarySearch(columns, column);
        return k >= 0 ? coefficients[k] : 0.0;
    }

    /**
     * Evaluates the objective, offset included, at a point indexed by column.
     */
    public double evaluate(double[] point) {
        double value = constant;
        for (int k = 0; k < columns.length; k++) {
            value += coefficients[k] * point[columns[k]];
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectiveRow)) return false;
        ObjectiveRow other = (ObjectiveRow) o;
        return name.equals(other.name)
                && direction == other.direction
                && Double.compare(constant, other.constant) == 0
                && Arrays.equals(columns, other.columns)
                && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + direction.hashCode();
        result = 31 * result + Arrays.hashCode(columns);
        result = 31 * result + Arrays.hashCode(coefficients);
        result = 31 * result + Double.hashCode(constant);
        return result;
    }
}
