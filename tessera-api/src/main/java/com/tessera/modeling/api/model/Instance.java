/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A fully materialized, solver-ready optimization problem.
 *
 * <p>Instances are immutable. They hold flattened copies of everything a solver needs and
 * no reference back to the model declarations they were generated from, so they can be
 * handed across threads freely.
 */
public final class Instance implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String modelName;
    private final List<Column> columns;
    private final List<Row> rows;
    private final ObjectiveRow objective;
    private final InstanceStats stats;
    private final Map<String, Column> columnsByLabel;

    public Instance(String modelName, List<Column> columns, List<Row> rows, ObjectiveRow objective, InstanceStats stats) {
        this.modelName = modelName;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
        this.objective = objective;
        this.stats = stats;
        Map<String, Column> byLabel = new HashMap<>(columns.size() * 2);
        for (Column column : this.columns) {
            byLabel.put(column.label(), column);
        }
        this.columnsByLabel = Collections.unmodifiableMap(byLabel);
    }

    public String modelName() {
        return modelName;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<Row> rows() {
        return rows;
    }

    public ObjectiveRow objective() {
        return objective;
    }

    public InstanceStats stats() {
        return stats;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public Column column(int index) {
        return columns.get(index);
    }

    /**
     * Looks up a column by its label, e.g. {@code x[1,2]}.
     */
    public Optional<Column> column(String label) {
        return Optional.ofNullable(columnsByLabel.get(label));
    }

    public Optional<Column> column(String name, Tuple tuple) {
        return column(tuple.format(name));
    }

    /**
     * Rows generated from the given constraint template, in emission order.
     */
    public List<Row> rowsOf(String template) {
        List<Row> result = new ArrayList<>();
        for (Row row : rows) {
            if (row.template().equals(template)) {
                result.add(row);
            }
        }
        return result;
    }

    public double[] rhs() {
        double[] rhs = new double[rows.size()];
        for (int i = 0; i < rhs.length; i++) {
            rhs[i] = rows.get(i).rhs();
        }
        return rhs;
    }

    public double[] lowerBounds() {
        double[] bounds = new double[columns.size()];
        for (int j = 0; j < bounds.length; j++) {
            bounds[j] = columns.get(j).lowerBound();
        }
        return bounds;
    }

    public double[] upperBounds() {
        double[] bounds = new double[columns.size()];
        for (int j = 0; j < bounds.length; j++) {
            bounds[j] = columns.get(j).upperBound();
        }
        return bounds;
    }

    public SparseMatrix matrix() {
        int[] rowStarts = new int[rows.size() + 1];
        int nnz = 0;
        for (int i = 0; i < rows.size(); i++) {
            rowStarts[i] = nnz;
            nnz += rows.get(i).size();
        }
        rowStarts[rows.size()] = nnz;
        int[] columnIndices = new int[nnz];
        double[] values = new double[nnz];
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            for (int k = 0; k < row.size(); k++) {
                columnIndices[rowStarts[i] + k] = row.columnAt(k);
                values[rowStarts[i] + k] = row.coefficientAt(k);
            }
        }
        return new SparseMatrix(rows.size(), columns.size(), rowStarts, columnIndices, values);
    }

    @Override
    public String toString() {
        return "Instance[" + modelName + ", columns=" + columns.size() + ", rows=" + rows.size() + "]";
    }
}
