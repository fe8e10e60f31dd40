package com.tessera.modeling.generator;

import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.generator.eval.VariableIndex;

import java.util.List;

/**
 * Allocated columns and the lookup from variable instance to column index.
 */
public record ColumnSet(List<Column> columns, VariableIndex index) {

    public ColumnSet {
        columns = List.copyOf(columns);
    }

    public int size() {
        return columns.size();
    }

    public int integerCount() {
        return (int) columns.stream().filter(c -> c.domain().isIntegral()).count();
    }
}
