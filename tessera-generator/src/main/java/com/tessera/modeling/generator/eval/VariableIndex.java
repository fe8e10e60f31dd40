package com.tessera.modeling.generator.eval;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Maps variable instances to dense column indices in allocation order.
 */
public final class VariableIndex {

    private final Object2IntOpenHashMap<VariableRef> columns = new Object2IntOpenHashMap<>();

    public VariableIndex() {
        columns.defaultReturnValue(-1);
    }

    /**
     * @return the new column index
     * @throws IllegalStateException if the instance is already registered
     */
    public int register(VariableRef variable) {
        int index = columns.size();
        if (columns.putIfAbsent(variable, index) != -1) {
            throw new IllegalStateException("Variable " + variable + " registered twice");
        }
        return index;
    }

    /**
     * @return the column index, or -1 when the instance is outside its variable's domain
     */
    public int columnOf(VariableRef variable) {
        return columns.getInt(variable);
    }

    public boolean contains(VariableRef variable) {
        return columns.containsKey(variable);
    }

    public int size() {
        return columns.size();
    }
}
