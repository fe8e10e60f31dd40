package com.tessera.modeling.generator.data;

import com.tessera.modeling.api.exceptions.MissingParameterValueException;
import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.generator.eval.TupleSet;
import com.tessera.modeling.generator.eval.ValueSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Materialized sets and parameter tables. Filled by {@link DataBinder} in dependency order
 * and read-only afterwards.
 */
public final class ModelData implements ValueSource {

    private final Map<String, TupleSet> sets = new LinkedHashMap<>();
    private final Map<String, ParameterTable> parameters = new LinkedHashMap<>();

    void putSet(String name, TupleSet members) {
        sets.put(name, members);
    }

    void putParameter(ParameterTable table) {
        parameters.put(table.name(), table);
    }

    @Override
    public TupleSet set(String name, SourceLocation location) {
        TupleSet members = sets.get(name);
        if (members == null) {
            throw new MissingParameterValueException(name, Tuple.EMPTY, location);
        }
        return members;
    }

    @Override
    public Atom parameter(String name, Tuple key, SourceLocation location) {
        ParameterTable table = parameters.get(name);
        Atom value = table == null ? null : table.get(key);
        if (value == null) {
            throw new MissingParameterValueException(name, key, location);
        }
        return value;
    }

    /**
     * Fails on the first parameter member, in binding order, that never received a value.
     * Called once the instance is generated, so a missing value that breaks a set range or
     * a row surfaces there first, at the place that reads it.
     *
     * @throws MissingParameterValueException naming the parameter and the unvalued tuple
     */
    public void requireComplete() {
        for (ParameterTable table : parameters.values()) {
            if (!table.isComplete()) {
                throw new MissingParameterValueException(table.name(), table.unvalued().get(0), table.location());
            }
        }
    }

    public Map<String, TupleSet> sets() {
        return Collections.unmodifiableMap(sets);
    }

    public Map<String, ParameterTable> parameters() {
        return Collections.unmodifiableMap(parameters);
    }
}
