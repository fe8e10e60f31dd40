package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.model.Tuple;

/**
 * One decision-variable instance, e.g. {@code x[1,2]}.
 */
public record VariableRef(String name, Tuple tuple) {

    public String label() {
        return tuple.format(name);
    }

    @Override
    public String toString() {
        return label();
    }
}
