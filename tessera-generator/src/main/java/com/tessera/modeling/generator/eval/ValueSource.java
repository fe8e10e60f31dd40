package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;

/**
 * Materialized set members and parameter values the evaluator reads from.
 */
public interface ValueSource {

    /**
     * @throws com.tessera.modeling.api.exceptions.MissingParameterValueException if the set has no members yet
     */
    TupleSet set(String name, SourceLocation location);

    /**
     * @throws com.tessera.modeling.api.exceptions.MissingParameterValueException if no value exists for the key
     */
    Atom parameter(String name, Tuple key, SourceLocation location);
}
