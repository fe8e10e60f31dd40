package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.api.exceptions.SourceLocation;

/**
 * A declared name.
 *
 * @param arity     number of subscripts a reference must carry (0 for sets and scalars)
 * @param dimension tuple width of a set's members; 0 for non-sets
 * @param handle    position of the declaration in the declaration tree
 */
public record Symbol(String name, SymbolKind kind, int arity, int dimension, int handle, SourceLocation location) {

    public boolean is(SymbolKind expected) {
        return kind == expected;
    }
}
