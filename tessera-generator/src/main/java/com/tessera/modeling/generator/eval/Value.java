package com.tessera.modeling.generator.eval;

/**
 * Result of evaluating a scalar expression: a linear form (numbers are constant forms)
 * or a symbolic value.
 */
public sealed interface Value permits LinearForm, SymbolValue {
}
