package com.tessera.modeling.generator.eval;

public record SymbolValue(String symbol) implements Value {
}
