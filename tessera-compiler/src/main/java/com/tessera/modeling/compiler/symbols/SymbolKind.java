package com.tessera.modeling.compiler.symbols;

public enum SymbolKind {
    SET, PARAMETER, VARIABLE, CONSTRAINT, OBJECTIVE;

    public String displayName() {
        return name().toLowerCase();
    }
}
