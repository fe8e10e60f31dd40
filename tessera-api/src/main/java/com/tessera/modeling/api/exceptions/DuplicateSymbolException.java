/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

public class DuplicateSymbolException extends ModelCompilationException {

    private final String symbol;

    public DuplicateSymbolException(String symbol, String existing, String attempted, SourceLocation location) {
        super(ErrorKind.DUPLICATE_SYMBOL,
                "Symbol '" + symbol + "' is already declared as " + existing + ", cannot redeclare it as " + attempted,
                location);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
