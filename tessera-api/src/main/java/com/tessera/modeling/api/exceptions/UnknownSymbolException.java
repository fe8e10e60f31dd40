/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

public class UnknownSymbolException extends ModelCompilationException {

    private final String symbol;

    public UnknownSymbolException(String symbol, SourceLocation location) {
        super(ErrorKind.UNKNOWN_SYMBOL, "Unknown symbol '" + symbol + "'", location);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
