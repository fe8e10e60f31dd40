/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

/**
 * A symbol is subscripted with a different number of indices than it was declared with.
 */
public class ShapeMismatchException extends ModelCompilationException {

    private final String symbol;
    private final int declaredArity;
    private final int usedArity;

    public ShapeMismatchException(String symbol, int declaredArity, int usedArity, SourceLocation location) {
        super(ErrorKind.SHAPE_MISMATCH,
                "'" + symbol + "' is declared with " + declaredArity + " index(es) but referenced with " + usedArity,
                location);
        this.symbol = symbol;
        this.declaredArity = declaredArity;
        this.usedArity = usedArity;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getDeclaredArity() {
        return declaredArity;
    }

    public int getUsedArity() {
        return usedArity;
    }
}
