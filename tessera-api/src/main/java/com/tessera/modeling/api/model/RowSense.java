/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

/**
 * Relational operator of a generated row, after all variable terms are moved to the left.
 */
public enum RowSense {
    EQUAL("="),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    RowSense(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static RowSense fromSymbol(String symbol) {
        switch (symbol) {
            case "=":
            case "==":
                return EQUAL;
            case "<=":
                return LESS_OR_EQUAL;
            case ">=":
                return GREATER_OR_EQUAL;
            default:
                throw new IllegalArgumentException("Not a row operator: " + symbol);
        }
    }
}
