/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single set element or parameter value: either a number or a symbol.
 *
 * <p>Numeric atoms compare by value (so {@code 3} and {@code 3.0} are the same element);
 * a numeric atom is never equal to a symbolic one, even when the symbol's text looks numeric.
 */
public final class Atom implements Comparable<Atom>, Serializable {
    private static final long serialVersionUID = 1L;

    private final double number;
    private final String symbol; // null for numeric atoms

    private Atom(double number, String symbol) {
        this.number = number;
        this.symbol = symbol;
    }

    public static Atom of(double number) {
        if (Double.isNaN(number)) {
            throw new IllegalArgumentException("NaN is not a valid atom");
        }
        return new Atom(number == 0.0 ? 0.0 : number, null);
    }

    public static Atom of(String symbol) {
        return new Atom(0.0, Objects.requireNonNull(symbol, "symbol"));
    }

    public boolean isNumeric() {
        return symbol == null;
    }

    public boolean isSymbolic() {
        return symbol != null;
    }

    public double number() {
        if (symbol != null) {
            throw new IllegalStateException("Atom '" + symbol + "' is symbolic");
        }
        return number;
    }

    public String symbol() {
        if (symbol == null) {
            throw new IllegalStateException("Atom " + this + " is numeric");
        }
        return symbol;
    }

    /**
     * Returns true for numeric atoms holding an integral value.
     */
    public boolean isIntegral() {
        return symbol == null && !Double.isInfinite(number) && number == Math.rint(number);
    }

    @JsonValue
    public Object toJson() {
        if (symbol != null) {
            return symbol;
        }
        if (isIntegral() && Math.abs(number) < 1e15) {
            return (long) number;
        }
        return number;
    }

    @Override
    public int compareTo(Atom other) {
        if (isNumeric() && other.isNumeric()) {
            return Double.compare(number, other.number);
        }
        if (isNumeric() != other.isNumeric()) {
            return isNumeric() ? -1 : 1;
        }
        return symbol.compareTo(other.symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Atom)) return false;
        Atom other = (Atom) o;
        if (symbol == null) {
            return other.symbol == null && Double.compare(number, other.number) == 0;
        }
        return symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return symbol == null ? Double.hashCode(number) : symbol.hashCode() * 31 + 7;
    }

    @Override
    public String toString() {
        if (symbol != null) {
            return symbol;
        }
        if (isIntegral() && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }
}
