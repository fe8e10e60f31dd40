/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered index tuple. The empty tuple indexes scalar symbols.
 */
public record Tuple(List<Atom> atoms) implements Iterable<Atom>, Serializable {

    public static final Tuple EMPTY = new Tuple(List.of());

    public Tuple {
        atoms = List.copyOf(atoms);
    }

    public static Tuple of(Atom... atoms) {
        return new Tuple(Arrays.asList(atoms));
    }

    /**
     * Builds a tuple from plain Java values; numbers become numeric atoms, anything else symbolic.
     */
    public static Tuple of(Object... values) {
        List<Atom> atoms = new ArrayList<>(values.length);
        for (Object value : values) {
            if (value instanceof Atom) {
                atoms.add((Atom) value);
            } else if (value instanceof Number) {
                atoms.add(Atom.of(((Number) value).doubleValue()));
            } else {
                atoms.add(Atom.of(String.valueOf(value)));
            }
        }
        return new Tuple(atoms);
    }

    public int arity() {
        return atoms.size();
    }

    public Atom get(int position) {
        return atoms.get(position);
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    public Tuple concat(Tuple other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Atom> joined = new ArrayList<>(atoms.size() + other.atoms.size());
        joined.addAll(atoms);
        joined.addAll(other.atoms);
        return new Tuple(joined);
    }

    /**
     * Formats as {@code name[a,b]}, or just {@code name} for the empty tuple.
     */
    public String format(String name) {
        if (atoms.isEmpty()) {
            return name;
        }
        return name + atoms.stream().map(Atom::toString).collect(Collectors.joining(",", "[", "]"));
    }

    @JsonValue
    public List<Atom> toJson() {
        return atoms;
    }

    @Override
    public Iterator<Atom> iterator() {
        return atoms.iterator();
    }

    @Override
    public String toString() {
        return atoms.stream().map(Atom::toString).collect(Collectors.joining(",", "(", ")"));
    }
}
