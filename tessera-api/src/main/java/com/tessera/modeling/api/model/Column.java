/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.io.Serializable;

/**
 * One decision column: a concrete (variable name, index tuple) pair.
 *
 * @param index      position in the instance's column list
 * @param name       declared variable name
 * @param tuple      index tuple within the variable's domain
 * @param domain     continuous, integer or binary
 * @param lowerBound lower bound, may be {@link Double#NEGATIVE_INFINITY}
 * @param upperBound upper bound, may be {@link Double#POSITIVE_INFINITY}
 */
public record Column(
        int index,
        String name,
        Tuple tuple,
        VariableDomain domain,
        double lowerBound,
        double upperBound
) implements Serializable {

    /**
     * Returns the column's display label, e.g. {@code x[1,2]}.
     */
    public String label() {
        return tuple.format(name);
    }
}
