/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

import java.util.List;

/**
 * A set or parameter definition depends, directly or transitively, on itself.
 */
public class CyclicDefinitionException extends ModelCompilationException {

    private final List<String> cycle;

    public CyclicDefinitionException(List<String> cycle, SourceLocation location) {
        super(ErrorKind.CYCLIC_DEFINITION, "Cyclic definition: " + String.join(" -> ", cycle), location);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
