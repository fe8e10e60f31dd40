/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

import java.io.Serializable;

/**
 * A 1-based line/column position in model or data text.
 */
public record SourceLocation(int line, int column) implements Serializable {

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
