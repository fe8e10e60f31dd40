/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VariableDomain {
    CONTINUOUS,
    INTEGER,
    BINARY;

    public boolean isIntegral() {
        return this != CONTINUOUS;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
