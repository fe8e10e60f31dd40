/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of compilation failures, in the order in which the pipeline detects them.
 */
public enum ErrorKind {
    SYNTAX_ERROR("syntax_error"),
    UNKNOWN_SYMBOL("unknown_symbol"),
    DUPLICATE_SYMBOL("duplicate_symbol"),
    CYCLIC_DEFINITION("cyclic_definition"),
    SHAPE_MISMATCH("shape_mismatch"),
    INVALID_RANGE("invalid_range"),
    MISSING_PARAMETER_VALUE("missing_parameter_value"),
    INVALID_DATA("invalid_data"),
    INSTANCE_BUILD("instance_build");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
