/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Value of one column, mapped back to its variable name and index tuple.
 */
public record VariableValue(
        @JsonProperty("name") String name,
        @JsonProperty("index") Tuple index,
        @JsonProperty("label") String label,
        @JsonProperty("value") double value
) implements Serializable {
}
