/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Size and timing figures of a generated instance.
 */
public record InstanceStats(
        @JsonProperty("columns") int columnCount,
        @JsonProperty("integer_columns") int integerColumnCount,
        @JsonProperty("rows") int rowCount,
        @JsonProperty("non_zeros") long nonZeroCount,
        @JsonProperty("generation_nanos") long generationNanos,
        @JsonProperty("rows_per_template") Map<String, Integer> rowsPerTemplate
) implements Serializable {

    public InstanceStats {
        rowsPerTemplate = Collections.unmodifiableMap(new LinkedHashMap<>(rowsPerTemplate));
    }

    public long generationMillis() {
        return generationNanos / 1_000_000;
    }
}
