/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.service.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tessera.modeling.api.exceptions.ErrorKind;
import com.tessera.modeling.api.exceptions.ModelCompilationException;
import com.tessera.modeling.api.exceptions.SourceLocation;

/**
 * A compilation failure, shaped for JSON output. {@code line} and {@code column} are null
 * when the failure has no single source position (e.g. a missing data value).
 */
@JsonPropertyOrder({"error_kind", "line", "column", "message"})
public record Diagnostic(
        @JsonProperty("error_kind") ErrorKind errorKind,
        @JsonProperty("line") Integer line,
        @JsonProperty("column") Integer column,
        @JsonProperty("message") String message
) {

    public static Diagnostic of(ModelCompilationException e) {
        SourceLocation location = e.getLocation().orElse(null);
        return new Diagnostic(
                e.getKind(),
                location == null ? null : location.line(),
                location == null ? null : location.column(),
                e.getDetail());
    }
}
