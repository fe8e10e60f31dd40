/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

import java.util.Optional;

/**
 * Base type of every failure raised while turning model text into an instance.
 *
 * <p>This is a RuntimeException so the parser, resolver and generator can propagate
 * failures without declaring them on every method. Compilation failures are
 * deterministic: the same input always fails the same way, so callers should not retry.
 */
public class ModelCompilationException extends RuntimeException {

    private final ErrorKind kind;
    private final transient SourceLocation location;
    private final String detail;

    public ModelCompilationException(ErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null);
    }

    public ModelCompilationException(ErrorKind kind, String message, SourceLocation location, Throwable cause) {
        super(location == null ? message : message + " (" + location + ")", cause);
        this.kind = kind;
        this.location = location;
        this.detail = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<SourceLocation> getLocation() {
        return Optional.ofNullable(location);
    }

    /**
     * Returns the message without the location suffix.
     */
    public String getDetail() {
        return detail;
    }
}
