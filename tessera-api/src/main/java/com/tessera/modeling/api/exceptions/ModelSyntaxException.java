/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

/**
 * Malformed model or data text.
 */
public class ModelSyntaxException extends ModelCompilationException {

    private final String expected;

    public ModelSyntaxException(String message, SourceLocation location, String expected) {
        super(ErrorKind.SYNTAX_ERROR, expected == null ? message : message + ", expected " + expected, location);
        this.expected = expected;
    }

    public ModelSyntaxException(String message, SourceLocation location) {
        this(message, location, null);
    }

    /**
     * Description of the token(s) the parser was looking for, or null.
     */
    public String getExpected() {
        return expected;
    }
}
