/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

public class InvalidRangeException extends ModelCompilationException {

    public InvalidRangeException(String message, SourceLocation location) {
        super(ErrorKind.INVALID_RANGE, message, location);
    }

    public InvalidRangeException(String message, SourceLocation location, Throwable cause) {
        super(ErrorKind.INVALID_RANGE, message, location, cause);
    }
}
