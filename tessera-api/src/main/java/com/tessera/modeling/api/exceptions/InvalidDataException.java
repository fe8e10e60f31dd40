/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

/**
 * Data that contradicts its declaration: values outside a declared domain, duplicate
 * set elements, attribute checks that fail, or data for a symbol computed in the model.
 */
public class InvalidDataException extends ModelCompilationException {

    public InvalidDataException(String message, SourceLocation location) {
        super(ErrorKind.INVALID_DATA, message, location);
    }
}
