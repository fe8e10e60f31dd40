/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

/**
 * Row or column construction failed for a reason not covered by a more specific kind.
 */
public class InstanceBuildException extends ModelCompilationException {

    public InstanceBuildException(String message) {
        super(ErrorKind.INSTANCE_BUILD, message, null);
    }

    public InstanceBuildException(String message, SourceLocation location) {
        super(ErrorKind.INSTANCE_BUILD, message, location);
    }

    public InstanceBuildException(String message, Throwable cause) {
        super(ErrorKind.INSTANCE_BUILD, message, null, cause);
    }
}
