/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.exceptions;

import com.tessera.modeling.api.model.Tuple;

/**
 * A parameter tuple inside the declared domain has no data value, no definition and no default.
 */
public class MissingParameterValueException extends ModelCompilationException {

    private final String parameter;
    private final Tuple tuple;

    public MissingParameterValueException(String parameter, Tuple tuple, SourceLocation location) {
        super(ErrorKind.MISSING_PARAMETER_VALUE, "No value supplied for " + tuple.format(parameter), location);
        this.parameter = parameter;
        this.tuple = tuple;
    }

    public String getParameter() {
        return parameter;
    }

    public Tuple getTuple() {
        return tuple;
    }
}
