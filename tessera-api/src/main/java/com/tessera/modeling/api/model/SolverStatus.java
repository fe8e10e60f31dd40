/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal status reported by a solver backend. None of these is an exception:
 * infeasibility and unboundedness are legitimate answers, and only {@link #TIME_LIMIT}
 * is worth retrying (with a larger budget).
 */
public enum SolverStatus {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    TIME_LIMIT,
    FAILED;

    public boolean isRetryable() {
        return this == TIME_LIMIT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
