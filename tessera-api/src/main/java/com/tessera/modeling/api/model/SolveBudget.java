/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Resource limits for one solver invocation. A zero node limit means unlimited.
 */
public record SolveBudget(Duration timeLimit, long nodeLimit) {

    public SolveBudget {
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("Time limit must be positive: " + timeLimit);
        }
        if (nodeLimit < 0) {
            throw new IllegalArgumentException("Node limit must not be negative: " + nodeLimit);
        }
    }

    public static SolveBudget ofTime(Duration timeLimit) {
        return new SolveBudget(timeLimit, 0);
    }

    public boolean hasNodeLimit() {
        return nodeLimit > 0;
    }
}
