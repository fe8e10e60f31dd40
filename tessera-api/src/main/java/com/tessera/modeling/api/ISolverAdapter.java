/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api;

import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.Solution;
import com.tessera.modeling.api.model.SolveBudget;

/**
 * Boundary to an external LP/MIP backend.
 *
 * <p>Implementations are the only components allowed to call into solver libraries.
 * They must honour the budget (returning {@code TIME_LIMIT} when it runs out), release
 * every backend-held resource before returning, and never alter the instance to force
 * feasibility.
 */
public interface ISolverAdapter {

    /**
     * Solves the instance within the given budget.
     *
     * @param instance generated instance
     * @param budget   time and node limits
     * @return the solution; on {@code OPTIMAL} every column has a value
     */
    Solution solve(Instance instance, SolveBudget budget);

    /**
     * Short name of the backend, used in logs and reports.
     */
    String backendName();
}
