/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.service.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.InstanceStats;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.Solution;
import com.tessera.modeling.api.model.SolverStatus;
import com.tessera.modeling.api.model.VariableValue;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Result of one solve, shaped for JSON output.
 *
 * <p>{@code objective_value} is null and {@code variables} is empty when the solver
 * returned no point (infeasible, unbounded, failed, or out of time without an incumbent).
 */
@JsonPropertyOrder({"model", "solver", "status", "objective_name", "objective_direction",
        "objective_value", "solve_millis", "variables", "stats"})
public record SolutionReport(
        @JsonProperty("model") String model,
        @JsonProperty("solver") String solver,
        @JsonProperty("status") SolverStatus status,
        @JsonProperty("objective_name") String objectiveName,
        @JsonProperty("objective_direction") ObjectiveDirection objectiveDirection,
        @JsonProperty("objective_value") Double objectiveValue,
        @JsonProperty("solve_millis") long solveMillis,
        @JsonProperty("variables") List<VariableValue> variables,
        @JsonProperty("stats") InstanceStats stats
) {

    public SolutionReport {
        variables = List.copyOf(variables);
    }

    public static SolutionReport of(Instance instance, Solution solution, String solver) {
        return new SolutionReport(
                instance.modelName(),
                solver,
                solution.status(),
                instance.objective().name(),
                instance.objective().direction(),
                solution.hasPoint() ? solution.objectiveValue() : null,
                solution.solveMillis(),
                solution.values(),
                instance.stats());
    }

    public OptionalDouble value(String label) {
        for (VariableValue v : variables) {
            if (v.label().equals(label)) {
                return OptionalDouble.of(v.value());
            }
        }
        return OptionalDouble.empty();
    }
}
