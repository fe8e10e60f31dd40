/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Outcome of a solver invocation.
 *
 * @param status         terminal status
 * @param objectiveValue objective value including the objective offset, NaN when no point is available
 * @param values         one entry per column in column order, empty when no point is available
 * @param solveTime      wall-clock time spent in the backend
 */
public record Solution(
        @JsonProperty("status") SolverStatus status,
        @JsonProperty("objective_value") double objectiveValue,
        @JsonProperty("variables") List<VariableValue> values,
        @JsonIgnore Duration solveTime
) implements Serializable {

    public Solution {
        values = List.copyOf(values);
    }

    public static Solution withoutPoint(SolverStatus status, Duration solveTime) {
        return new Solution(status, Double.NaN, List.of(), solveTime);
    }

    @JsonIgnore
    public boolean hasPoint() {
        return !values.isEmpty();
    }

    /**
     * Value of the column with the given label, e.g. {@code x[1,2]}.
     */
    public OptionalDouble value(String label) {
        for (VariableValue v : values) {
            if (v.label().equals(label)) {
                return OptionalDouble.of(v.value());
            }
        }
        return OptionalDouble.empty();
    }

    public Map<String, Double> valuesByLabel() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (VariableValue v : values) {
            map.put(v.label(), v.value());
        }
        return map;
    }

    @JsonProperty("solve_millis")
    public long solveMillis() {
        return solveTime.toMillis();
    }
}
