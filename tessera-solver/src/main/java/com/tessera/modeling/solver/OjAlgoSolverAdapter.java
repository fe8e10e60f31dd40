/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.solver;

import com.tessera.modeling.api.ISolverAdapter;
import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.ObjectiveRow;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.Solution;
import com.tessera.modeling.api.model.SolveBudget;
import com.tessera.modeling.api.model.SolverStatus;
import com.tessera.modeling.api.model.VariableDomain;
import com.tessera.modeling.api.model.VariableValue;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves instances with ojAlgo's {@link ExpressionsBasedModel}.
 *
 * <p>Columns become variables in column order, rows become expressions, and the objective
 * is carried as variable weights. The backend runs on a dedicated worker thread: the time
 * limit is passed to ojAlgo and also enforced here, with a short grace period, by waiting
 * on the future and cancelling it when the limit is exceeded.
 */
public class OjAlgoSolverAdapter implements ISolverAdapter, AutoCloseable {

    private static final Logger logger = Logger.getLogger(OjAlgoSolverAdapter.class.getName());
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final Duration GRACE = Duration.ofSeconds(2);

    private final Tracer tracer;
    private final ExecutorService worker;

    public OjAlgoSolverAdapter(Tracer tracer) {
        this.tracer = tracer;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tessera-solver-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String backendName() {
        return "ojalgo";
    }

    @Override
    public Solution solve(Instance instance, SolveBudget budget) {
        Span span = tracer.spanBuilder("solve-instance").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("backend", backendName());
            span.setAttribute("columnCount", instance.columnCount());
            span.setAttribute("rowCount", instance.rowCount());

            long start = System.nanoTime();
            Future<Solution> future = worker.submit(() -> solveNow(instance, budget, start));
            Solution solution;
            try {
                solution = future.get(budget.timeLimit().plus(GRACE).toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warning(String.format("Solver did not return within %s for %s; cancelled",
                        budget.timeLimit(), instance.modelName()));
                solution = Solution.withoutPoint(SolverStatus.TIME_LIMIT, Duration.ofNanos(System.nanoTime() - start));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                solution = Solution.withoutPoint(SolverStatus.FAILED, Duration.ofNanos(System.nanoTime() - start));
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Solver backend failed for " + instance.modelName(), e.getCause());
                span.recordException(e.getCause());
                solution = Solution.withoutPoint(SolverStatus.FAILED, Duration.ofNanos(System.nanoTime() - start));
            }

            span.setAttribute("status", solution.status().wireName());
            span.setAttribute("solveTimeMs", solution.solveMillis());
            logger.info(String.format("Solved %s with %s: %s in %d ms", instance.modelName(), backendName(),
                    solution.status(), solution.solveMillis()));
            return solution;
        } finally {
            span.end();
        }
    }

    private Solution solveNow(Instance instance, SolveBudget budget, long start) {
        ExpressionsBasedModel model = new ExpressionsBasedModel();
        try {
            model.options.time_abort = budget.timeLimit().toMillis();
            if (budget.hasNodeLimit()) {
                model.options.iterations_abort = (int) Math.min(Integer.MAX_VALUE, budget.nodeLimit());
            }
            Variable[] variables = addVariables(model, instance);
            addRows(model, instance, variables);

            Optimisation.Result result = instance.objective().direction() == ObjectiveDirection.MAXIMIZE
                    ? model.maximise()
                    : model.minimise();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            return toSolution(instance, result, elapsed);
        } finally {
            model.dispose();
        }
    }

    private static Variable[] addVariables(ExpressionsBasedModel model, Instance instance) {
        ObjectiveRow objective = instance.objective();
        Variable[] variables = new Variable[instance.columnCount()];
        for (Column column : instance.columns()) {
            Variable variable = model.newVariable(column.label());
            if (column.domain() == VariableDomain.BINARY) {
                variable.binary();
            } else {
                if (column.domain() == VariableDomain.INTEGER) {
                    variable.integer(true);
                }
                if (Double.isFinite(column.lowerBound())) {
                    variable.lower(BigDecimal.valueOf(column.lowerBound()));
                }
                if (Double.isFinite(column.upperBound())) {
                    variable.upper(BigDecimal.valueOf(column.upperBound()));
                }
            }
            double weight = objective.coefficientOf(column.index());
            if (weight != 0.0) {
                variable.weight(BigDecimal.valueOf(weight));
            }
            variables[column.index()] = variable;
        }
        return variables;
    }

    private static void addRows(ExpressionsBasedModel model, Instance instance, Variable[] variables) {
        for (Row row : instance.rows()) {
            Expression expression = model.newExpression(row.label().format());
            for (int k = 0; k < row.size(); k++) {
                expression.set(variables[row.columnAt(k)], BigDecimal.valueOf(row.coefficientAt(k)));
            }
            BigDecimal rhs = BigDecimal.valueOf(row.rhs());
            switch (row.sense()) {
                case EQUAL -> expression.level(rhs);
                case LESS_OR_EQUAL -> expression.upper(rhs);
                case GREATER_OR_EQUAL -> expression.lower(rhs);
            }
        }
    }

    private static Solution toSolution(Instance instance, Optimisation.Result result, Duration elapsed) {
        SolverStatus status = statusOf(result.getState());
        if (status != SolverStatus.OPTIMAL && !(status == SolverStatus.TIME_LIMIT && result.getState().isFeasible())) {
            logger.fine(() -> "Backend state " + result.getState() + " for " + instance.modelName());
            return Solution.withoutPoint(status, elapsed);
        }
        List<VariableValue> values = new ArrayList<>(instance.columnCount());
        double[] point = new double[instance.columnCount()];
        for (Column column : instance.columns()) {
            double value = result.doubleValue(column.index()) + 0.0;
            point[column.index()] = value;
            values.add(new VariableValue(column.name(), column.tuple(), column.label(), value));
        }
        return new Solution(status, instance.objective().evaluate(point), values, elapsed);
    }

    /**
     * Maps ojAlgo's terminal state onto the engine's statuses.
     */
    static SolverStatus statusOf(Optimisation.State state) {
        switch (state) {
            case OPTIMAL:
            case DISTINCT:
                return SolverStatus.OPTIMAL;
            case INFEASIBLE:
                return SolverStatus.INFEASIBLE;
            case UNBOUNDED:
                return SolverStatus.UNBOUNDED;
            case FEASIBLE:
            case APPROXIMATE:
                return SolverStatus.TIME_LIMIT;
            default:
                return SolverStatus.FAILED;
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
