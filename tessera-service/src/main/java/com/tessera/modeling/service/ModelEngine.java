/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.service;

import com.tessera.modeling.api.IModelCompiler;
import com.tessera.modeling.api.ISolverAdapter;
import com.tessera.modeling.api.exceptions.ModelCompilationException;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.Solution;
import com.tessera.modeling.api.model.SolveBudget;
import com.tessera.modeling.core.config.EngineConfig;
import com.tessera.modeling.generator.ModelCompiler;
import com.tessera.modeling.service.report.SolutionReport;
import com.tessera.modeling.solver.OjAlgoSolverAdapter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for callers: compiles model and data text into an instance, hands it to
 * the solver within the configured budget and maps the result to a {@link SolutionReport}.
 *
 * <p>Compilation failures propagate as {@link ModelCompilationException}; solver outcomes
 * other than optimal are reported through the report's status, never thrown.
 */
public class ModelEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ModelEngine.class.getName());

    private final IModelCompiler compiler;
    private final ISolverAdapter solver;
    private final EngineConfig config;
    private final Tracer tracer;

    public ModelEngine(IModelCompiler compiler, ISolverAdapter solver, EngineConfig config, Tracer tracer) {
        this.compiler = Objects.requireNonNull(compiler, "IModelCompiler cannot be null");
        this.solver = Objects.requireNonNull(solver, "ISolverAdapter cannot be null");
        this.config = Objects.requireNonNull(config, "EngineConfig cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
    }

    /**
     * Wires the default compiler and the ojAlgo backend.
     */
    public static ModelEngine create(EngineConfig config, Tracer tracer) {
        return new ModelEngine(new ModelCompiler(tracer, config), new OjAlgoSolverAdapter(tracer), config, tracer);
    }

    public Instance compile(Path modelPath, Path dataPath) throws IOException {
        return compiler.compile(modelPath, dataPath);
    }

    public Instance compile(String modelText, String dataText) {
        return compiler.compile(modelText, dataText);
    }

    /**
     * Compiles and solves model and data files.
     *
     * @param modelPath model file, may carry its own data block
     * @param dataPath  separate data file, or null
     */
    public SolutionReport solve(Path modelPath, Path dataPath) throws IOException {
        return solve(compile(modelPath, dataPath));
    }

    public SolutionReport solve(String modelText, String dataText) {
        return solve(compile(modelText, dataText));
    }

    public SolutionReport solve(Instance instance) {
        Span span = tracer.spanBuilder("model-engine-solve").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("modelName", instance.modelName());
            span.setAttribute("backend", solver.backendName());

            SolveBudget budget = new SolveBudget(config.solveTimeLimit(), config.solveNodeLimit());
            Solution solution = solver.solve(instance, budget);

            span.setAttribute("status", solution.status().wireName());
            if (!solution.hasPoint()) {
                logger.log(Level.WARNING, "No solution point for {0}: {1}",
                        new Object[]{instance.modelName(), solution.status().wireName()});
            }
            return SolutionReport.of(instance, solution, solver.backendName());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public void close() {
        closeQuietly(compiler);
        closeQuietly(solver);
    }

    private static void closeQuietly(Object component) {
        if (component instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to close " + component.getClass().getSimpleName(), e);
            }
        }
    }
}
