/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api;

import com.tessera.modeling.api.model.Instance;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling a model description plus a dataset into a solver-ready instance.
 */
public interface IModelCompiler {

    /**
     * Compiles model and data files.
     *
     * @param modelPath path to the model text (may contain its own {@code data;} block)
     * @param dataPath  path to a separate data text, or null
     * @return generated instance
     * @throws IOException if a file cannot be read
     * @throws com.tessera.modeling.api.exceptions.ModelCompilationException if compilation fails
     */
    Instance compile(Path modelPath, Path dataPath) throws IOException;

    /**
     * Compiles model and data text held in memory.
     *
     * @param modelText model text
     * @param dataText  separate data text, or null
     * @return generated instance
     */
    Instance compile(String modelText, String dataText);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
