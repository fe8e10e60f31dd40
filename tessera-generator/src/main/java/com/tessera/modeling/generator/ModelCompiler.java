/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.generator;

import com.tessera.modeling.api.CompilationListener;
import com.tessera.modeling.api.IModelCompiler;
import com.tessera.modeling.api.exceptions.ModelCompilationException;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.ObjectiveRow;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.compiler.ast.DataSection;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.parser.ModelParser;
import com.tessera.modeling.compiler.symbols.ModelValidator;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import com.tessera.modeling.core.config.EngineConfig;
import com.tessera.modeling.generator.data.DataBinder;
import com.tessera.modeling.generator.data.ModelData;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles model and data text into a solver-ready {@link Instance}.
 *
 * <p>The process runs six stages, each reported to the {@link CompilationListener} and traced
 * as its own span:
 * <ol>
 *   <li>PARSING: model text (with any embedded data block) and the separate data text;</li>
 *   <li>VALIDATION: symbol table, scoping, shapes, definition cycles and evaluation order;</li>
 *   <li>DATA_BINDING: sets and parameter tables materialized in dependency order;</li>
 *   <li>COLUMN_GENERATION: one column per variable instance;</li>
 *   <li>ROW_GENERATION: constraint templates expanded on the worker pool;</li>
 *   <li>OBJECTIVE: the cost row.</li>
 * </ol>
 * Every stage failure is a {@link ModelCompilationException}; nothing is partially returned.
 */
public class ModelCompiler implements IModelCompiler, AutoCloseable {

    private static final Logger logger = Logger.getLogger(ModelCompiler.class.getName());
    private static final int TOTAL_STAGES = 6;

    private final InstanceGenerator generator;
    private Tracer tracer;
    private CompilationListener listener;

    public ModelCompiler(Tracer tracer, EngineConfig config) {
        this.tracer = tracer;
        this.generator = new InstanceGenerator(tracer, config.parallelism());
    }

    public ModelCompiler(Tracer tracer) {
        this(tracer, EngineConfig.defaults());
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
        generator.setTracer(tracer);
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public Instance compile(Path modelPath, Path dataPath) throws IOException {
        String modelText = Files.readString(modelPath);
        String dataText = dataPath == null ? null : Files.readString(dataPath);
        return compile(modelName(modelPath), modelText, dataText);
    }

    @Override
    public Instance compile(String modelText, String dataText) {
        return compile("model", modelText, dataText);
    }

    public Instance compile(String modelName, String modelText, String dataText) {
        Span span = tracer.spanBuilder("compile-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("modelName", modelName);
            long startTime = System.nanoTime();

            ModelDeclarations declarations = stage("PARSING", 1, () -> {
                ModelDeclarations parsed = ModelParser.parse(modelText);
                return dataText == null ? parsed : parsed.withData(ModelParser.parseData(dataText));
            }, parsed -> Map.of("declarations", parsed.declarations().size(),
                    "dataStatements", parsed.data().statements().size()));

            ValidatedModel model = stage("VALIDATION", 2, () -> ModelValidator.validate(declarations),
                    validated -> Map.of("symbols", validated.symbols().size()));

            ModelData data = stage("DATA_BINDING", 3, () -> DataBinder.bind(model, declarations.data()),
                    bound -> Map.of("sets", bound.sets().size(), "parameters", bound.parameters().size()));

            long generationStart = System.nanoTime();
            ColumnSet columns = stage("COLUMN_GENERATION", 4, () -> generator.allocateColumns(model, data),
                    allocated -> Map.of("columnCount", allocated.size(),
                            "integerColumnCount", allocated.integerCount()));

            List<Row> rows = stage("ROW_GENERATION", 5, () -> generator.generateRows(model, data, columns),
                    generated -> Map.of("rowCount", generated.size(), "parallelism", generator.parallelism()));

            ObjectiveRow objective = stage("OBJECTIVE", 6, () -> generator.generateObjective(model, data, columns),
                    row -> Map.of("terms", row.columns().length));
            data.requireComplete();

            Instance instance = generator.assemble(modelName, columns, rows, objective,
                    System.nanoTime() - generationStart);

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            span.setAttribute("rowCount", instance.rowCount());
            span.setAttribute("columnCount", instance.columnCount());
            logger.info(String.format("Compiled %s: %d columns, %d rows, %d non-zeros in %d ms",
                    modelName, instance.columnCount(), instance.rowCount(), instance.stats().nonZeroCount(),
                    TimeUnit.NANOSECONDS.toMillis(compilationTime)));
            return instance;
        } catch (ModelCompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T stage(String name, int number, Supplier<T> work, Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(name, number, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = work.get();
            if (listener != null) {
                listener.onStageComplete(name, new CompilationListener.StageResult(
                        name, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            if (listener != null) {
                listener.onError(name, e);
            }
            throw e;
        }
    }

    private static String modelName(Path modelPath) {
        String file = modelPath.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    @Override
    public void close() {
        generator.close();
    }
}
