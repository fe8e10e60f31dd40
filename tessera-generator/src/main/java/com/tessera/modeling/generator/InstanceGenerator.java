/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.generator;

import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.model.Column;
import com.tessera.modeling.api.model.Instance;
import com.tessera.modeling.api.model.InstanceStats;
import com.tessera.modeling.api.model.ObjectiveRow;
import com.tessera.modeling.api.model.Row;
import com.tessera.modeling.api.model.RowLabel;
import com.tessera.modeling.api.model.RowSense;
import com.tessera.modeling.api.model.VariableDomain;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import com.tessera.modeling.generator.data.ModelData;
import com.tessera.modeling.generator.eval.Bindings;
import com.tessera.modeling.generator.eval.ExpressionEvaluator;
import com.tessera.modeling.generator.eval.IndexBinding;
import com.tessera.modeling.generator.eval.LinearForm;
import com.tessera.modeling.generator.eval.ResolvedIndexing;
import com.tessera.modeling.generator.eval.VariableIndex;
import com.tessera.modeling.generator.eval.VariableRef;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleRBTreeMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a validated model with bound data into a sparse {@link Instance}.
 *
 * <p>Columns are allocated sequentially in declaration order, then header order. Each
 * constraint template is instantiated as one task on the worker pool; every task only reads
 * the immutable model, data and column index. Per-template batches are concatenated in
 * template declaration order, so the instance does not depend on scheduling.
 *
 * <p>With a parallelism of 1 no pool is created and templates run on the caller's thread.
 */
public final class InstanceGenerator implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(InstanceGenerator.class.getName());
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private volatile Tracer tracer;
    private final int parallelism;
    private final ExecutorService workers;

    public InstanceGenerator(Tracer tracer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.tracer = tracer;
        this.parallelism = parallelism;
        this.workers = parallelism == 1 ? null : newWorkerPool(parallelism);
    }

    private static ExecutorService newWorkerPool(int threads) {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tessera-rowgen-" + pool + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    public int parallelism() {
        return parallelism;
    }

    /**
     * Runs all three phases and assembles the instance.
     */
    public Instance generate(String modelName, ValidatedModel model, ModelData data) {
        long start = System.nanoTime();
        ColumnSet columns = allocateColumns(model, data);
        List<Row> rows = generateRows(model, data, columns);
        ObjectiveRow objective = generateObjective(model, data, columns);
        data.requireComplete();
        return assemble(modelName, columns, rows, objective, System.nanoTime() - start);
    }

    public Instance assemble(String modelName, ColumnSet columns, List<Row> rows, ObjectiveRow objective,
                             long generationNanos) {
        long nonZeros = 0;
        Map<String, Integer> perTemplate = new LinkedHashMap<>();
        for (Row row : rows) {
            nonZeros += row.size();
            perTemplate.merge(row.template(), 1, Integer::sum);
        }
        InstanceStats stats = new InstanceStats(columns.size(), columns.integerCount(), rows.size(), nonZeros,
                generationNanos, perTemplate);
        return new Instance(modelName, columns.columns(), rows, objective, stats);
    }

    // ------------------------------------------------------------------------
    // Columns
    // ------------------------------------------------------------------------

    public ColumnSet allocateColumns(ValidatedModel model, ModelData data) {
        Span span = tracer.spanBuilder("allocate-columns").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ExpressionEvaluator evaluator = new ExpressionEvaluator(model.symbols(), data, null);
            VariableIndex index = new VariableIndex();
            List<Column> columns = new ArrayList<>();
            for (Declaration.VarDecl var : model.ofType(Declaration.VarDecl.class)) {
                boolean warned = false;
                for (IndexBinding member : evaluator.sets().resolve(var.indexing(), Bindings.EMPTY).bindings()) {
                    double lower;
                    double upper;
                    if (var.domain() == VariableDomain.BINARY) {
                        // stated bounds are never evaluated
                        if (!warned && (var.lower() != null || var.upper() != null)) {
                            logger.warning("Bounds stated on binary variable " + var.name()
                                    + " are ignored; binary columns are always [0, 1]");
                            warned = true;
                        }
                        lower = 0.0;
                        upper = 1.0;
                    } else {
                        lower = var.lower() == null ? 0.0 : evaluator.evaluateNumber(var.lower(), member.bindings());
                        upper = var.upper() == null
                                ? Double.POSITIVE_INFINITY
                                : evaluator.evaluateNumber(var.upper(), member.bindings());
                    }
                    if (lower > upper) {
                        throw new InstanceBuildException("Variable " + member.tuple().format(var.name())
                                + " has lower bound " + lower + " above upper bound " + upper, var.location());
                    }
                    int column = index.register(new VariableRef(var.name(), member.tuple()));
                    columns.add(new Column(column, var.name(), member.tuple(), var.domain(), lower, upper));
                }
            }
            span.setAttribute("columnCount", columns.size());
            return new ColumnSet(columns, index);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // ------------------------------------------------------------------------
    // Rows
    // ------------------------------------------------------------------------

    /**
     * Row contents before its position in the instance is known.
     */
    private record RowDraft(RowLabel label, int[] columns, double[] coefficients, RowSense sense, double rhs) {
    }

    public List<Row> generateRows(ValidatedModel model, ModelData data, ColumnSet columns) {
        Span span = tracer.spanBuilder("generate-rows").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ExpressionEvaluator evaluator = new ExpressionEvaluator(model.symbols(), data, columns.index());
            List<Declaration.ConstraintDecl> templates = model.ofType(Declaration.ConstraintDecl.class);

            List<List<RowDraft>> batches = new ArrayList<>(templates.size());
            if (workers == null) {
                for (Declaration.ConstraintDecl template : templates) {
                    batches.add(instantiate(template, evaluator, columns.index()));
                }
            } else {
                List<Future<List<RowDraft>>> futures = new ArrayList<>(templates.size());
                for (Declaration.ConstraintDecl template : templates) {
                    Callable<List<RowDraft>> task = () -> instantiate(template, evaluator, columns.index());
                    futures.add(workers.submit(task));
                }
                for (Future<List<RowDraft>> future : futures) {
                    batches.add(await(future, futures));
                }
            }

            List<Row> rows = new ArrayList<>();
            for (List<RowDraft> batch : batches) {
                for (RowDraft draft : batch) {
                    rows.add(new Row(rows.size(), draft.label(), draft.columns(), draft.coefficients(),
                            draft.sense(), draft.rhs()));
                }
            }
            span.setAttribute("templateCount", templates.size());
            span.setAttribute("rowCount", rows.size());
            logger.fine(() -> String.format("Generated %d rows from %d templates", rows.size(), templates.size()));
            return rows;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<RowDraft> await(Future<List<RowDraft>> future, List<Future<List<RowDraft>>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            all.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new InstanceBuildException("Row generation was interrupted", e);
        } catch (ExecutionException e) {
            all.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new InstanceBuildException("Row generation failed: " + e.getCause(), e.getCause());
        }
    }

    private List<RowDraft> instantiate(Declaration.ConstraintDecl template, ExpressionEvaluator evaluator,
                                       VariableIndex index) {
        ResolvedIndexing header = evaluator.sets().resolve(template.indexing(), Bindings.EMPTY);
        List<RowDraft> drafts = new ArrayList<>(header.size());
        for (IndexBinding member : header.bindings()) {
            RowLabel label = new RowLabel(template.name(), header.keys(), member.tuple());
            LinearForm form = evaluator.evaluate(template.lhs(), member.bindings())
                    .minus(evaluator.evaluate(template.rhs(), member.bindings()));
            Int2DoubleRBTreeMap packed = pack(form, index);
            if (packed.isEmpty()) {
                throw new InstanceBuildException("Constraint " + label.format()
                        + " has no variable terms (constant " + form.constant() + ")", template.location());
            }
            drafts.add(new RowDraft(label, packed.keySet().toIntArray(), packed.values().toDoubleArray(),
                    template.sense(), -form.constant() + 0.0));
        }
        return drafts;
    }

    /**
     * Maps a linear form onto column indices, sorted, dropping exact zeros.
     */
    private static Int2DoubleRBTreeMap pack(LinearForm form, VariableIndex index) {
        Int2DoubleRBTreeMap packed = new Int2DoubleRBTreeMap();
        for (Object2DoubleMap.Entry<VariableRef> term : form.terms().object2DoubleEntrySet()) {
            if (term.getDoubleValue() != 0.0) {
                packed.put(index.columnOf(term.getKey()), term.getDoubleValue());
            }
        }
        return packed;
    }

    // ------------------------------------------------------------------------
    // Objective
    // ------------------------------------------------------------------------

    public ObjectiveRow generateObjective(ValidatedModel model, ModelData data, ColumnSet columns) {
        Span span = tracer.spanBuilder("generate-objective").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Declaration.ObjectiveDecl objective = model.objective();
            ExpressionEvaluator evaluator = new ExpressionEvaluator(model.symbols(), data, columns.index());
            LinearForm form = evaluator.evaluate(objective.expression(), Bindings.EMPTY);
            Int2DoubleRBTreeMap packed = pack(form, columns.index());
            if (packed.isEmpty()) {
                logger.warning("Objective " + objective.name() + " has no variable terms");
            }
            span.setAttribute("objectiveTerms", packed.size());
            return new ObjectiveRow(objective.name(), objective.direction(), packed.keySet().toIntArray(),
                    packed.values().toDoubleArray(), form.constant());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void close() {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while stopping row generation workers", e);
        }
    }
}
