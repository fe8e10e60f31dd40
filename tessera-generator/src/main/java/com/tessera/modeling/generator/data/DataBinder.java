/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.generator.data;

import com.tessera.modeling.api.exceptions.InvalidDataException;
import com.tessera.modeling.api.exceptions.MissingParameterValueException;
import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.exceptions.UnknownSymbolException;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.DataSection;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.symbols.Symbol;
import com.tessera.modeling.compiler.symbols.SymbolKind;
import com.tessera.modeling.compiler.symbols.ValidatedModel;
import com.tessera.modeling.generator.eval.Bindings;
import com.tessera.modeling.generator.eval.ExpressionEvaluator;
import com.tessera.modeling.generator.eval.IndexBinding;
import com.tessera.modeling.generator.eval.ResolvedIndexing;
import com.tessera.modeling.generator.eval.TupleSet;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Materializes every set and parameter of a validated model, sequentially and in dependency
 * order, before any row is generated.
 *
 * <p>A parameter value comes from, in order: the model's {@code :=} definition, an explicit
 * data entry, the data statement's {@code default}, the declaration's {@code default}. A domain
 * tuple with none of these is recorded as unvalued: reading it raises a
 * {@link MissingParameterValueException} at the reference, and {@link ModelData#requireComplete()}
 * reports any left over once generation is done.
 */
public final class DataBinder {

    private static final Logger logger = Logger.getLogger(DataBinder.class.getName());

    private final ValidatedModel model;
    private final ModelData data = new ModelData();
    private final ExpressionEvaluator evaluator;
    private final Map<String, DataSection.SetData> setData = new HashMap<>();
    private final Map<String, SuppliedValues> parameterData = new HashMap<>();

    private DataBinder(ValidatedModel model) {
        this.model = model;
        this.evaluator = new ExpressionEvaluator(model.symbols(), data, null);
    }

    public static ModelData bind(ValidatedModel model, DataSection section) {
        return new DataBinder(model).run(section);
    }

    /**
     * Explicit entries for one parameter plus an optional data-level default.
     */
    private static final class SuppliedValues {
        final Object2ObjectLinkedOpenHashMap<Tuple, DataSection.Value> entries = new Object2ObjectLinkedOpenHashMap<>();
        DataSection.Value defaultValue;
    }

    private ModelData run(DataSection section) {
        for (DataSection.Statement statement : section.statements()) {
            collect(statement);
        }
        for (Declaration declaration : model.evaluationOrder()) {
            if (declaration instanceof Declaration.SetDecl set) {
                bindSet(set);
            } else if (declaration instanceof Declaration.ParamDecl param) {
                bindParameter(param);
            }
        }
        logger.fine(() -> String.format("Bound %d sets and %d parameters",
                data.sets().size(), data.parameters().size()));
        return data;
    }

    // ------------------------------------------------------------------------
    // Grouping raw data by declaration shape
    // ------------------------------------------------------------------------

    private void collect(DataSection.Statement statement) {
        if (statement instanceof DataSection.SetData set) {
            requireKind(set.name(), SymbolKind.SET, set.location());
            if (setData.putIfAbsent(set.name(), set) != null) {
                throw new InvalidDataException("Data for set " + set.name() + " is given twice", set.location());
            }
        } else if (statement instanceof DataSection.ParamData param) {
            Symbol symbol = requireKind(param.name(), SymbolKind.PARAMETER, param.location());
            SuppliedValues supplied = parameterData.computeIfAbsent(param.name(), n -> new SuppliedValues());
            if (param.defaultValue() != null) {
                supplied.defaultValue = new DataSection.Value(param.defaultValue(), param.location());
            }
            addFlat(symbol, param.flat(), supplied, param.location());
            for (DataSection.Table table : param.tables()) {
                addTable(symbol, table, supplied);
            }
        } else if (statement instanceof DataSection.TabbingData tabbing) {
            addTabbing(tabbing);
        }
    }

    private Symbol requireKind(String name, SymbolKind kind, SourceLocation location) {
        Symbol symbol = model.symbols().lookup(name)
                .orElseThrow(() -> new UnknownSymbolException(name, location));
        if (!symbol.is(kind)) {
            throw new InvalidDataException("'" + name + "' is a " + symbol.kind().displayName()
                    + " and cannot be given " + kind.displayName() + " data", location);
        }
        return symbol;
    }

    private void addFlat(Symbol symbol, List<DataSection.Value> flat, SuppliedValues supplied,
                         SourceLocation location) {
        int recordSize = symbol.arity() + 1;
        if (flat.size() % recordSize != 0) {
            throw new InvalidDataException("Data for " + symbol.name() + " has " + flat.size()
                    + " values, expected a multiple of " + recordSize, location);
        }
        for (int start = 0; start < flat.size(); start += recordSize) {
            Tuple key = keyOf(flat.subList(start, start + symbol.arity()));
            put(symbol, supplied, key, flat.get(start + symbol.arity()));
        }
    }

    private void addTable(Symbol symbol, DataSection.Table table, SuppliedValues supplied) {
        if (symbol.arity() < 2) {
            throw new InvalidDataException("Table data needs a parameter with at least two indices, "
                    + symbol.name() + " has " + symbol.arity(), table.location());
        }
        int rowKeyWidth = symbol.arity() - 1;
        int rowSize = rowKeyWidth + table.columnKeys().size();
        if (table.cells().size() % rowSize != 0) {
            throw new InvalidDataException("Table for " + symbol.name() + " has incomplete rows; each row needs "
                    + rowSize + " values", table.location());
        }
        for (int start = 0; start < table.cells().size(); start += rowSize) {
            Tuple rowKey = keyOf(table.cells().subList(start, start + rowKeyWidth));
            for (int c = 0; c < table.columnKeys().size(); c++) {
                DataSection.Value cell = table.cells().get(start + rowKeyWidth + c);
                if (!cell.isMissing()) {
                    put(symbol, supplied, rowKey.concat(Tuple.of(table.columnKeys().get(c))), cell);
                }
            }
        }
    }

    private void addTabbing(DataSection.TabbingData tabbing) {
        List<Symbol> symbols = new ArrayList<>();
        for (String name : tabbing.parameters()) {
            symbols.add(requireKind(name, SymbolKind.PARAMETER, tabbing.location()));
        }
        int arity = symbols.get(0).arity();
        for (Symbol symbol : symbols) {
            if (symbol.arity() != arity) {
                throw new InvalidDataException("Parameters " + tabbing.parameters()
                        + " do not share one index shape", tabbing.location());
            }
        }
        int recordSize = arity + symbols.size();
        if (tabbing.flat().size() % recordSize != 0) {
            throw new InvalidDataException("Tabbing data has " + tabbing.flat().size()
                    + " values, expected a multiple of " + recordSize, tabbing.location());
        }
        for (int start = 0; start < tabbing.flat().size(); start += recordSize) {
            Tuple key = keyOf(tabbing.flat().subList(start, start + arity));
            for (int p = 0; p < symbols.size(); p++) {
                SuppliedValues supplied = parameterData.computeIfAbsent(symbols.get(p).name(),
                        n -> new SuppliedValues());
                put(symbols.get(p), supplied, key, tabbing.flat().get(start + arity + p));
            }
        }
    }

    private static Tuple keyOf(List<DataSection.Value> values) {
        List<Atom> atoms = new ArrayList<>(values.size());
        for (DataSection.Value value : values) {
            if (value.isMissing()) {
                throw new InvalidDataException("'.' cannot be used as an index value", value.location());
            }
            atoms.add(value.atom());
        }
        return new Tuple(atoms);
    }

    private static void put(Symbol symbol, SuppliedValues supplied, Tuple key, DataSection.Value value) {
        if (value.isMissing()) {
            return;
        }
        if (supplied.entries.putIfAbsent(key, value) != null) {
            throw new InvalidDataException("Value for " + key.format(symbol.name()) + " is given twice",
                    value.location());
        }
    }

    // ------------------------------------------------------------------------
    // Sets
    // ------------------------------------------------------------------------

    private void bindSet(Declaration.SetDecl set) {
        DataSection.SetData supplied = setData.get(set.name());
        if (set.definition() != null) {
            if (supplied != null) {
                throw new InvalidDataException("Set " + set.name()
                        + " is defined in the model and cannot also be given data", supplied.location());
            }
            data.putSet(set.name(), evaluator.sets().resolve(set.definition(), Bindings.EMPTY));
            return;
        }
        if (supplied == null) {
            throw new MissingParameterValueException(set.name(), Tuple.EMPTY, set.location());
        }
        int dimension = model.symbols().resolve(set.name()).dimension();
        TupleSet.Builder members = TupleSet.builder();
        for (Tuple member : groupMembers(set.name(), dimension, supplied)) {
            if (!members.add(member)) {
                throw new InvalidDataException("Duplicate member " + member + " in set " + set.name(),
                        supplied.location());
            }
        }
        data.putSet(set.name(), members.build());
    }

    private static List<Tuple> groupMembers(String name, int dimension, DataSection.SetData supplied) {
        List<Tuple> members = new ArrayList<>();
        List<Atom> pending = new ArrayList<>();
        for (DataSection.Item item : supplied.items()) {
            if (item.tuple().arity() == dimension) {
                if (!pending.isEmpty()) {
                    throw new InvalidDataException("Incomplete member of set " + name, item.location());
                }
                members.add(item.tuple());
            } else if (item.tuple().arity() == 1) {
                pending.add(item.tuple().get(0));
                if (pending.size() == dimension) {
                    members.add(new Tuple(pending));
                    pending = new ArrayList<>();
                }
            } else {
                throw new InvalidDataException("Set " + name + " has dimension " + dimension
                        + " but member " + item.tuple() + " has " + item.tuple().arity(), item.location());
            }
        }
        if (!pending.isEmpty()) {
            throw new InvalidDataException("Set " + name + " data ends with an incomplete member "
                    + new Tuple(pending), supplied.location());
        }
        return members;
    }

    // ------------------------------------------------------------------------
    // Parameters
    // ------------------------------------------------------------------------

    private void bindParameter(Declaration.ParamDecl param) {
        SuppliedValues supplied = parameterData.getOrDefault(param.name(), new SuppliedValues());
        if (param.definition() != null && !supplied.entries.isEmpty()) {
            throw new InvalidDataException("Parameter " + param.name()
                    + " is defined in the model and cannot also be given data",
                    supplied.entries.values().iterator().next().location());
        }

        ResolvedIndexing domain = evaluator.sets().resolve(param.indexing(), Bindings.EMPTY);
        Object2ObjectLinkedOpenHashMap<Tuple, Atom> values = new Object2ObjectLinkedOpenHashMap<>(domain.size());
        List<Tuple> unvalued = new ObjectArrayList<>();
        for (IndexBinding member : domain.bindings()) {
            Atom value;
            SourceLocation location;
            DataSection.Value entry = supplied.entries.get(member.tuple());
            if (param.definition() != null) {
                value = evaluator.evaluateAtom(param.definition(), member.bindings());
                location = param.location();
            } else if (entry != null) {
                value = entry.atom();
                location = entry.location();
            } else if (supplied.defaultValue != null) {
                value = supplied.defaultValue.atom();
                location = supplied.defaultValue.location();
            } else if (param.defaultValue() != null) {
                value = evaluator.evaluateAtom(param.defaultValue(), member.bindings());
                location = param.location();
            } else {
                unvalued.add(member.tuple());
                continue;
            }
            check(param, member, value, location);
            values.put(member.tuple(), value);
        }

        for (Map.Entry<Tuple, DataSection.Value> entry : supplied.entries.entrySet()) {
            if (!values.containsKey(entry.getKey())) {
                throw new InvalidDataException(entry.getKey().format(param.name()) + " is outside the domain of "
                        + param.name(), entry.getValue().location());
            }
        }
        data.putParameter(new ParameterTable(param.name(), domain.keys().size(), param.location(),
                values, unvalued));
    }

    private void check(Declaration.ParamDecl param, IndexBinding member, Atom value, SourceLocation location) {
        String label = member.tuple().format(param.name());
        if (!param.symbolic() && !value.isNumeric()) {
            throw new InvalidDataException("Parameter " + label + " must be numeric, got '" + value.symbol() + "'",
                    location);
        }
        if (param.integer() && !value.isIntegral()) {
            throw new InvalidDataException("Parameter " + label + " must be integer, got " + value, location);
        }
        if (param.binary() && !(value.isNumeric() && (value.number() == 0.0 || value.number() == 1.0))) {
            throw new InvalidDataException("Parameter " + label + " must be binary, got " + value, location);
        }
        for (Declaration.Check restriction : param.checks()) {
            Atom bound = evaluator.evaluateAtom(restriction.bound(), member.bindings());
            if (!ExpressionEvaluator.compare(restriction.op(), value, bound)) {
                throw new InvalidDataException("Parameter " + label + " = " + value + " violates "
                        + restriction.op().symbol() + " " + bound, location);
            }
        }
    }
}
