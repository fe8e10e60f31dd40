package com.tessera.modeling.compiler.ast;

import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw data statements. Grouping of flat values into tuples depends on declared dimensions
 * and happens when the data is bound to the model.
 */
public record DataSection(List<Statement> statements) {

    public static final DataSection EMPTY = new DataSection(List.of());

    public DataSection {
        statements = List.copyOf(statements);
    }

    public DataSection merge(DataSection other) {
        if (other == null || other.statements.isEmpty()) {
            return this;
        }
        List<Statement> merged = new ArrayList<>(statements);
        merged.addAll(other.statements);
        return new DataSection(merged);
    }

    /**
     * A data value; {@code atom} is null for the {@code .} placeholder.
     */
    public record Value(Atom atom, SourceLocation location) {
        public boolean isMissing() {
            return atom == null;
        }
    }

    /**
     * A set member as written: a parenthesized tuple, or a single value as a 1-tuple.
     */
    public record Item(Tuple tuple, SourceLocation location) {
    }

    /**
     * {@code : c1 c2 :=} followed by rows of key values and one value per column.
     */
    public record Table(List<Atom> columnKeys, List<Value> cells, SourceLocation location) {
        public Table {
            columnKeys = List.copyOf(columnKeys);
            cells = List.copyOf(cells);
        }
    }

    public sealed interface Statement {
        SourceLocation location();
    }

    public record SetData(String name, List<Item> items, SourceLocation location) implements Statement {
        public SetData {
            items = List.copyOf(items);
        }
    }

    /**
     * {@code param p [default v] := k v ... [: c1 c2 := r v v ...];}. {@code defaultValue} may be null.
     */
    public record ParamData(String name, Atom defaultValue, List<Value> flat, List<Table> tables,
                            SourceLocation location) implements Statement {
        public ParamData {
            flat = List.copyOf(flat);
            tables = List.copyOf(tables);
        }
    }

    /**
     * {@code param : p q := k v w ...;} where each record is a key followed by one value per parameter.
     */
    public record TabbingData(List<String> parameters, List<Value> flat, SourceLocation location)
            implements Statement {
        public TabbingData {
            parameters = List.copyOf(parameters);
            flat = List.copyOf(flat);
        }
    }
}
