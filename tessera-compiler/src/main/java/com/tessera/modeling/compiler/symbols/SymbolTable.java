package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.api.exceptions.DuplicateSymbolException;
import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.exceptions.UnknownSymbolException;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Flat global namespace of sets, parameters, variables, constraints and objectives.
 *
 * <p>Symbols are stored in declaration order and addressed by name through an index map.
 * Once validation has finished the table is only read, so it may be shared by generator
 * worker threads.
 */
public final class SymbolTable {

    private final List<Symbol> symbols = new ArrayList<>();
    private final Object2IntOpenHashMap<String> byName = new Object2IntOpenHashMap<>();

    public SymbolTable() {
        byName.defaultReturnValue(-1);
    }

    /**
     * Binds a new name.
     *
     * @throws DuplicateSymbolException if the name is already bound, whatever its kind
     */
    public Symbol declare(String name, SymbolKind kind, int arity, int dimension, int handle,
                          SourceLocation location) {
        int existing = byName.getInt(name);
        if (existing >= 0) {
            Symbol previous = symbols.get(existing);
            throw new DuplicateSymbolException(name, previous.kind().displayName() + " at " + previous.location(),
                    kind.displayName(), location);
        }
        Symbol symbol = new Symbol(name, kind, arity, dimension, handle, location);
        byName.put(name, symbols.size());
        symbols.add(symbol);
        return symbol;
    }

    public Symbol declare(String name, SymbolKind kind, int arity) {
        return declare(name, kind, arity, kind == SymbolKind.SET ? 1 : 0, -1, null);
    }

    /**
     * @throws UnknownSymbolException if the name was never declared
     */
    public Symbol resolve(String name, SourceLocation location) {
        int index = byName.getInt(name);
        if (index < 0) {
            throw new UnknownSymbolException(name, location);
        }
        return symbols.get(index);
    }

    public Symbol resolve(String name) {
        return resolve(name, null);
    }

    public Optional<Symbol> lookup(String name) {
        int index = byName.getInt(name);
        return index < 0 ? Optional.empty() : Optional.of(symbols.get(index));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    public int size() {
        return symbols.size();
    }
}
