package com.tessera.modeling.generator.data;

import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Values of one parameter over its whole domain, in domain order. Domain members that received
 * no value are kept aside as unvalued; reading one fails only when something actually uses it.
 */
public final class ParameterTable {

    private final String name;
    private final int arity;
    private final SourceLocation location;
    private final Object2ObjectLinkedOpenHashMap<Tuple, Atom> values;
    private final List<Tuple> unvalued;

    ParameterTable(String name, int arity, SourceLocation location,
                   Object2ObjectLinkedOpenHashMap<Tuple, Atom> values, List<Tuple> unvalued) {
        this.name = name;
        this.arity = arity;
        this.location = location;
        this.values = values;
        this.unvalued = List.copyOf(unvalued);
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    /**
     * @return the value, or null when the key is outside the parameter's domain or has no value
     */
    public Atom get(Tuple key) {
        return values.get(key);
    }

    /** Where the parameter is declared. */
    public SourceLocation location() {
        return location;
    }

    /**
     * @return domain members with no value, in domain order
     */
    public List<Tuple> unvalued() {
        return unvalued;
    }

    public boolean isComplete() {
        return unvalued.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<Tuple, Atom> values() {
        return Collections.unmodifiableMap(values);
    }
}
