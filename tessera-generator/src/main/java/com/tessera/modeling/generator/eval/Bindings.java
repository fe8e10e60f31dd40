package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;

import java.util.List;

/**
 * Immutable chain of dummy-index assignments. Binding a name shadows any outer binding
 * of the same name; the outer chain is shared, never copied.
 */
public final class Bindings {

    public static final Bindings EMPTY = new Bindings(null, null, null);

    private final String name;
    private final Atom value;
    private final Bindings parent;

    private Bindings(String name, Atom value, Bindings parent) {
        this.name = name;
        this.value = value;
        this.parent = parent;
    }

    public Bindings bind(String dummy, Atom atom) {
        return new Bindings(dummy, atom, this);
    }

    public Bindings bindAll(List<String> dummies, Tuple tuple) {
        if (dummies.size() != tuple.arity()) {
            throw new IllegalArgumentException("Cannot bind " + dummies + " to " + tuple);
        }
        Bindings result = this;
        for (int i = 0; i < dummies.size(); i++) {
            result = result.bind(dummies.get(i), tuple.get(i));
        }
        return result;
    }

    /**
     * @return the bound value, or null when the name is not a dummy in scope
     */
    public Atom lookup(String dummy) {
        for (Bindings b = this; b.parent != null; b = b.parent) {
            if (b.name.equals(dummy)) {
                return b.value;
            }
        }
        return null;
    }

    public boolean isBound(String dummy) {
        return lookup(dummy) != null;
    }

    public boolean isEmpty() {
        return parent == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Bindings b = this; b.parent != null; b = b.parent) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(b.name).append('=').append(b.value);
        }
        return sb.append('}').toString();
    }
}
