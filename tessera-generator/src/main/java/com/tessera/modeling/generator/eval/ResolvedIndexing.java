package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.model.Tuple;

import java.util.List;

/**
 * Expanded indexing header.
 *
 * @param keys     one label key per tuple position: the dummy name, or {@code _k} for anonymous positions
 * @param bindings header members in generation order
 */
public record ResolvedIndexing(List<String> keys, List<IndexBinding> bindings) {

    public static final ResolvedIndexing SCALAR = new ResolvedIndexing(
            List.of(), List.of(new IndexBinding(Tuple.EMPTY, Bindings.EMPTY)));

    public ResolvedIndexing {
        keys = List.copyOf(keys);
        bindings = List.copyOf(bindings);
    }

    public int size() {
        return bindings.size();
    }
}
