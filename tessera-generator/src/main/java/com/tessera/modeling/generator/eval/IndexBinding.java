package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.model.Tuple;

/**
 * One member of an expanded indexing header: the header tuple and the bindings its body sees.
 */
public record IndexBinding(Tuple tuple, Bindings bindings) {
}
