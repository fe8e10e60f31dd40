package com.tessera.modeling.compiler.ast;

import java.util.List;
import java.util.Optional;

/**
 * Parsed model: declarations in source order plus any data block embedded in the model text.
 */
public record ModelDeclarations(List<Declaration> declarations, DataSection data) {

    public ModelDeclarations {
        declarations = List.copyOf(declarations);
        for (int i = 0; i < declarations.size(); i++) {
            if (declarations.get(i).handle() != i) {
                throw new IllegalArgumentException("Declaration handle " + declarations.get(i).handle()
                        + " does not match position " + i);
            }
        }
    }

    public Declaration get(int handle) {
        return declarations.get(handle);
    }

    public <T extends Declaration> List<T> ofType(Class<T> type) {
        return declarations.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public Optional<Declaration.ObjectiveDecl> objective() {
        return ofType(Declaration.ObjectiveDecl.class).stream().findFirst();
    }

    public ModelDeclarations withData(DataSection extra) {
        return new ModelDeclarations(declarations, data.merge(extra));
    }
}
