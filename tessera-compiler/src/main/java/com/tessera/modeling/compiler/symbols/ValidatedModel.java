package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.ast.ModelDeclarations;

import java.util.List;

/**
 * A model that passed validation.
 *
 * @param evaluationOrder sets and parameters ordered so every definition comes after what it depends on
 */
public record ValidatedModel(ModelDeclarations declarations, SymbolTable symbols, List<Declaration> evaluationOrder) {

    public ValidatedModel {
        evaluationOrder = List.copyOf(evaluationOrder);
    }

    public <T extends Declaration> List<T> ofType(Class<T> type) {
        return declarations.ofType(type);
    }

    public Declaration.ObjectiveDecl objective() {
        return declarations.objective().orElseThrow();
    }
}
