package com.tessera.modeling.compiler.ast;

import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.ObjectiveDirection;
import com.tessera.modeling.api.model.RowSense;
import com.tessera.modeling.api.model.VariableDomain;

import java.util.List;

/**
 * Model-section declarations. Optional parts are null when absent. The {@code handle}
 * is the declaration's position in its {@link ModelDeclarations}.
 */
public sealed interface Declaration {

    int handle();

    String name();

    SourceLocation location();

    /**
     * Indexing header, or null for scalar declarations.
     */
    Indexing indexing();

    default String kindName() {
        return getClass().getSimpleName().replace("Decl", "").toLowerCase();
    }

    /**
     * {@code set S [dimen n] [:= e]}.
     */
    record SetDecl(int handle, String name, int dimen, SetExpr definition, SourceLocation location)
            implements Declaration {
        @Override
        public Indexing indexing() {
            return null;
        }
    }

    /**
     * Relational restriction on parameter values, e.g. {@code >= 0}.
     */
    record Check(Expr.BinaryOp op, Expr bound) {
    }

    record ParamDecl(int handle, String name, Indexing indexing, boolean symbolic, boolean integer, boolean binary,
                     List<Check> checks, Expr defaultValue, Expr definition, SourceLocation location)
            implements Declaration {
        public ParamDecl {
            checks = List.copyOf(checks);
        }
    }

    /**
     * {@code lower} and {@code upper} are null when not stated; a fixed variable
     * ({@code = e}) has both set to the same expression.
     */
    record VarDecl(int handle, String name, Indexing indexing, VariableDomain domain,
                   Expr lower, Expr upper, SourceLocation location) implements Declaration {
    }

    record ConstraintDecl(int handle, String name, Indexing indexing, Expr lhs, RowSense sense, Expr rhs,
                          SourceLocation location) implements Declaration {
        @Override
        public String kindName() {
            return "constraint";
        }
    }

    record ObjectiveDecl(int handle, String name, ObjectiveDirection direction, Expr expression,
                         SourceLocation location) implements Declaration {
        @Override
        public Indexing indexing() {
            return null;
        }

        @Override
        public String kindName() {
            return "objective";
        }
    }
}
