package com.tessera.modeling.compiler.ast;

import com.tessera.modeling.api.exceptions.SourceLocation;

import java.util.List;

/**
 * Set expression tree.
 */
public sealed interface SetExpr {

    SourceLocation location();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    enum SetOp { UNION, DIFF, INTER, CROSS }

    record NamedSet(String name, SourceLocation location) implements SetExpr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitNamed(this, context);
        }
    }

    /**
     * {@code {a, b, (c, d)}}; each element is a tuple of scalar expressions.
     */
    record Enumeration(List<List<Expr>> elements, SourceLocation location) implements SetExpr {
        public Enumeration {
            elements = elements.stream().map(List::copyOf).toList();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitEnumeration(this, context);
        }
    }

    /**
     * {@code from .. to [by step]}; {@code step} is null when omitted.
     */
    record Range(Expr from, Expr to, Expr step, SourceLocation location) implements SetExpr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitRange(this, context);
        }
    }

    /**
     * {@code {i in S, j in T : filter}} used as a set.
     */
    record Builder(Indexing indexing, SourceLocation location) implements SetExpr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitBuilder(this, context);
        }
    }

    record Operation(SetOp op, SetExpr left, SetExpr right, SourceLocation location) implements SetExpr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitOperation(this, context);
        }
    }

    interface Visitor<R, C> {
        R visitNamed(NamedSet set, C context);

        R visitEnumeration(Enumeration set, C context);

        R visitRange(Range set, C context);

        R visitBuilder(Builder set, C context);

        R visitOperation(Operation set, C context);
    }
}
