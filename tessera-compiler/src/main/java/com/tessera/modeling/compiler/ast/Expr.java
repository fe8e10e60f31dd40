package com.tessera.modeling.compiler.ast;

import com.tessera.modeling.api.exceptions.SourceLocation;

import java.util.List;

/**
 * Scalar expression tree. Every node carries the location of its first token.
 */
public sealed interface Expr {

    SourceLocation location();

    <R, C> R accept(Visitor<R, C> visitor, C context);

    enum UnaryOp { NEGATE, PLUS, NOT }

    enum BinaryOp {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("mod"), INT_DIVIDE("div"), POWER("^"),
        EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">="),
        AND("and"), OR("or");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return ordinal() >= EQ.ordinal() && ordinal() <= GE.ordinal();
        }
    }

    enum Function {
        ABS, MIN, MAX, FLOOR, CEIL;

        public static Function byName(String name) {
            for (Function f : values()) {
                if (f.name().equalsIgnoreCase(name)) {
                    return f;
                }
            }
            return null;
        }
    }

    record NumberLiteral(double value, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitNumber(this, context);
        }
    }

    record StringLiteral(String value, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitString(this, context);
        }
    }

    /**
     * A name, optionally subscripted: a dummy index, a parameter or a variable.
     */
    record Reference(String name, List<Expr> subscripts, SourceLocation location) implements Expr {
        public Reference {
            subscripts = List.copyOf(subscripts);
        }

        public boolean isSubscripted() {
            return !subscripts.isEmpty();
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitReference(this, context);
        }
    }

    record Unary(UnaryOp op, Expr operand, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitUnary(this, context);
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitBinary(this, context);
        }
    }

    record Sum(Indexing indexing, Expr body, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitSum(this, context);
        }
    }

    /**
     * {@code if c then a [else b]}; a missing else branch evaluates to zero.
     */
    record Conditional(Expr condition, Expr whenTrue, Expr whenFalse, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitConditional(this, context);
        }
    }

    /**
     * {@code e in S} or {@code (e1, e2) not in S}.
     */
    record Membership(List<Expr> elements, SetExpr set, boolean negated, SourceLocation location) implements Expr {
        public Membership {
            elements = List.copyOf(elements);
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitMembership(this, context);
        }
    }

    record Cardinality(SetExpr set, SourceLocation location) implements Expr {
        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitCardinality(this, context);
        }
    }

    record FunctionCall(Function function, List<Expr> arguments, SourceLocation location) implements Expr {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitFunction(this, context);
        }
    }

    interface Visitor<R, C> {
        R visitNumber(NumberLiteral expr, C context);

        R visitString(StringLiteral expr, C context);

        R visitReference(Reference expr, C context);

        R visitUnary(Unary expr, C context);

        R visitBinary(Binary expr, C context);

        R visitSum(Sum expr, C context);

        R visitConditional(Conditional expr, C context);

        R visitMembership(Membership expr, C context);

        R visitCardinality(Cardinality expr, C context);

        R visitFunction(FunctionCall expr, C context);
    }
}
