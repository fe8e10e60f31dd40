/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.Expr;
import com.tessera.modeling.compiler.symbols.Symbol;
import com.tessera.modeling.compiler.symbols.SymbolKind;
import com.tessera.modeling.compiler.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates scalar expressions under a set of dummy bindings.
 *
 * <p>Numeric results are constant {@link LinearForm}s, so a single evaluation path serves
 * parameter definitions, filters and constraint bodies. Products of two non-constant forms
 * and divisions by a non-constant form are rejected as non-linear.
 *
 * <p>Instances are stateless apart from their read-only inputs and may be shared across threads
 * once the value source is fully materialized.
 */
public final class ExpressionEvaluator implements Expr.Visitor<Value, Bindings> {

    private final SymbolTable symbols;
    private final ValueSource values;
    private final VariableIndex variables;
    private final SetResolver sets;

    /**
     * @param variables allocated columns, or null while sets and parameters are being bound
     */
    public ExpressionEvaluator(SymbolTable symbols, ValueSource values, VariableIndex variables) {
        this.symbols = symbols;
        this.values = values;
        this.variables = variables;
        this.sets = new SetResolver(values, this);
    }

    public SetResolver sets() {
        return sets;
    }

    /**
     * Evaluates a numeric expression to a linear form.
     */
    public LinearForm evaluate(Expr expr, Bindings bindings) {
        return linear(expr.accept(this, bindings), expr.location());
    }

    /**
     * Evaluates an expression that must not depend on decision variables.
     */
    public Atom evaluateAtom(Expr expr, Bindings bindings) {
        return toAtom(expr.accept(this, bindings), expr.location());
    }

    public double evaluateNumber(Expr expr, Bindings bindings) {
        Atom atom = evaluateAtom(expr, bindings);
        if (!atom.isNumeric()) {
            throw new InstanceBuildException("Expected a number but got symbol '" + atom.symbol() + "'",
                    expr.location());
        }
        return atom.number();
    }

    public boolean evaluatePredicate(Expr expr, Bindings bindings) {
        return evaluateNumber(expr, bindings) != 0.0;
    }

    // ------------------------------------------------------------------------
    // Conversions
    // ------------------------------------------------------------------------

    private static LinearForm linear(Value value, SourceLocation location) {
        if (value instanceof SymbolValue symbol) {
            throw new InstanceBuildException("Symbolic value '" + symbol.symbol()
                    + "' cannot be used in arithmetic", location);
        }
        return (LinearForm) value;
    }

    private static Atom toAtom(Value value, SourceLocation location) {
        if (value instanceof SymbolValue symbol) {
            return Atom.of(symbol.symbol());
        }
        LinearForm form = (LinearForm) value;
        if (!form.isConstant()) {
            throw new InstanceBuildException("Expression depends on decision variables (" + form + ")", location);
        }
        return Atom.of(form.constant());
    }

    private static Value fromAtom(Atom atom) {
        return atom.isNumeric() ? LinearForm.constant(atom.number()) : new SymbolValue(atom.symbol());
    }

    private static Value bool(boolean value) {
        return LinearForm.constant(value ? 1.0 : 0.0);
    }

    public Tuple evaluateTuple(List<Expr> exprs, Bindings bindings) {
        if (exprs.size() == 1) {
            return Tuple.of(evaluateAtom(exprs.get(0), bindings));
        }
        List<Atom> atoms = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            atoms.add(evaluateAtom(expr, bindings));
        }
        return new Tuple(atoms);
    }

    // ------------------------------------------------------------------------
    // Visitor
    // ------------------------------------------------------------------------

    @Override
    public Value visitNumber(Expr.NumberLiteral expr, Bindings bindings) {
        return LinearForm.constant(expr.value());
    }

    @Override
    public Value visitString(Expr.StringLiteral expr, Bindings bindings) {
        return new SymbolValue(expr.value());
    }

    @Override
    public Value visitReference(Expr.Reference expr, Bindings bindings) {
        if (!expr.isSubscripted()) {
            Atom bound = bindings.lookup(expr.name());
            if (bound != null) {
                return fromAtom(bound);
            }
        }
        Symbol symbol = symbols.resolve(expr.name(), expr.location());
        Tuple key = expr.isSubscripted() ? evaluateTuple(expr.subscripts(), bindings) : Tuple.EMPTY;
        if (symbol.is(SymbolKind.PARAMETER)) {
            return fromAtom(values.parameter(expr.name(), key, expr.location()));
        }
        if (symbol.is(SymbolKind.VARIABLE)) {
            VariableRef variable = new VariableRef(expr.name(), key);
            if (variables == null) {
                throw new InstanceBuildException("Decision variable " + variable.label()
                        + " cannot be evaluated here", expr.location());
            }
            if (!variables.contains(variable)) {
                throw new InstanceBuildException("Variable " + variable.label()
                        + " is referenced outside its declared domain", expr.location());
            }
            return LinearForm.of(variable);
        }
        throw new InstanceBuildException("'" + expr.name() + "' is a " + symbol.kind().displayName()
                + " and has no value", expr.location());
    }

    @Override
    public Value visitUnary(Expr.Unary expr, Bindings bindings) {
        return switch (expr.op()) {
            case NEGATE -> evaluate(expr.operand(), bindings).scale(-1.0);
            case PLUS -> evaluate(expr.operand(), bindings);
            case NOT -> bool(!evaluatePredicate(expr.operand(), bindings));
        };
    }

    @Override
    public Value visitBinary(Expr.Binary expr, Bindings bindings) {
        switch (expr.op()) {
            case AND:
                return bool(evaluatePredicate(expr.left(), bindings) && evaluatePredicate(expr.right(), bindings));
            case OR:
                return bool(evaluatePredicate(expr.left(), bindings) || evaluatePredicate(expr.right(), bindings));
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE:
                return bool(compare(expr.op(), evaluateAtom(expr.left(), bindings),
                        evaluateAtom(expr.right(), bindings)));
            default:
                break;
        }

        LinearForm result = arithmetic(expr, evaluate(expr.left(), bindings), evaluate(expr.right(), bindings));
        if (Double.isNaN(result.constant())) {
            throw new InstanceBuildException("Operator '" + expr.op().symbol()
                    + "' does not yield a number here", expr.location());
        }
        return result;
    }

    private static LinearForm arithmetic(Expr.Binary expr, LinearForm left, LinearForm right) {
        switch (expr.op()) {
            case ADD:
                return left.plus(right);
            case SUBTRACT:
                return left.minus(right);
            case MULTIPLY:
                if (left.isConstant()) {
                    return right.scale(left.constant());
                }
                if (right.isConstant()) {
                    return left.scale(right.constant());
                }
                throw new InstanceBuildException("Non-linear term: product of (" + left + ") and (" + right + ")",
                        expr.location());
            case DIVIDE:
                return left.scale(1.0 / divisor(right, expr));
            default:
                break;
        }

        if (!left.isConstant() || !right.isConstant()) {
            throw new InstanceBuildException("Operator '" + expr.op().symbol()
                    + "' requires constant operands", expr.location());
        }
        double a = left.constant();
        double b = right.constant();
        return switch (expr.op()) {
            case MODULO -> LinearForm.constant(a - divisor(right, expr) * Math.floor(a / b));
            case INT_DIVIDE -> LinearForm.constant(Math.floor(a / divisor(right, expr)));
            case POWER -> LinearForm.constant(Math.pow(a, b));
            default -> throw new IllegalStateException("Unhandled operator " + expr.op());
        };
    }

    private static double divisor(LinearForm right, Expr.Binary expr) {
        if (!right.isConstant()) {
            throw new InstanceBuildException("Non-linear term: division by (" + right + ")", expr.location());
        }
        if (right.constant() == 0.0) {
            throw new InstanceBuildException("Division by zero", expr.location());
        }
        return right.constant();
    }

    /**
     * Numbers compare numerically, symbols lexically; a number never equals a symbol.
     */
    public static boolean compare(Expr.BinaryOp op, Atom left, Atom right) {
        int order = left.compareTo(right);
        return switch (op) {
            case EQ -> left.equals(right);
            case NE -> !left.equals(right);
            case LT -> order < 0;
            case LE -> order <= 0;
            case GT -> order > 0;
            case GE -> order >= 0;
            default -> throw new IllegalArgumentException("Not a comparison: " + op);
        };
    }

    @Override
    public Value visitSum(Expr.Sum expr, Bindings bindings) {
        LinearForm.Builder total = new LinearForm.Builder();
        for (IndexBinding member : sets.resolve(expr.indexing(), bindings).bindings()) {
            total.add(evaluate(expr.body(), member.bindings()), 1.0);
        }
        return total.build();
    }

    @Override
    public Value visitConditional(Expr.Conditional expr, Bindings bindings) {
        if (evaluatePredicate(expr.condition(), bindings)) {
            return expr.whenTrue().accept(this, bindings);
        }
        return expr.whenFalse() == null ? LinearForm.ZERO : expr.whenFalse().accept(this, bindings);
    }

    @Override
    public Value visitMembership(Expr.Membership expr, Bindings bindings) {
        Tuple element = evaluateTuple(expr.elements(), bindings);
        boolean member = sets.resolve(expr.set(), bindings).contains(element);
        return bool(member != expr.negated());
    }

    @Override
    public Value visitCardinality(Expr.Cardinality expr, Bindings bindings) {
        return LinearForm.constant(sets.resolve(expr.set(), bindings).size());
    }

    @Override
    public Value visitFunction(Expr.FunctionCall expr, Bindings bindings) {
        double[] args = new double[expr.arguments().size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = evaluateNumber(expr.arguments().get(i), bindings);
        }
        double result = switch (expr.function()) {
            case ABS -> Math.abs(args[0]);
            case FLOOR -> Math.floor(args[0]);
            case CEIL -> Math.ceil(args[0]);
            case MIN -> {
                double min = args[0];
                for (double a : args) min = Math.min(min, a);
                yield min;
            }
            case MAX -> {
                double max = args[0];
                for (double a : args) max = Math.max(max, a);
                yield max;
            }
        };
        return LinearForm.constant(result);
    }
}
