/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.api.exceptions.CyclicDefinitionException;
import com.tessera.modeling.api.exceptions.InstanceBuildException;
import com.tessera.modeling.api.exceptions.ModelSyntaxException;
import com.tessera.modeling.api.exceptions.ShapeMismatchException;
import com.tessera.modeling.api.exceptions.SourceLocation;
import com.tessera.modeling.api.exceptions.UnknownSymbolException;
import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.ast.Expr;
import com.tessera.modeling.compiler.ast.Indexing;
import com.tessera.modeling.compiler.ast.ModelDeclarations;
import com.tessera.modeling.compiler.ast.SetExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Single validation pass over a parsed model, run before any set or expression is resolved.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>every name is declared once ({@code DuplicateSymbolException});</li>
 *   <li>set and parameter definitions are acyclic ({@code CyclicDefinitionException});</li>
 *   <li>every reference names a declared symbol or a dummy in scope ({@code UnknownSymbolException});</li>
 *   <li>subscript counts and tuple widths agree with declarations ({@code ShapeMismatchException});</li>
 *   <li>decision variables only appear in constraint and objective bodies;</li>
 *   <li>exactly one objective is declared.</li>
 * </ol>
 */
public final class ModelValidator {

    private static final Logger logger = Logger.getLogger(ModelValidator.class.getName());

    private final ModelDeclarations model;
    private final Map<String, Declaration> byName = new LinkedHashMap<>();
    private final Map<String, Integer> setDimensions = new HashMap<>();
    private SymbolTable symbols;

    private ModelValidator(ModelDeclarations model) {
        this.model = model;
    }

    public static ValidatedModel validate(ModelDeclarations model) {
        return new ModelValidator(model).run();
    }

    private ValidatedModel run() {
        SymbolTable names = new SymbolTable();
        for (Declaration declaration : model.declarations()) {
            names.declare(declaration.name(), kindOf(declaration), 0, 0, declaration.handle(), declaration.location());
            byName.put(declaration.name(), declaration);
        }

        List<Declaration> evaluationOrder = orderDefinitions();

        for (Declaration declaration : model.declarations()) {
            if (declaration instanceof Declaration.SetDecl set) {
                dimensionOf(set);
            }
        }

        symbols = new SymbolTable();
        for (Declaration declaration : model.declarations()) {
            SymbolKind kind = kindOf(declaration);
            int dimension = kind == SymbolKind.SET ? setDimensions.get(declaration.name()) : 0;
            symbols.declare(declaration.name(), kind, arityOf(declaration.indexing()), dimension,
                    declaration.handle(), declaration.location());
        }

        for (Declaration declaration : model.declarations()) {
            checkDeclaration(declaration);
        }

        if (model.objective().isEmpty()) {
            throw new InstanceBuildException("Model declares no objective");
        }

        logger.fine(() -> String.format("Validated %d declarations, %d set/parameter definitions",
                model.declarations().size(), evaluationOrder.size()));
        return new ValidatedModel(model, symbols, evaluationOrder);
    }

    private static SymbolKind kindOf(Declaration declaration) {
        if (declaration instanceof Declaration.SetDecl) return SymbolKind.SET;
        if (declaration instanceof Declaration.ParamDecl) return SymbolKind.PARAMETER;
        if (declaration instanceof Declaration.VarDecl) return SymbolKind.VARIABLE;
        if (declaration instanceof Declaration.ConstraintDecl) return SymbolKind.CONSTRAINT;
        return SymbolKind.OBJECTIVE;
    }

    // ------------------------------------------------------------------------
    // Definition graph
    // ------------------------------------------------------------------------

    private List<Declaration> orderDefinitions() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (Declaration declaration : model.declarations()) {
            if (isDefinition(declaration)) {
                List<String> dependencies = new ArrayList<>();
                for (String name : ReferenceCollector.referencesOf(declaration)) {
                    Declaration target = byName.get(name);
                    if (target != null && isDefinition(target)) {
                        dependencies.add(name);
                    }
                }
                edges.put(declaration.name(), dependencies);
            }
        }

        List<Declaration> order = new ArrayList<>();
        Set<String> done = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String name : edges.keySet()) {
            visit(name, edges, done, path, order);
        }
        return order;
    }

    private void visit(String name, Map<String, List<String>> edges, Set<String> done, List<String> path,
                       List<Declaration> order) {
        if (done.contains(name)) {
            return;
        }
        int onPath = path.indexOf(name);
        if (onPath >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
            cycle.add(name);
            throw new CyclicDefinitionException(cycle, byName.get(cycle.get(0)).location());
        }
        path.add(name);
        for (String dependency : edges.get(name)) {
            visit(dependency, edges, done, path, order);
        }
        path.remove(path.size() - 1);
        done.add(name);
        order.add(byName.get(name));
    }

    private static boolean isDefinition(Declaration declaration) {
        return declaration instanceof Declaration.SetDecl || declaration instanceof Declaration.ParamDecl;
    }

    // ------------------------------------------------------------------------
    // Dimensions
    // ------------------------------------------------------------------------

    private int dimensionOf(Declaration.SetDecl set) {
        Integer known = setDimensions.get(set.name());
        if (known != null) {
            return known;
        }
        int dimension = set.dimen() > 0 ? set.dimen() : 1;
        if (set.definition() != null) {
            int defined = dimensionOf(set.definition());
            if (set.dimen() > 0 && defined != set.dimen()) {
                throw new ShapeMismatchException(set.name(), set.dimen(), defined, set.location());
            }
            dimension = defined;
        }
        setDimensions.put(set.name(), dimension);
        return dimension;
    }

    private int dimensionOf(SetExpr set) {
        if (set instanceof SetExpr.NamedSet named) {
            return dimensionOf(requireSet(named.name(), named.location()));
        }
        if (set instanceof SetExpr.Enumeration enumeration) {
            if (enumeration.elements().isEmpty()) {
                return 1;
            }
            int width = enumeration.elements().get(0).size();
            for (List<Expr> element : enumeration.elements()) {
                if (element.size() != width) {
                    throw new ShapeMismatchException("set literal", width, element.size(), enumeration.location());
                }
            }
            return width;
        }
        if (set instanceof SetExpr.Range) {
            return 1;
        }
        if (set instanceof SetExpr.Builder builder) {
            return arityOf(builder.indexing());
        }
        SetExpr.Operation operation = (SetExpr.Operation) set;
        int left = dimensionOf(operation.left());
        int right = dimensionOf(operation.right());
        if (operation.op() == SetExpr.SetOp.CROSS) {
            return left + right;
        }
        if (left != right) {
            throw new ShapeMismatchException(operation.op().name().toLowerCase(), left, right, operation.location());
        }
        return left;
    }

    private int arityOf(Indexing indexing) {
        if (indexing == null) {
            return 0;
        }
        int arity = 0;
        for (Indexing.Entry entry : indexing.entries()) {
            arity += entry.isAnonymous() ? dimensionOf(entry.domain()) : entry.dummies().size();
        }
        return arity;
    }

    private Declaration.SetDecl requireSet(String name, SourceLocation location) {
        Declaration declaration = byName.get(name);
        if (declaration == null) {
            throw new UnknownSymbolException(name, location);
        }
        if (!(declaration instanceof Declaration.SetDecl set)) {
            throw new ModelSyntaxException("'" + name + "' is a " + kindOf(declaration).displayName()
                    + ", not a set", location);
        }
        return set;
    }

    // ------------------------------------------------------------------------
    // Scope and shape checks
    // ------------------------------------------------------------------------

    /**
     * Dummies visible at a point, and whether decision variables may appear there.
     */
    private record Scope(Set<String> dummies, boolean variablesAllowed) {
        static final Scope DEFINITION = new Scope(Set.of(), false);
        static final Scope BODY = new Scope(Set.of(), true);

        Scope bind(List<String> names) {
            Set<String> extended = new HashSet<>(dummies);
            extended.addAll(names);
            return new Scope(extended, variablesAllowed);
        }

        Scope constant() {
            return variablesAllowed ? new Scope(dummies, false) : this;
        }
    }

    private void checkDeclaration(Declaration declaration) {
        if (declaration instanceof Declaration.SetDecl set) {
            if (set.definition() != null) {
                checkSet(set.definition(), Scope.DEFINITION);
            }
        } else if (declaration instanceof Declaration.ParamDecl param) {
            Scope scope = checkIndexing(param.indexing(), Scope.DEFINITION);
            for (Declaration.Check check : param.checks()) {
                checkExpr(check.bound(), scope);
            }
            checkOptional(param.defaultValue(), scope);
            checkOptional(param.definition(), scope);
        } else if (declaration instanceof Declaration.VarDecl var) {
            Scope scope = checkIndexing(var.indexing(), Scope.DEFINITION);
            checkOptional(var.lower(), scope);
            checkOptional(var.upper(), scope);
        } else if (declaration instanceof Declaration.ConstraintDecl constraint) {
            Scope scope = checkIndexing(constraint.indexing(), Scope.BODY);
            checkExpr(constraint.lhs(), scope);
            checkExpr(constraint.rhs(), scope);
        } else if (declaration instanceof Declaration.ObjectiveDecl objective) {
            checkExpr(objective.expression(), Scope.BODY);
        }
    }

    private void checkOptional(Expr expr, Scope scope) {
        if (expr != null) {
            checkExpr(expr, scope);
        }
    }

    /**
     * Checks a header and returns the scope its body sees.
     */
    private Scope checkIndexing(Indexing indexing, Scope outer) {
        if (indexing == null) {
            return outer;
        }
        Scope scope = outer;
        Set<String> seen = new HashSet<>();
        for (Indexing.Entry entry : indexing.entries()) {
            checkSet(entry.domain(), scope.constant());
            if (!entry.isAnonymous()) {
                int width = dimensionOf(entry.domain());
                if (width != entry.dummies().size()) {
                    throw new ShapeMismatchException(describe(entry.domain()), width, entry.dummies().size(),
                            entry.location());
                }
                for (String dummy : entry.dummies()) {
                    if (!seen.add(dummy)) {
                        throw new ModelSyntaxException("Dummy index '" + dummy + "' is bound twice in one header",
                                entry.location());
                    }
                }
                scope = scope.bind(entry.dummies());
            }
        }
        if (indexing.filter() != null) {
            checkExpr(indexing.filter(), scope.constant());
        }
        return scope;
    }

    private static String describe(SetExpr set) {
        return set instanceof SetExpr.NamedSet named ? named.name() : "set expression";
    }

    private void checkSet(SetExpr set, Scope scope) {
        if (set instanceof SetExpr.NamedSet named) {
            requireSet(named.name(), named.location());
        } else if (set instanceof SetExpr.Enumeration enumeration) {
            dimensionOf(enumeration);
            enumeration.elements().forEach(element -> element.forEach(e -> checkExpr(e, scope)));
        } else if (set instanceof SetExpr.Range range) {
            checkExpr(range.from(), scope);
            checkExpr(range.to(), scope);
            checkOptional(range.step(), scope);
        } else if (set instanceof SetExpr.Builder builder) {
            checkIndexing(builder.indexing(), scope);
        } else if (set instanceof SetExpr.Operation operation) {
            checkSet(operation.left(), scope);
            checkSet(operation.right(), scope);
            dimensionOf(operation);
        }
    }

    private void checkExpr(Expr expr, Scope scope) {
        expr.accept(new ExprChecker(), scope);
    }

    private final class ExprChecker implements Expr.Visitor<Void, Scope> {

        @Override
        public Void visitNumber(Expr.NumberLiteral expr, Scope scope) {
            return null;
        }

        @Override
        public Void visitString(Expr.StringLiteral expr, Scope scope) {
            return null;
        }

        @Override
        public Void visitReference(Expr.Reference expr, Scope scope) {
            if (scope.dummies().contains(expr.name())) {
                if (expr.isSubscripted()) {
                    throw new ShapeMismatchException(expr.name(), 0, expr.subscripts().size(), expr.location());
                }
                return null;
            }
            Symbol symbol = symbols.resolve(expr.name(), expr.location());
            switch (symbol.kind()) {
                case PARAMETER -> {
                }
                case VARIABLE -> {
                    if (!scope.variablesAllowed()) {
                        throw new ModelSyntaxException("Decision variable '" + expr.name()
                                + "' cannot be used in a definition, bound, header or condition", expr.location());
                    }
                }
                default -> throw new ModelSyntaxException("'" + expr.name() + "' is a "
                        + symbol.kind().displayName() + " and cannot be used as a value", expr.location());
            }
            if (symbol.arity() != expr.subscripts().size()) {
                throw new ShapeMismatchException(expr.name(), symbol.arity(), expr.subscripts().size(),
                        expr.location());
            }
            for (Expr subscript : expr.subscripts()) {
                subscript.accept(this, scope.constant());
            }
            return null;
        }

        @Override
        public Void visitUnary(Expr.Unary expr, Scope scope) {
            expr.operand().accept(this, expr.op() == Expr.UnaryOp.NOT ? scope.constant() : scope);
            return null;
        }

        @Override
        public Void visitBinary(Expr.Binary expr, Scope scope) {
            Scope operands = expr.op().isComparison() || expr.op() == Expr.BinaryOp.AND
                    || expr.op() == Expr.BinaryOp.OR ? scope.constant() : scope;
            expr.left().accept(this, operands);
            expr.right().accept(this, operands);
            return null;
        }

        @Override
        public Void visitSum(Expr.Sum expr, Scope scope) {
            Scope inner = checkIndexing(expr.indexing(), scope);
            expr.body().accept(this, inner);
            return null;
        }

        @Override
        public Void visitConditional(Expr.Conditional expr, Scope scope) {
            expr.condition().accept(this, scope.constant());
            expr.whenTrue().accept(this, scope);
            if (expr.whenFalse() != null) {
                expr.whenFalse().accept(this, scope);
            }
            return null;
        }

        @Override
        public Void visitMembership(Expr.Membership expr, Scope scope) {
            for (Expr element : expr.elements()) {
                element.accept(this, scope.constant());
            }
            checkSet(expr.set(), scope.constant());
            int width = dimensionOf(expr.set());
            if (width != expr.elements().size()) {
                throw new ShapeMismatchException(describe(expr.set()), width, expr.elements().size(),
                        expr.location());
            }
            return null;
        }

        @Override
        public Void visitCardinality(Expr.Cardinality expr, Scope scope) {
            checkSet(expr.set(), scope.constant());
            return null;
        }

        @Override
        public Void visitFunction(Expr.FunctionCall expr, Scope scope) {
            for (Expr argument : expr.arguments()) {
                argument.accept(this, scope.constant());
            }
            return null;
        }
    }
}
