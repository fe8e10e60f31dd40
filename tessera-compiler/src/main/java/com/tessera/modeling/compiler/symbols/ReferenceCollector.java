package com.tessera.modeling.compiler.symbols;

import com.tessera.modeling.compiler.ast.Declaration;
import com.tessera.modeling.compiler.ast.Expr;
import com.tessera.modeling.compiler.ast.Indexing;
import com.tessera.modeling.compiler.ast.SetExpr;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects every name a declaration or expression mentions, minus the dummy indices it binds.
 */
public final class ReferenceCollector implements Expr.Visitor<Void, Set<String>>, SetExpr.Visitor<Void, Set<String>> {

    private final Set<String> dummies = new LinkedHashSet<>();

    private ReferenceCollector() {
    }

    /**
     * Names referenced by an expression, excluding dummies bound inside it.
     */
    public static Set<String> referencesIn(Expr expr) {
        ReferenceCollector collector = new ReferenceCollector();
        Set<String> names = new LinkedHashSet<>();
        collector.expr(expr, names);
        names.removeAll(collector.dummies);
        return names;
    }

    static Set<String> referencesOf(Declaration declaration) {
        ReferenceCollector collector = new ReferenceCollector();
        Set<String> names = new LinkedHashSet<>();
        collector.indexing(declaration.indexing(), names);
        if (declaration instanceof Declaration.SetDecl set) {
            collector.set(set.definition(), names);
        } else if (declaration instanceof Declaration.ParamDecl param) {
            param.checks().forEach(check -> collector.expr(check.bound(), names));
            collector.expr(param.defaultValue(), names);
            collector.expr(param.definition(), names);
        } else if (declaration instanceof Declaration.VarDecl var) {
            collector.expr(var.lower(), names);
            collector.expr(var.upper(), names);
        } else if (declaration instanceof Declaration.ConstraintDecl constraint) {
            collector.expr(constraint.lhs(), names);
            collector.expr(constraint.rhs(), names);
        } else if (declaration instanceof Declaration.ObjectiveDecl objective) {
            collector.expr(objective.expression(), names);
        }
        names.removeAll(collector.dummies);
        return names;
    }

    private void expr(Expr expr, Set<String> names) {
        if (expr != null) {
            expr.accept(this, names);
        }
    }

    private void set(SetExpr set, Set<String> names) {
        if (set != null) {
            set.accept(this, names);
        }
    }

    private void indexing(Indexing indexing, Set<String> names) {
        if (indexing == null) {
            return;
        }
        for (Indexing.Entry entry : indexing.entries()) {
            set(entry.domain(), names);
            dummies.addAll(entry.dummies());
        }
        expr(indexing.filter(), names);
    }

    private void all(List<Expr> exprs, Set<String> names) {
        exprs.forEach(e -> expr(e, names));
    }

    @Override
    public Void visitNumber(Expr.NumberLiteral expr, Set<String> names) {
        return null;
    }

    @Override
    public Void visitString(Expr.StringLiteral expr, Set<String> names) {
        return null;
    }

    @Override
    public Void visitReference(Expr.Reference expr, Set<String> names) {
        names.add(expr.name());
        all(expr.subscripts(), names);
        return null;
    }

    @Override
    public Void visitUnary(Expr.Unary expr, Set<String> names) {
        expr(expr.operand(), names);
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary expr, Set<String> names) {
        expr(expr.left(), names);
        expr(expr.right(), names);
        return null;
    }

    @Override
    public Void visitSum(Expr.Sum expr, Set<String> names) {
        indexing(expr.indexing(), names);
        expr(expr.body(), names);
        return null;
    }

    @Override
    public Void visitConditional(Expr.Conditional expr, Set<String> names) {
        expr(expr.condition(), names);
        expr(expr.whenTrue(), names);
        expr(expr.whenFalse(), names);
        return null;
    }

    @Override
    public Void visitMembership(Expr.Membership expr, Set<String> names) {
        all(expr.elements(), names);
        set(expr.set(), names);
        return null;
    }

    @Override
    public Void visitCardinality(Expr.Cardinality expr, Set<String> names) {
        set(expr.set(), names);
        return null;
    }

    @Override
    public Void visitFunction(Expr.FunctionCall expr, Set<String> names) {
        all(expr.arguments(), names);
        return null;
    }

    @Override
    public Void visitNamed(SetExpr.NamedSet set, Set<String> names) {
        names.add(set.name());
        return null;
    }

    @Override
    public Void visitEnumeration(SetExpr.Enumeration set, Set<String> names) {
        set.elements().forEach(element -> all(element, names));
        return null;
    }

    @Override
    public Void visitRange(SetExpr.Range set, Set<String> names) {
        expr(set.from(), names);
        expr(set.to(), names);
        expr(set.step(), names);
        return null;
    }

    @Override
    public Void visitBuilder(SetExpr.Builder set, Set<String> names) {
        indexing(set.indexing(), names);
        return null;
    }

    @Override
    public Void visitOperation(SetExpr.Operation set, Set<String> names) {
        set(set.left(), names);
        set(set.right(), names);
        return null;
    }
}
