package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.exceptions.InvalidDataException;
import com.tessera.modeling.api.exceptions.InvalidRangeException;
import com.tessera.modeling.api.exceptions.MissingParameterValueException;
import com.tessera.modeling.api.model.Atom;
import com.tessera.modeling.api.model.Tuple;
import com.tessera.modeling.compiler.ast.Expr;
import com.tessera.modeling.compiler.ast.Indexing;
import com.tessera.modeling.compiler.ast.SetExpr;
import com.tessera.modeling.compiler.symbols.ReferenceCollector;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves set expressions and indexing headers to ordered tuple lists.
 *
 * <p>Headers expand with the leftmost entry varying slowest. Each entry's domain is resolved
 * under the bindings of the entries before it, so {@code {i in I, j in 1..i}} is triangular.
 * The filter is applied to fully bound tuples. An empty result is legitimate and yields no
 * rows, columns or terms.
 *
 * <p>A range whose bounds mention no bound dummy is a fixed part of the model and must be
 * non-empty with integral bounds; ranges inside comprehensions that depend on a dummy may be empty.
 */
public final class SetResolver implements SetExpr.Visitor<TupleSet, Bindings> {

    private static final double STEP_TOLERANCE = 1e-9;

    private final ValueSource values;
    private final ExpressionEvaluator evaluator;

    SetResolver(ValueSource values, ExpressionEvaluator evaluator) {
        this.values = values;
        this.evaluator = evaluator;
    }

    public TupleSet resolve(SetExpr set, Bindings bindings) {
        return set.accept(this, bindings);
    }

    /**
     * Expands an indexing header. A null header expands to a single empty tuple.
     */
    public ResolvedIndexing resolve(Indexing indexing, Bindings bindings) {
        if (indexing == null) {
            return ResolvedIndexing.SCALAR;
        }
        List<IndexBinding> out = new ArrayList<>();
        int[] widths = new int[indexing.entries().size()];
        expand(indexing, 0, bindings, Tuple.EMPTY, widths, out);
        return new ResolvedIndexing(keysFor(indexing, widths), out);
    }

    private void expand(Indexing indexing, int entryIndex, Bindings bindings, Tuple prefix, int[] widths,
                        List<IndexBinding> out) {
        if (entryIndex == indexing.entries().size()) {
            if (indexing.filter() == null || evaluator.evaluatePredicate(indexing.filter(), bindings)) {
                out.add(new IndexBinding(prefix, bindings));
            }
            return;
        }
        Indexing.Entry entry = indexing.entries().get(entryIndex);
        for (Tuple member : resolve(entry.domain(), bindings)) {
            widths[entryIndex] = member.arity();
            Bindings next = entry.isAnonymous() ? bindings : bindings.bindAll(entry.dummies(), member);
            expand(indexing, entryIndex + 1, next, prefix.concat(member), widths, out);
        }
    }

    private static List<String> keysFor(Indexing indexing, int[] widths) {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < widths.length; i++) {
            Indexing.Entry entry = indexing.entries().get(i);
            if (!entry.isAnonymous()) {
                keys.addAll(entry.dummies());
            } else {
                for (int k = 0; k < widths[i]; k++) {
                    keys.add("_" + (keys.size() + 1));
                }
            }
        }
        return keys;
    }

    @Override
    public TupleSet visitNamed(SetExpr.NamedSet set, Bindings bindings) {
        return values.set(set.name(), set.location());
    }

    @Override
    public TupleSet visitEnumeration(SetExpr.Enumeration set, Bindings bindings) {
        TupleSet.Builder members = TupleSet.builder();
        for (List<Expr> element : set.elements()) {
            Tuple member = evaluator.evaluateTuple(element, bindings);
            if (!members.add(member)) {
                throw new InvalidDataException("Duplicate member " + member + " in set enumeration",
                        set.location());
            }
        }
        return members.build();
    }

    @Override
    public TupleSet visitRange(SetExpr.Range range, Bindings bindings) {
        double from = bound(range.from(), range, bindings);
        double to = bound(range.to(), range, bindings);
        double step = range.step() == null ? 1.0 : bound(range.step(), range, bindings);
        if (step == 0.0) {
            throw new InvalidRangeException("Range step must not be zero", range.location());
        }

        if (!dependsOnDummy(range, bindings)) {
            if (from != Math.rint(from) || to != Math.rint(to)) {
                throw new InvalidRangeException("Range bounds " + Atom.of(from) + ".." + Atom.of(to)
                        + " must be integers", range.location());
            }
            if (step > 0 ? to < from : to > from) {
                throw new InvalidRangeException("Range " + Atom.of(from) + ".." + Atom.of(to) + " is empty",
                        range.location());
            }
        }

        long count = (long) Math.floor((to - from) / step + STEP_TOLERANCE) + 1;
        TupleSet.Builder members = TupleSet.builder();
        for (long k = 0; k < count; k++) {
            members.add(Tuple.of(Atom.of(from + k * step)));
        }
        return members.build();
    }

    private double bound(Expr expr, SetExpr.Range range, Bindings bindings) {
        double value;
        try {
            value = evaluator.evaluateNumber(expr, bindings);
        } catch (MissingParameterValueException e) {
            throw new InvalidRangeException("Range bound needs " + e.getTuple().format(e.getParameter())
                    + ", which has no value", range.location(), e);
        }
        if (Double.isInfinite(value)) {
            throw new InvalidRangeException("Range bound must be finite", range.location());
        }
        return value;
    }

    private static boolean dependsOnDummy(SetExpr.Range range, Bindings bindings) {
        if (bindings.isEmpty()) {
            return false;
        }
        List<Expr> parts = new ArrayList<>(List.of(range.from(), range.to()));
        if (range.step() != null) {
            parts.add(range.step());
        }
        for (Expr part : parts) {
            for (String name : ReferenceCollector.referencesIn(part)) {
                if (bindings.isBound(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public TupleSet visitBuilder(SetExpr.Builder set, Bindings bindings) {
        TupleSet.Builder members = TupleSet.builder();
        for (IndexBinding member : resolve(set.indexing(), bindings).bindings()) {
            members.add(member.tuple());
        }
        return members.build();
    }

    @Override
    public TupleSet visitOperation(SetExpr.Operation set, Bindings bindings) {
        TupleSet left = resolve(set.left(), bindings);
        TupleSet right = resolve(set.right(), bindings);
        TupleSet.Builder members = TupleSet.builder();
        switch (set.op()) {
            case UNION -> {
                left.forEach(members::add);
                right.forEach(members::add);
            }
            case DIFF -> left.stream().filter(t -> !right.contains(t)).forEach(members::add);
            case INTER -> left.stream().filter(right::contains).forEach(members::add);
            case CROSS -> {
                for (Tuple l : left) {
                    for (Tuple r : right) {
                        members.add(l.concat(r));
                    }
                }
            }
        }
        return members.build();
    }
}
