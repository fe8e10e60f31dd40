package com.tessera.modeling.generator.eval;

import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMaps;

import java.util.Objects;

/**
 * Immutable affine expression {@code sum(c_k * v_k) + constant}. Terms keep first-seen order;
 * a term whose coefficient cancels to exactly zero is dropped.
 */
public final class LinearForm implements Value {

    public static final LinearForm ZERO = new LinearForm(new Object2DoubleLinkedOpenHashMap<>(), 0.0);

    private final Object2DoubleLinkedOpenHashMap<VariableRef> terms;
    private final double constant;

    private LinearForm(Object2DoubleLinkedOpenHashMap<VariableRef> terms, double constant) {
        this.terms = terms;
        this.constant = constant + 0.0;
    }

    public static LinearForm constant(double value) {
        return value == 0.0 ? ZERO : new LinearForm(new Object2DoubleLinkedOpenHashMap<>(), value);
    }

    public static LinearForm of(VariableRef variable) {
        Object2DoubleLinkedOpenHashMap<VariableRef> terms = new Object2DoubleLinkedOpenHashMap<>(1);
        terms.put(variable, 1.0);
        return new LinearForm(terms, 0.0);
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    public double constant() {
        return constant;
    }

    public double coefficient(VariableRef variable) {
        return terms.getDouble(variable);
    }

    public int size() {
        return terms.size();
    }

    public Object2DoubleMap<VariableRef> terms() {
        return Object2DoubleMaps.unmodifiable(terms);
    }

    public LinearForm plus(LinearForm other) {
        return new Builder().add(this, 1.0).add(other, 1.0).build();
    }

    public LinearForm minus(LinearForm other) {
        return new Builder().add(this, 1.0).add(other, -1.0).build();
    }

    public LinearForm scale(double factor) {
        if (factor == 0.0) {
            return ZERO;
        }
        if (factor == 1.0) {
            return this;
        }
        return new Builder().add(this, factor).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearForm other)) return false;
        return constant == other.constant && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, constant);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Object2DoubleMap.Entry<VariableRef> term : terms.object2DoubleEntrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(term.getDoubleValue()).append('*').append(term.getKey());
        }
        if (sb.length() == 0 || constant != 0.0) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(constant);
        }
        return sb.toString();
    }

    /**
     * Mutable accumulator used for sums, so that adding n terms stays linear in n.
     */
    public static final class Builder {
        private final Object2DoubleLinkedOpenHashMap<VariableRef> terms = new Object2DoubleLinkedOpenHashMap<>();
        private double constant;

        public Builder add(LinearForm form, double factor) {
            constant += form.constant * factor;
            for (Object2DoubleMap.Entry<VariableRef> term : form.terms.object2DoubleEntrySet()) {
                double updated = terms.getDouble(term.getKey()) + term.getDoubleValue() * factor;
                if (updated == 0.0) {
                    terms.removeDouble(term.getKey());
                } else {
                    terms.put(term.getKey(), updated);
                }
            }
            return this;
        }

        public LinearForm build() {
            if (terms.isEmpty()) {
                return LinearForm.constant(constant);
            }
            return new LinearForm(new Object2DoubleLinkedOpenHashMap<>(terms), constant);
        }
    }
}
