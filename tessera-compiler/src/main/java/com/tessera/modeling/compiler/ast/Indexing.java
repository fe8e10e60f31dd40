package com.tessera.modeling.compiler.ast;

import com.tessera.modeling.api.exceptions.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Indexing header {@code {e1, e2, ... : filter}}. The leftmost entry varies slowest and
 * later entries may refer to dummies bound by earlier ones. {@code filter} is null when absent.
 */
public record Indexing(List<Entry> entries, Expr filter, SourceLocation location) {

    public Indexing {
        entries = List.copyOf(entries);
    }

    /**
     * One header entry: {@code i in S}, {@code (i, j) in S}, or an anonymous {@code S}
     * (empty {@code dummies}).
     */
    public record Entry(List<String> dummies, SetExpr domain, SourceLocation location) {
        public Entry {
            dummies = List.copyOf(dummies);
        }

        public boolean isAnonymous() {
            return dummies.isEmpty();
        }
    }

    public List<String> dummyNames() {
        List<String> names = new ArrayList<>();
        for (Entry entry : entries) {
            names.addAll(entry.dummies());
        }
        return names;
    }
}
