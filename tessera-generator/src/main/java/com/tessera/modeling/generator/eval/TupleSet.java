package com.tessera.modeling.generator.eval;

import com.tessera.modeling.api.model.Tuple;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ordered set of distinct tuples with constant-time membership. Immutable once built;
 * safe for concurrent reads.
 */
public final class TupleSet implements Iterable<Tuple> {

    public static final TupleSet EMPTY = new TupleSet(new ObjectLinkedOpenHashSet<>());

    private final ObjectLinkedOpenHashSet<Tuple> members;

    private TupleSet(ObjectLinkedOpenHashSet<Tuple> members) {
        this.members = members;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TupleSet of(Tuple... tuples) {
        Builder builder = builder();
        for (Tuple tuple : tuples) {
            builder.add(tuple);
        }
        return builder.build();
    }

    public boolean contains(Tuple tuple) {
        return members.contains(tuple);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Iterator<Tuple> iterator() {
        return members.iterator();
    }

    public Stream<Tuple> stream() {
        return StreamSupport.stream(Spliterators.spliterator(members, Spliterator.ORDERED | Spliterator.DISTINCT),
                false);
    }

    public List<Tuple> toList() {
        return new ArrayList<>(members);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TupleSet other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return members.toString();
    }

    public static final class Builder {
        private ObjectLinkedOpenHashSet<Tuple> members = new ObjectLinkedOpenHashSet<>();

        /**
         * @return false when the tuple was already present
         */
        public boolean add(Tuple tuple) {
            return members.add(tuple);
        }

        public int size() {
            return members.size();
        }

        public TupleSet build() {
            TupleSet set = members.isEmpty() ? EMPTY : new TupleSet(members);
            members = new ObjectLinkedOpenHashSet<>();
            return set;
        }
    }
}
