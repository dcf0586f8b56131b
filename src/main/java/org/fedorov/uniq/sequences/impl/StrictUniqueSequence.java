package org.fedorov.uniq.sequences.impl;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.function.UnaryOperator;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.fedorov.uniq.sequences.Equalities;
import org.fedorov.uniq.sequences.Equivalence;
import org.fedorov.uniq.sequences.IUniqueSequence;
import org.fedorov.uniq.sequences.PartialEquality;

/**
 * A {@link UniqueSequence} whose equality is an {@link Equivalence}, which additionally lets
 * callers replace elements in place.
 * <p>
 * In-place writes are not checked against the other elements. Writing a value equal to
 * another stored element breaks uniqueness; keeping them distinct is up to the caller.
 * <p>
 * {@link #wrap(UniqueSequence)} and {@link #unwrap()} share storage with the wrapped
 * sequence, nothing is copied or re-checked.
 */
public final class StrictUniqueSequence<T> implements IUniqueSequence<T> {

    private final UniqueSequence<T> sequence;

    private StrictUniqueSequence(UniqueSequence<T> sequence) {
        this.sequence = sequence;
    }

    public static <T> StrictUniqueSequence<T> create() {
        return create(Equalities.natural());
    }

    public static <T> StrictUniqueSequence<T> create(Equivalence<? super T> equivalence) {
        return new StrictUniqueSequence<>(UniqueSequence.<T>create(equivalence));
    }

    public static <T> Deduplication<T, StrictUniqueSequence<T>> from(Iterable<? extends T> source) {
        return from(source, Equalities.natural());
    }

    public static <T> Deduplication<T, StrictUniqueSequence<T>> from(Iterable<? extends T> source,
                                                                     Equivalence<? super T> equivalence) {
        Deduplication<T, UniqueSequence<T>> result = UniqueSequence.from(source, equivalence);
        return new Deduplication<>(new StrictUniqueSequence<>(result.sequence()), result.rejected());
    }

    public static <T> StrictUniqueSequence<T> copyOf(Iterable<? extends T> source) {
        return StrictUniqueSequence.<T>from(source).sequence();
    }

    public static <T> Collector<T, ?, StrictUniqueSequence<T>> collector() {
        return collector(Equalities.natural());
    }

    public static <T> Collector<T, ?, StrictUniqueSequence<T>> collector(Equivalence<? super T> equivalence) {
        return Collectors.collectingAndThen(UniqueSequence.<T>collector(equivalence), StrictUniqueSequence::new);
    }

    /**
     * Takes over {@code sequence} without copying it. The caller should stop using
     * {@code sequence} directly afterwards.
     *
     * @throws IllegalArgumentException if the sequence's equality is not an {@link Equivalence}
     */
    public static <T> StrictUniqueSequence<T> wrap(UniqueSequence<T> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        if( !(sequence.equality() instanceof Equivalence) ){
            throw new IllegalArgumentException(
                    "Sequence equality is not an Equivalence: " + sequence.equality().getClass().getName());
        }
        return new StrictUniqueSequence<>(sequence);
    }

    /** The wrapped sequence, sharing this instance's storage. */
    public UniqueSequence<T> unwrap() {
        return sequence;
    }

    public Optional<T> push(T element) {
        return sequence.push(element);
    }

    public List<T> extendFrom(Iterable<? extends T> source) {
        return sequence.extendFrom(source);
    }

    public boolean addAll(Iterable<? extends T> source) {
        return sequence.addAll(source);
    }

    public Optional<T> pop() {
        return sequence.pop();
    }

    public void clear() {
        sequence.clear();
    }

    public Iterator<T> drain() {
        return sequence.drain();
    }

    /**
     * Replaces the element at {@code index}. Uniqueness is not re-checked.
     *
     * @return the element previously at {@code index}
     */
    public T set(int index, T element) {
        Objects.requireNonNull(element, "element");
        return sequence.elements().set(index, element);
    }

    public T update(int index, UnaryOperator<T> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        return set(index, mutation.apply(get(index)));
    }

    public void replaceAll(UnaryOperator<T> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        for (int i = 0; i < size(); i++) {
            update(i, mutation);
        }
    }

    /**
     * Fixed-size view that writes through to this sequence. {@code set} is supported;
     * adding or removing elements throws {@link UnsupportedOperationException}.
     */
    public List<T> asMutableList() {
        return new MutableView();
    }

    public StrictUniqueSequence<T> copy() {
        return new StrictUniqueSequence<>(sequence.copy());
    }

    @Override
    public PartialEquality<? super T> equality() {
        return sequence.equality();
    }

    @Override
    public int size() {
        return sequence.size();
    }

    @Override
    public boolean isEmpty() {
        return sequence.isEmpty();
    }

    @Override
    public T get(int index) {
        return sequence.get(index);
    }

    @Override
    public boolean contains(T element) {
        return sequence.contains(element);
    }

    @Override
    public int indexOf(T element) {
        return sequence.indexOf(element);
    }

    @Override
    public Iterator<T> iterator() {
        return sequence.iterator();
    }

    @Override
    public Stream<T> stream() {
        return sequence.stream();
    }

    @Override
    public List<T> asList() {
        return sequence.asList();
    }

    @Override
    public List<T> toList() {
        return sequence.toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StrictUniqueSequence)) return false;
        return sequence.equals(((StrictUniqueSequence<?>) o).sequence);
    }

    @Override
    public int hashCode() {
        return sequence.hashCode();
    }

    @Override
    public String toString() {
        return sequence.toString();
    }

    private final class MutableView extends AbstractList<T> implements RandomAccess {

        @Override
        public T get(int index) {
            return StrictUniqueSequence.this.get(index);
        }

        @Override
        public T set(int index, T element) {
            return StrictUniqueSequence.this.set(index, element);
        }

        @Override
        public int size() {
            return StrictUniqueSequence.this.size();
        }
    }
}
