package org.fedorov.uniq.sequences.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collector;
import java.util.stream.Stream;

import org.fedorov.uniq.sequences.Equalities;
import org.fedorov.uniq.sequences.IUniqueSequence;
import org.fedorov.uniq.sequences.PartialEquality;

/**
 * Ordered sequence in which no two elements are equal under the sequence's
 * {@link PartialEquality}.
 * <p>
 * Every insertion scans the stored elements linearly, so bulk insertion is quadratic. There
 * is no hash index: relations such as {@link Equalities#ieee754()} or
 * {@link Equalities#withinTolerance(double)} are not hash-compatible.
 * <p>
 * Not thread-safe. Callers sharing an instance between threads must guard every access
 * with one external lock.
 *
 * <pre>{@code
 * UniqueSequence<Integer> seq = UniqueSequence.create();
 * seq.push(1);
 * seq.push(2);
 * Optional<Integer> back = seq.push(1); // Optional[1], seq is still [1, 2]
 * }</pre>
 */
public final class UniqueSequence<T> implements IUniqueSequence<T> {

    private final PartialEquality<? super T> equality;
    private final ArrayList<T> elements;

    private UniqueSequence(PartialEquality<? super T> equality, ArrayList<T> elements)
    {
        this.equality = equality;
        this.elements = elements;
    }

    public static <T> UniqueSequence<T> create() {
        return create(Equalities.natural());
    }

    public static <T> UniqueSequence<T> create(PartialEquality<? super T> equality) {
        Objects.requireNonNull(equality, "equality");
        return new UniqueSequence<>(equality, new ArrayList<>());
    }

    public static <T> Deduplication<T, UniqueSequence<T>> from(Iterable<? extends T> source) {
        return from(source, Equalities.natural());
    }

    /**
     * Builds a sequence by consuming {@code source} in order. An element equal to one
     * already accepted goes to {@link Deduplication#rejected()} instead.
     */
    public static <T> Deduplication<T, UniqueSequence<T>> from(Iterable<? extends T> source,
                                                               PartialEquality<? super T> equality) {
        Objects.requireNonNull(source, "source");
        UniqueSequence<T> sequence = create(equality);
        List<T> rejected = sequence.extendFrom(source);
        return new Deduplication<>(sequence, rejected);
    }

    /** Same as {@link #from(Iterable)} with the rejected elements discarded. */
    public static <T> UniqueSequence<T> copyOf(Iterable<? extends T> source) {
        return UniqueSequence.<T>from(source).sequence();
    }

    public static <T> UniqueSequence<T> copyOf(Iterable<? extends T> source, PartialEquality<? super T> equality) {
        return UniqueSequence.<T>from(source, equality).sequence();
    }

    public static <T> Collector<T, ?, UniqueSequence<T>> collector() {
        return collector(Equalities.natural());
    }

    /** Collects a stream, dropping duplicates the way {@link #addAll(Iterable)} does. */
    public static <T> Collector<T, ?, UniqueSequence<T>> collector(PartialEquality<? super T> equality) {
        Objects.requireNonNull(equality, "equality");
        return Collector.of(
                () -> UniqueSequence.<T>create(equality),
                UniqueSequence::push,
                (left, right) -> {
                    left.addAll(right);
                    return left;
                });
    }

    /**
     * Appends {@code element} unless an equal element is already present.
     *
     * @return empty if the element was appended; otherwise the very instance that was
     *         offered, with the sequence left unchanged
     */
    public Optional<T> push(T element) {
        Objects.requireNonNull(element, "element");
        if( contains(element) ){
            return Optional.of(element);
        }
        elements.add(element);
        return Optional.empty();
    }

    /**
     * Pushes every element of {@code source} in order. Each element is checked against the
     * current contents, including elements accepted earlier in this call.
     * <p>
     * {@code source} is copied before anything is appended, so it may be this sequence or
     * one of its views. A {@code null} anywhere in it fails the call with nothing appended.
     *
     * @return the elements that were not appended, in encounter order
     */
    public List<T> extendFrom(Iterable<? extends T> source) {
        Objects.requireNonNull(source, "source");
        List<T> incoming = new ArrayList<>();
        for( T element : source ){
            incoming.add(Objects.requireNonNull(element, "element"));
        }
        List<T> duplicates = new ArrayList<>();
        for( T element : incoming ){
            push(element).ifPresent(duplicates::add);
        }
        return duplicates;
    }

    /**
     * {@link #extendFrom(Iterable)} for callers that do not need the duplicates.
     *
     * @return true if at least one element was appended
     */
    public boolean addAll(Iterable<? extends T> source) {
        int before = elements.size();
        extendFrom(source);
        return elements.size() != before;
    }

    public Optional<T> pop() {
        if( elements.isEmpty() ){
            return Optional.empty();
        }
        return Optional.of(elements.remove(elements.size() - 1));
    }

    public void clear() {
        elements.clear();
    }

    /**
     * Hands the stored elements over to the caller, in order, and leaves this sequence empty.
     */
    public Iterator<T> drain() {
        ArrayList<T> owned = new ArrayList<>(elements);
        elements.clear();
        return owned.iterator();
    }

    public UniqueSequence<T> copy() {
        return new UniqueSequence<>(equality, new ArrayList<>(elements));
    }

    @Override
    public PartialEquality<? super T> equality() {
        return equality;
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public T get(int index) {
        return elements.get(index);
    }

    @Override
    public boolean contains(T element) {
        return indexOf(element) >= 0;
    }

    @Override
    public int indexOf(T element) {
        Objects.requireNonNull(element, "element");
        for (int i = 0; i < elements.size(); i++) {
            if( equality.test(elements.get(i), element) ){
                return i;
            }
        }
        return -1;
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    @Override
    public Stream<T> stream() {
        return asList().stream();
    }

    @Override
    public List<T> asList() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public List<T> toList() {
        return new ArrayList<>(elements);
    }

    // StrictUniqueSequence writes through this for in-place mutation.
    List<T> elements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniqueSequence)) return false;
        return elements.equals(((UniqueSequence<?>) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
