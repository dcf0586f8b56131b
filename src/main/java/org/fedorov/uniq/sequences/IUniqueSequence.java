package org.fedorov.uniq.sequences;

import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only surface of an ordered sequence without duplicates.
 * <p>
 * Nothing here hands out a way to change an element in place: the iterator does not
 * support {@code remove} and {@link #asList()} is unmodifiable.
 */
public interface IUniqueSequence<T> extends Iterable<T> {
    public int size();

    public boolean isEmpty();

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size())}
     */
    public T get(int index);

    /**
     * Membership under the sequence's own {@link #equality()}.
     *
     * @throws NullPointerException if {@code element} is null
     */
    public boolean contains(T element);

    /**
     * Position of the first element equal to {@code element} under {@link #equality()}, or -1.
     *
     * @throws NullPointerException if {@code element} is null
     */
    public int indexOf(T element);

    public PartialEquality<? super T> equality();

    public Stream<T> stream();

    /** Unmodifiable live view of the stored elements. */
    public List<T> asList();

    /** Independent mutable copy of the stored elements, in order. */
    public List<T> toList();
}
