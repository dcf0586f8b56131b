package org.fedorov.uniq.sequences;

/**
 * Equality relation used to decide whether an element is a duplicate.
 * <p>
 * The relation need not be transitive, and need not be reflexive for every value: under
 * IEEE-754 rules {@code NaN} is unequal to itself. Full equivalence relations should
 * implement {@link Equivalence} instead.
 */
@FunctionalInterface
public interface PartialEquality<T> {

    boolean test(T left, T right);
}
