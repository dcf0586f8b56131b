package org.fedorov.uniq.sequences;

/**
 * A {@link PartialEquality} that is reflexive, symmetric and transitive.
 * <p>
 * Implementing this interface is a promise made by the author of the relation; it is not
 * checked. {@code StrictUniqueSequence} only accepts relations carrying this promise.
 */
@FunctionalInterface
public interface Equivalence<T> extends PartialEquality<T> {
}
