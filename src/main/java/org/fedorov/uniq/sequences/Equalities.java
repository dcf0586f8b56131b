package org.fedorov.uniq.sequences;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;

/**
 * Stock equality relations.
 */
public final class Equalities {

    private static final Equivalence<Object> NATURAL = Objects::equals;

    private static final Equivalence<Object> IDENTITY = (left, right) -> left == right;

    private static final PartialEquality<Double> IEEE_754 =
            (left, right) -> left.doubleValue() == right.doubleValue();

    private static final PartialEquality<Float> IEEE_754_FLOATS =
            (left, right) -> left.floatValue() == right.floatValue();

    private Equalities() {
        // utility
    }

    /** {@link Object#equals(Object)}, which the JDK contract requires to be an equivalence. */
    @SuppressWarnings("unchecked")
    public static <T> Equivalence<T> natural() {
        return (Equivalence<T>) NATURAL;
    }

    @SuppressWarnings("unchecked")
    public static <T> Equivalence<T> identity() {
        return (Equivalence<T>) IDENTITY;
    }

    public static <T, K> Equivalence<T> by(Function<? super T, ? extends K> key) {
        Objects.requireNonNull(key, "key");
        return (left, right) -> Objects.equals(key.apply(left), key.apply(right));
    }

    /** Equal when {@code compare} returns 0; the comparator must be a total order. */
    public static <T> Equivalence<T> comparing(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (left, right) -> comparator.compare(left, right) == 0;
    }

    /**
     * Primitive {@code ==} on doubles: {@code NaN} equals nothing, itself included, and
     * {@code 0.0} equals {@code -0.0}. This differs from {@link Double#equals(Object)}.
     */
    public static PartialEquality<Double> ieee754() {
        return IEEE_754;
    }

    public static PartialEquality<Float> ieee754Floats() {
        return IEEE_754_FLOATS;
    }

    /**
     * Equal when {@code |left - right| <= tolerance}, compared as doubles.
     * Symmetric but not transitive.
     */
    public static PartialEquality<Number> withinTolerance(double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be a non-negative number, got: " + tolerance);
        }
        return (left, right) -> Math.abs(left.doubleValue() - right.doubleValue()) <= tolerance;
    }
}
