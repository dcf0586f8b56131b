package org.fedorov.uniq.sequences.impl;

import java.util.Collections;
import java.util.List;

import org.fedorov.uniq.sequences.IUniqueSequence;

/**
 * Outcome of building a sequence from arbitrary input: the accepted elements and the ones
 * turned away as duplicates, in the order they were encountered.
 */
public final class Deduplication<T, S extends IUniqueSequence<T>> {

    private final S sequence;
    private final List<T> rejected;

    Deduplication(S sequence, List<T> rejected) {
        this.sequence = sequence;
        this.rejected = Collections.unmodifiableList(rejected);
    }

    public S sequence() {
        return sequence;
    }

    public List<T> rejected() {
        return rejected;
    }

    @Override
    public String toString() {
        return "Deduplication[sequence=" + sequence + ", rejected=" + rejected + "]";
    }
}
