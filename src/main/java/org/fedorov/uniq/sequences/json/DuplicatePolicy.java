package org.fedorov.uniq.sequences.json;

import java.util.Locale;

/**
 * What {@link UniqueSequenceModule} does with duplicates found while reading a sequence.
 */
public enum DuplicatePolicy {
    /** Fail the read with a {@link com.fasterxml.jackson.databind.exc.MismatchedInputException}. */
    REJECT,
    /** Keep the first occurrence, drop the rest and log a warning. */
    DROP;

    public static final String PROPERTY = "uniq.sequences.json.duplicates";

    /** Policy named by the {@value #PROPERTY} system property, {@link #REJECT} when unset. */
    public static DuplicatePolicy fromSystemProperty() {
        return parse(System.getProperty(PROPERTY, REJECT.name()));
    }

    public static DuplicatePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duplicate policy must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate policy: " + value, e);
        }
    }
}
