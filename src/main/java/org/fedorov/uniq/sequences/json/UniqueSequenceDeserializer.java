package org.fedorov.uniq.sequences.json;

import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import org.fedorov.uniq.sequences.Equalities;
import org.fedorov.uniq.sequences.IUniqueSequence;
import org.fedorov.uniq.sequences.impl.Deduplication;
import org.fedorov.uniq.sequences.impl.StrictUniqueSequence;
import org.fedorov.uniq.sequences.impl.UniqueSequence;

/**
 * Reads a JSON array into a sequence using {@link Equalities#natural()}, re-checking
 * uniqueness according to the configured {@link DuplicatePolicy}.
 */
final class UniqueSequenceDeserializer extends StdDeserializer<IUniqueSequence<?>> {

    private static final long serialVersionUID = 1L;

    private static final Logger log = Logger.getLogger(UniqueSequenceDeserializer.class.getName());

    private final JavaType listType;
    private final boolean strict;
    private final DuplicatePolicy policy;

    UniqueSequenceDeserializer(JavaType sequenceType, JavaType listType, DuplicatePolicy policy) {
        super(sequenceType);
        this.listType = listType;
        this.strict = sequenceType.hasRawClass(StrictUniqueSequence.class);
        this.policy = policy;
    }

    @Override
    public IUniqueSequence<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        List<Object> values = ctxt.readValue(p, listType);
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                return ctxt.reportInputMismatch(this, "Null element at index %d of %s", i, handledType().getName());
            }
        }

        Deduplication<Object, UniqueSequence<Object>> result = UniqueSequence.from(values, Equalities.natural());
        if (!result.rejected().isEmpty()) {
            if (policy == DuplicatePolicy.REJECT) {
                return ctxt.reportInputMismatch(this, "Duplicate elements in %s: %s",
                        handledType().getName(), result.rejected());
            }
            log.log(Level.WARNING, String.format("Dropped %d duplicate element(s) while reading %s: %s",
                    result.rejected().size(), listType.getContentType(), result.rejected()));
        }

        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("Read %s of %d element(s)", strict ? "strict sequence" : "sequence",
                    result.sequence().size()));
        }
        return strict ? StrictUniqueSequence.wrap(result.sequence()) : result.sequence();
    }
}
