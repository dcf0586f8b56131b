package org.fedorov.uniq.sequences.json;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import org.fedorov.uniq.sequences.IUniqueSequence;

/**
 * Writes a sequence as a plain JSON array of its elements.
 */
final class UniqueSequenceSerializer extends StdSerializer<IUniqueSequence<?>> {

    private static final long serialVersionUID = 1L;

    UniqueSequenceSerializer() {
        super(IUniqueSequence.class, false);
    }

    @Override
    public void serialize(IUniqueSequence<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray(value, value.size());
        for (Object element : value) {
            provider.defaultSerializeValue(element, gen);
        }
        gen.writeEndArray();
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, IUniqueSequence<?> value) {
        return value.isEmpty();
    }
}
