package org.fedorov.uniq.sequences.json;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;

import org.fedorov.uniq.sequences.IUniqueSequence;
import org.fedorov.uniq.sequences.impl.StrictUniqueSequence;
import org.fedorov.uniq.sequences.impl.UniqueSequence;

/**
 * Jackson support for {@link UniqueSequence} and {@link StrictUniqueSequence}.
 * <p>
 * On the wire a sequence is a bare JSON array, exactly as its elements would be written as
 * a {@code List}. Reading always goes through the normal insertion path, so the result
 * never holds duplicates; {@link DuplicatePolicy} decides whether duplicates in the input
 * fail the read or are dropped.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new UniqueSequenceModule());
 * UniqueSequence<Integer> seq = mapper.readValue("[3,1,19]", new TypeReference<UniqueSequence<Integer>>() {});
 * }</pre>
 */
public final class UniqueSequenceModule extends Module {

    private static final Logger log = Logger.getLogger(UniqueSequenceModule.class.getName());

    private final DuplicatePolicy policy;

    /** Uses the policy from the {@value DuplicatePolicy#PROPERTY} system property. */
    public UniqueSequenceModule() {
        this(DuplicatePolicy.fromSystemProperty());
    }

    public UniqueSequenceModule(DuplicatePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DuplicatePolicy policy() {
        return policy;
    }

    @Override
    public String getModuleName() {
        return UniqueSequenceModule.class.getSimpleName();
    }

    @Override
    public Version version() {
        return Version.unknownVersion();
    }

    @Override
    public void setupModule(SetupContext context) {
        context.addSerializers(new SequenceSerializers());
        context.addDeserializers(new SequenceDeserializers(policy));
        log.fine(() -> "Registered " + getModuleName() + " with duplicate policy " + policy);
    }

    private static final class SequenceSerializers extends Serializers.Base {

        private final UniqueSequenceSerializer serializer = new UniqueSequenceSerializer();

        @Override
        public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
            return IUniqueSequence.class.isAssignableFrom(type.getRawClass()) ? serializer : null;
        }
    }

    private static final class SequenceDeserializers extends Deserializers.Base {

        private final DuplicatePolicy policy;

        SequenceDeserializers(DuplicatePolicy policy) {
            this.policy = policy;
        }

        @Override
        public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config,
                                                        BeanDescription beanDesc) {
            Class<?> raw = type.getRawClass();
            if (raw != UniqueSequence.class && raw != StrictUniqueSequence.class && raw != IUniqueSequence.class) {
                return null;
            }
            JavaType elementType = type.containedTypeOrUnknown(0);
            JavaType listType = config.getTypeFactory().constructCollectionType(List.class, elementType);
            return new UniqueSequenceDeserializer(type, listType, policy);
        }
    }
}
