package io.iamcore.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.iamcore.CommandException;
import io.iamcore.EventPayload;
import io.iamcore.EventType;

import java.io.IOException;
import java.lang.reflect.RecordComponent;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventCodec} backed by Jackson.
 *
 * <p>{@code null} fields are omitted, so delta payloads only carry what changed. Unknown
 * properties are ignored on decode so older readers can replay newer events.
 *
 * <p>When a record payload does not bind as a whole, each field is bound on its own and the
 * fields that fail are logged and left out, so one legacy field does not lose the event.
 */
public final class JacksonEventCodec implements EventCodec {
    private static final Logger logger = Logger.getLogger(JacksonEventCodec.class.getName());

    private final ObjectMapper mapper;

    public JacksonEventCodec() {
        this(defaultMapper());
    }

    public JacksonEventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns a mapper configured the way this codec expects.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public String encode(EventPayload payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw CommandException.serialization("CODEC-ENCODE", e);
        }
    }

    @Override
    public EventPayload decode(EventType type, String data) {
        Objects.requireNonNull(type, "type");
        if (data == null || data.isEmpty()) {
            throw CommandException.serialization("CODEC-EMPTY",
                    new IllegalArgumentException("Empty payload for " + type.name()));
        }
        Class<? extends EventPayload> payloadType = type.payloadType();
        JsonNode tree;
        try {
            tree = mapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw CommandException.serialization("CODEC-DECODE", e);
        }
        try {
            return mapper.treeToValue(tree, payloadType);
        } catch (JsonProcessingException e) {
            if (!payloadType.isRecord() || !(tree instanceof ObjectNode)) {
                throw CommandException.serialization("CODEC-DECODE", e);
            }
            ObjectNode readable = dropUnreadableFields(type, (ObjectNode) tree.deepCopy());
            try {
                return mapper.treeToValue(readable, payloadType);
            } catch (JsonProcessingException retry) {
                retry.addSuppressed(e);
                throw CommandException.serialization("CODEC-DECODE", retry);
            }
        }
    }

    private ObjectNode dropUnreadableFields(EventType type, ObjectNode node) {
        for (RecordComponent component : type.payloadType().getRecordComponents()) {
            JsonNode value = node.get(component.getName());
            if (value == null || value.isNull()) {
                continue;
            }
            try {
                mapper.readerFor(mapper.constructType(component.getGenericType())).readValue(value);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Dropping undecodable field " + component.getName()
                        + " of " + type.name() + ": " + e.getMessage());
                node.remove(component.getName());
            }
        }
        return node;
    }
}
