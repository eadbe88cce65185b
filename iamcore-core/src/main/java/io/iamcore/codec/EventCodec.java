package io.iamcore.codec;

import io.iamcore.EventPayload;
import io.iamcore.EventType;

/**
 * Encodes event payloads for storage and decodes them on replay.
 */
public interface EventCodec {

    /**
     * @throws io.iamcore.CommandException with {@code SERIALIZATION_ERROR} on failure
     */
    String encode(EventPayload payload);

    /**
     * Decodes a stored payload into {@link EventType#payloadType()}.
     *
     * @throws io.iamcore.CommandException with {@code SERIALIZATION_ERROR} on failure
     */
    EventPayload decode(EventType type, String data);
}
