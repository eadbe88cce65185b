package io.iamcore.codec;

import io.iamcore.EventType;
import io.iamcore.cascade.MembershipEvents;
import io.iamcore.cascade.UserGrantEvents;
import io.iamcore.smtp.SmtpConfigEvents;
import io.iamcore.user.UserEvents;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves persisted event type names back to {@link EventType}s during replay.
 *
 * <p>Names must be unique across all registered types.
 */
public final class EventTypeRegistry {
    private final Map<String, EventType> types = new LinkedHashMap<>();

    /**
     * Returns a registry containing every built-in event type.
     */
    public static EventTypeRegistry defaults() {
        return new EventTypeRegistry()
                .registerAll(SmtpConfigEvents.values())
                .registerAll(UserEvents.values())
                .registerAll(MembershipEvents.values())
                .registerAll(UserGrantEvents.values());
    }

    public EventTypeRegistry register(EventType type) {
        Objects.requireNonNull(type, "type");
        EventType existing = types.putIfAbsent(type.name(), type);
        if (existing != null && existing != type) {
            throw new IllegalStateException("Duplicate event type name: " + type.name());
        }
        return this;
    }

    public EventTypeRegistry registerAll(EventType... eventTypes) {
        for (EventType type : eventTypes) {
            register(type);
        }
        return this;
    }

    public Optional<EventType> find(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public Map<String, EventType> all() {
        return Collections.unmodifiableMap(types);
    }
}
