package io.iamcore;

/**
 * Represents an event type identifier together with the payload it carries.
 *
 * <p>Implementations are enums, one per domain:
 * <pre>{@code
 * public enum SmtpConfigEvents implements EventType {
 *   SMTP_CONFIG_ADDED(SmtpConfigEvents.Added.class), ...
 * }
 * }</pre>
 *
 * <p>The name is persisted to the log and used to find the payload type again on replay,
 * so it must stay stable across releases.
 */
public interface EventType {

    /**
     * Returns the persisted event type name.
     *
     * @return the event type name, never null
     */
    String name();

    /**
     * Returns the aggregate type whose stream this event belongs to.
     */
    AggregateType aggregateType();

    /**
     * Returns the payload class decoded for this event type.
     */
    Class<? extends EventPayload> payloadType();
}
