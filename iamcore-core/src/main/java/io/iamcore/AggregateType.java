package io.iamcore;

/**
 * Represents an aggregate type identifier.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum Aggregates implements AggregateType {
 *   USER,
 *   ORG;
 *   // No need to override name(), Enum.name() already satisfies the contract
 * }
 * }</pre>
 *
 * @see IamAggregates
 */
public interface AggregateType {

    /**
     * Returns the string representation of this aggregate type.
     * This value is persisted with every event and partitions the log.
     *
     * @return the aggregate type name, never null
     */
    String name();
}
