package io.iamcore;

/**
 * Aggregate types owned by the identity and access-management core.
 */
public enum IamAggregates implements AggregateType {
    /** The IAM instance itself; owns instance-wide configuration and IAM memberships. */
    INSTANCE,
    USER,
    ORG,
    PROJECT,
    USER_GRANT
}
