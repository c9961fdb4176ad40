package com.chronicle.core.operation;

/**
 * Names every operation variant, for logging and metrics tags.
 */
public enum OperationType {
    CREATE_NAMESPACE,
    AGENT_EXISTS,
    AGENT_ACTS_ON_BEHALF_OF,
    ACTIVITY_EXISTS,
    START_ACTIVITY,
    END_ACTIVITY,
    ACTIVITY_USES,
    ENTITY_EXISTS,
    WAS_GENERATED_BY,
    ENTITY_DERIVE,
    SET_AGENT_ATTRIBUTES,
    SET_ACTIVITY_ATTRIBUTES,
    SET_ENTITY_ATTRIBUTES,
    WAS_ASSOCIATED_WITH,
    WAS_ATTRIBUTED_TO,
    WAS_INFORMED_BY,
    REGISTER_KEY
}
