package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.DelegationId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;
import java.util.Optional;

/**
 * The delegate agent acts on behalf of the responsible agent,
 * optionally for an activity and in a role.
 */
public record ActsOnBehalfOf(
    NamespaceId namespace,
    DelegationId id,
    AgentId responsibleId,
    AgentId delegateId,
    ActivityId activityId,
    String role
) implements ChronicleOperation {

    public ActsOnBehalfOf {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(responsibleId, "responsibleId");
        Objects.requireNonNull(delegateId, "delegateId");
    }

    /**
     * Build the operation, deriving the delegation id from its components.
     */
    public static ActsOnBehalfOf create(
            NamespaceId namespace,
            AgentId responsibleId,
            AgentId delegateId,
            ActivityId activityId,
            String role) {
        return new ActsOnBehalfOf(
            namespace,
            DelegationId.fromComponentIds(delegateId, responsibleId, activityId, role),
            responsibleId,
            delegateId,
            activityId,
            role
        );
    }

    public Optional<ActivityId> activity() {
        return Optional.ofNullable(activityId);
    }

    @Override
    public OperationType type() {
        return OperationType.AGENT_ACTS_ON_BEHALF_OF;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitActsOnBehalfOf(this);
    }
}
