package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.AssociationId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record WasAssociatedWith(
    NamespaceId namespace,
    AssociationId id,
    ActivityId activityId,
    AgentId agentId,
    String role
) implements ChronicleOperation {

    public WasAssociatedWith {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activityId, "activityId");
        Objects.requireNonNull(agentId, "agentId");
    }

    public static WasAssociatedWith create(NamespaceId namespace, ActivityId activityId, AgentId agentId, String role) {
        return new WasAssociatedWith(
            namespace,
            AssociationId.fromComponentIds(agentId, activityId, role),
            activityId,
            agentId,
            role
        );
    }

    @Override
    public OperationType type() {
        return OperationType.WAS_ASSOCIATED_WITH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWasAssociatedWith(this);
    }
}
