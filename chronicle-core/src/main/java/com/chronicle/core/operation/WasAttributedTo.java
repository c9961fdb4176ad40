package com.chronicle.core.operation;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.AttributionId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record WasAttributedTo(
    NamespaceId namespace,
    AttributionId id,
    EntityId entityId,
    AgentId agentId,
    String role
) implements ChronicleOperation {

    public WasAttributedTo {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(agentId, "agentId");
    }

    public static WasAttributedTo create(NamespaceId namespace, EntityId entityId, AgentId agentId, String role) {
        return new WasAttributedTo(
            namespace,
            AttributionId.fromComponentIds(agentId, entityId, role),
            entityId,
            agentId,
            role
        );
    }

    @Override
    public OperationType type() {
        return OperationType.WAS_ATTRIBUTED_TO;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWasAttributedTo(this);
    }
}
