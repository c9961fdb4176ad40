package com.chronicle.core.operation;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record AgentExists(NamespaceId namespace, AgentId id) implements ChronicleOperation {

    public AgentExists {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
    }

    public static AgentExists of(NamespaceId namespace, String externalId) {
        return new AgentExists(namespace, AgentId.fromExternalId(externalId));
    }

    @Override
    public OperationType type() {
        return OperationType.AGENT_EXISTS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAgentExists(this);
    }
}
