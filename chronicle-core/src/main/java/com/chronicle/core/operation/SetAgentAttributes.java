package com.chronicle.core.operation;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.Attributes;
import java.util.Objects;

public record SetAgentAttributes(NamespaceId namespace, AgentId id, Attributes attributes)
        implements ChronicleOperation {

    public SetAgentAttributes {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    public static SetAgentAttributes of(NamespaceId namespace, AgentId id, Attributes attributes) {
        return new SetAgentAttributes(namespace, id, attributes);
    }

    @Override
    public OperationType type() {
        return OperationType.SET_AGENT_ATTRIBUTES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSetAgentAttributes(this);
    }
}
