package com.chronicle.core.operation;

import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.Attributes;
import java.util.Objects;

public record SetEntityAttributes(NamespaceId namespace, EntityId id, Attributes attributes)
        implements ChronicleOperation {

    public SetEntityAttributes {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    public static SetEntityAttributes of(NamespaceId namespace, EntityId id, Attributes attributes) {
        return new SetEntityAttributes(namespace, id, attributes);
    }

    @Override
    public OperationType type() {
        return OperationType.SET_ENTITY_ATTRIBUTES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSetEntityAttributes(this);
    }
}
