package com.chronicle.core.operation;

import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record EntityExists(NamespaceId namespace, EntityId id) implements ChronicleOperation {

    public EntityExists {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
    }

    public static EntityExists of(NamespaceId namespace, String externalId) {
        return new EntityExists(namespace, EntityId.fromExternalId(externalId));
    }

    @Override
    public OperationType type() {
        return OperationType.ENTITY_EXISTS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEntityExists(this);
    }
}
