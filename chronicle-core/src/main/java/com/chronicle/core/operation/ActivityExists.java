package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record ActivityExists(NamespaceId namespace, ActivityId id) implements ChronicleOperation {

    public ActivityExists {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
    }

    public static ActivityExists of(NamespaceId namespace, String externalId) {
        return new ActivityExists(namespace, ActivityId.fromExternalId(externalId));
    }

    @Override
    public OperationType type() {
        return OperationType.ACTIVITY_EXISTS;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitActivityExists(this);
    }
}
