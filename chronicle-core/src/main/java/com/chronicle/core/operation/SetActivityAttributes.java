package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.Attributes;
import java.util.Objects;

public record SetActivityAttributes(NamespaceId namespace, ActivityId id, Attributes attributes)
        implements ChronicleOperation {

    public SetActivityAttributes {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        attributes = attributes == null ? Attributes.empty() : attributes;
    }

    public static SetActivityAttributes of(NamespaceId namespace, ActivityId id, Attributes attributes) {
        return new SetActivityAttributes(namespace, id, attributes);
    }

    @Override
    public OperationType type() {
        return OperationType.SET_ACTIVITY_ATTRIBUTES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSetActivityAttributes(this);
    }
}
