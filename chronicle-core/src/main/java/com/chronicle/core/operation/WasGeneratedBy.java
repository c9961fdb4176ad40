package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

/**
 * The entity was generated by the activity.
 */
public record WasGeneratedBy(NamespaceId namespace, EntityId id, ActivityId activity) implements ChronicleOperation {

    public WasGeneratedBy {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activity, "activity");
    }

    public static WasGeneratedBy of(NamespaceId namespace, EntityId id, ActivityId activity) {
        return new WasGeneratedBy(namespace, id, activity);
    }

    @Override
    public OperationType type() {
        return OperationType.WAS_GENERATED_BY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWasGeneratedBy(this);
    }
}
