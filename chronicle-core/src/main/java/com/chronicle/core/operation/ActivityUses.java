package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

/**
 * The activity used the entity.
 */
public record ActivityUses(NamespaceId namespace, EntityId id, ActivityId activity) implements ChronicleOperation {

    public ActivityUses {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activity, "activity");
    }

    public static ActivityUses of(NamespaceId namespace, EntityId id, ActivityId activity) {
        return new ActivityUses(namespace, id, activity);
    }

    @Override
    public OperationType type() {
        return OperationType.ACTIVITY_USES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitActivityUses(this);
    }
}
