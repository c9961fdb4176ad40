package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.DerivationType;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity {@code id} was derived from {@code usedId}, optionally through an activity.
 */
public record EntityDerive(
    NamespaceId namespace,
    EntityId id,
    EntityId usedId,
    ActivityId activityId,
    DerivationType typ
) implements ChronicleOperation {

    public EntityDerive {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(usedId, "usedId");
        typ = typ == null ? DerivationType.NONE : typ;
    }

    public static EntityDerive of(NamespaceId namespace, EntityId id, EntityId usedId, DerivationType typ) {
        return new EntityDerive(namespace, id, usedId, null, typ);
    }

    public EntityDerive withActivity(ActivityId activity) {
        return new EntityDerive(namespace, id, usedId, activity, typ);
    }

    public Optional<ActivityId> activity() {
        return Optional.ofNullable(activityId);
    }

    @Override
    public OperationType type() {
        return OperationType.ENTITY_DERIVE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEntityDerive(this);
    }
}
