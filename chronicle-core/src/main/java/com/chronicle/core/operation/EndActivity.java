package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import java.time.Instant;
import java.util.Objects;

public record EndActivity(NamespaceId namespace, ActivityId id, Instant time) implements ChronicleOperation {

    public EndActivity {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(time, "time");
    }

    public static EndActivity of(NamespaceId namespace, ActivityId id, Instant time) {
        return new EndActivity(namespace, id, time);
    }

    @Override
    public OperationType type() {
        return OperationType.END_ACTIVITY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEndActivity(this);
    }
}
