package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import java.time.Instant;
import java.util.Objects;

public record StartActivity(NamespaceId namespace, ActivityId id, Instant time) implements ChronicleOperation {

    public StartActivity {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(time, "time");
    }

    public static StartActivity of(NamespaceId namespace, ActivityId id, Instant time) {
        return new StartActivity(namespace, id, time);
    }

    @Override
    public OperationType type() {
        return OperationType.START_ACTIVITY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStartActivity(this);
    }
}
