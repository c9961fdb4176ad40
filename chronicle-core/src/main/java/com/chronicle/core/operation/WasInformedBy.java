package com.chronicle.core.operation;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

/**
 * {@code activity} was informed by {@code informingActivity}.
 */
public record WasInformedBy(NamespaceId namespace, ActivityId activity, ActivityId informingActivity)
        implements ChronicleOperation {

    public WasInformedBy {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(activity, "activity");
        Objects.requireNonNull(informingActivity, "informingActivity");
    }

    public static WasInformedBy of(NamespaceId namespace, ActivityId activity, ActivityId informingActivity) {
        return new WasInformedBy(namespace, activity, informingActivity);
    }

    @Override
    public OperationType type() {
        return OperationType.WAS_INFORMED_BY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWasInformedBy(this);
    }
}
