package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import java.util.Comparator;

public record Usage(ActivityId activityId, EntityId entityId) implements Comparable<Usage> {

    private static final Comparator<Usage> ORDER = Comparator
        .comparing(Usage::activityId)
        .thenComparing(Usage::entityId);

    @Override
    public int compareTo(Usage other) {
        return ORDER.compare(this, other);
    }
}
