package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import java.util.Comparator;

/**
 * Entity-side record of an entity being generated by an activity.
 */
public record Generation(ActivityId activityId, EntityId generatedId) implements Comparable<Generation> {

    private static final Comparator<Generation> ORDER = Comparator
        .comparing(Generation::activityId)
        .thenComparing(Generation::generatedId);

    @Override
    public int compareTo(Generation other) {
        return ORDER.compare(this, other);
    }
}
