package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import java.util.Comparator;

/**
 * Activity-side record of an entity the activity generated.
 */
public record GeneratedEntity(EntityId entityId, ActivityId generatedId) implements Comparable<GeneratedEntity> {

    private static final Comparator<GeneratedEntity> ORDER = Comparator
        .comparing(GeneratedEntity::entityId)
        .thenComparing(GeneratedEntity::generatedId);

    @Override
    public int compareTo(GeneratedEntity other) {
        return ORDER.compare(this, other);
    }
}
