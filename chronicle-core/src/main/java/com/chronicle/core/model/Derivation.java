package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.EntityId;
import java.util.Comparator;

/**
 * Generated entity derived from a used entity, optionally through an activity.
 */
public record Derivation(
    EntityId generatedId,
    EntityId usedId,
    ActivityId activityId,
    DerivationType typ
) implements Comparable<Derivation> {

    private static final Comparator<Derivation> ORDER = Comparator
        .comparing(Derivation::generatedId)
        .thenComparing(Derivation::usedId)
        .thenComparing(Derivation::activityId, Relations::compareNullable)
        .thenComparing(Derivation::typ);

    @Override
    public int compareTo(Derivation other) {
        return ORDER.compare(this, other);
    }
}
