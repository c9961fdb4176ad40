package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.DomaintypeId;
import com.chronicle.core.id.NamespaceId;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An activity record.
 *
 * Invariants:
 * - started <= ended whenever both are known
 * - once started or ended is set it never changes
 */
public record Activity(
    ActivityId id,
    NamespaceId namespaceId,
    String externalId,
    DomaintypeId domaintypeId,
    SortedMap<String, Attribute> attributes,
    Instant started,
    Instant ended
) {
    public Activity {
        attributes = attributes == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    public static Activity exists(NamespaceId namespaceId, ActivityId id) {
        return new Activity(id, namespaceId, id.externalId(), null, null, null, null);
    }

    public Activity withAttributes(Attributes replacement) {
        return new Activity(id, namespaceId, externalId,
            replacement.typ(), replacement.items(), started, ended);
    }

    public Activity withStarted(Instant time) {
        return new Activity(id, namespaceId, externalId, domaintypeId, attributes, time, ended);
    }

    public Activity withEnded(Instant time) {
        return new Activity(id, namespaceId, externalId, domaintypeId, attributes, started, time);
    }
}
