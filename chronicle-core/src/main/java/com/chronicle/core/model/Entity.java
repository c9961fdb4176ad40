package com.chronicle.core.model;

import com.chronicle.core.id.DomaintypeId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record Entity(
    EntityId id,
    NamespaceId namespaceId,
    String externalId,
    DomaintypeId domaintypeId,
    SortedMap<String, Attribute> attributes
) {
    public Entity {
        attributes = attributes == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    public static Entity exists(NamespaceId namespaceId, EntityId id) {
        return new Entity(id, namespaceId, id.externalId(), null, null);
    }

    public Entity withAttributes(Attributes replacement) {
        return new Entity(id, namespaceId, externalId, replacement.typ(), replacement.items());
    }
}
