package com.chronicle.core.model;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.DomaintypeId;
import com.chronicle.core.id.NamespaceId;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

public record Agent(
    AgentId id,
    NamespaceId namespaceId,
    String externalId,
    DomaintypeId domaintypeId,
    SortedMap<String, Attribute> attributes
) {
    public Agent {
        attributes = attributes == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    /**
     * Create a prototypical agent from its id. Only the external id can be determined.
     */
    public static Agent exists(NamespaceId namespaceId, AgentId id) {
        return new Agent(id, namespaceId, id.externalId(), null, null);
    }

    /**
     * Create a copy whose domain type and attributes are replaced.
     */
    public Agent withAttributes(Attributes replacement) {
        return new Agent(id, namespaceId, externalId, replacement.typ(), replacement.items());
    }
}
