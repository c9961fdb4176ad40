package com.chronicle.core.model;

import com.chronicle.core.id.NamespaceId;
import java.util.UUID;

/**
 * An isolated provenance graph partition.
 * Identity is fixed at creation: the uuid is part of the id and never changes.
 */
public record Namespace(NamespaceId id, UUID uuid, String externalId) {

    /**
     * Build the namespace record implied by its identifier.
     */
    public static Namespace of(NamespaceId id) {
        return new Namespace(id, id.uuid(), id.externalId());
    }
}
