package com.chronicle.core.id;

import java.util.UUID;

/**
 * Identifier of a namespace: the external name plus a UUID disambiguator.
 * The UUID is part of the identity, so two namespaces with the same name are distinct.
 */
public record NamespaceId(String externalId, UUID uuid) implements ChronicleIri {

    public NamespaceId {
        Iris.requireExternalId(externalId, "Namespace");
        if (uuid == null) {
            throw new IllegalArgumentException("Namespace uuid must not be null");
        }
    }

    public static NamespaceId of(String externalId, UUID uuid) {
        return new NamespaceId(externalId, uuid);
    }

    @Override
    public String toIri() {
        return PREFIX + "ns:" + Iris.encode(externalId) + ":" + uuid;
    }

    @Override
    public String toString() {
        return toIri();
    }
}
