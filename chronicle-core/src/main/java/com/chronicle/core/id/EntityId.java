package com.chronicle.core.id;

public record EntityId(String externalId) implements ChronicleIri {

    public EntityId {
        Iris.requireExternalId(externalId, "Entity");
    }

    public static EntityId fromExternalId(String externalId) {
        return new EntityId(externalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "entity:" + Iris.encode(externalId);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
