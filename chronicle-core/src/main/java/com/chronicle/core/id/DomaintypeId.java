package com.chronicle.core.id;

public record DomaintypeId(String externalId) implements ChronicleIri {

    public DomaintypeId {
        Iris.requireExternalId(externalId, "Domaintype");
    }

    public static DomaintypeId fromExternalId(String externalId) {
        return new DomaintypeId(externalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "domaintype:" + Iris.encode(externalId);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
