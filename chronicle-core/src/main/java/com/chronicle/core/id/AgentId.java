package com.chronicle.core.id;

public record AgentId(String externalId) implements ChronicleIri {

    public AgentId {
        Iris.requireExternalId(externalId, "Agent");
    }

    public static AgentId fromExternalId(String externalId) {
        return new AgentId(externalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "agent:" + Iris.encode(externalId);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
