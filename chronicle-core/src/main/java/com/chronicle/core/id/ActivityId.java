package com.chronicle.core.id;

public record ActivityId(String externalId) implements ChronicleIri {

    public ActivityId {
        Iris.requireExternalId(externalId, "Activity");
    }

    public static ActivityId fromExternalId(String externalId) {
        return new ActivityId(externalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "activity:" + Iris.encode(externalId);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
