package com.chronicle.core.id;

/**
 * Composite identifier of an agent's association with an activity, optionally in a role.
 */
public record AssociationId(String agent, String activity, String role) implements ChronicleIri {

    public AssociationId {
        Iris.requireExternalId(agent, "Association agent");
        Iris.requireExternalId(activity, "Association activity");
        Iris.requireNonEmptyIfPresent(role, "Association role");
    }

    public static AssociationId fromComponentIds(AgentId agent, ActivityId activity, String role) {
        return new AssociationId(agent.externalId(), activity.externalId(), role);
    }

    public AgentId agentId() {
        return AgentId.fromExternalId(agent);
    }

    public ActivityId activityId() {
        return ActivityId.fromExternalId(activity);
    }

    @Override
    public String toIri() {
        return PREFIX + "association:" + Iris.encode(agent) + ":" + Iris.encode(activity)
            + ":role=" + Iris.optional(role);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
