package com.chronicle.core.id;

import java.util.Optional;

/**
 * Composite identifier of a delegation: delegate acting on behalf of responsible,
 * optionally scoped to an activity and a role.
 */
public record DelegationId(String delegate, String responsible, String activity, String role)
        implements ChronicleIri {

    public DelegationId {
        Iris.requireExternalId(delegate, "Delegation delegate");
        Iris.requireExternalId(responsible, "Delegation responsible");
        Iris.requireNonEmptyIfPresent(activity, "Delegation activity");
        Iris.requireNonEmptyIfPresent(role, "Delegation role");
    }

    public static DelegationId fromComponentIds(
            AgentId delegate,
            AgentId responsible,
            ActivityId activity,
            String role) {
        return new DelegationId(
            delegate.externalId(),
            responsible.externalId(),
            activity == null ? null : activity.externalId(),
            role
        );
    }

    public AgentId delegateId() {
        return AgentId.fromExternalId(delegate);
    }

    public AgentId responsibleId() {
        return AgentId.fromExternalId(responsible);
    }

    public Optional<ActivityId> activityId() {
        return Optional.ofNullable(activity).map(ActivityId::fromExternalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "delegation:" + Iris.encode(delegate) + ":" + Iris.encode(responsible)
            + ":role=" + Iris.optional(role) + ":activity=" + Iris.optional(activity);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
