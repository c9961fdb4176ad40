package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.DelegationId;
import com.chronicle.core.id.NamespaceId;
import java.util.Comparator;

/**
 * Delegate agent acting on behalf of a responsible agent,
 * optionally for a specific activity and in a role.
 */
public record Delegation(
    NamespaceId namespaceId,
    DelegationId id,
    AgentId delegateId,
    AgentId responsibleId,
    ActivityId activityId,
    String role
) implements Comparable<Delegation> {

    private static final Comparator<Delegation> ORDER = Comparator
        .comparing(Delegation::namespaceId)
        .thenComparing(Delegation::id)
        .thenComparing(Delegation::activityId, Relations::compareNullable)
        .thenComparing(Delegation::role, Relations::compareNullable);

    public static Delegation of(
            NamespaceId namespaceId,
            AgentId delegateId,
            AgentId responsibleId,
            ActivityId activityId,
            String role) {
        return new Delegation(
            namespaceId,
            DelegationId.fromComponentIds(delegateId, responsibleId, activityId, role),
            delegateId,
            responsibleId,
            activityId,
            role
        );
    }

    @Override
    public int compareTo(Delegation other) {
        return ORDER.compare(this, other);
    }
}
