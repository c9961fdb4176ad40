package com.chronicle.core.model;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.AssociationId;
import com.chronicle.core.id.NamespaceId;
import java.util.Comparator;

/**
 * Agent associated with an activity, optionally in a role.
 */
public record Association(
    NamespaceId namespaceId,
    AssociationId id,
    AgentId agentId,
    ActivityId activityId,
    String role
) implements Comparable<Association> {

    private static final Comparator<Association> ORDER = Comparator
        .comparing(Association::namespaceId)
        .thenComparing(Association::id)
        .thenComparing(Association::role, Relations::compareNullable);

    public static Association of(NamespaceId namespaceId, AgentId agentId, ActivityId activityId, String role) {
        return new Association(
            namespaceId,
            AssociationId.fromComponentIds(agentId, activityId, role),
            agentId,
            activityId,
            role
        );
    }

    @Override
    public int compareTo(Association other) {
        return ORDER.compare(this, other);
    }
}
