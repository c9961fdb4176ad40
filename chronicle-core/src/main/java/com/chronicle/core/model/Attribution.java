package com.chronicle.core.model;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.AttributionId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Comparator;

/**
 * Entity attributed to an agent, optionally in a role.
 */
public record Attribution(
    NamespaceId namespaceId,
    AttributionId id,
    AgentId agentId,
    EntityId entityId,
    String role
) implements Comparable<Attribution> {

    private static final Comparator<Attribution> ORDER = Comparator
        .comparing(Attribution::namespaceId)
        .thenComparing(Attribution::id)
        .thenComparing(Attribution::role, Relations::compareNullable);

    public static Attribution of(NamespaceId namespaceId, AgentId agentId, EntityId entityId, String role) {
        return new Attribution(
            namespaceId,
            AttributionId.fromComponentIds(agentId, entityId, role),
            agentId,
            entityId,
            role
        );
    }

    @Override
    public int compareTo(Attribution other) {
        return ORDER.compare(this, other);
    }
}
