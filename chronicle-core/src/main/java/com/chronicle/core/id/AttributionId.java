package com.chronicle.core.id;

/**
 * Composite identifier of an entity's attribution to an agent, optionally in a role.
 */
public record AttributionId(String agent, String entity, String role) implements ChronicleIri {

    public AttributionId {
        Iris.requireExternalId(agent, "Attribution agent");
        Iris.requireExternalId(entity, "Attribution entity");
        Iris.requireNonEmptyIfPresent(role, "Attribution role");
    }

    public static AttributionId fromComponentIds(AgentId agent, EntityId entity, String role) {
        return new AttributionId(agent.externalId(), entity.externalId(), role);
    }

    public AgentId agentId() {
        return AgentId.fromExternalId(agent);
    }

    public EntityId entityId() {
        return EntityId.fromExternalId(entity);
    }

    @Override
    public String toIri() {
        return PREFIX + "attribution:" + Iris.encode(agent) + ":" + Iris.encode(entity)
            + ":role=" + Iris.optional(role);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
