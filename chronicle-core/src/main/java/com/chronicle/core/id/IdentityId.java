package com.chronicle.core.id;

/**
 * A public key registered for an agent. Rotating an agent's key produces a new IdentityId.
 */
public record IdentityId(String agentExternalId, String publicKey) implements ChronicleIri {

    public IdentityId {
        Iris.requireExternalId(agentExternalId, "Identity agent");
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("Identity public key must not be blank");
        }
    }

    public static IdentityId fromAgent(AgentId agent, String publicKey) {
        return new IdentityId(agent.externalId(), publicKey);
    }

    public AgentId agent() {
        return AgentId.fromExternalId(agentExternalId);
    }

    @Override
    public String toIri() {
        return PREFIX + "identity:" + Iris.encode(agentExternalId) + ":" + Iris.encode(publicKey);
    }

    @Override
    public String toString() {
        return toIri();
    }
}
