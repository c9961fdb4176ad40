package com.chronicle.core.model;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.IdentityId;
import com.chronicle.core.id.NamespaceId;

/**
 * A public key registered for an agent.
 */
public record Identity(IdentityId id, NamespaceId namespaceId, String publicKey) {

    public static Identity of(NamespaceId namespaceId, AgentId agent, String publicKey) {
        return new Identity(IdentityId.fromAgent(agent, publicKey), namespaceId, publicKey);
    }
}
