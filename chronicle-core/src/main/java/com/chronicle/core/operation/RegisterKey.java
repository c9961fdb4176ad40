package com.chronicle.core.operation;

import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.IdentityId;
import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

/**
 * Register a public key as the agent's current identity.
 */
public record RegisterKey(NamespaceId namespace, AgentId id, String publicKey) implements ChronicleOperation {

    public RegisterKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(publicKey, "publicKey");
    }

    public static RegisterKey of(NamespaceId namespace, AgentId id, String publicKey) {
        return new RegisterKey(namespace, id, publicKey);
    }

    public IdentityId identityId() {
        return IdentityId.fromAgent(id, publicKey);
    }

    @Override
    public OperationType type() {
        return OperationType.REGISTER_KEY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRegisterKey(this);
    }
}
