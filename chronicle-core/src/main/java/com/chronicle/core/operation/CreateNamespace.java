package com.chronicle.core.operation;

import com.chronicle.core.id.NamespaceId;
import java.util.Objects;

public record CreateNamespace(NamespaceId id) implements ChronicleOperation {

    public CreateNamespace {
        Objects.requireNonNull(id, "id");
    }

    public static CreateNamespace of(NamespaceId id) {
        return new CreateNamespace(id);
    }

    @Override
    public NamespaceId namespace() {
        return id;
    }

    @Override
    public OperationType type() {
        return OperationType.CREATE_NAMESPACE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCreateNamespace(this);
    }
}
