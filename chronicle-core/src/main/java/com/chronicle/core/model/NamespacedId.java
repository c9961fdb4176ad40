package com.chronicle.core.model;

import com.chronicle.core.id.ChronicleIri;
import com.chronicle.core.id.NamespaceId;

/**
 * Composite (namespace, resource) key used throughout the model.
 */
public record NamespacedId<T extends ChronicleIri>(NamespaceId namespace, T id)
        implements Comparable<NamespacedId<T>> {

    public static <T extends ChronicleIri> NamespacedId<T> of(NamespaceId namespace, T id) {
        return new NamespacedId<>(namespace, id);
    }

    @Override
    public int compareTo(NamespacedId<T> other) {
        int byNamespace = namespace.compareTo(other.namespace);
        return byNamespace != 0 ? byNamespace : id.compareTo(other.id);
    }
}
