package com.chronicle.core.ledger;

import com.chronicle.core.id.ChronicleIri;
import com.chronicle.core.id.NamespaceId;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A (namespace, resource) key identifying one independently stored slice of ledger state.
 * Namespace addresses have no namespace part.
 */
public record LedgerAddress(NamespaceId namespace, ChronicleIri resource) implements Comparable<LedgerAddress> {

    private static final Comparator<LedgerAddress> ORDER = Comparator
        .<LedgerAddress, NamespaceId>comparing(LedgerAddress::namespace,
            Comparator.nullsFirst(Comparator.<NamespaceId>naturalOrder()))
        .thenComparing(LedgerAddress::resource, Comparator.<ChronicleIri>naturalOrder());

    public LedgerAddress {
        Objects.requireNonNull(resource, "resource");
    }

    /**
     * The address of a namespace record.
     */
    public static LedgerAddress namespace(NamespaceId namespace) {
        return new LedgerAddress(null, namespace);
    }

    public static LedgerAddress inNamespace(NamespaceId namespace, ChronicleIri resource) {
        return new LedgerAddress(Objects.requireNonNull(namespace, "namespace"), resource);
    }

    public Optional<NamespaceId> namespacePart() {
        return Optional.ofNullable(namespace);
    }

    @Override
    public int compareTo(LedgerAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return namespace == null ? resource.toIri() : namespace.toIri() + ":" + resource.toIri();
    }
}
