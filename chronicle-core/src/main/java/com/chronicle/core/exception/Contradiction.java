package com.chronicle.core.exception;

import com.chronicle.core.id.ChronicleIri;
import com.chronicle.core.id.NamespaceId;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The set of conflicts found when applying an operation to a resource.
 */
public record Contradiction(ChronicleIri id, NamespaceId namespace, List<ContradictionDetail> details) {

    public Contradiction {
        details = List.copyOf(details);
    }

    public static Contradiction of(ChronicleIri id, NamespaceId namespace, ContradictionDetail detail) {
        return new Contradiction(id, namespace, List.of(detail));
    }

    public String describe() {
        return String.format("Contradiction on %s in %s: %s", id.toIri(), namespace.toIri(),
            details.stream().map(ContradictionDetail::describe).collect(Collectors.joining("; ")));
    }
}
