package com.chronicle.core.id;

/**
 * Common contract for every Chronicle identifier.
 * Identifiers are value types: equality is structural and ordering follows the IRI text.
 */
public interface ChronicleIri extends Comparable<ChronicleIri> {

    String PREFIX = "chronicle:";

    /**
     * The compact IRI form, e.g. {@code chronicle:agent:alice}.
     */
    String toIri();

    @Override
    default int compareTo(ChronicleIri other) {
        return toIri().compareTo(other.toIri());
    }
}
