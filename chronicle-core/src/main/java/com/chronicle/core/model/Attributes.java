package com.chronicle.core.model;

import com.chronicle.core.id.DomaintypeId;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The attribute payload carried by a SetAttributes operation: an optional domain type
 * plus the attribute mapping.
 */
public record Attributes(DomaintypeId typ, SortedMap<String, Attribute> items) {

    public Attributes {
        items = items == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(items));
    }

    public static Attributes of(DomaintypeId typ, Map<String, Attribute> items) {
        return new Attributes(typ, new TreeMap<>(items));
    }

    public static Attributes untyped(Map<String, Attribute> items) {
        return of(null, items);
    }

    public static Attributes empty() {
        return new Attributes(null, null);
    }
}
