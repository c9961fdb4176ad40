package com.chronicle.core.model;

import java.util.Comparator;

/**
 * Null-tolerant orderings shared by the relation records.
 */
final class Relations {

    private Relations() {
    }

    static <T extends Comparable<? super T>> int compareNullable(T left, T right) {
        return Comparator.<T>nullsFirst(Comparator.naturalOrder()).compare(left, right);
    }
}
