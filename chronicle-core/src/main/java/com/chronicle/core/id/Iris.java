package com.chronicle.core.id;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Helpers for building Chronicle IRIs from external ids.
 */
final class Iris {

    private Iris() {
    }

    /**
     * Percent-encode an external id so that ':' and '=' cannot be confused with IRI separators.
     */
    static String encode(String externalId) {
        return URLEncoder.encode(externalId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String optional(String value) {
        return value == null ? "" : encode(value);
    }

    /**
     * An absent optional component renders as the empty string, so a present one must not be empty.
     */
    static String requireNonEmptyIfPresent(String value, String kind) {
        if (value != null && value.isEmpty()) {
            throw new IllegalArgumentException(kind + " must not be empty when present");
        }
        return value;
    }

    static String requireExternalId(String externalId, String kind) {
        Objects.requireNonNull(externalId, kind + " external id must not be null");
        return externalId;
    }
}
