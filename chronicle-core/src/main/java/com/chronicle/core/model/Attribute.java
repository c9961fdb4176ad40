package com.chronicle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A typed attribute value. The value is opaque: it is only ever compared for equality.
 */
public record Attribute(String typ, JsonNode value) {

    public Attribute {
        Objects.requireNonNull(typ, "Attribute type must not be null");
        Objects.requireNonNull(value, "Attribute value must not be null");
    }

    @Override
    public String toString() {
        return typ + "=" + value;
    }
}
