package com.chronicle.core.exception;

import com.chronicle.core.model.Attribute;
import java.time.Instant;

/**
 * One reason an operation conflicts with already-recorded state.
 */
public interface ContradictionDetail {

    String describe();

    /**
     * An attribute that already has a different type or value.
     */
    record AttributeValueChange(String name, Attribute value, Attribute attempted) implements ContradictionDetail {
        @Override
        public String describe() {
            return String.format("attribute %s: %s(%s) != %s(%s)",
                name, value.typ(), value.value(), attempted.typ(), attempted.value());
        }
    }

    record StartAlteration(Instant value, Instant attempted) implements ContradictionDetail {
        @Override
        public String describe() {
            return String.format("start date alteration: %s != %s", value, attempted);
        }
    }

    record EndAlteration(Instant value, Instant attempted) implements ContradictionDetail {
        @Override
        public String describe() {
            return String.format("end date alteration: %s != %s", value, attempted);
        }
    }

    /**
     * Start would fall after end.
     */
    record InvalidRange(Instant start, Instant end) implements ContradictionDetail {
        @Override
        public String describe() {
            return String.format("invalid range: start %s is after end %s", start, end);
        }
    }
}
