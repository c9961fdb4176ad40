package com.chronicle.core.model;

/**
 * Classification of an entity-derived-from-entity relation.
 * Codes match the stored representation used by downstream persistence.
 */
public enum DerivationType {
    NONE(-1),
    REVISION(1),
    QUOTATION(2),
    PRIMARY_SOURCE(3);

    private final int code;

    DerivationType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static DerivationType fromCode(int code) {
        for (DerivationType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unrecognized derivation type code: " + code);
    }
}
