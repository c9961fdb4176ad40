package com.chronicle.core.ledger;

import com.chronicle.core.model.ProvModel;
import java.util.Objects;
import java.util.Optional;

/**
 * A cached state value and the number of times it has actually changed.
 */
public final class Version {

    private int version;
    private ProvModel value;

    public Version(int version, ProvModel value) {
        this.version = version;
        this.value = value;
    }

    /**
     * Replace the value, bumping the version only if the new value differs.
     */
    public void write(ProvModel newValue) {
        if (!Objects.equals(newValue, value)) {
            version++;
            value = newValue;
        }
    }

    public int version() {
        return version;
    }

    public Optional<ProvModel> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return "Version{version=" + version + ", present=" + (value != null) + "}";
    }
}
