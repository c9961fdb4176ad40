package com.chronicle.core.ledger;

import com.chronicle.core.model.ProvModel;
import java.util.Objects;

/**
 * A state fragment to be written back to the ledger at an address.
 */
public record StateOutput<T>(T address, ProvModel fragment) {

    public StateOutput {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(fragment, "fragment");
    }
}
