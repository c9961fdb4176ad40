package com.chronicle.core.ledger;

import com.chronicle.core.model.ProvModel;
import java.util.Objects;

/**
 * A state fragment read from ledger storage for one address, used as merge input.
 */
public record StateInput(ProvModel fragment) {

    public StateInput {
        Objects.requireNonNull(fragment, "fragment");
    }
}
