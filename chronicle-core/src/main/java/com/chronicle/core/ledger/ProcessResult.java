package com.chronicle.core.ledger;

import com.chronicle.core.model.ProvModel;
import java.util.List;

/**
 * The outcome of processing one operation: every fragment of the working model, and the model.
 */
public record ProcessResult(List<StateOutput<LedgerAddress>> outputs, ProvModel model) {

    public ProcessResult {
        outputs = List.copyOf(outputs);
    }
}
