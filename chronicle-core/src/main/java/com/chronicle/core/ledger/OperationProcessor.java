package com.chronicle.core.ledger;

import com.chronicle.core.exception.ContradictionException;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.operation.ChronicleOperation;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies one operation to a working model built from ledger state.
 */
public class OperationProcessor {

    private static final Logger log = LoggerFactory.getLogger(OperationProcessor.class);

    /**
     * Merge the input fragments into {@code model}, apply the operation and decompose
     * the result back into per-address fragments.
     *
     * The model is mutated in place and returned in the result. On contradiction it is
     * left partially updated and must be discarded.
     *
     * @throws ContradictionException if the operation conflicts with the loaded state
     */
    public ProcessResult process(ChronicleOperation operation, ProvModel model, List<StateInput> inputs) {
        for (StateInput input : inputs) {
            model.merge(input.fragment());
        }
        log.debug("Processing {} against {} input fragments", operation.type(), inputs.size());

        model.apply(operation);

        List<StateOutput<LedgerAddress>> outputs = ProvSnapshot.toSnapshot(model);
        log.trace("{} produced {} outputs", operation.type(), outputs.size());
        return new ProcessResult(outputs, model);
    }
}
