package com.chronicle.core.operation;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.Dependencies;
import com.chronicle.core.ledger.LedgerAddress;
import java.util.List;

/**
 * An atomic provenance fact. The variant set is closed: every implementation
 * is dispatched through {@link Visitor}, so adding a variant forces every
 * visitor (apply, dependencies) to handle it.
 */
public interface ChronicleOperation {

    /**
     * The namespace the operation is recorded in.
     */
    NamespaceId namespace();

    OperationType type();

    <R> R accept(Visitor<R> visitor);

    /**
     * Every ledger address this operation reads or writes, each exactly once.
     */
    default List<LedgerAddress> dependencies() {
        return Dependencies.of(this);
    }

    interface Visitor<R> {

        R visitCreateNamespace(CreateNamespace operation);

        R visitAgentExists(AgentExists operation);

        R visitActsOnBehalfOf(ActsOnBehalfOf operation);

        R visitActivityExists(ActivityExists operation);

        R visitStartActivity(StartActivity operation);

        R visitEndActivity(EndActivity operation);

        R visitActivityUses(ActivityUses operation);

        R visitEntityExists(EntityExists operation);

        R visitWasGeneratedBy(WasGeneratedBy operation);

        R visitEntityDerive(EntityDerive operation);

        R visitSetAgentAttributes(SetAgentAttributes operation);

        R visitSetActivityAttributes(SetActivityAttributes operation);

        R visitSetEntityAttributes(SetEntityAttributes operation);

        R visitWasAssociatedWith(WasAssociatedWith operation);

        R visitWasAttributedTo(WasAttributedTo operation);

        R visitWasInformedBy(WasInformedBy operation);

        R visitRegisterKey(RegisterKey operation);
    }
}
