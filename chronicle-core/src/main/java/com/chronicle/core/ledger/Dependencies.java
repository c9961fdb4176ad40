package com.chronicle.core.ledger;

import com.chronicle.core.id.ChronicleIri;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.operation.ActivityExists;
import com.chronicle.core.operation.ActivityUses;
import com.chronicle.core.operation.ActsOnBehalfOf;
import com.chronicle.core.operation.AgentExists;
import com.chronicle.core.operation.ChronicleOperation;
import com.chronicle.core.operation.CreateNamespace;
import com.chronicle.core.operation.EndActivity;
import com.chronicle.core.operation.EntityDerive;
import com.chronicle.core.operation.EntityExists;
import com.chronicle.core.operation.RegisterKey;
import com.chronicle.core.operation.SetActivityAttributes;
import com.chronicle.core.operation.SetAgentAttributes;
import com.chronicle.core.operation.SetEntityAttributes;
import com.chronicle.core.operation.StartActivity;
import com.chronicle.core.operation.WasAssociatedWith;
import com.chronicle.core.operation.WasAttributedTo;
import com.chronicle.core.operation.WasGeneratedBy;
import com.chronicle.core.operation.WasInformedBy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the ledger addresses an operation reads and writes.
 *
 * The result depends only on the operation's fields: the namespace address, then one
 * address per resource id the operation names, with optional ids included only when
 * present. Input and output addresses are symmetric.
 */
public final class Dependencies implements ChronicleOperation.Visitor<List<LedgerAddress>> {

    private static final Dependencies INSTANCE = new Dependencies();

    private Dependencies() {
    }

    public static List<LedgerAddress> of(ChronicleOperation operation) {
        return operation.accept(INSTANCE);
    }

    /**
     * The union of the dependencies of several operations, in first-occurrence order.
     */
    public static List<LedgerAddress> union(Collection<? extends ChronicleOperation> operations) {
        Set<LedgerAddress> addresses = new LinkedHashSet<>();
        for (ChronicleOperation operation : operations) {
            addresses.addAll(of(operation));
        }
        return new ArrayList<>(addresses);
    }

    private static List<LedgerAddress> addresses(NamespaceId namespace, ChronicleIri... resources) {
        Set<LedgerAddress> addresses = new LinkedHashSet<>();
        addresses.add(LedgerAddress.namespace(namespace));
        for (ChronicleIri resource : resources) {
            if (resource != null) {
                addresses.add(LedgerAddress.inNamespace(namespace, resource));
            }
        }
        return List.copyOf(addresses);
    }

    @Override
    public List<LedgerAddress> visitCreateNamespace(CreateNamespace operation) {
        return addresses(operation.id());
    }

    @Override
    public List<LedgerAddress> visitAgentExists(AgentExists operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitActsOnBehalfOf(ActsOnBehalfOf operation) {
        return addresses(operation.namespace(),
            operation.id(), operation.delegateId(), operation.responsibleId(), operation.activityId());
    }

    @Override
    public List<LedgerAddress> visitActivityExists(ActivityExists operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitStartActivity(StartActivity operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitEndActivity(EndActivity operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitActivityUses(ActivityUses operation) {
        return addresses(operation.namespace(), operation.id(), operation.activity());
    }

    @Override
    public List<LedgerAddress> visitEntityExists(EntityExists operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitWasGeneratedBy(WasGeneratedBy operation) {
        return addresses(operation.namespace(), operation.id(), operation.activity());
    }

    @Override
    public List<LedgerAddress> visitEntityDerive(EntityDerive operation) {
        return addresses(operation.namespace(), operation.id(), operation.usedId(), operation.activityId());
    }

    @Override
    public List<LedgerAddress> visitSetAgentAttributes(SetAgentAttributes operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitSetActivityAttributes(SetActivityAttributes operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitSetEntityAttributes(SetEntityAttributes operation) {
        return addresses(operation.namespace(), operation.id());
    }

    @Override
    public List<LedgerAddress> visitWasAssociatedWith(WasAssociatedWith operation) {
        return addresses(operation.namespace(), operation.id(), operation.activityId(), operation.agentId());
    }

    @Override
    public List<LedgerAddress> visitWasAttributedTo(WasAttributedTo operation) {
        return addresses(operation.namespace(), operation.id(), operation.entityId(), operation.agentId());
    }

    @Override
    public List<LedgerAddress> visitWasInformedBy(WasInformedBy operation) {
        return addresses(operation.namespace(), operation.activity(), operation.informingActivity());
    }

    @Override
    public List<LedgerAddress> visitRegisterKey(RegisterKey operation) {
        return addresses(operation.namespace(), operation.id(), operation.identityId());
    }
}
