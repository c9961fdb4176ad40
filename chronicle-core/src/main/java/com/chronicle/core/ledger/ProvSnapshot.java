package com.chronicle.core.ledger;

import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.IdentityId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.NamespacedId;
import com.chronicle.core.model.ProvModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a model into one fragment per ledger address and combines fragments back.
 *
 * {@code combine(toSnapshot(m))} equals {@code m}.
 */
public final class ProvSnapshot {

    private ProvSnapshot() {
    }

    public static List<StateOutput<LedgerAddress>> toSnapshot(ProvModel model) {
        List<StateOutput<LedgerAddress>> outputs = new ArrayList<>();

        for (NamespaceId namespace : model.namespaces().keySet()) {
            outputs.add(new StateOutput<>(LedgerAddress.namespace(namespace), model.namespaceFragment(namespace)));
        }
        for (NamespacedId<AgentId> key : model.agentKeys()) {
            outputs.add(new StateOutput<>(address(key), model.agentFragment(key)));
        }
        for (NamespacedId<IdentityId> key : model.identityKeys()) {
            outputs.add(new StateOutput<>(address(key), model.identityFragment(key)));
        }
        for (NamespacedId<ActivityId> key : model.activityKeys()) {
            outputs.add(new StateOutput<>(address(key), model.activityFragment(key)));
        }
        for (NamespacedId<EntityId> key : model.entityKeys()) {
            outputs.add(new StateOutput<>(address(key), model.entityFragment(key)));
        }
        return outputs;
    }

    public static ProvModel combine(Iterable<ProvModel> fragments) {
        ProvModel model = new ProvModel();
        for (ProvModel fragment : fragments) {
            model.merge(fragment);
        }
        return model;
    }

    public static ProvModel combineOutputs(Iterable<? extends StateOutput<?>> outputs) {
        ProvModel model = new ProvModel();
        for (StateOutput<?> output : outputs) {
            model.merge(output.fragment());
        }
        return model;
    }

    private static LedgerAddress address(NamespacedId<?> key) {
        return LedgerAddress.inNamespace(key.namespace(), key.id());
    }
}
