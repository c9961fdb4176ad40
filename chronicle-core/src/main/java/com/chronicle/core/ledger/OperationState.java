package com.chronicle.core.ledger;

import com.chronicle.core.model.ProvModel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cache of ledger state used across one transaction.
 *
 * Loaded fragments start at version 0. Every later write bumps the version only when
 * the value actually changes, so {@link #dirty()} yields exactly the addresses that
 * need persisting.
 *
 * @param <T> the address type
 */
public final class OperationState<T extends Comparable<? super T>> {

    private final TreeMap<T, Version> state = new TreeMap<>();

    /**
     * Seed or overwrite cached values. A null value marks an address with no stored state.
     */
    public void updateState(Map<T, ProvModel> entries) {
        entries.forEach(this::write);
    }

    public void updateStateFromOutput(Collection<StateOutput<T>> outputs) {
        for (StateOutput<T> output : outputs) {
            write(output.address(), output.fragment());
        }
    }

    private void write(T address, ProvModel value) {
        state.computeIfAbsent(address, key -> new Version(0, value)).write(value);
    }

    /**
     * All currently held fragments.
     */
    public List<StateInput> input() {
        List<StateInput> inputs = new ArrayList<>();
        for (Version version : state.values()) {
            version.value().ifPresent(value -> inputs.add(new StateInput(value)));
        }
        return inputs;
    }

    /**
     * The held fragments for the given addresses only.
     */
    public List<StateInput> inputFor(Collection<T> addresses) {
        Set<T> wanted = new TreeSet<>(addresses);
        List<StateInput> inputs = new ArrayList<>();
        state.forEach((address, version) -> {
            if (wanted.contains(address)) {
                version.value().ifPresent(value -> inputs.add(new StateInput(value)));
            }
        });
        return inputs;
    }

    /**
     * Drain the cache, returning only the addresses whose value changed and is present.
     */
    public List<StateOutput<T>> dirty() {
        List<StateOutput<T>> outputs = new ArrayList<>();
        state.forEach((address, version) -> {
            if (version.version() > 0) {
                version.value().ifPresent(value -> outputs.add(new StateOutput<>(address, value)));
            }
        });
        state.clear();
        return outputs;
    }

    public int size() {
        return state.size();
    }
}
