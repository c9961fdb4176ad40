package com.chronicle.engine.persistence;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.ledger.StateOutput;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.repository.LedgerStateRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of LedgerStateRepository.
 * Fragments are copied on the way in and out so callers never share mutable state.
 */
@Repository
public class InMemoryLedgerStateRepository implements LedgerStateRepository {

    private final Map<LedgerAddress, ProvModel> state = new ConcurrentHashMap<>();

    @Override
    public Optional<ProvModel> findByAddress(LedgerAddress address) {
        return Optional.ofNullable(state.get(address)).map(ProvModel::copy);
    }

    @Override
    public Map<LedgerAddress, ProvModel> loadAll(Collection<LedgerAddress> addresses) {
        Map<LedgerAddress, ProvModel> loaded = new LinkedHashMap<>();
        for (LedgerAddress address : addresses) {
            ProvModel fragment = state.get(address);
            loaded.put(address, fragment == null ? null : fragment.copy());
        }
        return loaded;
    }

    @Override
    public void writeAll(Collection<StateOutput<LedgerAddress>> outputs) {
        for (StateOutput<LedgerAddress> output : outputs) {
            state.put(output.address(), output.fragment().copy());
        }
    }

    @Override
    public List<ProvModel> findByNamespace(NamespaceId namespace) {
        return state.entrySet().stream()
            .filter(e -> belongsTo(e.getKey(), namespace))
            .sorted(Map.Entry.comparingByKey())
            .map(e -> e.getValue().copy())
            .collect(Collectors.toList());
    }

    private static boolean belongsTo(LedgerAddress address, NamespaceId namespace) {
        return address.namespacePart()
            .map(namespace::equals)
            .orElseGet(() -> address.resource().equals(namespace));
    }

    @Override
    public long count() {
        return state.size();
    }
}
