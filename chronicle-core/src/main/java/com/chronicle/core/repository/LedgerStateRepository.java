package com.chronicle.core.repository;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.ledger.StateOutput;
import com.chronicle.core.model.ProvModel;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for per-address ledger state fragments.
 */
public interface LedgerStateRepository {

    /**
     * Find the fragment stored at an address.
     *
     * @param address The ledger address
     * @return The fragment if one has been written
     */
    Optional<ProvModel> findByAddress(LedgerAddress address);

    /**
     * Load several addresses at once.
     *
     * @param addresses The addresses to load
     * @return An entry for every requested address, in request order; the value is null
     *         where nothing is stored
     */
    Map<LedgerAddress, ProvModel> loadAll(Collection<LedgerAddress> addresses);

    /**
     * Write fragments, replacing whatever is stored at their addresses.
     *
     * @param outputs The fragments to write
     */
    void writeAll(Collection<StateOutput<LedgerAddress>> outputs);

    /**
     * All fragments belonging to a namespace, including the namespace record itself.
     *
     * @param namespace The namespace
     * @return Fragments ordered by address
     */
    List<ProvModel> findByNamespace(NamespaceId namespace);

    /**
     * Number of stored addresses.
     */
    long count();
}
