package com.chronicle.engine.persistence;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.ledger.StateOutput;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.operation.ActivityExists;
import com.chronicle.core.operation.ChronicleOperation;
import com.chronicle.core.operation.CreateNamespace;
import com.chronicle.core.operation.StartActivity;
import com.chronicle.engine.test.LedgerHarness;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static com.chronicle.engine.test.LedgerHarness.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Ledger State Tests")
public class InMemoryLedgerStateRepositoryTest {

    private static final NamespaceId NS = LedgerHarness.namespace("store");
    private static final NamespaceId OTHER = LedgerHarness.namespace("other");

    private InMemoryLedgerStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLedgerStateRepository();
    }

    private static ProvModel fragment(ChronicleOperation operation) {
        ProvModel model = new ProvModel();
        model.apply(operation);
        return model;
    }

    @Test
    @DisplayName("Missing addresses load as null, in request order")
    void testLoadAllMarksMissing() {
        LedgerAddress build = LedgerAddress.inNamespace(NS, BUILD);
        repository.writeAll(List.of(new StateOutput<>(build, fragment(ActivityExists.of(NS, "build")))));

        Map<LedgerAddress, ProvModel> loaded = repository.loadAll(List.of(LedgerAddress.namespace(NS), build));

        assertEquals(List.of(LedgerAddress.namespace(NS), build), List.copyOf(loaded.keySet()));
        assertNull(loaded.get(LedgerAddress.namespace(NS)));
        assertNotNull(loaded.get(build));
    }

    @Test
    @DisplayName("Stored fragments are isolated from caller mutation")
    void testFragmentsAreCopied() {
        LedgerAddress build = LedgerAddress.inNamespace(NS, BUILD);
        ProvModel written = fragment(ActivityExists.of(NS, "build"));
        repository.writeAll(List.of(new StateOutput<>(build, written)));

        written.apply(StartActivity.of(NS, BUILD, T));
        repository.findByAddress(build).orElseThrow().apply(StartActivity.of(NS, BUILD, T.plusSeconds(1)));

        assertNull(repository.findByAddress(build).orElseThrow().activity(NS, BUILD).orElseThrow().started());
    }

    @Test
    @DisplayName("Namespace lookup includes the namespace record and excludes other namespaces")
    void testFindByNamespace() {
        repository.writeAll(List.of(
            new StateOutput<>(LedgerAddress.namespace(NS), fragment(CreateNamespace.of(NS))),
            new StateOutput<>(LedgerAddress.inNamespace(NS, BUILD), fragment(ActivityExists.of(NS, "build"))),
            new StateOutput<>(LedgerAddress.namespace(OTHER), fragment(CreateNamespace.of(OTHER))),
            new StateOutput<>(LedgerAddress.inNamespace(OTHER, BUILD), fragment(ActivityExists.of(OTHER, "build")))));

        List<ProvModel> fragments = repository.findByNamespace(NS);

        assertEquals(2, fragments.size());
        assertEquals(4, repository.count());
        assertTrue(fragments.stream().noneMatch(f -> f.namespace(OTHER).isPresent()));
    }
}
