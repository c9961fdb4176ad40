package com.chronicle.core.model;

import com.chronicle.core.exception.Contradiction;
import com.chronicle.core.exception.ContradictionDetail;
import com.chronicle.core.exception.ContradictionException;
import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.AgentId;
import com.chronicle.core.id.ChronicleIri;
import com.chronicle.core.id.EntityId;
import com.chronicle.core.id.IdentityId;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The materialized provenance graph.
 *
 * All resource records and relation sets are keyed by (namespace, resource id).
 * Mutation is monotonic: records are created on first reference and never removed,
 * relation sets only grow, and attribute and time changes are gated by contradiction
 * checks in {@link #apply(ChronicleOperation)}.
 *
 * Instances are not thread safe. A model is owned by one validating thread for the
 * duration of a transaction.
 */
public final class ProvModel {

    private static final Logger log = LoggerFactory.getLogger(ProvModel.class);

    private final TreeMap<NamespaceId, Namespace> namespaces = new TreeMap<>();

    private final TreeMap<NamespacedId<AgentId>, Agent> agents = new TreeMap<>();
    private final TreeMap<NamespacedId<AgentId>, TreeSet<Delegation>> actedOnBehalfOf = new TreeMap<>();
    private final TreeMap<NamespacedId<AgentId>, TreeSet<Delegation>> delegation = new TreeMap<>();
    private final TreeMap<NamespacedId<AgentId>, IdentityId> hasIdentity = new TreeMap<>();
    private final TreeMap<NamespacedId<AgentId>, TreeSet<IdentityId>> hadIdentity = new TreeMap<>();

    private final TreeMap<NamespacedId<IdentityId>, Identity> identities = new TreeMap<>();

    private final TreeMap<NamespacedId<EntityId>, Entity> entities = new TreeMap<>();
    private final TreeMap<NamespacedId<EntityId>, TreeSet<Derivation>> derivation = new TreeMap<>();
    private final TreeMap<NamespacedId<EntityId>, TreeSet<Generation>> generation = new TreeMap<>();
    private final TreeMap<NamespacedId<EntityId>, TreeSet<Attribution>> attribution = new TreeMap<>();

    private final TreeMap<NamespacedId<ActivityId>, Activity> activities = new TreeMap<>();
    private final TreeMap<NamespacedId<ActivityId>, TreeSet<NamespacedId<ActivityId>>> wasInformedBy =
        new TreeMap<>();
    private final TreeMap<NamespacedId<ActivityId>, TreeSet<GeneratedEntity>> generated = new TreeMap<>();
    private final TreeMap<NamespacedId<ActivityId>, TreeSet<Association>> association = new TreeMap<>();
    private final TreeMap<NamespacedId<ActivityId>, TreeSet<Usage>> usage = new TreeMap<>();

    public ProvModel() {
    }

    /**
     * Fold a sequence of operations into an empty model.
     *
     * @throws ContradictionException on the first contradicting operation
     */
    public static ProvModel fromOperations(Iterable<? extends ChronicleOperation> operations) {
        ProvModel model = new ProvModel();
        for (ChronicleOperation operation : operations) {
            model.apply(operation);
        }
        return model;
    }

    // ========== Ensure-exists primitives ==========

    public void namespaceContext(NamespaceId namespace) {
        namespaces.putIfAbsent(namespace, Namespace.of(namespace));
    }

    public void agentContext(NamespaceId namespace, AgentId agent) {
        agents.computeIfAbsent(NamespacedId.of(namespace, agent), key -> Agent.exists(namespace, agent));
    }

    public void activityContext(NamespaceId namespace, ActivityId activity) {
        activities.computeIfAbsent(NamespacedId.of(namespace, activity), key -> Activity.exists(namespace, activity));
    }

    public void entityContext(NamespaceId namespace, EntityId entity) {
        entities.computeIfAbsent(NamespacedId.of(namespace, entity), key -> Entity.exists(namespace, entity));
    }

    // ========== Relation insertion ==========

    /**
     * Record a delegation, indexed under the responsible agent and under the delegate.
     */
    public void qualifiedDelegation(
            NamespaceId namespace,
            AgentId responsibleId,
            AgentId delegateId,
            ActivityId activityId,
            String role) {
        Delegation relation = Delegation.of(namespace, delegateId, responsibleId, activityId, role);
        delegation.computeIfAbsent(NamespacedId.of(namespace, responsibleId), key -> new TreeSet<>()).add(relation);
        actedOnBehalfOf.computeIfAbsent(NamespacedId.of(namespace, delegateId), key -> new TreeSet<>()).add(relation);
    }

    public void qualifiedAssociation(NamespaceId namespace, ActivityId activityId, AgentId agentId, String role) {
        association.computeIfAbsent(NamespacedId.of(namespace, activityId), key -> new TreeSet<>())
            .add(Association.of(namespace, agentId, activityId, role));
    }

    public void qualifiedAttribution(NamespaceId namespace, EntityId entityId, AgentId agentId, String role) {
        attribution.computeIfAbsent(NamespacedId.of(namespace, entityId), key -> new TreeSet<>())
            .add(Attribution.of(namespace, agentId, entityId, role));
    }

    public void wasGeneratedBy(NamespaceId namespace, EntityId generatedId, ActivityId activityId) {
        generation.computeIfAbsent(NamespacedId.of(namespace, generatedId), key -> new TreeSet<>())
            .add(new Generation(activityId, generatedId));
    }

    public void generated(NamespaceId namespace, ActivityId activityId, EntityId entityId) {
        generated.computeIfAbsent(NamespacedId.of(namespace, activityId), key -> new TreeSet<>())
            .add(new GeneratedEntity(entityId, activityId));
    }

    public void used(NamespaceId namespace, ActivityId activityId, EntityId entityId) {
        usage.computeIfAbsent(NamespacedId.of(namespace, activityId), key -> new TreeSet<>())
            .add(new Usage(activityId, entityId));
    }

    public void wasInformedBy(NamespaceId namespace, ActivityId activityId, ActivityId informingActivityId) {
        wasInformedBy.computeIfAbsent(NamespacedId.of(namespace, activityId), key -> new TreeSet<>())
            .add(NamespacedId.of(namespace, informingActivityId));
    }

    public void wasDerivedFrom(
            NamespaceId namespace,
            DerivationType typ,
            EntityId usedId,
            EntityId generatedId,
            ActivityId activityId) {
        derivation.computeIfAbsent(NamespacedId.of(namespace, generatedId), key -> new TreeSet<>())
            .add(new Derivation(generatedId, usedId, activityId, typ));
    }

    /**
     * Make {@code publicKey} the agent's current identity. A previous, different identity
     * moves to the agent's historical set.
     */
    public void newIdentity(NamespaceId namespace, AgentId agentId, String publicKey) {
        Identity identity = Identity.of(namespace, agentId, publicKey);
        NamespacedId<AgentId> key = NamespacedId.of(namespace, agentId);

        IdentityId previous = hasIdentity.get(key);
        if (previous != null && !previous.equals(identity.id())) {
            hadIdentity.computeIfAbsent(key, k -> new TreeSet<>()).add(previous);
        }
        hasIdentity.put(key, identity.id());
        identities.put(NamespacedId.of(namespace, identity.id()), identity);
    }

    // ========== Apply ==========

    /**
     * Fold one operation into this model.
     *
     * Ensure-exists side effects of the operation are applied before the contradiction
     * check, so they remain even when the operation is rejected. Callers processing a
     * transaction must discard the model on failure.
     *
     * @throws ContradictionException if the operation conflicts with recorded state
     */
    public void apply(ChronicleOperation operation) {
        log.trace("Applying {} to model", operation);
        operation.accept(new ApplyVisitor());
    }

    private final class ApplyVisitor implements ChronicleOperation.Visitor<Void> {

        @Override
        public Void visitCreateNamespace(CreateNamespace operation) {
            namespaceContext(operation.id());
            return null;
        }

        @Override
        public Void visitAgentExists(AgentExists operation) {
            namespaceContext(operation.namespace());
            agentContext(operation.namespace(), operation.id());
            return null;
        }

        @Override
        public Void visitActsOnBehalfOf(ActsOnBehalfOf operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            agentContext(namespace, operation.delegateId());
            agentContext(namespace, operation.responsibleId());
            operation.activity().ifPresent(activity -> activityContext(namespace, activity));
            qualifiedDelegation(namespace, operation.responsibleId(), operation.delegateId(),
                operation.activityId(), operation.role());
            return null;
        }

        @Override
        public Void visitActivityExists(ActivityExists operation) {
            namespaceContext(operation.namespace());
            activityContext(operation.namespace(), operation.id());
            return null;
        }

        @Override
        public Void visitStartActivity(StartActivity operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            activityContext(namespace, operation.id());

            NamespacedId<ActivityId> key = NamespacedId.of(namespace, operation.id());
            Activity activity = activities.get(key);
            Instant time = operation.time();

            if (activity.started() != null && !activity.started().equals(time)) {
                throw contradiction(operation.id(), namespace,
                    new ContradictionDetail.StartAlteration(activity.started(), time));
            }
            if (activity.ended() != null && activity.ended().isBefore(time)) {
                throw contradiction(operation.id(), namespace,
                    new ContradictionDetail.InvalidRange(time, activity.ended()));
            }

            activities.put(key, activity.withStarted(time));
            return null;
        }

        @Override
        public Void visitEndActivity(EndActivity operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            activityContext(namespace, operation.id());

            NamespacedId<ActivityId> key = NamespacedId.of(namespace, operation.id());
            Activity activity = activities.get(key);
            Instant time = operation.time();

            if (activity.ended() != null && !activity.ended().equals(time)) {
                throw contradiction(operation.id(), namespace,
                    new ContradictionDetail.EndAlteration(activity.ended(), time));
            }
            if (activity.started() != null && activity.started().isAfter(time)) {
                throw contradiction(operation.id(), namespace,
                    new ContradictionDetail.InvalidRange(activity.started(), time));
            }

            activities.put(key, activity.withEnded(time));
            return null;
        }

        @Override
        public Void visitActivityUses(ActivityUses operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            activityContext(namespace, operation.activity());
            entityContext(namespace, operation.id());
            used(namespace, operation.activity(), operation.id());
            return null;
        }

        @Override
        public Void visitEntityExists(EntityExists operation) {
            namespaceContext(operation.namespace());
            entityContext(operation.namespace(), operation.id());
            return null;
        }

        @Override
        public Void visitWasGeneratedBy(WasGeneratedBy operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            entityContext(namespace, operation.id());
            activityContext(namespace, operation.activity());
            wasGeneratedBy(namespace, operation.id(), operation.activity());
            generated(namespace, operation.activity(), operation.id());
            return null;
        }

        @Override
        public Void visitEntityDerive(EntityDerive operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            entityContext(namespace, operation.id());
            entityContext(namespace, operation.usedId());
            operation.activity().ifPresent(activity -> activityContext(namespace, activity));
            wasDerivedFrom(namespace, operation.typ(), operation.usedId(), operation.id(), operation.activityId());
            return null;
        }

        @Override
        public Void visitSetAgentAttributes(SetAgentAttributes operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            agentContext(namespace, operation.id());

            NamespacedId<AgentId> key = NamespacedId.of(namespace, operation.id());
            Agent agent = agents.get(key);
            validateAttributeChanges(operation.id(), namespace, agent.attributes(), operation.attributes());
            agents.put(key, agent.withAttributes(operation.attributes()));
            return null;
        }

        @Override
        public Void visitSetActivityAttributes(SetActivityAttributes operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            activityContext(namespace, operation.id());

            NamespacedId<ActivityId> key = NamespacedId.of(namespace, operation.id());
            Activity activity = activities.get(key);
            validateAttributeChanges(operation.id(), namespace, activity.attributes(), operation.attributes());
            activities.put(key, activity.withAttributes(operation.attributes()));
            return null;
        }

        @Override
        public Void visitSetEntityAttributes(SetEntityAttributes operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            entityContext(namespace, operation.id());

            NamespacedId<EntityId> key = NamespacedId.of(namespace, operation.id());
            Entity entity = entities.get(key);
            validateAttributeChanges(operation.id(), namespace, entity.attributes(), operation.attributes());
            entities.put(key, entity.withAttributes(operation.attributes()));
            return null;
        }

        @Override
        public Void visitWasAssociatedWith(WasAssociatedWith operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            agentContext(namespace, operation.agentId());
            activityContext(namespace, operation.activityId());
            qualifiedAssociation(namespace, operation.activityId(), operation.agentId(), operation.role());
            return null;
        }

        @Override
        public Void visitWasAttributedTo(WasAttributedTo operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            agentContext(namespace, operation.agentId());
            entityContext(namespace, operation.entityId());
            qualifiedAttribution(namespace, operation.entityId(), operation.agentId(), operation.role());
            return null;
        }

        @Override
        public Void visitWasInformedBy(WasInformedBy operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            activityContext(namespace, operation.activity());
            activityContext(namespace, operation.informingActivity());
            wasInformedBy(namespace, operation.activity(), operation.informingActivity());
            return null;
        }

        @Override
        public Void visitRegisterKey(RegisterKey operation) {
            NamespaceId namespace = operation.namespace();
            namespaceContext(namespace);
            agentContext(namespace, operation.id());
            newIdentity(namespace, operation.id(), operation.publicKey());
            return null;
        }
    }

    /**
     * Additional attributes are allowed; changing the type or value of an existing one is not.
     * Every changed key is reported in a single contradiction.
     */
    private static void validateAttributeChanges(
            ChronicleIri id,
            NamespaceId namespace,
            SortedMap<String, Attribute> current,
            Attributes attempted) {
        List<ContradictionDetail> changes = new ArrayList<>();
        for (Map.Entry<String, Attribute> entry : attempted.items().entrySet()) {
            Attribute existing = current.get(entry.getKey());
            if (existing != null && !existing.equals(entry.getValue())) {
                changes.add(new ContradictionDetail.AttributeValueChange(
                    entry.getKey(), existing, entry.getValue()));
            }
        }
        if (!changes.isEmpty()) {
            throw new ContradictionException(new Contradiction(id, namespace, changes));
        }
    }

    private static ContradictionException contradiction(
            ChronicleIri id,
            NamespaceId namespace,
            ContradictionDetail detail) {
        return new ContradictionException(Contradiction.of(id, namespace, detail));
    }

    // ========== Merge / copy ==========

    /**
     * Merge another model into this one. Records and the current-identity link are
     * overwritten by key; relation sets and historical identities are unioned.
     */
    public void merge(ProvModel other) {
        namespaces.putAll(other.namespaces);
        agents.putAll(other.agents);
        entities.putAll(other.entities);
        activities.putAll(other.activities);
        identities.putAll(other.identities);
        hasIdentity.putAll(other.hasIdentity);

        union(actedOnBehalfOf, other.actedOnBehalfOf);
        union(delegation, other.delegation);
        union(hadIdentity, other.hadIdentity);
        union(derivation, other.derivation);
        union(generation, other.generation);
        union(attribution, other.attribution);
        union(wasInformedBy, other.wasInformedBy);
        union(generated, other.generated);
        union(association, other.association);
        union(usage, other.usage);
    }

    private static <K, V> void union(TreeMap<K, TreeSet<V>> target, TreeMap<K, TreeSet<V>> source) {
        source.forEach((key, values) -> target.computeIfAbsent(key, k -> new TreeSet<>()).addAll(values));
    }

    /**
     * Copy this model. Records are immutable, so only the maps and sets are duplicated.
     */
    public ProvModel copy() {
        ProvModel copy = new ProvModel();
        copy.merge(this);
        return copy;
    }

    // ========== Fragments ==========

    /**
     * The fragment holding only the namespace record, or an empty model if unknown.
     */
    public ProvModel namespaceFragment(NamespaceId namespace) {
        ProvModel fragment = new ProvModel();
        Optional.ofNullable(namespaces.get(namespace)).ifPresent(found -> fragment.namespaces.put(namespace, found));
        return fragment;
    }

    /**
     * The fragment for one agent: its record, the delegations it is responsible for,
     * the delegations it acts under, and its identity links.
     */
    public ProvModel agentFragment(NamespacedId<AgentId> key) {
        ProvModel fragment = new ProvModel();
        copyEntry(agents, fragment.agents, key);
        copySet(delegation, fragment.delegation, key);
        copySet(actedOnBehalfOf, fragment.actedOnBehalfOf, key);
        copyEntry(hasIdentity, fragment.hasIdentity, key);
        copySet(hadIdentity, fragment.hadIdentity, key);
        return fragment;
    }

    public ProvModel identityFragment(NamespacedId<IdentityId> key) {
        ProvModel fragment = new ProvModel();
        copyEntry(identities, fragment.identities, key);
        return fragment;
    }

    /**
     * The fragment for one activity: its record and its informed-by, usage, generated
     * and association sets.
     */
    public ProvModel activityFragment(NamespacedId<ActivityId> key) {
        ProvModel fragment = new ProvModel();
        copyEntry(activities, fragment.activities, key);
        copySet(wasInformedBy, fragment.wasInformedBy, key);
        copySet(usage, fragment.usage, key);
        copySet(generated, fragment.generated, key);
        copySet(association, fragment.association, key);
        return fragment;
    }

    /**
     * The fragment for one entity: its record and its derivation, generation and
     * attribution sets.
     */
    public ProvModel entityFragment(NamespacedId<EntityId> key) {
        ProvModel fragment = new ProvModel();
        copyEntry(entities, fragment.entities, key);
        copySet(derivation, fragment.derivation, key);
        copySet(generation, fragment.generation, key);
        copySet(attribution, fragment.attribution, key);
        return fragment;
    }

    private static <K, V> void copyEntry(Map<K, V> source, Map<K, V> target, K key) {
        V value = source.get(key);
        if (value != null) {
            target.put(key, value);
        }
    }

    private static <K, V> void copySet(Map<K, TreeSet<V>> source, Map<K, TreeSet<V>> target, K key) {
        TreeSet<V> values = source.get(key);
        if (values != null) {
            target.put(key, new TreeSet<>(values));
        }
    }

    /**
     * Every agent key that has a record or agent-indexed relations.
     */
    public SortedSet<NamespacedId<AgentId>> agentKeys() {
        TreeSet<NamespacedId<AgentId>> keys = new TreeSet<>(agents.keySet());
        keys.addAll(delegation.keySet());
        keys.addAll(actedOnBehalfOf.keySet());
        keys.addAll(hasIdentity.keySet());
        keys.addAll(hadIdentity.keySet());
        return keys;
    }

    public SortedSet<NamespacedId<IdentityId>> identityKeys() {
        return new TreeSet<>(identities.keySet());
    }

    public SortedSet<NamespacedId<ActivityId>> activityKeys() {
        TreeSet<NamespacedId<ActivityId>> keys = new TreeSet<>(activities.keySet());
        keys.addAll(wasInformedBy.keySet());
        keys.addAll(usage.keySet());
        keys.addAll(generated.keySet());
        keys.addAll(association.keySet());
        return keys;
    }

    public SortedSet<NamespacedId<EntityId>> entityKeys() {
        TreeSet<NamespacedId<EntityId>> keys = new TreeSet<>(entities.keySet());
        keys.addAll(derivation.keySet());
        keys.addAll(generation.keySet());
        keys.addAll(attribution.keySet());
        return keys;
    }

    public boolean isEmpty() {
        return namespaces.isEmpty() && agents.isEmpty() && entities.isEmpty() && activities.isEmpty()
            && identities.isEmpty() && hasIdentity.isEmpty() && hadIdentity.isEmpty()
            && actedOnBehalfOf.isEmpty() && delegation.isEmpty() && derivation.isEmpty()
            && generation.isEmpty() && attribution.isEmpty() && wasInformedBy.isEmpty()
            && generated.isEmpty() && association.isEmpty() && usage.isEmpty();
    }

    // ========== Lookups ==========

    public Optional<Namespace> namespace(NamespaceId id) {
        return Optional.ofNullable(namespaces.get(id));
    }

    public Optional<Agent> agent(NamespaceId namespace, AgentId id) {
        return Optional.ofNullable(agents.get(NamespacedId.of(namespace, id)));
    }

    public Optional<Activity> activity(NamespaceId namespace, ActivityId id) {
        return Optional.ofNullable(activities.get(NamespacedId.of(namespace, id)));
    }

    public Optional<Entity> entity(NamespaceId namespace, EntityId id) {
        return Optional.ofNullable(entities.get(NamespacedId.of(namespace, id)));
    }

    public Optional<Identity> identity(NamespaceId namespace, IdentityId id) {
        return Optional.ofNullable(identities.get(NamespacedId.of(namespace, id)));
    }

    public Optional<IdentityId> hasIdentity(NamespaceId namespace, AgentId agent) {
        return Optional.ofNullable(hasIdentity.get(NamespacedId.of(namespace, agent)));
    }

    public SortedSet<IdentityId> hadIdentity(NamespaceId namespace, AgentId agent) {
        return readOnly(hadIdentity.get(NamespacedId.of(namespace, agent)));
    }

    public SortedSet<Delegation> delegation(NamespaceId namespace, AgentId responsible) {
        return readOnly(delegation.get(NamespacedId.of(namespace, responsible)));
    }

    public SortedSet<Delegation> actedOnBehalfOf(NamespaceId namespace, AgentId delegate) {
        return readOnly(actedOnBehalfOf.get(NamespacedId.of(namespace, delegate)));
    }

    public SortedSet<Derivation> derivation(NamespaceId namespace, EntityId entity) {
        return readOnly(derivation.get(NamespacedId.of(namespace, entity)));
    }

    public SortedSet<Generation> generation(NamespaceId namespace, EntityId entity) {
        return readOnly(generation.get(NamespacedId.of(namespace, entity)));
    }

    public SortedSet<Attribution> attribution(NamespaceId namespace, EntityId entity) {
        return readOnly(attribution.get(NamespacedId.of(namespace, entity)));
    }

    public SortedSet<NamespacedId<ActivityId>> wasInformedBy(NamespaceId namespace, ActivityId activity) {
        return readOnly(wasInformedBy.get(NamespacedId.of(namespace, activity)));
    }

    public SortedSet<GeneratedEntity> generated(NamespaceId namespace, ActivityId activity) {
        return readOnly(generated.get(NamespacedId.of(namespace, activity)));
    }

    public SortedSet<Association> association(NamespaceId namespace, ActivityId activity) {
        return readOnly(association.get(NamespacedId.of(namespace, activity)));
    }

    public SortedSet<Usage> usage(NamespaceId namespace, ActivityId activity) {
        return readOnly(usage.get(NamespacedId.of(namespace, activity)));
    }

    private static <V> SortedSet<V> readOnly(TreeSet<V> values) {
        return values == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(values);
    }

    public SortedMap<NamespaceId, Namespace> namespaces() {
        return Collections.unmodifiableSortedMap(namespaces);
    }

    public SortedMap<NamespacedId<AgentId>, Agent> agents() {
        return Collections.unmodifiableSortedMap(agents);
    }

    public SortedMap<NamespacedId<IdentityId>, Identity> identities() {
        return Collections.unmodifiableSortedMap(identities);
    }

    public SortedMap<NamespacedId<ActivityId>, Activity> activities() {
        return Collections.unmodifiableSortedMap(activities);
    }

    public SortedMap<NamespacedId<EntityId>, Entity> entities() {
        return Collections.unmodifiableSortedMap(entities);
    }

    /**
     * Restrict a copy of this model to the resources of one namespace.
     */
    public ProvModel inNamespace(NamespaceId namespace) {
        ProvModel scoped = namespaceFragment(namespace);
        agentKeys().stream().filter(key -> key.namespace().equals(namespace))
            .forEach(key -> scoped.merge(agentFragment(key)));
        identityKeys().stream().filter(key -> key.namespace().equals(namespace))
            .forEach(key -> scoped.merge(identityFragment(key)));
        activityKeys().stream().filter(key -> key.namespace().equals(namespace))
            .forEach(key -> scoped.merge(activityFragment(key)));
        entityKeys().stream().filter(key -> key.namespace().equals(namespace))
            .forEach(key -> scoped.merge(entityFragment(key)));
        return scoped;
    }

    // ========== Object ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProvModel)) {
            return false;
        }
        ProvModel other = (ProvModel) o;
        return namespaces.equals(other.namespaces)
            && agents.equals(other.agents)
            && actedOnBehalfOf.equals(other.actedOnBehalfOf)
            && delegation.equals(other.delegation)
            && hasIdentity.equals(other.hasIdentity)
            && hadIdentity.equals(other.hadIdentity)
            && identities.equals(other.identities)
            && entities.equals(other.entities)
            && derivation.equals(other.derivation)
            && generation.equals(other.generation)
            && attribution.equals(other.attribution)
            && activities.equals(other.activities)
            && wasInformedBy.equals(other.wasInformedBy)
            && generated.equals(other.generated)
            && association.equals(other.association)
            && usage.equals(other.usage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespaces, agents, actedOnBehalfOf, delegation, hasIdentity, hadIdentity,
            identities, entities, derivation, generation, attribution, activities, wasInformedBy,
            generated, association, usage);
    }

    @Override
    public String toString() {
        return "ProvModel{namespaces=" + namespaces.keySet()
            + ", agents=" + agents.values()
            + ", activities=" + activities.values()
            + ", entities=" + entities.values()
            + ", identities=" + identities.values()
            + "}";
    }
}
