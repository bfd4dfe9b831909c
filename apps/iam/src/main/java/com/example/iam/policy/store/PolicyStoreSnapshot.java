package com.example.iam.policy.store;

import com.example.iam.policy.model.Policy;
import com.example.iam.policy.model.PolicyVersion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time view of the policy store.
 */
public final class PolicyStoreSnapshot {

    /**
     * Evaluation order: highest priority first, then oldest, then id.
     */
    public static final Comparator<Policy> EVALUATION_ORDER = Comparator
            .comparingInt(Policy::priority).reversed()
            .thenComparing(Policy::createdAt)
            .thenComparing(Policy::id);

    private static final PolicyStoreSnapshot EMPTY = new PolicyStoreSnapshot(0L, Map.of(), Map.of());

    private final long version;
    private final Map<String, Policy> policies;
    private final Map<String, List<PolicyVersion>> history;
    private final Map<String, List<Policy>> activeByResourceType;
    private final Set<String> knownActions;
    private final Set<String> knownResourceTypes;

    PolicyStoreSnapshot(long version, Map<String, Policy> policies, Map<String, List<PolicyVersion>> history) {
        this.version = version;
        this.policies = Map.copyOf(policies);
        Map<String, List<PolicyVersion>> historyCopy = new HashMap<>();
        history.forEach((id, versions) -> historyCopy.put(id, List.copyOf(versions)));
        this.history = Collections.unmodifiableMap(historyCopy);

        Map<String, List<Policy>> byType = new HashMap<>();
        Set<String> actions = new HashSet<>();
        Set<String> types = new HashSet<>();
        for (Policy policy : this.policies.values()) {
            if (!policy.active()) {
                continue;
            }
            byType.computeIfAbsent(policy.resourceType(), t -> new ArrayList<>()).add(policy);
            types.add(policy.resourceType());
            policy.actions().stream()
                    .filter(a -> !Policy.ANY_ACTION.equals(a))
                    .forEach(actions::add);
        }
        byType.replaceAll((type, list) -> list.stream().sorted(EVALUATION_ORDER).toList());
        this.activeByResourceType = Map.copyOf(byType);
        this.knownActions = Set.copyOf(actions);
        this.knownResourceTypes = Set.copyOf(types);
    }

    public static PolicyStoreSnapshot empty() {
        return EMPTY;
    }

    public long version() {
        return version;
    }

    public Optional<Policy> policy(String policyId) {
        return Optional.ofNullable(policies.get(policyId));
    }

    public Collection<Policy> policies() {
        return policies.values();
    }

    /**
     * Active policies for a resource type, in evaluation order.
     */
    public List<Policy> activePolicies(String resourceType) {
        return activeByResourceType.getOrDefault(resourceType, List.of());
    }

    public List<PolicyVersion> history(String policyId) {
        return history.getOrDefault(policyId, List.of());
    }

    Map<String, Policy> policyMap() {
        return policies;
    }

    Map<String, List<PolicyVersion>> historyMap() {
        return history;
    }

    /**
     * Actions named explicitly by an active policy. Wildcards do not count.
     */
    public boolean isKnownAction(String action) {
        return knownActions.contains(action);
    }

    public boolean isKnownResourceType(String resourceType) {
        return knownResourceTypes.contains(resourceType);
    }
}
