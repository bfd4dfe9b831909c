package com.example.iam.policy.store;

import com.example.iam.common.exception.IamException;
import com.example.iam.common.exception.NotFoundException;
import com.example.iam.common.exception.UnavailableException;
import com.example.iam.persistence.IamStateRepository;
import com.example.iam.policy.model.Policy;
import com.example.iam.policy.model.PolicyDefinition;
import com.example.iam.policy.model.PolicyVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versioned store of ABAC policies.
 *
 * <p>Same concurrency model as the role graph: lock-free snapshot reads, one writer at a
 * time, and a write only becomes visible after the backing store accepted it.
 */
@Slf4j
@Component
public class PolicyStore {

    private final AtomicReference<PolicyStoreSnapshot> current = new AtomicReference<>(PolicyStoreSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();
    private final IamStateRepository repository;
    private final PolicyValidator validator;
    private final Clock clock;

    public PolicyStore(IamStateRepository repository, PolicyValidator validator, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.clock = clock;
    }

    @NonNull
    public PolicyStoreSnapshot snapshot() {
        return current.get();
    }

    @NonNull
    public List<Policy> listActivePolicies(@NonNull String resourceType) {
        return snapshot().activePolicies(resourceType);
    }

    @NonNull
    public Policy getPolicy(@NonNull String policyId) {
        return snapshot().policy(policyId).orElseThrow(() -> new NotFoundException("policy", policyId));
    }

    /**
     * Every accepted version of a policy, oldest first.
     */
    @NonNull
    public List<PolicyVersion> history(@NonNull String policyId) {
        List<PolicyVersion> versions = snapshot().history(policyId);
        if (versions.isEmpty()) {
            throw new NotFoundException("policy", policyId);
        }
        return versions;
    }

    /**
     * Creates a policy or records a new version of it.
     *
     * @throws com.example.iam.common.exception.ValidationException if the definition is
     *         structurally invalid; nothing is written
     */
    @NonNull
    public Policy upsertPolicy(@NonNull PolicyDefinition definition) {
        validator.validate(definition);

        writeLock.lock();
        try {
            PolicyStoreSnapshot base = current.get();
            Instant now = clock.instant();
            Policy updated = base.policy(definition.id())
                    .map(existing -> new Policy(definition, existing.version() + 1, existing.createdAt(), now))
                    .orElseGet(() -> new Policy(definition, 1, now, now));

            publish(base, updated, now);
            log.info("Policy {} stored at version {} (effect={}, resourceType={}, active={})",
                    updated.id(), updated.version(), updated.effect(), updated.resourceType(), updated.active());
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @NonNull
    public Policy activate(@NonNull String policyId) {
        return setActive(policyId, true);
    }

    @NonNull
    public Policy deactivate(@NonNull String policyId) {
        return setActive(policyId, false);
    }

    /**
     * Replaces all policies with state loaded from the backing store. History of
     * policies already known is kept; loaded versions newer than the last recorded one
     * are appended.
     */
    public void replaceAll(@NonNull Collection<Policy> policies) {
        policies.forEach(policy -> validator.validate(policy.definition()));

        writeLock.lock();
        try {
            PolicyStoreSnapshot base = current.get();
            Instant now = clock.instant();
            Map<String, Policy> loaded = new HashMap<>();
            Map<String, List<PolicyVersion>> history = new HashMap<>();
            for (Policy policy : policies) {
                loaded.put(policy.id(), policy);
                List<PolicyVersion> versions = new ArrayList<>(base.history(policy.id()));
                int lastRecorded = versions.isEmpty() ? 0 : versions.get(versions.size() - 1).version();
                if (policy.version() > lastRecorded) {
                    versions.add(new PolicyVersion(policy.id(), policy.version(), policy, now));
                }
                history.put(policy.id(), versions);
            }
            PolicyStoreSnapshot replaced = new PolicyStoreSnapshot(base.version() + 1, loaded, history);
            current.set(replaced);
            log.info("Policy store replaced (policies={}, version={})", loaded.size(), replaced.version());
        } finally {
            writeLock.unlock();
        }
    }

    private Policy setActive(String policyId, boolean active) {
        writeLock.lock();
        try {
            PolicyStoreSnapshot base = current.get();
            Policy existing = base.policy(policyId).orElseThrow(() -> new NotFoundException("policy", policyId));
            if (existing.active() == active) {
                return existing;
            }
            Instant now = clock.instant();
            Policy toggled = existing.withActive(active, now);
            publish(base, toggled, now);
            log.info("Policy {} {} at version {}", policyId, active ? "activated" : "deactivated", toggled.version());
            return toggled;
        } finally {
            writeLock.unlock();
        }
    }

    private void publish(PolicyStoreSnapshot base, Policy policy, Instant now) {
        Map<String, Policy> policies = new HashMap<>(base.policyMap());
        policies.put(policy.id(), policy);
        Map<String, List<PolicyVersion>> history = new HashMap<>(base.historyMap());
        List<PolicyVersion> versions = new ArrayList<>(history.getOrDefault(policy.id(), List.of()));
        versions.add(new PolicyVersion(policy.id(), policy.version(), policy, now));
        history.put(policy.id(), versions);

        try {
            repository.persistPolicy(policy);
        } catch (IamException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to persist policy {}: {}", policy.id(), e.getMessage());
            throw new UnavailableException("Backing store rejected write of policy " + policy.id(), e);
        }
        current.set(new PolicyStoreSnapshot(base.version() + 1, policies, history));
    }
}
