package com.example.iam.persistence;

import com.example.iam.common.exception.IamException;
import com.example.iam.common.exception.UnavailableException;
import com.example.iam.config.properties.StateSyncProperties;
import com.example.iam.observability.metrics.IamMetrics;
import com.example.iam.policy.store.PolicyStore;
import com.example.iam.rbac.graph.RoleGraph;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads roles, permissions and policies from the {@link IamStateRepository} into the role
 * graph and policy store. Runs once at startup and, when {@code app.iam.sync.enabled},
 * again on a fixed delay so changes written by other nodes are picked up.
 */
@Slf4j
@Component
public class StateSynchronizer {

    private final IamStateRepository repository;
    private final RoleGraph roleGraph;
    private final PolicyStore policyStore;
    private final IamMetrics metrics;
    private final StateSyncProperties properties;
    private final AtomicReference<IamState> lastLoaded = new AtomicReference<>();

    public StateSynchronizer(IamStateRepository repository, RoleGraph roleGraph, PolicyStore policyStore,
                             IamMetrics metrics, StateSyncProperties properties) {
        this.repository = repository;
        this.roleGraph = roleGraph;
        this.policyStore = policyStore;
        this.metrics = metrics;
        this.properties = properties;
    }

    @PostConstruct
    public void initialLoad() {
        synchronize();
    }

    @Scheduled(fixedDelayString = "${app.iam.sync.interval:PT60S}",
            initialDelayString = "${app.iam.sync.interval:PT60S}")
    public void scheduledSync() {
        if (!properties.enabled()) {
            return;
        }
        try {
            synchronize();
        } catch (IamException e) {
            // Current snapshots stay in place until the next attempt
            log.warn("Scheduled state sync failed: {}", e.getMessage());
        }
    }

    /**
     * Loads the full state and replaces both in-memory views. Skipped when the loaded
     * state equals the previous load.
     *
     * @return true when the views were replaced
     * @throws UnavailableException when the repository cannot be read
     */
    public boolean synchronize() {
        IamState state;
        try {
            state = repository.loadAll();
        } catch (IamException e) {
            metrics.recordStateSyncFailure();
            throw e;
        } catch (RuntimeException e) {
            metrics.recordStateSyncFailure();
            log.error("Failed to load IAM state: {}", e.getMessage());
            throw new UnavailableException("IAM state could not be loaded", e);
        }

        if (state.equals(lastLoaded.get())) {
            log.debug("IAM state unchanged, skipping replace");
            return false;
        }
        try {
            roleGraph.replaceAll(state.roles(), state.permissions());
            policyStore.replaceAll(state.policies());
        } catch (IamException e) {
            metrics.recordStateSyncFailure();
            log.error("Loaded IAM state rejected: {}", e.getMessage());
            throw e;
        }
        lastLoaded.set(state);
        log.info("IAM state synchronized (roles={}, permissions={}, policies={})",
                state.roles().size(), state.permissions().size(), state.policies().size());
        return true;
    }
}
