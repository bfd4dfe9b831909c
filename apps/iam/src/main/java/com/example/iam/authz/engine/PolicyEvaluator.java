package com.example.iam.authz.engine;

import com.example.iam.audit.AuditPublisher;
import com.example.iam.authz.model.Decision;
import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.model.Subject;
import com.example.iam.common.exception.InternalConsistencyException;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.config.properties.AuthzProperties;
import com.example.iam.observability.metrics.IamMetrics;
import com.example.iam.policy.store.PolicyStore;
import com.example.iam.policy.store.PolicyStoreSnapshot;
import com.example.iam.rbac.graph.RoleGraph;
import com.example.iam.rbac.graph.RoleGraphSnapshot;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Combines RBAC and ABAC into a single decision.
 *
 * <p>Each evaluation:
 * <ol>
 *   <li>takes one snapshot of the role graph and one of the policy store</li>
 *   <li>denies unknown actions and resource types outright</li>
 *   <li>runs every {@link DecisionSource} and combines their verdicts with deny-overrides</li>
 *   <li>publishes exactly one audit event</li>
 * </ol>
 * Any failure, including a decision without reasons, produces DENY with the error flag set.
 */
@Slf4j
@Component
public class PolicyEvaluator {

    private final RoleGraph roleGraph;
    private final PolicyStore policyStore;
    private final List<DecisionSource> sources;
    private final DenyOverridesCombiner combiner;
    private final AuditPublisher auditPublisher;
    private final IamMetrics metrics;
    private final Clock clock;
    private final Set<String> registeredActions;
    private final Set<String> registeredResourceTypes;
    private final Duration slowThreshold;

    public PolicyEvaluator(RoleGraph roleGraph,
                           PolicyStore policyStore,
                           List<DecisionSource> sources,
                           DenyOverridesCombiner combiner,
                           AuditPublisher auditPublisher,
                           IamMetrics metrics,
                           Clock clock,
                           AuthzProperties properties) {
        this.roleGraph = roleGraph;
        this.policyStore = policyStore;
        this.sources = List.copyOf(sources);
        this.combiner = combiner;
        this.auditPublisher = auditPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.registeredActions = Set.copyOf(properties.registeredActions());
        this.registeredResourceTypes = Set.copyOf(properties.registeredResourceTypes());
        this.slowThreshold = properties.slowEvaluationThreshold();

        log.info("Policy evaluator initialized with sources {}",
                this.sources.stream().map(DecisionSource::name).toList());
    }

    @NonNull
    public Decision evaluate(Subject subject, String action, Resource resource, Environment environment) {
        Timer.Sample sample = metrics.startEvaluation();
        long started = System.nanoTime();
        String decisionId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        RoleGraphSnapshot graph = roleGraph.snapshot();
        PolicyStoreSnapshot policies = policyStore.snapshot();

        Decision decision;
        try {
            EvaluationContext context = new EvaluationContext(subject, action, resource,
                    environment != null ? environment : Environment.at(now), graph, policies);
            decision = decide(decisionId, context, now);
        } catch (InternalConsistencyException e) {
            log.error("Decision {} had no traceable reason, denying: {}", decisionId, e.getMessage());
            decision = failClosed(decisionId, subject, action, resource, graph, policies, now, e);
        } catch (RuntimeException e) {
            log.error("Evaluation {} failed, denying: {}", decisionId, StringSanitizer.forLog(e.getMessage()), e);
            decision = failClosed(decisionId, subject, action, resource, graph, policies, now, e);
        }

        auditPublisher.publish(decision);
        metrics.recordDecision(sample, decision.isAllowed(), decision.error(), knownActionOrNull(decision, action));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (elapsed.compareTo(slowThreshold) > 0) {
            log.warn("Slow evaluation {}: {} ms (action={}, resourceType={})", decisionId, elapsed.toMillis(),
                    StringSanitizer.forLog(action), resource != null ? StringSanitizer.forLog(resource.type()) : "null");
        }
        return decision;
    }

    // Unregistered action names are caller input and stay out of meter tags
    private static String knownActionOrNull(Decision decision, String action) {
        boolean unknown = decision.reasons().stream()
                .anyMatch(reason -> reason.kind() == ReasonEntry.Kind.UNKNOWN_ACTION);
        return unknown ? null : action;
    }

    private Decision decide(String decisionId, EvaluationContext context, Instant now) {
        String action = context.action();
        String resourceType = context.resource().type();
        RoleGraphSnapshot graph = context.roleGraph();
        PolicyStoreSnapshot policies = context.policies();

        if (!isKnownAction(action, graph, policies)) {
            log.debug("Unknown action {} denied", StringSanitizer.forLog(action));
            return decision(decisionId, context, Outcome.DENY, List.of(ReasonEntry.of(
                    ReasonEntry.Kind.UNKNOWN_ACTION, "action " + action + " is not known")), false, now);
        }
        if (!isKnownResourceType(resourceType, graph, policies)) {
            log.debug("Unknown resource type {} denied", StringSanitizer.forLog(resourceType));
            return decision(decisionId, context, Outcome.DENY, List.of(ReasonEntry.of(
                    ReasonEntry.Kind.UNKNOWN_RESOURCE_TYPE, "resource type " + resourceType + " is not known")),
                    false, now);
        }

        List<Verdict> verdicts = new ArrayList<>();
        for (DecisionSource source : sources) {
            verdicts.addAll(source.evaluate(context));
        }
        DenyOverridesCombiner.Combined combined = combiner.combine(verdicts);

        if (combined.reasons().isEmpty()) {
            throw new InternalConsistencyException("No decision source produced a reason for "
                    + action + " on " + resourceType);
        }

        log.debug("Decision {}: {} {} on {}/{} for subject {} ({})", decisionId, combined.outcome(),
                StringSanitizer.forLog(action), StringSanitizer.forLog(resourceType),
                StringSanitizer.forLog(context.resource().id()), StringSanitizer.forLog(context.subject().id()),
                combined.reasons());
        return decision(decisionId, context, combined.outcome(), combined.reasons(), false, now);
    }

    private boolean isKnownAction(String action, RoleGraphSnapshot graph, PolicyStoreSnapshot policies) {
        return action != null && (graph.isKnownAction(action) || policies.isKnownAction(action)
                || registeredActions.contains(action));
    }

    private boolean isKnownResourceType(String type, RoleGraphSnapshot graph, PolicyStoreSnapshot policies) {
        return graph.isKnownResourceType(type) || policies.isKnownResourceType(type)
                || registeredResourceTypes.contains(type);
    }

    private Decision decision(String id, EvaluationContext context, Outcome outcome,
                              List<ReasonEntry> reasons, boolean error, Instant now) {
        return new Decision(id, context.action(), context.resource().type(), context.resource().id(),
                context.subject().id(), outcome, reasons, error,
                context.roleGraph().version(), context.policies().version(), now);
    }

    private Decision failClosed(String id, Subject subject, String action, Resource resource,
                                RoleGraphSnapshot graph, PolicyStoreSnapshot policies, Instant now, Exception cause) {
        return new Decision(id, action,
                resource != null ? resource.type() : null,
                resource != null ? resource.id() : null,
                subject != null ? subject.id() : null,
                Outcome.DENY,
                List.of(ReasonEntry.of(ReasonEntry.Kind.EVALUATION_ERROR, cause.getClass().getSimpleName())),
                true, graph.version(), policies.version(), now);
    }
}
