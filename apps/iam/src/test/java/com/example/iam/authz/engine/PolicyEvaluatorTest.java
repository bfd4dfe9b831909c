package com.example.iam.authz.engine;

import com.example.iam.audit.AuditEmitter;
import com.example.iam.audit.AuditPublisher;
import com.example.iam.authz.model.Decision;
import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.model.Subject;
import com.example.iam.config.properties.AuthzProperties;
import com.example.iam.observability.metrics.IamMetrics;
import com.example.iam.persistence.InMemoryIamStateRepository;
import com.example.iam.policy.model.Effect;
import com.example.iam.policy.model.Operator;
import com.example.iam.policy.model.PolicyDefinition;
import com.example.iam.policy.model.Rule;
import com.example.iam.policy.rule.RuleMatcher;
import com.example.iam.policy.store.PolicyStore;
import com.example.iam.policy.store.PolicyValidator;
import com.example.iam.rbac.graph.RoleGraph;
import com.example.iam.rbac.model.PermissionScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.example.iam.util.SubjectTestBuilder.aSubject;
import static com.example.iam.util.SubjectTestBuilder.aViewer;
import static com.example.iam.util.SubjectTestBuilder.anEditor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("PolicyEvaluator")
class PolicyEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:30:00Z");

    private RoleGraph roleGraph;
    private PolicyStore policyStore;
    private AuditEmitter auditEmitter;
    private SimpleMeterRegistry registry;
    private PolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        InMemoryIamStateRepository repository = new InMemoryIamStateRepository();
        roleGraph = new RoleGraph(repository);
        policyStore = new PolicyStore(repository, new PolicyValidator(), clock);
        auditEmitter = mock(AuditEmitter.class);
        registry = new SimpleMeterRegistry();
        IamMetrics metrics = new IamMetrics(registry);

        evaluator = evaluator(List.of(new RbacDecisionSource(), new PolicyDecisionSource(new RuleMatcher())),
                metrics, clock, new AuthzProperties(List.of("archive"), List.of("invoice"), null));

        roleGraph.definePermission("doc-read", "document", "read", PermissionScope.ALL);
        roleGraph.definePermission("doc-write", "document", "write", PermissionScope.ALL);
        roleGraph.definePermission("doc-delete-own", "document", "delete", PermissionScope.OWN);
        roleGraph.addRole("viewer", "Viewer");
        roleGraph.addRole("editor", "Editor");
        roleGraph.grantPermission("viewer", "doc-read");
        roleGraph.grantPermission("editor", "doc-write");
        roleGraph.grantPermission("editor", "doc-delete-own");
        roleGraph.addParent("editor", "viewer");
    }

    private PolicyEvaluator evaluator(List<DecisionSource> sources, IamMetrics metrics, Clock clock,
                                      AuthzProperties properties) {
        return new PolicyEvaluator(roleGraph, policyStore, sources, new DenyOverridesCombiner(),
                new AuditPublisher(auditEmitter, metrics), metrics, clock, properties);
    }

    private Decision evaluate(Subject subject, String action, Resource resource) {
        return evaluator.evaluate(subject, action, resource, Environment.at(NOW));
    }

    @Nested
    @DisplayName("RBAC baseline")
    class RbacBaseline {

        @Test
        @DisplayName("should allow through an inherited permission and record its version")
        void shouldAllowInheritedPermission() {
            Decision decision = evaluate(anEditor("alice"), "read", Resource.of("document", "d1"));

            assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
            assertThat(decision.error()).isFalse();
            assertThat(decision.reasons()).singleElement().satisfies(reason -> {
                assertThat(reason.kind()).isEqualTo(ReasonEntry.Kind.PERMISSION);
                assertThat(reason.sourceId()).isEqualTo("doc-read");
                assertThat(reason.version()).isEqualTo(1);
                assertThat(reason.detail()).contains("viewer");
            });
        }

        @Test
        @DisplayName("should deny a viewer writing with a non-empty reason")
        void shouldDenyWithoutPermission() {
            Decision decision = evaluate(aViewer("bob"), "write", Resource.of("document", "d1"));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.error()).isFalse();
            assertThat(decision.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.NO_MATCHING_PERMISSION);
        }

        @Test
        @DisplayName("should allow directly granted permissions")
        void shouldAllowDirectPermission() {
            Subject subject = aSubject().withId("carol").withDirectPermissions("doc-write").build();

            Decision decision = evaluate(subject, "write", Resource.of("document", "d1"));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.reasons().get(0).detail()).isEqualTo("granted directly");
        }

        @Test
        @DisplayName("should apply OWN scope against the resource owner")
        void shouldApplyOwnScope() {
            Subject alice = anEditor("alice");

            assertThat(evaluate(alice, "delete", Resource.owned("document", "d1", "alice")).isAllowed()).isTrue();
            assertThat(evaluate(alice, "delete", Resource.owned("document", "d2", "bob")).isDenied()).isTrue();
            assertThat(evaluate(alice, "delete", Resource.of("document", "d3")).isDenied()).isTrue();
        }

        @Test
        @DisplayName("should record the snapshot versions it read")
        void shouldRecordSnapshotVersions() {
            Decision decision = evaluate(aViewer("bob"), "read", Resource.of("document", "d1"));

            assertThat(decision.roleGraphVersion()).isEqualTo(roleGraph.snapshot().version());
            assertThat(decision.policyStoreVersion()).isEqualTo(policyStore.snapshot().version());
            assertThat(decision.timestamp()).isEqualTo(NOW);
        }
    }

    @Nested
    @DisplayName("ABAC overrides")
    class AbacOverrides {

        @Test
        @DisplayName("should deny from inside 10.0.0.0/8 and keep the RBAC allow outside it")
        void shouldDenyInsideBlockedRange() {
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-internal-range")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .actions("write")
                    .rules(Rule.of("environment.ip", Operator.IP_RANGE, "10.0.0.0/8"))
                    .build());

            Decision outside = evaluator.evaluate(anEditor("alice"), "write", Resource.of("document", "d1"),
                    Environment.from("192.168.1.20", NOW));
            Decision inside = evaluator.evaluate(anEditor("alice"), "write", Resource.of("document", "d1"),
                    Environment.from("10.4.5.6", NOW));

            assertThat(outside.isAllowed()).isTrue();
            assertThat(outside.reasons().get(0).sourceId()).isEqualTo("doc-write");
            assertThat(inside.isDenied()).isTrue();
            assertThat(inside.reasons()).singleElement().satisfies(reason -> {
                assertThat(reason.kind()).isEqualTo(ReasonEntry.Kind.POLICY_DENY);
                assertThat(reason.sourceId()).isEqualTo("deny-internal-range");
                assertThat(reason.version()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("should not match an IP rule when the request carries no address")
        void shouldNotMatchWithoutAddress() {
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-internal-range")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .rules(Rule.of("environment.ip", Operator.IP_RANGE, "10.0.0.0/8"))
                    .build());

            assertThat(evaluate(anEditor("alice"), "write", Resource.of("document", "d1")).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("should let a matching deny win over a matching allow")
        void shouldApplyDenyOverrides() {
            policyStore.upsertPolicy(PolicyDefinition.builder("allow-engineering")
                    .resourceType("document")
                    .effect(Effect.ALLOW)
                    .priority(100)
                    .rules(Rule.of("subject.department", Operator.EQUALS, "engineering"))
                    .build());
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-contractors")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .priority(1)
                    .rules(Rule.of("subject.employment", Operator.EQUALS, "contractor"))
                    .build());
            Subject contractor = aSubject().withId("dan")
                    .withAttribute("department", "engineering")
                    .withAttribute("employment", "contractor")
                    .build();

            Decision decision = evaluate(contractor, "read", Resource.of("document", "d1"));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.reasons().get(0).sourceId()).isEqualTo("deny-contractors");
        }

        @Test
        @DisplayName("should let a matching allow policy grant without an RBAC permission")
        void shouldAllowViaPolicy() {
            policyStore.upsertPolicy(PolicyDefinition.builder("allow-engineering-write")
                    .resourceType("document")
                    .effect(Effect.ALLOW)
                    .actions("write")
                    .rules(Rule.of("subject.department", Operator.EQUALS, "engineering"))
                    .build());
            Subject engineer = aSubject().withId("erin").withRoles("viewer")
                    .withAttribute("department", "engineering").build();

            Decision decision = evaluate(engineer, "write", Resource.of("document", "d1"));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.POLICY_ALLOW);
        }

        @Test
        @DisplayName("should fall back to the baseline when no policy matches")
        void shouldUseBaselineWhenNoPolicyMatches() {
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-night")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .rules(Rule.of("environment.time", Operator.TIME_WINDOW, "22:00", "06:00"))
                    .build());

            Decision decision = evaluate(aViewer("bob"), "read", Resource.of("document", "d1"));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.reasons().get(0).kind()).isEqualTo(ReasonEntry.Kind.PERMISSION);
        }

        @Test
        @DisplayName("should ignore deactivated policies")
        void shouldIgnoreInactivePolicies() {
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-all-reads")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .actions("read")
                    .build());
            policyStore.deactivate("deny-all-reads");

            assertThat(evaluate(aViewer("bob"), "read", Resource.of("document", "d1")).isAllowed()).isTrue();
        }

        @Test
        @DisplayName("should scope policies to matching resource ids")
        void shouldMatchResourcePatterns() {
            policyStore.upsertPolicy(PolicyDefinition.builder("deny-hr-docs")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .resources("hr-*")
                    .build());

            assertThat(evaluate(aViewer("bob"), "read", Resource.of("document", "hr-2024")).isDenied()).isTrue();
            assertThat(evaluate(aViewer("bob"), "read", Resource.of("document", "eng-2024")).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("snapshot isolation")
    class SnapshotIsolation {

        private PolicyDefinition denyReads() {
            return PolicyDefinition.builder("deny-reads")
                    .resourceType("document")
                    .effect(Effect.DENY)
                    .actions("read")
                    .build();
        }

        @Test
        @DisplayName("should not see a policy written while the evaluation is running")
        void shouldIgnoreWritesDuringEvaluation() {
            long versionBefore = policyStore.snapshot().version();
            DecisionSource writer = new DecisionSource() {
                @Override
                public String name() {
                    return "writer";
                }

                @Override
                public List<Verdict> evaluate(EvaluationContext context) {
                    policyStore.upsertPolicy(denyReads());
                    return List.of();
                }
            };
            PolicyEvaluator racing = evaluator(
                    List.of(writer, new RbacDecisionSource(), new PolicyDecisionSource(new RuleMatcher())),
                    new IamMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC), new AuthzProperties(null, null, null));

            Decision during = racing.evaluate(anEditor("alice"), "read", Resource.of("document", "d1"),
                    Environment.at(NOW));
            Decision after = evaluate(anEditor("alice"), "read", Resource.of("document", "d1"));

            assertThat(during.isAllowed()).isTrue();
            assertThat(during.policyStoreVersion()).isEqualTo(versionBefore);
            assertThat(after.isDenied()).isTrue();
            assertThat(after.policyStoreVersion()).isEqualTo(versionBefore + 1);
        }

        @Test
        @DisplayName("should decide from the snapshot version it records under concurrent toggles")
        void shouldStayConsistentUnderConcurrentWrites() throws Exception {
            policyStore.upsertPolicy(denyReads());
            long activeVersion = policyStore.snapshot().version();
            int readers = 4;
            int evaluationsPerReader = 200;
            ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
            CountDownLatch start = new CountDownLatch(1);
            AtomicBoolean running = new AtomicBoolean(true);
            try {
                Future<?> toggler = executor.submit(() -> {
                    start.await();
                    boolean active = true;
                    while (running.get()) {
                        if (active) {
                            policyStore.deactivate("deny-reads");
                        } else {
                            policyStore.activate("deny-reads");
                        }
                        active = !active;
                    }
                    return null;
                });
                List<Future<List<Decision>>> results = new ArrayList<>();
                for (int i = 0; i < readers; i++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        List<Decision> decisions = new ArrayList<>();
                        for (int n = 0; n < evaluationsPerReader; n++) {
                            decisions.add(evaluate(anEditor("alice"), "read", Resource.of("document", "d1")));
                        }
                        return decisions;
                    }));
                }
                start.countDown();

                List<Decision> decisions = new ArrayList<>();
                for (Future<List<Decision>> result : results) {
                    decisions.addAll(result.get(30, TimeUnit.SECONDS));
                }
                running.set(false);
                toggler.get(30, TimeUnit.SECONDS);

                assertThat(decisions).hasSize(readers * evaluationsPerReader);
                // Each toggle bumps the store version by one, so parity tells whether the deny was active
                assertThat(decisions).allSatisfy(decision -> {
                    boolean denyActive = (decision.policyStoreVersion() - activeVersion) % 2 == 0;
                    assertThat(decision.isDenied()).isEqualTo(denyActive);
                    assertThat(decision.error()).isFalse();
                });
            } finally {
                running.set(false);
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("unknown verbs")
    class UnknownVerbs {

        @Test
        @DisplayName("should deny an action nothing references")
        void shouldDenyUnknownAction() {
            Decision decision = evaluate(anEditor("alice"), "teleport", Resource.of("document", "d1"));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.error()).isFalse();
            assertThat(decision.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.UNKNOWN_ACTION);
        }

        @Test
        @DisplayName("should tag unknown actions as unknown in the per-action counter")
        void shouldNotTagMetricsWithUnknownAction() {
            evaluate(anEditor("alice"), "Teleport-XYZ-123", Resource.of("document", "d1"));
            evaluate(anEditor("alice"), "read", Resource.of("document", "d1"));

            assertThat(registry.find("iam.decision.by_action").tag("action", "teleport-xyz-123").counter())
                    .isNull();
            assertThat(registry.get("iam.decision.by_action").tags("action", "unknown", "result", "denied")
                    .counter().count()).isEqualTo(1.0);
            assertThat(registry.get("iam.decision.by_action").tags("action", "read", "result", "allowed")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should deny a resource type nothing references")
        void shouldDenyUnknownResourceType() {
            Decision decision = evaluate(anEditor("alice"), "read", Resource.of("spaceship", "s1"));

            assertThat(decision.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.UNKNOWN_RESOURCE_TYPE);
        }

        @Test
        @DisplayName("should treat configured actions and resource types as known")
        void shouldHonorRegisteredVerbs() {
            Decision archive = evaluate(anEditor("alice"), "archive", Resource.of("document", "d1"));
            Decision invoice = evaluate(anEditor("alice"), "read", Resource.of("invoice", "i1"));

            assertThat(archive.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.NO_MATCHING_PERMISSION);
            assertThat(invoice.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.NO_MATCHING_PERMISSION);
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureHandling {

        @Test
        @DisplayName("should deny with the error flag when a source throws")
        void shouldFailClosedOnException() {
            DecisionSource broken = new DecisionSource() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public List<Verdict> evaluate(EvaluationContext context) {
                    throw new IllegalStateException("boom");
                }
            };
            IamMetrics metrics = new IamMetrics(registry);
            PolicyEvaluator failing = evaluator(List.of(new RbacDecisionSource(), broken), metrics,
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuthzProperties(null, null, null));

            Decision decision = failing.evaluate(anEditor("alice"), "read", Resource.of("document", "d1"),
                    Environment.at(NOW));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.error()).isTrue();
            assertThat(decision.reasons()).extracting(ReasonEntry::kind)
                    .containsExactly(ReasonEntry.Kind.EVALUATION_ERROR);
            assertThat(registry.counter("iam.decision.error").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should deny with the error flag when no source gives a reason")
        void shouldFailClosedOnEmptyReasons() {
            IamMetrics metrics = new IamMetrics(registry);
            PolicyEvaluator empty = evaluator(List.of(), metrics, Clock.fixed(NOW, ZoneOffset.UTC),
                    new AuthzProperties(null, null, null));

            Decision decision = empty.evaluate(anEditor("alice"), "read", Resource.of("document", "d1"),
                    Environment.at(NOW));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.error()).isTrue();
            assertThat(decision.reasons()).isNotEmpty();
        }

        @Test
        @DisplayName("should deny with the error flag for a null resource")
        void shouldFailClosedOnNullResource() {
            Decision decision = evaluator.evaluate(anEditor("alice"), "read", null, Environment.at(NOW));

            assertThat(decision.isDenied()).isTrue();
            assertThat(decision.error()).isTrue();
        }
    }

    @Nested
    @DisplayName("audit")
    class Audit {

        @Test
        @DisplayName("should emit exactly one audit event per decision")
        void shouldEmitOneEvent() {
            Decision decision = evaluate(aViewer("bob"), "read", Resource.of("document", "d1"));

            ArgumentCaptor<Decision> captor = ArgumentCaptor.forClass(Decision.class);
            verify(auditEmitter, times(1)).emit(captor.capture());
            assertThat(captor.getValue()).isSameAs(decision);
        }

        @Test
        @DisplayName("should emit one event for unknown verbs and failures too")
        void shouldEmitForEveryOutcome() {
            evaluate(aViewer("bob"), "teleport", Resource.of("document", "d1"));
            evaluator.evaluate(aViewer("bob"), "read", null, Environment.at(NOW));

            verify(auditEmitter, times(2)).emit(any(Decision.class));
        }

        @Test
        @DisplayName("should return the same decision when the emitter fails")
        void shouldIgnoreEmitterFailure() {
            doThrow(new IllegalStateException("disk full")).when(auditEmitter).emit(any(Decision.class));

            Decision decision = evaluate(aViewer("bob"), "read", Resource.of("document", "d1"));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.error()).isFalse();
            assertThat(registry.counter("iam.audit.emit.failure").count()).isEqualTo(1.0);
        }
    }
}
