package com.example.iam.authz.engine;

import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.policy.model.Effect;
import com.example.iam.policy.model.Policy;
import com.example.iam.policy.rule.RuleMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ABAC overrides: one verdict per active policy of the resource type whose rules hold,
 * in store order.
 */
@Slf4j
@Component
@Order(200)
@RequiredArgsConstructor
public class PolicyDecisionSource implements DecisionSource {

    private final RuleMatcher ruleMatcher;

    @Override
    public String name() {
        return "abac";
    }

    @Override
    public List<Verdict> evaluate(EvaluationContext context) {
        List<Verdict> verdicts = new ArrayList<>();
        String resourceId = context.resource().id();

        for (Policy policy : context.policies().activePolicies(context.resource().type())) {
            if (!policy.appliesToAction(context.action()) || !policy.appliesToResource(resourceId)) {
                continue;
            }
            if (!ruleMatcher.matches(policy, context)) {
                continue;
            }
            boolean deny = policy.effect() == Effect.DENY;
            log.debug("Policy {} v{} matched with effect {}", policy.id(), policy.version(), policy.effect());
            verdicts.add(Verdict.override(deny ? Outcome.DENY : Outcome.ALLOW,
                    ReasonEntry.policy(policy.id(), policy.version(), deny, policy.name())));
        }
        return verdicts;
    }
}
