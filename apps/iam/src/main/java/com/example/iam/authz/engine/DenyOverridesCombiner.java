package com.example.iam.authz.engine;

import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deny-overrides combination:
 * <ol>
 *   <li>the first matching DENY override wins</li>
 *   <li>otherwise the first matching ALLOW override wins, even over a denying baseline</li>
 *   <li>otherwise the baseline stands</li>
 * </ol>
 * Returns a result with an empty reason chain when no source produced a verdict.
 */
@Component
public class DenyOverridesCombiner {

    public Combined combine(List<Verdict> verdicts) {
        for (Verdict verdict : verdicts) {
            if (verdict.tier() == Verdict.Tier.OVERRIDE && verdict.outcome() == Outcome.DENY) {
                return new Combined(Outcome.DENY, verdict.reasons());
            }
        }
        for (Verdict verdict : verdicts) {
            if (verdict.tier() == Verdict.Tier.OVERRIDE && verdict.outcome() == Outcome.ALLOW) {
                return new Combined(Outcome.ALLOW, verdict.reasons());
            }
        }
        for (Verdict verdict : verdicts) {
            if (verdict.tier() == Verdict.Tier.BASELINE) {
                return new Combined(verdict.outcome(), verdict.reasons());
            }
        }
        return new Combined(Outcome.DENY, List.of());
    }

    public record Combined(Outcome outcome, List<ReasonEntry> reasons) {
    }
}
