package com.example.iam.authz.engine;

import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;

import java.util.List;

/**
 * Opinion of one decision source about a request.
 *
 * @param tier    {@code BASELINE} verdicts stand only when no override matched
 * @param reasons why the source reached this outcome
 */
public record Verdict(
        Outcome outcome,
        Tier tier,
        List<ReasonEntry> reasons
) {
    public enum Tier {
        BASELINE,
        OVERRIDE
    }

    public Verdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static Verdict baseline(Outcome outcome, List<ReasonEntry> reasons) {
        return new Verdict(outcome, Tier.BASELINE, reasons);
    }

    public static Verdict override(Outcome outcome, ReasonEntry reason) {
        return new Verdict(outcome, Tier.OVERRIDE, List.of(reason));
    }
}
