package com.example.iam.policy.model;

import java.util.List;

/**
 * Explicit OR-group: satisfied when at least one rule holds.
 */
public record RuleGroup(List<Rule> anyOf) {

    public RuleGroup {
        anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
    }

    public static RuleGroup anyOf(Rule... rules) {
        return new RuleGroup(List.of(rules));
    }
}
