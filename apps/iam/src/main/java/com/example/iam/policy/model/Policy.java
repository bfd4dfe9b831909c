package com.example.iam.policy.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A stored ABAC policy: a definition plus the version and timestamps assigned by the store.
 */
public record Policy(
        PolicyDefinition definition,
        int version,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String ANY_ACTION = "*";

    public String id() {
        return definition.id();
    }

    public String name() {
        return definition.name();
    }

    public String resourceType() {
        return definition.resourceType();
    }

    public Effect effect() {
        return definition.effect();
    }

    public int priority() {
        return definition.priority();
    }

    public boolean active() {
        return definition.active();
    }

    public List<Rule> rules() {
        return definition.rules();
    }

    public List<RuleGroup> anyOf() {
        return definition.anyOf();
    }

    public Set<String> actions() {
        return definition.actions();
    }

    public boolean appliesToAction(String action) {
        Set<String> actions = definition.actions();
        return actions.isEmpty() || actions.contains(ANY_ACTION) || actions.contains(action);
    }

    public boolean appliesToResource(String resourceId) {
        Set<String> patterns = definition.resources();
        if (patterns.isEmpty()) {
            return true;
        }
        for (String pattern : patterns) {
            if (pattern.equals("*") || pattern.equals(resourceId)) {
                return true;
            }
            if (resourceId != null && pattern.endsWith("*")
                    && resourceId.startsWith(pattern.substring(0, pattern.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    public Policy withActive(boolean active, Instant now) {
        PolicyDefinition d = definition;
        PolicyDefinition toggled = new PolicyDefinition(d.id(), d.name(), d.description(), d.resourceType(),
                d.effect(), d.actions(), d.resources(), d.rules(), d.anyOf(), d.priority(), active);
        return new Policy(toggled, version + 1, createdAt, now);
    }
}
