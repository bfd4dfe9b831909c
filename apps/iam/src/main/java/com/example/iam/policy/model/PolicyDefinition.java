package com.example.iam.policy.model;

import java.util.List;
import java.util.Set;

/**
 * Caller-supplied content of a policy. The store assigns version and timestamps.
 *
 * @param actions   actions the policy applies to; empty or {@code *} means every action
 * @param resources resource id patterns; empty means every resource of the type,
 *                  a trailing {@code *} matches by prefix
 * @param rules     conditions that must all hold
 * @param anyOf     OR-groups that must each have at least one holding rule
 * @param priority  higher priorities are listed first
 */
public record PolicyDefinition(
        String id,
        String name,
        String description,
        String resourceType,
        Effect effect,
        Set<String> actions,
        Set<String> resources,
        List<Rule> rules,
        List<RuleGroup> anyOf,
        int priority,
        boolean active
) {
    public PolicyDefinition {
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        resources = resources == null ? Set.of() : Set.copyOf(resources);
        rules = rules == null ? List.of() : List.copyOf(rules);
        anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String resourceType;
        private Effect effect = Effect.ALLOW;
        private Set<String> actions = Set.of();
        private Set<String> resources = Set.of();
        private List<Rule> rules = List.of();
        private List<RuleGroup> anyOf = List.of();
        private int priority;
        private boolean active = true;

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder effect(Effect effect) {
            this.effect = effect;
            return this;
        }

        public Builder actions(String... actions) {
            this.actions = Set.of(actions);
            return this;
        }

        public Builder resources(String... resources) {
            this.resources = Set.of(resources);
            return this;
        }

        public Builder rules(Rule... rules) {
            this.rules = List.of(rules);
            return this;
        }

        public Builder anyOf(RuleGroup... groups) {
            this.anyOf = List.of(groups);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public PolicyDefinition build() {
            return new PolicyDefinition(id, name, description, resourceType, effect,
                    actions, resources, rules, anyOf, priority, active);
        }
    }
}
