package com.example.iam.config.properties;

import com.example.iam.policy.model.Effect;
import com.example.iam.policy.model.Operator;
import com.example.iam.policy.model.Policy;
import com.example.iam.policy.model.PolicyDefinition;
import com.example.iam.policy.model.Rule;
import com.example.iam.policy.model.RuleGroup;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.PermissionScope;
import com.example.iam.rbac.model.Role;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Initial roles, permissions, policies and subjects for the in-memory stores.
 * Loaded from {@code app.iam.bootstrap} in application.yml.
 */
@ConfigurationProperties(prefix = "app.iam.bootstrap")
public record BootstrapProperties(
        List<PermissionSeed> permissions,
        List<RoleSeed> roles,
        List<PolicySeed> policies,
        List<SubjectSeed> subjects
) {
    public BootstrapProperties {
        if (permissions == null) permissions = List.of();
        if (roles == null) roles = List.of();
        if (policies == null) policies = List.of();
        if (subjects == null) subjects = List.of();
    }

    public record PermissionSeed(String id, String resourceType, String action, String scope) {

        public Permission toPermission() {
            PermissionScope parsed = scope == null || scope.isBlank()
                    ? PermissionScope.ALL
                    : PermissionScope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
            return new Permission(id, resourceType, action, parsed, 1);
        }
    }

    public record RoleSeed(String id, String name, List<String> permissions, List<String> parents) {

        public Role toRole() {
            return new Role(id, name,
                    permissions == null ? null : new HashSet<>(permissions),
                    parents == null ? null : new HashSet<>(parents));
        }
    }

    public record RuleSeed(String attribute, String operator, List<String> values) {

        public Rule toRule() {
            List<Object> converted = values == null ? List.of() : new ArrayList<>(values);
            return new Rule(attribute, Operator.parse(operator), converted);
        }
    }

    public record PolicySeed(
            String id,
            String name,
            String description,
            String resourceType,
            String effect,
            List<String> actions,
            List<String> resources,
            List<RuleSeed> rules,
            List<List<RuleSeed>> anyOf,
            int priority,
            Boolean active
    ) {
        /**
         * Seeded policies start at version 1.
         */
        public Policy toPolicy(Instant now) {
            PolicyDefinition definition = new PolicyDefinition(
                    id,
                    name != null ? name : id,
                    description,
                    resourceType,
                    effect == null ? null : Effect.valueOf(effect.trim().toUpperCase(Locale.ROOT)),
                    actions == null ? null : new HashSet<>(actions),
                    resources == null ? null : new HashSet<>(resources),
                    rules == null ? null : rules.stream().map(RuleSeed::toRule).toList(),
                    anyOf == null ? null : anyOf.stream()
                            .map(group -> new RuleGroup(group.stream().map(RuleSeed::toRule).toList()))
                            .toList(),
                    priority,
                    active == null || active);
            return new Policy(definition, 1, now, now);
        }
    }

    /**
     * @param passwordHash BCrypt hash; subjects without one cannot authenticate
     */
    public record SubjectSeed(
            String id,
            List<String> roles,
            List<String> permissions,
            Map<String, String> attributes,
            String passwordHash
    ) {}
}
