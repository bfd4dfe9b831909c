package com.example.iam.authz.engine;

import com.example.iam.authz.model.Environment;
import com.example.iam.authz.model.Resource;
import com.example.iam.authz.model.Subject;
import com.example.iam.policy.rule.AttributeContext;
import com.example.iam.policy.store.PolicyStoreSnapshot;
import com.example.iam.rbac.graph.RoleGraphSnapshot;

import java.util.Map;
import java.util.Optional;

/**
 * Everything one evaluation reads: the request and the two snapshots taken when it started.
 *
 * <p>Built-in attributes:
 * <ul>
 *   <li>{@code subject.id}, {@code subject.roles}, {@code subject.mfaEnabled},
 *       {@code subject.trustLevel}, {@code subject.sessionId}</li>
 *   <li>{@code resource.id}, {@code resource.type}, {@code resource.ownerId}</li>
 *   <li>{@code environment.time}, {@code environment.ip}</li>
 * </ul>
 * Any other name is looked up in the corresponding attribute map.
 */
public record EvaluationContext(
        Subject subject,
        String action,
        Resource resource,
        Environment environment,
        RoleGraphSnapshot roleGraph,
        PolicyStoreSnapshot policies
) implements AttributeContext {

    private static final String SUBJECT = "subject.";
    private static final String RESOURCE = "resource.";
    private static final String ENVIRONMENT = "environment.";

    @Override
    public Optional<Object> lookup(String path) {
        if (path == null) {
            return Optional.empty();
        }
        if ("action".equals(path)) {
            return Optional.ofNullable(action);
        }
        if (path.startsWith(SUBJECT)) {
            return subjectAttribute(path.substring(SUBJECT.length()));
        }
        if (path.startsWith(RESOURCE)) {
            return resourceAttribute(path.substring(RESOURCE.length()));
        }
        if (path.startsWith(ENVIRONMENT)) {
            return environmentAttribute(path.substring(ENVIRONMENT.length()));
        }
        return Optional.empty();
    }

    private Optional<Object> subjectAttribute(String name) {
        return switch (name) {
            case "id" -> Optional.of(subject.id());
            case "roles" -> Optional.of(subject.roleIds());
            case "mfaEnabled" -> Optional.of(subject.mfaEnabled());
            case "trustLevel" -> Optional.of(subject.trustLevel().name());
            case "sessionId" -> Optional.ofNullable(subject.sessionId());
            default -> fromMap(subject.attributes(), name);
        };
    }

    private Optional<Object> resourceAttribute(String name) {
        return switch (name) {
            case "id" -> Optional.ofNullable(resource.id());
            case "type" -> Optional.of(resource.type());
            case "ownerId" -> Optional.ofNullable(resource.ownerId());
            default -> fromMap(resource.attributes(), name);
        };
    }

    private Optional<Object> environmentAttribute(String name) {
        if (environment == null) {
            return Optional.empty();
        }
        return switch (name) {
            case "time" -> Optional.ofNullable(environment.time());
            case "ip" -> Optional.ofNullable(environment.sourceIp());
            default -> fromMap(environment.attributes(), name);
        };
    }

    private static Optional<Object> fromMap(Map<String, Object> attributes, String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
