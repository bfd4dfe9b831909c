package com.example.iam.authz.engine;

import com.example.iam.authz.model.Outcome;
import com.example.iam.authz.model.ReasonEntry;
import com.example.iam.authz.model.Subject;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.rbac.graph.RoleGraphSnapshot;
import com.example.iam.rbac.model.Permission;
import com.example.iam.rbac.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * RBAC baseline: allow when a permission reachable through the subject's roles, or
 * granted directly, covers the action on the resource.
 */
@Slf4j
@Component
@Order(100)
public class RbacDecisionSource implements DecisionSource {

    @Override
    public String name() {
        return "rbac";
    }

    @Override
    public List<Verdict> evaluate(EvaluationContext context) {
        Subject subject = context.subject();
        RoleGraphSnapshot graph = context.roleGraph();
        String resourceType = context.resource().type();
        String ownerId = context.resource().ownerId();

        List<ReasonEntry> grants = new ArrayList<>();
        Set<String> checked = new HashSet<>();

        for (Role role : graph.closure(subject.roleIds())) {
            for (String permissionId : role.permissionIds()) {
                if (checked.add(permissionId)) {
                    match(graph, permissionId, subject.id(), resourceType, context.action(), ownerId)
                            .ifPresent(p -> grants.add(ReasonEntry.permission(p.id(), p.version(),
                                    "granted by role " + role.id())));
                }
            }
        }
        for (String permissionId : subject.permissionIds()) {
            if (checked.add(permissionId)) {
                match(graph, permissionId, subject.id(), resourceType, context.action(), ownerId)
                        .ifPresent(p -> grants.add(ReasonEntry.permission(p.id(), p.version(), "granted directly")));
            }
        }

        if (grants.isEmpty()) {
            return List.of(Verdict.baseline(Outcome.DENY, List.of(ReasonEntry.of(
                    ReasonEntry.Kind.NO_MATCHING_PERMISSION,
                    "no permission grants " + context.action() + " on " + resourceType))));
        }
        return List.of(Verdict.baseline(Outcome.ALLOW, grants));
    }

    private Optional<Permission> match(RoleGraphSnapshot graph, String permissionId, String subjectId,
                                       String resourceType, String action, String ownerId) {
        Optional<Permission> permission = graph.permission(permissionId);
        if (permission.isEmpty()) {
            log.warn("Dangling permission reference skipped: {} (graph version {})",
                    StringSanitizer.forLog(permissionId), graph.version());
            return Optional.empty();
        }
        return permission.filter(p -> p.covers(resourceType, action, subjectId, ownerId));
    }
}
