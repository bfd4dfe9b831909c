package com.example.iam.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration of the policy evaluator.
 *
 * @param registeredActions       actions recognized even when no permission or policy names them yet
 * @param registeredResourceTypes resource types recognized the same way
 * @param slowEvaluationThreshold evaluations slower than this are logged at WARN
 */
@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        List<String> registeredActions,
        List<String> registeredResourceTypes,
        Duration slowEvaluationThreshold
) {
    public AuthzProperties {
        if (registeredActions == null) {
            registeredActions = List.of();
        }
        if (registeredResourceTypes == null) {
            registeredResourceTypes = List.of();
        }
        if (slowEvaluationThreshold == null) {
            slowEvaluationThreshold = Duration.ofMillis(50);
        }
    }
}
