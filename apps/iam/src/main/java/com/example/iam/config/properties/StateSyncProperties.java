package com.example.iam.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Reload of roles, permissions and policies from the backing store.
 */
@ConfigurationProperties(prefix = "app.iam.sync")
public record StateSyncProperties(
        boolean enabled,
        Duration interval
) {
    public StateSyncProperties {
        if (interval == null) {
            interval = Duration.ofSeconds(60);
        }
    }
}
