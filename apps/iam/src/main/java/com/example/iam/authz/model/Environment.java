package com.example.iam.authz.model;

import java.time.Instant;
import java.util.Map;

/**
 * Request environment supplied by the transport layer, already resolved.
 * Exposed to rules as {@code environment.time}, {@code environment.ip} and
 * {@code environment.<name>} for everything in {@code attributes}.
 */
public record Environment(
        Instant time,
        String sourceIp,
        Map<String, Object> attributes
) {
    public Environment {
        attributes = Attributes.copyOf(attributes);
    }

    public static Environment at(Instant time) {
        return new Environment(time, null, Map.of());
    }

    public static Environment from(String sourceIp, Instant time) {
        return new Environment(time, sourceIp, Map.of());
    }
}
