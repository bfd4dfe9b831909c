package com.example.iam.authz.model;

import java.util.Map;
import java.util.Objects;

/**
 * Target of an access request.
 *
 * @param ownerId owner used by {@code OWN}-scoped permissions, may be null
 */
public record Resource(
        String type,
        String id,
        String ownerId,
        Map<String, Object> attributes
) {
    public Resource {
        Objects.requireNonNull(type, "type");
        attributes = Attributes.copyOf(attributes);
    }

    public static Resource of(String type, String id) {
        return new Resource(type, id, null, Map.of());
    }

    public static Resource owned(String type, String id, String ownerId) {
        return new Resource(type, id, ownerId, Map.of());
    }
}
