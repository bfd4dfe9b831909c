package com.example.iam.authz.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class Attributes {

    private Attributes() {}

    /**
     * Unmodifiable copy without null values. A null attribute is treated as missing.
     */
    static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
