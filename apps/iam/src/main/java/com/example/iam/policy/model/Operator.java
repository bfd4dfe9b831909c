package com.example.iam.policy.model;

import com.example.iam.common.exception.ValidationException;

import java.util.Locale;

/**
 * Rule operators with the number of comparison values each accepts.
 */
public enum Operator {
    EQUALS(1, 1),
    NOT_EQUALS(1, 1),
    CONTAINS(1, 1),
    STARTS_WITH(1, 1),
    ENDS_WITH(1, 1),
    GREATER_THAN(1, 1),
    LESS_THAN(1, 1),
    IN(1, Integer.MAX_VALUE),
    /**
     * Inclusive [min, max] over numbers or timestamps.
     */
    IN_RANGE(2, 2),
    /**
     * Time of day window: start, end and an optional zone id (default UTC).
     * A window whose start is after its end wraps past midnight.
     */
    TIME_WINDOW(2, 3),
    /**
     * One or more CIDR blocks.
     */
    IP_RANGE(1, Integer.MAX_VALUE),
    REGEX(1, 1),
    EXISTS(0, 0),
    NOT_EXISTS(0, 0);

    private final int minValues;
    private final int maxValues;

    Operator(int minValues, int maxValues) {
        this.minValues = minValues;
        this.maxValues = maxValues;
    }

    public int minValues() {
        return minValues;
    }

    public int maxValues() {
        return maxValues;
    }

    /**
     * Presence-sensitive operators evaluate missing attributes instead of failing them.
     */
    public boolean isPresenceSensitive() {
        return this == EXISTS || this == NOT_EXISTS;
    }

    /**
     * Parse an operator name as written in configuration: {@code equals},
     * {@code startsWith}, {@code in-range} and {@code IP_RANGE} all work.
     */
    public static Operator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Rule operator is required");
        }
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Operator.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown rule operator: " + raw, e);
        }
    }
}
