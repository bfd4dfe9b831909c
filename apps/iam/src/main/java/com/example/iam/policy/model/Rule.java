package com.example.iam.policy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single attribute condition, e.g. {@code environment.ip IP_RANGE [10.0.0.0/8]}.
 *
 * <p>Attribute paths start with {@code subject.}, {@code resource.} or
 * {@code environment.}, or are exactly {@code action}.
 */
public record Rule(
        String attribute,
        Operator operator,
        List<Object> values
) {
    public Rule {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
        // List.copyOf rejects nulls, validation reports them instead
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Rule of(String attribute, Operator operator, Object... values) {
        return new Rule(attribute, operator, List.of(values));
    }

    public Object firstValue() {
        return values.isEmpty() ? null : values.get(0);
    }

    @Override
    public String toString() {
        return attribute + " " + operator + " " + values;
    }
}
